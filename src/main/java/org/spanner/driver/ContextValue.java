/**
 * Copyright 2021 the original author or authors. A Cloud Spanner script driver.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0

 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.spanner.driver;

/**Types of the object browser items.
 *
 * @since 2021-03-06
 *
 */
public enum ContextValue {

    CONNECTION("connection"),
    CONNECTED_CONNECTION("connectedConnection"),
    SCHEMA("connection.schema"),
    RESOURCE_GROUP("connection.resource_group"),
    TABLE("connection.table"),
    VIEW("connection.view"),
    COLUMN("connection.column");

    private final String value;

    private ContextValue(String value) {
        this.value = value;
    }

    public String getValue() {
        return this.value;
    }

    public static ContextValue of(String value) throws IllegalArgumentException {
        for (ContextValue v : values()) {
            if (v.value.equals(value)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown context value: " + value);
    }

    @Override
    public String toString() {
        return this.value;
    }

}

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

/**The registry of the SQL client host that the driver plugin registers into.
 *
 * @since 2021-03-08
 *
 */
public interface DriverRegistry {

    /**A factory of the driver of a connection. */
    interface DriverFactory {
        SpannerDriver create(ConnectionOptions options);
    }

    void register(String alias, DriverFactory factory);

}

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

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**The driver plugin that registers the Cloud Spanner driver under its aliases.
 *
 * @since 2021-03-08
 *
 */
public class SpannerDriverPlugin {
    static final Logger log = LoggerFactory.getLogger(SpannerDriverPlugin.class);

    /** Aliases of the driver, all resolved to the Cloud Spanner driver */
    public static final List<DriverAlias> DRIVER_ALIASES = Collections.singletonList(
            new DriverAlias(SpannerDriver.NAME, SpannerDriver.NAME));

    public void register(DriverRegistry registry) {
        for (DriverAlias alias : DRIVER_ALIASES) {
            registry.register(alias.getValue(), new DriverRegistry.DriverFactory() {
                @Override
                public SpannerDriver create(ConnectionOptions options) {
                    return new SpannerDriver(options);
                }
            });
            log.debug("Register driver '{}'", alias.getValue());
        }
    }

    public static class DriverAlias {

        protected final String displayName;
        protected final String value;

        public DriverAlias(String displayName, String value) {
            this.displayName = displayName;
            this.value = value;
        }

        public String getDisplayName() {
            return this.displayName;
        }

        public String getValue() {
            return this.value;
        }

        @Override
        public String toString() {
            return this.displayName;
        }

    }

}

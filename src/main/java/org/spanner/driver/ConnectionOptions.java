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

import static java.lang.String.*;

import java.util.Properties;

import org.spanner.util.StringUtils;

/**<p>
 * Connection options of the Cloud Spanner driver. The JDBC url is derived from the
 * project, instance and database in the Cloud Spanner JDBC format: <br/>
 * jdbc:cloudspanner:[//host:port]/projects/P/instances/I/databases/D[;k1=v1;k2=v2...]
 * </p>
 * <p>
 * An explicit url overrides the derived one, e.g. to connect through another JDBC driver.
 * </p>
 *
 * @since 2021-03-04
 *
 */
public class ConnectionOptions {

    public static final String URL_PREFIX = "jdbc:cloudspanner:";
    public static final String DRIVER_CLASS_DEFAULT = "com.google.cloud.spanner.jdbc.JdbcDriver";
    public static final String EMULATOR_HOST_DEFAULT = "localhost";
    public static final int EMULATOR_PORT_DEFAULT = 9010;
    public static final int MAX_ACTIVE_DEFAULT = 4;
    /**
     * Max number of results allowed in a query. This prevents out-of-memory errors or queries
     * that run for an unreasonable long time if the user forgets to add a limit clause to the query.
     */
    public static final int MAX_QUERY_RESULTS_DEFAULT = Integer.getInteger("spanner.driver.maxQueryResults", 100000);

    // property names
    public static final String PROJECT = "project";
    public static final String INSTANCE = "instance";
    public static final String DATABASE = "database";
    public static final String CREDENTIALS_KEY_FILE = "credentialsKeyFile";
    public static final String CONNECT_TO_EMULATOR = "connectToEmulator";
    public static final String EMULATOR_HOST = "emulatorHost";
    public static final String EMULATOR_PORT = "emulatorPort";
    public static final String URL = "url";
    public static final String DRIVER_CLASS_NAME = "driverClassName";
    public static final String MAX_QUERY_RESULTS = "maxQueryResults";
    public static final String READ_ONLY_QUERIES = "readOnlyQueries";
    public static final String MAX_ACTIVE = "maxActive";
    public static final String TRACE = "trace";
    public static final String TRACE_ERROR = "traceError";

    protected String project;
    protected String instance;
    protected String database;
    protected String credentialsKeyFile;
    protected boolean connectToEmulator;
    protected String emulatorHost = EMULATOR_HOST_DEFAULT;
    protected int emulatorPort = EMULATOR_PORT_DEFAULT;
    protected String url;
    protected String driverClassName;
    protected int maxQueryResults = MAX_QUERY_RESULTS_DEFAULT;
    protected boolean readOnlyQueries = true;
    protected int maxActive = MAX_ACTIVE_DEFAULT;
    protected boolean trace;
    protected boolean traceError;

    public ConnectionOptions() {

    }

    public static ConnectionOptions from(Properties props) throws IllegalArgumentException {
        ConnectionOptions options = new ConnectionOptions();

        options.project = props.getProperty(PROJECT);
        options.instance = props.getProperty(INSTANCE);
        options.database = props.getProperty(DATABASE);
        options.credentialsKeyFile = props.getProperty(CREDENTIALS_KEY_FILE);
        options.connectToEmulator = parseBoolean(props, CONNECT_TO_EMULATOR, false);
        String host = props.getProperty(EMULATOR_HOST);
        if (!StringUtils.isBlank(host)) {
            options.emulatorHost = host.trim();
        }
        options.emulatorPort = parseInt(props, EMULATOR_PORT, EMULATOR_PORT_DEFAULT);
        options.url = props.getProperty(URL);
        options.driverClassName = props.getProperty(DRIVER_CLASS_NAME);
        options.setMaxQueryResults(parseInt(props, MAX_QUERY_RESULTS, MAX_QUERY_RESULTS_DEFAULT));
        options.readOnlyQueries = parseBoolean(props, READ_ONLY_QUERIES, true);
        options.setMaxActive(parseInt(props, MAX_ACTIVE, MAX_ACTIVE_DEFAULT));
        options.trace = parseBoolean(props, TRACE, false);
        options.traceError = parseBoolean(props, TRACE_ERROR, false);

        return options;
    }

    static boolean parseBoolean(Properties props, String name, boolean defaultValue) {
        String value = props.getProperty(name);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }

        value = StringUtils.toLowerEnglish(value.trim());
        switch (value) {
        case "true":
        case "yes":
        case "1":
            return true;
        case "false":
        case "no":
        case "0":
            return false;
        default:
            throw new IllegalArgumentException(name + " " + value);
        }
    }

    static int parseInt(Properties props, String name, int defaultValue) {
        String value = props.getProperty(name);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }

        try {
            return Integer.decode(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " " + value, e);
        }
    }

    /**Build the JDBC url of this connection.
     *
     * @return the explicit url if set, otherwise the Cloud Spanner JDBC url
     * @throws IllegalArgumentException if project, instance or database not set
     */
    public String getJdbcUrl() throws IllegalArgumentException {
        if (!StringUtils.isBlank(this.url)) {
            return this.url.trim();
        }

        checkRequired(PROJECT, this.project);
        checkRequired(INSTANCE, this.instance);
        checkRequired(DATABASE, this.database);

        StringBuilder sb = new StringBuilder(URL_PREFIX);
        if (this.connectToEmulator) {
            sb.append("//").append(this.emulatorHost).append(':').append(this.emulatorPort);
        }
        sb.append(format("/projects/%s/instances/%s/databases/%s", this.project, this.instance, this.database));
        if (this.connectToEmulator) {
            // The emulator instance and database are created if they don't exist
            sb.append(";usePlainText=true;autoConfigEmulator=true");
        } else if (!StringUtils.isBlank(this.credentialsKeyFile)) {
            sb.append(";credentials=").append(this.credentialsKeyFile);
        }

        return sb.toString();
    }

    static void checkRequired(String name, String value) throws IllegalArgumentException {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException("No " + name + " specified");
        }
    }

    /**
     * @return the driver class name, or null if the url is resolved by DriverManager
     */
    public String getDriverClassName() {
        if (this.driverClassName == null && StringUtils.isBlank(this.url)) {
            return DRIVER_CLASS_DEFAULT;
        }
        return this.driverClassName;
    }

    /**
     * @return the connection id "project/instance/database", or the url if set
     */
    public String getId() {
        if (!StringUtils.isBlank(this.url)) {
            return this.url.trim();
        }
        return format("%s/%s/%s", this.project, this.instance, this.database);
    }

    public String getProject() {
        return this.project;
    }

    public void setProject(String project) {
        this.project = project;
    }

    public String getInstance() {
        return this.instance;
    }

    public void setInstance(String instance) {
        this.instance = instance;
    }

    public String getDatabase() {
        return this.database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getCredentialsKeyFile() {
        return this.credentialsKeyFile;
    }

    public void setCredentialsKeyFile(String credentialsKeyFile) {
        this.credentialsKeyFile = credentialsKeyFile;
    }

    public boolean isConnectToEmulator() {
        return this.connectToEmulator;
    }

    public void setConnectToEmulator(boolean connectToEmulator) {
        this.connectToEmulator = connectToEmulator;
    }

    public String getEmulatorHost() {
        return this.emulatorHost;
    }

    public void setEmulatorHost(String emulatorHost) {
        this.emulatorHost = emulatorHost;
    }

    public int getEmulatorPort() {
        return this.emulatorPort;
    }

    public void setEmulatorPort(int emulatorPort) {
        this.emulatorPort = emulatorPort;
    }

    public String getUrl() {
        return this.url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public void setDriverClassName(String driverClassName) {
        this.driverClassName = driverClassName;
    }

    public int getMaxQueryResults() {
        return this.maxQueryResults;
    }

    public void setMaxQueryResults(int maxQueryResults) throws IllegalArgumentException {
        if (maxQueryResults < 0) {
            throw new IllegalArgumentException(MAX_QUERY_RESULTS + " " + maxQueryResults);
        }
        this.maxQueryResults = maxQueryResults;
    }

    public boolean isReadOnlyQueries() {
        return this.readOnlyQueries;
    }

    public void setReadOnlyQueries(boolean readOnlyQueries) {
        this.readOnlyQueries = readOnlyQueries;
    }

    public int getMaxActive() {
        return this.maxActive;
    }

    public void setMaxActive(int maxActive) throws IllegalArgumentException {
        if (maxActive < 1) {
            throw new IllegalArgumentException(MAX_ACTIVE + " " + maxActive);
        }
        this.maxActive = maxActive;
    }

    public boolean isTrace() {
        return this.trace;
    }

    public void setTrace(boolean trace) {
        this.trace = trace;
    }

    public boolean isTraceError() {
        return this.traceError;
    }

    public void setTraceError(boolean traceError) {
        this.traceError = traceError;
    }

    @Override
    public String toString() {
        return format("ConnectionOptions[id %s, emulator %s]", getId(), this.connectToEmulator);
    }

}

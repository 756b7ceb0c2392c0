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
package org.spanner;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spanner.driver.ConnectionOptions;
import org.spanner.driver.QueryResult;
import org.spanner.driver.SpannerDriver;
import org.spanner.util.IoUtils;

/**A command line SQL client that executes a script through the Cloud Spanner driver.
 *
 * @since 2021-03-08
 *
 */
public class ScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(ScriptRunner.class);

    protected final PrintStream out;
    protected final PrintStream err;
    protected final InputStream in;

    protected final ConnectionOptions options = new ConnectionOptions();
    protected String scriptFile;
    protected boolean help;

    public ScriptRunner(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String args[]) {
        ScriptRunner runner = new ScriptRunner(System.in, System.out, System.err);
        int status = runner.run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**Run the script.
     *
     * @param args the command line arguments
     * @return the exit status: 0 if successful, 1 if the arguments are illegal,
     * 2 if execution failed
     */
    public int run(String ... args) {
        try {
            init(args);
        } catch (IllegalArgumentException e) {
            this.err.println("[ERROR] " + e.getMessage());
            this.err.println(getHelp());
            return 1;
        }
        if (this.help) {
            this.out.println(getHelp());
            return 0;
        }

        SpannerDriver driver = new SpannerDriver(this.options);
        try {
            String script = readScript();
            List<QueryResult> results = driver.query(script, UUID.randomUUID().toString());
            for (QueryResult result : results) {
                print(result);
            }
            return 0;
        } catch (IOException | SQLException | IllegalArgumentException e) {
            if (this.options.isTraceError()) {
                log.warn(SpannerDriver.NAME + " fatal", e);
            }
            this.err.println("[ERROR] " + e.getMessage()
                + (e.getCause() != null? "(" + e.getCause().getMessage() + ")": ""));
            return 2;
        } finally {
            IoUtils.close(driver);
        }
    }

    protected void init(String ... args) throws IllegalArgumentException {
        for (int i = 0, argc = args.length; i < argc; i++) {
            String a = args[i];
            if ("--project".equals(a) || "-P".equals(a)) {
                this.options.setProject(value(args, ++i, a));
            } else if ("--instance".equals(a) || "-i".equals(a)) {
                this.options.setInstance(value(args, ++i, a));
            } else if ("--database".equals(a) || "-d".equals(a)) {
                this.options.setDatabase(value(args, ++i, a));
            } else if ("--credentials".equals(a) || "-c".equals(a)) {
                this.options.setCredentialsKeyFile(value(args, ++i, a));
            } else if ("--emulator".equals(a) || "-E".equals(a)) {
                this.options.setConnectToEmulator(true);
            } else if ("--emulator-host".equals(a)) {
                this.options.setEmulatorHost(value(args, ++i, a));
            } else if ("--emulator-port".equals(a)) {
                this.options.setEmulatorPort(decode(args, ++i, a));
            } else if ("--url".equals(a) || "-u".equals(a)) {
                this.options.setUrl(value(args, ++i, a));
            } else if ("--driver".equals(a)) {
                this.options.setDriverClassName(value(args, ++i, a));
            } else if ("--max-query-results".equals(a)) {
                this.options.setMaxQueryResults(decode(args, ++i, a));
            } else if ("--no-read-only".equals(a)) {
                this.options.setReadOnlyQueries(false);
            } else if ("--trace".equals(a) || "-T".equals(a)) {
                this.options.setTrace(true);
            } else if ("--trace-error".equals(a)) {
                this.options.setTraceError(true);
            } else if ("--help".equals(a) || "-h".equals(a) || "-?".equals(a)) {
                this.help = true;
            } else if (a.startsWith("-")) {
                throw new IllegalArgumentException("Unknown option: " + a);
            } else if (this.scriptFile == null) {
                this.scriptFile = a;
            } else {
                throw new IllegalArgumentException("More than one script file: " + a);
            }
        }
    }

    static String value(String[] args, int i, String option) throws IllegalArgumentException {
        if (i >= args.length) {
            throw new IllegalArgumentException("No value of option " + option);
        }
        return args[i];
    }

    static int decode(String[] args, int i, String option) throws IllegalArgumentException {
        String value = value(args, i, option);
        try {
            return Integer.decode(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " " + value, e);
        }
    }

    protected String readScript() throws IOException {
        if (this.scriptFile == null) {
            return IoUtils.readString(this.in, StandardCharsets.UTF_8);
        }
        return IoUtils.readString(Paths.get(this.scriptFile));
    }

    protected void print(QueryResult result) {
        List<String> cols = result.getCols();
        this.out.println(String.join("\t", cols));
        for (Map<String, Object> row : result.getResults()) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0, n = cols.size(); i < n; ++i) {
                if (i > 0) {
                    sb.append('\t');
                }
                Object value = row.get(cols.get(i));
                sb.append(value == null? "NULL": value);
            }
            this.out.println(sb);
        }
        this.out.println("-- " + result.getMessage());
    }

    public ConnectionOptions getOptions() {
        return this.options;
    }

    protected String getHelp() {
        return SpannerDriver.NAME + " " + SpannerDriver.VERSION + "\n" +
                "Usage: java " + getClass().getName() + " [OPTIONS] [script-file]\n" +
                "  --project|-P    <project>     \tGoogle Cloud project id\n" +
                "  --instance|-i   <instance>    \tCloud Spanner instance id\n" +
                "  --database|-d   <database>    \tCloud Spanner database id\n" +
                "  --credentials|-c<file>        \tCredentials key file\n" +
                "  --emulator|-E                 \tConnect to the emulator\n" +
                "  --emulator-host <host>        \tEmulator host, default " + ConnectionOptions.EMULATOR_HOST_DEFAULT + "\n" +
                "  --emulator-port <port>        \tEmulator port, default " + ConnectionOptions.EMULATOR_PORT_DEFAULT + "\n" +
                "  --url|-u        <jdbcUrl>     \tJDBC url instead of the Cloud Spanner url\n" +
                "  --driver        <className>   \tJDBC driver class of the url\n" +
                "  --max-query-results <n>       \tMax number of results of a query, default " + ConnectionOptions.MAX_QUERY_RESULTS_DEFAULT + "\n" +
                "  --no-read-only                \tDon't mark query connections read-only\n" +
                "  --trace|-T                    \tTrace script execution\n" +
                "  --trace-error                 \tTrace execution errors\n" +
                "  --help|-h|-?                  \tShow this message\n" +
                "The script is read from stdin if no script file is given.";
    }

}

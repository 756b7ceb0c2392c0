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
package org.spanner.sql;

import java.util.ArrayList;
import java.util.List;

/**<p>
 * SQL script splitter. The statements of a script are separated by ';' that is
 * not in a string literal or a comment.
 * </p>
 * <p>
 * Each statement is trimmed and doesn't include its delimiter, and empty statements
 * are skipped, e.g. "select 1;; select 2" is split into "select 1" and "select 2".
 * </p>
 *
 * @since 2021-03-02
 *
 */
public class SQLSplitter {

    public static final char DELIMITER = ';';

    // unscanned rest of the script, null at end
    protected String rest;

    public SQLSplitter(String script) {
        this.rest = script;
    }

    public static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        SQLSplitter splitter = new SQLSplitter(script);
        for (String sql = splitter.nextStatement(); sql != null; sql = splitter.nextStatement()) {
            statements.add(sql);
        }
        return statements;
    }

    /**Read the next statement.
     *
     * @return the next non-empty trimmed statement, or null if no more statements
     */
    public String nextStatement() {
        while (this.rest != null) {
            String buffer = this.rest;
            SQLScanner scanner = new SQLScanner(buffer);
            int i = scanner.indexOf(DELIMITER);

            String sql;
            if (i == -1) {
                sql = buffer;
                this.rest = null;
            } else {
                sql = buffer.substring(0, i);
                this.rest = buffer.substring(i + 1);
            }

            sql = sql.trim();
            if (!sql.isEmpty()) {
                return sql;
            }
        }

        return null;
    }

}

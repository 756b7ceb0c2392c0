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

/**SQL statement of a script and its kind.
 *
 * @since 2021-03-02
 *
 */
public class SQLStatement {

    protected final String sql;
    protected final String command;
    protected final StatementKind kind;

    public SQLStatement(String sql) {
        this(sql, SQLClassifier.leadingKeyword(sql));
    }

    protected SQLStatement(String sql, String command) {
        this.sql = sql;
        this.command = command;
        this.kind = StatementKind.of(command);
    }

    public String getSQL() {
        return this.sql;
    }

    /**
     * @return the leading keyword as written, empty if none
     */
    public String getCommand() {
        return this.command;
    }

    public StatementKind getKind() {
        return this.kind;
    }

    public boolean isQuery() {
        return (this.kind == StatementKind.QUERY);
    }

    public boolean isDataChange() {
        return (this.kind == StatementKind.DATA_CHANGE);
    }

    public boolean isSchemaChange() {
        return (this.kind == StatementKind.SCHEMA_CHANGE);
    }

    public boolean isSupported() {
        return (this.kind != StatementKind.UNSPECIFIED);
    }

    @Override
    public String toString() {
        return this.sql;
    }

}

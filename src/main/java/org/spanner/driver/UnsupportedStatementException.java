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

import java.sql.SQLException;

/** A script contains a statement that is neither a query, a DML statement nor a DDL
 * statement. No statement of the script is executed.
 *
 * @since 2021-03-04
 *
 */
public class UnsupportedStatementException extends SQLException {

    private static final long serialVersionUID = 4790618218353920152L;

    static final String SQL_STATE = "0A000";

    protected final String statement;

    public UnsupportedStatementException(String statement) {
        super("Unsupported statement: " + statement, SQL_STATE);
        this.statement = statement;
    }

    public String getStatement() {
        return this.statement;
    }

}

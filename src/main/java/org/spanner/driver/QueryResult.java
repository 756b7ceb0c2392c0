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

import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**Result of one statement of a script.
 *
 * @since 2021-03-04
 *
 */
public class QueryResult {

    public static final String ERROR_COLUMN = "Error";

    protected final String connId;
    protected final String query;
    protected final String requestId;
    protected final String resultId;
    protected final List<String> cols;
    protected final List<Map<String, Object>> results;
    protected final List<Message> messages;

    public QueryResult(String connId, String query, String requestId,
            List<String> cols, List<Map<String, Object>> results, String message) {
        this.connId = connId;
        this.query = query;
        this.requestId = requestId;
        this.resultId = UUID.randomUUID().toString();
        this.cols = Collections.unmodifiableList(cols);
        this.results = Collections.unmodifiableList(results);
        this.messages = Collections.singletonList(new Message(message));
    }

    /**Create a result that carries an error message instead of rows.
     */
    public static QueryResult error(String connId, String query, String requestId, String message) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(ERROR_COLUMN, message);
        return new QueryResult(connId, query, requestId, Collections.singletonList(ERROR_COLUMN),
                Collections.singletonList(row), message);
    }

    /**Create a single-row result of one column.
     */
    public static QueryResult single(String connId, String query, String requestId,
            String column, Object value, String message) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(column, value);
        return new QueryResult(connId, query, requestId, Collections.singletonList(column),
                Collections.singletonList(row), message);
    }

    public String getConnId() {
        return this.connId;
    }

    public String getQuery() {
        return this.query;
    }

    public String getRequestId() {
        return this.requestId;
    }

    public String getResultId() {
        return this.resultId;
    }

    public List<String> getCols() {
        return this.cols;
    }

    public List<Map<String, Object>> getResults() {
        return this.results;
    }

    public List<Message> getMessages() {
        return this.messages;
    }

    public String getMessage() {
        return this.messages.get(0).getMessage();
    }

    public boolean isError() {
        return (this.cols.size() == 1 && ERROR_COLUMN.equals(this.cols.get(0)));
    }

    @Override
    public String toString() {
        return format("QueryResult[query \"%s\", cols %s, rows %d, message \"%s\"]",
                this.query, this.cols, this.results.size(), getMessage());
    }

    public static class Message {

        protected final Date date;
        protected final String message;

        public Message(String message) {
            this.date = new Date();
            this.message = message;
        }

        public Date getDate() {
            return this.date;
        }

        public String getMessage() {
            return this.message;
        }

        @Override
        public String toString() {
            return this.message;
        }

    }

}

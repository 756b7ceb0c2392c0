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

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spanner.sql.SQLParser;
import org.spanner.sql.SQLStatement;
import org.spanner.util.StringUtils;

/**<p>
 * The Cloud Spanner driver that executes a script of queries, DML and DDL statements.
 * Multiple statements must be separated by semicolons.
 * </p>
 * <p>
 * A query is executed using a single-use read-only transaction, a DML statement is wrapped
 * in its own read/write transaction, and a DDL statement is submitted as a schema update.
 * A script that contains any other statement is rejected before execution.
 * </p>
 *
 * @since 2021-03-04
 *
 */
public class SpannerDriver implements AutoCloseable {
    static final Logger log = LoggerFactory.getLogger(SpannerDriver.class);

    public static final String NAME = "Google Cloud Spanner Driver";
    public static final String VERSION = "0.4.1";

    protected final ConnectionOptions options;
    protected final ConnectionExplorer explorer;
    private SpannerDatabase database;

    public SpannerDriver(ConnectionOptions options) {
        this.options = options;
        this.explorer = new ConnectionExplorer(this);
    }

    /**Open the database of this driver if not opened.
     *
     * @return the database
     * @throws IllegalArgumentException if the connection options are incomplete
     */
    public synchronized SpannerDatabase open() throws IllegalArgumentException {
        if (this.database != null) {
            return this.database;
        }

        trace(log, "open {}", this.options);
        this.database = new SpannerDatabase(this.options);
        return this.database;
    }

    public SpannerDatabase getDatabase() {
        return open();
    }

    public synchronized boolean isOpen() {
        return (this.database != null);
    }

    public String getId() {
        return this.options.getId();
    }

    public String getDatabaseId() {
        String database = this.options.getDatabase();
        return (database == null? "": database);
    }

    public ConnectionOptions getOptions() {
        return this.options;
    }

    @Override
    public synchronized void close() {
        if (this.database == null) {
            return;
        }

        trace(log, "close {}", this.options);
        this.database.close();
        this.database = null;
    }

    /**Execute a set of queries, DML and DDL statements separated by semicolons.
     *
     * @param script the statements
     * @param requestId the request id carried by the results
     * @return the result of each statement in script order
     * @throws UnsupportedStatementException if a statement kind is unspecified, and then
     * no statement executed
     * @throws SQLException if a statement execution failed, and then the statements
     * before it have been executed
     */
    public List<QueryResult> query(String script, String requestId) throws SQLException {
        List<SQLStatement> statements = SQLParser.parse(script);
        for (SQLStatement s : statements) {
            if (!s.isSupported()) {
                throw new UnsupportedStatementException(s.getSQL());
            }
        }

        SpannerDatabase db = open();
        List<QueryResult> results = new ArrayList<>(statements.size());
        for (SQLStatement s : statements) {
            trace(log, "execute {} \"{}\"", s.getKind(), s);
            try {
                switch (s.getKind()) {
                case QUERY:
                    results.add(executeQuery(db, s.getSQL(), requestId));
                    break;
                case DATA_CHANGE:
                    results.add(executeDml(db, s.getSQL(), requestId));
                    break;
                case SCHEMA_CHANGE:
                    results.add(executeDdl(db, s.getSQL(), requestId));
                    break;
                default:
                    throw new UnsupportedStatementException(s.getSQL());
                }
            } catch (SQLException e) {
                traceError(log, "execute failed: " + s, e);
                throw e;
            }
        }

        return results;
    }

    /**Execute a statement as a query. A count query is executed first to check that
     * the results will not exceed the max number of allowed results.
     */
    protected QueryResult executeQuery(SpannerDatabase db, final String sql, final String requestId)
            throws SQLException {
        // newline: the query may end with a line comment
        final String countQuery = "SELECT COUNT(*) FROM (" + sql + "\n)";
        final int maxResults = this.options.getMaxQueryResults();
        final String connId = getId();

        return db.readOnly(new SpannerDatabase.Work<QueryResult>() {
            @Override
            public QueryResult execute(Connection conn) throws SQLException {
                try (Statement stmt = conn.createStatement()) {
                    long count;
                    try (ResultSet rs = stmt.executeQuery(countQuery)) {
                        count = (rs.next()? rs.getLong(1): 0L);
                    }
                    if (count > maxResults) {
                        String message = format("Query result is too large with %d results. "
                                + "Limit the query results to max %d and rerun the query.", count, maxResults);
                        return QueryResult.error(connId, sql, requestId, message);
                    }

                    try (ResultSet rs = stmt.executeQuery(sql)) {
                        List<String> cols = ResultSetReader.columns(rs.getMetaData());
                        List<Map<String, Object>> rows = ResultSetReader.rows(rs, cols);
                        String message = format("Query ok with %d results", rows.size());
                        return new QueryResult(connId, sql, requestId, cols, rows, message);
                    }
                }
            }
        });
    }

    /**Execute a statement as a DML statement in a single transaction, and the result
     * is the update count.
     */
    protected QueryResult executeDml(SpannerDatabase db, final String sql, String requestId)
            throws SQLException {
        long rowCount = db.readWrite(new SpannerDatabase.Work<Long>() {
            @Override
            public Long execute(Connection conn) throws SQLException {
                try (Statement stmt = conn.createStatement()) {
                    return (long)stmt.executeUpdate(sql);
                }
            }
        });

        String message = format("Update ok with %d updated rows", rowCount);
        return QueryResult.single(getId(), sql, requestId, "rowCount", rowCount, message);
    }

    /**Execute a statement as a DDL statement.
     */
    protected QueryResult executeDdl(SpannerDatabase db, String sql, String requestId)
            throws SQLException {
        db.updateSchema(Collections.singletonList(sql));
        return QueryResult.single(getId(), sql, requestId, "Result", "Success",
                "DDL statement executed successfully");
    }

    public void testConnection() throws SQLException {
        open();
        query("SELECT 1", null);
    }

    public Map<String, Completion> getStaticCompletions() {
        return StaticCompletions.get();
    }

    public List<ExplorerItem> getChildrenForItem(ExplorerItem item, ExplorerItem parent)
            throws SQLException {
        return this.explorer.getChildrenForItem(item, parent);
    }

    public List<ExplorerItem> searchItems(ContextValue type, String search, List<String> tables, int limit)
            throws SQLException {
        return this.explorer.searchItems(type, search, tables, limit);
    }

    public boolean isTrace() {
        return this.options.isTrace();
    }

    public boolean isTraceError() {
        return this.options.isTraceError();
    }

    public void trace(Logger log, String message) {
        if (isTrace()) {
            log.info(message);
        }
    }

    public void trace(Logger log, String format, Object ... args) {
        if (isTrace()) {
            log.info(format, args);
        }
    }

    public void traceError(Logger log, String message, Throwable cause) {
        if (isTraceError()) {
            log.warn(message, cause);
        }
    }

    @Override
    public String toString() {
        return (StringUtils.isEmpty(getDatabaseId())? getId(): getDatabaseId());
    }

}

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

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import org.apache.tomcat.jdbc.pool.DataSource;
import org.apache.tomcat.jdbc.pool.PoolProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**The database client of the driver, backed by a pool of JDBC connections.
 * It provides the transaction strategies of statement kinds.
 *
 * @since 2021-03-04
 *
 */
public class SpannerDatabase implements AutoCloseable {
    static final Logger log = LoggerFactory.getLogger(SpannerDatabase.class);

    /**A unit of work executed on a pooled connection. */
    public interface Work<T> {
        T execute(Connection conn) throws SQLException;
    }

    protected final ConnectionOptions options;
    protected final DataSource dataSource;
    private volatile boolean open = true;

    public SpannerDatabase(ConnectionOptions options) throws IllegalArgumentException {
        this.options = options;

        PoolProperties props = new PoolProperties();
        props.setUrl(options.getJdbcUrl());
        props.setDriverClassName(options.getDriverClassName());
        props.setMaxActive(options.getMaxActive());
        props.setMaxIdle(options.getMaxActive());
        // Don't keep sessions on an emulator database that may be recreated
        int minIdle = options.isConnectToEmulator()? 0: 1;
        props.setMinIdle(minIdle);
        props.setInitialSize(minIdle);
        props.setDefaultAutoCommit(true);
        props.setRollbackOnReturn(true);
        props.setJmxEnabled(false);
        this.dataSource = new DataSource(props);
    }

    public String getId() {
        return this.options.getId();
    }

    /**Execute the work in a single-use read-only transaction.
     *
     * @param work the query work
     * @return the result of the work
     * @throws SQLException if the execution failed
     */
    public <T> T readOnly(Work<T> work) throws SQLException {
        try (Connection conn = getConnection()) {
            final boolean readOnly = this.options.isReadOnlyQueries();
            if (readOnly) {
                conn.setReadOnly(true);
            }
            boolean failed = true;
            try {
                T result = work.execute(conn);
                failed = false;
                return result;
            } finally {
                if (readOnly) {
                    resetReadOnly(conn, failed);
                }
            }
        }
    }

    /**Execute the work in a read/write transaction: commit if the work is
     * successful, otherwise rollback.
     *
     * @param work the update work
     * @return the result of the work
     * @throws SQLException if the execution or commit failed
     */
    public <T> T readWrite(Work<T> work) throws SQLException {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            trace(log, "tx: begin");
            boolean failed = true;
            try {
                T result = work.execute(conn);
                conn.commit();
                trace(log, "tx: commit");
                failed = false;
                return result;
            } finally {
                if (failed) {
                    rollback(conn);
                }
                resetAutoCommit(conn, failed);
            }
        }
    }

    /**Submit the DDL statements as a schema update and wait for completion.
     *
     * @param statements the DDL statements
     * @throws SQLException if the schema update failed
     */
    public void updateSchema(List<String> statements) throws SQLException {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                trace(log, "ddl \"{}\"", sql);
                stmt.execute(sql);
            }
        }
    }

    protected void rollback(Connection conn) {
        try {
            conn.rollback();
            trace(log, "tx: rollback");
        } catch (SQLException e) {
            // keep the cause of the failed transaction
            log.warn("tx: rollback failed", e);
        }
    }

    /**Restore the connection to read/write.
     *
     * @param conn the connection
     * @param failed whether the work on the connection failed
     * @throws SQLException if restoring failed and the work not
     */
    protected void resetReadOnly(Connection conn, boolean failed) throws SQLException {
        try {
            conn.setReadOnly(false);
        } catch (SQLException e) {
            if (!failed) {
                throw e;
            }
            // keep the cause of the failed work
            log.warn("tx: reset read-only failed", e);
        }
    }

    /**Restore the auto-commit mode of the connection.
     *
     * @param conn the connection
     * @param failed whether the transaction failed
     * @throws SQLException if restoring failed and the transaction not
     */
    protected void resetAutoCommit(Connection conn, boolean failed) throws SQLException {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            if (!failed) {
                throw e;
            }
            // keep the cause of the failed transaction
            log.warn("tx: reset auto-commit failed", e);
        }
    }

    protected Connection getConnection() throws SQLException {
        if (!isOpen()) {
            throw new IllegalStateException("Database " + getId() + " closed");
        }
        return this.dataSource.getConnection();
    }

    public boolean isOpen() {
        return this.open;
    }

    @Override
    public void close() {
        this.open = false;
        this.dataSource.close();
    }

    protected void trace(Logger log, String format, Object ... args) {
        if (this.options.isTrace()) {
            log.info(format, args);
        }
    }

}

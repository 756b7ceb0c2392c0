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

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;

import org.spanner.TestBase;

/**
 * @since 2021-03-05
 *
 */
public class SpannerDatabaseTest extends TestBase {

    public static void main(String args[]) throws Exception {
        new SpannerDatabaseTest().test();
    }

    @Override
    protected void doTest() throws Exception {
        readOnlyResetTest();
        readWriteResetTest();
        commitResetTest();
        resetFailedTest();
    }

    protected void readOnlyResetTest() {
        final FailingDatabase db = new FailingDatabase(false);
        try {
            SQLException e = assertThrows(SQLException.class, new ThrowingWork() {
                @Override
                public void run() throws Exception {
                    db.readOnly(new SpannerDatabase.Work<Void>() {
                        @Override
                        public Void execute(Connection conn) throws SQLException {
                            throw new SQLException("query failed");
                        }
                    });
                }
            });
            assertEquals("query failed", e.getMessage());
            assertTrue(db.closed);
        } finally {
            db.close();
        }
    }

    protected void readWriteResetTest() {
        final FailingDatabase db = new FailingDatabase(false);
        try {
            SQLException e = assertThrows(SQLException.class, new ThrowingWork() {
                @Override
                public void run() throws Exception {
                    db.readWrite(new SpannerDatabase.Work<Void>() {
                        @Override
                        public Void execute(Connection conn) throws SQLException {
                            throw new SQLException("update failed");
                        }
                    });
                }
            });
            assertEquals("update failed", e.getMessage());
            assertTrue(db.rolledBack);
            assertTrue(db.closed);
        } finally {
            db.close();
        }
    }

    protected void commitResetTest() {
        final FailingDatabase db = new FailingDatabase(true);
        try {
            SQLException e = assertThrows(SQLException.class, new ThrowingWork() {
                @Override
                public void run() throws Exception {
                    db.readWrite(new SpannerDatabase.Work<Integer>() {
                        @Override
                        public Integer execute(Connection conn) {
                            return 1;
                        }
                    });
                }
            });
            assertEquals("commit failed", e.getMessage());
            assertTrue(db.rolledBack);
        } finally {
            db.close();
        }
    }

    protected void resetFailedTest() {
        final FailingDatabase db = new FailingDatabase(false);
        try {
            // no failure of the work to keep
            SQLException e = assertThrows(SQLException.class, new ThrowingWork() {
                @Override
                public void run() throws Exception {
                    db.readWrite(new SpannerDatabase.Work<Integer>() {
                        @Override
                        public Integer execute(Connection conn) {
                            return 1;
                        }
                    });
                }
            });
            assertEquals("reset auto-commit failed", e.getMessage());
            assertFalse(db.rolledBack);

            e = assertThrows(SQLException.class, new ThrowingWork() {
                @Override
                public void run() throws Exception {
                    db.readOnly(new SpannerDatabase.Work<Integer>() {
                        @Override
                        public Integer execute(Connection conn) {
                            return 1;
                        }
                    });
                }
            });
            assertEquals("reset read-only failed", e.getMessage());
        } finally {
            db.close();
        }
    }

    static ConnectionOptions newOptions() {
        ConnectionOptions options = new ConnectionOptions();
        options.setUrl("jdbc:sqlite::memory:");
        options.setDriverClassName("org.sqlite.JDBC");
        options.setReadOnlyQueries(true);
        return options;
    }

    /**A database whose connections can't restore their read-only or auto-commit mode.
     */
    static class FailingDatabase extends SpannerDatabase {

        final boolean failCommit;
        boolean rolledBack;
        boolean closed;

        FailingDatabase(boolean failCommit) {
            super(newOptions());
            this.failCommit = failCommit;
        }

        @Override
        protected Connection getConnection() {
            InvocationHandler handler = new InvocationHandler() {
                @Override
                public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
                    String name = method.getName();
                    if ("setReadOnly".equals(name) && Boolean.FALSE.equals(args[0])) {
                        throw new SQLException("reset read-only failed");
                    }
                    if ("setAutoCommit".equals(name) && Boolean.TRUE.equals(args[0])) {
                        throw new SQLException("reset auto-commit failed");
                    }
                    if ("commit".equals(name) && failCommit) {
                        throw new SQLException("commit failed");
                    }
                    if ("rollback".equals(name)) {
                        rolledBack = true;
                    } else if ("close".equals(name)) {
                        closed = true;
                    }

                    Class<?> type = method.getReturnType();
                    if (type == boolean.class) {
                        return false;
                    }
                    if (type == int.class) {
                        return 0;
                    }
                    return null;
                }
            };
            return (Connection)Proxy.newProxyInstance(getClass().getClassLoader(),
                    new Class<?>[] { Connection.class }, handler);
        }
    }

}

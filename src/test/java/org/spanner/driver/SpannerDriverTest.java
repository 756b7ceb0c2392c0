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
import java.util.List;
import java.util.Map;

import org.spanner.TestDbBase;

/**Test the script execution of the driver against a SQLite database.
 *
 * @since 2021-03-05
 *
 */
public class SpannerDriverTest extends TestDbBase {

    public static void main(String args[]) throws Exception {
        new SpannerDriverTest().test();
    }

    @Override
    protected void doTest() throws Exception {
        ddlTest();
        dmlTest();
        queryTest();
        maxQueryResultsTest();
        unsupportedTest();
        rollbackTest();
        metaQueryTest();
        closeTest();
    }

    protected void ddlTest() throws SQLException {
        SpannerDriver driver = getDriver();
        assertFalse(driver.isOpen());
        String sql = "create table account(id integer primary key, name varchar(20), balance integer)";
        List<QueryResult> results = driver.query(sql + ";\n", "ddl-1");
        assertTrue(driver.isOpen());
        assertEquals(1, results.size());

        QueryResult result = results.get(0);
        assertEquals("DDL statement executed successfully", result.getMessage());
        assertEquals("[Result]", result.getCols().toString());
        assertEquals("Success", result.getResults().get(0).get("Result"));
        assertEquals(sql, result.getQuery());
        assertEquals("ddl-1", result.getRequestId());
        assertEquals(getUrl(), result.getConnId());
        assertNotNull(result.getResultId());
        assertFalse(result.isError());
        assertEquals(0, count("select count(*) from account"));
    }

    protected void dmlTest() throws SQLException {
        List<QueryResult> results = getDriver().query(
                "insert into account(id, name, balance) values(1, 'a;b', 100), (2, 'c', 200);\n"
                + "-- credit\nupdate account set balance = balance + 1 where id = 1", "dml-1");
        assertEquals(2, results.size());

        QueryResult result = results.get(0);
        assertEquals("Update ok with 2 updated rows", result.getMessage());
        assertEquals("[rowCount]", result.getCols().toString());
        assertEquals(2L, result.getResults().get(0).get("rowCount"));

        result = results.get(1);
        assertEquals("Update ok with 1 updated rows", result.getMessage());
        assertEquals(1L, result.getResults().get(0).get("rowCount"));
        assertFalse(results.get(0).getResultId().equals(result.getResultId()));

        assertEquals(101, count("select balance from account where id = 1"));
    }

    protected void queryTest() throws SQLException {
        List<QueryResult> results = getDriver().query("select id, name from account order by id", "q-1");
        QueryResult result = results.get(0);
        assertEquals("Query ok with 2 results", result.getMessage());
        assertEquals("[id, name]", result.getCols().toString());
        List<Map<String, Object>> rows = result.getResults();
        assertEquals(2, rows.size());
        assertEquals(1, ((Number)rows.get(0).get("id")).intValue());
        assertEquals("a;b", rows.get(0).get("name"));
        assertEquals("c", rows.get(1).get("name"));

        // a trailing line comment and the count query
        results = getDriver().query("/* q */ select count(*) as n from account -- total\n;"
                + "with a as (select 1 as x) select x from a", "q-2");
        assertEquals(2, results.size());
        assertEquals("Query ok with 1 results", results.get(0).getMessage());
        assertEquals(2, ((Number)results.get(0).getResults().get(0).get("n")).intValue());
        assertEquals(1, ((Number)results.get(1).getResults().get(0).get("x")).intValue());

        results = getDriver().query("select * from account where id < 0", null);
        assertEquals("Query ok with 0 results", results.get(0).getMessage());
        assertEquals("[id, name, balance]", results.get(0).getCols().toString());
        assertTrue(results.get(0).getResults().isEmpty());

        assertTrue(getDriver().query("  ;\n; ", "empty").isEmpty());
        getDriver().testConnection();
    }

    protected void maxQueryResultsTest() throws SQLException {
        ConnectionOptions options = getOptions();
        options.setMaxQueryResults(1);
        try {
            QueryResult result = getDriver().query("select * from account", "max-1").get(0);
            assertTrue(result.isError());
            String message = "Query result is too large with 2 results. "
                    + "Limit the query results to max 1 and rerun the query.";
            assertEquals(message, result.getMessage());
            assertEquals("[Error]", result.getCols().toString());
            assertEquals(message, result.getResults().get(0).get(QueryResult.ERROR_COLUMN));

            options.setMaxQueryResults(2);
            result = getDriver().query("select * from account", "max-2").get(0);
            assertFalse(result.isError());
            assertEquals(2, result.getResults().size());
        } finally {
            options.setMaxQueryResults(ConnectionOptions.MAX_QUERY_RESULTS_DEFAULT);
        }

        int max = ConnectionOptions.MAX_QUERY_RESULTS_DEFAULT;
        String sql = "with recursive c(x) as (select 1 union all select x + 1 from c where x < " + (max + 1)
                + ") select x from c";
        QueryResult result = getDriver().query(sql, "max-default").get(0);
        assertTrue(result.isError());
        assertEquals(String.format("Query result is too large with %d results. "
                + "Limit the query results to max %d and rerun the query.", max + 1, max), result.getMessage());
    }

    protected void unsupportedTest() throws SQLException {
        final String script = "insert into account(id, name, balance) values(3, 'd', 300);\n"
                + "explain select 1;\nselect 1";
        UnsupportedStatementException e = assertThrows(UnsupportedStatementException.class,
                new ThrowingWork() {
            @Override
            public void run() throws Exception {
                getDriver().query(script, "unsupported-1");
            }
        });
        assertEquals("Unsupported statement: explain select 1", e.getMessage());
        assertEquals("explain select 1", e.getStatement());
        assertEquals("0A000", e.getSQLState());
        // nothing executed
        assertEquals(2, count("select count(*) from account"));

        // a comment-only statement has no keyword
        e = assertThrows(UnsupportedStatementException.class, new ThrowingWork() {
            @Override
            public void run() throws Exception {
                getDriver().query("select 1; -- bye", "unsupported-2");
            }
        });
        assertEquals("-- bye", e.getStatement());
    }

    protected void rollbackTest() throws SQLException {
        SQLException e = assertThrows(SQLException.class, new ThrowingWork() {
            @Override
            public void run() throws Exception {
                getDriver().query("insert into account(id, name, balance) values(5, 'e', 500);\n"
                        + "insert into account(id, name, balance) values(4, 'f', 400), (1, 'dup', 0);\n"
                        + "delete from account", "rollback-1");
            }
        });
        assertFalse(e instanceof UnsupportedStatementException);
        // executed before the failed one
        assertEquals(1, count("select count(*) from account where id = 5"));
        assertEquals(0, count("select count(*) from account where id = 4"));
        assertEquals(3, count("select count(*) from account"));

        e = assertThrows(SQLException.class, new ThrowingWork() {
            @Override
            public void run() throws Exception {
                getDriver().query("update account set balance = 0 where id = 5;\n"
                        + "update account set id = 1 where id = 2", "rollback-2");
            }
        });
        // each statement is executed in its own transaction
        assertEquals(1, count("select count(*) from account where balance = 0"));
        assertEquals(1, count("select count(*) from account where id = 2"));

        // the pooled connection is still usable
        QueryResult result = getDriver().query("delete from account where id = 5", "delete-1").get(0);
        assertEquals("Update ok with 1 updated rows", result.getMessage());
        assertEquals(2, count("select count(*) from account"));
    }

    protected void metaQueryTest() throws SQLException {
        QueryResult result = getDriver().query(MetaQueries.countRecords("account"), null).get(0);
        assertEquals(2, ((Number)result.getResults().get(0).get("total")).intValue());
        result = getDriver().query(MetaQueries.fetchRecords("account", 1, 1), null).get(0);
        assertEquals(1, result.getResults().size());

        ConnectionExplorer explorer = new ConnectionExplorer(getDriver());
        List<ExplorerItem> items = explorer.query("select 'account' as label, 'TABLE' as type, "
                + "'' as `schema` union all select 'id', 'connection.column', ''", ContextValue.VIEW);
        assertEquals(2, items.size());
        assertEquals("account", items.get(0).getLabel());
        assertEquals(ContextValue.TABLE, items.get(0).getType());
        assertEquals("", items.get(0).getSchema());
        assertEquals(ContextValue.COLUMN, items.get(1).getType());
    }

    protected void closeTest() throws SQLException {
        SpannerDriver driver = getDriver();
        final SpannerDatabase db = driver.getDatabase();
        assertSame(db, driver.open());
        assertTrue(db.isOpen());
        driver.close();
        assertFalse(driver.isOpen());
        assertFalse(db.isOpen());
        assertThrows(IllegalStateException.class, new ThrowingWork() {
            @Override
            public void run() throws Exception {
                db.readOnly(new SpannerDatabase.Work<Object>() {
                    @Override
                    public Object execute(Connection conn) {
                        return null;
                    }
                });
            }
        });

        // reopen on demand
        assertEquals(1, driver.query("select 1", null).size());
        assertTrue(driver.isOpen());
        assertNotSame(db, driver.getDatabase());
    }

}

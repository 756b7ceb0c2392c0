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

import java.util.Arrays;

import org.spanner.TestBase;
import org.spanner.sql.SQLClassifier;
import org.spanner.sql.StatementKind;

/**
 * @since 2021-03-06
 *
 */
public class MetaQueriesTest extends TestBase {

    public static void main(String args[]) throws Exception {
        new MetaQueriesTest().test();
    }

    @Override
    protected void doTest() throws Exception {
        recordsTest();
        schemaTest();
        tablesTest();
        columnsTest();
    }

    protected void recordsTest() {
        assertEquals("SELECT *\nFROM account\nLIMIT 50\nOFFSET 0", MetaQueries.fetchRecords("account", 0, -1));
        assertEquals("SELECT *\nFROM account\nLIMIT 10\nOFFSET 20", MetaQueries.fetchRecords("account", 10, 20));
        assertEquals("SELECT count(1) AS total\nFROM account", MetaQueries.countRecords("account"));
    }

    protected void schemaTest() {
        String sql = MetaQueries.fetchSchemas("db's");
        assertTrue(sql, sql.contains("THEN '(default)'"));
        assertTrue(sql, sql.contains("'connection.schema' AS type"));
        assertTrue(sql, sql.contains("'db\\'s' AS `database`"));
        assertTrue(sql, sql.endsWith("FROM INFORMATION_SCHEMA.SCHEMATA"));
        assertEquals(StatementKind.QUERY, SQLClassifier.classify(sql));

        sql = MetaQueries.describeTable("", "account");
        assertTrue(sql, sql.contains("TABLE_SCHEMA  = ''"));
        assertTrue(sql, sql.endsWith("TABLE_NAME    = 'account'"));
    }

    protected void tablesTest() {
        String sql = MetaQueries.fetchTables("db", "");
        assertTrue(sql, sql.contains("'connection.table' AS type"));
        assertTrue(sql, sql.contains("FALSE AS isView"));
        assertTrue(sql, sql.contains("END = 'TABLE'"));

        sql = MetaQueries.fetchViews("db", "reports");
        assertTrue(sql, sql.contains("'connection.view' AS type"));
        assertTrue(sql, sql.contains("TRUE AS isView"));
        assertTrue(sql, sql.contains("TABLE_SCHEMA  = 'reports'"));
        assertTrue(sql, sql.contains("END = 'VIEW'"));

        sql = MetaQueries.searchTables("Acc");
        assertTrue(sql, sql.contains("LOWER(TABLE_NAME) LIKE '%acc%'"));
        sql = MetaQueries.searchTables(null);
        assertFalse(sql, sql.contains("LIKE"));
        assertTrue(sql, sql.endsWith("ORDER BY TABLE_NAME"));
    }

    protected void columnsTest() {
        String sql = MetaQueries.fetchColumns("db", "", "it's");
        assertTrue(sql, sql.contains("TABLE_NAME    = 'it\\'s'"));
        assertTrue(sql, sql.contains("'connection.column' AS type"));
        assertTrue(sql, sql.endsWith("ORDER BY ORDINAL_POSITION ASC"));

        sql = MetaQueries.searchColumns(Arrays.asList("Account", "", null), "Na", 0);
        assertTrue(sql, sql.contains("IN ('account')"));
        assertTrue(sql, sql.contains("LIKE '%na%'"));
        assertTrue(sql, sql.endsWith("LIMIT 100"));

        sql = MetaQueries.searchColumns(null, null, 5);
        assertEquals(StatementKind.QUERY, SQLClassifier.classify(sql));
        assertFalse(sql, sql.contains("IN ("));
        assertFalse(sql, sql.contains("LIKE"));
        assertTrue(sql, sql.endsWith("LIMIT 5"));
    }

}

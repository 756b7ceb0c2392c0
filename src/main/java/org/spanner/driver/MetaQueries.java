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

import static org.spanner.util.StringUtils.*;

import java.util.ArrayList;
import java.util.List;

/**<p>
 * INFORMATION_SCHEMA queries of the object browser and the auto-completion.
 * </p>
 * <p>
 * The default schema is nameless in Cloud Spanner: it only contains tables, and
 * all other schemata only contain views.
 * </p>
 *
 * @since 2021-03-06
 *
 */
public final class MetaQueries {

    public static final int FETCH_RECORDS_LIMIT = 50;
    public static final int SEARCH_COLUMNS_LIMIT = 100;
    public static final String DEFAULT_SCHEMA_LABEL = "(default)";

    private MetaQueries() {}

    public static String describeTable(String schema, String table) {
        return "SELECT * FROM INFORMATION_SCHEMA.COLUMNS\n" +
                "WHERE TABLE_CATALOG = ''\n" +
                "  AND TABLE_SCHEMA  = " + quoteLiteral(schema) + "\n" +
                "  AND TABLE_NAME    = " + quoteLiteral(table);
    }

    /**Fetch the columns of a single table or view. The size of a sized type
     * is parsed from the type, e.g. STRING(64), and MAX is the max size of the type.
     */
    public static String fetchColumns(String database, String schema, String table) {
        return "SELECT\n" +
                "  C.COLUMN_NAME AS label,\n" +
                "  C.TABLE_NAME AS `table`,\n" +
                "  C.TABLE_SCHEMA AS `schema`,\n" +
                "  " + quoteLiteral(database) + " AS `database`,\n" +
                "  C.SPANNER_TYPE AS dataType,\n" +
                "  C.SPANNER_TYPE AS detail,\n" +
                "  CASE\n" +
                "    WHEN STRPOS(SPANNER_TYPE, '(')=0 THEN NULL\n" +
                "    ELSE CAST(REPLACE(SUBSTR(C.SPANNER_TYPE, STRPOS(C.SPANNER_TYPE, '(')+1, " +
                "STRPOS(C.SPANNER_TYPE, ')')-STRPOS(C.SPANNER_TYPE, '(')-1), 'MAX', " +
                "CASE WHEN UPPER(C.SPANNER_TYPE) LIKE '%STRING%' THEN '2621440' ELSE '10485760' END) AS INT64)\n" +
                "  END AS size,\n" +
                "  CAST(C.COLUMN_DEFAULT AS STRING) AS defaultValue,\n" +
                "  CASE WHEN C.IS_NULLABLE = 'YES' THEN TRUE ELSE FALSE END AS isNullable,\n" +
                "  FALSE AS isPk,\n" +
                "  FALSE AS isFk,\n" +
                "  '" + ContextValue.COLUMN + "' AS type\n" +
                "FROM INFORMATION_SCHEMA.COLUMNS AS C\n" +
                "WHERE TABLE_CATALOG = ''\n" +
                "AND   TABLE_SCHEMA  = " + quoteLiteral(schema) + "\n" +
                "AND   TABLE_NAME    = " + quoteLiteral(table) + "\n" +
                "ORDER BY ORDINAL_POSITION ASC";
    }

    public static String fetchRecords(String table, int limit, int offset) {
        if (limit <= 0) {
            limit = FETCH_RECORDS_LIMIT;
        }
        return "SELECT *\n" +
                "FROM " + table + "\n" +
                "LIMIT " + limit + "\n" +
                "OFFSET " + Math.max(0, offset);
    }

    public static String countRecords(String table) {
        return "SELECT count(1) AS total\n" +
                "FROM " + table;
    }

    public static String fetchTables(String database, String schema) {
        return fetchTablesAndViews(ContextValue.TABLE, database, schema);
    }

    public static String fetchViews(String database, String schema) {
        return fetchTablesAndViews(ContextValue.VIEW, database, schema);
    }

    static String fetchTablesAndViews(ContextValue type, String database, String schema) {
        boolean view = (type == ContextValue.VIEW);
        return "SELECT " + quoteLiteral(database) + " AS `database`,\n" +
                "       TABLE_SCHEMA AS `schema`,\n" +
                "       TABLE_NAME  AS label,\n" +
                "       '" + type + "' AS type,\n" +
                "       " + (view? "TRUE": "FALSE") + " AS isView\n" +
                "FROM INFORMATION_SCHEMA.TABLES\n" +
                "WHERE TABLE_CATALOG = ''\n" +
                "AND   TABLE_SCHEMA  = " + quoteLiteral(schema) + "\n" +
                "AND   CASE WHEN TABLE_SCHEMA='' THEN 'TABLE' ELSE 'VIEW' END = " +
                (view? "'VIEW'": "'TABLE'") + "\n" +
                "ORDER BY TABLE_NAME";
    }

    /**Search the tables and views whose name contains the search text. A view is
     * labelled by its qualified name "schema.view".
     */
    public static String searchTables(String search) {
        StringBuilder sb = new StringBuilder();
        sb.append("SELECT CASE WHEN TABLE_SCHEMA='' THEN TABLE_NAME ELSE TABLE_SCHEMA || '.' || TABLE_NAME END AS label,\n")
          .append("       CASE WHEN TABLE_SCHEMA='' THEN 'TABLE' ELSE 'VIEW' END AS type\n")
          .append("FROM INFORMATION_SCHEMA.TABLES\n")
          .append("WHERE TABLE_CATALOG = ''\n");
        if (!isEmpty(search)) {
            String like = quoteLiteral("%" + toLowerEnglish(search) + "%");
            sb.append("  AND (\n")
              .append("    (TABLE_SCHEMA='' AND LOWER(TABLE_NAME) LIKE ").append(like).append(")\n")
              .append("    OR\n")
              .append("    (LOWER(TABLE_SCHEMA) || '.' || LOWER(TABLE_NAME)) LIKE ").append(like).append('\n')
              .append("  )\n");
        }
        sb.append("ORDER BY TABLE_NAME");
        return sb.toString();
    }

    /**Search the columns of the given tables whose name contains the search text.
     *
     * @param tables the table labels, all tables if empty
     * @param search the search text, may be null
     * @param limit max number of columns, the default limit if not positive
     * @return the search query
     */
    public static String searchColumns(List<String> tables, String search, int limit) {
        if (limit <= 0) {
            limit = SEARCH_COLUMNS_LIMIT;
        }

        List<String> names = new ArrayList<>();
        if (tables != null) {
            for (String t : tables) {
                if (!isEmpty(t)) {
                    names.add(quoteLiteral(toLowerEnglish(t)));
                }
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append("SELECT C.COLUMN_NAME AS label,\n")
          .append("       C.TABLE_NAME AS `table`,\n")
          .append("       C.SPANNER_TYPE AS dataType,\n")
          .append("       CASE WHEN C.IS_NULLABLE = 'YES' THEN TRUE ELSE FALSE END AS isNullable,\n")
          .append("       FALSE AS isPk,\n")
          .append("       '").append(ContextValue.COLUMN).append("' AS type\n")
          .append("FROM INFORMATION_SCHEMA.COLUMNS C\n")
          .append("WHERE 1 = 1\n");
        if (names.size() > 0) {
            sb.append("AND LOWER(C.TABLE_NAME) IN (").append(String.join(", ", names)).append(")\n");
        }
        if (!isEmpty(search)) {
            String like = quoteLiteral("%" + toLowerEnglish(search) + "%");
            sb.append("AND (\n")
              .append("    LOWER(C.TABLE_NAME || '.' || C.COLUMN_NAME) LIKE ").append(like).append('\n')
              .append("    OR LOWER(C.COLUMN_NAME) LIKE ").append(like).append('\n')
              .append(")\n");
        }
        sb.append("ORDER BY C.COLUMN_NAME ASC, C.ORDINAL_POSITION ASC\n")
          .append("LIMIT ").append(limit);
        return sb.toString();
    }

    public static String fetchSchemas(String database) {
        return "SELECT\n" +
                "  CASE WHEN SCHEMA_NAME = '' THEN '" + DEFAULT_SCHEMA_LABEL + "' ELSE SCHEMA_NAME END AS label,\n" +
                "  SCHEMA_NAME AS `schema`,\n" +
                "  '" + ContextValue.SCHEMA + "' AS type,\n" +
                "  'group-by-ref-type' AS iconId,\n" +
                "  " + quoteLiteral(database) + " AS `database`\n" +
                "FROM INFORMATION_SCHEMA.SCHEMATA";
    }

}

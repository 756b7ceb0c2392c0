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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**The object browser of a Cloud Spanner database, based on INFORMATION_SCHEMA.
 *
 * @since 2021-03-06
 *
 */
public class ConnectionExplorer {
    static final Logger log = LoggerFactory.getLogger(ConnectionExplorer.class);

    public static final String TABLES_GROUP = "Tables";
    public static final String VIEWS_GROUP  = "Views";

    protected final SpannerDriver driver;

    public ConnectionExplorer(SpannerDriver driver) {
        this.driver = driver;
    }

    /**<p>
     * Retrieve the child items of the given item:
     * <ol>
     * <li>A connection: the schemas of the database</li>
     * <li>A schema: the fixed resource groups 'Tables' and 'Views'</li>
     * <li>A resource group: the tables or views of the parent schema</li>
     * <li>A table or view: the columns of the table or view</li>
     * </ol>
     * </p>
     *
     * @param item the item
     * @param parent the parent of the item, the schema of a resource group
     * @return the child items, empty if the item has no children
     * @throws SQLException if the meta query failed
     */
    public List<ExplorerItem> getChildrenForItem(ExplorerItem item, ExplorerItem parent)
            throws SQLException {
        String database = this.driver.getDatabaseId();
        switch (item.getType()) {
        case CONNECTION:
        case CONNECTED_CONNECTION:
            return query(MetaQueries.fetchSchemas(database), ContextValue.SCHEMA);
        case SCHEMA:
            return Arrays.asList(
                    ExplorerItem.resourceGroup(TABLES_GROUP, ContextValue.TABLE, item),
                    ExplorerItem.resourceGroup(VIEWS_GROUP, ContextValue.VIEW, item));
        case TABLE:
        case VIEW:
            return query(MetaQueries.fetchColumns(database, schemaOf(item), item.getLabel()),
                    ContextValue.COLUMN);
        case RESOURCE_GROUP:
            return getChildrenForGroup(item, parent);
        default:
            return Collections.emptyList();
        }
    }

    protected List<ExplorerItem> getChildrenForGroup(ExplorerItem group, ExplorerItem parent)
            throws SQLException {
        String database = this.driver.getDatabaseId();
        String schema = schemaOf(parent != null? parent: group);
        ContextValue childType = group.getChildType();
        if (childType == null) {
            return Collections.emptyList();
        }

        switch (childType) {
        case TABLE:
            return query(MetaQueries.fetchTables(database, schema), ContextValue.TABLE);
        case VIEW:
            return query(MetaQueries.fetchViews(database, schema), ContextValue.VIEW);
        default:
            return Collections.emptyList();
        }
    }

    /**Search all items of the given type that match the search text.
     *
     * @param type TABLE, VIEW or COLUMN, other types have no search result
     * @param search the search text
     * @param tables the table labels that columns are searched in, all tables if empty
     * @param limit max number of columns
     * @return the matched items
     * @throws SQLException if the meta query failed
     */
    public List<ExplorerItem> searchItems(ContextValue type, String search, List<String> tables, int limit)
            throws SQLException {
        switch (type) {
        case TABLE:
        case VIEW:
            return query(MetaQueries.searchTables(search), type);
        case COLUMN:
            return query(MetaQueries.searchColumns(tables, search, limit), ContextValue.COLUMN);
        default:
            return Collections.emptyList();
        }
    }

    static String schemaOf(ExplorerItem item) {
        String schema = item.getSchema();
        return (schema == null? "": schema);
    }

    protected List<ExplorerItem> query(final String sql, final ContextValue defaultType)
            throws SQLException {
        this.driver.trace(log, "meta query \"{}\"", sql);
        return this.driver.getDatabase().readOnly(new SpannerDatabase.Work<List<ExplorerItem>>() {
            @Override
            public List<ExplorerItem> execute(Connection conn) throws SQLException {
                try (Statement stmt = conn.createStatement();
                        ResultSet rs = stmt.executeQuery(sql)) {
                    List<String> cols = ResultSetReader.columns(rs.getMetaData());
                    List<ExplorerItem> items = new ArrayList<>();
                    for (Map<String, Object> row : ResultSetReader.rows(rs, cols)) {
                        items.add(ExplorerItem.from(row, defaultType));
                    }
                    return items;
                }
            }
        });
    }

}

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

import java.util.Map;
import java.util.TreeMap;

/**An item of the object browser: schema, resource group, table, view or column.
 *
 * @since 2021-03-06
 *
 */
public class ExplorerItem {

    protected String label;
    protected ContextValue type;
    protected String database;
    protected String schema;
    protected String table;
    protected String iconId;
    // the child type of a resource group
    protected ContextValue childType;
    protected final Map<String, Object> attributes = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public ExplorerItem(String label, ContextValue type) {
        this.label = label;
        this.type = type;
    }

    public static ExplorerItem resourceGroup(String label, ContextValue childType, ExplorerItem schema) {
        ExplorerItem group = new ExplorerItem(label, ContextValue.RESOURCE_GROUP);
        group.iconId = "folder";
        group.childType = childType;
        if (schema != null) {
            group.database = schema.database;
            group.schema = schema.schema;
        }
        return group;
    }

    /**Create an item from a row of the meta queries.
     *
     * @param row the query row
     * @param defaultType the type if the row has no "type" column
     * @return the item
     */
    public static ExplorerItem from(Map<String, Object> row, ContextValue defaultType) {
        Map<String, Object> attrs = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        attrs.putAll(row);

        Object type = attrs.get("type");
        ContextValue t = defaultType;
        if (type != null) {
            String value = type.toString();
            if ("TABLE".equals(value)) {
                t = ContextValue.TABLE;
            } else if ("VIEW".equals(value)) {
                t = ContextValue.VIEW;
            } else {
                t = ContextValue.of(value);
            }
        }

        ExplorerItem item = new ExplorerItem(asString(attrs.get("label")), t);
        item.database = asString(attrs.get("database"));
        item.schema = asString(attrs.get("schema"));
        item.table = asString(attrs.get("table"));
        item.iconId = asString(attrs.get("iconId"));
        item.attributes.putAll(attrs);
        return item;
    }

    static String asString(Object o) {
        return (o == null? null: o.toString());
    }

    public String getLabel() {
        return this.label;
    }

    public ContextValue getType() {
        return this.type;
    }

    public String getDatabase() {
        return this.database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getSchema() {
        return this.schema;
    }

    public void setSchema(String schema) {
        this.schema = schema;
    }

    public String getTable() {
        return this.table;
    }

    public String getIconId() {
        return this.iconId;
    }

    public ContextValue getChildType() {
        return this.childType;
    }

    public Object getAttribute(String name) {
        return this.attributes.get(name);
    }

    @Override
    public String toString() {
        return format("%s[label %s, schema %s]", this.type, this.label, this.schema);
    }

}

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

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @since 2021-03-06
 *
 */
final class ResultSetReader {

    private ResultSetReader() {}

    /**
     * @return the column labels, a nameless column i is named "_i"
     */
    static List<String> columns(ResultSetMetaData meta) throws SQLException {
        int n = meta.getColumnCount();
        List<String> cols = new ArrayList<>(n);
        for (int i = 1; i <= n; ++i) {
            String label = meta.getColumnLabel(i);
            if (label == null || label.isEmpty()) {
                label = "_" + (i - 1);
            }
            cols.add(label);
        }
        return cols;
    }

    static List<Map<String, Object>> rows(ResultSet rs, List<String> cols) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0, n = cols.size(); i < n; ++i) {
                row.put(cols.get(i), rs.getObject(i + 1));
            }
            rows.add(row);
        }
        return rows;
    }

}

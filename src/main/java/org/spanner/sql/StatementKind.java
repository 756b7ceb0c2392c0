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
package org.spanner.sql;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.spanner.util.StringUtils;

/**Statement kind that selects the transaction strategy of a statement.
 *
 * @since 2021-03-02
 *
 */
public enum StatementKind {

    UNSPECIFIED,
    /** Executed in a single-use read-only transaction */
    QUERY("SELECT", "WITH"),
    /** Executed in its own read/write transaction */
    DATA_CHANGE("INSERT", "UPDATE", "DELETE"),
    /** Submitted as a schema update */
    SCHEMA_CHANGE("CREATE", "ALTER", "DROP");

    private final Set<String> keywords;

    private StatementKind(String ... keywords) {
        this.keywords = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(keywords)));
    }

    public Set<String> getKeywords() {
        return this.keywords;
    }

    /**
     * @param keyword the leading keyword of a statement, case-insensitive
     * @return the first kind in QUERY, DATA_CHANGE, SCHEMA_CHANGE order whose keywords
     * contain the keyword, otherwise UNSPECIFIED
     */
    public static StatementKind of(String keyword) {
        if (keyword == null || keyword.isEmpty()) {
            return UNSPECIFIED;
        }

        String upper = StringUtils.toUpperEnglish(keyword);
        for (StatementKind kind : values()) {
            if (kind.keywords.contains(upper)) {
                return kind;
            }
        }
        return UNSPECIFIED;
    }

}

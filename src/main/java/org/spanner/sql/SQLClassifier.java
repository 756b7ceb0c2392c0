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

import static java.lang.Character.*;

/**A simple statement classifier that detects the kind of a statement by its first
 * keyword outside comments. It doesn't verify the validity of the statement.
 *
 * @since 2021-03-02
 *
 */
public final class SQLClassifier {

    private SQLClassifier() {}

    public static StatementKind classify(String sql) {
        return StatementKind.of(leadingKeyword(sql));
    }

    /**Look for the first word in a SQL statement that is not inside a comment.
     * Quotes are plain chars of the word, so a leading string literal can't hide
     * the text after it.
     *
     * @param sql the SQL statement
     * @return the first run of non-whitespace chars outside comments, or an empty string
     */
    public static String firstKeyword(String sql) {
        if (sql == null) {
            return "";
        }

        StringBuilder keyword = new StringBuilder();
        ScanMode mode = ScanMode.NORMAL;
        for (int i = 0, n = sql.length(); i < n; ++i) {
            char c = sql.charAt(i);
            char next = (i + 1 < n? sql.charAt(i + 1): 0);
            if (mode.isComment()) {
                if (mode.isLineComment()) {
                    if (c == '\n') {
                        mode = ScanMode.NORMAL;
                    }
                } else if (c == '*' && next == '/') {
                    ++i;
                    mode = ScanMode.NORMAL;
                }
                continue;
            }

            if (SQLScanner.isCommentStart(c, next) || isWhitespace(c)) {
                if (keyword.length() > 0) {
                    break;
                }
                if (!isWhitespace(c)) {
                    mode = ScanMode.inComment(c);
                    ++i;
                }
                continue;
            }
            keyword.append(c);
        }

        return keyword.toString();
    }

    /**
     * @param sql the SQL statement
     * @return the letters prefix of the first word, e.g. "select" of "select*from t"
     */
    public static String leadingKeyword(String sql) {
        String word = firstKeyword(sql);
        int i = 0, n = word.length();
        while (i < n && isLetter(word.charAt(i))) {
            ++i;
        }
        return word.substring(0, i);
    }

}

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
package org.spanner.util;

import java.util.Locale;

/**
 * @since 2021-03-02
 *
 */
public final class StringUtils {

    private StringUtils() {}

    public static String toUpperEnglish(String s) {
        return s.toUpperCase(Locale.ENGLISH);
    }

    public static String toLowerEnglish(String s) {
        return s.toLowerCase(Locale.ENGLISH);
    }

    public static boolean isEmpty(String s) {
        return (s == null || s.isEmpty());
    }

    public static boolean isBlank(String s) {
        return (s == null || s.trim().isEmpty());
    }

    /**Escape a string value for embedding into a single-quoted SQL literal.
     *
     * @param s the string value
     * @return the escaped value without the enclosing quotes
     */
    public static String escapeLiteral(String s) {
        if (s == null) {
            return "";
        }

        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0, n = s.length(); i < n; ++i) {
            char c = s.charAt(i);
            switch (c) {
            case '\'':
            case '\\':
                sb.append('\\');
                break;
            default:
                break;
            }
            sb.append(c);
        }
        return sb.toString();
    }

    public static String quoteLiteral(String s) {
        return "'" + escapeLiteral(s) + "'";
    }

}

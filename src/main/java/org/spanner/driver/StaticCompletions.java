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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.spanner.sql.StatementKind;

/**Static completions of the supported keywords and the Cloud Spanner functions,
 * built once on first access.
 *
 * @since 2021-03-06
 *
 */
public final class StaticCompletions {

    static final List<String> NUMERIC_FUNCTIONS = Arrays.asList(
            "ABS", "SIGN", "IS_INF", "IS_NAN", "IEEE_DIVIDE", "SQRT", "POW", "POWER", "EXP", "LN", "LOG",
            "LOG10", "GREATEST", "LEAST", "DIV", "MOD", "ROUND", "TRUNC", "CEIL", "CEILING", "FLOOR",
            "COS", "COSH", "ACOS", "ACOSH", "SIN", "SINH", "ASIN", "ASINH", "TAN", "TANH", "ATAN",
            "ATANH", "ATAN2", "FARM_FINGERPRINT", "SHA1", "SHA256", "SHA512");

    static final List<String> STRING_FUNCTIONS = Arrays.asList(
            "BYTE_LENGTH", "CHAR_LENGTH", "CHARACTER_LENGTH", "CODE_POINTS_TO_BYTES",
            "CODE_POINTS_TO_STRING", "CONCAT", "ENDS_WITH", "FORMAT", "FROM_BASE64", "FROM_HEX",
            "LENGTH", "LPAD", "LOWER", "LTRIM", "REGEXP_CONTAINS", "REGEXP_EXTRACT", "REGEXP_EXTRACT_ALL",
            "REGEXP_REPLACE", "REPLACE", "REPEAT", "REVERSE", "RPAD", "RTRIM",
            "SAFE_CONVERT_BYTES_TO_STRING", "SPLIT", "STARTS_WITH", "STRPOS", "SUBSTR", "TO_BASE64",
            "TO_CODE_POINTS", "TO_HEX", "TRIM", "UPPER", "JSON_QUERY", "JSON_VALUE");

    static final List<String> DATE_FUNCTIONS = Arrays.asList(
            "CURRENT_DATE", "EXTRACT", "DATE", "DATE_ADD", "DATE_SUB", "DATE_DIFF", "DATE_TRUNC",
            "DATE_FROM_UNIX_DATE", "FORMAT_DATE", "PARSE_DATE", "UNIX_DATE", "CURRENT_TIMESTAMP",
            "STRING", "TIMESTAMP", "TIMESTAMP_ADD", "TIMESTAMP_SUB", "TIMESTAMP_DIFF", "TIMESTAMP_TRUNC",
            "FORMAT_TIMESTAMP", "PARSE_TIMESTAMP", "TIMESTAMP_SECONDS", "TIMESTAMP_MILLIS",
            "TIMESTAMP_MICROS", "UNIX_SECONDS", "UNIX_MILLIS", "UNIX_MICROS");

    private StaticCompletions() {}

    /**
     * @return the keywords of all supported statement kinds, in kind order
     */
    public static Set<String> keywords() {
        Set<String> keywords = new LinkedHashSet<>();
        for (StatementKind kind : StatementKind.values()) {
            keywords.addAll(kind.getKeywords());
        }
        return keywords;
    }

    /**
     * @return the unmodifiable completions map of word to completion
     */
    public static Map<String, Completion> get() {
        return Holder.COMPLETIONS;
    }

    static Map<String, Completion> build() {
        Set<String> keywords = keywords();
        Map<String, Completion> completions = new LinkedHashMap<>();
        for (String keyword : keywords) {
            completions.put(keyword, new Completion(keyword, true));
        }
        for (List<String> functions : Arrays.asList(NUMERIC_FUNCTIONS, STRING_FUNCTIONS, DATE_FUNCTIONS)) {
            for (String f : functions) {
                completions.put(f, new Completion(f, keywords.contains(f)));
            }
        }
        return Collections.unmodifiableMap(completions);
    }

    // Initialized by the class loader on first access of get()
    static class Holder {
        static final Map<String, Completion> COMPLETIONS = build();
    }

}

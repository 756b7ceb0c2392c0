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

/**<p>
 * A character-by-character SQL scanner that tracks whether the cursor is in
 * normal code, inside a string literal or inside a comment.
 * </p>
 * <p>
 * Strings are quoted by ', " or `, optionally tripled(e.g. '''...'''), and a quote
 * preceded by a backslash is escaped. Comments are started by "# ", "--" or "/*".
 * An unterminated string or comment simply extends to the end of the text.
 * </p>
 *
 * @since 2021-03-02
 *
 */
public class SQLScanner {

    protected final CharSequence text;
    protected final int length;

    protected ScanMode mode = ScanMode.NORMAL;
    // next scan position
    protected int pos;
    // index of the char consumed by the last step
    protected int index = -1;

    public SQLScanner(CharSequence text) {
        this.text = text;
        this.length = text.length();
    }

    public static boolean isQuote(char c) {
        return (c == '\'' || c == '"' || c == '`');
    }

    /**
     * @param c the current char
     * @param next the char after it, or 0 at the end of text
     * @return true if the pair opens a comment: "# ", "--" or "/*"
     */
    public static boolean isCommentStart(char c, char next) {
        return ((c == '#' && next == ' ') || (c == '-' && next == '-') || (c == '/' && next == '*'));
    }

    public boolean hasNext() {
        return (this.pos < this.length);
    }

    /**Consume one scan step and update the scan mode.
     *
     * @return true if the consumed char is significant, i.e. scanned in normal mode
     * and not a quote or comment marker, otherwise false
     * @throws IllegalStateException if no more chars
     */
    public boolean next() throws IllegalStateException {
        if (!hasNext()) {
            throw new IllegalStateException("End of text");
        }

        final int i = this.index = this.pos++;
        final char c = this.text.charAt(i);
        final char prev = charAt(i - 1), next = charAt(i + 1);
        ScanMode mode = this.mode;

        switch (mode.getKind()) {
        case NORMAL:
            if (isQuote(c) && prev != '\\') {
                boolean triple = (i + 2 < this.length && next == c && charAt(i + 2) == c);
                if (triple) {
                    this.pos += 2;
                }
                this.mode = ScanMode.inString(c, triple);
                return false;
            }
            if (isCommentStart(c, next)) {
                // consume the marker pair
                ++this.pos;
                this.mode = ScanMode.inComment(c);
                return false;
            }
            return true;
        case COMMENT:
            if (mode.isLineComment()) {
                if (c == '\n') {
                    this.mode = ScanMode.NORMAL;
                }
            } else if (c == '*' && next == '/') {
                ++this.pos;
                this.mode = ScanMode.NORMAL;
            }
            return false;
        case STRING:
            if (c == mode.getQuote() && prev != '\\') {
                if (!mode.isTriple()) {
                    this.mode = ScanMode.NORMAL;
                } else if (i + 2 < this.length && next == c && charAt(i + 2) == c) {
                    this.pos += 2;
                    this.mode = ScanMode.NORMAL;
                }
                // a lone quote in a triple-quoted string is content
            }
            return false;
        default:
            throw new IllegalStateException("Unknown scan mode: " + mode);
        }
    }

    /**Scan forward to the next significant occurrence of the given char.
     *
     * @param c the char to find, e.g. the statement delimiter ';'
     * @return the index of the char, or -1 if the text ends before it
     */
    public int indexOf(char c) {
        while (hasNext()) {
            if (next() && this.text.charAt(this.index) == c) {
                return this.index;
            }
        }
        return -1;
    }

    protected char charAt(int i) {
        if (i < 0 || i >= this.length) {
            return 0;
        }
        return this.text.charAt(i);
    }

    public char current() throws IllegalStateException {
        if (this.index < 0) {
            throw new IllegalStateException("No char scanned");
        }
        return this.text.charAt(this.index);
    }

    public int index() {
        return this.index;
    }

    public int position() {
        return this.pos;
    }

    public ScanMode mode() {
        return this.mode;
    }

    public CharSequence text() {
        return this.text;
    }

}

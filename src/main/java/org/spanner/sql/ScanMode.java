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

import static java.lang.String.*;

/**Scan mode of the SQL scanner: normal code, inside a string literal
 * or inside a comment. Exactly one mode is active at any scan position.
 *
 * @since 2021-03-02
 *
 */
public final class ScanMode {

    public enum Kind {
        NORMAL, STRING, COMMENT
    }

    public static final ScanMode NORMAL = new ScanMode(Kind.NORMAL, (char)0, false);

    protected final Kind kind;
    // quote char in STRING mode, comment marker in COMMENT mode
    protected final char mark;
    protected final boolean triple;

    private ScanMode(Kind kind, char mark, boolean triple) {
        this.kind = kind;
        this.mark = mark;
        this.triple = triple;
    }

    public static ScanMode inString(char quote, boolean triple) {
        return new ScanMode(Kind.STRING, quote, triple);
    }

    /**
     * @param marker the first char of the comment opener: '#', '-' or '/'
     * @return the comment mode
     */
    public static ScanMode inComment(char marker) {
        switch (marker) {
        case '#':
        case '-':
        case '/':
            return new ScanMode(Kind.COMMENT, marker, false);
        default:
            throw new IllegalArgumentException("Unknown comment marker: " + marker);
        }
    }

    public Kind getKind() {
        return this.kind;
    }

    public boolean isNormal() {
        return (this.kind == Kind.NORMAL);
    }

    public boolean isString() {
        return (this.kind == Kind.STRING);
    }

    public boolean isComment() {
        return (this.kind == Kind.COMMENT);
    }

    public char getQuote() throws IllegalStateException {
        if (!isString()) {
            throw new IllegalStateException("Not in string: " + this);
        }
        return this.mark;
    }

    public boolean isTriple() {
        return this.triple;
    }

    public char getCommentMarker() throws IllegalStateException {
        if (!isComment()) {
            throw new IllegalStateException("Not in comment: " + this);
        }
        return this.mark;
    }

    /**
     * @return true if a newline ends this comment, false if '*&#47;' ends it
     */
    public boolean isLineComment() {
        return (isComment() && this.mark != '/');
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof ScanMode)) {
            return false;
        }

        ScanMode m = (ScanMode)o;
        return (m.kind == this.kind && m.mark == this.mark && m.triple == this.triple);
    }

    @Override
    public int hashCode() {
        return (this.kind.hashCode() * 31 + this.mark) * 31 + (this.triple? 1: 0);
    }

    @Override
    public String toString() {
        switch (this.kind) {
        case STRING:
            return format("InString[quote %s, triple %s]", this.mark, this.triple);
        case COMMENT:
            return format("InComment[marker %s]", this.mark);
        default:
            return "Normal";
        }
    }

}

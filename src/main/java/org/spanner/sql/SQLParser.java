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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**A simple SQL script parser that splits a script into statements and
 * classifies each of them.
 *
 * @since 2021-03-02
 *
 */
public class SQLParser implements Iterator<SQLStatement>, Iterable<SQLStatement> {

    protected final SQLSplitter splitter;
    protected String sql;

    private boolean nextCalled;

    public SQLParser(String script) {
        this.splitter = new SQLSplitter(script);
    }

    public static List<SQLStatement> parse(String script) {
        List<SQLStatement> statements = new ArrayList<>();
        for (SQLStatement s : new SQLParser(script)) {
            statements.add(s);
        }
        return statements;
    }

    @Override
    public Iterator<SQLStatement> iterator() {
        return this;
    }

    @Override
    public boolean hasNext() {
        if (this.sql == null) {
            this.sql = this.splitter.nextStatement();
        }
        return (this.sql != null);
    }

    @Override
    public SQLStatement next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }

        SQLStatement stmt = new SQLStatement(this.sql);
        this.sql = null;
        this.nextCalled = true;
        return stmt;
    }

    @Override
    public void remove() {
        if (this.nextCalled) {
            this.nextCalled = false;
            return;
        }

        throw new IllegalStateException();
    }

}

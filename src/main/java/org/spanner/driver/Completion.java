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

/**A static completion item of a keyword or function.
 *
 * @since 2021-03-06
 *
 */
public class Completion {

    public static final String DOC_KIND_MARKDOWN = "markdown";

    protected final String label;
    protected final String detail;
    protected final String filterText;
    protected final String sortText;
    protected final String documentationKind;
    protected final String documentation;

    public Completion(String word, boolean keyword) {
        this.label = word;
        this.detail = word;
        this.filterText = word;
        this.sortText = (keyword? "2:": "") + word;
        this.documentationKind = DOC_KIND_MARKDOWN;
        this.documentation = word;
    }

    public String getLabel() {
        return this.label;
    }

    public String getDetail() {
        return this.detail;
    }

    public String getFilterText() {
        return this.filterText;
    }

    public String getSortText() {
        return this.sortText;
    }

    public String getDocumentationKind() {
        return this.documentationKind;
    }

    public String getDocumentation() {
        return this.documentation;
    }

    @Override
    public String toString() {
        return this.label;
    }

}

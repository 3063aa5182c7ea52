/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.protofront.ast;

public class EditionNode extends CompositeNode {

    public final IdentNode keyword;
    public final RuneNode equals;
    public final StringValueNode edition;
    public final RuneNode semicolon;

    public EditionNode(IdentNode keyword, RuneNode equals, StringValueNode edition, RuneNode semicolon) {
        this.keyword = required(keyword, "EditionNode", "keyword");
        this.equals = equals;
        this.edition = edition;
        this.semicolon = semicolon;
    }

    public String value() {
        return edition == null ? "" : edition.asString();
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("keyword", keyword);
        visitor.field("equals", equals);
        visitor.field("edition", edition);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public EditionNode copy() {
        return new EditionNode(keyword.copy(), Nodes.copy(equals), Nodes.copy(edition), Nodes.copy(semicolon));
    }

}

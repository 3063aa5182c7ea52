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

/**
 * An option declaration, or one entry of a compact options list where the keyword is
 * absent and {@link #semicolon} holds the separating comma.
 */
public class OptionNode extends CompositeNode {

    public final IdentNode keyword;
    public final OptionNameNode name;
    public final RuneNode equals;
    public final ValueNode val;
    public final RuneNode semicolon;

    public OptionNode(IdentNode keyword, OptionNameNode name, RuneNode equals, ValueNode val, RuneNode semicolon) {
        if (keyword == null && name == null) {
            throw new AstConstructionException("OptionNode: keyword or name is required");
        }
        this.keyword = keyword;
        this.name = name;
        this.equals = equals;
        this.val = val;
        this.semicolon = semicolon;
    }

    public boolean isCompact() {
        return keyword == null;
    }

    public boolean isIncomplete() {
        return name == null || name.isIncomplete() || equals == null || val == null || val.isNone();
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("keyword", keyword);
        visitor.field("name", name);
        visitor.field("equals", equals);
        visitor.field("val", val);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public OptionNode copy() {
        return new OptionNode(Nodes.copy(keyword), Nodes.copy(name), Nodes.copy(equals), Nodes.copy(val), Nodes.copy(semicolon));
    }

}

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

public class ImportNode extends CompositeNode {

    public final IdentNode keyword;
    public final IdentNode publicKeyword;
    public final IdentNode weakKeyword;
    public final StringValueNode name;
    public final RuneNode semicolon;

    public ImportNode(IdentNode keyword, IdentNode publicKeyword, IdentNode weakKeyword, StringValueNode name, RuneNode semicolon) {
        this.keyword = required(keyword, "ImportNode", "keyword");
        if (publicKeyword != null && weakKeyword != null) {
            throw new AstConstructionException("ImportNode: cannot be both public and weak");
        }
        this.publicKeyword = publicKeyword;
        this.weakKeyword = weakKeyword;
        this.name = name;
        this.semicolon = semicolon;
    }

    public boolean isPublic() {
        return publicKeyword != null;
    }

    public boolean isWeak() {
        return weakKeyword != null;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("keyword", keyword);
        visitor.field("public", publicKeyword);
        visitor.field("weak", weakKeyword);
        visitor.field("name", name);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public ImportNode copy() {
        return new ImportNode(keyword.copy(), Nodes.copy(publicKeyword), Nodes.copy(weakKeyword), Nodes.copy(name), Nodes.copy(semicolon));
    }

}

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
 * A reference to a field: a plain name, an extension name in parentheses or brackets,
 * or an any-type reference like {@code [type.googleapis.com/foo.Bar]}.
 */
public class FieldReferenceNode extends CompositeNode {

    public final RuneNode open;
    public final IdentValueNode urlPrefix;
    public final RuneNode slash;
    public final IdentValueNode name;
    public final RuneNode comma;
    public final RuneNode close;
    public final RuneNode semicolon;

    public FieldReferenceNode(IdentValueNode name) {
        this(null, null, null, name, null, null, null);
    }

    public FieldReferenceNode(RuneNode open, IdentValueNode urlPrefix, RuneNode slash, IdentValueNode name,
                              RuneNode comma, RuneNode close, RuneNode semicolon) {
        if (open == null && (urlPrefix != null || slash != null || close != null)) {
            throw new AstConstructionException("FieldReferenceNode: enclosed parts require an open rune");
        }
        this.open = open;
        this.urlPrefix = urlPrefix;
        this.slash = slash;
        this.name = name;
        this.comma = comma;
        this.close = close;
        this.semicolon = semicolon;
    }

    public boolean isExtension() {
        return open != null && slash == null && name != null;
    }

    public boolean isAnyTypeReference() {
        return urlPrefix != null && slash != null && name != null;
    }

    public boolean isIncomplete() {
        if (open != null && open.rune == '(') {
            return name == null || close == null;
        }
        if (open != null && open.rune == '[' && slash != null) {
            return urlPrefix == null || name == null || close == null;
        }
        if (open != null) {
            return name == null || close == null;
        }
        return name == null;
    }

    public String asString() {
        String value = name == null ? "" : name.asIdentifier();
        if (open == null) {
            return value;
        }
        StringBuilder sb = new StringBuilder();
        sb.appendCodePoint(open.rune);
        if (isAnyTypeReference()) {
            sb.append(urlPrefix.asIdentifier()).append('/');
        }
        sb.append(value);
        if (close != null) {
            sb.appendCodePoint(close.rune);
        }
        return sb.toString();
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("open", open);
        visitor.field("urlPrefix", urlPrefix);
        visitor.field("slash", slash);
        visitor.field("name", name);
        visitor.field("comma", comma);
        visitor.field("close", close);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public FieldReferenceNode copy() {
        return new FieldReferenceNode(Nodes.copy(open), Nodes.copy(urlPrefix), Nodes.copy(slash), Nodes.copy(name),
                Nodes.copy(comma), Nodes.copy(close), Nodes.copy(semicolon));
    }

    @Override
    public String toString() {
        return asString();
    }

}

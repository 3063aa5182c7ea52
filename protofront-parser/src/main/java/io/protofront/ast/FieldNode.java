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
 * {@code optional string name = 1 [json_name = "n"];}. Label and options are optional,
 * everything after the type may be missing in an incomplete declaration.
 */
public class FieldNode extends CompositeNode {

    public final IdentNode label;
    public final IdentValueNode fieldType;
    public final IdentNode name;
    public final RuneNode equals;
    public final UintLiteralNode tag;
    public final CompactOptionsNode options;
    public final RuneNode semicolon;

    public FieldNode(IdentNode label, IdentValueNode fieldType, IdentNode name, RuneNode equals, UintLiteralNode tag,
                     CompactOptionsNode options, RuneNode semicolon) {
        this.label = label;
        this.fieldType = required(fieldType, "FieldNode", "fieldType");
        this.name = name;
        this.equals = equals;
        this.tag = tag;
        this.options = options;
        this.semicolon = semicolon;
    }

    public boolean isIncomplete() {
        return name == null || equals == null || tag == null;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("label", label);
        visitor.field("fieldType", fieldType);
        visitor.field("name", name);
        visitor.field("equals", equals);
        visitor.field("tag", tag);
        visitor.field("options", options);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public FieldNode copy() {
        return new FieldNode(Nodes.copy(label), fieldType.copy(), Nodes.copy(name), Nodes.copy(equals), Nodes.copy(tag),
                Nodes.copy(options), Nodes.copy(semicolon));
    }

}

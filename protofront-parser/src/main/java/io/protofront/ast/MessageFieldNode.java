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

public class MessageFieldNode extends CompositeNode {

    public final FieldReferenceNode name;
    public final RuneNode sep;
    public final ValueNode val;
    public final RuneNode semicolon;

    public MessageFieldNode(FieldReferenceNode name, RuneNode sep, ValueNode val, RuneNode semicolon) {
        this.name = required(name, "MessageFieldNode", "name");
        this.sep = sep;
        this.val = val;
        this.semicolon = semicolon;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("name", name);
        visitor.field("sep", sep);
        visitor.field("val", val);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public MessageFieldNode copy() {
        return new MessageFieldNode(name.copy(), Nodes.copy(sep), Nodes.copy(val), Nodes.copy(semicolon));
    }

}

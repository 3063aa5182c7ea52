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

public class EnumValueNode extends CompositeNode {

    public final IdentNode name;
    public final RuneNode equals;
    public final IntValueNode number;
    public final CompactOptionsNode options;
    public final RuneNode semicolon;

    public EnumValueNode(IdentNode name, RuneNode equals, IntValueNode number, CompactOptionsNode options, RuneNode semicolon) {
        this.name = required(name, "EnumValueNode", "name");
        this.equals = equals;
        this.number = number;
        this.options = options;
        this.semicolon = semicolon;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("name", name);
        visitor.field("equals", equals);
        visitor.field("number", number);
        visitor.field("options", options);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public EnumValueNode copy() {
        return new EnumValueNode(name.copy(), Nodes.copy(equals), Nodes.copy(number), Nodes.copy(options), Nodes.copy(semicolon));
    }

}

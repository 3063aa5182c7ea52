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

import java.util.ArrayList;
import java.util.List;

/**
 * {@code [a, b, c]} in a message literal. Values and commas are interleaved.
 */
public class ArrayLiteralNode extends CompositeNode {

    public final RuneNode openBracket;
    public final List<ArrayLiteralElement> elements;
    public final RuneNode closeBracket;
    public final RuneNode semicolon;

    public ArrayLiteralNode(RuneNode openBracket, List<ArrayLiteralElement> elements, RuneNode closeBracket, RuneNode semicolon) {
        this.openBracket = required(openBracket, "ArrayLiteralNode", "openBracket");
        this.elements = listOf(elements, "ArrayLiteralNode", "elements");
        this.closeBracket = closeBracket;
        this.semicolon = semicolon;
    }

    public List<ValueNode> values() {
        List<ValueNode> list = new ArrayList<>();
        for (ArrayLiteralElement element : elements) {
            if (element.value() != null) {
                list.add(element.value());
            }
        }
        return list;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("openBracket", openBracket);
        visitor.list("elements", elements);
        visitor.field("closeBracket", closeBracket);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public ArrayLiteralNode copy() {
        return new ArrayLiteralNode(openBracket.copy(), Nodes.copyAll(elements), Nodes.copy(closeBracket), Nodes.copy(semicolon));
    }

}

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

public class ExtensionRangeNode extends CompositeNode {

    public final IdentNode keyword;
    public final List<RangeElement> elements;
    public final CompactOptionsNode options;
    public final RuneNode semicolon;

    public ExtensionRangeNode(IdentNode keyword, List<RangeElement> elements, CompactOptionsNode options, RuneNode semicolon) {
        this.keyword = required(keyword, "ExtensionRangeNode", "keyword");
        this.elements = listOf(elements, "ExtensionRangeNode", "elements");
        this.options = options;
        this.semicolon = semicolon;
    }

    public List<RangeNode> ranges() {
        List<RangeNode> list = new ArrayList<>();
        for (RangeElement element : elements) {
            if (element.range() != null) {
                list.add(element.range());
            }
        }
        return list;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("keyword", keyword);
        visitor.list("elements", elements);
        visitor.field("options", options);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public ExtensionRangeNode copy() {
        return new ExtensionRangeNode(keyword.copy(), Nodes.copyAll(elements), Nodes.copy(options), Nodes.copy(semicolon));
    }

}

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

import java.util.List;

/**
 * {@code [deprecated = true, json_name = "foo"]} as used by fields, enum values and
 * extension ranges.
 */
public class CompactOptionsNode extends CompositeNode {

    public final RuneNode openBracket;
    public final List<OptionNode> options;
    public final RuneNode closeBracket;
    public final RuneNode semicolon;

    public CompactOptionsNode(RuneNode openBracket, List<OptionNode> options, RuneNode closeBracket, RuneNode semicolon) {
        this.openBracket = required(openBracket, "CompactOptionsNode", "openBracket");
        this.options = listOf(options, "CompactOptionsNode", "options");
        this.closeBracket = closeBracket;
        this.semicolon = semicolon;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("openBracket", openBracket);
        visitor.list("options", options);
        visitor.field("closeBracket", closeBracket);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public CompactOptionsNode copy() {
        return new CompactOptionsNode(openBracket.copy(), Nodes.copyAll(options), Nodes.copy(closeBracket), Nodes.copy(semicolon));
    }

}

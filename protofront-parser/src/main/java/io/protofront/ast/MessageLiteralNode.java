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
 * Text-format message value enclosed in {@code {}} or {@code <>}.
 */
public class MessageLiteralNode extends CompositeNode {

    public final RuneNode open;
    public final List<MessageFieldNode> elements;
    public final RuneNode close;
    public final RuneNode semicolon;

    public MessageLiteralNode(RuneNode open, List<MessageFieldNode> elements, RuneNode close, RuneNode semicolon) {
        this.open = required(open, "MessageLiteralNode", "open");
        if (open.rune != '{' && open.rune != '<') {
            throw new AstConstructionException("MessageLiteralNode: open must be '{' or '<'");
        }
        this.elements = listOf(elements, "MessageLiteralNode", "elements");
        this.close = close;
        this.semicolon = semicolon;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("open", open);
        visitor.list("elements", elements);
        visitor.field("close", close);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public MessageLiteralNode copy() {
        return new MessageLiteralNode(open.copy(), Nodes.copyAll(elements), Nodes.copy(close), Nodes.copy(semicolon));
    }

}

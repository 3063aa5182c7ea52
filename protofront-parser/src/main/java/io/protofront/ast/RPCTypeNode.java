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

public class RPCTypeNode extends CompositeNode {

    public final RuneNode openParen;
    public final IdentNode stream;
    public final IdentValueNode messageType;
    public final RuneNode closeParen;
    public final RuneNode semicolon;

    public RPCTypeNode(RuneNode openParen, IdentNode stream, IdentValueNode messageType, RuneNode closeParen, RuneNode semicolon) {
        this.openParen = required(openParen, "RPCTypeNode", "openParen");
        this.stream = stream;
        this.messageType = messageType;
        this.closeParen = closeParen;
        this.semicolon = semicolon;
    }

    public boolean isStream() {
        return stream != null;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("openParen", openParen);
        visitor.field("stream", stream);
        visitor.field("messageType", messageType);
        visitor.field("closeParen", closeParen);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public RPCTypeNode copy() {
        return new RPCTypeNode(openParen.copy(), Nodes.copy(stream), Nodes.copy(messageType), Nodes.copy(closeParen), Nodes.copy(semicolon));
    }

}

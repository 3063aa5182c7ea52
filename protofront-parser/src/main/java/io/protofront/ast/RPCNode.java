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

public class RPCNode extends CompositeNode {

    public final IdentNode keyword;
    public final IdentNode name;
    public final RPCTypeNode input;
    public final IdentNode returns;
    public final RPCTypeNode output;
    public final RuneNode openBrace;
    public final List<RPCElement> decls;
    public final RuneNode closeBrace;
    public final RuneNode semicolon;

    public RPCNode(IdentNode keyword, IdentNode name, RPCTypeNode input, IdentNode returns, RPCTypeNode output,
                   RuneNode openBrace, List<RPCElement> decls, RuneNode closeBrace, RuneNode semicolon) {
        this.keyword = required(keyword, "RPCNode", "keyword");
        this.name = name;
        this.input = input;
        this.returns = returns;
        this.output = output;
        this.openBrace = openBrace;
        this.decls = listOf(decls, "RPCNode", "decls");
        this.closeBrace = closeBrace;
        this.semicolon = semicolon;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("keyword", keyword);
        visitor.field("name", name);
        visitor.field("input", input);
        visitor.field("returns", returns);
        visitor.field("output", output);
        visitor.field("openBrace", openBrace);
        visitor.list("decls", decls);
        visitor.field("closeBrace", closeBrace);
        visitor.field("semicolon", semicolon);
    }

    @Override
    public RPCNode copy() {
        return new RPCNode(keyword.copy(), Nodes.copy(name), Nodes.copy(input), Nodes.copy(returns), Nodes.copy(output),
                Nodes.copy(openBrace), Nodes.copyAll(decls), Nodes.copy(closeBrace), Nodes.copy(semicolon));
    }

}

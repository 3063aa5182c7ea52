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
 * Base for nodes built from child nodes. The span is derived from the first and last
 * present child and computed once on demand.
 */
public abstract class CompositeNode implements Node {

    private Token start;
    private Token end;

    @Override
    public Token start() {
        if (start == null) {
            computeSpan();
        }
        return start;
    }

    @Override
    public Token end() {
        if (end == null) {
            computeSpan();
        }
        return end;
    }

    private void computeSpan() {
        Token[] span = new Token[2];
        forEachChild(new ChildVisitor() {
            @Override
            public void field(String name, Node child) {
                accept(child);
            }

            @Override
            public void list(String name, List<? extends Node> children) {
                for (Node child : children) {
                    accept(child);
                }
            }

            private void accept(Node child) {
                if (child == null) {
                    return;
                }
                Token childStart = child.start();
                if (!childStart.isValid()) {
                    return;
                }
                if (span[0] == null) {
                    span[0] = childStart;
                }
                span[1] = child.end();
            }
        });
        end = span[1] == null ? Token.ERROR : span[1];
        start = span[0] == null ? Token.ERROR : span[0];
    }

    protected static <T> T required(T value, String owner, String field) {
        if (value == null) {
            throw new AstConstructionException(owner + ": " + field + " is required");
        }
        return value;
    }

    protected static <T extends Node> List<T> listOf(List<T> values, String owner, String field) {
        if (values == null) {
            return List.of();
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new AstConstructionException(owner + ": " + field + "[" + i + "] is null");
            }
        }
        return List.copyOf(values);
    }

    protected static <T extends Node> List<T> nonEmpty(List<T> values, String owner, String field) {
        List<T> list = listOf(values, owner, field);
        if (list.isEmpty()) {
            throw new AstConstructionException(owner + ": " + field + " must have at least one element");
        }
        return list;
    }

}

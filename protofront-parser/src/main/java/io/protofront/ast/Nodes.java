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

public class Nodes {

    private Nodes() {
    }

    /**
     * Deep copy, null safe. The copy shares no mutable state with the original.
     */
    @SuppressWarnings("unchecked")
    public static <T extends Node> T copy(T node) {
        return node == null ? null : (T) node.copy();
    }

    public static <T extends Node> List<T> copyAll(List<T> nodes) {
        if (nodes == null) {
            return null;
        }
        List<T> list = new ArrayList<>(nodes.size());
        for (T node : nodes) {
            list.add(copy(node));
        }
        return list;
    }

    /**
     * Strips any number of union layers.
     */
    public static Node unwrap(Node node) {
        while (node instanceof WrapperNode) {
            node = ((WrapperNode) node).unwrap();
        }
        return node;
    }

    public static boolean isNone(Node node) {
        return unwrap(node) == NoneNode.INSTANCE;
    }

    /**
     * All terminals under the node in source order, the same sequence the lexer produced.
     */
    public static List<TerminalNode> terminals(Node node) {
        List<TerminalNode> list = new ArrayList<>();
        collect(node, list);
        return list;
    }

    private static void collect(Node node, List<TerminalNode> list) {
        if (node == null) {
            return;
        }
        if (node instanceof TerminalNode) {
            list.add((TerminalNode) node);
            return;
        }
        node.forEachChild(new ChildVisitor() {
            @Override
            public void field(String name, Node child) {
                collect(child, list);
            }

            @Override
            public void list(String name, List<? extends Node> children) {
                for (Node child : children) {
                    collect(child, list);
                }
            }
        });
    }

}

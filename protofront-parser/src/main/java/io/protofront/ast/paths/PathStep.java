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
package io.protofront.ast.paths;

import io.protofront.ast.Node;

import java.util.List;

/**
 * One step from a parent to a child. A list element is reached in two steps: a
 * {@link Kind#FIELD} step whose value is the list, then a {@link Kind#LIST_INDEX} step
 * whose value is the element.
 */
public final class PathStep {

    public enum Kind {
        ROOT, FIELD, LIST_INDEX
    }

    private final Kind kind;
    private final String name;
    private final int index;
    private final Node node;
    private final List<? extends Node> list;

    private PathStep(Kind kind, String name, int index, Node node, List<? extends Node> list) {
        this.kind = kind;
        this.name = name;
        this.index = index;
        this.node = node;
        this.list = list;
    }

    public static PathStep root(Node node) {
        return new PathStep(Kind.ROOT, null, -1, node, null);
    }

    public static PathStep field(String name, Node node) {
        return new PathStep(Kind.FIELD, name, -1, node, null);
    }

    public static PathStep listField(String name, List<? extends Node> list) {
        return new PathStep(Kind.FIELD, name, -1, null, list);
    }

    public static PathStep listIndex(int index, Node node) {
        return new PathStep(Kind.LIST_INDEX, null, index, node, null);
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public int index() {
        return index;
    }

    /**
     * @return the node reached by this step, null for a list field step
     */
    public Node node() {
        return node;
    }

    /**
     * @return the list reached by a list field step, else null
     */
    public List<? extends Node> list() {
        return list;
    }

    public boolean isList() {
        return list != null;
    }

    @Override
    public String toString() {
        switch (kind) {
            case ROOT:
                return "(" + node.getClass().getSimpleName() + ")";
            case FIELD:
                return "." + name;
            default:
                return "[" + index + "]";
        }
    }

}

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
import io.protofront.ast.WalkOption;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Records the path to the node currently being visited. Pass {@link #asWalkOptions()}
 * to a walk and query the tracker from the visit function.
 */
public class AncestorTracker {

    private final Deque<PathValues> stack = new ArrayDeque<>();

    public WalkOption[] asWalkOptions() {
        return new WalkOption[]{
                WalkOption.beforePath(values -> {
                    stack.push(values);
                    return true;
                }),
                WalkOption.afterPath(values -> {
                    if (stack.peek() == values) {
                        stack.pop();
                    }
                })
        };
    }

    public PathValues values() {
        return stack.isEmpty() ? PathValues.EMPTY : stack.peek();
    }

    /**
     * Concrete nodes from the walk root to the current node.
     */
    public List<Node> path() {
        return Paths.toNodes(values());
    }

    /**
     * @return the nearest concrete ancestor of the current node, null at the root
     */
    public Node parent() {
        List<Node> nodes = path();
        return nodes.size() < 2 ? null : nodes.get(nodes.size() - 2);
    }

}

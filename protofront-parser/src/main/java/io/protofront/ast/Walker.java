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

import io.protofront.ast.paths.PathStep;
import io.protofront.ast.paths.PathValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Depth-first traversal over the tree. Unions are passed through and list fields are
 * expanded, so hooks and the visit function only ever see concrete nodes. Both still
 * show up as steps in the path given to path hooks.
 */
public class Walker {

    static final Logger logger = LoggerFactory.getLogger(Walker.class);

    public static final int DEFAULT_DEPTH_LIMIT = Integer.parseInt(
            System.getProperty("protofront.walk.depthLimit", "32"));

    static class Settings {

        final List<Predicate<Node>> before = new ArrayList<>();
        final List<Consumer<Node>> after = new ArrayList<>();
        final List<Predicate<PathValues>> beforePath = new ArrayList<>();
        final List<Consumer<PathValues>> afterPath = new ArrayList<>();
        Token rangeStart;
        Token rangeEnd;
        Token intersects;
        int depthLimit = DEFAULT_DEPTH_LIMIT;

    }

    private final Settings settings;
    private final Predicate<Node> fn;
    private final List<PathStep> path = new ArrayList<>();
    private int depth;

    private Walker(Settings settings, Predicate<Node> fn) {
        this.settings = settings;
        this.fn = fn;
    }

    /**
     * Calls {@code fn} for the node and, while it returns true, for each descendant.
     */
    public static void inspect(Node node, Predicate<Node> fn, WalkOption... options) {
        if (node == null) {
            throw new IllegalArgumentException("node must not be null");
        }
        Settings settings = new Settings();
        for (WalkOption option : options) {
            option.configure(settings);
        }
        new Walker(settings, fn).visit(node, PathStep.root(node));
    }

    /**
     * Visits every concrete node, the same as {@code inspect} with a function that always
     * returns true.
     */
    public static void walk(Node node, WalkOption... options) {
        inspect(node, n -> true, options);
    }

    private void visit(Node node, PathStep step) {
        path.add(step);
        try {
            if (node instanceof WrapperNode) {
                WrapperNode wrapper = (WrapperNode) node;
                if (!wrapper.isNone()) {
                    Node value = wrapper.unwrap();
                    visit(value, PathStep.field(wrapper.variant(), value));
                }
                return;
            }
            if (depth >= settings.depthLimit) {
                logger.warn("depth limit {} reached, skipping subtree at {}", settings.depthLimit, PathValues.of(path));
                return;
            }
            visitConcrete(node);
        } finally {
            path.remove(path.size() - 1);
        }
    }

    private void visitConcrete(Node node) {
        PathValues values = settings.beforePath.isEmpty() && settings.afterPath.isEmpty() ? null : PathValues.of(path);
        depth++;
        try {
            if (!runBefore(node, values)) {
                return;
            }
            if (!inRange(node)) {
                return;
            }
            if (fn.test(node)) {
                visitChildren(node);
            }
        } finally {
            depth--;
            runAfter(node, values);
        }
    }

    private boolean runBefore(Node node, PathValues values) {
        for (Predicate<PathValues> hook : settings.beforePath) {
            if (!hook.test(values)) {
                return false;
            }
        }
        for (Predicate<Node> hook : settings.before) {
            if (!hook.test(node)) {
                return false;
            }
        }
        return true;
    }

    private void runAfter(Node node, PathValues values) {
        for (Consumer<Node> hook : settings.after) {
            hook.accept(node);
        }
        for (Consumer<PathValues> hook : settings.afterPath) {
            hook.accept(values);
        }
    }

    private boolean inRange(Node node) {
        Token start = node.start();
        Token end = node.end();
        if (settings.rangeStart != null) {
            if (start.isAfter(settings.rangeEnd) || end.isBefore(settings.rangeStart)) {
                return false;
            }
        }
        if (settings.intersects != null) {
            return !start.isAfter(settings.intersects) && !end.isBefore(settings.intersects);
        }
        return true;
    }

    private void visitChildren(Node node) {
        node.forEachChild(new ChildVisitor() {
            @Override
            public void field(String name, Node child) {
                if (child != null) {
                    visit(child, PathStep.field(name, child));
                }
            }

            @Override
            public void list(String name, List<? extends Node> children) {
                path.add(PathStep.listField(name, children));
                try {
                    for (int i = 0; i < children.size(); i++) {
                        Node child = children.get(i);
                        visit(child, PathStep.listIndex(i, child));
                    }
                } finally {
                    path.remove(path.size() - 1);
                }
            }
        });
    }

}

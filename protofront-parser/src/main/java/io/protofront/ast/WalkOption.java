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

import io.protofront.ast.paths.PathValues;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Hooks and filters for {@link Walker#inspect}. Hooks of the same kind compose, they
 * run in the order the options were given.
 */
public final class WalkOption {

    private final Consumer<Walker.Settings> configurer;

    private WalkOption(Consumer<Walker.Settings> configurer) {
        this.configurer = configurer;
    }

    void configure(Walker.Settings settings) {
        configurer.accept(settings);
    }

    /**
     * Runs before a node is visited. Returning false skips the node and its subtree, the
     * after hooks still run for it.
     */
    public static WalkOption before(Predicate<Node> fn) {
        return new WalkOption(s -> s.before.add(fn));
    }

    public static WalkOption after(Consumer<Node> fn) {
        return new WalkOption(s -> s.after.add(fn));
    }

    /**
     * Like {@link #before(Predicate)} but receives the full path, wrappers and list
     * fields included, ending at the node.
     */
    public static WalkOption beforePath(Predicate<PathValues> fn) {
        return new WalkOption(s -> s.beforePath.add(fn));
    }

    public static WalkOption afterPath(Consumer<PathValues> fn) {
        return new WalkOption(s -> s.afterPath.add(fn));
    }

    /**
     * Only visit nodes overlapping the inclusive token range.
     */
    public static WalkOption range(Token start, Token end) {
        return new WalkOption(s -> {
            s.rangeStart = start;
            s.rangeEnd = end;
        });
    }

    /**
     * Only visit nodes whose span contains the token.
     */
    public static WalkOption intersection(Token token) {
        return new WalkOption(s -> s.intersects = token);
    }

    public static WalkOption depthLimit(int limit) {
        return new WalkOption(s -> s.depthLimit = limit);
    }

}

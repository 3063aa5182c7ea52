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
import io.protofront.ast.WrapperNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Queries over walk paths. The suffix matchers find a chain of concrete node types
 * ending at the last node of a path, skipping unions and list fields in between.
 */
public class Paths {

    private Paths() {
    }

    public record Suffix2<T, U>(T t, int tIndex, U u, int uIndex) {
    }

    public record Suffix3<T, U, V>(T t, int tIndex, U u, int uIndex, V v, int vIndex) {
    }

    public record Suffix4<T, U, V, W>(T t, int tIndex, U u, int uIndex, V v, int vIndex, W w, int wIndex) {
    }

    public record Suffix5<T, U, V, W, X>(T t, int tIndex, U u, int uIndex, V v, int vIndex, W w, int wIndex,
                                         X x, int xIndex) {
    }

    public static boolean isConcrete(PathValues values, int index) {
        PathStep step = values.index(index);
        Node node = step.node();
        return node != null && !(node instanceof WrapperNode);
    }

    public static List<Node> toNodes(PathValues values) {
        List<Node> list = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            if (isConcrete(values, i)) {
                list.add(values.index(i).node());
            }
        }
        return list;
    }

    /**
     * @return the node at the step if it is of the given type, else null
     */
    public static <T> T nodeAt(PathValues values, int index, Class<T> type) {
        Node node = values.index(index).node();
        return type.isInstance(node) ? type.cast(node) : null;
    }

    public static <T, U> Optional<Suffix2<T, U>> suffix2(PathValues values, Class<T> t, Class<U> u) {
        if (values.size() < 2) {
            return Optional.empty();
        }
        Cursor c = new Cursor(values);
        U un = c.last(u);
        if (un == null) {
            return Optional.empty();
        }
        int ui = c.index;
        T tn = c.previous(t);
        if (tn == null) {
            return Optional.empty();
        }
        return Optional.of(new Suffix2<>(tn, c.index, un, ui));
    }

    public static <T, U, V> Optional<Suffix3<T, U, V>> suffix3(PathValues values, Class<T> t, Class<U> u, Class<V> v) {
        if (values.size() < 3) {
            return Optional.empty();
        }
        Cursor c = new Cursor(values);
        V vn = c.last(v);
        if (vn == null) {
            return Optional.empty();
        }
        int vi = c.index;
        U un = c.previous(u);
        if (un == null) {
            return Optional.empty();
        }
        int ui = c.index;
        T tn = c.previous(t);
        if (tn == null) {
            return Optional.empty();
        }
        return Optional.of(new Suffix3<>(tn, c.index, un, ui, vn, vi));
    }

    public static <T, U, V, W> Optional<Suffix4<T, U, V, W>> suffix4(PathValues values, Class<T> t, Class<U> u,
                                                                       Class<V> v, Class<W> w) {
        if (values.size() < 4) {
            return Optional.empty();
        }
        Cursor c = new Cursor(values);
        W wn = c.last(w);
        if (wn == null) {
            return Optional.empty();
        }
        int wi = c.index;
        V vn = c.previous(v);
        if (vn == null) {
            return Optional.empty();
        }
        int vi = c.index;
        U un = c.previous(u);
        if (un == null) {
            return Optional.empty();
        }
        int ui = c.index;
        T tn = c.previous(t);
        if (tn == null) {
            return Optional.empty();
        }
        return Optional.of(new Suffix4<>(tn, c.index, un, ui, vn, vi, wn, wi));
    }

    public static <T, U, V, W, X> Optional<Suffix5<T, U, V, W, X>> suffix5(PathValues values, Class<T> t, Class<U> u,
                                                                             Class<V> v, Class<W> w, Class<X> x) {
        if (values.size() < 5) {
            return Optional.empty();
        }
        Cursor c = new Cursor(values);
        X xn = c.last(x);
        if (xn == null) {
            return Optional.empty();
        }
        int xi = c.index;
        W wn = c.previous(w);
        if (wn == null) {
            return Optional.empty();
        }
        int wi = c.index;
        V vn = c.previous(v);
        if (vn == null) {
            return Optional.empty();
        }
        int vi = c.index;
        U un = c.previous(u);
        if (un == null) {
            return Optional.empty();
        }
        int ui = c.index;
        T tn = c.previous(t);
        if (tn == null) {
            return Optional.empty();
        }
        return Optional.of(new Suffix5<>(tn, c.index, un, ui, vn, vi, wn, wi, xn, xi));
    }

    /**
     * Walks a path backwards. {@link #index} is left on the step of the last match.
     */
    static class Cursor {

        final PathValues values;
        int index;

        Cursor(PathValues values) {
            this.values = values;
            this.index = values.size() - 1;
            if (values.index(0).kind() != PathStep.Kind.ROOT) {
                throw malformed("first step is not a root");
            }
        }

        <T> T last(Class<T> type) {
            PathStep step = values.index(index);
            if (step.node() == null) {
                throw malformed("path ends at a list field");
            }
            return type.isInstance(step.node()) ? type.cast(step.node()) : null;
        }

        <T> T previous(Class<T> type) {
            index--;
            while (index >= 0) {
                PathStep step = values.index(index);
                if (step.kind() == PathStep.Kind.ROOT && index != 0) {
                    throw malformed("root step at " + index);
                }
                if (step.kind() == PathStep.Kind.LIST_INDEX) {
                    PathStep parent = index > 0 ? values.index(index - 1) : null;
                    if (parent == null || !parent.isList()) {
                        throw malformed("list index without a list field at " + index);
                    }
                }
                if (step.isList()) {
                    index--;
                    continue;
                }
                Node node = step.node();
                if (type.isInstance(node)) {
                    return type.cast(node);
                }
                if (node instanceof WrapperNode) {
                    index--;
                    continue;
                }
                return null;
            }
            // ran out of ancestors
            return null;
        }

        IllegalStateException malformed(String reason) {
            return new IllegalStateException("malformed path: " + reason + ": " + values);
        }

    }

}

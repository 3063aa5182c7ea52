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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of the steps from the walk root to a node.
 */
public final class PathValues {

    public static final PathValues EMPTY = new PathValues(Collections.emptyList());

    private final List<PathStep> steps;

    private PathValues(List<PathStep> steps) {
        this.steps = steps;
    }

    public static PathValues of(List<PathStep> steps) {
        return new PathValues(List.copyOf(steps));
    }

    public List<PathStep> steps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * Negative indices count from the end, -1 is the last step.
     */
    public PathStep index(int i) {
        int pos = i < 0 ? steps.size() + i : i;
        if (pos < 0 || pos >= steps.size()) {
            throw new IndexOutOfBoundsException("path index " + i + " out of range for size " + steps.size());
        }
        return steps.get(pos);
    }

    /**
     * Sub-path from start (inclusive) to end (exclusive). When start is not zero the first
     * step is rewritten as a root step on the node found there.
     */
    public PathValues slice(int start, int end) {
        if (start == 0) {
            return new PathValues(steps.subList(0, end));
        }
        PathStep first = steps.get(start);
        if (first.node() == null) {
            throw new IllegalArgumentException("cannot slice a path at a list field step");
        }
        List<PathStep> list = new ArrayList<>(end - start);
        list.add(PathStep.root(first.node()));
        list.addAll(steps.subList(start + 1, end));
        return new PathValues(Collections.unmodifiableList(list));
    }

    public PathValues append(PathStep step) {
        List<PathStep> list = new ArrayList<>(steps);
        list.add(step);
        return new PathValues(Collections.unmodifiableList(list));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (PathStep step : steps) {
            sb.append(step);
        }
        return sb.toString();
    }

}

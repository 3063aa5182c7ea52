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

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A contiguous run of rows in the comment table of a {@link FileInfo}.
 */
public class Comments implements Iterable<Comment> {

    public static final Comments EMPTY = new Comments(null, 0, 0, List.of());

    private final FileInfo fileInfo;
    private final int first;
    private final int num;
    private final List<Integer> virtual;

    Comments(FileInfo fileInfo, int first, int num, List<Integer> virtual) {
        this.fileInfo = fileInfo;
        this.first = first;
        this.num = num;
        this.virtual = virtual;
    }

    public int size() {
        return num;
    }

    public boolean isEmpty() {
        return num == 0;
    }

    public Comment get(int i) {
        if (i < 0 || i >= num) {
            throw new IndexOutOfBoundsException("index " + i + " out of range (size = " + num + ")");
        }
        return new Comment(fileInfo, first + i, virtual.contains(i));
    }

    @Override
    public Iterator<Comment> iterator() {
        return new Iterator<>() {

            int next = 0;

            @Override
            public boolean hasNext() {
                return next < num;
            }

            @Override
            public Comment next() {
                if (next >= num) {
                    throw new NoSuchElementException();
                }
                return get(next++);
            }
        };
    }

}

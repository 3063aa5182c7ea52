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
package io.protofront.common;

import java.nio.file.Path;

/**
 * A named source of bytes, either in memory or on the file system.
 */
public interface Resource {

    /**
     * The name diagnostics and the file info report, a relative path where there is one.
     */
    String getName();

    byte[] getBytes();

    boolean isFile();

    /**
     * @return the file backing this resource, null if it is in memory
     */
    Path getPath();

    default String getText() {
        return FileUtils.toString(getBytes());
    }

    static Resource text(String name, String text) {
        return new MemoryResource(name, FileUtils.toBytes(text));
    }

    static Resource bytes(String name, byte[] bytes) {
        return new MemoryResource(name, bytes);
    }

    static Resource path(Path path) {
        return new PathResource(path);
    }

    static Resource path(Path path, Path root) {
        return new PathResource(path, root);
    }

}

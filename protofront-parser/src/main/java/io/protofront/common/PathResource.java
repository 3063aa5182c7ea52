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

public class PathResource implements Resource {

    private final Path path;
    private final Path root;
    private final String name;

    // lazy
    private byte[] bytes;

    public PathResource(Path path) {
        this(path, FileUtils.WORKING_DIR.toPath());
    }

    /**
     * @param root the path names are computed relative to
     */
    public PathResource(Path path, Path root) {
        this.path = path.toAbsolutePath().normalize();
        this.root = root != null ? root.toAbsolutePath().normalize() : FileUtils.WORKING_DIR.toPath();
        this.name = computeName();
    }

    private String computeName() {
        // cross-drive on windows cannot be relativized
        if (root.getRoot() != null && path.getRoot() != null && !root.getRoot().equals(path.getRoot())) {
            return path.toString().replace('\\', '/');
        }
        if (!path.startsWith(root)) {
            return path.toString().replace('\\', '/');
        }
        return root.relativize(path).toString().replace('\\', '/');
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public synchronized byte[] getBytes() {
        if (bytes == null) {
            bytes = FileUtils.toBytes(path);
        }
        return bytes;
    }

    @Override
    public boolean isFile() {
        return true;
    }

    @Override
    public Path getPath() {
        return path;
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public String toString() {
        return name;
    }

}

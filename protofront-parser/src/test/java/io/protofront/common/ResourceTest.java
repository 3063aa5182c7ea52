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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceTest {

    @Test
    void testMemoryResource() {
        Resource resource = Resource.text("foo/bar.proto", "message Foo {}");
        assertEquals("foo/bar.proto", resource.getName());
        assertEquals("message Foo {}", resource.getText());
        assertArrayEquals("message Foo {}".getBytes(StandardCharsets.UTF_8), resource.getBytes());
        assertFalse(resource.isFile());
        assertNull(resource.getPath());
        Resource unnamed = Resource.bytes(null, null);
        assertEquals("", unnamed.getName());
        assertEquals(0, unnamed.getBytes().length);
        assertEquals("(in memory)", unnamed.toString());
    }

    @Test
    void testPathResource(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sub/a.proto");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "syntax = \"proto3\";");
        Resource resource = Resource.path(file, dir);
        assertTrue(resource.isFile());
        assertEquals("sub/a.proto", resource.getName());
        assertEquals("syntax = \"proto3\";", resource.getText());
        assertEquals(file.toAbsolutePath().normalize(), resource.getPath());
        // outside the root the absolute path is used
        Resource outside = Resource.path(file, dir.resolve("other"));
        assertEquals(file.toAbsolutePath().normalize().toString().replace('\\', '/'), outside.getName());
    }

    @Test
    void testFindFiles(@TempDir Path dir) throws IOException {
        Files.createDirectories(dir.resolve("b"));
        Files.writeString(dir.resolve("b/z.proto"), "");
        Files.writeString(dir.resolve("a.proto"), "");
        Files.writeString(dir.resolve("a.txt"), "");
        Files.createDirectories(dir.resolve("dir.proto"));
        List<Path> files = FileUtils.findFiles(dir, "proto");
        assertEquals(List.of(dir.resolve("a.proto"), dir.resolve("b/z.proto")), files);
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        Resource resource = Resource.path(dir.resolve("missing.proto"), dir);
        assertThrows(UncheckedIOException.class, resource::getBytes);
    }

}

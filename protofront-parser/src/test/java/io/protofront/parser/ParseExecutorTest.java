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
package io.protofront.parser;

import io.protofront.ast.AstJson;
import io.protofront.ast.AstPrinter;
import io.protofront.common.Resource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class ParseExecutorTest {

    private static String source(int i) {
        StringBuilder sb = new StringBuilder();
        sb.append("syntax = \"proto3\";\n");
        sb.append("package pkg").append(i).append(";\n");
        for (int j = 0; j < 20; j++) {
            sb.append("// message ").append(j).append('\n');
            sb.append("message M").append(j).append(" {\n");
            sb.append("  string name = 1;\n");
            sb.append("  repeated int64 values = 2 [packed = true];\n");
            sb.append("  map<string, M").append(j).append("> children = 3;\n");
            sb.append("}\n");
        }
        if (i % 5 == 0) {
            sb.append("message {\n");
        }
        return sb.toString();
    }

    private static List<Resource> resources(int count) {
        List<Resource> list = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            list.add(Resource.text("file" + i + ".proto", source(i)));
        }
        return list;
    }

    @Test
    void testConcurrentMatchesSequential() {
        List<Resource> resources = resources(40);
        ParsedFiles concurrent = new ParseExecutor(8, ParseConfig.defaults(), ErrorReporter::collecting).parseAll(resources);
        assertEquals(40, concurrent.size());
        for (Resource resource : resources) {
            ParseResult sequential = Parser.parse(resource, new ErrorHandler(), ParseConfig.defaults());
            ParseResult result = concurrent.get(resource.getName());
            assertEquals(resource.getName(), result.getName());
            assertEquals(AstJson.toJson(sequential.ast()), AstJson.toJson(result.ast()));
            assertEquals(resource.getText(), AstPrinter.print(result.ast()));
            assertEquals(sequential.isOk(), result.isOk());
        }
        assertEquals(8, concurrent.getFailed().size());
        assertFalse(concurrent.isOk());
        assertEquals("ParsedFiles{count=40, failed=8}", concurrent.toString());
    }

    @Test
    void testResultsKeepSubmissionOrder() {
        List<Resource> resources = resources(10);
        ParsedFiles parsed = new ParseExecutor(3, ParseConfig.defaults(), ErrorReporter::collecting).parseAll(resources);
        List<String> names = new ArrayList<>();
        for (ParseResult result : parsed.getResults()) {
            names.add(result.getName());
        }
        List<String> expected = new ArrayList<>();
        for (Resource resource : resources) {
            expected.add(resource.getName());
        }
        assertEquals(expected, names);
    }

    @Test
    void testReporterPerFile() {
        AtomicInteger created = new AtomicInteger();
        ParseExecutor executor = new ParseExecutor(4, ParseConfig.defaults(), () -> {
            created.incrementAndGet();
            return ErrorReporter.failFast();
        });
        ParsedFiles parsed = executor.parseAll(resources(10));
        assertEquals(10, created.get());
        ParseResult failed = parsed.get("file5.proto");
        assertNotNull(failed.error());
        assertEquals(1, failed.error().getErrors().size());
        assertTrue(parsed.get("file1.proto").isOk());
    }

    @Test
    void testEmptyInput() {
        ParsedFiles parsed = new ParseExecutor().parseAll(List.of());
        assertEquals(0, parsed.size());
        assertTrue(parsed.isOk());
    }

    @Test
    void testInvalidParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new ParseExecutor(0, ParseConfig.defaults(), ErrorReporter::collecting));
        assertTrue(new ParseExecutor().getMaxParallelism() >= 1);
    }

    @Test
    void testParallelismProperty() {
        String previous = System.getProperty(ParseExecutor.PARALLELISM_PROPERTY);
        try {
            System.setProperty(ParseExecutor.PARALLELISM_PROPERTY, "3");
            assertEquals(3, ParseExecutor.defaultParallelism());
            System.setProperty(ParseExecutor.PARALLELISM_PROPERTY, "lots");
            assertEquals(Runtime.getRuntime().availableProcessors(), ParseExecutor.defaultParallelism());
        } finally {
            if (previous == null) {
                System.clearProperty(ParseExecutor.PARALLELISM_PROPERTY);
            } else {
                System.setProperty(ParseExecutor.PARALLELISM_PROPERTY, previous);
            }
        }
    }

    @Test
    void testParseDirectory(@TempDir Path dir) throws IOException {
        Files.createDirectories(dir.resolve("nested"));
        Files.writeString(dir.resolve("a.proto"), "syntax = \"proto3\";\nmessage A {}\n");
        Files.writeString(dir.resolve("nested/b.proto"), "syntax = \"proto3\";\nmessage B { A a = 1; }\n");
        Files.writeString(dir.resolve("readme.txt"), "not a proto file");
        ParsedFiles parsed = new ParseExecutor(2, ParseConfig.defaults(), ErrorReporter::collecting).parseDirectory(dir);
        assertEquals(2, parsed.size());
        assertTrue(parsed.isOk());
        ParseResult b = parsed.get("nested/b.proto");
        assertNotNull(b);
        assertEquals("nested/b.proto", b.ast().getName());
    }

    private static Resource resource(String name, Supplier<byte[]> bytes) {
        return new Resource() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public byte[] getBytes() {
                return bytes.get();
            }

            @Override
            public boolean isFile() {
                return false;
            }

            @Override
            public Path getPath() {
                return null;
            }
        };
    }

    @Test
    void testFailureDoesNotWaitForOtherFiles() {
        CountDownLatch never = new CountDownLatch(1);
        Resource broken = resource("broken.proto", () -> {
            throw new IllegalStateException("cannot read broken.proto");
        });
        Resource stuck = resource("stuck.proto", () -> {
            try {
                never.await();
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
            return new byte[0];
        });
        ParseExecutor executor = new ParseExecutor(2, ParseConfig.defaults(), ErrorReporter::collecting);
        try {
            IllegalStateException e = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> assertThrows(IllegalStateException.class, () -> executor.parseAll(List.of(broken, stuck))));
            assertEquals("cannot read broken.proto", e.getMessage());
        } finally {
            never.countDown();
        }
    }

}

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

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static io.protofront.parser.ProtoTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class PragmaTest {

    @Test
    void testPragmasBeforeSyntax() {
        FileNode file = parseOk("//pragma: mode strict\n// not a pragma\n//pragma:flag\n//pragma:   \nsyntax = \"proto3\";\n");
        assertEquals(Map.of("mode", "strict", "flag", ""), file.pragmas());
        assertEquals(Optional.of("strict"), file.pragma("mode"));
        assertEquals(Optional.empty(), file.pragma("missing"));
        assertThrows(UnsupportedOperationException.class, () -> file.pragmas().put("x", "y"));
    }

    @Test
    void testPragmasBeforeEdition() {
        FileNode file = parseOk("//pragma: lint off  \nedition = \"2023\";\n");
        assertEquals(Map.of("lint", "off"), file.pragmas());
        assertEquals("editions", file.syntaxValue());
    }

    @Test
    void testLaterPragmaWins() {
        FileNode file = parseOk("//pragma: mode a\n//pragma: mode b\nsyntax = \"proto2\";");
        assertEquals(Optional.of("b"), file.pragma("mode"));
    }

    @Test
    void testPragmasElsewhereIgnored() {
        FileNode file = parseOk("syntax = \"proto3\";\n//pragma: mode strict\nmessage Foo {}\n");
        assertTrue(file.pragmas().isEmpty());
        // without a syntax declaration there is nothing to attach pragmas to
        file = parseOk("//pragma: mode strict\nmessage Foo {}\n");
        assertTrue(file.pragmas().isEmpty());
        assertEquals("", file.syntaxValue());
    }

    @Test
    void testBlockCommentIsNotPragma() {
        FileNode file = parseOk("/*pragma: mode strict*/\nsyntax = \"proto3\";");
        assertTrue(file.pragmas().isEmpty());
    }

}

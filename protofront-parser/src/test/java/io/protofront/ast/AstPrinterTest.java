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

import io.protofront.parser.ErrorHandler;
import io.protofront.parser.ParseConfig;
import io.protofront.parser.ParseResult;
import io.protofront.parser.Parser;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static io.protofront.parser.ProtoTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class AstPrinterTest {

    @Test
    void testWellFormed() {
        assertRoundTrip("");
        assertRoundTrip("\n\n");
        assertRoundTrip("syntax = \"proto3\";\n\npackage foo.bar;\n\nimport public \"other.proto\";\n"
                + "option java_package = \"com.example\";\n\n"
                + "message Foo {\n"
                + "  // the id\n"
                + "  int64 id = 1 [deprecated = true, (custom).value = \"x\"];\n"
                + "  map<string, Foo> children = 2;\n"
                + "  oneof kind {\n"
                + "    string name = 3;\n"
                + "    int32 number = 4;\n"
                + "  }\n"
                + "  reserved 5 to 10, 15;\n"
                + "  reserved \"old\";\n"
                + "}\n\n"
                + "enum State { UNKNOWN = 0; ON = 1; OFF = -1 [(x) = 1e3]; }\n"
                + "service Api { rpc Get(stream Foo) returns (.foo.bar.Foo) { option idempotency_level = NO_SIDE_EFFECTS; } }\n");
    }

    @Test
    void testProto2() {
        assertRoundTrip("syntax = 'proto2';\n"
                + "message Foo {\n"
                + "  required group Result = 1 { optional string url = 2; }\n"
                + "  extensions 100 to max;\n"
                + "  optional float f = 3 [default = inf];\n"
                + "}\n"
                + "extend Foo { optional int32 bar = 100; }\n");
    }

    @Test
    void testWhitespaceVariants() {
        assertRoundTrip("syntax = \"proto3\";\r\nmessage Foo {\r\n  int32 a = 1;\r\n}\r\n");
        assertRoundTrip("\tmessage\tFoo\t{\f}\u000B");
        assertRoundTrip("message Foo {}\n\n   ");
    }

    @Test
    void testUnicode() {
        assertRoundTrip("// héllo 😀\nmessage Foo { string s = 1 [default = \"é😀\"]; }\n");
        assertRoundTrip("/* 日本語\n */ message Foo {}");
        assertRoundTrip("\uFEFFsyntax = \"proto3\";\n");
    }

    @Test
    void testMissingPunctuation() {
        assertRoundTrip("message Foo {\n  int32 a = 1\n  string b = 2\n}\n");
        assertRoundTrip("enum E { A = 1 B = 2 }");
        assertRoundTrip("option (a) = { x: 1 y: [1, 2] z { } }\n");
        assertRoundTrip("import \"a.proto\"\nimport \"b.proto\"\n");
        assertRoundTrip("service S { rpc M(A) returns (B) }");
    }

    @Test
    void testMalformed() {
        assertRoundTrip("message {");
        assertRoundTrip("message Foo { int32 = ; }");
        assertRoundTrip("}}}");
        assertRoundTrip("@#$ message Foo {}");
        assertRoundTrip("\"unterminated");
        assertRoundTrip("message Foo {} /* never closed");
        assertRoundTrip("option (a.b = 1;");
        assertRoundTrip("message Foo { int32 a = 0xZZ; string s = \"\\q\"; }");
        assertRoundTrip("message Foo { message Bar { message Baz {");
        assertRoundTrip("syntax = ;\nmessage = Foo {} }\nenum { = }");
        assertRoundTrip("service S { rpc (A) returns B; }");
        assertRoundTrip("message Foo { map<string, > m = 1; optional = 2; }");
        assertRoundTrip("extend ");
        assertRoundTrip("import");
        assertRoundTrip("package");
    }

    @Test
    void testPrintToStream() {
        String text = "message Foo { int32 a = 1; } // é\n";
        ParseResult result = parse(text);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        AstPrinter.print(result.ast(), out);
        assertEquals(text, out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testPrintCopy() {
        String text = "message Foo {\n  int32 a = 1 // trailing\n}\n";
        FileNode file = parseOk(text);
        assertEquals(text, AstPrinter.print(file.copy()));
    }

    private static byte[] printBytes(byte[] data) {
        ParseResult result = Parser.parse("test.proto", data, new ErrorHandler(), ParseConfig.defaults());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        AstPrinter.print(result.ast(), out);
        return out.toByteArray();
    }

    @Test
    void testNonUtf8BytesKept() {
        byte[] latin1 = "// caf\u00e9\nsyntax = \"proto3\";\nmessage M {}\n".getBytes(StandardCharsets.ISO_8859_1);
        ParseResult result = Parser.parse("test.proto", latin1, new ErrorHandler(), ParseConfig.defaults());
        assertNull(result.error());
        assertArrayEquals(latin1, printBytes(latin1));
        byte[] stray = {'m', 'e', 's', 's', 'a', 'g', 'e', ' ', (byte) 0xff, ' ', 'M', ' ', '{', '}', (byte) 0xc3};
        assertArrayEquals(stray, printBytes(stray));
        // the String form decodes the same bytes
        assertEquals(new String(latin1, StandardCharsets.UTF_8), AstPrinter.print(result.ast()));
        assertFalse(Arrays.equals(latin1, AstPrinter.print(result.ast()).getBytes(StandardCharsets.UTF_8)));
    }

}

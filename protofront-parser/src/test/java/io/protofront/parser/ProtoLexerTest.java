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

import io.protofront.ast.CompoundIdentNode;
import io.protofront.ast.OptionNameNode;
import io.protofront.ast.RuneNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.protofront.parser.ProtoTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ProtoLexerTest {

    private static List<SymbolType> types(List<Symbol> symbols) {
        List<SymbolType> list = new ArrayList<>();
        for (Symbol sym : symbols) {
            list.add(sym.type);
        }
        return list;
    }

    /**
     * Runes as text, with a leading {@code ~} for inserted ones, other symbols by type.
     */
    private static List<String> describe(List<Symbol> symbols) {
        List<String> list = new ArrayList<>();
        for (Symbol sym : symbols) {
            if (sym.type == SymbolType.RUNE) {
                RuneNode rune = sym.rune();
                list.add((rune.virtual ? "~" : "") + (char) rune.rune);
            } else if (sym.type == SymbolType.IDENT) {
                list.add(sym.ident().val);
            } else {
                list.add(sym.type.name());
            }
        }
        return list;
    }

    private static String firstError(String text) {
        ErrorHandler handler = new ErrorHandler();
        lex(text, handler);
        assertFalse(handler.getErrors().isEmpty(), "expected an error for: " + text);
        return handler.getErrors().get(0).message;
    }

    @Test
    void testSimpleTokens() {
        List<Symbol> symbols = lex("message Foo { }");
        assertEquals(List.of("message", "Foo", "{", "}", "~;", "EOF"), describe(symbols));
        assertTrue(symbols.get(0).ident().keyword);
        assertFalse(symbols.get(1).ident().keyword);
    }

    @Test
    void testVirtualSemicolonAfterBrace() {
        assertEquals(List.of("}", "~;", "foo", "EOF"), describe(lex("}\nfoo")));
        assertEquals(List.of("}", ";", "EOF"), describe(lex("} ;")));
        assertEquals(List.of(">", "~;", "foo", "EOF"), describe(lex("> foo")));
    }

    @Test
    void testVirtualCommaBeforeBracket() {
        assertEquals(List.of("[", "INT_LIT", ",", "INT_LIT", "~,", "]", "~;", "EOF"), describe(lex("[1, 2]")));
        assertEquals(List.of("[", "INT_LIT", ",", "]", "~;", "EOF"), describe(lex("[1,]")));
        assertEquals(List.of("[", "]", "~;", "EOF"), describe(lex("[]")));
    }

    @Test
    void testVirtualSemicolonAtNewline() {
        assertEquals(List.of("a", "=", "INT_LIT", "~;", "b", "EOF"), describe(lex("a = 1\nb")));
        assertEquals(List.of("a", "=", "STRING_LIT", "~;", "b", "EOF"), describe(lex("a = \"x\"\nb")));
        // a semicolon already there
        assertEquals(List.of("a", "=", "INT_LIT", ";", "b", "EOF"), describe(lex("a = 1;\nb")));
    }

    @Test
    void testCompoundIdentifiers() {
        List<Symbol> symbols = lex("foo.bar.Baz");
        assertEquals(List.of(SymbolType.QUALIFIED_IDENT, SymbolType.EOF), types(symbols));
        assertEquals("foo.bar.Baz", ((CompoundIdentNode) symbols.get(0).node).asIdentifier());
        symbols = lex(".foo.Bar");
        assertEquals(List.of(SymbolType.FULLY_QUALIFIED_IDENT, SymbolType.EOF), types(symbols));
        assertTrue(((CompoundIdentNode) symbols.get(0).node).isFullyQualified());
        // a label keeps its distance from a fully qualified type
        symbols = lex("optional .foo.Bar");
        assertEquals(List.of(SymbolType.IDENT, SymbolType.FULLY_QUALIFIED_IDENT, SymbolType.EOF), types(symbols));
    }

    @Test
    void testExtensionIdentifiers() {
        List<Symbol> symbols = lex("(foo.bar).baz");
        assertEquals(List.of(SymbolType.EXTENSION_IDENT, SymbolType.EOF), types(symbols));
        OptionNameNode name = symbols.get(0).optionName();
        assertEquals("(foo.bar).baz", name.asString());
        assertEquals(1, name.fieldReferences().stream().filter(r -> r.isExtension()).count());
    }

    @Test
    void testExtensionIdentifierErrors() {
        assertEquals("unexpected ')'", firstError("a )"));
        assertEquals("unexpected '(' in extension identifier", firstError("((a"));
    }

    @Test
    void testNumbers() {
        List<Symbol> symbols = lex("0x1F 017 42 1.5e3 .5 18446744073709551615 18446744073709551616");
        assertEquals(31, symbols.get(0).uint().val);
        assertEquals(15, symbols.get(1).uint().val);
        assertEquals("017", symbols.get(1).uint().raw);
        assertEquals(42, symbols.get(2).uint().val);
        assertEquals(1500.0, symbols.get(3).floatLit().val);
        assertEquals(0.5, symbols.get(4).floatLit().val);
        assertEquals("18446744073709551615", symbols.get(5).uint().asUnsignedString());
        // too big for 64 bits
        assertEquals(SymbolType.FLOAT_LIT, symbols.get(6).type);
    }

    @Test
    void testNumberErrors() {
        assertEquals("invalid syntax in hexadecimal integer value: G1", firstError("0xG1"));
        assertEquals("invalid syntax in octal integer value: 09", firstError("09"));
        assertEquals("value out of range for hexadecimal integer: FFFFFFFFFFFFFFFFF", firstError("0xFFFFFFFFFFFFFFFFF"));
        assertEquals("invalid syntax in float value: 1e", firstError("1e"));
    }

    @Test
    void testStrings() {
        assertEquals("a\tb", lex("'a\\tb'").get(0).stringValue().asString());
        List<Symbol> symbols = lex("\"\\x41\\101\\u0042\\U0001F600\"");
        assertEquals("AAB\uD83D\uDE00", symbols.get(0).stringValue().asString());
        assertNotNull(symbols.get(0).stringValue().stringLiteral());
    }

    @Test
    void testCompoundString() {
        List<Symbol> symbols = lex("\"ab\" 'cd'\n\"ef\"");
        assertEquals(SymbolType.STRING_LIT, symbols.get(0).type);
        assertEquals("abcdef", symbols.get(0).stringValue().asString());
        assertEquals(3, symbols.get(0).stringValue().compoundStringLiteral().elements.size());
    }

    @Test
    void testStringErrors() {
        assertEquals("unexpected EOF", firstError("\"abc"));
        assertEquals("encountered end-of-line before end of string literal", firstError("\"abc\n\""));
        assertEquals("invalid escape sequence: \\q", firstError("\"\\q\""));
        assertEquals("invalid hex escape: \\x", firstError("\"\\x\""));
        assertEquals("invalid unicode escape: \\u12", firstError("\"\\u12\""));
        assertEquals("octal escape is out range, must be between 0 and 377: \\777", firstError("\"\\777\""));
        assertEquals("unicode escape is out of range, must be between 0 and 0x10ffff: \\U00110000",
                firstError("\"\\U00110000\""));
        assertEquals("null character ('\\0') not allowed in string literal", firstError("\"a\0\""));
    }

    @Test
    void testNullCharacterKeepsScanningString() {
        ErrorHandler handler = new ErrorHandler();
        List<Symbol> symbols = lex("'foo \0 \\L bar \\. baz \\+ \\[ buzz' 0", handler);
        assertEquals(SymbolType.ERROR, symbols.get(0).type);
        assertEquals(SymbolType.INT_LIT, symbols.get(1).type);
        List<String> errors = new ArrayList<>();
        for (SyntaxError error : handler.getErrors()) {
            errors.add(error.toString());
        }
        assertEquals(List.of(
                "test.proto:1:6: null character ('\\0') not allowed in string literal",
                "test.proto:1:8: invalid escape sequence: \\L",
                "test.proto:1:15: invalid escape sequence: \\.",
                "test.proto:1:22: invalid escape sequence: \\+",
                "test.proto:1:25: invalid escape sequence: \\["), errors);
    }

    @Test
    void testTooManyStringErrors() {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < 12; i++) {
            sb.append("\\q");
        }
        sb.append('"');
        ErrorHandler handler = new ErrorHandler();
        List<Symbol> symbols = lex(sb.toString(), handler);
        assertEquals(SymbolType.ERROR, symbols.get(0).type);
        List<String> messages = messages(handler.getErrors());
        assertEquals(12, messages.size());
        assertEquals("too many errors (12) encountered while parsing string literal", messages.get(10));
        assertEquals("invalid escape sequence: \\q", messages.get(11));
    }

    @Test
    void testComments() {
        ErrorHandler handler = new ErrorHandler();
        List<Symbol> symbols = lex("// line\n/* block\n */ foo", handler);
        assertEquals(List.of("foo", "EOF"), describe(symbols));
        assertTrue(handler.getErrors().isEmpty());
        assertEquals("block comment never terminates, unexpected EOF", firstError("foo /* abc"));
        assertEquals("invalid control character", firstError("// a\0b"));
    }

    @Test
    void testInvalidCharacters() {
        assertEquals("invalid character", firstError("@"));
        assertEquals("invalid control character", firstError("\u0001"));
        ErrorHandler handler = new ErrorHandler();
        ProtoLexer lexer = new ProtoLexer("test.proto", new byte[]{'a', ' ', (byte) 0xFF}, handler,
                ParseConfig.defaults().utf8Strict(true));
        assertEquals(SymbolType.IDENT, lexer.next().type);
        assertEquals(SymbolType.ERROR, lexer.next().type);
        assertEquals("invalid UTF-8 at offset 2: ff", handler.getErrors().get(0).message);
    }

    @Test
    void testErrorPosition() {
        ErrorHandler handler = new ErrorHandler();
        lex("foo\n  @", handler);
        SyntaxError error = handler.getErrors().get(0);
        assertEquals(SyntaxError.Kind.LEXICAL, error.kind);
        assertEquals(2, error.getLine());
        assertEquals(3, error.getColumn());
        assertEquals("test.proto:2:3: invalid character", error.toString());
    }

    @Test
    void testRpcParens() {
        List<Symbol> symbols = lex("{rpc Foo(Bar) returns (baz.Qux);");
        assertEquals(List.of("{", "rpc", "Foo", "(", "Bar", ")", "returns", "(", "QUALIFIED_IDENT", ")", ";", "EOF"),
                describe(symbols));
    }

    @Test
    void testAbortReturnsEof() {
        ErrorHandler handler = new ErrorHandler(ErrorReporter.failFast());
        List<Symbol> symbols = lex("foo @ bar baz", handler);
        assertEquals(List.of("foo", "ERROR", "EOF"), describe(symbols));
        assertTrue(handler.isAborted());
    }

}

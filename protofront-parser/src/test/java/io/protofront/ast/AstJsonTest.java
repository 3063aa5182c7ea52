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

import net.minidev.json.JSONValue;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.protofront.parser.ProtoTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class AstJsonTest {

    @Test
    void testMessage() {
        FileNode file = parseOk("message Foo { int32 bar = 1; }");
        match(file.decls.get(0), "{ type: 'MessageNode', keyword: 'message', name: 'Foo', openBrace: '{',"
                + " decls: [{ type: 'FieldNode', fieldType: 'int32', name: 'bar', equals: '=', tag: 1, semicolon: ';' }],"
                + " closeBrace: '}', semicolon: '~;' }");
    }

    @Test
    void testFile() {
        FileNode file = parseOk("syntax = \"proto3\";\noption a = -5;\n");
        match(file, "{ type: 'FileNode',"
                + " syntax: { type: 'SyntaxNode', keyword: 'syntax', equals: '=', syntax: 'proto3', semicolon: ';' },"
                + " decls: [{ type: 'OptionNode', keyword: 'option',"
                + " name: { type: 'OptionNameNode', parts: [{ type: 'FieldReferenceNode', name: 'a' }] },"
                + " equals: '=', val: { type: 'NegativeIntLiteralNode', minus: '-', uint: 5 }, semicolon: ';' }],"
                + " eof: 'EOF' }");
    }

    @Test
    void testLiterals() {
        FileNode file = parseOk("option (x) = { a: [1, 2.5] b: 'z' };");
        OptionNode option = file.decls.get(0).option();
        match(option.val, "{ type: 'MessageLiteralNode', open: '{', elements: ["
                + " { type: 'MessageFieldNode', name: { type: 'FieldReferenceNode', name: 'a' }, sep: ':',"
                + "   val: { type: 'ArrayLiteralNode', openBracket: '[', elements: [1, ',', 2.5, '~,'], closeBracket: ']',"
                + "   semicolon: '~;' } },"
                + " { type: 'MessageFieldNode', name: { type: 'FieldReferenceNode', name: 'b' }, sep: ':', val: 'z' }"
                + " ], close: '}' }");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testUnsignedMax() {
        FileNode file = parseOk("option a = 18446744073709551615;");
        Map<String, Object> json = (Map<String, Object>) AstJson.toObject(file.decls.get(0));
        assertEquals("18446744073709551615", json.get("val"));
    }

    @Test
    void testToJson() {
        FileNode file = parseOk("enum E { X = 0; }");
        String json = AstJson.toJson(file.decls.get(0));
        Object parsed = JSONValue.parse(json);
        assertTrue(parsed instanceof Map);
        assertEquals("EnumNode", ((Map<?, ?>) parsed).get("type"));
        assertNull(AstJson.toObject(null));
        assertNull(AstJson.toObject(MessageElement.none()));
    }

}

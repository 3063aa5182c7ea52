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

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static io.protofront.parser.ProtoTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class CloneTest {

    static final String SOURCE = "//pragma: owner core\n"
            + "syntax = \"proto3\";\n"
            + "message Foo {\n"
            + "  int32 a = 1 [(opt) = { x: 1 }];\n"
            + "  oneof o { string b = 2; }\n"
            + "  map<string, int32> m = 3;\n"
            + "  int32 = ;\n"
            + "}\n"
            + "enum E { X = 0; }\n";

    @Test
    void testDeepCopy() {
        FileNode file = parse(SOURCE).ast();
        FileNode copy = file.copy();
        assertNotSame(file, copy);
        assertSame(file.getFileInfo(), copy.getFileInfo());
        assertEquals(file.pragmas(), copy.pragmas());
        assertEquals(AstJson.toJson(file), AstJson.toJson(copy));
        assertEquals(AstPrinter.print(file), AstPrinter.print(copy));
        List<TerminalNode> original = Nodes.terminals(file);
        List<TerminalNode> copied = Nodes.terminals(copy);
        assertEquals(original.size(), copied.size());
        Map<Node, Boolean> seen = new IdentityHashMap<>();
        for (TerminalNode node : original) {
            seen.put(node, true);
        }
        for (int i = 0; i < original.size(); i++) {
            assertEquals(original.get(i).token, copied.get(i).token);
            assertFalse(seen.containsKey(copied.get(i)), "terminal shared with the original: " + copied.get(i));
        }
    }

    @Test
    void testCompositesAreNotShared() {
        FileNode file = parse(SOURCE).ast();
        FileNode copy = file.copy();
        Map<Node, Boolean> seen = new IdentityHashMap<>();
        Walker.walk(file, WalkOption.before(n -> {
            seen.put(n, true);
            return true;
        }));
        Walker.walk(copy, WalkOption.before(n -> {
            assertFalse(seen.containsKey(n), "node shared with the original: " + n);
            return true;
        }));
        MessageNode message = file.decls.get(0).message();
        MessageNode messageCopy = copy.decls.get(0).message();
        assertNotSame(message, messageCopy);
        assertNotSame(message.decls, messageCopy.decls);
        assertNotSame(message.decls.get(0), messageCopy.decls.get(0));
    }

    @Test
    void testCopySubtree() {
        FileNode file = parseOk("message Foo { int32 a = 1; }");
        MessageNode message = file.decls.get(0).message();
        MessageNode copy = Nodes.copy(message);
        assertNotSame(message, copy);
        assertEquals(message.start(), copy.start());
        assertEquals(message.end(), copy.end());
        assertEquals(AstJson.toJson(message), AstJson.toJson(copy));
        assertNull(Nodes.copy((Node) null));
        assertNull(Nodes.copyAll(null));
    }

    @Test
    void testNoneSurvivesCopy() {
        assertSame(MessageElement.none(), MessageElement.none().copy());
        assertTrue(Nodes.isNone(MessageElement.none()));
    }

    @Test
    void testWrapperVariants() {
        IdentNode ident = new IdentNode("b", new Token(3));
        ValueNode value = new ValueNode(ident);
        assertEquals("ident", value.variant());
        assertSame(ident, value.ident());
        assertNull(value.uintLiteral());
        ValueNode copy = value.copy();
        assertEquals("ident", copy.variant());
        assertNotSame(ident, copy.ident());
        assertEquals("b", copy.ident().val);
        assertThrows(AstConstructionException.class, () -> new IdentValueNode((IdentNode) null));
        assertTrue(ValueNode.none().isNone());
        assertEquals(WrapperNode.NONE, ValueNode.none().variant());
    }

}

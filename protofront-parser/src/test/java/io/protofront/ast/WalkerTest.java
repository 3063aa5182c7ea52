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

import io.protofront.ast.paths.PathValues;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.protofront.parser.ProtoTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class WalkerTest {

    static final String SOURCE = "message Foo {\n"
            + "  int32 a = 1;\n"
            + "  message Bar { string b = 2; }\n"
            + "}\n"
            + "enum E { X = 0; }\n";

    private static String name(Node node) {
        return node.getClass().getSimpleName();
    }

    private static boolean isComposite(Node node) {
        return !(node instanceof TerminalNode);
    }

    @Test
    void testPreOrderAndPostOrder() {
        FileNode file = parseOk(SOURCE);
        List<String> before = new ArrayList<>();
        List<String> after = new ArrayList<>();
        Walker.walk(file,
                WalkOption.before(n -> {
                    if (isComposite(n)) {
                        before.add(name(n));
                    }
                    return true;
                }),
                WalkOption.after(n -> {
                    if (isComposite(n)) {
                        after.add(name(n));
                    }
                }));
        assertEquals(List.of("FileNode", "MessageNode", "FieldNode", "MessageNode", "FieldNode", "EnumNode", "EnumValueNode"), before);
        assertEquals(List.of("FieldNode", "FieldNode", "MessageNode", "MessageNode", "EnumValueNode", "EnumNode", "FileNode"), after);
    }

    @Test
    void testTerminalsInSourceOrder() {
        FileNode file = parseOk(SOURCE);
        List<Token> tokens = new ArrayList<>();
        Walker.walk(file, WalkOption.before(n -> {
            if (n instanceof TerminalNode) {
                tokens.add(((TerminalNode) n).token);
            }
            return true;
        }));
        List<Token> expected = new ArrayList<>();
        for (TerminalNode node : Nodes.terminals(file)) {
            expected.add(node.token);
        }
        assertEquals(expected, tokens);
        for (int i = 1; i < tokens.size(); i++) {
            assertTrue(tokens.get(i - 1).isBefore(tokens.get(i)));
        }
    }

    @Test
    void testInspectSkipsChildren() {
        FileNode file = parseOk(SOURCE);
        List<String> visited = new ArrayList<>();
        Walker.inspect(file, n -> {
            if (isComposite(n)) {
                visited.add(name(n));
            }
            return !(n instanceof MessageNode);
        });
        assertEquals(List.of("FileNode", "MessageNode", "EnumNode", "EnumValueNode"), visited);
    }

    @Test
    void testBeforeFalseStillRunsAfter() {
        FileNode file = parseOk(SOURCE);
        List<String> visited = new ArrayList<>();
        List<String> after = new ArrayList<>();
        Walker.inspect(file, n -> {
                    if (isComposite(n)) {
                        visited.add(name(n));
                    }
                    return true;
                },
                WalkOption.before(n -> !(n instanceof FieldNode)),
                WalkOption.after(n -> {
                    if (n instanceof FieldNode) {
                        after.add(((FieldNode) n).name.val);
                    }
                }));
        assertFalse(visited.contains("FieldNode"));
        assertEquals(List.of("a", "b"), after);
    }

    @Test
    void testRange() {
        FileNode file = parseOk(SOURCE);
        EnumNode enumNode = file.decls.get(1).enumNode();
        List<String> visited = new ArrayList<>();
        Walker.inspect(file, n -> {
            if (isComposite(n)) {
                visited.add(name(n));
            }
            return true;
        }, WalkOption.range(enumNode.start(), enumNode.end()));
        assertEquals(List.of("FileNode", "EnumNode", "EnumValueNode"), visited);
    }

    @Test
    void testIntersection() {
        FileNode file = parseOk(SOURCE);
        MessageNode bar = file.decls.get(0).message().decls.get(1).message();
        FieldNode b = bar.decls.get(0).field();
        List<Node> visited = new ArrayList<>();
        Walker.inspect(file, n -> {
            visited.add(n);
            return true;
        }, WalkOption.intersection(b.name.token));
        assertEquals(5, visited.size());
        assertSame(file, visited.get(0));
        assertSame(bar, visited.get(2));
        assertSame(b, visited.get(3));
        assertSame(b.name, visited.get(4));
    }

    @Test
    void testDepthLimit() {
        FileNode file = parseOk(SOURCE);
        List<String> visited = new ArrayList<>();
        Walker.walk(file, WalkOption.depthLimit(2), WalkOption.before(n -> {
            visited.add(name(n));
            return true;
        }));
        assertEquals(List.of("FileNode", "MessageNode", "EnumNode", "RuneNode"), visited);
    }

    @Test
    void testAbortRunsAfterHooks() {
        FileNode file = parseOk(SOURCE);
        List<String> after = new ArrayList<>();
        WalkAbortException e = assertThrows(WalkAbortException.class, () -> Walker.walk(file,
                WalkOption.before(n -> {
                    if (n instanceof FieldNode) {
                        throw new WalkAbortException("found a field");
                    }
                    return true;
                }),
                WalkOption.after(n -> {
                    if (isComposite(n)) {
                        after.add(name(n));
                    }
                })));
        assertEquals("found a field", e.getMessage());
        assertEquals(List.of("FieldNode", "MessageNode", "FileNode"), after);
    }

    @Test
    void testHooksCompose() {
        FileNode file = parseOk(SOURCE);
        List<String> calls = new ArrayList<>();
        Walker.walk(file.decls.get(1).enumNode(),
                WalkOption.before(n -> calls.add("first " + name(n))),
                WalkOption.before(n -> calls.add("second " + name(n))),
                WalkOption.depthLimit(1));
        assertEquals(List.of("first EnumNode", "second EnumNode"), calls);
    }

    @Test
    void testPathHooks() {
        FileNode file = parseOk(SOURCE);
        List<String> paths = new ArrayList<>();
        Walker.walk(file, WalkOption.beforePath(values -> {
            Node node = values.index(-1).node();
            if (node instanceof FieldNode) {
                paths.add(values.toString());
            }
            return true;
        }));
        assertEquals(List.of(
                "(FileNode).decls[0].message.decls[0].field",
                "(FileNode).decls[0].message.decls[1].message.decls[0].field"), paths);
        List<PathValues> after = new ArrayList<>();
        Walker.walk(file, WalkOption.afterPath(after::add));
        assertEquals(1, after.get(after.size() - 1).size());
    }

    @Test
    void testNullRoot() {
        assertThrows(IllegalArgumentException.class, () -> Walker.walk(null));
    }

}

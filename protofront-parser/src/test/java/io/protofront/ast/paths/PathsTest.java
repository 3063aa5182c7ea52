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
package io.protofront.ast.paths;

import io.protofront.ast.ArrayLiteralNode;
import io.protofront.ast.EnumNode;
import io.protofront.ast.FieldNode;
import io.protofront.ast.FileElement;
import io.protofront.ast.FileNode;
import io.protofront.ast.IdentNode;
import io.protofront.ast.MessageFieldNode;
import io.protofront.ast.MessageNode;
import io.protofront.ast.Node;
import io.protofront.ast.OptionNode;
import io.protofront.ast.WalkOption;
import io.protofront.ast.Walker;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.protofront.parser.ProtoTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class PathsTest {

    static final String SOURCE = "message Foo {\n"
            + "  int32 a = 1;\n"
            + "  message Bar { string b = 2; }\n"
            + "}\n";

    /**
     * Path to the first field named "b".
     */
    private static PathValues pathToB(FileNode file) {
        List<PathValues> found = new ArrayList<>();
        Walker.walk(file, WalkOption.beforePath(values -> {
            FieldNode field = Paths.nodeAt(values, -1, FieldNode.class);
            if (field != null && field.name.val.equals("b")) {
                found.add(values);
            }
            return true;
        }));
        assertEquals(1, found.size());
        return found.get(0);
    }

    @Test
    void testAncestorTracker() {
        FileNode file = parseOk(SOURCE);
        AncestorTracker tracker = new AncestorTracker();
        List<String> parents = new ArrayList<>();
        Walker.inspect(file, n -> {
            if (n instanceof FieldNode) {
                MessageNode parent = (MessageNode) tracker.parent();
                parents.add(((FieldNode) n).name.val + " in " + parent.name.val);
                assertSame(n, tracker.path().get(tracker.path().size() - 1));
                assertSame(file, tracker.path().get(0));
            }
            return true;
        }, tracker.asWalkOptions());
        assertEquals(List.of("a in Foo", "b in Bar"), parents);
        assertTrue(tracker.values().isEmpty());
        assertNull(tracker.parent());
    }

    @Test
    void testToNodesSkipsUnionsAndLists() {
        FileNode file = parseOk(SOURCE);
        PathValues values = pathToB(file);
        assertEquals(10, values.size());
        List<Node> nodes = Paths.toNodes(values);
        assertEquals(4, nodes.size());
        assertSame(file, nodes.get(0));
        assertTrue(nodes.get(1) instanceof MessageNode);
        assertTrue(nodes.get(2) instanceof MessageNode);
        assertTrue(nodes.get(3) instanceof FieldNode);
        assertTrue(Paths.isConcrete(values, 0));
        assertFalse(Paths.isConcrete(values, 1));
        assertFalse(Paths.isConcrete(values, 2));
    }

    @Test
    void testSuffix2() {
        FileNode file = parseOk(SOURCE);
        PathValues values = pathToB(file);
        Optional<Paths.Suffix2<MessageNode, FieldNode>> match = Paths.suffix2(values, MessageNode.class, FieldNode.class);
        assertTrue(match.isPresent());
        assertEquals("Bar", match.get().t().name.val);
        assertEquals(6, match.get().tIndex());
        assertEquals("b", match.get().u().name.val);
        assertEquals(9, match.get().uIndex());
        assertTrue(Paths.suffix2(values, EnumNode.class, FieldNode.class).isEmpty());
        assertTrue(Paths.suffix2(values, MessageNode.class, EnumNode.class).isEmpty());
    }

    @Test
    void testSuffix3() {
        FileNode file = parseOk(SOURCE);
        PathValues values = pathToB(file);
        Paths.Suffix3<MessageNode, MessageNode, FieldNode> match =
                Paths.suffix3(values, MessageNode.class, MessageNode.class, FieldNode.class).orElseThrow();
        assertEquals("Foo", match.t().name.val);
        assertEquals(3, match.tIndex());
        assertEquals("Bar", match.u().name.val);
        assertEquals(6, match.uIndex());
        assertEquals(9, match.vIndex());
        assertTrue(Paths.suffix4(values, FileNode.class, MessageNode.class, MessageNode.class, FieldNode.class).isPresent());
        // the field is not directly in the file
        assertTrue(Paths.suffix3(values, FileNode.class, MessageNode.class, FieldNode.class).isEmpty());
        assertTrue(Paths.suffix5(values, FileNode.class, FileNode.class, MessageNode.class, MessageNode.class, FieldNode.class).isEmpty());
    }

    @Test
    void testShortPaths() {
        FileNode file = parseOk(SOURCE);
        PathValues root = PathValues.of(List.of(PathStep.root(file)));
        assertTrue(Paths.suffix2(root, FileNode.class, FileNode.class).isEmpty());
        assertTrue(Paths.suffix3(pathToB(file).slice(0, 2), Node.class, Node.class, Node.class).isEmpty());
    }

    @Test
    void testMalformedPaths() {
        FileNode file = parseOk(SOURCE);
        FileElement element = file.decls.get(0);
        MessageNode message = element.message();
        PathValues noRoot = PathValues.of(List.of(PathStep.field("decls", element), PathStep.field("message", message)));
        assertThrows(IllegalStateException.class, () -> Paths.suffix2(noRoot, FileElement.class, MessageNode.class));
        PathValues endsAtList = PathValues.of(List.of(PathStep.root(file), PathStep.listField("decls", file.decls)));
        assertThrows(IllegalStateException.class, () -> Paths.suffix2(endsAtList, FileNode.class, FileNode.class));
        PathValues strayIndex = PathValues.of(List.of(PathStep.root(file), PathStep.field("x", element),
                PathStep.listIndex(0, element), PathStep.field("message", message)));
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> Paths.suffix2(strayIndex, FileNode.class, MessageNode.class));
        assertTrue(e.getMessage().startsWith("malformed path: list index without a list field at 2"));
        PathValues secondRoot = PathValues.of(List.of(PathStep.root(file), PathStep.root(element),
                PathStep.field("message", message)));
        assertThrows(IllegalStateException.class, () -> Paths.suffix2(secondRoot, FileNode.class, MessageNode.class));
    }

    @Test
    void testPathValues() {
        FileNode file = parseOk(SOURCE);
        PathValues values = pathToB(file);
        assertSame(values.index(9), values.index(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> values.index(10));
        assertThrows(IndexOutOfBoundsException.class, () -> values.index(-11));
        PathValues sub = values.slice(6, 10);
        assertEquals(PathStep.Kind.ROOT, sub.index(0).kind());
        assertEquals("(MessageNode).decls[0].field", sub.toString());
        assertTrue(Paths.suffix2(sub, MessageNode.class, FieldNode.class).isPresent());
        assertThrows(IllegalArgumentException.class, () -> values.slice(1, 3));
        PathValues longer = values.append(PathStep.field("name", values.index(-1).node()));
        assertEquals(11, longer.size());
        assertEquals(10, values.size());
    }

    /**
     * Path to the non-keyword identifier with the given name.
     */
    private static PathValues pathToIdent(FileNode file, String name) {
        List<PathValues> found = new ArrayList<>();
        Walker.walk(file, WalkOption.beforePath(values -> {
            IdentNode ident = Paths.nodeAt(values, -1, IdentNode.class);
            if (ident != null && !ident.keyword && ident.val.equals(name)) {
                found.add(values);
            }
            return true;
        }));
        assertEquals(1, found.size());
        return found.get(0);
    }

    @Test
    void testSuffixIgnoresWrapperDepth() {
        // value wrapper only, then the same option inside a compact option list
        PathValues plain = pathToIdent(parseOk("option a = b;"), "b");
        PathValues compact = pathToIdent(parseOk("message M { int32 f = 1 [a = b]; }"), "b");
        assertTrue(compact.size() > plain.size());
        for (PathValues values : List.of(plain, compact)) {
            Paths.Suffix2<OptionNode, IdentNode> match = Paths.suffix2(values, OptionNode.class, IdentNode.class).orElseThrow();
            assertEquals("b", match.u().val);
            assertEquals("a", match.t().name.asString());
            assertEquals(values.size() - 1, match.uIndex());
        }
        // message field value, directly and in an array whose elements add a wrapper
        PathValues scalar = pathToIdent(parseOk("option (x) = { y: b };"), "b");
        PathValues array = pathToIdent(parseOk("option (x) = { y: [b] };"), "b");
        assertTrue(array.size() > scalar.size());
        assertEquals("y", Paths.suffix2(scalar, MessageFieldNode.class, IdentNode.class).orElseThrow().t().name.asString());
        Paths.Suffix3<MessageFieldNode, ArrayLiteralNode, IdentNode> inArray =
                Paths.suffix3(array, MessageFieldNode.class, ArrayLiteralNode.class, IdentNode.class).orElseThrow();
        assertEquals("y", inArray.t().name.asString());
        assertEquals("b", inArray.v().val);
        assertTrue(Paths.suffix2(array, MessageFieldNode.class, IdentNode.class).isEmpty());
    }

}

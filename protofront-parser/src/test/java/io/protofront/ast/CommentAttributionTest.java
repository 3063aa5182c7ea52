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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.protofront.parser.ProtoTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class CommentAttributionTest {

    private static List<String> texts(Comments comments) {
        List<String> list = new ArrayList<>();
        for (Comment comment : comments) {
            list.add(comment.rawText());
        }
        return list;
    }

    @Test
    void testTrailingLineComment() {
        String text = "syntax = \"proto3\"; // trailing\n// leading\nmessage Foo {}";
        FileNode file = parseOk(text);
        assertEquals(List.of("// trailing"), texts(file.nodeInfo(file.syntax).trailingComments()));
        MessageNode message = file.decls.get(0).message();
        assertEquals(List.of("// leading"), texts(file.nodeInfo(message).leadingComments()));
        assertRoundTrip(text);
    }

    @Test
    void testOnlyFirstCommentIsDonated() {
        String text = "syntax = \"proto3\"; // one\n// two\n\n// three\nmessage Foo {}";
        FileNode file = parseOk(text);
        assertEquals(List.of("// one"), texts(file.nodeInfo(file.syntax.semicolon).trailingComments()));
        MessageNode message = file.decls.get(0).message();
        assertEquals(List.of("// two", "// three"), texts(file.nodeInfo(message.keyword).leadingComments()));
        assertRoundTrip(text);
    }

    @Test
    void testBlockComments() {
        // ends on its own line, so it trails
        FileNode file = parseOk("syntax = \"proto3\"; /* a */\nmessage Foo {}");
        assertEquals(List.of("/* a */"), texts(file.nodeInfo(file.syntax).trailingComments()));
        // ends on the line of the next token, so it leads that token
        file = parseOk("syntax = \"proto3\"; /* a\n */ message Foo {}");
        assertTrue(file.nodeInfo(file.syntax).trailingComments().isEmpty());
        assertEquals(List.of("/* a\n */"), texts(file.nodeInfo(file.decls.get(0)).leadingComments()));
        // same line as both neighbours
        file = parseOk("syntax = \"proto3\"; /* a */ message Foo {}");
        assertTrue(file.nodeInfo(file.syntax).trailingComments().isEmpty());
        assertEquals(List.of("/* a */"), texts(file.nodeInfo(file.decls.get(0)).leadingComments()));
    }

    @Test
    void testCommentBeforeVirtualSemicolon() {
        String text = "message Foo {\n  int32 bar = 1 // note\n}";
        FileNode file = parseOk(text);
        FieldNode field = file.decls.get(0).message().decls.get(0).field();
        assertTrue(field.semicolon.virtual);
        Comments onTag = file.nodeInfo(field.tag).trailingComments();
        assertEquals(1, onTag.size());
        assertTrue(onTag.get(0).isVirtual());
        Comments onSemicolon = file.nodeInfo(field.semicolon).trailingComments();
        assertEquals(1, onSemicolon.size());
        assertFalse(onSemicolon.get(0).isVirtual());
        assertEquals("// note", onSemicolon.get(0).rawText());
        assertEquals(field.semicolon.token.asItem(), onSemicolon.get(0).virtualItem());
        assertEquals(field.tag.token.asItem(), onSemicolon.get(0).attributedTo());
        // the field as a whole ends at the virtual semicolon
        assertEquals(1, file.nodeInfo(field).trailingComments().size());
        assertRoundTrip(text);
    }

    @Test
    void testCommentsAtEndOfFile() {
        String text = "message Foo {}\n// end\n";
        FileNode file = parseOk(text);
        assertEquals(List.of("// end"), texts(file.nodeInfo(file.eof).leadingComments()));
        assertEquals("\n", file.nodeInfo(file.eof).leadingWhitespace());
        assertRoundTrip(text);
    }

    @Test
    void testCommentOnLastLine() {
        String text = "message Foo {} // end";
        FileNode file = parseOk(text);
        MessageNode message = file.decls.get(0).message();
        assertTrue(message.semicolon.virtual);
        assertEquals(List.of("// end"), texts(file.nodeInfo(message.semicolon).trailingComments()));
        assertTrue(file.nodeInfo(file.eof).leadingComments().isEmpty());
        assertRoundTrip(text);
    }

    @Test
    void testCommentOnlyFile() {
        String text = "// just a comment\n/* and a block */\n";
        FileNode file = parseOk(text);
        assertTrue(file.decls.isEmpty());
        assertEquals(List.of("// just a comment", "/* and a block */"), texts(file.nodeInfo(file.eof).leadingComments()));
        assertRoundTrip(text);
    }

    @Test
    void testCommentPositions() {
        FileNode file = parseOk("// ab\nmessage Foo {}");
        Comment comment = file.nodeInfo(file.decls.get(0)).leadingComments().get(0);
        assertEquals(1, comment.start().line());
        assertEquals(1, comment.start().col());
        assertEquals(5, comment.end().col());
        assertEquals(6, comment.endExclusive().col());
        assertEquals("test.proto:1:1-1:5: // ab", comment.toString());
    }

    static final String COMMENTED = "// header\n"
            + "syntax = \"proto3\"; // after syntax\n"
            + "/* before */ message Foo { // open\n"
            + "  int32 a = 1 /* odd */ ;\n"
            + "  // dangling\n"
            + "  string b = 2 // no semicolon\n"
            + "}\n"
            + "option (x) = { a: 1 /* in literal */ }\n"
            + "// last";

    @Test
    void testEveryCommentAttributedOnce() {
        FileNode file = parse(COMMENTED).ast();
        FileInfo info = file.getFileInfo();
        Map<Item, Integer> seen = new HashMap<>();
        for (TerminalNode terminal : Nodes.terminals(file)) {
            NodeInfo nodeInfo = info.nodeInfo(terminal);
            for (Comments comments : List.of(nodeInfo.leadingComments(), nodeInfo.trailingComments())) {
                for (Comment comment : comments) {
                    if (!comment.isVirtual()) {
                        seen.merge(comment.asItem(), 1, Integer::sum);
                    }
                }
            }
        }
        int count = 0;
        for (Item item = info.items().first(); item != null; item = info.items().next(item)) {
            if (info.isComment(item)) {
                count++;
                assertEquals(1, seen.get(item), info.commentOf(item).rawText());
            }
        }
        assertEquals(9, count);
        assertEquals(count, seen.size());
        assertEquals(COMMENTED, AstPrinter.print(file));
    }

    @Test
    void testSequencesAreSymmetric() {
        FileInfo info = parse(COMMENTED).ast().getFileInfo();
        Sequence<Item> items = info.items();
        List<Item> forward = new ArrayList<>();
        for (Item item = items.first(); item != null; item = items.next(item)) {
            forward.add(item);
        }
        List<Item> backward = new ArrayList<>();
        for (Item item = items.last(); item != null; item = items.previous(item)) {
            backward.add(item);
        }
        Collections.reverse(backward);
        assertEquals(forward, backward);
        assertEquals(info.getItemCount(), forward.size());
        Sequence<Token> tokens = info.tokens();
        List<Token> tokensForward = new ArrayList<>();
        for (Token token = tokens.first(); token != null; token = tokens.next(token)) {
            tokensForward.add(token);
        }
        List<Token> tokensBackward = new ArrayList<>();
        for (Token token = tokens.last(); token != null; token = tokens.previous(token)) {
            tokensBackward.add(token);
        }
        Collections.reverse(tokensBackward);
        assertEquals(tokensForward, tokensBackward);
        assertEquals(info.getItemCount() - info.getCommentCount(), tokensForward.size());
    }

}

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

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FileInfoTest {

    private static FileInfo fileInfo(String text) {
        return new FileInfo("test.proto", text.getBytes(StandardCharsets.UTF_8), 0);
    }

    // "ab cd\nef" tokenized by hand
    private static FileInfo simple() {
        FileInfo info = fileInfo("ab cd\nef");
        info.addToken(0, 2);
        info.addToken(3, 2);
        info.addLine(6);
        info.addToken(6, 2);
        return info;
    }

    @Test
    void testSourcePos() {
        FileInfo info = simple();
        assertEquals(new SourcePos("test.proto", 1, 1, 0), info.sourcePos(0));
        assertEquals(new SourcePos("test.proto", 1, 5, 4), info.sourcePos(4));
        assertEquals(new SourcePos("test.proto", 2, 1, 6), info.sourcePos(6));
        assertEquals(new SourcePos("test.proto", 2, 2, 7), info.sourcePos(7));
        assertEquals(2, info.getLineCount());
        assertEquals(3, info.getItemCount());
    }

    @Test
    void testItemAtOffset() {
        FileInfo info = simple();
        assertEquals(new Item(0), info.itemAtOffset(0));
        assertEquals(new Item(0), info.itemAtOffset(1));
        // just past the end of "ab"
        assertEquals(new Item(0), info.itemAtOffset(2));
        assertEquals(new Item(1), info.itemAtOffset(3));
        assertEquals(new Item(1), info.itemAtOffset(5));
        assertEquals(new Item(2), info.itemAtOffset(7));
        assertEquals(new Item(2), info.itemAtOffset(8));
        assertEquals(Item.ERROR, info.itemAtOffset(9));
        assertEquals(Item.ERROR, info.itemAtOffset(-1));
        assertEquals(new Token(1), info.tokenAtOffset(4));
    }

    @Test
    void testNodeInfo() {
        FileInfo info = simple();
        NodeInfo nodeInfo = info.tokenInfo(new Token(1));
        assertEquals("cd", nodeInfo.rawText());
        assertEquals(" ", nodeInfo.leadingWhitespace());
        assertEquals(4, nodeInfo.start().col());
        // exclusive end
        assertEquals(6, nodeInfo.end().col());
        assertEquals("\n", info.tokenInfo(new Token(2)).leadingWhitespace());
        NodeInfo invalid = info.tokenInfo(new Token(5));
        assertFalse(invalid.isValid());
        assertEquals("", invalid.rawText());
        assertFalse(invalid.start().isKnown());
    }

    @Test
    void testComments() {
        FileInfo info = fileInfo("a // c\nb");
        Token a = info.addToken(0, 1);
        Token comment = info.addToken(2, 4);
        info.addLine(7);
        Token b = info.addToken(7, 1);
        assertNull(info.commentOf(comment.asItem()));
        info.addComment(comment, a);
        assertEquals(1, info.getCommentCount());
        assertTrue(info.isComment(comment.asItem()));
        assertFalse(info.isComment(b.asItem()));
        assertEquals(Token.ERROR, info.tokenOf(comment.asItem()));
        Comment c = info.commentOf(comment.asItem());
        assertEquals("// c", c.rawText());
        assertEquals(" ", c.leadingWhitespace());
        assertEquals(a.asItem(), c.attributedTo());
        assertEquals(Item.ERROR, c.virtualItem());
        // end is the last character, not one past it
        assertEquals(6, c.end().col());
        assertEquals(7, c.endExclusive().col());
        assertEquals("// c", info.itemInfo(comment.asItem()).rawText());
        Comments trailing = info.tokenInfo(a).trailingComments();
        assertEquals(1, trailing.size());
        assertEquals("// c", trailing.get(0).rawText());
        assertTrue(info.tokenInfo(b).leadingComments().isEmpty());
        assertThrows(IndexOutOfBoundsException.class, () -> trailing.get(1));
    }

    @Test
    void testSequences() {
        FileInfo info = fileInfo("a // c\nb");
        info.addToken(0, 1);
        info.addToken(2, 4);
        info.addLine(7);
        info.addToken(7, 1);
        Sequence<Token> tokens = info.tokens();
        assertEquals(new Token(0), tokens.first());
        assertEquals(new Token(2), tokens.next(tokens.first()));
        assertNull(tokens.next(new Token(2)));
        assertEquals(new Token(2), tokens.last());
        assertEquals(new Token(0), tokens.previous(tokens.last()));
        assertNull(tokens.previous(new Token(0)));
        Sequence<Item> items = info.items();
        assertEquals(new Item(1), items.next(items.first()));
        assertEquals(new Item(1), items.previous(items.last()));
        Sequence<Item> empty = fileInfo("").items();
        assertNull(empty.first());
        assertNull(empty.last());
    }

    @Test
    void testCorruptedTokens() {
        FileInfo info = fileInfo("ab cd");
        info.addToken(0, 2);
        TokenStoreCorruptedException e = assertThrows(TokenStoreCorruptedException.class, () -> info.addToken(1, 1));
        assertTrue(e.getMessage().startsWith("invalid offset: 1 is not greater than previously observed token end 1"));
        assertTrue(e.getMessage().contains("this is a lexer bug"));
        assertThrows(TokenStoreCorruptedException.class, () -> info.addToken(-1, 1));
        assertThrows(TokenStoreCorruptedException.class, () -> info.addToken(3, -1));
        assertThrows(TokenStoreCorruptedException.class, () -> info.addToken(3, 5));
    }

    @Test
    void testCorruptedLines() {
        FileInfo info = fileInfo("a\nb\nc");
        info.addLine(2);
        assertThrows(TokenStoreCorruptedException.class, () -> info.addLine(2));
        assertThrows(TokenStoreCorruptedException.class, () -> info.addLine(-1));
        assertThrows(TokenStoreCorruptedException.class, () -> info.addLine(10));
        info.addLine(4);
        assertEquals(3, info.getLineCount());
    }

    @Test
    void testTooManyZeroLengthTokens() {
        FileInfo info = fileInfo("a");
        for (int i = 0; i < 11; i++) {
            info.addToken(0, 0);
        }
        TokenStoreCorruptedException e = assertThrows(TokenStoreCorruptedException.class, () -> info.addToken(0, 0));
        assertTrue(e.getMessage().startsWith("more than 10 consecutive zero-length tokens"));
    }

    @Test
    void testCommentOrdering() {
        FileInfo info = fileInfo("a /*x*/ /*y*/ b");
        Token a = info.addToken(0, 1);
        Token x = info.addToken(2, 5);
        Token y = info.addToken(8, 5);
        Token b = info.addToken(14, 1);
        info.addComment(x, b);
        assertThrows(TokenStoreCorruptedException.class, () -> info.addComment(y, a));
        info.addComment(y, b);
        assertThrows(TokenStoreCorruptedException.class, () -> info.addComment(x, b));
        assertEquals(2, info.tokenInfo(b).leadingComments().size());
    }

    @Test
    void testGrowth() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 500; i++) {
            sb.append("a\n");
        }
        FileInfo info = fileInfo(sb.toString());
        for (int i = 0; i < 500; i++) {
            info.addToken(i * 2, 1);
            info.addLine(i * 2 + 2);
        }
        assertEquals(500, info.getItemCount());
        assertEquals(501, info.getLineCount());
        assertEquals(new SourcePos("test.proto", 500, 1, 998), info.sourcePos(998));
        assertTrue(info.debugAnnotated().contains("a"));
        assertEquals("test.proto [lines: 501, items: 500, comments: 0]", info.toString());
    }

}

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Owns the raw bytes of one source file together with its line table, the spans of
 * every lexed item (tokens and comments) and the comment attribution table.
 * Append-only while the lexer runs, read-only afterwards.
 */
public class FileInfo {

    static final Logger logger = LoggerFactory.getLogger(FileInfo.class);

    private static final int MIN_CAPACITY = 64;
    // roughly 1 item per 4 bytes of source
    private static final int BYTES_PER_ITEM = 4;
    private static final int MAX_CONSECUTIVE_ZERO_LENGTH = 10;

    private final String name;
    private final byte[] data;
    private final int version;

    private int[] lines;
    private int lineCount;

    private int[] itemOffsets;
    private int[] itemLengths;
    private int itemCount;

    // parallel arrays, one row per comment, sorted by comment index
    private int[] commentIndex;
    private int[] commentAttributedTo;
    private int[] commentVirtual;
    private int commentCount;

    private int zeroLengthTotal;
    private int zeroLengthConsecutive;

    public FileInfo(String name, byte[] data, int version) {
        this.name = name;
        this.data = data;
        this.version = version;
        int capacity = Math.max(MIN_CAPACITY, data.length / BYTES_PER_ITEM);
        itemOffsets = new int[capacity];
        itemLengths = new int[capacity];
        lines = new int[Math.max(MIN_CAPACITY, capacity / 8)];
        lines[0] = 0;
        lineCount = 1;
        commentIndex = new int[16];
        commentAttributedTo = new int[16];
        commentVirtual = new int[16];
    }

    public String getName() {
        return name;
    }

    public int getVersion() {
        return version;
    }

    public int getLength() {
        return data.length;
    }

    public byte[] getData() {
        return Arrays.copyOf(data, data.length);
    }

    public int getLineCount() {
        return lineCount;
    }

    public int getItemCount() {
        return itemCount;
    }

    public int getCommentCount() {
        return commentCount;
    }

    //==================================================================================================================
    // construction, only called by the lexer

    public void addLine(int offset) {
        if (offset < 0) {
            abort("invalid line offset: " + offset + " must not be negative");
        }
        if (offset > data.length) {
            abort("invalid line offset: " + offset + " is greater than file size " + data.length);
        }
        int last = lines[lineCount - 1];
        if (offset <= last) {
            abort("invalid line offset: " + offset + " is not greater than previously observed line offset " + last);
        }
        if (lineCount == lines.length) {
            lines = Arrays.copyOf(lines, lines.length * 2);
        }
        lines[lineCount++] = offset;
    }

    public Token addToken(int offset, int length) {
        if (offset < 0) {
            abort("invalid offset: " + offset + " must not be negative");
        }
        if (length < 0) {
            abort("invalid length: " + length + " must not be negative");
        }
        if (offset + length > data.length) {
            abort("invalid offset+length: " + (offset + length) + " is greater than file size " + data.length);
        }
        if (itemCount > 0) {
            int lastEnd = itemOffsets[itemCount - 1] + itemLengths[itemCount - 1] - 1;
            if (offset <= lastEnd) {
                abort("invalid offset: " + offset + " is not greater than previously observed token end " + lastEnd);
            }
        }
        if (itemCount - zeroLengthTotal > data.length + 1) {
            abort("more tokens have been created than could possibly exist in the file");
        } else if (zeroLengthConsecutive > MAX_CONSECUTIVE_ZERO_LENGTH) {
            abort("more than " + MAX_CONSECUTIVE_ZERO_LENGTH + " consecutive zero-length tokens have been created");
        }
        if (itemCount == itemOffsets.length) {
            int capacity = itemOffsets.length * 2;
            itemOffsets = Arrays.copyOf(itemOffsets, capacity);
            itemLengths = Arrays.copyOf(itemLengths, capacity);
        }
        int index = itemCount++;
        itemOffsets[index] = offset;
        itemLengths[index] = length;
        if (length == 0) {
            zeroLengthConsecutive++;
            zeroLengthTotal++;
        } else {
            zeroLengthConsecutive = 0;
        }
        return new Token(index);
    }

    public void addComment(Token comment, Token attributedTo) {
        appendComment(comment, attributedTo, -1);
    }

    public void addVirtualComment(Token comment, Token attributedTo, Token virtualToken) {
        appendComment(comment, attributedTo, virtualToken.index());
    }

    private void appendComment(Token comment, Token attributedTo, int virtualIndex) {
        if (commentCount > 0) {
            int lastIndex = commentIndex[commentCount - 1];
            if (comment.index() <= lastIndex) {
                abort("invalid comment index: " + comment.index()
                        + " is not greater than previously observed comment index " + lastIndex);
            }
            int lastAttribution = commentAttributedTo[commentCount - 1];
            if (attributedTo.index() < lastAttribution) {
                abort("invalid comment attribution: " + attributedTo.index()
                        + " is less than previously observed attribution " + lastAttribution);
            }
        }
        if (commentCount == commentIndex.length) {
            int capacity = commentIndex.length * 2;
            commentIndex = Arrays.copyOf(commentIndex, capacity);
            commentAttributedTo = Arrays.copyOf(commentAttributedTo, capacity);
            commentVirtual = Arrays.copyOf(commentVirtual, capacity);
        }
        commentIndex[commentCount] = comment.index();
        commentAttributedTo[commentCount] = attributedTo.index();
        commentVirtual[commentCount] = virtualIndex;
        commentCount++;
    }

    private void abort(String message) {
        StringBuilder sb = new StringBuilder();
        sb.append(message).append('\n');
        sb.append("this is a lexer bug, accumulated tokens (").append(itemCount).append(") in ").append(name).append(":\n");
        sb.append("line:col   | text\n");
        sb.append("-----------+-----------\n");
        for (int i = 0; i < itemCount; i++) {
            NodeInfo info = tokenInfo(new Token(i));
            SourcePos start = info.start();
            SourcePos end = info.end();
            String text = info.rawText();
            sb.append(String.format("%4d:%02d-%02d | %s", start.line(), start.col(), end.col(),
                    text.isEmpty() ? "(empty)" : '"' + text + '"'));
            sb.append('\n');
        }
        String dump = sb.toString();
        logger.error("token store corrupted: {}", dump);
        throw new TokenStoreCorruptedException(dump);
    }

    //==================================================================================================================
    // queries

    public NodeInfo nodeInfo(Node node) {
        return nodeInfo(node.start().index(), node.end().index());
    }

    public NodeInfo tokenInfo(Token token) {
        return nodeInfo(token.index(), token.index());
    }

    private NodeInfo nodeInfo(int start, int end) {
        if (start < 0 || start >= itemCount || end < 0 || end >= itemCount) {
            return new NodeInfo(this, -1, -1);
        }
        return new NodeInfo(this, start, end);
    }

    /**
     * @return the info for a token or a comment, null if the item is out of range
     */
    public ItemInfo itemInfo(Item item) {
        Token token = tokenOf(item);
        if (token.isValid()) {
            return tokenInfo(token);
        }
        return commentOf(item);
    }

    /**
     * @return the token for this item, or {@link Token#ERROR} if it is a comment or out of range
     */
    public Token tokenOf(Item item) {
        int i = item.index();
        if (i < 0 || i >= itemCount || isComment(i)) {
            return Token.ERROR;
        }
        return new Token(i);
    }

    /**
     * @return the comment for this item, or null if it is not an attributed comment
     */
    public Comment commentOf(Item item) {
        int i = item.index();
        if (i < 0 || i >= itemCount || !isComment(i)) {
            return null;
        }
        int c = lowerBoundCommentIndex(i);
        if (c < commentCount && commentIndex[c] == i) {
            return new Comment(this, c, false);
        }
        return null;
    }

    boolean isComment(int i) {
        int length = itemLengths[i];
        if (length < 2) {
            return false;
        }
        int offset = itemOffsets[i];
        if (data[offset] != '/') {
            return false;
        }
        byte c = data[offset + 1];
        return c == '/' || c == '*';
    }

    public boolean isComment(Item item) {
        return item.index() >= 0 && item.index() < itemCount && isComment(item.index());
    }

    public Sequence<Item> items() {
        return new Sequence<>() {
            @Override
            public Item first() {
                return itemCount == 0 ? null : new Item(0);
            }

            @Override
            public Item next(Item current) {
                int i = current.index();
                if (i < 0 || i >= itemCount - 1) {
                    return null;
                }
                return new Item(i + 1);
            }

            @Override
            public Item last() {
                return itemCount == 0 ? null : new Item(itemCount - 1);
            }

            @Override
            public Item previous(Item current) {
                int i = current.index();
                if (i <= 0 || i >= itemCount) {
                    return null;
                }
                return new Item(i - 1);
            }
        };
    }

    public Sequence<Token> tokens() {
        return new Sequence<>() {
            @Override
            public Token first() {
                return forward(0);
            }

            @Override
            public Token next(Token current) {
                int i = current.index();
                if (i < 0 || i >= itemCount - 1) {
                    return null;
                }
                return forward(i + 1);
            }

            @Override
            public Token last() {
                return backward(itemCount - 1);
            }

            @Override
            public Token previous(Token current) {
                int i = current.index();
                if (i <= 0 || i >= itemCount) {
                    return null;
                }
                return backward(i - 1);
            }
        };
    }

    private Token forward(int i) {
        for (; i < itemCount; i++) {
            if (!isComment(i)) {
                return new Token(i);
            }
        }
        return null;
    }

    private Token backward(int i) {
        for (; i >= 0; i--) {
            if (!isComment(i)) {
                return new Token(i);
            }
        }
        return null;
    }

    public SourcePos sourcePos(int offset) {
        int line = upperBoundLine(offset);
        int col = offset;
        if (line > 0) {
            col -= lines[line - 1];
        }
        return new SourcePos(name, line, col + 1, offset);
    }

    /**
     * Finds the item whose span contains the offset. When none does, the closest
     * preceding non-empty item is used if it ends exactly at the offset.
     *
     * @return the item, or {@link Item#ERROR} if nothing qualifies on the offset's line
     */
    public Item itemAtOffset(int offset) {
        if (offset < 0 || offset > data.length || itemCount == 0) {
            return Item.ERROR;
        }
        int targetLine = upperBoundLine(offset) - 1;
        int offsetMin = lines[targetLine];
        int offsetMax = data.length;
        if (targetLine < lineCount - 1) {
            offsetMax = lines[targetLine + 1] - 1;
        }
        int lo = 0;
        int hi = itemCount;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            int itemOffset = itemOffsets[mid];
            if (itemOffset >= offsetMin && (itemOffset == offset || itemOffset + itemLengths[mid] > offset)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        int target = lo;
        if (target == itemCount) {
            if (offset == data.length) {
                target--;
            } else {
                return Item.ERROR;
            }
        }
        if (itemLengths[target] == 0 || itemOffsets[target] > offset) {
            int i = target - 1;
            while (i > 0 && itemLengths[i] == 0) {
                i--;
            }
            if (i < 0) {
                return Item.ERROR;
            }
            if (itemOffsets[i] + itemLengths[i] == offset) {
                target = i;
            }
        }
        if (itemOffsets[target] > offsetMax) {
            return Item.ERROR;
        }
        return new Item(target);
    }

    /**
     * Same as {@link #itemAtOffset(int)} but never resolves to a comment.
     */
    public Token tokenAtOffset(int offset) {
        return tokenOf(itemAtOffset(offset));
    }

    // index of the first line starting after the offset, lines[0] is always 0
    private int upperBoundLine(int offset) {
        int lo = 0;
        int hi = lineCount;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (lines[mid] > offset) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    /**
     * Renders every item with alternating ANSI background colors, comments in green and
     * tokens in blue. Runs of zero-length tokens show up as a count.
     */
    public String debugAnnotated() {
        StringBuilder sb = new StringBuilder();
        int zeroLength = 0;
        for (int i = 0; i < itemCount; i++) {
            int length = itemLengths[i];
            if (length == 0) {
                zeroLength++;
                continue;
            } else if (zeroLength > 0) {
                sb.append("\u001B[1;30;47m").append(zeroLength).append("\u001B[0m");
                zeroLength = 0;
            }
            String background;
            if (isComment(i)) {
                background = i % 2 == 0 ? "\u001B[48;5;2m" : "\u001B[48;5;22m";
            } else {
                background = i % 2 == 0 ? "\u001B[48;5;4m" : "\u001B[48;5;24m";
            }
            sb.append(leadingWhitespace(i));
            sb.append(background);
            sb.append(text(itemOffsets[i], itemOffsets[i] + length));
            sb.append("\u001B[0m");
        }
        if (zeroLength > 0) {
            sb.append("\u001B[1;30;47m").append(zeroLength).append("\u001B[0m");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return name + " [lines: " + lineCount + ", items: " + itemCount + ", comments: " + commentCount + "]";
    }

    //==================================================================================================================
    // package-private accessors for the derived views

    int itemOffset(int i) {
        return itemOffsets[i];
    }

    int itemLength(int i) {
        return itemLengths[i];
    }

    int commentIndexAt(int c) {
        return commentIndex[c];
    }

    int commentAttributedToAt(int c) {
        return commentAttributedTo[c];
    }

    int commentVirtualAt(int c) {
        return commentVirtual[c];
    }

    String text(int from, int to) {
        return new String(data, from, to - from, StandardCharsets.UTF_8);
    }

    /**
     * Text between the end of the previous non-empty item and the start of item i.
     */
    String leadingWhitespace(int i) {
        return text(leadingWhitespaceStart(i), itemOffsets[i]);
    }

    int leadingWhitespaceStart(int i) {
        for (int j = i - 1; j >= 0; j--) {
            if (itemLengths[j] > 0) {
                return itemOffsets[j] + itemLengths[j];
            }
        }
        return 0;
    }

    /**
     * Copies the original bytes, so input that is not valid UTF-8 survives unchanged.
     */
    void writeRange(OutputStream out, int from, int to) throws IOException {
        out.write(data, from, to - from);
    }

    int lowerBoundCommentIndex(int index) {
        int lo = 0;
        int hi = commentCount;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (commentIndex[mid] >= index) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    int lowerBoundCommentAttribution(int index) {
        int lo = 0;
        int hi = commentCount;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (commentAttributedTo[mid] >= index) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    int lowerBoundTrailing(int endIndex) {
        int lo = 0;
        int hi = commentCount;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (commentVirtual[mid] >= endIndex
                    || (commentAttributedTo[mid] >= endIndex && commentIndex[mid] > endIndex)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

}

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

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Derived view over a span of tokens, from the start token of a node to its end token.
 * Cheap to create, never stored.
 */
public class NodeInfo implements ItemInfo {

    private final FileInfo fileInfo;
    private final int startIndex;
    private final int endIndex;

    NodeInfo(FileInfo fileInfo, int startIndex, int endIndex) {
        this.fileInfo = fileInfo;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
    }

    public boolean isValid() {
        return startIndex >= 0 && endIndex >= 0;
    }

    public FileInfo getFileInfo() {
        return fileInfo;
    }

    @Override
    public SourcePos start() {
        if (!isValid()) {
            return SourcePos.unknown(fileInfo.getName());
        }
        return fileInfo.sourcePos(fileInfo.itemOffset(startIndex));
    }

    /**
     * Exclusive end: for a non-empty token the column is one past its last byte.
     */
    @Override
    public SourcePos end() {
        if (!isValid()) {
            return SourcePos.unknown(fileInfo.getName());
        }
        int offset = fileInfo.itemOffset(endIndex);
        int length = fileInfo.itemLength(endIndex);
        if (length > 0) {
            offset += length - 1;
        }
        SourcePos pos = fileInfo.sourcePos(offset);
        if (length > 0) {
            pos = pos.withCol(pos.col() + 1);
        }
        return pos;
    }

    /**
     * Empty for virtual tokens, except for the final EOF token which carries the
     * whitespace at the end of the file.
     */
    @Override
    public String leadingWhitespace() {
        if (!isValid()) {
            return "";
        }
        if (fileInfo.itemLength(startIndex) == 0 && startIndex < fileInfo.getItemCount() - 1) {
            return "";
        }
        return fileInfo.leadingWhitespace(startIndex);
    }

    public Comments leadingComments() {
        if (!isValid()) {
            return Comments.EMPTY;
        }
        int start = fileInfo.lowerBoundCommentAttribution(startIndex);
        int count = fileInfo.getCommentCount();
        if (start == count || fileInfo.commentAttributedToAt(start) != startIndex) {
            return Comments.EMPTY;
        }
        int num = 0;
        for (int i = start; i < count; i++) {
            if (fileInfo.commentAttributedToAt(i) == startIndex && fileInfo.commentIndexAt(i) < startIndex) {
                num++;
            } else {
                break;
            }
        }
        return new Comments(fileInfo, start, num, List.of());
    }

    /**
     * Comments attributed to the end token that come after it. A comment whose real
     * anchor is a virtual token following this one is included but flagged virtual; the
     * same comment shows up un-flagged in the virtual token's own trailing comments.
     */
    public Comments trailingComments() {
        if (!isValid()) {
            return Comments.EMPTY;
        }
        int start = fileInfo.lowerBoundTrailing(endIndex);
        int count = fileInfo.getCommentCount();
        int num = 0;
        List<Integer> virtual = new ArrayList<>();
        for (int i = start; i < count; i++) {
            if (fileInfo.commentAttributedToAt(i) == endIndex) {
                if (fileInfo.commentVirtualAt(i) > 0) {
                    virtual.add(num);
                }
                num++;
            } else if (fileInfo.commentVirtualAt(i) == endIndex) {
                num++;
            } else {
                break;
            }
        }
        if (num == 0) {
            return Comments.EMPTY;
        }
        return new Comments(fileInfo, start, num, virtual);
    }

    @Override
    public String rawText() {
        if (!isValid()) {
            return "";
        }
        int from = fileInfo.itemOffset(startIndex);
        int to = fileInfo.itemOffset(endIndex) + fileInfo.itemLength(endIndex);
        return fileInfo.text(from, to);
    }

    void writeLeadingWhitespace(OutputStream out) throws IOException {
        if (isValid() && (fileInfo.itemLength(startIndex) > 0 || startIndex == fileInfo.getItemCount() - 1)) {
            fileInfo.writeRange(out, fileInfo.leadingWhitespaceStart(startIndex), fileInfo.itemOffset(startIndex));
        }
    }

    void writeRawText(OutputStream out) throws IOException {
        if (isValid()) {
            fileInfo.writeRange(out, fileInfo.itemOffset(startIndex),
                    fileInfo.itemOffset(endIndex) + fileInfo.itemLength(endIndex));
        }
    }

    @Override
    public String toString() {
        SourcePos start = start();
        SourcePos end = end();
        return start.filename() + ":" + start.line() + ":" + start.col() + "-" + end.col();
    }

}

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

/**
 * One attributed comment. {@link #isVirtual()} is set when the comment is seen from a
 * real token although it was recorded against a virtual token that follows it.
 */
public class Comment implements ItemInfo {

    private final FileInfo fileInfo;
    private final int row;
    private final boolean virtual;

    Comment(FileInfo fileInfo, int row, boolean virtual) {
        this.fileInfo = fileInfo;
        this.row = row;
        this.virtual = virtual;
    }

    public Item asItem() {
        return new Item(fileInfo.commentIndexAt(row));
    }

    public Item attributedTo() {
        return new Item(fileInfo.commentAttributedToAt(row));
    }

    /**
     * @return the virtual token this comment belongs to, {@link Item#ERROR} if none
     */
    public Item virtualItem() {
        return new Item(fileInfo.commentVirtualAt(row));
    }

    public boolean isVirtual() {
        return virtual;
    }

    @Override
    public SourcePos start() {
        return fileInfo.sourcePos(fileInfo.itemOffset(asItem().index()));
    }

    /**
     * Position of the last character of the comment. This is inclusive, unlike
     * {@link NodeInfo#end()}; see {@link #endExclusive()}.
     */
    @Override
    public SourcePos end() {
        int i = asItem().index();
        return fileInfo.sourcePos(fileInfo.itemOffset(i) + fileInfo.itemLength(i) - 1);
    }

    public SourcePos endExclusive() {
        SourcePos end = end();
        return end.withCol(end.col() + 1);
    }

    @Override
    public String leadingWhitespace() {
        return fileInfo.leadingWhitespace(asItem().index());
    }

    @Override
    public String rawText() {
        int i = asItem().index();
        int offset = fileInfo.itemOffset(i);
        return fileInfo.text(offset, offset + fileInfo.itemLength(i));
    }

    void writeTo(OutputStream out) throws IOException {
        int i = asItem().index();
        int offset = fileInfo.itemOffset(i);
        fileInfo.writeRange(out, fileInfo.leadingWhitespaceStart(i), offset + fileInfo.itemLength(i));
    }

    @Override
    public String toString() {
        SourcePos start = start();
        SourcePos end = end();
        return start.filename() + ":" + start.line() + ":" + start.col() + "-" + end.line() + ":" + end.col() + ": " + rawText();
    }

}

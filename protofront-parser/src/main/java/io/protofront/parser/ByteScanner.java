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

import java.nio.charset.StandardCharsets;

/**
 * Rune-at-a-time cursor over UTF-8 bytes. Supports a mark (start of the current lexeme)
 * and a single save slot for lookahead that must not consume input.
 */
class ByteScanner {

    static final int EOF = -1;
    static final int INVALID = -2;
    static final int REPLACEMENT = 0xFFFD;

    private final byte[] data;
    private final boolean utf8Strict;

    private int pos;
    private int mark;
    private int size;
    private boolean eof;

    private int savedPos;
    private int savedSize;
    private boolean savedEof;

    ByteScanner(byte[] data, boolean utf8Strict) {
        this.data = data;
        this.utf8Strict = utf8Strict;
    }

    /**
     * @return the next code point, {@link #EOF}, or {@link #INVALID} for a bad byte in
     * strict mode; invalid bytes otherwise decode as U+FFFD, one byte at a time
     */
    int read() {
        if (pos >= data.length) {
            eof = true;
            size = 0;
            return EOF;
        }
        int b = data[pos] & 0xFF;
        if (b < 0x80) {
            size = 1;
            pos++;
            return b;
        }
        int cp = decode(b);
        if (cp < 0) {
            size = 1;
            pos++;
            return utf8Strict ? INVALID : REPLACEMENT;
        }
        pos += size;
        return cp;
    }

    private int decode(int b) {
        int need;
        int cp;
        int min;
        if ((b & 0xE0) == 0xC0) {
            need = 1;
            cp = b & 0x1F;
            min = 0x80;
        } else if ((b & 0xF0) == 0xE0) {
            need = 2;
            cp = b & 0x0F;
            min = 0x800;
        } else if ((b & 0xF8) == 0xF0) {
            need = 3;
            cp = b & 0x07;
            min = 0x10000;
        } else {
            return -1;
        }
        if (pos + need >= data.length) {
            return -1;
        }
        for (int i = 1; i <= need; i++) {
            int c = data[pos + i] & 0xFF;
            if ((c & 0xC0) != 0x80) {
                return -1;
            }
            cp = (cp << 6) | (c & 0x3F);
        }
        if (cp < min || cp > Character.MAX_CODE_POINT || (cp >= 0xD800 && cp <= 0xDFFF)) {
            return -1;
        }
        size = need + 1;
        return cp;
    }

    /**
     * Byte size of the last rune read, 0 after EOF.
     */
    int size() {
        return size;
    }

    void unread(int count) {
        if (eof) {
            eof = false;
            return;
        }
        int newPos = pos - count;
        if (newPos < mark) {
            throw new IllegalStateException("unread past mark");
        }
        pos = newPos;
    }

    int offset() {
        return pos;
    }

    int getMark() {
        return mark;
    }

    void setMark() {
        mark = pos;
        eof = false;
    }

    void save() {
        savedPos = pos;
        savedSize = size;
        savedEof = eof;
    }

    void restore() {
        pos = savedPos;
        size = savedSize;
        eof = savedEof;
    }

    /**
     * Text from the mark to the current position.
     */
    String markText() {
        return new String(data, mark, pos - mark, StandardCharsets.UTF_8);
    }

    int byteAt(int offset) {
        return data[offset] & 0xFF;
    }

}

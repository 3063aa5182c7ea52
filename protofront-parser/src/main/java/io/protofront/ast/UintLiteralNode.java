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

/**
 * Unsigned 64-bit integer literal. Java has no unsigned long so {@link #val} must be read
 * with the {@code Long.*Unsigned*} helpers.
 */
public class UintLiteralNode extends TerminalNode {

    public final long val;
    public final String raw;

    public UintLiteralNode(long val, String raw, Token token) {
        super(token);
        this.val = val;
        this.raw = raw;
    }

    public String asUnsignedString() {
        return Long.toUnsignedString(val);
    }

    public double asDouble() {
        if (val >= 0) {
            return val;
        }
        // top bit set
        return (double) (val >>> 1) * 2.0 + (val & 1);
    }

    @Override
    public UintLiteralNode copy() {
        return new UintLiteralNode(val, raw, token);
    }

    @Override
    public String toString() {
        return raw == null ? asUnsignedString() : raw;
    }

}

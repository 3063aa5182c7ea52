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
 * A single punctuation rune. Virtual runes are inserted by the lexer and have no source
 * text, only the position they were inserted at.
 */
public class RuneNode extends TerminalNode {

    public final int rune;
    public final boolean virtual;

    public RuneNode(int rune, Token token) {
        this(rune, token, false);
    }

    public RuneNode(int rune, Token token, boolean virtual) {
        super(token);
        this.rune = rune;
        this.virtual = virtual;
    }

    public static RuneNode virtual(int rune, Token token) {
        return new RuneNode(rune, token, true);
    }

    public boolean is(char c) {
        return rune == c;
    }

    @Override
    public RuneNode copy() {
        return new RuneNode(rune, token, virtual);
    }

    @Override
    public String toString() {
        return (virtual ? "virtual '" : "'") + (rune == 0 ? "EOF" : new String(Character.toChars(rune))) + "'";
    }

}

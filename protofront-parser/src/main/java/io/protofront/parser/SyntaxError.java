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

import io.protofront.ast.SourcePos;
import io.protofront.ast.SourceSpan;

/**
 * A positioned diagnostic produced while lexing or parsing. Warnings and errors share
 * this type, the {@link ErrorHandler} decides which list it lands in.
 */
public class SyntaxError {

    public enum Kind {
        LEXICAL, PARSE, EXTENDED_SYNTAX
    }

    public enum Category {

        EMPTY_DECL("empty_decl", true),
        INCOMPLETE_DECL("incomplete_decl", false),
        EXTRA_TOKENS("extra_tokens", true),
        WRONG_TOKEN("wrong_token", true),
        MISSING_TOKEN("missing_token", true),
        DECL_NOT_ALLOWED("decl_not_allowed", false);

        public final String value;
        private final boolean canFormat;

        Category(String value, boolean canFormat) {
            this.value = value;
            this.canFormat = canFormat;
        }

        /**
         * @return true if a formatter can fix the problem without user input
         */
        public boolean canFormat() {
            return canFormat;
        }

        @Override
        public String toString() {
            return value;
        }

    }

    public final SourceSpan span;
    public final String message;
    public final Kind kind;
    public final Category category;

    public SyntaxError(SourceSpan span, String message, Kind kind, Category category) {
        this.span = span;
        this.message = message;
        this.kind = kind;
        this.category = category;
    }

    public SyntaxError(SourceSpan span, String message, Kind kind) {
        this(span, message, kind, null);
    }

    public SourcePos getStart() {
        return span.start();
    }

    public int getLine() {
        return span.start().line();
    }

    public int getColumn() {
        return span.start().col();
    }

    public boolean canFormat() {
        return category != null && category.canFormat();
    }

    @Override
    public String toString() {
        SourcePos pos = span.start();
        return pos.filename() + ":" + pos.line() + ":" + pos.col() + ": " + message;
    }

}

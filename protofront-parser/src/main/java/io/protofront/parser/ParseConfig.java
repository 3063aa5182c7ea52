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

/**
 * Immutable settings for one parse. Built fluently from {@link #defaults()}, which reads
 * the {@code protofront.*} system properties.
 */
public final class ParseConfig {

    public static final String EXTENDED_SYNTAX_PROPERTY = "protofront.extendedSyntax";
    public static final String UTF8_STRICT_PROPERTY = "protofront.utf8Strict";

    private final boolean extendedSyntax;
    private final boolean utf8Strict;
    private final int version;

    private ParseConfig(boolean extendedSyntax, boolean utf8Strict, int version) {
        this.extendedSyntax = extendedSyntax;
        this.utf8Strict = utf8Strict;
        this.version = version;
    }

    public static ParseConfig defaults() {
        boolean extendedSyntax = Boolean.parseBoolean(System.getProperty(EXTENDED_SYNTAX_PROPERTY, "true"));
        boolean utf8Strict = Boolean.parseBoolean(System.getProperty(UTF8_STRICT_PROPERTY, "false"));
        return new ParseConfig(extendedSyntax, utf8Strict, 0);
    }

    public ParseConfig extendedSyntax(boolean value) {
        return new ParseConfig(value, utf8Strict, version);
    }

    public ParseConfig utf8Strict(boolean value) {
        return new ParseConfig(extendedSyntax, value, version);
    }

    public ParseConfig version(int value) {
        return new ParseConfig(extendedSyntax, utf8Strict, value);
    }

    public boolean isExtendedSyntax() {
        return extendedSyntax;
    }

    public boolean isUtf8Strict() {
        return utf8Strict;
    }

    public int getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "ParseConfig{extendedSyntax=" + extendedSyntax + ", utf8Strict=" + utf8Strict + ", version=" + version + "}";
    }

}

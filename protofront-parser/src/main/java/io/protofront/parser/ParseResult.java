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

import io.protofront.ast.FileNode;

import java.util.List;

/**
 * Outcome of parsing one file. The tree is always present, best effort when there were
 * errors.
 */
public class ParseResult {

    private final FileNode ast;
    private final ParserException error;
    private final List<SyntaxError> warnings;

    ParseResult(FileNode ast, ParserException error, List<SyntaxError> warnings) {
        this.ast = ast;
        this.error = error;
        this.warnings = warnings;
    }

    public FileNode ast() {
        return ast;
    }

    /**
     * @return null if the file parsed without errors
     */
    public ParserException error() {
        return error;
    }

    public List<SyntaxError> warnings() {
        return warnings;
    }

    public boolean isOk() {
        return error == null;
    }

    public String getName() {
        return ast.getName();
    }

    @Override
    public String toString() {
        return ast.getName() + (error == null ? " [ok]" : " [" + error.getErrors().size() + " errors]");
    }

}

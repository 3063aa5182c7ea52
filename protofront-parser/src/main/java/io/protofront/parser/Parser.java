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
import io.protofront.common.FileUtils;
import io.protofront.common.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.List;

/**
 * Entry point: turns the bytes of one file into a {@link FileNode} that prints back to
 * exactly those bytes.
 */
public class Parser {

    static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private Parser() {
        // only static methods
    }

    public static ParseResult parse(String filename, byte[] data) {
        return parse(filename, data, new ErrorHandler(), ParseConfig.defaults());
    }

    public static ParseResult parse(Resource resource, ErrorHandler handler, ParseConfig config) {
        return parse(resource.getName(), resource.getBytes(), handler, config);
    }

    public static ParseResult parse(String filename, InputStream is, ErrorHandler handler, ParseConfig config) {
        return parse(filename, FileUtils.toBytes(is), handler, config);
    }

    public static ParseResult parse(String filename, byte[] data, ErrorHandler handler, ParseConfig config) {
        long startTime = System.nanoTime();
        ProtoLexer lexer = new ProtoLexer(filename, data, handler, config);
        ProtoParser parser = new ProtoParser(lexer, handler, config);
        FileNode ast = parser.parseFile();
        ParserException error = handler.getError();
        if (logger.isDebugEnabled()) {
            long elapsed = (System.nanoTime() - startTime) / 1000;
            logger.debug("{}: {} items, {} errors, {} warnings in {} us", filename, ast.getFileInfo().getItemCount(),
                    handler.getErrors().size(), handler.getWarnings().size(), elapsed);
        }
        return new ParseResult(ast, error, List.copyOf(handler.getWarnings()));
    }

}

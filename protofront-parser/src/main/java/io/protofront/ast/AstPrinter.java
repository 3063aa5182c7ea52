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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Reproduces the source of a parsed file from its terminals, their whitespace and their
 * comments. For any tree produced by the parser the bytes written equal the input bytes.
 */
public class AstPrinter {

    private AstPrinter() {
    }

    /**
     * Prints the file decoded as UTF-8. Use {@link #print(FileNode, OutputStream)} when
     * the input may not be valid UTF-8.
     */
    public static String print(FileNode file) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(file.getFileInfo().getLength());
        print(file, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    public static void print(FileNode file, OutputStream out) {
        FileInfo info = file.getFileInfo();
        try {
            for (TerminalNode terminal : Nodes.terminals(file)) {
                NodeInfo nodeInfo = info.nodeInfo(terminal);
                writeComments(out, nodeInfo.leadingComments());
                nodeInfo.writeLeadingWhitespace(out);
                nodeInfo.writeRawText(out);
                writeComments(out, nodeInfo.trailingComments());
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeComments(OutputStream out, Comments comments) throws IOException {
        for (Comment comment : comments) {
            if (!comment.isVirtual()) {
                comment.writeTo(out);
            }
        }
    }

}

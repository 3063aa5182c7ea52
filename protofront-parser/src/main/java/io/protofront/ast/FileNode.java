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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root of a parsed file. Holds the {@link FileInfo} all tokens in the tree index into,
 * and the pragmas found in the comments before the syntax or edition declaration.
 */
public class FileNode extends CompositeNode {

    public static final String PRAGMA_PREFIX = "//pragma:";

    public final SyntaxNode syntax;
    public final EditionNode edition;
    public final List<FileElement> decls;
    public final RuneNode eof;

    private final FileInfo fileInfo;
    private final Map<String, String> pragmas;

    public FileNode(FileInfo fileInfo, SyntaxNode syntax, EditionNode edition, List<FileElement> decls, RuneNode eof) {
        if (syntax != null && edition != null) {
            throw new AstConstructionException("FileNode: cannot have both syntax and edition");
        }
        this.fileInfo = required(fileInfo, "FileNode", "fileInfo");
        this.syntax = syntax;
        this.edition = edition;
        this.decls = listOf(decls, "FileNode", "decls");
        this.eof = required(eof, "FileNode", "eof");
        if (syntax != null) {
            pragmas = parsePragmas(fileInfo.nodeInfo(syntax).leadingComments());
        } else if (edition != null) {
            pragmas = parsePragmas(fileInfo.nodeInfo(edition).leadingComments());
        } else {
            pragmas = Collections.emptyMap();
        }
    }

    private FileNode(FileNode other) {
        this.fileInfo = other.fileInfo;
        this.syntax = Nodes.copy(other.syntax);
        this.edition = Nodes.copy(other.edition);
        this.decls = List.copyOf(Nodes.copyAll(other.decls));
        this.eof = other.eof.copy();
        this.pragmas = other.pragmas;
    }

    static Map<String, String> parsePragmas(Comments comments) {
        Map<String, String> map = null;
        for (Comment comment : comments) {
            String text = comment.rawText().trim();
            if (!text.startsWith(PRAGMA_PREFIX)) {
                continue;
            }
            text = text.substring(PRAGMA_PREFIX.length()).trim();
            if (text.isEmpty()) {
                continue;
            }
            int pos = text.indexOf(' ');
            String key = pos == -1 ? text : text.substring(0, pos);
            String value = pos == -1 ? "" : text.substring(pos + 1).trim();
            if (map == null) {
                map = new LinkedHashMap<>();
            }
            map.put(key, value);
        }
        return map == null ? Collections.emptyMap() : Collections.unmodifiableMap(map);
    }

    public FileInfo getFileInfo() {
        return fileInfo;
    }

    public String getName() {
        return fileInfo.getName();
    }

    public Map<String, String> pragmas() {
        return pragmas;
    }

    public Optional<String> pragma(String key) {
        return Optional.ofNullable(pragmas.get(key));
    }

    public NodeInfo nodeInfo(Node node) {
        return fileInfo.nodeInfo(node);
    }

    /**
     * @return the declared syntax, "editions" when an edition is declared, or empty
     */
    public String syntaxValue() {
        if (syntax != null) {
            return syntax.value();
        }
        return edition != null ? "editions" : "";
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("syntax", syntax);
        visitor.field("edition", edition);
        visitor.list("decls", decls);
        visitor.field("eof", eof);
    }

    /**
     * Deep copy of the tree. The {@link FileInfo} is shared since it is not mutated
     * after parsing.
     */
    @Override
    public FileNode copy() {
        return new FileNode(this);
    }

    @Override
    public String toString() {
        return "FileNode[" + fileInfo.getName() + "]";
    }

}

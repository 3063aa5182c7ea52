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

import io.protofront.ast.ComplexIdentComponent;
import io.protofront.ast.CompoundIdentNode;
import io.protofront.ast.CompoundStringLiteralNode;
import io.protofront.ast.FieldReferenceNode;
import io.protofront.ast.FileInfo;
import io.protofront.ast.FloatLiteralNode;
import io.protofront.ast.IdentNode;
import io.protofront.ast.IdentValueNode;
import io.protofront.ast.Node;
import io.protofront.ast.NodeInfo;
import io.protofront.ast.Nodes;
import io.protofront.ast.OptionNameNode;
import io.protofront.ast.RuneNode;
import io.protofront.ast.SourceSpan;
import io.protofront.ast.StringLiteralNode;
import io.protofront.ast.StringValueNode;
import io.protofront.ast.TerminalNode;
import io.protofront.ast.Token;
import io.protofront.ast.UintLiteralNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns source bytes into {@link Symbol}s, recording every token and comment in the
 * {@link FileInfo} as it goes. Inserts zero-length virtual {@code ;} and {@code ,} runes
 * where the source most likely omitted them, so that the grammar can assume regular
 * statement termination while a file is still being edited.
 */
public class ProtoLexer {

    static final Logger logger = LoggerFactory.getLogger(ProtoLexer.class);

    static final int AT_NEXT_NEWLINE = 1;
    static final int IMMEDIATE = 2 | AT_NEXT_NEWLINE;
    static final int AT_EOF = 8;
    static final int ONLY_IF_LAST_TOKEN_ON_LINE = 16;
    static final int INSERT_COMMA = 32;

    private static final int MAX_STRING_ERRORS = 10;
    private static final String PUNCTUATION = ";,.:=-+(){}[]<>/";
    private static final Pattern FLOAT = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    static final Set<String> KEYWORDS = Set.of(
            "syntax", "edition", "import", "weak", "public", "package", "option",
            "true", "false", "inf", "infinity", "nan",
            "repeated", "optional", "required",
            "double", "float", "int32", "int64", "uint32", "uint64", "sint32", "sint64",
            "fixed32", "fixed64", "sfixed32", "sfixed64", "bool", "string", "bytes",
            "group", "oneof", "map", "extensions", "to", "max", "reserved",
            "enum", "message", "extend", "service", "rpc", "stream", "returns");

    private static final Set<String> FIELD_START_KEYWORDS = Set.of(
            "message", "enum", "option", "reserved", "extensions", "oneof", "optional", "repeated");
    private static final Set<String> PROTO2_FIELD_START_KEYWORDS = Set.of("required", "extend", "group");

    private final FileInfo info;
    private final ByteScanner input;
    private final ErrorHandler handler;
    private final boolean extendedSyntax;

    private String syntax = "";
    private TerminalNode prevSym;
    private int prevOffset;
    private int insertSemi;
    private Symbol eof;
    private final List<Token> comments = new ArrayList<>();

    private boolean inCompoundStringLiteral;
    private boolean inCompoundIdent;
    private boolean inExtensionIdent;
    private boolean inMethodDecl;
    private boolean inMethodTypeDecl;

    private IdentParts cid;
    private IdentParts xid;
    private RuneNode refOpen;
    private RuneNode refClose;
    private final List<StringLiteralNode> strings = new ArrayList<>();

    private static class IdentParts {
        final List<IdentNode> idents = new ArrayList<>();
        final List<RuneNode> dots = new ArrayList<>();
        final List<FieldReferenceNode> refs = new ArrayList<>();
    }

    public ProtoLexer(String filename, byte[] data, ErrorHandler handler, ParseConfig config) {
        this.info = new FileInfo(filename, data, config.getVersion());
        this.input = new ByteScanner(data, config.isUtf8Strict());
        this.handler = handler;
        this.extendedSyntax = config.isExtendedSyntax();
    }

    public FileInfo getFileInfo() {
        return info;
    }

    /**
     * The parser calls this once the syntax or edition declaration is known, it changes
     * which keywords can start a field in the partial-field heuristic.
     */
    public void setSyntax(String syntax) {
        this.syntax = syntax == null ? "" : syntax;
    }

    public Symbol next() {
        Symbol sym = lex();
        if (logger.isTraceEnabled()) {
            logger.trace("{}: {}", info.getName(), sym);
        }
        return sym;
    }

    private Symbol lex() {
        if (eof != null) {
            return eof;
        }
        if (handler.isAborted()) {
            return abortedEof();
        }
        while (true) {
            input.setMark();
            prevOffset = input.offset();
            int c = input.read();
            int sz = input.size();
            if (c == ByteScanner.EOF) {
                return atEof();
            }
            switch (c) {
                case '\r':
                case '\t':
                case '\f':
                case 0x0B:
                case ' ':
                    continue;
            }
            if ((insertSemi & IMMEDIATE) == IMMEDIATE) {
                int rn = pendingRune();
                if (c != rn) {
                    insertSemi = 0;
                    return writeVirtualRune(rn, sz);
                }
                insertSemi = 0;
            }
            switch (c) {
                case '}':
                case '>':
                    insertSemi = IMMEDIATE;
                    break;
                case ']':
                    if (prevSym != null && !isRune(prevSym, ',') && !isRune(prevSym, '[')) {
                        return writeVirtualRune(',', sz);
                    }
                    insertSemi = IMMEDIATE;
                    break;
                case '=':
                    if (matchNextRune(']') != 0) {
                        insertSemi = IMMEDIATE | INSERT_COMMA;
                    }
                    break;
                case ':':
                    if (matchNextRune('}') != 0) {
                        insertSemi = peekNewline() ? AT_NEXT_NEWLINE | ONLY_IF_LAST_TOKEN_ON_LINE : IMMEDIATE;
                    } else {
                        insertSemi = AT_NEXT_NEWLINE | ONLY_IF_LAST_TOKEN_ON_LINE;
                    }
                    break;
                case '\n':
                    if ((insertSemi & AT_NEXT_NEWLINE) != 0) {
                        int rn = pendingRune();
                        boolean canInsert = true;
                        if (prevSym instanceof RuneNode) {
                            int prev = ((RuneNode) prevSym).rune;
                            canInsert = rn == ';' ? canDirectlyPrecedeVirtualSemi(prev) : canDirectlyPrecedeVirtualComma(prev);
                        }
                        if (canInsert) {
                            if (inCompoundIdent) {
                                input.unread(sz);
                                if (inExtensionIdent) {
                                    endExtensionIdent();
                                    continue;
                                }
                                return endCompoundIdent();
                            }
                            insertSemi = 0;
                            return writeVirtualRune(rn, sz);
                        }
                        insertSemi = 0;
                    }
                    info.addLine(input.offset());
                    continue;
                default:
                    if ((insertSemi & ONLY_IF_LAST_TOKEN_ON_LINE) != 0 && c != '/') {
                        insertSemi = 0;
                    }
            }

            if (c == '.' && !inCompoundIdent) {
                int cn = input.read();
                if (isDigit(cn)) {
                    readNumber();
                    return floatLiteral(input.markText());
                }
                input.unread(input.size());
            }

            if (c == '(') {
                boolean extensionParen = !inMethodDecl && !isIdent(prevSym, "returns");
                if (extensionParen) {
                    if (inExtensionIdent) {
                        return error("unexpected '(' in extension identifier", abandonCompound());
                    }
                    beginExtensionIdent();
                    refOpen = setRune(c);
                    continue;
                }
                inMethodTypeDecl = true;
            } else if (c == ')') {
                if (inMethodTypeDecl) {
                    if (inCompoundIdent) {
                        input.unread(sz);
                        return endCompoundIdent();
                    }
                    inMethodTypeDecl = false;
                } else {
                    if (!inExtensionIdent) {
                        return error("unexpected ')'", abandonCompound());
                    }
                    refClose = setRune(c);
                    endExtensionIdent();
                    int next = matchNextRune('.', '(');
                    if (next == 0) {
                        return endCompoundIdent();
                    }
                    if (next == '(') {
                        extendedSyntax("expected '='", SyntaxError.Category.MISSING_TOKEN);
                    }
                    continue;
                }
            }

            if (c == '.' || c == '_' || isLetter(c)) {
                if (c == '.') {
                    if (!inCompoundIdent) {
                        beginCompoundIdent();
                    }
                    if (peekWhitespace()) {
                        maybeProcessPartialField(".");
                    }
                    cid.dots.add(setRune(c));
                    continue;
                }
                readIdentifier();
                String str = input.markText();
                maybeProcessPartialField(str);
                int next = matchNextRune('.', ')');
                if (next != 0) {
                    if (!inCompoundIdent && next == '.') {
                        if (KEYWORDS.contains(str) && peekWhitespace()) {
                            // "optional .foo.Bar" must not glue the label to the type
                            return Symbol.ident(setIdent(str, true));
                        }
                        beginCompoundIdent();
                        cid.idents.add(setIdent(str, false));
                        continue;
                    }
                    if (inCompoundIdent) {
                        cid.idents.add(setIdent(str, false));
                        if (next == ')') {
                            if (inMethodTypeDecl) {
                                return endCompoundIdent();
                            } else if (!inExtensionIdent) {
                                return error("unexpected ')' in compound identifier", abandonCompound());
                            }
                        }
                        continue;
                    }
                } else if (inCompoundIdent) {
                    if (inExtensionIdent) {
                        if (peekNewline()) {
                            cid.idents.add(setIdent(str, false));
                            continue;
                        }
                        return error("unexpected '" + new String(Character.toChars(c)) + "' in extension identifier",
                                abandonCompound());
                    }
                    cid.idents.add(setIdent(str, false));
                    return endCompoundIdent();
                }
                boolean keyword = KEYWORDS.contains(str);
                if (keyword) {
                    applyKeywordHeuristics(str);
                }
                return Symbol.ident(setIdent(str, keyword));
            }

            if (inCompoundIdent && c != '/') {
                input.unread(sz);
                return closeCompoundIdent();
            }

            if (isDigit(c)) {
                readNumber();
                return numberLiteral(input.markText());
            }

            if (c == '\'' || c == '"') {
                String value = readStringLiteral(c);
                if (value == null) {
                    List<TerminalNode> orphans = new ArrayList<>(strings);
                    strings.clear();
                    inCompoundStringLiteral = false;
                    return Symbol.error(orphans);
                }
                StringLiteralNode node = new StringLiteralNode(value, newToken());
                if (!inCompoundStringLiteral) {
                    strings.clear();
                }
                strings.add(node);
                setPrevAndAddComments(node);
                if (matchNextRune('"', '\'') != 0) {
                    inCompoundStringLiteral = true;
                    continue;
                }
                inCompoundStringLiteral = false;
                if (matchNextRune(',', ']') == 0) {
                    insertSemi |= AT_NEXT_NEWLINE | ONLY_IF_LAST_TOKEN_ON_LINE;
                }
                return Symbol.string(takeStringValue());
            }

            if (c == '/') {
                int cn = input.read();
                if (cn == '/') {
                    if (!skipToEndOfLineComment()) {
                        return error("invalid control character");
                    }
                    comments.add(newToken());
                    continue;
                }
                if (cn == '*') {
                    int result = skipToEndOfBlockComment();
                    if (result < 0) {
                        return error("invalid control character");
                    }
                    if (result == 0) {
                        return error("block comment never terminates, unexpected EOF");
                    }
                    comments.add(newToken());
                    continue;
                }
                input.unread(input.size());
            }

            if (inCompoundIdent) {
                input.unread(sz);
                return closeCompoundIdent();
            }

            if (c == ByteScanner.INVALID) {
                return error(String.format("invalid UTF-8 at offset %d: %02x", prevOffset, input.byteAt(prevOffset)));
            }
            if (c < 32 || c == 127) {
                return error("invalid control character");
            }
            if (PUNCTUATION.indexOf(c) < 0) {
                return error("invalid character");
            }
            return Symbol.rune(setRune(c));
        }
    }

    private Symbol atEof() {
        if (inCompoundIdent) {
            return closeCompoundIdent();
        }
        if (insertSemi != 0) {
            int rn = pendingRune();
            insertSemi = 0;
            if (!isRune(prevSym, (char) rn)) {
                return writeVirtualRune(rn, 0);
            }
        }
        if (prevSym instanceof IdentNode) {
            switch (((IdentNode) prevSym).val) {
                case "extend":
                case "import":
                case "public":
                case "weak":
                    return writeVirtualRune(';', 0);
            }
        }
        eof = Symbol.eof(setRune(0));
        return eof;
    }

    private Symbol abortedEof() {
        RuneNode node = new RuneNode(0, info.addToken(info.getLength(), 0));
        setPrevAndAddComments(node);
        eof = Symbol.eof(node);
        return eof;
    }

    private int pendingRune() {
        return (insertSemi & INSERT_COMMA) == INSERT_COMMA ? ',' : ';';
    }

    private static boolean canDirectlyPrecedeVirtualSemi(int c) {
        return c != ';' && c != '{' && c != '<';
    }

    private static boolean canDirectlyPrecedeVirtualComma(int c) {
        return c != ',' && c != '{' && c != '<';
    }

    private boolean canStartField() {
        return isRune(prevSym, '{') || isRune(prevSym, ';');
    }

    private boolean canStartFileElement() {
        return prevSym == null || isRune(prevSym, ';');
    }

    private static boolean isRune(TerminalNode node, char c) {
        return node instanceof RuneNode && ((RuneNode) node).rune == c;
    }

    private static boolean isIdent(TerminalNode node, String value) {
        return node instanceof IdentNode && ((IdentNode) node).val.equals(value);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isHexDigit(int c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isOctalDigit(int c) {
        return c >= '0' && c <= '7';
    }

    //==================================================================================================================
    // heuristics

    private void applyKeywordHeuristics(String keyword) {
        switch (keyword) {
            case "rpc":
                if (canStartField()) {
                    PeekedIdents next = peekNextIdentsFast(2);
                    if (next.idents.size() == 1 && !next.idents.get(0).contains(".") && next.nextRune == '(') {
                        inMethodDecl = true;
                    }
                }
                break;
            case "package":
                if (canStartFileElement() && peekWhitespace()) {
                    insertSemi |= AT_NEXT_NEWLINE;
                }
                break;
            case "option":
                if (canStartFileElement()) {
                    insertSemi |= AT_EOF;
                }
                break;
            case "import":
                if (canStartFileElement()) {
                    List<String> next = peekNextIdentsFast(2).idents;
                    if (!next.isEmpty() && next.get(0).equals("import")) {
                        // import followed by another import statement
                        insertSemi |= AT_NEXT_NEWLINE;
                    } else if (next.size() == 2 && (next.get(0).equals("public") || next.get(0).equals("weak"))
                            && next.get(1).equals("import")) {
                        insertSemi |= AT_NEXT_NEWLINE;
                    }
                }
                break;
            case "extend":
                if (canStartField() || canStartFileElement()) {
                    PeekedIdents next = peekNextIdentsFast(2);
                    switch (next.idents.size()) {
                        case 0:
                            if (peekNewline()) {
                                insertSemi |= AT_NEXT_NEWLINE;
                            }
                            break;
                        case 1:
                            if (next.nextRune != '{') {
                                insertSemi |= AT_NEXT_NEWLINE;
                            }
                            break;
                        default:
                            insertSemi |= AT_NEXT_NEWLINE;
                    }
                }
                break;
            case "returns":
                inMethodDecl = false;
                break;
        }
    }

    private boolean isFieldStartKeyword(String ident) {
        if (FIELD_START_KEYWORDS.contains(ident)) {
            return true;
        }
        // no syntax declared means proto2
        return PROTO2_FIELD_START_KEYWORDS.contains(ident) && !syntax.equals("proto3");
    }

    /**
     * Detects an identifier that ends a partially typed member declaration, such as a
     * lone label or type on its own line, and schedules a virtual semicolon after it.
     */
    private void maybeProcessPartialField(String ident) {
        if (!canStartField()) {
            return;
        }
        PeekedIdents next = peekNextIdentsFast(2);
        switch (next.idents.size()) {
            case 2:
                if (ident.equals("option")) {
                    // option can't be followed by two idents
                    insertSemi |= AT_NEXT_NEWLINE;
                } else if (isFieldStartKeyword(next.idents.get(0)) || isFieldStartKeyword(next.idents.get(1))) {
                    insertSemi |= AT_NEXT_NEWLINE;
                }
                break;
            case 1:
                if (next.nextRune != '{' && isFieldStartKeyword(next.idents.get(0))) {
                    insertSemi |= AT_NEXT_NEWLINE;
                } else if (next.nextRune == ':') {
                    insertSemi |= AT_NEXT_NEWLINE | ONLY_IF_LAST_TOKEN_ON_LINE;
                }
                break;
            default:
                if (next.nextRune == '}') {
                    insertSemi |= IMMEDIATE;
                } else if (next.nextRune == '(' && ident.equals("option")) {
                    insertSemi |= AT_NEXT_NEWLINE;
                }
        }
    }

    //==================================================================================================================
    // compound identifiers

    private void beginCompoundIdent() {
        inCompoundIdent = true;
        cid = new IdentParts();
    }

    private void beginExtensionIdent() {
        if (!inCompoundIdent) {
            beginCompoundIdent();
        }
        inExtensionIdent = true;
        xid = cid;
        cid = new IdentParts();
    }

    private void endExtensionIdent() {
        IdentParts parts = cid;
        IdentValueNode name = null;
        if (parts.dots.isEmpty() && parts.idents.size() == 1) {
            name = new IdentValueNode(parts.idents.get(0));
        } else if (!parts.dots.isEmpty()) {
            name = new IdentValueNode(new CompoundIdentNode(sortedComponents(parts.idents, parts.dots)));
        } else if (parts.idents.size() > 1) {
            // unreachable in practice, idents only accumulate together with dots
            name = new IdentValueNode(new CompoundIdentNode(sortedComponents(parts.idents, parts.dots)));
        } else {
            extendedSyntax("extension name cannot be empty", SyntaxError.Category.EMPTY_DECL);
        }
        FieldReferenceNode ref = new FieldReferenceNode(refOpen, null, null, name, null, refClose, null);
        xid.refs.add(ref);
        cid = xid;
        xid = null;
        refOpen = null;
        refClose = null;
        inExtensionIdent = false;
    }

    private Symbol closeCompoundIdent() {
        if (inExtensionIdent) {
            endExtensionIdent();
        }
        return endCompoundIdent();
    }

    private Symbol endCompoundIdent() {
        IdentParts parts = cid;
        cid = null;
        inCompoundIdent = false;
        if (parts.idents.isEmpty() && parts.refs.isEmpty()) {
            // dots only
            return Symbol.compoundIdent(SymbolType.FULLY_QUALIFIED_IDENT,
                    new CompoundIdentNode(sortedComponents(List.of(), parts.dots)));
        }
        if (!parts.refs.isEmpty()) {
            List<FieldReferenceNode> refs = new ArrayList<>(parts.refs);
            for (IdentNode ident : parts.idents) {
                refs.add(new FieldReferenceNode(new IdentValueNode(ident)));
            }
            refs.sort(Comparator.comparingInt(ref -> ref.start().index()));
            List<ComplexIdentComponent> components = new ArrayList<>();
            for (FieldReferenceNode ref : refs) {
                components.add(new ComplexIdentComponent(ref));
            }
            for (RuneNode dot : parts.dots) {
                components.add(new ComplexIdentComponent(dot));
            }
            components.sort(Comparator.comparingInt(part -> part.start().index()));
            FieldReferenceNode first = refs.get(0);
            if (!parts.dots.isEmpty() && first.isExtension() && parts.dots.get(0).token.isBefore(first.open.token)) {
                extendedSyntaxAt("unexpected leading '.'", parts.dots.get(0), SyntaxError.Category.EXTRA_TOKENS);
            }
            return Symbol.optionName(new OptionNameNode(components));
        }
        if (parts.dots.isEmpty()) {
            // the dot that opened this compound never arrived
            return Symbol.ident(parts.idents.get(0));
        }
        List<ComplexIdentComponent> components = sortedComponents(parts.idents, parts.dots);
        SymbolType type = parts.dots.get(0).token.isBefore(parts.idents.get(0).token)
                ? SymbolType.FULLY_QUALIFIED_IDENT : SymbolType.QUALIFIED_IDENT;
        return Symbol.compoundIdent(type, new CompoundIdentNode(components));
    }

    private static List<ComplexIdentComponent> sortedComponents(List<IdentNode> idents, List<RuneNode> dots) {
        List<ComplexIdentComponent> list = new ArrayList<>();
        for (IdentNode ident : idents) {
            list.add(new ComplexIdentComponent(ident));
        }
        for (RuneNode dot : dots) {
            list.add(new ComplexIdentComponent(dot));
        }
        list.sort(Comparator.comparingInt(part -> part.start().index()));
        return list;
    }

    /**
     * Drops any half-built compound identifier and returns its terminals, so that an
     * error symbol can still carry them to the parser.
     */
    private List<TerminalNode> abandonCompound() {
        List<TerminalNode> list = new ArrayList<>();
        for (IdentParts parts : new IdentParts[]{xid, cid}) {
            if (parts == null) {
                continue;
            }
            list.addAll(parts.idents);
            list.addAll(parts.dots);
            for (FieldReferenceNode ref : parts.refs) {
                list.addAll(Nodes.terminals(ref));
            }
        }
        if (refOpen != null) {
            list.add(refOpen);
        }
        list.sort(Comparator.comparingInt(node -> node.token.index()));
        cid = null;
        xid = null;
        refOpen = null;
        refClose = null;
        inCompoundIdent = false;
        inExtensionIdent = false;
        return list;
    }

    private StringValueNode takeStringValue() {
        StringValueNode value;
        if (strings.size() == 1) {
            value = new StringValueNode(strings.get(0));
        } else {
            value = new StringValueNode(new CompoundStringLiteralNode(new ArrayList<>(strings)));
        }
        strings.clear();
        return value;
    }

    //==================================================================================================================
    // tokens and comments

    private Token newToken() {
        int offset = input.getMark();
        return info.addToken(offset, input.offset() - offset);
    }

    private RuneNode setRune(int c) {
        RuneNode node = new RuneNode(c, newToken());
        setPrevAndAddComments(node);
        return node;
    }

    private IdentNode setIdent(String value, boolean keyword) {
        IdentNode node = new IdentNode(value, newToken(), keyword);
        setPrevAndAddComments(node);
        return node;
    }

    private Symbol writeVirtualRune(int rune, int size) {
        input.unread(size);
        RuneNode node = RuneNode.virtual(rune, info.addToken(input.offset(), 0));
        setPrevAndAddComments(node);
        return Symbol.rune(node);
    }

    /**
     * Attributes pending comments. The first comment becomes a trailing comment of the
     * previous terminal when it starts on that terminal's line and the next terminal is on a
     * later line, unless it is a lone block comment ending on the next terminal's line.
     * Everything else leads the new terminal.
     */
    private void setPrevAndAddComments(TerminalNode node) {
        List<Token> pending = new ArrayList<>(comments);
        comments.clear();
        Token donated = null;
        if (prevSym != null && !pending.isEmpty()) {
            int prevEnd = info.tokenInfo(prevSym.token).end().line();
            int nodeStart = info.tokenInfo(node.token).start().line();
            if (nodeStart == prevEnd && node instanceof RuneNode && ((RuneNode) node).rune == 0) {
                // a final comment on the last line trails the last token
                nodeStart++;
            }
            Token first = pending.get(0);
            NodeInfo commentInfo = info.tokenInfo(first);
            if (nodeStart > prevEnd && commentInfo.start().line() == prevEnd) {
                boolean canDonate = commentInfo.rawText().startsWith("//")
                        || pending.size() > 1
                        || commentInfo.end().line() < nodeStart;
                if (canDonate) {
                    donated = first;
                    pending.remove(0);
                }
            }
        }
        if (donated != null) {
            info.addComment(donated, prevSym.token);
        }
        boolean virtual = node instanceof RuneNode && ((RuneNode) node).virtual;
        for (Token comment : pending) {
            if (virtual && prevSym != null) {
                info.addVirtualComment(comment, prevSym.token, node.token);
            } else {
                info.addComment(comment, node.token);
            }
        }
        prevSym = node;
    }

    //==================================================================================================================
    // literals

    private void readIdentifier() {
        while (true) {
            int c = input.read();
            if (c == ByteScanner.EOF) {
                return;
            }
            if (c != '_' && !isLetter(c) && !isDigit(c)) {
                input.unread(input.size());
                return;
            }
        }
    }

    private void readNumber() {
        boolean allowExpSign = false;
        while (true) {
            int c = input.read();
            if (c == ByteScanner.EOF) {
                return;
            }
            if ((c == '-' || c == '+') && !allowExpSign) {
                input.unread(input.size());
                return;
            }
            allowExpSign = false;
            if (c != '.' && c != '_' && c != '-' && c != '+' && !isLetter(c) && !isDigit(c)) {
                input.unread(input.size());
                return;
            }
            if (c == 'e' || c == 'E') {
                allowExpSign = true;
            }
        }
    }

    private Symbol numberLiteral(String token) {
        if (token.startsWith("0x") || token.startsWith("0X")) {
            String digits = token.substring(2);
            if (!isUnsigned(digits, 16)) {
                return error(numError(false, "hexadecimal integer", digits));
            }
            long value;
            try {
                value = Long.parseUnsignedLong(digits, 16);
            } catch (NumberFormatException e) {
                return error(numError(true, "hexadecimal integer", digits));
            }
            return intLiteral(value, token, ',', ']');
        }
        if (token.indexOf('.') >= 0 || token.indexOf('e') >= 0 || token.indexOf('E') >= 0) {
            return floatLiteral(token);
        }
        int radix = token.charAt(0) == '0' ? 8 : 10;
        String kind = radix == 8 ? "octal integer" : "integer";
        if (!isUnsigned(token, radix)) {
            return error(numError(false, kind, token));
        }
        long value;
        try {
            value = Long.parseUnsignedLong(token, radix);
        } catch (NumberFormatException e) {
            if (radix == 10) {
                // too big for a uint64, try again as a float
                Double d = parseFloat(token);
                if (d != null) {
                    FloatLiteralNode node = new FloatLiteralNode(d, token, newToken());
                    setPrevAndAddComments(node);
                    return Symbol.floatLit(node);
                }
            }
            return error(numError(true, kind, token));
        }
        return intLiteral(value, token, '[', ',', ']');
    }

    private Symbol intLiteral(long value, String raw, char... suppressors) {
        UintLiteralNode node = new UintLiteralNode(value, raw, newToken());
        setPrevAndAddComments(node);
        if (matchNextRune(suppressors) == 0) {
            insertSemi |= AT_NEXT_NEWLINE | ONLY_IF_LAST_TOKEN_ON_LINE;
        }
        return Symbol.uint(node);
    }

    private Symbol floatLiteral(String token) {
        Double value = parseFloat(token);
        if (value == null) {
            return error(numError(false, "float", token));
        }
        FloatLiteralNode node = new FloatLiteralNode(value, token, newToken());
        setPrevAndAddComments(node);
        if (matchNextRune(',', ']') == 0) {
            insertSemi |= AT_NEXT_NEWLINE | ONLY_IF_LAST_TOKEN_ON_LINE;
        }
        return Symbol.floatLit(node);
    }

    /**
     * @return null for a syntax error; values too large become infinity
     */
    static Double parseFloat(String token) {
        if (!FLOAT.matcher(token).matches()) {
            return null;
        }
        return Double.parseDouble(token);
    }

    private static boolean isUnsigned(String digits, int radix) {
        if (digits.isEmpty()) {
            return false;
        }
        for (int i = 0; i < digits.length(); i++) {
            if (Character.digit(digits.charAt(i), radix) < 0) {
                return false;
            }
        }
        return true;
    }

    static String numError(boolean outOfRange, String kind, String text) {
        if (outOfRange) {
            return "value out of range for " + kind + ": " + text;
        }
        return "invalid syntax in " + kind + " value: " + text;
    }

    private static class EscapeErrors {
        int count;
        boolean noMore;
        SyntaxError pending;
    }

    /**
     * Reads the rest of a quoted literal and decodes its escapes.
     *
     * @return the decoded value, or null when errors were reported
     */
    private String readStringLiteral(int quote) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        EscapeErrors errors = new EscapeErrors();
        while (true) {
            int c = input.read();
            if (c == ByteScanner.EOF) {
                return stringFailed(errors, "unexpected EOF");
            }
            if (c == ByteScanner.INVALID) {
                int offset = input.offset() - 1;
                return stringFailed(errors, String.format("invalid UTF-8 at offset %d: %02x", offset, input.byteAt(offset)));
            }
            if (c == '\n') {
                return stringFailed(errors, "encountered end-of-line before end of string literal");
            }
            if (c == quote) {
                break;
            }
            if (c == 0) {
                escapeError(errors, input.offset() - 1, "null character ('\\0') not allowed in string literal");
                continue;
            }
            if (c != '\\') {
                writeCodePoint(buf, c);
                continue;
            }
            int start = input.offset() - 1;
            c = input.read();
            if (c == ByteScanner.EOF) {
                return stringFailed(errors, "unexpected EOF");
            }
            if (c == 'x' || c == 'X') {
                int c1 = input.read();
                if (c1 == ByteScanner.EOF) {
                    return stringFailed(errors, "unexpected EOF");
                }
                if (c1 == quote || c1 == '\\') {
                    input.unread(input.size());
                    escapeError(errors, start, "invalid hex escape: \\" + (char) c);
                    continue;
                }
                String hex = new String(Character.toChars(c1));
                int c2 = input.read();
                if (c2 == ByteScanner.EOF) {
                    return stringFailed(errors, "unexpected EOF");
                }
                if (isHexDigit(c2)) {
                    hex += (char) c2;
                } else {
                    input.unread(input.size());
                }
                if (!isUnsigned(hex, 16)) {
                    escapeError(errors, start, "invalid hex escape: \\" + (char) c + hex);
                    continue;
                }
                buf.write(Integer.parseInt(hex, 16));
            } else if (isOctalDigit(c)) {
                StringBuilder octal = new StringBuilder().append((char) c);
                for (int i = 0; i < 2; i++) {
                    int cn = input.read();
                    if (cn == ByteScanner.EOF) {
                        return stringFailed(errors, "unexpected EOF");
                    }
                    if (!isOctalDigit(cn)) {
                        input.unread(input.size());
                        break;
                    }
                    octal.append((char) cn);
                }
                int value = Integer.parseInt(octal.toString(), 8);
                if (value > 0xff) {
                    escapeError(errors, start, "octal escape is out range, must be between 0 and 377: \\" + octal);
                    continue;
                }
                buf.write(value);
            } else if (c == 'u' || c == 'U') {
                int width = c == 'u' ? 4 : 8;
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < width; i++) {
                    int cn = input.read();
                    if (cn == ByteScanner.EOF) {
                        return stringFailed(errors, "unexpected EOF");
                    }
                    if (cn == quote || cn == '\\') {
                        input.unread(input.size());
                        break;
                    }
                    sb.appendCodePoint(cn);
                }
                String codepoint = sb.toString();
                String prefix = "\\" + (char) c;
                if (codepoint.length() < width || !isUnsigned(codepoint, 16)) {
                    escapeError(errors, start, "invalid unicode escape: " + prefix + codepoint);
                    continue;
                }
                long value = Long.parseLong(codepoint, 16);
                if (value > Integer.MAX_VALUE) {
                    escapeError(errors, start, "invalid unicode escape: " + prefix + codepoint);
                    continue;
                }
                if (value > Character.MAX_CODE_POINT) {
                    escapeError(errors, start, "unicode escape is out of range, must be between 0 and 0x10ffff: "
                            + prefix + codepoint);
                    continue;
                }
                writeCodePoint(buf, (int) value);
            } else {
                switch (c) {
                    case 'a':
                        buf.write(7);
                        break;
                    case 'b':
                        buf.write('\b');
                        break;
                    case 'f':
                        buf.write('\f');
                        break;
                    case 'n':
                        buf.write('\n');
                        break;
                    case 'r':
                        buf.write('\r');
                        break;
                    case 't':
                        buf.write('\t');
                        break;
                    case 'v':
                        buf.write(0x0B);
                        break;
                    case '\\':
                    case '\'':
                    case '"':
                    case '?':
                        buf.write(c);
                        break;
                    default:
                        escapeError(errors, start, "invalid escape sequence: \\" + new String(Character.toChars(c)));
                }
            }
        }
        if (errors.noMore && errors.count > MAX_STRING_ERRORS) {
            reportTooManyErrors(errors);
        }
        if (errors.pending != null) {
            handler.handleError(errors.pending);
            return null;
        }
        return new String(buf.toByteArray(), StandardCharsets.UTF_8);
    }

    private String stringFailed(EscapeErrors errors, String message) {
        if (errors.count > MAX_STRING_ERRORS) {
            reportTooManyErrors(errors);
        }
        handler.handleError(new SyntaxError(spanAt(prevOffset), message, SyntaxError.Kind.LEXICAL));
        return null;
    }

    private void reportTooManyErrors(EscapeErrors errors) {
        handler.handleError(new SyntaxError(spanAt(prevOffset),
                "too many errors (" + errors.count + ") encountered while parsing string literal",
                SyntaxError.Kind.LEXICAL));
    }

    /**
     * Keeps the latest escape error pending and reports the one before it, so that the
     * final one can be reported after the summary once the literal is done.
     */
    private void escapeError(EscapeErrors errors, int offset, String message) {
        errors.count++;
        if (errors.noMore) {
            return;
        }
        if (errors.pending != null && !handler.handleError(errors.pending)) {
            errors.noMore = true;
        }
        errors.pending = new SyntaxError(spanAt(offset), message, SyntaxError.Kind.LEXICAL);
        if (errors.count > MAX_STRING_ERRORS) {
            errors.noMore = true;
        }
    }

    private static void writeCodePoint(ByteArrayOutputStream buf, int cp) {
        if (cp < 0 || cp > Character.MAX_CODE_POINT || (cp >= 0xD800 && cp <= 0xDFFF)) {
            cp = ByteScanner.REPLACEMENT;
        }
        byte[] bytes = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8);
        buf.write(bytes, 0, bytes.length);
    }

    /**
     * @return false if a NUL byte was found before the end of the line
     */
    private boolean skipToEndOfLineComment() {
        while (true) {
            int c = input.read();
            if (c == ByteScanner.EOF) {
                return true;
            }
            if (c == '\n') {
                input.unread(input.size());
                return true;
            }
            if (c == 0) {
                return false;
            }
        }
    }

    /**
     * @return 1 when terminated, 0 at EOF, -1 on a NUL byte
     */
    private int skipToEndOfBlockComment() {
        while (true) {
            int c = input.read();
            if (c == ByteScanner.EOF) {
                return 0;
            }
            if (c == 0) {
                return -1;
            }
            if (c == '\n') {
                info.addLine(input.offset());
            }
            if (c == '*') {
                int cn = input.read();
                if (cn == '/') {
                    return 1;
                }
                input.unread(input.size());
            }
        }
    }

    //==================================================================================================================
    // lookahead, never consumes input

    private static final class PeekedIdents {

        final List<String> idents = new ArrayList<>();
        int nextRune;

    }

    private int skipToNextRune(boolean stopAtNewline) {
        while (true) {
            int c = input.read();
            switch (c) {
                case ByteScanner.EOF:
                    return 0;
                case '/': {
                    int cn = input.read();
                    if (cn == '/') {
                        skipLineCommentQuietly();
                        continue;
                    }
                    if (cn == '*') {
                        if (!skipBlockCommentQuietly()) {
                            return 0;
                        }
                        continue;
                    }
                    input.unread(input.size());
                    input.unread(1);
                    return '/';
                }
                case '\r':
                case '\t':
                case '\f':
                case 0x0B:
                case ' ':
                    continue;
                case '\n':
                    if (!stopAtNewline) {
                        continue;
                    }
                    input.unread(1);
                    return c;
                default:
                    input.unread(input.size());
                    return c;
            }
        }
    }

    private void skipLineCommentQuietly() {
        while (true) {
            int c = input.read();
            if (c == ByteScanner.EOF || c == 0) {
                return;
            }
            if (c == '\n') {
                input.unread(1);
                return;
            }
        }
    }

    private boolean skipBlockCommentQuietly() {
        while (true) {
            int c = input.read();
            if (c == ByteScanner.EOF) {
                return false;
            }
            if (c == '*') {
                int cn = input.read();
                if (cn == '/') {
                    return true;
                }
                input.unread(input.size());
            }
        }
    }

    private int matchNextRune(char... targets) {
        input.save();
        try {
            skipToNextRune(false);
            int c = input.read();
            for (char target : targets) {
                if (c == target) {
                    return c;
                }
            }
            return 0;
        } finally {
            input.restore();
        }
    }

    private boolean peekWhitespace() {
        input.save();
        try {
            int c = input.read();
            switch (c) {
                case ByteScanner.EOF:
                case '\n':
                case '\r':
                case '\t':
                case '\f':
                case 0x0B:
                case ' ':
                    return true;
                default:
                    return false;
            }
        } finally {
            input.restore();
        }
    }

    private boolean peekNewline() {
        input.save();
        try {
            skipToNextRune(true);
            int c = input.read();
            return c == ByteScanner.EOF || c == '\n';
        } finally {
            input.restore();
        }
    }

    private PeekedIdents peekNextIdentsFast(int count) {
        PeekedIdents result = new PeekedIdents();
        input.save();
        try {
            for (int i = 0; i < count; i++) {
                result.nextRune = skipToNextRune(false);
                int start = input.offset();
                while (true) {
                    int c = input.read();
                    if (c == ByteScanner.EOF) {
                        break;
                    }
                    if (c != '_' && c != '.' && !isLetter(c) && !isDigit(c)) {
                        input.unread(input.size());
                        break;
                    }
                }
                int end = input.offset();
                if (end > start) {
                    result.idents.add(text(start, end));
                }
            }
            return result;
        } finally {
            input.restore();
        }
    }

    private String text(int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            sb.append((char) input.byteAt(i));
        }
        return sb.toString();
    }

    //==================================================================================================================
    // diagnostics

    private SourceSpan spanAt(int offset) {
        return SourceSpan.of(info.sourcePos(offset));
    }

    private Symbol error(String message) {
        return error(message, List.of());
    }

    private Symbol error(String message, List<TerminalNode> orphans) {
        handler.handleError(new SyntaxError(spanAt(prevOffset), message, SyntaxError.Kind.LEXICAL));
        return Symbol.error(orphans);
    }

    private void extendedSyntax(String message, SyntaxError.Category category) {
        report(new SyntaxError(spanAt(prevOffset), message, SyntaxError.Kind.EXTENDED_SYNTAX, category));
    }

    private void extendedSyntaxAt(String message, Node node, SyntaxError.Category category) {
        report(new SyntaxError(info.nodeInfo(node), message, SyntaxError.Kind.EXTENDED_SYNTAX, category));
    }

    private void report(SyntaxError error) {
        if (extendedSyntax) {
            handler.handleWarning(error);
        } else {
            handler.handleError(error);
        }
    }

}

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

import io.protofront.ast.ArrayLiteralElement;
import io.protofront.ast.ArrayLiteralNode;
import io.protofront.ast.CompactOptionsNode;
import io.protofront.ast.CompoundIdentNode;
import io.protofront.ast.EditionNode;
import io.protofront.ast.EmptyDeclNode;
import io.protofront.ast.EnumElement;
import io.protofront.ast.EnumNode;
import io.protofront.ast.EnumValueNode;
import io.protofront.ast.ErrorNode;
import io.protofront.ast.ExtendElement;
import io.protofront.ast.ExtendNode;
import io.protofront.ast.ExtensionRangeNode;
import io.protofront.ast.FieldNode;
import io.protofront.ast.FieldReferenceNode;
import io.protofront.ast.FileElement;
import io.protofront.ast.FileInfo;
import io.protofront.ast.FileNode;
import io.protofront.ast.FloatValueNode;
import io.protofront.ast.GroupNode;
import io.protofront.ast.IdentNode;
import io.protofront.ast.IdentValueNode;
import io.protofront.ast.ImportNode;
import io.protofront.ast.IntValueNode;
import io.protofront.ast.MapFieldNode;
import io.protofront.ast.MapTypeNode;
import io.protofront.ast.MessageElement;
import io.protofront.ast.MessageFieldNode;
import io.protofront.ast.MessageLiteralNode;
import io.protofront.ast.MessageNode;
import io.protofront.ast.NegativeIntLiteralNode;
import io.protofront.ast.Node;
import io.protofront.ast.OneofElement;
import io.protofront.ast.OneofNode;
import io.protofront.ast.OptionNameNode;
import io.protofront.ast.OptionNode;
import io.protofront.ast.PackageNode;
import io.protofront.ast.RPCElement;
import io.protofront.ast.RPCNode;
import io.protofront.ast.RPCTypeNode;
import io.protofront.ast.RangeElement;
import io.protofront.ast.RangeNode;
import io.protofront.ast.ReservedElement;
import io.protofront.ast.ReservedNode;
import io.protofront.ast.RuneNode;
import io.protofront.ast.ServiceElement;
import io.protofront.ast.ServiceNode;
import io.protofront.ast.SignedFloatLiteralNode;
import io.protofront.ast.SourceSpan;
import io.protofront.ast.SpecialFloatLiteralNode;
import io.protofront.ast.StringValueNode;
import io.protofront.ast.SyntaxNode;
import io.protofront.ast.TerminalNode;
import io.protofront.ast.UintLiteralNode;
import io.protofront.ast.ValueNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Recursive descent parser over the {@link ProtoLexer} symbol stream. Never gives up on
 * a file: a declaration that cannot be parsed becomes an {@link ErrorNode} holding every
 * terminal that was consumed or skipped for it, so that printing the tree still yields
 * the exact source.
 */
public class ProtoParser {

    static final Logger logger = LoggerFactory.getLogger(ProtoParser.class);

    private static final int MAX_DEPTH = 128;

    private static final Set<String> LABELS = Set.of("optional", "required", "repeated");

    private static final Set<String> FILE_RECOVERY_KEYWORDS = Set.of(
            "syntax", "edition", "import", "package", "option", "message", "enum", "extend", "service");

    private static final Set<String> BLOCK_RECOVERY_KEYWORDS = Set.of(
            "option", "message", "enum", "extend", "oneof", "reserved", "extensions", "map", "rpc",
            "optional", "required", "repeated");

    private final ProtoLexer lexer;
    private final FileInfo info;
    private final ErrorHandler handler;
    private final boolean extendedSyntax;

    private final List<Symbol> lookahead = new ArrayList<>();
    private final List<TerminalNode> consumed = new ArrayList<>();
    private int depth;

    // thrown after a syntax error was reported, caught by the nearest declaration list
    private static final class Recover extends RuntimeException {

        Recover() {
            super(null, null, false, false);
        }

    }

    public ProtoParser(ProtoLexer lexer, ErrorHandler handler, ParseConfig config) {
        this.lexer = lexer;
        this.info = lexer.getFileInfo();
        this.handler = handler;
        this.extendedSyntax = config.isExtendedSyntax();
    }

    public FileNode parseFile() {
        SyntaxNode syntax = null;
        EditionNode edition = null;
        int mark = consumed.size();
        List<FileElement> decls = new ArrayList<>();
        try {
            if (peek().isIdent("syntax")) {
                syntax = parseSyntax();
                lexer.setSyntax(syntax.value());
            } else if (peek().isIdent("edition")) {
                edition = parseEdition();
                lexer.setSyntax("editions");
            }
        } catch (Recover r) {
            ErrorNode error = recover(mark, false);
            if (error != null) {
                decls.add(new FileElement(error));
            }
        }
        if (syntax == null && edition == null) {
            handler.handleWarning(new SyntaxError(SourceSpan.of(info.sourcePos(0)),
                    "no syntax specified; defaulting to proto2 syntax", SyntaxError.Kind.PARSE));
        }
        while (peek().type != SymbolType.EOF) {
            mark = consumed.size();
            try {
                decls.add(parseFileElement());
            } catch (Recover r) {
                ErrorNode error = recover(mark, false);
                if (error != null) {
                    decls.add(new FileElement(error));
                }
            }
        }
        RuneNode eof = peek().rune();
        return new FileNode(info, syntax, edition, decls, eof);
    }

    //==================================================================================================================
    // symbol stream

    private Symbol peek() {
        return peek(0);
    }

    private Symbol peek(int n) {
        while (lookahead.size() <= n) {
            lookahead.add(lexer.next());
        }
        return lookahead.get(n);
    }

    private Symbol advance() {
        Symbol sym = peek();
        if (sym.type == SymbolType.EOF) {
            throw new IllegalStateException("cannot advance past EOF");
        }
        lookahead.remove(0);
        consumed.addAll(sym.terminals());
        return sym;
    }

    private RuneNode optionalRune(char c) {
        return peek().isRune(c) ? advance().rune() : null;
    }

    private RuneNode expectRune(char c) {
        if (!peek().isRune(c)) {
            throw fail("'" + c + "'");
        }
        return advance().rune();
    }

    private IdentNode expectKeyword(String keyword) {
        if (!peek().isIdent(keyword)) {
            throw fail('"' + keyword + '"');
        }
        return advance().ident();
    }

    private IdentNode expectIdent() {
        if (!peek().isIdent()) {
            throw fail("identifier");
        }
        return advance().ident();
    }

    private IdentValueNode expectIdentValue() {
        if (!peek().isIdentValue()) {
            throw fail("identifier");
        }
        return advance().identValue();
    }

    private boolean atStatementEnd() {
        Symbol sym = peek();
        return sym.isRune(';') || sym.isRune('}') || sym.type == SymbolType.EOF;
    }

    /**
     * A keyword that starts a declaration, as opposed to the same word used as a type
     * or field name, is never directly followed by an identifier and {@code =}.
     */
    private boolean startsDecl(String keyword) {
        return peek().isIdent(keyword) && !(peek(1).isIdent() && peek(2).isRune('='));
    }

    //==================================================================================================================
    // diagnostics

    private Recover fail(String expecting) {
        Symbol sym = peek();
        if (sym.type != SymbolType.ERROR) {
            String message = "syntax error: unexpected " + sym.describe();
            if (expecting != null) {
                message = message + ", expecting " + expecting;
            }
            handler.handleError(new SyntaxError(spanOf(sym), message, SyntaxError.Kind.PARSE));
        }
        return new Recover();
    }

    private SourceSpan spanOf(Symbol sym) {
        List<TerminalNode> terminals = sym.terminals();
        if (terminals.isEmpty()) {
            TerminalNode last = consumed.isEmpty() ? null : consumed.get(consumed.size() - 1);
            return last == null ? SourceSpan.of(info.sourcePos(0)) : info.nodeInfo(last);
        }
        return info.nodeInfo(terminals.get(0));
    }

    private SourceSpan spanOfLastConsumed() {
        if (consumed.isEmpty()) {
            return SourceSpan.of(info.sourcePos(0));
        }
        return info.nodeInfo(consumed.get(consumed.size() - 1));
    }

    private void extendedSyntax(SourceSpan span, String message, SyntaxError.Category category) {
        SyntaxError error = new SyntaxError(span, message, SyntaxError.Kind.EXTENDED_SYNTAX, category);
        if (extendedSyntax) {
            handler.handleWarning(error);
        } else {
            handler.handleError(error);
        }
    }

    private void incomplete(Node node, String message) {
        extendedSyntax(info.nodeInfo(node), message, SyntaxError.Category.INCOMPLETE_DECL);
    }

    /**
     * A statement terminator. Lenient parsing accepts a missing or inserted one, strict
     * parsing wants a real {@code ;} in the source.
     */
    private RuneNode semicolon() {
        if (peek().isRune(';')) {
            RuneNode semicolon = advance().rune();
            if (semicolon.virtual && !extendedSyntax) {
                handler.handleError(new SyntaxError(info.nodeInfo(semicolon), "syntax error: expected ';'",
                        SyntaxError.Kind.PARSE));
            }
            return semicolon;
        }
        if (extendedSyntax) {
            extendedSyntax(spanOfLastConsumed(), "expected ';'", SyntaxError.Category.MISSING_TOKEN);
        } else {
            handler.handleError(new SyntaxError(spanOf(peek()), "syntax error: expected ';'", SyntaxError.Kind.PARSE));
        }
        return null;
    }

    /**
     * Any {@code ;} directly after a closing brace belongs to the block.
     */
    private RuneNode blockSemicolon() {
        return optionalRune(';');
    }

    private RuneNode virtualSemicolon() {
        Symbol sym = peek();
        if (sym.isRune(';') && sym.rune().virtual) {
            return advance().rune();
        }
        return null;
    }

    private RuneNode closeBrace() {
        if (peek().isRune('}')) {
            return advance().rune();
        }
        if (peek().type == SymbolType.EOF) {
            // keep the partial block, there is nothing left to recover
            fail("'}'");
            return null;
        }
        throw fail("'}'");
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            depth--;
            logger.warn("{}: nesting deeper than {} at {}, skipping", info.getName(), MAX_DEPTH, spanOf(peek()));
            handler.handleError(new SyntaxError(spanOf(peek()), "too much recursion", SyntaxError.Kind.PARSE));
            throw new Recover();
        }
    }

    private void exit() {
        depth--;
    }

    /**
     * Skips ahead to a plausible declaration boundary, balancing any braces opened since
     * the mark.
     *
     * @return every terminal consumed since the mark, or null if there were none
     */
    private ErrorNode recover(int mark, boolean inBlock) {
        int open = 0;
        for (int i = mark; i < consumed.size(); i++) {
            TerminalNode node = consumed.get(i);
            if (node instanceof RuneNode) {
                int rune = ((RuneNode) node).rune;
                if (rune == '{') {
                    open++;
                } else if (rune == '}' && open > 0) {
                    open--;
                }
            }
        }
        boolean progressed = consumed.size() > mark;
        Set<String> keywords = inBlock ? BLOCK_RECOVERY_KEYWORDS : FILE_RECOVERY_KEYWORDS;
        while (true) {
            Symbol sym = peek();
            if (sym.type == SymbolType.EOF) {
                break;
            }
            if (open == 0) {
                if (inBlock && sym.isRune('}')) {
                    break;
                }
                if (progressed && sym.isIdent() && keywords.contains(sym.ident().val) && startsLine(sym)) {
                    break;
                }
            }
            advance();
            progressed = true;
            if (sym.isRune('{')) {
                open++;
            } else if (sym.isRune('}')) {
                if (open > 0) {
                    open--;
                }
                if (open == 0) {
                    break;
                }
            } else if (sym.isRune(';') && open == 0) {
                break;
            }
        }
        if (consumed.size() == mark) {
            return null;
        }
        List<TerminalNode> parts = new ArrayList<>(consumed.subList(mark, consumed.size()));
        if (logger.isDebugEnabled()) {
            logger.debug("{}: recovered {} terminals at {}", info.getName(), parts.size(), info.nodeInfo(parts.get(0)));
        }
        return new ErrorNode(parts);
    }

    private boolean startsLine(Symbol sym) {
        if (consumed.isEmpty() || sym.node == null) {
            return true;
        }
        int line = info.nodeInfo(sym.node).start().line();
        int previous = info.nodeInfo(consumed.get(consumed.size() - 1)).end().line();
        return line > previous;
    }

    /**
     * Parses declarations until the closing brace, wrapping failures into error nodes.
     */
    private <T> List<T> parseBody(Function<List<T>, T> element, Function<ErrorNode, T> onError) {
        enter();
        try {
            List<T> decls = new ArrayList<>();
            while (!peek().isRune('}') && peek().type != SymbolType.EOF) {
                int mark = consumed.size();
                try {
                    decls.add(element.apply(decls));
                } catch (Recover r) {
                    ErrorNode error = recover(mark, true);
                    if (error != null) {
                        decls.add(onError.apply(error));
                    }
                }
            }
            return decls;
        } finally {
            exit();
        }
    }

    //==================================================================================================================
    // file level

    private SyntaxNode parseSyntax() {
        IdentNode keyword = advance().ident();
        RuneNode equals = expectRune('=');
        if (peek().type != SymbolType.STRING_LIT) {
            throw fail("string literal");
        }
        StringValueNode value = advance().stringValue();
        return new SyntaxNode(keyword, equals, value, semicolon());
    }

    private EditionNode parseEdition() {
        IdentNode keyword = advance().ident();
        RuneNode equals = expectRune('=');
        if (peek().type != SymbolType.STRING_LIT) {
            throw fail("string literal");
        }
        StringValueNode value = advance().stringValue();
        return new EditionNode(keyword, equals, value, semicolon());
    }

    private FileElement parseFileElement() {
        Symbol sym = peek();
        if (sym.isRune(';')) {
            return new FileElement(new EmptyDeclNode(advance().rune()));
        }
        if (sym.isIdent()) {
            switch (sym.ident().val) {
                case "import":
                    return new FileElement(parseImport());
                case "package":
                    return new FileElement(parsePackage());
                case "option":
                    return new FileElement(parseOption());
                case "message":
                    return new FileElement(parseMessage());
                case "enum":
                    return new FileElement(parseEnum());
                case "extend":
                    return new FileElement(parseExtend());
                case "service":
                    return new FileElement(parseService());
            }
        }
        throw fail(null);
    }

    private ImportNode parseImport() {
        IdentNode keyword = advance().ident();
        IdentNode publicKeyword = null;
        IdentNode weakKeyword = null;
        if (peek().isIdent("public")) {
            publicKeyword = advance().ident();
        } else if (peek().isIdent("weak")) {
            weakKeyword = advance().ident();
        }
        StringValueNode name = null;
        if (peek().type == SymbolType.STRING_LIT) {
            name = advance().stringValue();
        } else if (!atStatementEnd()) {
            throw fail("string literal");
        }
        ImportNode node = new ImportNode(keyword, publicKeyword, weakKeyword, name, semicolon());
        if (name == null) {
            incomplete(node, "missing import path");
        }
        return node;
    }

    private PackageNode parsePackage() {
        IdentNode keyword = advance().ident();
        IdentValueNode name = null;
        if (peek().isIdentValue()) {
            name = advance().identValue();
        } else if (!atStatementEnd()) {
            throw fail("identifier");
        }
        PackageNode node = new PackageNode(keyword, name, semicolon());
        if (name == null) {
            incomplete(node, "missing package name");
        }
        return node;
    }

    //==================================================================================================================
    // options and values

    private OptionNameNode optionName() {
        Symbol sym = peek();
        if (sym.type == SymbolType.EXTENSION_IDENT) {
            return advance().optionName();
        }
        if (sym.isIdentValue()) {
            return OptionNameNode.of(advance().identValue());
        }
        return null;
    }

    private OptionNode parseOption() {
        IdentNode keyword = advance().ident();
        OptionNameNode name = optionName();
        RuneNode equals = null;
        ValueNode val = null;
        if (name == null && !atStatementEnd()) {
            throw fail("identifier");
        }
        if (name != null) {
            equals = optionalRune('=');
            if (equals == null && !atStatementEnd()) {
                throw fail("'='");
            }
            if (equals != null && !atStatementEnd()) {
                val = parseValue(false);
            }
        }
        OptionNode node = new OptionNode(keyword, name, equals, val, semicolon());
        if (val == null) {
            incomplete(node, "incomplete option declaration");
        }
        return node;
    }

    private CompactOptionsNode parseCompactOptions() {
        RuneNode open = advance().rune();
        List<OptionNode> options = new ArrayList<>();
        while (!peek().isRune(']')) {
            OptionNameNode name = optionName();
            if (name == null) {
                throw fail("identifier");
            }
            RuneNode equals = optionalRune('=');
            ValueNode val = null;
            if (equals != null && !peek().isRune(',') && !peek().isRune(']')) {
                val = parseValue(true);
            }
            RuneNode comma = optionalRune(',');
            OptionNode option = new OptionNode(null, name, equals, val, comma);
            if (val == null) {
                incomplete(option, "incomplete option declaration");
            }
            options.add(option);
            if (comma == null && !peek().isRune(']')) {
                throw fail("','");
            }
        }
        RuneNode close = advance().rune();
        CompactOptionsNode node = new CompactOptionsNode(open, options, close, null);
        if (options.isEmpty()) {
            extendedSyntax(info.nodeInfo(node), "compact options list cannot be empty", SyntaxError.Category.EMPTY_DECL);
        }
        return node;
    }

    /**
     * @param nested true inside compact options and literals, where a virtual semicolon
     *               after a closing bracket or brace belongs to the literal
     */
    private ValueNode parseValue(boolean nested) {
        Symbol sym = peek();
        switch (sym.type) {
            case IDENT:
                return new ValueNode(advance().ident());
            case QUALIFIED_IDENT:
            case FULLY_QUALIFIED_IDENT:
                return new ValueNode((CompoundIdentNode) advance().node);
            case STRING_LIT: {
                StringValueNode value = advance().stringValue();
                if (value.stringLiteral() != null) {
                    return new ValueNode(value.stringLiteral());
                }
                return new ValueNode(value.compoundStringLiteral());
            }
            case INT_LIT:
                return new ValueNode(advance().uint());
            case FLOAT_LIT:
                return new ValueNode(advance().floatLit());
            case RUNE:
                if (sym.isRune('-') || sym.isRune('+')) {
                    return parseSignedValue();
                }
                if (sym.isRune('[')) {
                    return new ValueNode(parseArrayLiteral(nested));
                }
                if (sym.isRune('{') || sym.isRune('<')) {
                    return new ValueNode(parseMessageLiteral(nested));
                }
                break;
        }
        throw fail("value");
    }

    private ValueNode parseSignedValue() {
        RuneNode sign = advance().rune();
        Symbol sym = peek();
        if (sym.type == SymbolType.INT_LIT) {
            if (sign.rune == '-') {
                return new ValueNode(new NegativeIntLiteralNode(sign, advance().uint()));
            }
            return new ValueNode(new SignedFloatLiteralNode(sign, new FloatValueNode(advance().uint())));
        }
        if (sym.type == SymbolType.FLOAT_LIT) {
            return new ValueNode(new SignedFloatLiteralNode(sign, new FloatValueNode(advance().floatLit())));
        }
        if (sym.isIdent() && SpecialFloatLiteralNode.isSpecial(sym.ident().val)) {
            SpecialFloatLiteralNode special = new SpecialFloatLiteralNode(advance().ident());
            return new ValueNode(new SignedFloatLiteralNode(sign, new FloatValueNode(special)));
        }
        throw fail("numeric literal");
    }

    private ArrayLiteralNode parseArrayLiteral(boolean nested) {
        enter();
        try {
            RuneNode open = advance().rune();
            List<ArrayLiteralElement> elements = new ArrayList<>();
            while (!peek().isRune(']')) {
                if (peek().isRune(',')) {
                    elements.add(new ArrayLiteralElement(advance().rune()));
                    continue;
                }
                if (peek().type == SymbolType.EOF) {
                    throw fail("']'");
                }
                elements.add(new ArrayLiteralElement(parseValue(true)));
                if (!peek().isRune(',') && !peek().isRune(']')) {
                    throw fail("','");
                }
            }
            RuneNode close = advance().rune();
            RuneNode semicolon = nested ? virtualSemicolon() : null;
            return new ArrayLiteralNode(open, elements, close, semicolon);
        } finally {
            exit();
        }
    }

    private MessageLiteralNode parseMessageLiteral(boolean nested) {
        enter();
        try {
            RuneNode open = advance().rune();
            char closeRune = open.rune == '{' ? '}' : '>';
            List<MessageFieldNode> fields = new ArrayList<>();
            while (!peek().isRune(closeRune)) {
                if (peek().type == SymbolType.EOF) {
                    throw fail("'" + closeRune + "'");
                }
                fields.add(parseMessageField());
            }
            RuneNode close = advance().rune();
            RuneNode semicolon = nested ? virtualSemicolon() : null;
            return new MessageLiteralNode(open, fields, close, semicolon);
        } finally {
            exit();
        }
    }

    private MessageFieldNode parseMessageField() {
        FieldReferenceNode name;
        if (peek().isIdent()) {
            name = new FieldReferenceNode(new IdentValueNode(advance().ident()));
        } else if (peek().isRune('[')) {
            RuneNode open = advance().rune();
            IdentValueNode first = expectIdentValue();
            IdentValueNode urlPrefix = null;
            RuneNode slash = optionalRune('/');
            IdentValueNode typeName = first;
            if (slash != null) {
                urlPrefix = first;
                typeName = expectIdentValue();
            }
            RuneNode comma = null;
            if (peek().isRune(',') && peek().rune().virtual) {
                comma = advance().rune();
            }
            RuneNode close = expectRune(']');
            name = new FieldReferenceNode(open, urlPrefix, slash, typeName, comma, close, null);
        } else {
            throw fail("field name");
        }
        RuneNode sep = optionalRune(':');
        ValueNode val;
        Symbol sym = peek();
        if (sep == null && !sym.isRune('{') && !sym.isRune('<') && !sym.isRune('[')) {
            throw fail("':'");
        }
        val = parseValue(true);
        RuneNode separator = optionalRune(',');
        if (separator == null) {
            separator = optionalRune(';');
        }
        return new MessageFieldNode(name, sep, val, separator);
    }

    //==================================================================================================================
    // messages

    private MessageNode parseMessage() {
        IdentNode keyword = advance().ident();
        IdentNode name = expectIdent();
        RuneNode open = expectRune('{');
        List<MessageElement> decls = parseBody(this::parseMessageElement, MessageElement::new);
        RuneNode close = closeBrace();
        return new MessageNode(keyword, name, open, decls, close, close == null ? null : blockSemicolon());
    }

    private MessageElement parseMessageElement(List<MessageElement> previous) {
        Symbol sym = peek();
        if (sym.isRune(';')) {
            return new MessageElement(new EmptyDeclNode(advance().rune()));
        }
        if (!sym.isIdentValue()) {
            throw fail(null);
        }
        if (sym.isIdent()) {
            String word = sym.ident().val;
            switch (word) {
                case "option":
                    return new MessageElement(parseOption());
                case "message":
                    if (startsDecl(word)) {
                        return new MessageElement(parseMessage());
                    }
                    break;
                case "enum":
                    if (startsDecl(word)) {
                        return new MessageElement(parseEnum());
                    }
                    break;
                case "extend":
                    if (startsDecl(word)) {
                        return new MessageElement(parseExtend());
                    }
                    break;
                case "oneof":
                    if (startsDecl(word)) {
                        return new MessageElement(parseOneof());
                    }
                    break;
                case "reserved":
                    if (startsDecl(word)) {
                        return new MessageElement(parseReserved());
                    }
                    break;
                case "extensions":
                    if (startsDecl(word)) {
                        return new MessageElement(parseExtensionRange());
                    }
                    break;
                case "map":
                    if (peek(1).isRune('<')) {
                        return new MessageElement(parseMapField());
                    }
                    break;
            }
        }
        return fieldOrGroup(MessageElement::new, MessageElement::new);
    }

    private <T> T fieldOrGroup(Function<FieldNode, T> field, Function<GroupNode, T> group) {
        int offset = 0;
        if (peek().isIdent() && LABELS.contains(peek().ident().val) && peek(1).isIdentValue()) {
            offset = 1;
        }
        if (isGroup(offset)) {
            IdentNode label = offset == 1 ? advance().ident() : null;
            return group.apply(parseGroup(label));
        }
        IdentNode label = offset == 1 ? advance().ident() : null;
        return field.apply(parseField(label));
    }

    private boolean isGroup(int offset) {
        if (!peek(offset).isIdent("group")) {
            return false;
        }
        Symbol name = peek(offset + 1);
        if (!name.isIdent() || !peek(offset + 2).isRune('=') || peek(offset + 3).type != SymbolType.INT_LIT) {
            return false;
        }
        Symbol next = peek(offset + 4);
        if (next.isRune('{')) {
            return true;
        }
        // group names are capitalized, a field of a type called "group" usually is not
        return next.isRune('[') && Character.isUpperCase(name.ident().val.charAt(0));
    }

    private FieldNode parseField(IdentNode label) {
        IdentValueNode type = expectIdentValue();
        IdentNode name = null;
        RuneNode equals = null;
        UintLiteralNode tag = null;
        if (peek().isIdent()) {
            name = advance().ident();
        } else if (!atStatementEnd()) {
            throw fail("identifier");
        }
        if (name != null) {
            equals = optionalRune('=');
            if (equals != null) {
                if (peek().type == SymbolType.INT_LIT) {
                    tag = advance().uint();
                } else if (!atStatementEnd() && !peek().isRune('[')) {
                    throw fail("int literal");
                }
            } else if (!atStatementEnd() && !peek().isRune('[')) {
                throw fail("'='");
            }
        }
        CompactOptionsNode options = peek().isRune('[') ? parseCompactOptions() : null;
        FieldNode node = new FieldNode(label, type, name, equals, tag, options, semicolon());
        if (tag == null) {
            incomplete(node, "incomplete field declaration");
        }
        return node;
    }

    private GroupNode parseGroup(IdentNode label) {
        IdentNode keyword = advance().ident();
        IdentNode name = expectIdent();
        RuneNode equals = expectRune('=');
        if (peek().type != SymbolType.INT_LIT) {
            throw fail("int literal");
        }
        UintLiteralNode tag = advance().uint();
        CompactOptionsNode options = peek().isRune('[') ? parseCompactOptions() : null;
        RuneNode open = expectRune('{');
        List<MessageElement> decls = parseBody(this::parseMessageElement, MessageElement::new);
        RuneNode close = closeBrace();
        return new GroupNode(label, keyword, name, equals, tag, options, open, decls, close,
                close == null ? null : blockSemicolon());
    }

    private MapFieldNode parseMapField() {
        IdentNode keyword = advance().ident();
        RuneNode openAngle = advance().rune();
        IdentNode keyType = expectIdent();
        RuneNode comma = expectRune(',');
        IdentValueNode valueType = expectIdentValue();
        RuneNode closeAngle = expectRune('>');
        MapTypeNode mapType = new MapTypeNode(keyword, openAngle, keyType, comma, valueType, closeAngle, virtualSemicolon());
        IdentNode name = expectIdent();
        RuneNode equals = expectRune('=');
        if (peek().type != SymbolType.INT_LIT) {
            throw fail("int literal");
        }
        UintLiteralNode tag = advance().uint();
        CompactOptionsNode options = peek().isRune('[') ? parseCompactOptions() : null;
        return new MapFieldNode(mapType, name, equals, tag, options, semicolon());
    }

    private OneofNode parseOneof() {
        IdentNode keyword = advance().ident();
        IdentNode name = expectIdent();
        RuneNode open = expectRune('{');
        List<OneofElement> decls = parseBody(previous -> {
            Symbol sym = peek();
            if (sym.isRune(';')) {
                return new OneofElement(new EmptyDeclNode(advance().rune()));
            }
            if (sym.isIdent("option")) {
                return new OneofElement(parseOption());
            }
            if (!sym.isIdentValue()) {
                throw fail(null);
            }
            return fieldOrGroup(OneofElement::new, OneofElement::new);
        }, OneofElement::new);
        RuneNode close = closeBrace();
        return new OneofNode(keyword, name, open, decls, close, close == null ? null : blockSemicolon());
    }

    private ExtendNode parseExtend() {
        IdentNode keyword = advance().ident();
        IdentValueNode extendee = expectIdentValue();
        RuneNode open = expectRune('{');
        List<ExtendElement> decls = parseBody(previous -> {
            Symbol sym = peek();
            if (sym.isRune(';')) {
                return new ExtendElement(new EmptyDeclNode(advance().rune()));
            }
            if (!sym.isIdentValue()) {
                throw fail(null);
            }
            return fieldOrGroup(ExtendElement::new, ExtendElement::new);
        }, ExtendElement::new);
        RuneNode close = closeBrace();
        return new ExtendNode(keyword, extendee, open, decls, close, close == null ? null : blockSemicolon());
    }

    private IntValueNode parseIntValue() {
        if (peek().isRune('-')) {
            RuneNode minus = advance().rune();
            if (peek().type != SymbolType.INT_LIT) {
                throw fail("int literal");
            }
            return new IntValueNode(new NegativeIntLiteralNode(minus, advance().uint()));
        }
        if (peek().type != SymbolType.INT_LIT) {
            throw fail("int literal");
        }
        return new IntValueNode(advance().uint());
    }

    private RangeNode parseRange() {
        IntValueNode start = parseIntValue();
        if (!peek().isIdent("to")) {
            return new RangeNode(start, null, null, null);
        }
        IdentNode to = advance().ident();
        if (peek().isIdent("max")) {
            return new RangeNode(start, to, null, advance().ident());
        }
        return new RangeNode(start, to, parseIntValue(), null);
    }

    private ExtensionRangeNode parseExtensionRange() {
        IdentNode keyword = advance().ident();
        List<RangeElement> elements = new ArrayList<>();
        elements.add(new RangeElement(parseRange()));
        while (peek().isRune(',')) {
            elements.add(new RangeElement(advance().rune()));
            elements.add(new RangeElement(parseRange()));
        }
        CompactOptionsNode options = peek().isRune('[') ? parseCompactOptions() : null;
        return new ExtensionRangeNode(keyword, elements, options, semicolon());
    }

    private ReservedNode parseReserved() {
        IdentNode keyword = advance().ident();
        List<ReservedElement> elements = new ArrayList<>();
        elements.add(reservedElement());
        while (peek().isRune(',')) {
            elements.add(new ReservedElement(advance().rune()));
            elements.add(reservedElement());
        }
        return new ReservedNode(keyword, elements, semicolon());
    }

    private ReservedElement reservedElement() {
        Symbol sym = peek();
        if (sym.type == SymbolType.STRING_LIT) {
            return new ReservedElement(advance().stringValue());
        }
        if (sym.isIdent()) {
            return new ReservedElement(advance().ident());
        }
        if (sym.type == SymbolType.INT_LIT || sym.isRune('-')) {
            return new ReservedElement(parseRange());
        }
        throw fail("int literal");
    }

    //==================================================================================================================
    // enums

    private EnumNode parseEnum() {
        IdentNode keyword = advance().ident();
        IdentNode name = expectIdent();
        RuneNode open = expectRune('{');
        List<EnumElement> decls = parseBody(previous -> {
            Symbol sym = peek();
            if (sym.isRune(';')) {
                return new EnumElement(new EmptyDeclNode(advance().rune()));
            }
            if (sym.isIdent("option") && !peek(1).isRune('=')) {
                return new EnumElement(parseOption());
            }
            if (sym.isIdent("reserved") && !peek(1).isRune('=')) {
                return new EnumElement(parseReserved());
            }
            if (sym.isIdent()) {
                return new EnumElement(parseEnumValue());
            }
            throw fail(null);
        }, EnumElement::new);
        RuneNode close = closeBrace();
        return new EnumNode(keyword, name, open, decls, close, close == null ? null : blockSemicolon());
    }

    private EnumValueNode parseEnumValue() {
        IdentNode name = advance().ident();
        RuneNode equals = optionalRune('=');
        IntValueNode number = null;
        if (equals != null && !atStatementEnd() && !peek().isRune('[')) {
            number = parseIntValue();
        } else if (equals == null && !atStatementEnd()) {
            throw fail("'='");
        }
        CompactOptionsNode options = peek().isRune('[') ? parseCompactOptions() : null;
        EnumValueNode node = new EnumValueNode(name, equals, number, options, semicolon());
        if (number == null) {
            incomplete(node, "incomplete enum value declaration");
        }
        return node;
    }

    //==================================================================================================================
    // services

    private ServiceNode parseService() {
        IdentNode keyword = advance().ident();
        IdentNode name = expectIdent();
        RuneNode open = expectRune('{');
        List<ServiceElement> decls = parseBody(previous -> {
            Symbol sym = peek();
            if (sym.isRune(';')) {
                return new ServiceElement(new EmptyDeclNode(advance().rune()));
            }
            if (sym.isIdent("option")) {
                return new ServiceElement(parseOption());
            }
            if (sym.isIdent("rpc")) {
                return new ServiceElement(parseRpc());
            }
            throw fail(null);
        }, ServiceElement::new);
        RuneNode close = closeBrace();
        return new ServiceNode(keyword, name, open, decls, close, close == null ? null : blockSemicolon());
    }

    private RPCNode parseRpc() {
        IdentNode keyword = advance().ident();
        IdentNode name = expectIdent();
        RPCTypeNode input = parseRpcType();
        IdentNode returns = expectKeyword("returns");
        RPCTypeNode output = parseRpcType();
        if (!peek().isRune('{')) {
            return new RPCNode(keyword, name, input, returns, output, null, null, null, semicolon());
        }
        RuneNode open = advance().rune();
        List<RPCElement> decls = parseBody(previous -> {
            Symbol sym = peek();
            if (sym.isRune(';')) {
                return new RPCElement(new EmptyDeclNode(advance().rune()));
            }
            if (sym.isIdent("option")) {
                return new RPCElement(parseOption());
            }
            throw fail(null);
        }, RPCElement::new);
        RuneNode close = closeBrace();
        return new RPCNode(keyword, name, input, returns, output, open, decls, close,
                close == null ? null : blockSemicolon());
    }

    private RPCTypeNode parseRpcType() {
        RuneNode open = expectRune('(');
        IdentNode stream = null;
        if (peek().isIdent("stream") && peek(1).isIdentValue()) {
            stream = advance().ident();
        }
        IdentValueNode type = expectIdentValue();
        RuneNode close = expectRune(')');
        return new RPCTypeNode(open, stream, type, close, null);
    }

}

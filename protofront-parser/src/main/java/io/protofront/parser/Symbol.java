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

import io.protofront.ast.CompoundIdentNode;
import io.protofront.ast.FloatLiteralNode;
import io.protofront.ast.IdentNode;
import io.protofront.ast.IdentValueNode;
import io.protofront.ast.Node;
import io.protofront.ast.Nodes;
import io.protofront.ast.OptionNameNode;
import io.protofront.ast.RuneNode;
import io.protofront.ast.StringValueNode;
import io.protofront.ast.TerminalNode;
import io.protofront.ast.UintLiteralNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One unit handed from the lexer to the parser. Compound identifiers and adjacent string
 * literals arrive already assembled, each component keeping its own token.
 */
public final class Symbol {

    public final SymbolType type;
    public final Node node;
    // terminals an erroneous lexeme left behind, kept so the parser can preserve them
    public final List<TerminalNode> orphans;

    private Symbol(SymbolType type, Node node, List<TerminalNode> orphans) {
        this.type = type;
        this.node = node;
        this.orphans = orphans;
    }

    static Symbol ident(IdentNode node) {
        return new Symbol(SymbolType.IDENT, node, List.of());
    }

    static Symbol compoundIdent(SymbolType type, CompoundIdentNode node) {
        return new Symbol(type, node, List.of());
    }

    static Symbol optionName(OptionNameNode node) {
        return new Symbol(SymbolType.EXTENSION_IDENT, node, List.of());
    }

    static Symbol string(StringValueNode node) {
        return new Symbol(SymbolType.STRING_LIT, node, List.of());
    }

    static Symbol uint(UintLiteralNode node) {
        return new Symbol(SymbolType.INT_LIT, node, List.of());
    }

    static Symbol floatLit(FloatLiteralNode node) {
        return new Symbol(SymbolType.FLOAT_LIT, node, List.of());
    }

    static Symbol rune(RuneNode node) {
        return new Symbol(SymbolType.RUNE, node, List.of());
    }

    static Symbol eof(RuneNode node) {
        return new Symbol(SymbolType.EOF, node, List.of());
    }

    static Symbol error(List<TerminalNode> orphans) {
        return new Symbol(SymbolType.ERROR, null, List.copyOf(orphans));
    }

    public boolean isRune(char c) {
        return type == SymbolType.RUNE && ((RuneNode) node).rune == c;
    }

    public boolean isIdent() {
        return type == SymbolType.IDENT;
    }

    public boolean isIdent(String value) {
        return type == SymbolType.IDENT && ((IdentNode) node).val.equals(value);
    }

    /**
     * Simple, qualified or fully qualified identifier.
     */
    public boolean isIdentValue() {
        return type == SymbolType.IDENT || type == SymbolType.QUALIFIED_IDENT || type == SymbolType.FULLY_QUALIFIED_IDENT;
    }

    public RuneNode rune() {
        return (RuneNode) node;
    }

    public IdentNode ident() {
        return (IdentNode) node;
    }

    public IdentValueNode identValue() {
        if (type == SymbolType.IDENT) {
            return new IdentValueNode((IdentNode) node);
        }
        return new IdentValueNode((CompoundIdentNode) node);
    }

    public StringValueNode stringValue() {
        return (StringValueNode) node;
    }

    public OptionNameNode optionName() {
        return (OptionNameNode) node;
    }

    public UintLiteralNode uint() {
        return (UintLiteralNode) node;
    }

    public FloatLiteralNode floatLit() {
        return (FloatLiteralNode) node;
    }

    /**
     * Every terminal this symbol carries, in source order.
     */
    public List<TerminalNode> terminals() {
        if (node == null) {
            return orphans;
        }
        List<TerminalNode> list = new ArrayList<>(Nodes.terminals(node));
        list.addAll(orphans);
        return list;
    }

    /**
     * Token description used in syntax error messages.
     */
    public String describe() {
        switch (type) {
            case IDENT:
                IdentNode ident = (IdentNode) node;
                return ident.keyword ? '"' + ident.val + '"' : type.description;
            case RUNE:
                return "'" + new String(Character.toChars(((RuneNode) node).rune)) + "'";
            default:
                return type.description;
        }
    }

    @Override
    public String toString() {
        if (node == null) {
            return type.name();
        }
        return type.name() + " " + node;
    }

}

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
 * An option or message literal value.
 */
public class ValueNode extends WrapperNode {

    private static final ValueNode NONE_VALUE = new ValueNode();

    private ValueNode() {
    }

    private ValueNode(String variant, Node value) {
        super(variant, value);
    }

    public ValueNode(IdentNode ident) {
        super("ident", ident);
    }

    public ValueNode(CompoundIdentNode compoundIdent) {
        super("compoundIdent", compoundIdent);
    }

    public ValueNode(StringLiteralNode stringLiteral) {
        super("stringLiteral", stringLiteral);
    }

    public ValueNode(CompoundStringLiteralNode compoundStringLiteral) {
        super("compoundStringLiteral", compoundStringLiteral);
    }

    public ValueNode(UintLiteralNode uintLiteral) {
        super("uintLiteral", uintLiteral);
    }

    public ValueNode(NegativeIntLiteralNode negativeIntLiteral) {
        super("negativeIntLiteral", negativeIntLiteral);
    }

    public ValueNode(FloatLiteralNode floatLiteral) {
        super("floatLiteral", floatLiteral);
    }

    public ValueNode(SpecialFloatLiteralNode specialFloatLiteral) {
        super("specialFloatLiteral", specialFloatLiteral);
    }

    public ValueNode(SignedFloatLiteralNode signedFloatLiteral) {
        super("signedFloatLiteral", signedFloatLiteral);
    }

    public ValueNode(ArrayLiteralNode arrayLiteral) {
        super("arrayLiteral", arrayLiteral);
    }

    public ValueNode(MessageLiteralNode messageLiteral) {
        super("messageLiteral", messageLiteral);
    }

    public static ValueNode none() {
        return NONE_VALUE;
    }

    public IdentNode ident() {
        return as(IdentNode.class);
    }

    public CompoundIdentNode compoundIdent() {
        return as(CompoundIdentNode.class);
    }

    public StringLiteralNode stringLiteral() {
        return as(StringLiteralNode.class);
    }

    public CompoundStringLiteralNode compoundStringLiteral() {
        return as(CompoundStringLiteralNode.class);
    }

    public UintLiteralNode uintLiteral() {
        return as(UintLiteralNode.class);
    }

    public NegativeIntLiteralNode negativeIntLiteral() {
        return as(NegativeIntLiteralNode.class);
    }

    public FloatLiteralNode floatLiteral() {
        return as(FloatLiteralNode.class);
    }

    public SpecialFloatLiteralNode specialFloatLiteral() {
        return as(SpecialFloatLiteralNode.class);
    }

    public SignedFloatLiteralNode signedFloatLiteral() {
        return as(SignedFloatLiteralNode.class);
    }

    public ArrayLiteralNode arrayLiteral() {
        return as(ArrayLiteralNode.class);
    }

    public MessageLiteralNode messageLiteral() {
        return as(MessageLiteralNode.class);
    }

    /**
     * Plain Java view of the value, for tooling and tests. Aggregates are returned as nodes.
     */
    public Object value() {
        Node node = unwrap();
        if (node instanceof IdentNode) {
            return ((IdentNode) node).val;
        } else if (node instanceof CompoundIdentNode) {
            return ((CompoundIdentNode) node).asIdentifier();
        } else if (node instanceof StringLiteralNode) {
            return ((StringLiteralNode) node).val;
        } else if (node instanceof CompoundStringLiteralNode) {
            return ((CompoundStringLiteralNode) node).asString();
        } else if (node instanceof UintLiteralNode) {
            return ((UintLiteralNode) node).val;
        } else if (node instanceof NegativeIntLiteralNode) {
            return ((NegativeIntLiteralNode) node).asLong();
        } else if (node instanceof FloatLiteralNode) {
            return ((FloatLiteralNode) node).val;
        } else if (node instanceof SpecialFloatLiteralNode) {
            return ((SpecialFloatLiteralNode) node).val;
        } else if (node instanceof SignedFloatLiteralNode) {
            return ((SignedFloatLiteralNode) node).asDouble();
        }
        return node == NoneNode.INSTANCE ? null : node;
    }

    @Override
    public ValueNode copy() {
        return isNone() ? NONE_VALUE : new ValueNode(variant(), unwrap().copy());
    }

}

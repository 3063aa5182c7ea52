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

public class StringValueNode extends WrapperNode {

    private static final StringValueNode NONE_VALUE = new StringValueNode();

    private StringValueNode() {
    }

    private StringValueNode(String variant, Node value) {
        super(variant, value);
    }

    public StringValueNode(StringLiteralNode stringLiteral) {
        super("stringLiteral", stringLiteral);
    }

    public StringValueNode(CompoundStringLiteralNode compoundStringLiteral) {
        super("compoundStringLiteral", compoundStringLiteral);
    }

    public static StringValueNode none() {
        return NONE_VALUE;
    }

    public StringLiteralNode stringLiteral() {
        return as(StringLiteralNode.class);
    }

    public CompoundStringLiteralNode compoundStringLiteral() {
        return as(CompoundStringLiteralNode.class);
    }

    public String asString() {
        if (stringLiteral() != null) {
            return stringLiteral().val;
        }
        if (compoundStringLiteral() != null) {
            return compoundStringLiteral().asString();
        }
        return "";
    }

    @Override
    public StringValueNode copy() {
        return isNone() ? NONE_VALUE : new StringValueNode(variant(), unwrap().copy());
    }

}

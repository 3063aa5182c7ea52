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

public class IntValueNode extends WrapperNode {

    private static final IntValueNode NONE_VALUE = new IntValueNode();

    private IntValueNode() {
    }

    private IntValueNode(String variant, Node value) {
        super(variant, value);
    }

    public IntValueNode(UintLiteralNode uintLiteral) {
        super("uintLiteral", uintLiteral);
    }

    public IntValueNode(NegativeIntLiteralNode negativeIntLiteral) {
        super("negativeIntLiteral", negativeIntLiteral);
    }

    public static IntValueNode none() {
        return NONE_VALUE;
    }

    public UintLiteralNode uintLiteral() {
        return as(UintLiteralNode.class);
    }

    public NegativeIntLiteralNode negativeIntLiteral() {
        return as(NegativeIntLiteralNode.class);
    }

    /**
     * @return the signed value, or null if it does not fit in a long
     */
    public Long asLong() {
        if (uintLiteral() != null) {
            return uintLiteral().val < 0 ? null : uintLiteral().val;
        }
        if (negativeIntLiteral() != null) {
            return negativeIntLiteral().asLong();
        }
        return null;
    }

    @Override
    public IntValueNode copy() {
        return isNone() ? NONE_VALUE : new IntValueNode(variant(), unwrap().copy());
    }

}

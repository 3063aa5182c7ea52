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
 * The magnitude of a signed float, an integer literal is accepted too.
 */
public class FloatValueNode extends WrapperNode {

    private static final FloatValueNode NONE_VALUE = new FloatValueNode();

    private FloatValueNode() {
    }

    private FloatValueNode(String variant, Node value) {
        super(variant, value);
    }

    public FloatValueNode(FloatLiteralNode floatLiteral) {
        super("floatLiteral", floatLiteral);
    }

    public FloatValueNode(SpecialFloatLiteralNode specialFloatLiteral) {
        super("specialFloatLiteral", specialFloatLiteral);
    }

    public FloatValueNode(UintLiteralNode uintLiteral) {
        super("uintLiteral", uintLiteral);
    }

    public static FloatValueNode none() {
        return NONE_VALUE;
    }

    public FloatLiteralNode floatLiteral() {
        return as(FloatLiteralNode.class);
    }

    public SpecialFloatLiteralNode specialFloatLiteral() {
        return as(SpecialFloatLiteralNode.class);
    }

    public UintLiteralNode uintLiteral() {
        return as(UintLiteralNode.class);
    }

    public double asDouble() {
        if (floatLiteral() != null) {
            return floatLiteral().val;
        }
        if (specialFloatLiteral() != null) {
            return specialFloatLiteral().val;
        }
        if (uintLiteral() != null) {
            return uintLiteral().asDouble();
        }
        return 0;
    }

    @Override
    public FloatValueNode copy() {
        return isNone() ? NONE_VALUE : new FloatValueNode(variant(), unwrap().copy());
    }

}

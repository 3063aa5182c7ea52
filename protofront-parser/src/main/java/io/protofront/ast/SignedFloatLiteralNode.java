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

public class SignedFloatLiteralNode extends CompositeNode {

    public final RuneNode sign;
    public final FloatValueNode value;

    public SignedFloatLiteralNode(RuneNode sign, FloatValueNode value) {
        this.sign = required(sign, "SignedFloatLiteralNode", "sign");
        this.value = required(value, "SignedFloatLiteralNode", "value");
        if (sign.rune != '-' && sign.rune != '+') {
            throw new AstConstructionException("SignedFloatLiteralNode: sign must be '+' or '-'");
        }
    }

    public double asDouble() {
        double d = value.asDouble();
        return sign.rune == '-' ? -d : d;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("sign", sign);
        visitor.field("float", value);
    }

    @Override
    public SignedFloatLiteralNode copy() {
        return new SignedFloatLiteralNode(sign.copy(), value.copy());
    }

}

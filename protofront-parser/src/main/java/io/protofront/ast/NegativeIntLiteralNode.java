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

public class NegativeIntLiteralNode extends CompositeNode {

    public final RuneNode minus;
    public final UintLiteralNode uint;

    public NegativeIntLiteralNode(RuneNode minus, UintLiteralNode uint) {
        this.minus = required(minus, "NegativeIntLiteralNode", "minus");
        this.uint = required(uint, "NegativeIntLiteralNode", "uint");
    }

    /**
     * @return the value, or null when it is below {@link Long#MIN_VALUE}
     */
    public Long asLong() {
        if (Long.compareUnsigned(uint.val, Long.MIN_VALUE) > 0) {
            return null;
        }
        return -uint.val;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("minus", minus);
        visitor.field("uint", uint);
    }

    @Override
    public NegativeIntLiteralNode copy() {
        return new NegativeIntLiteralNode(minus.copy(), uint.copy());
    }

}

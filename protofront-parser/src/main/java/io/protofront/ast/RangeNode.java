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
 * {@code 1}, {@code 1 to 5} or {@code 10 to max}.
 */
public class RangeNode extends CompositeNode {

    public final IntValueNode startVal;
    public final IdentNode to;
    public final IntValueNode endVal;
    public final IdentNode max;

    public RangeNode(IntValueNode startVal, IdentNode to, IntValueNode endVal, IdentNode max) {
        this.startVal = required(startVal, "RangeNode", "startVal");
        if (to == null && (endVal != null || max != null)) {
            throw new AstConstructionException("RangeNode: end requires 'to'");
        }
        if (endVal != null && max != null) {
            throw new AstConstructionException("RangeNode: end cannot be both a value and 'max'");
        }
        this.to = to;
        this.endVal = endVal;
        this.max = max;
    }

    public boolean isSingle() {
        return to == null;
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.field("startVal", startVal);
        visitor.field("to", to);
        visitor.field("endVal", endVal);
        visitor.field("max", max);
    }

    @Override
    public RangeNode copy() {
        return new RangeNode(startVal.copy(), Nodes.copy(to), Nodes.copy(endVal), Nodes.copy(max));
    }

}

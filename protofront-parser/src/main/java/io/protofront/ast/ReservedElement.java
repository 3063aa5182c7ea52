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

public class ReservedElement extends WrapperNode {

    private static final ReservedElement NONE_VALUE = new ReservedElement();

    private ReservedElement() {
    }

    private ReservedElement(String variant, Node value) {
        super(variant, value);
    }

    public ReservedElement(RangeNode range) {
        super("range", range);
    }

    public ReservedElement(StringValueNode name) {
        super("name", name);
    }

    public ReservedElement(IdentNode identifier) {
        super("identifier", identifier);
    }

    public ReservedElement(RuneNode comma) {
        super("comma", comma);
    }

    public static ReservedElement none() {
        return NONE_VALUE;
    }

    public RangeNode range() {
        return as(RangeNode.class);
    }

    public StringValueNode name() {
        return as(StringValueNode.class);
    }

    public IdentNode identifier() {
        return as(IdentNode.class);
    }

    public RuneNode comma() {
        return as(RuneNode.class);
    }

    @Override
    public ReservedElement copy() {
        return isNone() ? NONE_VALUE : new ReservedElement(variant(), unwrap().copy());
    }

}

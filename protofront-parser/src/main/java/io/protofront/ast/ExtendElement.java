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

public class ExtendElement extends WrapperNode {

    private static final ExtendElement NONE_VALUE = new ExtendElement();

    private ExtendElement() {
    }

    private ExtendElement(String variant, Node value) {
        super(variant, value);
    }

    public ExtendElement(FieldNode field) {
        super("field", field);
    }

    public ExtendElement(GroupNode group) {
        super("group", group);
    }

    public ExtendElement(EmptyDeclNode empty) {
        super("empty", empty);
    }

    public ExtendElement(ErrorNode error) {
        super("err", error);
    }

    public static ExtendElement none() {
        return NONE_VALUE;
    }

    public FieldNode field() {
        return as(FieldNode.class);
    }

    public GroupNode group() {
        return as(GroupNode.class);
    }

    public EmptyDeclNode empty() {
        return as(EmptyDeclNode.class);
    }

    public ErrorNode error() {
        return as(ErrorNode.class);
    }

    @Override
    public ExtendElement copy() {
        return isNone() ? NONE_VALUE : new ExtendElement(variant(), unwrap().copy());
    }

}

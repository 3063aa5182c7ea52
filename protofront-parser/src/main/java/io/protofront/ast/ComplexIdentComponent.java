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
 * One part of a compound identifier or option name.
 */
public class ComplexIdentComponent extends WrapperNode {

    private static final ComplexIdentComponent NONE_VALUE = new ComplexIdentComponent();

    private ComplexIdentComponent() {
    }

    private ComplexIdentComponent(String variant, Node value) {
        super(variant, value);
    }

    public ComplexIdentComponent(IdentNode ident) {
        super("ident", ident);
    }

    public ComplexIdentComponent(RuneNode dot) {
        super("dot", dot);
    }

    public ComplexIdentComponent(FieldReferenceNode fieldRef) {
        super("fieldRef", fieldRef);
    }

    public static ComplexIdentComponent none() {
        return NONE_VALUE;
    }

    public IdentNode ident() {
        return as(IdentNode.class);
    }

    public RuneNode dot() {
        return as(RuneNode.class);
    }

    public FieldReferenceNode fieldRef() {
        return as(FieldReferenceNode.class);
    }

    @Override
    public ComplexIdentComponent copy() {
        return isNone() ? NONE_VALUE : new ComplexIdentComponent(variant(), unwrap().copy());
    }

}

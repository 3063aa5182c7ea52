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
 * A tagged union over alternative node types. Exactly one variant is populated, or none
 * for error recovery placeholders. Walkers pass through wrappers without surfacing them.
 */
public abstract class WrapperNode implements Node {

    public static final String NONE = "none";

    private final String variant;
    private final Node value;

    protected WrapperNode(String variant, Node value) {
        if (value == null) {
            throw new AstConstructionException(getClass().getSimpleName() + ": " + variant + " must not be null");
        }
        this.variant = variant;
        this.value = value;
    }

    protected WrapperNode() {
        this.variant = NONE;
        this.value = NoneNode.INSTANCE;
    }

    public String variant() {
        return variant;
    }

    /**
     * @return the populated variant, {@link NoneNode#INSTANCE} if there is none
     */
    public Node unwrap() {
        return value;
    }

    public boolean isNone() {
        return value == NoneNode.INSTANCE;
    }

    protected <T> T as(Class<T> type) {
        return type.isInstance(value) ? type.cast(value) : null;
    }

    @Override
    public Token start() {
        return value.start();
    }

    @Override
    public Token end() {
        return value.end();
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        if (!isNone()) {
            visitor.field(variant, value);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + variant + "]";
    }

}

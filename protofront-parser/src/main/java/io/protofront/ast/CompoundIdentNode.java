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

import java.util.List;

/**
 * A qualified name such as {@code foo.bar.Baz} or {@code .foo.Bar}, components and dots
 * interleaved in source order.
 */
public class CompoundIdentNode extends CompositeNode {

    public final List<ComplexIdentComponent> components;

    public CompoundIdentNode(List<ComplexIdentComponent> components) {
        this.components = nonEmpty(components, "CompoundIdentNode", "components");
    }

    public boolean isFullyQualified() {
        return leadingDot() != null;
    }

    public RuneNode leadingDot() {
        return components.get(0).dot();
    }

    public String asIdentifier() {
        StringBuilder sb = new StringBuilder();
        for (ComplexIdentComponent component : components) {
            if (component.ident() != null) {
                sb.append(component.ident().val);
            } else if (component.dot() != null) {
                sb.append('.');
            } else if (component.fieldRef() != null) {
                sb.append(component.fieldRef().asString());
            }
        }
        return sb.toString();
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.list("components", components);
    }

    @Override
    public CompoundIdentNode copy() {
        return new CompoundIdentNode(Nodes.copyAll(components));
    }

    @Override
    public String toString() {
        return asIdentifier();
    }

}

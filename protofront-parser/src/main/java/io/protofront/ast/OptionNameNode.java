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

import java.util.ArrayList;
import java.util.List;

/**
 * Option name path such as {@code (foo.bar).baz}. Parts are field references and dots.
 */
public class OptionNameNode extends CompositeNode {

    public final List<ComplexIdentComponent> parts;

    public OptionNameNode(List<ComplexIdentComponent> parts) {
        this.parts = nonEmpty(parts, "OptionNameNode", "parts");
    }

    public static OptionNameNode of(IdentValueNode ident) {
        List<ComplexIdentComponent> parts = new ArrayList<>();
        if (ident.ident() != null) {
            parts.add(new ComplexIdentComponent(new FieldReferenceNode(new IdentValueNode(ident.ident()))));
        } else if (ident.compoundIdent() != null) {
            for (ComplexIdentComponent component : ident.compoundIdent().components) {
                if (component.ident() != null) {
                    parts.add(new ComplexIdentComponent(new FieldReferenceNode(new IdentValueNode(component.ident()))));
                } else {
                    parts.add(component);
                }
            }
        } else {
            throw new AstConstructionException("OptionNameNode: empty identifier");
        }
        return new OptionNameNode(parts);
    }

    public List<FieldReferenceNode> fieldReferences() {
        List<FieldReferenceNode> list = new ArrayList<>();
        for (ComplexIdentComponent part : parts) {
            if (part.fieldRef() != null) {
                list.add(part.fieldRef());
            }
        }
        return list;
    }

    public boolean isIncomplete() {
        for (FieldReferenceNode ref : fieldReferences()) {
            if (ref.isIncomplete()) {
                return true;
            }
        }
        return false;
    }

    public String asString() {
        StringBuilder sb = new StringBuilder();
        for (ComplexIdentComponent part : parts) {
            if (part.fieldRef() != null) {
                sb.append(part.fieldRef().asString());
            } else if (part.dot() != null) {
                sb.append('.');
            } else if (part.ident() != null) {
                sb.append(part.ident().val);
            }
        }
        return sb.toString();
    }

    @Override
    public void forEachChild(ChildVisitor visitor) {
        visitor.list("parts", parts);
    }

    @Override
    public OptionNameNode copy() {
        return new OptionNameNode(Nodes.copyAll(parts));
    }

    @Override
    public String toString() {
        return asString();
    }

}

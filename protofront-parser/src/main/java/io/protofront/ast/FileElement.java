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
 * A top level declaration.
 */
public class FileElement extends WrapperNode {

    private static final FileElement NONE_VALUE = new FileElement();

    private FileElement() {
    }

    private FileElement(String variant, Node value) {
        super(variant, value);
    }

    public FileElement(ImportNode importNode) {
        super("import", importNode);
    }

    public FileElement(PackageNode packageNode) {
        super("package", packageNode);
    }

    public FileElement(OptionNode option) {
        super("option", option);
    }

    public FileElement(MessageNode message) {
        super("message", message);
    }

    public FileElement(EnumNode enumNode) {
        super("enum", enumNode);
    }

    public FileElement(ExtendNode extend) {
        super("extend", extend);
    }

    public FileElement(ServiceNode service) {
        super("service", service);
    }

    public FileElement(EmptyDeclNode empty) {
        super("empty", empty);
    }

    public FileElement(ErrorNode error) {
        super("err", error);
    }

    public static FileElement none() {
        return NONE_VALUE;
    }

    public ImportNode importNode() {
        return as(ImportNode.class);
    }

    public PackageNode packageNode() {
        return as(PackageNode.class);
    }

    public OptionNode option() {
        return as(OptionNode.class);
    }

    public MessageNode message() {
        return as(MessageNode.class);
    }

    public EnumNode enumNode() {
        return as(EnumNode.class);
    }

    public ExtendNode extend() {
        return as(ExtendNode.class);
    }

    public ServiceNode service() {
        return as(ServiceNode.class);
    }

    public EmptyDeclNode empty() {
        return as(EmptyDeclNode.class);
    }

    public ErrorNode error() {
        return as(ErrorNode.class);
    }

    @Override
    public FileElement copy() {
        return isNone() ? NONE_VALUE : new FileElement(variant(), unwrap().copy());
    }

}

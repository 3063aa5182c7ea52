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
 * A declaration inside a message or group body.
 */
public class MessageElement extends WrapperNode {

    private static final MessageElement NONE_VALUE = new MessageElement();

    private MessageElement() {
    }

    private MessageElement(String variant, Node value) {
        super(variant, value);
    }

    public MessageElement(OptionNode option) {
        super("option", option);
    }

    public MessageElement(FieldNode field) {
        super("field", field);
    }

    public MessageElement(MapFieldNode mapField) {
        super("mapField", mapField);
    }

    public MessageElement(OneofNode oneof) {
        super("oneof", oneof);
    }

    public MessageElement(GroupNode group) {
        super("group", group);
    }

    public MessageElement(MessageNode message) {
        super("message", message);
    }

    public MessageElement(EnumNode enumNode) {
        super("enum", enumNode);
    }

    public MessageElement(ExtendNode extend) {
        super("extend", extend);
    }

    public MessageElement(ExtensionRangeNode extensionRange) {
        super("extensionRange", extensionRange);
    }

    public MessageElement(ReservedNode reserved) {
        super("reserved", reserved);
    }

    public MessageElement(EmptyDeclNode empty) {
        super("empty", empty);
    }

    public MessageElement(ErrorNode error) {
        super("err", error);
    }

    public static MessageElement none() {
        return NONE_VALUE;
    }

    public OptionNode option() {
        return as(OptionNode.class);
    }

    public FieldNode field() {
        return as(FieldNode.class);
    }

    public MapFieldNode mapField() {
        return as(MapFieldNode.class);
    }

    public OneofNode oneof() {
        return as(OneofNode.class);
    }

    public GroupNode group() {
        return as(GroupNode.class);
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

    public ExtensionRangeNode extensionRange() {
        return as(ExtensionRangeNode.class);
    }

    public ReservedNode reserved() {
        return as(ReservedNode.class);
    }

    public EmptyDeclNode empty() {
        return as(EmptyDeclNode.class);
    }

    public ErrorNode error() {
        return as(ErrorNode.class);
    }

    @Override
    public MessageElement copy() {
        return isNone() ? NONE_VALUE : new MessageElement(variant(), unwrap().copy());
    }

}

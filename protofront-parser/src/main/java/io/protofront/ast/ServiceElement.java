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

public class ServiceElement extends WrapperNode {

    private static final ServiceElement NONE_VALUE = new ServiceElement();

    private ServiceElement() {
    }

    private ServiceElement(String variant, Node value) {
        super(variant, value);
    }

    public ServiceElement(OptionNode option) {
        super("option", option);
    }

    public ServiceElement(RPCNode rpc) {
        super("rpc", rpc);
    }

    public ServiceElement(EmptyDeclNode empty) {
        super("empty", empty);
    }

    public ServiceElement(ErrorNode error) {
        super("err", error);
    }

    public static ServiceElement none() {
        return NONE_VALUE;
    }

    public OptionNode option() {
        return as(OptionNode.class);
    }

    public RPCNode rpc() {
        return as(RPCNode.class);
    }

    public EmptyDeclNode empty() {
        return as(EmptyDeclNode.class);
    }

    public ErrorNode error() {
        return as(ErrorNode.class);
    }

    @Override
    public ServiceElement copy() {
        return isNone() ? NONE_VALUE : new ServiceElement(variant(), unwrap().copy());
    }

}

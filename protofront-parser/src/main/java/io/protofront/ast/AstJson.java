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

import net.minidev.json.JSONValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a tree as plain maps and lists, and from there as JSON. Composites become
 * objects with a "type" key followed by their present fields, unions are transparent.
 * Terminals become scalars: identifiers and strings as their value, runes as their
 * character with virtual runes prefixed by {@code ~}, and the end of file as "EOF".
 */
public class AstJson {

    private AstJson() {
    }

    public static String toJson(Node node) {
        return JSONValue.toJSONString(toObject(node));
    }

    public static Object toObject(Node node) {
        if (node == null) {
            return null;
        }
        if (node instanceof WrapperNode) {
            WrapperNode wrapper = (WrapperNode) node;
            return wrapper.isNone() ? null : toObject(wrapper.unwrap());
        }
        if (node instanceof RuneNode) {
            RuneNode rune = (RuneNode) node;
            if (rune.rune == 0) {
                return "EOF";
            }
            String text = new String(Character.toChars(rune.rune));
            return rune.virtual ? "~" + text : text;
        }
        if (node instanceof IdentNode) {
            return ((IdentNode) node).val;
        }
        if (node instanceof StringLiteralNode) {
            return ((StringLiteralNode) node).val;
        }
        if (node instanceof UintLiteralNode) {
            UintLiteralNode uint = (UintLiteralNode) node;
            return uint.val < 0 ? uint.asUnsignedString() : (Object) uint.val;
        }
        if (node instanceof FloatLiteralNode) {
            return ((FloatLiteralNode) node).val;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", node.getClass().getSimpleName());
        node.forEachChild(new ChildVisitor() {
            @Override
            public void field(String name, Node child) {
                if (child != null) {
                    map.put(name, toObject(child));
                }
            }

            @Override
            public void list(String name, List<? extends Node> children) {
                List<Object> list = new ArrayList<>(children.size());
                for (Node child : children) {
                    list.add(toObject(child));
                }
                map.put(name, list);
            }
        });
        return map;
    }

}

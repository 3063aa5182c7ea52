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
package io.protofront.parser;

import io.protofront.ast.AstJson;
import io.protofront.ast.AstPrinter;
import io.protofront.ast.FileNode;
import io.protofront.ast.Node;
import io.protofront.ast.TerminalNode;
import io.protofront.ast.Nodes;
import net.minidev.json.JSONValue;
import org.junit.jupiter.api.Assertions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SuppressWarnings("unchecked")
public class ProtoTestUtils {

    static final Logger logger = LoggerFactory.getLogger(ProtoTestUtils.class);

    public static ParseResult parse(String text) {
        return parse(text, ParseConfig.defaults());
    }

    public static ParseResult parse(String text, ParseConfig config) {
        return Parser.parse("test.proto", text.getBytes(StandardCharsets.UTF_8), new ErrorHandler(), config);
    }

    /**
     * Parses and fails the test on any error.
     */
    public static FileNode parseOk(String text) {
        ParseResult result = parse(text);
        if (result.error() != null) {
            fail("unexpected errors: " + result.error().getErrors());
        }
        return result.ast();
    }

    public static void assertRoundTrip(String text) {
        ParseResult result = parse(text);
        String printed = AstPrinter.print(result.ast());
        if (!text.equals(printed)) {
            logger.debug("source:\n{}\nprinted:\n{}", text, printed);
        }
        assertEquals(text, printed);
    }

    /**
     * Lexes the whole input, EOF included.
     */
    public static List<Symbol> lex(String text, ErrorHandler handler) {
        ProtoLexer lexer = new ProtoLexer("test.proto", text.getBytes(StandardCharsets.UTF_8), handler, ParseConfig.defaults());
        List<Symbol> list = new ArrayList<>();
        while (true) {
            Symbol sym = lexer.next();
            list.add(sym);
            if (sym.type == SymbolType.EOF) {
                return list;
            }
        }
    }

    public static List<Symbol> lex(String text) {
        return lex(text, new ErrorHandler());
    }

    public static List<String> texts(List<TerminalNode> terminals, FileNode file) {
        List<String> list = new ArrayList<>(terminals.size());
        for (TerminalNode terminal : terminals) {
            list.add(file.nodeInfo(terminal).rawText());
        }
        return list;
    }

    public static List<String> texts(Node node, FileNode file) {
        return texts(Nodes.terminals(node), file);
    }

    public static List<String> messages(List<SyntaxError> errors) {
        List<String> list = new ArrayList<>(errors.size());
        for (SyntaxError error : errors) {
            list.add(error.message);
        }
        return list;
    }

    /**
     * Compares the JSON rendering of the node with the expected JSON, numbers by value.
     */
    public static void match(Node node, String json) {
        Object actual = AstJson.toObject(node);
        Object expected = JSONValue.parse(json);
        isEqualTo(actual, expected, "$");
    }

    private static void isEqualTo(Object actual, Object expected, String path) {
        if (expected instanceof List) {
            if (!(actual instanceof List)) {
                Assertions.fail(path + ": list expected, actual is: " + actual);
            }
            List<Object> actList = (List<Object>) actual;
            List<Object> expList = (List<Object>) expected;
            if (actList.size() != expList.size()) {
                Assertions.fail(path + ": list size mismatch: " + actList.size() + " - " + expList.size() + ": " + actual);
            }
            for (int i = 0; i < expList.size(); i++) {
                isEqualTo(actList.get(i), expList.get(i), path + "[" + i + "]");
            }
        } else if (expected instanceof Map) {
            if (!(actual instanceof Map)) {
                Assertions.fail(path + ": map expected, actual is: " + actual);
            }
            Map<String, Object> actMap = (Map<String, Object>) actual;
            Map<String, Object> expMap = (Map<String, Object>) expected;
            if (!actMap.keySet().equals(expMap.keySet())) {
                Assertions.fail(path + ": keys mismatch: " + actMap.keySet() + " - " + expMap.keySet());
            }
            for (String key : expMap.keySet()) {
                isEqualTo(actMap.get(key), expMap.get(key), path + "." + key);
            }
        } else if (expected instanceof Number) {
            if (!(actual instanceof Number)) {
                Assertions.fail(path + ": number expected, actual is: " + actual);
            }
            assertEquals(((Number) expected).doubleValue(), ((Number) actual).doubleValue(), path);
        } else {
            assertEquals(expected, actual, path);
        }
    }

}

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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable results of a {@link ParseExecutor} run, keyed by file name in submission order.
 */
public class ParsedFiles {

    private final Map<String, ParseResult> results;

    ParsedFiles(List<ParseResult> list) {
        Map<String, ParseResult> map = new LinkedHashMap<>(list.size());
        for (ParseResult result : list) {
            map.put(result.getName(), result);
        }
        this.results = Collections.unmodifiableMap(map);
    }

    public ParseResult get(String name) {
        return results.get(name);
    }

    public Collection<ParseResult> getResults() {
        return results.values();
    }

    public int size() {
        return results.size();
    }

    public List<ParseResult> getFailed() {
        return results.values().stream().filter(r -> !r.isOk()).collect(Collectors.toList());
    }

    public boolean isOk() {
        return getFailed().isEmpty();
    }

    @Override
    public String toString() {
        return "ParsedFiles{count=" + results.size() + ", failed=" + getFailed().size() + "}";
    }

}

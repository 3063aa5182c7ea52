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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records every diagnostic of one parse and asks the {@link ErrorReporter} whether to
 * continue. Once the reporter says stop, the handler stays aborted and the lexer only
 * returns EOF from then on. One instance per file, not thread-safe.
 */
public class ErrorHandler {

    static final String GENERIC_FAILURE = "parse failed: invalid proto source";

    private final ErrorReporter reporter;
    private final List<SyntaxError> errors = new ArrayList<>();
    private final List<SyntaxError> warnings = new ArrayList<>();
    private SyntaxError abortedBy;

    public ErrorHandler(ErrorReporter reporter) {
        this.reporter = reporter;
    }

    public ErrorHandler() {
        this(ErrorReporter.collecting());
    }

    /**
     * @return true if parsing should continue
     */
    public boolean handleError(SyntaxError error) {
        if (abortedBy != null) {
            return false;
        }
        errors.add(error);
        if (!reporter.error(error)) {
            abortedBy = error;
            return false;
        }
        return true;
    }

    public void handleWarning(SyntaxError warning) {
        warnings.add(warning);
        reporter.warning(warning);
    }

    public boolean isAborted() {
        return abortedBy != null;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<SyntaxError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<SyntaxError> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * @return null when no error was reported
     */
    public ParserException getError() {
        if (errors.isEmpty()) {
            return null;
        }
        String message = abortedBy != null ? abortedBy.toString() : GENERIC_FAILURE;
        return new ParserException(message, errors);
    }

}

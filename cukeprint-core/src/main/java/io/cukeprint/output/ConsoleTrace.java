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
package io.cukeprint.output;

import org.slf4j.Logger;

import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Collects text written to the console into whole lines and hands each line,
 * stripped of ANSI codes, to a sink.
 */
final class ConsoleTrace {

    private final BooleanSupplier enabled;
    private final Consumer<String> sink;
    private final StringBuilder line = new StringBuilder();

    ConsoleTrace(BooleanSupplier enabled, Consumer<String> sink) {
        this.enabled = enabled;
        this.sink = sink;
    }

    static ConsoleTrace toLogger(Logger logger) {
        return new ConsoleTrace(logger::isTraceEnabled, logger::trace);
    }

    void append(String text) {
        if (!enabled.getAsBoolean()) {
            return;
        }
        int start = 0;
        int pos;
        while ((pos = text.indexOf('\n', start)) != -1) {
            line.append(text, start, pos);
            sink.accept(Console.stripAnsi(line.toString()));
            line.setLength(0);
            start = pos + 1;
        }
        line.append(text, start, text.length());
    }

}

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
package io.cukeprint.gherkin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * The step text as matched by a step definition, with the positions of the
 * captured arguments.
 */
public class StepMatch {

    public record Argument(int offset, String value) {

        public int end() {
            return offset + value.length();
        }

    }

    private final String text;
    private final String location;
    private final List<Argument> arguments = new ArrayList<>();

    public StepMatch(String text, String location) {
        this.text = text == null ? "" : text;
        this.location = location;
    }

    public String getText() {
        return text;
    }

    /**
     * @return "file:line" of the step definition, null when undefined
     */
    public String getLocation() {
        return location;
    }

    public StepMatch argument(int offset, String value) {
        if (offset < 0 || value == null || offset + value.length() > text.length()) {
            throw new IllegalArgumentException("argument out of range: " + offset + " '" + value + "' in: " + text);
        }
        arguments.add(new Argument(offset, value));
        arguments.sort(Comparator.comparingInt(Argument::offset));
        return this;
    }

    public List<Argument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

}

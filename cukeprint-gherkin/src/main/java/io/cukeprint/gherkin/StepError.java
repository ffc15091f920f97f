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
import java.util.List;

/**
 * An error raised while running a step. Two errors are the same error when
 * their ids are equal: the producer assigns one id to a failure that surfaces
 * in several places, such as a background step shared by every scenario.
 */
public class StepError {

    private final String id;
    private final String message;
    private final String type;
    private final List<String> backtrace;

    public StepError(String id, String message, String type, List<String> backtrace) {
        if (id == null) {
            throw new IllegalArgumentException("error id must not be null");
        }
        this.id = id;
        this.message = message == null ? "" : message;
        this.type = type;
        this.backtrace = backtrace == null ? Collections.emptyList() : List.copyOf(backtrace);
    }

    public static StepError of(String id, Throwable t) {
        List<String> lines = new ArrayList<>();
        for (StackTraceElement ste : t.getStackTrace()) {
            lines.add(ste.toString());
        }
        return new StepError(id, t.getMessage(), t.getClass().getName(), lines);
    }

    public String getId() {
        return id;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return the error class name, null when unknown
     */
    public String getType() {
        return type;
    }

    public List<String> getBacktrace() {
        return backtrace;
    }

    /**
     * @return message and type on the first line, one backtrace entry per following line
     */
    public String toText() {
        StringBuilder sb = new StringBuilder(message);
        if (type != null) {
            sb.append(" (").append(type).append(')');
        }
        for (String line : backtrace) {
            sb.append('\n').append(line);
        }
        return sb.toString();
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return id.equals(((StepError) obj).id);
    }

    @Override
    public String toString() {
        return id + ": " + message;
    }

}

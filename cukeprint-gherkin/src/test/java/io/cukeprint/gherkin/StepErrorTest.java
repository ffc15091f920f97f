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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StepErrorTest {

    @Test
    void testToText() {
        StepError error = new StepError("1", "expected 2 but was 3", "java.lang.AssertionError",
                List.of("at Steps.check(Steps.java:12)", "at Runner.run(Runner.java:40)"));
        assertEquals("""
                expected 2 but was 3 (java.lang.AssertionError)
                at Steps.check(Steps.java:12)
                at Runner.run(Runner.java:40)""", error.toText());
    }

    @Test
    void testToTextWithoutType() {
        StepError error = new StepError("1", "boom", null, null);
        assertEquals("boom", error.toText());
        assertTrue(error.getBacktrace().isEmpty());
    }

    @Test
    void testEqualityById() {
        StepError a = new StepError("shared", "one", null, null);
        StepError b = new StepError("shared", "two", "x.Y", null);
        StepError c = new StepError("other", "one", null, null);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void testIdRequired() {
        assertThrows(IllegalArgumentException.class, () -> new StepError(null, "x", null, null));
    }

    @Test
    void testOfThrowable() {
        StepError error = StepError.of("e1", new IllegalStateException("bad state"));
        assertEquals("bad state", error.getMessage());
        assertEquals("java.lang.IllegalStateException", error.getType());
        assertFalse(error.getBacktrace().isEmpty());
    }

}

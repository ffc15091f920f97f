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

import io.cukeprint.gherkin.Status;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleTest {

    @AfterEach
    void afterEach() {
        Console.setColorsEnabled(false);
    }

    @Test
    void testStatusColors() {
        Console.setColorsEnabled(true);
        assertEquals("\u001B[32mok\u001B[0m", Console.style("ok", Status.PASSED));
        assertEquals("\u001B[31mno\u001B[0m", Console.style("no", Status.FAILED));
        assertEquals("\u001B[36mskip\u001B[0m", Console.style("skip", Status.SKIPPED));
        assertEquals("\u001B[33m?\u001B[0m", Console.style("?", Status.UNDEFINED));
        assertEquals("\u001B[33m?\u001B[0m", Console.style("?", Status.PENDING));
        assertEquals("\u001B[32m\u001B[1m5\u001B[0m", Console.param("5", Status.PASSED));
        assertEquals("\u001B[90m# x\u001B[0m", Console.comment("# x"));
    }

    @Test
    void testColorsDisabled() {
        Console.setColorsEnabled(false);
        assertEquals("ok", Console.style("ok", Status.PASSED));
        assertEquals("@tag", Console.tag("@tag"));
        assertEquals("error", Console.fail("error"));
    }

    @Test
    void testStripAnsi() {
        Console.setColorsEnabled(true);
        String styled = Console.style("a", Status.FAILED) + " | " + Console.param("b", Status.PASSED);
        assertEquals("a | b", Console.stripAnsi(styled));
    }

    @Test
    void testPrintln() {
        PrintStream original = Console.getOutput();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try {
            Console.setOutput(new PrintStream(baos, true, StandardCharsets.UTF_8));
            Console.println("hello");
        } finally {
            Console.setOutput(original);
        }
        assertEquals("hello" + System.lineSeparator(), baos.toString(StandardCharsets.UTF_8));
    }

}

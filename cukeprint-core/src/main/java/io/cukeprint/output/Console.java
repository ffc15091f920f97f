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
import org.slf4j.Logger;

import java.io.PrintStream;
import java.util.regex.Pattern;

/**
 * Console output utilities with ANSI color support.
 * Also sends a copy (stripped of ANSI codes) to the cukeprint.console logger at TRACE level.
 */
public final class Console {

    private static final Logger logger = LogContext.CONSOLE_LOGGER;

    // Pattern to strip ANSI escape codes for logger
    private static final Pattern ANSI_PATTERN = Pattern.compile("\u001B\\[[;\\d]*m");

    private Console() {
    }

    public static String stripAnsi(String text) {
        return ANSI_PATTERN.matcher(text).replaceAll("");
    }

    // ANSI escape codes
    public static final String RESET = "\u001B[0m";
    public static final String BOLD = "\u001B[1m";

    // Colors
    public static final String RED = "\u001B[31m";
    public static final String GREEN = "\u001B[32m";
    public static final String YELLOW = "\u001B[33m";
    public static final String CYAN = "\u001B[36m";
    public static final String GREY = "\u001B[90m";

    private static boolean colorsEnabled = detectColorSupport();
    private static PrintStream out = System.out;

    private static boolean detectColorSupport() {
        String term = System.getenv("TERM");
        String colorterm = System.getenv("COLORTERM");
        String forceColor = System.getenv("FORCE_COLOR");
        String noColor = System.getenv("NO_COLOR");

        // NO_COLOR takes precedence (https://no-color.org/)
        if (noColor != null) {
            return false;
        }
        if (forceColor != null && !forceColor.equals("0")) {
            return true;
        }
        // only an interactive stream gets colors, never a pipe or a file
        if (System.console() == null) {
            return false;
        }
        if (term != null && (term.contains("color") || term.contains("xterm") || term.contains("256"))) {
            return true;
        }
        if (colorterm != null) {
            return true;
        }
        String os = System.getProperty("os.name", "").toLowerCase();
        if (os.contains("win")) {
            return System.getenv("WT_SESSION") != null;
        }
        return true;
    }

    public static void setColorsEnabled(boolean enabled) {
        colorsEnabled = enabled;
    }

    public static boolean isColorsEnabled() {
        return colorsEnabled;
    }

    public static void setOutput(PrintStream output) {
        out = output;
    }

    public static PrintStream getOutput() {
        return out;
    }

    // ========== Formatting helpers ==========

    public static String color(String text, String... codes) {
        if (!colorsEnabled || codes.length == 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        for (String code : codes) {
            sb.append(code);
        }
        sb.append(text);
        sb.append(RESET);
        return sb.toString();
    }

    // ========== Status formatting ==========

    public static String style(String text, Status status) {
        return color(text, statusColor(status));
    }

    /**
     * Highlight for a matched step argument, the bold form of the status color.
     */
    public static String param(String text, Status status) {
        return color(text, statusColor(status), BOLD);
    }

    public static String tag(String text) {
        return color(text, CYAN);
    }

    public static String comment(String text) {
        return color(text, GREY);
    }

    private static String statusColor(Status status) {
        return switch (status) {
            case PASSED -> GREEN;
            case FAILED -> RED;
            case SKIPPED -> CYAN;
            case UNDEFINED, PENDING -> YELLOW;
        };
    }

    // ========== Semantic formatting ==========

    public static String fail(String text) {
        return color(text, RED, BOLD);
    }

    public static String warn(String text) {
        return color(text, YELLOW);
    }

    // ========== Output ==========

    public static void println(String text) {
        out.println(text);
        // Send stripped copy to logger at TRACE level (avoids double-logging)
        if (logger.isTraceEnabled()) {
            logger.trace(stripAnsi(text));
        }
    }

}

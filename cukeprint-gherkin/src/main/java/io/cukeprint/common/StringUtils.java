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
package io.cukeprint.common;

import java.util.ArrayList;
import java.util.List;

public class StringUtils {

    private StringUtils() {
        // only static methods
    }

    public static final String EMPTY = "";

    public static String trimToEmpty(String s) {
        if (s == null) {
            return EMPTY;
        } else {
            return s.trim();
        }
    }

    public static String trimToNull(String s) {
        String temp = trimToEmpty(s);
        return EMPTY.equals(temp) ? null : temp;
    }

    public static boolean isBlank(String s) {
        return trimToNull(s) == null;
    }

    public static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Splits on line feeds, keeping empty lines in between but not the empty
     * remainder after a trailing line feed. A null or empty input yields a
     * single empty line.
     */
    public static List<String> lines(String text) {
        List<String> list = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            list.add(EMPTY);
            return list;
        }
        int start = 0;
        int pos;
        while ((pos = text.indexOf('\n', start)) != -1) {
            list.add(stripCarriageReturn(text.substring(start, pos)));
            start = pos + 1;
        }
        if (start < text.length()) {
            list.add(stripCarriageReturn(text.substring(start)));
        }
        return list;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    public static String firstLine(String text) {
        return lines(text).get(0);
    }

    /**
     * Shifts every line of the text right by {@code n} spaces, or left by
     * removing up to {@code -n} leading spaces when {@code n} is negative.
     * A trailing line feed is preserved and does not start a new indented line.
     */
    public static String indent(String text, int n) {
        if (text == null) {
            return null;
        }
        if (n == 0) {
            return text;
        }
        String pad = n > 0 ? repeat(' ', n) : EMPTY;
        StringBuilder sb = new StringBuilder(text.length() + 16);
        int start = 0;
        while (start < text.length()) {
            int pos = text.indexOf('\n', start);
            int end = pos == -1 ? text.length() : pos;
            String line = text.substring(start, end);
            if (n > 0) {
                sb.append(pad).append(line);
            } else {
                int strip = 0;
                while (strip < -n && strip < line.length() && line.charAt(strip) == ' ') {
                    strip++;
                }
                sb.append(line, strip, line.length());
            }
            if (pos == -1) {
                break;
            }
            sb.append('\n');
            start = pos + 1;
        }
        return sb.toString();
    }

    /**
     * Number of terminal columns the text occupies. East Asian wide and
     * fullwidth characters (and most emoji) take two columns, combining marks,
     * format characters and controls take none.
     */
    public static int displayWidth(String text) {
        if (text == null) {
            return 0;
        }
        int width = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            width += codePointWidth(cp);
            i += Character.charCount(cp);
        }
        return width;
    }

    public static int codePointWidth(int cp) {
        if (cp == 0) {
            return 0;
        }
        if (cp < 32 || (cp >= 0x7f && cp < 0xa0)) {
            return 0;
        }
        int type = Character.getType(cp);
        if (type == Character.NON_SPACING_MARK
                || type == Character.ENCLOSING_MARK
                || type == Character.FORMAT) {
            return 0;
        }
        if (cp == 0x200b || (cp >= 0x1160 && cp <= 0x11ff)) {
            return 0;
        }
        return isWide(cp) ? 2 : 1;
    }

    private static boolean isWide(int cp) {
        return (cp >= 0x1100 && cp <= 0x115f) // hangul jamo
                || cp == 0x2329 || cp == 0x232a
                || (cp >= 0x2e80 && cp <= 0xa4cf && cp != 0x303f) // cjk .. yi
                || (cp >= 0xac00 && cp <= 0xd7a3) // hangul syllables
                || (cp >= 0xf900 && cp <= 0xfaff) // cjk compatibility ideographs
                || (cp >= 0xfe10 && cp <= 0xfe19) // vertical forms
                || (cp >= 0xfe30 && cp <= 0xfe6f) // cjk compatibility forms
                || (cp >= 0xff00 && cp <= 0xff60) // fullwidth forms
                || (cp >= 0xffe0 && cp <= 0xffe6)
                || (cp >= 0x1f300 && cp <= 0x1f64f) // symbols and emoticons
                || (cp >= 0x1f900 && cp <= 0x1f9ff)
                || (cp >= 0x20000 && cp <= 0x2fffd)
                || (cp >= 0x30000 && cp <= 0x3fffd);
    }

}

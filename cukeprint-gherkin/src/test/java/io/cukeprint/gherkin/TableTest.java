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

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableTest {

    @Test
    void testColumnWidths() {
        Table table = Table.of(List.of(
                List.of("a", "bb", "c"),
                List.of("abc", "0123456789", "")));
        assertEquals(3, table.getColumnCount());
        assertEquals(3, table.getColumnWidth(0));
        assertEquals(10, table.getColumnWidth(1));
        assertEquals(1, table.getColumnWidth(2));
    }

    @Test
    void testWideCharactersCountDouble() {
        Table table = Table.of(List.of(List.of("日本"), List.of("abc")));
        assertEquals(4, table.getColumnWidth(0));
    }

    @Test
    void testRaggedRows() {
        Table table = Table.of(List.of(List.of("a"), List.of("bb", "ccc")));
        assertEquals(2, table.getColumnCount());
        assertEquals(2, table.getColumnWidth(0));
        assertEquals(3, table.getColumnWidth(1));
    }

    @Test
    void testUnknownColumn() {
        Table table = Table.of(List.of(List.of("a")));
        assertThrows(IndexOutOfBoundsException.class, () -> table.getColumnWidth(1));
        assertThrows(IndexOutOfBoundsException.class, () -> table.getColumnWidth(-1));
    }

    @Test
    void testRowsAreCopied() {
        List<TableRow> rows = new ArrayList<>();
        rows.add(TableRow.of(List.of("a")));
        Table table = new Table(rows);
        rows.add(TableRow.of(List.of("much longer")));
        assertEquals(1, table.getRows().size());
        assertEquals(1, table.getColumnWidth(0));
    }

    @Test
    void testNullCellValue() {
        TableCell cell = new TableCell(null);
        assertEquals("", cell.getValue());
        assertNull(cell.getStatus());
    }

}

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

import io.cukeprint.common.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Rows of cells with column widths measured once, when the table is built.
 * Widths are in terminal columns, so wide characters count double.
 */
public final class Table implements MultilineArgument {

    private final List<TableRow> rows;
    private final int[] columnWidths;

    public Table(List<TableRow> rows) {
        this.rows = List.copyOf(rows);
        int columns = 0;
        for (TableRow row : this.rows) {
            columns = Math.max(columns, row.getCells().size());
        }
        columnWidths = new int[columns];
        for (TableRow row : this.rows) {
            List<TableCell> cells = row.getCells();
            for (int i = 0; i < cells.size(); i++) {
                int width = StringUtils.displayWidth(cells.get(i).getValue());
                if (width > columnWidths[i]) {
                    columnWidths[i] = width;
                }
            }
        }
    }

    public static Table of(List<List<String>> values) {
        List<TableRow> rows = new ArrayList<>(values.size());
        for (List<String> list : values) {
            rows.add(TableRow.of(list));
        }
        return new Table(rows);
    }

    public List<TableRow> getRows() {
        return rows;
    }

    public int getColumnCount() {
        return columnWidths.length;
    }

    public int getColumnWidth(int index) {
        if (index < 0 || index >= columnWidths.length) {
            throw new IndexOutOfBoundsException("no column " + index + ", table has " + columnWidths.length);
        }
        return columnWidths[index];
    }

}

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
import java.util.List;

public class TableRow {

    private final List<TableCell> cells;
    private int line;
    private StepError error;

    public TableRow(List<TableCell> cells) {
        this.cells = List.copyOf(cells);
    }

    public static TableRow of(List<String> values) {
        List<TableCell> cells = new ArrayList<>(values.size());
        for (String value : values) {
            cells.add(new TableCell(value));
        }
        return new TableRow(cells);
    }

    public static TableRow of(List<String> values, Status status) {
        List<TableCell> cells = new ArrayList<>(values.size());
        for (String value : values) {
            cells.add(new TableCell(value, status));
        }
        return new TableRow(cells);
    }

    public List<TableCell> getCells() {
        return cells;
    }

    public int getLine() {
        return line;
    }

    public void setLine(int line) {
        this.line = line;
    }

    /**
     * @return the error of an example row whose run failed, null otherwise
     */
    public StepError getError() {
        return error;
    }

    public void setError(StepError error) {
        this.error = error;
    }

}

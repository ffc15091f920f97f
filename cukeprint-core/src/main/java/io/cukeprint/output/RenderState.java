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
import io.cukeprint.gherkin.Step;
import io.cukeprint.gherkin.StepError;
import io.cukeprint.gherkin.Table;

import java.util.HashSet;
import java.util.Set;

/**
 * Mutable state of one render pass. Indentation is set to a fixed value by
 * each kind of block as it is entered, never derived from nesting depth.
 */
class RenderState {

    static final int ELEMENT_INDENT = 2;
    static final int EXAMPLES_INDENT = 4;
    static final int STEP_INDENT = 6;

    // indent while a tag line is open, so later tags are separated by one space
    static final int TAG_LINE = 1;

    int indent;
    int scenarioIndent;
    boolean inBackground;
    boolean firstExamplesName;
    boolean hideStep;
    boolean skipMultiline;

    private Table table;
    private int columnIndex;
    private Step currentStep;
    private Status status;
    private final Set<String> printedErrors = new HashSet<>();

    void startFeature() {
        printedErrors.clear();
        indent = 0;
        scenarioIndent = 0;
        inBackground = false;
        hideStep = false;
        skipMultiline = false;
        table = null;
        currentStep = null;
        status = null;
    }

    void startElement() {
        indent = ELEMENT_INDENT;
        scenarioIndent = ELEMENT_INDENT;
    }

    void startStep(Step step) {
        currentStep = step;
        indent = STEP_INDENT;
    }

    Step requireStep(String callback) {
        if (currentStep == null) {
            throw new IllegalStateException(callback + " received outside of a step");
        }
        return currentStep;
    }

    void setStatus(Status status) {
        this.status = status;
    }

    /**
     * The status to color with: the node's own status when it has one, else
     * the status of the step being rendered, else passed.
     */
    Status effectiveStatus(Status own) {
        if (own != null) {
            return own;
        }
        return status != null ? status : Status.PASSED;
    }

    /**
     * @return true if the error had not been printed yet in this feature, in
     * which case it is now recorded as printed
     */
    boolean markPrinted(StepError error) {
        return printedErrors.add(error.getId());
    }

    void startTable(Table table) {
        this.table = table;
        columnIndex = 0;
    }

    void endTable() {
        table = null;
    }

    Table requireTable(String callback) {
        if (table == null) {
            throw new IllegalStateException(callback + " received without an active table");
        }
        return table;
    }

    void startRow() {
        columnIndex = 0;
    }

    int getColumnIndex() {
        return columnIndex;
    }

    void nextColumn() {
        columnIndex++;
    }

}

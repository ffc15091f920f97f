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
package io.cukeprint.core;

import io.cukeprint.gherkin.Background;
import io.cukeprint.gherkin.DocString;
import io.cukeprint.gherkin.Examples;
import io.cukeprint.gherkin.Feature;
import io.cukeprint.gherkin.FeatureElement;
import io.cukeprint.gherkin.MultilineArgument;
import io.cukeprint.gherkin.Status;
import io.cukeprint.gherkin.Step;
import io.cukeprint.gherkin.StepError;
import io.cukeprint.gherkin.Table;
import io.cukeprint.gherkin.TableCell;
import io.cukeprint.gherkin.TableRow;
import io.cukeprint.gherkin.Tag;

import java.util.List;

/**
 * Receives one callback per node of a result tree, in document order, as
 * driven by {@link FeatureWalker}.
 * <p>
 * For each feature the order is: comments, tags, name, background, then every
 * element. Within an element: comments, tags, name, steps and, for an outline,
 * the examples. Within a step: result, name, multiline argument, error.
 * <p>
 * Implementations are stateful and not thread-safe: use one instance per walk.
 */
public interface FeatureVisitor {

    default void beforeFeatures(List<Feature> features) {
    }

    /**
     * Called once after the last feature of the run.
     */
    default void afterFeatures(List<Feature> features) {
    }

    default void beforeFeature(Feature feature) {
    }

    /**
     * Always called when {@link #beforeFeature(Feature)} returned normally,
     * even if visiting the feature failed.
     */
    default void afterFeature(Feature feature) {
    }

    default void commentLine(String comment) {
    }

    default void tagName(String tagName) {
    }

    default void afterTags(List<Tag> tags) {
    }

    default void featureName(String name) {
    }

    default void beforeBackground(Background background) {
    }

    default void backgroundName(String keyword, String name, String fileColonLine, int sourceIndent) {
    }

    default void afterBackground(Background background) {
    }

    default void beforeFeatureElement(FeatureElement element) {
    }

    /**
     * @param sourceIndent spaces to insert before the location comment so that
     *                     comments line up across the element
     */
    default void scenarioName(String keyword, String name, String fileColonLine, int sourceIndent) {
    }

    default void afterFeatureElement(FeatureElement element) {
    }

    default void beforeExamplesArray(List<Examples> examples) {
    }

    default void examplesName(String keyword, String name) {
    }

    default void beforeOutlineTable(Table table) {
    }

    default void afterOutlineTable(Table table) {
    }

    default void beforeStep(Step step) {
    }

    default void beforeStepResult(Step step, int sourceIndent) {
    }

    default void stepName(Step step, int sourceIndent) {
    }

    default void beforeMultilineArg(MultilineArgument argument) {
    }

    default void afterMultilineArg(MultilineArgument argument) {
    }

    default void docString(DocString docString) {
    }

    default void error(StepError error, Status status) {
    }

    default void beforeTableRow(TableRow row) {
    }

    default void afterTableRow(TableRow row) {
    }

    default void tableCellValue(String value, Status status) {
    }

    default void afterTableCell(TableCell cell) {
    }

}

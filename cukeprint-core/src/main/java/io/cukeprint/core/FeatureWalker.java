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

import io.cukeprint.common.StringUtils;
import io.cukeprint.gherkin.Background;
import io.cukeprint.gherkin.DocString;
import io.cukeprint.gherkin.Examples;
import io.cukeprint.gherkin.Feature;
import io.cukeprint.gherkin.FeatureElement;
import io.cukeprint.gherkin.MultilineArgument;
import io.cukeprint.gherkin.ScenarioOutline;
import io.cukeprint.gherkin.Step;
import io.cukeprint.gherkin.Table;
import io.cukeprint.gherkin.TableCell;
import io.cukeprint.gherkin.TableRow;
import io.cukeprint.gherkin.Tag;
import io.cukeprint.output.LogContext;
import org.slf4j.Logger;

import java.util.List;

/**
 * Walks result trees in document order and feeds every node to a {@link FeatureVisitor}.
 * <p>
 * The walker also measures each element so that location comments can be
 * right-aligned: the source indent handed to the visitor for a line is the
 * difference between the longest line of the element and that line.
 */
public class FeatureWalker {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final FeatureVisitor visitor;

    public FeatureWalker(FeatureVisitor visitor) {
        this.visitor = visitor;
    }

    public void walk(List<Feature> features) {
        visitor.beforeFeatures(features);
        for (Feature feature : features) {
            walkFeature(feature);
        }
        visitor.afterFeatures(features);
    }

    public void walkFeature(Feature feature) {
        logger.debug("walking feature: {}", feature);
        visitor.beforeFeature(feature);
        try {
            comments(feature.getComments());
            tags(feature.getTags());
            visitor.featureName(feature.getTitle());
            if (feature.isBackgroundPresent()) {
                walkBackground(feature.getBackground());
            }
            for (FeatureElement element : feature.getElements()) {
                walkElement(element);
            }
        } finally {
            visitor.afterFeature(feature);
        }
    }

    private void walkBackground(Background background) {
        visitor.beforeBackground(background);
        comments(background.getComments());
        int max = maxLineLength(background);
        visitor.backgroundName(background.getKeyword(), background.getName(),
                background.getFileColonLine(), max - nameLength(background));
        walkSteps(background.getSteps(), max);
        visitor.afterBackground(background);
    }

    private void walkElement(FeatureElement element) {
        visitor.beforeFeatureElement(element);
        comments(element.getComments());
        tags(element.getTags());
        int max = maxLineLength(element);
        visitor.scenarioName(element.getKeyword(), element.getName(),
                element.getFileColonLine(), max - nameLength(element));
        walkSteps(element.getSteps(), max);
        if (element instanceof ScenarioOutline outline && !outline.getExamples().isEmpty()) {
            walkExamples(outline.getExamples());
        }
        visitor.afterFeatureElement(element);
    }

    private void walkExamples(List<Examples> examplesList) {
        visitor.beforeExamplesArray(examplesList);
        for (Examples examples : examplesList) {
            visitor.examplesName(examples.getKeyword(), examples.getName());
            Table table = examples.getTable();
            visitor.beforeOutlineTable(table);
            walkRows(table);
            visitor.afterOutlineTable(table);
        }
    }

    private void walkSteps(List<Step> steps, int max) {
        for (Step step : steps) {
            int sourceIndent = max - stepLength(step);
            visitor.beforeStep(step);
            visitor.beforeStepResult(step, sourceIndent);
            visitor.stepName(step, sourceIndent);
            MultilineArgument argument = step.getArgument();
            if (argument != null) {
                visitor.beforeMultilineArg(argument);
                if (argument instanceof Table table) {
                    walkRows(table);
                } else {
                    visitor.docString((DocString) argument);
                }
                visitor.afterMultilineArg(argument);
            }
            if (step.getError() != null) {
                visitor.error(step.getError(), step.getStatus());
            }
        }
    }

    private void walkRows(Table table) {
        for (TableRow row : table.getRows()) {
            visitor.beforeTableRow(row);
            for (TableCell cell : row.getCells()) {
                visitor.tableCellValue(cell.getValue(), cell.getStatus());
                visitor.afterTableCell(cell);
            }
            visitor.afterTableRow(row);
        }
    }

    private void comments(List<String> comments) {
        for (String comment : comments) {
            visitor.commentLine(comment);
        }
    }

    private void tags(List<Tag> tags) {
        for (Tag tag : tags) {
            visitor.tagName(tag.getName());
        }
        visitor.afterTags(tags);
    }

    static int nameLength(FeatureElement element) {
        return StringUtils.displayWidth(
                FeatureElement.heading(element.getKeyword(), StringUtils.firstLine(element.getName())));
    }

    // steps print two columns deeper than their element
    static int stepLength(Step step) {
        return 2 + StringUtils.displayWidth(step.getKeyword() + " " + step.getMatch().getText());
    }

    static int maxLineLength(FeatureElement element) {
        int max = nameLength(element);
        for (Step step : element.getSteps()) {
            max = Math.max(max, stepLength(step));
        }
        return max;
    }

}

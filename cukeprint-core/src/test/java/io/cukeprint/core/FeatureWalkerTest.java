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
import io.cukeprint.gherkin.Scenario;
import io.cukeprint.gherkin.ScenarioOutline;
import io.cukeprint.gherkin.Status;
import io.cukeprint.gherkin.Step;
import io.cukeprint.gherkin.StepError;
import io.cukeprint.gherkin.StepMatch;
import io.cukeprint.gherkin.StepResult;
import io.cukeprint.gherkin.Table;
import io.cukeprint.gherkin.TableCell;
import io.cukeprint.gherkin.TableRow;
import io.cukeprint.gherkin.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureWalkerTest {

    static class RecordingVisitor implements FeatureVisitor {

        final List<String> events = new ArrayList<>();

        @Override
        public void beforeFeature(Feature feature) {
            events.add("beforeFeature");
        }

        @Override
        public void afterFeature(Feature feature) {
            events.add("afterFeature");
        }

        @Override
        public void commentLine(String comment) {
            events.add("comment " + comment);
        }

        @Override
        public void tagName(String tagName) {
            events.add("tag " + tagName);
        }

        @Override
        public void afterTags(List<Tag> tags) {
            events.add("afterTags " + tags.size());
        }

        @Override
        public void featureName(String name) {
            events.add("featureName " + name);
        }

        @Override
        public void backgroundName(String keyword, String name, String fileColonLine, int sourceIndent) {
            events.add("backgroundName " + keyword + " " + sourceIndent);
        }

        @Override
        public void scenarioName(String keyword, String name, String fileColonLine, int sourceIndent) {
            events.add("scenarioName " + name + " " + fileColonLine + " " + sourceIndent);
        }

        @Override
        public void beforeStep(Step step) {
            events.add("beforeStep");
        }

        @Override
        public void stepName(Step step, int sourceIndent) {
            events.add("stepName " + step.getText() + " " + sourceIndent);
        }

        @Override
        public void beforeMultilineArg(MultilineArgument argument) {
            events.add("beforeMultilineArg");
        }

        @Override
        public void afterMultilineArg(MultilineArgument argument) {
            events.add("afterMultilineArg");
        }

        @Override
        public void docString(DocString docString) {
            events.add("docString " + docString.getContent());
        }

        @Override
        public void error(StepError error, Status status) {
            events.add("error " + error.getMessage() + " " + status.getName());
        }

        @Override
        public void beforeExamplesArray(List<Examples> examples) {
            events.add("beforeExamplesArray " + examples.size());
        }

        @Override
        public void examplesName(String keyword, String name) {
            events.add("examplesName " + name);
        }

        @Override
        public void beforeTableRow(TableRow row) {
            events.add("row");
        }

        @Override
        public void tableCellValue(String value, Status status) {
            events.add("cell " + value);
        }

        @Override
        public void afterTableCell(TableCell cell) {
            events.add("afterCell");
        }

        @Override
        public void afterFeatureElement(FeatureElement element) {
            events.add("afterFeatureElement");
        }

    }

    private static Step step(FeatureElement element, String keyword, String text, StepResult result) {
        Step step = new Step(element);
        step.setKeyword(keyword);
        step.setText(text);
        step.setResult(result);
        element.addStep(step);
        return step;
    }

    @Test
    void testDocumentOrder() {
        Feature feature = new Feature("a.feature");
        feature.setName("Cukes");
        feature.addComment("# c");
        feature.addTag(new Tag(1, "@t"));
        Background background = new Background(feature);
        step(background, "Given", "x", StepResult.passed());
        feature.setBackground(background);
        Scenario scenario = new Scenario(feature);
        scenario.setName("Eat");
        scenario.setLine(5);
        step(scenario, "Given", "a doc", StepResult.passed()).setArgument(new DocString("hello"));
        step(scenario, "Then", "fails", StepResult.failed(new StepError("1", "boom", null, null)));
        feature.addElement(scenario);
        RecordingVisitor visitor = new RecordingVisitor();
        new FeatureWalker(visitor).walkFeature(feature);
        assertEquals(List.of(
                "beforeFeature",
                "comment # c",
                "tag t",
                "afterTags 1",
                "featureName Feature: Cukes",
                "backgroundName Background 0",
                "beforeStep",
                "stepName x 2",
                "afterTags 0",
                "scenarioName Eat a.feature:5 0",
                "beforeStep",
                "stepName a doc 0",
                "beforeMultilineArg",
                "docString hello",
                "afterMultilineArg",
                "beforeStep",
                "stepName fails 1",
                "error boom failed",
                "afterFeatureElement",
                "afterFeature"), visitor.events);
    }

    @Test
    void testOutlineTables() {
        Feature feature = new Feature("o.feature");
        ScenarioOutline outline = new ScenarioOutline(feature);
        step(outline, "Given", "<n> cukes", StepResult.skipped());
        Examples examples = new Examples(Table.of(List.of(List.of("n"), List.of("1"))));
        examples.setName("Few");
        outline.addExamples(examples);
        feature.addElement(outline);
        RecordingVisitor visitor = new RecordingVisitor();
        new FeatureWalker(visitor).walkFeature(feature);
        List<String> events = visitor.events;
        int start = events.indexOf("beforeExamplesArray 1");
        assertEquals(List.of("beforeExamplesArray 1", "examplesName Few",
                "row", "cell n", "afterCell", "row", "cell 1", "afterCell", "afterFeatureElement"),
                events.subList(start, start + 9));
    }

    @Test
    void testAfterFeatureCalledOnFailure() {
        Feature feature = new Feature("a.feature");
        RecordingVisitor visitor = new RecordingVisitor() {
            @Override
            public void featureName(String name) {
                throw new IllegalStateException("broken");
            }
        };
        assertThrows(IllegalStateException.class, () -> new FeatureWalker(visitor).walkFeature(feature));
        assertEquals("afterFeature", visitor.events.get(visitor.events.size() - 1));
    }

    @Test
    void testLineLengths() {
        Feature feature = new Feature("a.feature");
        Scenario scenario = new Scenario(feature);
        scenario.setName("日本");
        Step step = step(scenario, "Given", "ignored", StepResult.passed());
        step.setMatch(new StepMatch("matched text", null));
        assertEquals(14, FeatureWalker.nameLength(scenario)); // "Scenario: " + 2 wide characters
        assertEquals(2 + 18, FeatureWalker.stepLength(step));
        assertEquals(20, FeatureWalker.maxLineLength(scenario));
    }

}

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
import io.cukeprint.gherkin.Examples;
import io.cukeprint.gherkin.Feature;
import io.cukeprint.gherkin.FeatureElement;
import io.cukeprint.gherkin.ScenarioOutline;
import io.cukeprint.gherkin.Status;
import io.cukeprint.gherkin.Step;
import io.cukeprint.gherkin.TableCell;
import io.cukeprint.gherkin.TableRow;
import io.cukeprint.output.Console;
import io.cukeprint.output.FormatterOptions;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * End-of-run report: scenario and step counts, snippets for undefined steps,
 * the work-in-progress check and tag limit warnings.
 * <p>
 * Tag occurrences are recorded by the formatter as elements are visited; all
 * other figures are derived from the result trees when printing.
 */
public class RunSummary {

    // order in which counts are listed
    private static final List<Status> REPORT_ORDER = List.of(
            Status.FAILED, Status.SKIPPED, Status.UNDEFINED, Status.PENDING, Status.PASSED);

    // a scenario takes the first of these found among its steps
    private static final List<Status> PRECEDENCE = List.of(
            Status.FAILED, Status.UNDEFINED, Status.PENDING, Status.SKIPPED, Status.PASSED);

    public record ScenarioOutcome(String location, String title, Status status) {
    }

    private final FormatterOptions options;
    private final Map<String, List<String>> tagOccurrences = new LinkedHashMap<>();

    public RunSummary(FormatterOptions options) {
        this.options = options;
    }

    public void recordTagOccurrences(FeatureElement element) {
        for (String name : element.getSourceTagNames()) {
            if (options.getTagLimits().containsKey(name)) {
                tagOccurrences.computeIfAbsent(name, k -> new ArrayList<>()).add(element.getFileColonLine());
            }
        }
    }

    public Map<String, List<String>> getTagOccurrences() {
        return tagOccurrences;
    }

    public boolean isTagLimitBreached() {
        for (Map.Entry<String, Integer> entry : options.getTagLimits().entrySet()) {
            if (occurrences(entry.getKey()) > entry.getValue()) {
                return true;
            }
        }
        return false;
    }

    private int occurrences(String tag) {
        List<String> list = tagOccurrences.get(tag);
        return list == null ? 0 : list.size();
    }

    /**
     * @return true if the run should be reported as failed: a scenario failed
     * (or, in wip mode, passed) or a tag limit was exceeded
     */
    public boolean isFailed(List<Feature> features) {
        if (isTagLimitBreached()) {
            return true;
        }
        Status unwanted = options.isWip() ? Status.PASSED : Status.FAILED;
        for (ScenarioOutcome outcome : scenarios(features)) {
            if (outcome.status() == unwanted) {
                return true;
            }
        }
        return false;
    }

    public void print(List<Feature> features, PrintStream out) {
        printStats(features, out);
        printSnippets(features, out);
        printPassingWip(features, out);
        printTagLimitWarnings(out);
        out.flush();
    }

    void printStats(List<Feature> features, PrintStream out) {
        Map<Status, Integer> scenarioCounts = new EnumMap<>(Status.class);
        List<ScenarioOutcome> outcomes = scenarios(features);
        for (ScenarioOutcome outcome : outcomes) {
            scenarioCounts.merge(outcome.status(), 1, Integer::sum);
        }
        Map<Status, Integer> stepCounts = new EnumMap<>(Status.class);
        int stepTotal = 0;
        for (Step step : steps(features)) {
            stepCounts.merge(step.getStatus(), 1, Integer::sum);
            stepTotal++;
        }
        println(out, dumpCount(outcomes.size(), "scenario", scenarioCounts));
        println(out, dumpCount(stepTotal, "step", stepCounts));
    }

    static String dumpCount(int total, String what, Map<Status, Integer> counts) {
        StringBuilder sb = new StringBuilder();
        sb.append(total).append(' ').append(what);
        if (total != 1) {
            sb.append('s');
        }
        if (total == 0) {
            return sb.toString();
        }
        List<String> parts = new ArrayList<>();
        for (Status status : REPORT_ORDER) {
            Integer count = counts.get(status);
            if (count != null) {
                parts.add(Console.style(count + " " + status.getName(), status));
            }
        }
        sb.append(" (").append(String.join(", ", parts)).append(')');
        return sb.toString();
    }

    void printSnippets(List<Feature> features, PrintStream out) {
        Map<String, String> snippets = new LinkedHashMap<>();
        for (Step step : steps(features)) {
            if (step.getStatus() == Status.UNDEFINED) {
                snippets.putIfAbsent(step.getText(), snippet(step));
            }
        }
        if (snippets.isEmpty()) {
            return;
        }
        println(out, "");
        println(out, Console.style("You can implement step definitions for undefined steps with these snippets:",
                Status.UNDEFINED));
        for (String snippet : snippets.values()) {
            println(out, "");
            println(out, Console.style(snippet, Status.UNDEFINED));
        }
    }

    static String snippet(Step step) {
        String text = step.getText() == null ? "" : step.getText();
        String expression = text.replace("\\", "\\\\").replace("\"", "\\\"");
        return "@" + snippetKeyword(step.getKeyword()) + "(\"" + expression + "\")\n"
                + "public void " + methodName(text) + "() {\n"
                + "    // Write code here that turns the phrase above into concrete actions\n"
                + "    throw new PendingException();\n"
                + "}";
    }

    private static String snippetKeyword(String keyword) {
        if (keyword == null) {
            return "Given";
        }
        return switch (keyword.trim()) {
            case "When" -> "When";
            case "Then" -> "Then";
            default -> "Given";
        };
    }

    static String methodName(String text) {
        String name = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
            name = "step_" + name;
        }
        return name;
    }

    void printPassingWip(List<Feature> features, PrintStream out) {
        if (!options.isWip()) {
            return;
        }
        List<ScenarioOutcome> passed = new ArrayList<>();
        for (ScenarioOutcome outcome : scenarios(features)) {
            if (outcome.status() == Status.PASSED) {
                passed.add(outcome);
            }
        }
        println(out, "");
        if (passed.isEmpty()) {
            println(out, Console.style("The --wip switch was used, so the failures were expected. All is good.",
                    Status.PASSED));
        } else {
            println(out, Console.style(
                    "The --wip switch was used, so I didn't expect anything to pass. These scenarios passed:",
                    Status.FAILED));
            for (ScenarioOutcome outcome : passed) {
                println(out, Console.style("  " + outcome.location() + " # " + outcome.title(), Status.PASSED));
            }
        }
    }

    void printTagLimitWarnings(PrintStream out) {
        if (!isTagLimitBreached()) {
            return;
        }
        println(out, "");
        println(out, Console.style("Failed due to exceeding the tag limit", Status.FAILED));
        for (Map.Entry<String, Integer> entry : options.getTagLimits().entrySet()) {
            String tag = entry.getKey();
            int limit = entry.getValue();
            int count = occurrences(tag);
            if (count > limit) {
                println(out, Console.style("@" + tag + " occurred:" + count + " limit:" + limit, Status.FAILED));
                for (String location : tagOccurrences.get(tag)) {
                    println(out, Console.style("  " + location, Status.FAILED));
                }
            }
        }
    }

    /**
     * One outcome per scenario, and one per example row of an outline.
     */
    public static List<ScenarioOutcome> scenarios(List<Feature> features) {
        List<ScenarioOutcome> list = new ArrayList<>();
        for (Feature feature : features) {
            for (FeatureElement element : feature.getElements()) {
                String title = FeatureElement.heading(element.getKeyword(), StringUtils.firstLine(element.getName()));
                if (element instanceof ScenarioOutline outline) {
                    for (Examples examples : outline.getExamples()) {
                        List<TableRow> rows = examples.getTable().getRows();
                        for (TableRow row : rows.subList(Math.min(1, rows.size()), rows.size())) {
                            String location = row.getLine() > 0
                                    ? feature.getFileColonLine(row.getLine()) : element.getFileColonLine();
                            list.add(new ScenarioOutcome(location, title, rowStatus(row)));
                        }
                    }
                } else {
                    Set<Status> found = new LinkedHashSet<>();
                    for (Step step : element.getSteps()) {
                        found.add(step.getStatus());
                    }
                    list.add(new ScenarioOutcome(element.getFileColonLine(), title, worst(found)));
                }
            }
        }
        return list;
    }

    private static Status rowStatus(TableRow row) {
        if (row.getError() != null) {
            return Status.FAILED;
        }
        Set<Status> found = new LinkedHashSet<>();
        for (TableCell cell : row.getCells()) {
            if (cell.getStatus() != null) {
                found.add(cell.getStatus());
            }
        }
        return worst(found);
    }

    private static Status worst(Set<Status> found) {
        for (Status status : PRECEDENCE) {
            if (found.contains(status)) {
                return status;
            }
        }
        return Status.PASSED;
    }

    /**
     * Every step once: the background steps as listed under the background,
     * then the scenario steps without the background steps re-run before them.
     */
    static List<Step> steps(List<Feature> features) {
        List<Step> list = new ArrayList<>();
        for (Feature feature : features) {
            if (feature.isBackgroundPresent()) {
                list.addAll(feature.getBackground().getSteps());
            }
            for (FeatureElement element : feature.getElements()) {
                for (Step step : element.getSteps()) {
                    if (!step.isBackground()) {
                        list.add(step);
                    }
                }
            }
        }
        return list;
    }

    private static void println(PrintStream out, String text) {
        out.print(text);
        out.print('\n');
    }

}

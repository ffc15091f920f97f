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

import io.cukeprint.common.StringUtils;
import io.cukeprint.core.FeatureVisitor;
import io.cukeprint.core.RunSummary;
import io.cukeprint.gherkin.Background;
import io.cukeprint.gherkin.DocString;
import io.cukeprint.gherkin.Examples;
import io.cukeprint.gherkin.Feature;
import io.cukeprint.gherkin.FeatureElement;
import io.cukeprint.gherkin.MultilineArgument;
import io.cukeprint.gherkin.Status;
import io.cukeprint.gherkin.Step;
import io.cukeprint.gherkin.StepError;
import io.cukeprint.gherkin.StepMatch;
import io.cukeprint.gherkin.Table;
import io.cukeprint.gherkin.TableCell;
import io.cukeprint.gherkin.TableRow;
import io.cukeprint.gherkin.Tag;
import org.slf4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Prints features back as plain text, exactly as they were written but with
 * uniform indentation, aligned table columns and, on a terminal, colors by status.
 * <p>
 * Passing background steps are shown once, under the background. A background
 * step run before a scenario is shown again under that scenario only when that
 * run failed, and an error shared by several steps is printed once per feature.
 * <p>
 * In batch mode each feature goes to its own file under the batch output
 * directory, mirroring the feature's uri, and no summary is printed.
 */
public class PrettyFormatter implements FeatureVisitor {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private static final String DOC_STRING_QUOTES = "\"\"\"";

    private final PrintStream console;
    private final FormatterOptions options;
    private final RunSummary summary;
    private final RenderState state = new RenderState();

    private PrintStream out;
    private ConsoleTrace trace = ConsoleTrace.toLogger(LogContext.CONSOLE_LOGGER);

    public PrettyFormatter(PrintStream out, FormatterOptions options, RunSummary summary) {
        this.console = out;
        this.out = out;
        this.options = options;
        this.summary = summary;
    }

    public PrettyFormatter(PrintStream out, FormatterOptions options) {
        this(out, options, new RunSummary(options));
    }

    public RunSummary getSummary() {
        return summary;
    }

    @Override
    public void afterFeatures(List<Feature> features) {
        if (!options.isBatchOutput()) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            summary.print(features, new PrintStream(buffer, true, StandardCharsets.UTF_8));
            print(buffer.toString(StandardCharsets.UTF_8));
        }
    }

    @Override
    public void beforeFeature(Feature feature) {
        state.startFeature();
        if (options.isBatchOutput()) {
            out = openBatchOutput(feature);
        }
    }

    @Override
    public void afterFeature(Feature feature) {
        if (out != console) {
            PrintStream file = out;
            out = console;
            file.close();
            if (file.checkError()) {
                throw new RuntimeException("failed to write output for: " + feature);
            }
        }
    }

    @Override
    public void commentLine(String comment) {
        println(StringUtils.indent(comment, state.indent));
    }

    @Override
    public void tagName(String tagName) {
        print(StringUtils.indent(Console.tag("@" + tagName), state.indent));
        state.indent = RenderState.TAG_LINE;
    }

    @Override
    public void afterTags(List<Tag> tags) {
        if (state.indent == RenderState.TAG_LINE) {
            println("");
        }
    }

    @Override
    public void featureName(String name) {
        println(name);
        println("");
    }

    @Override
    public void beforeBackground(Background background) {
        state.startElement();
        state.inBackground = true;
    }

    @Override
    public void backgroundName(String keyword, String name, String fileColonLine, int sourceIndent) {
        printElementName(keyword, name, fileColonLine, sourceIndent);
    }

    @Override
    public void afterBackground(Background background) {
        state.inBackground = false;
        println("");
    }

    @Override
    public void beforeFeatureElement(FeatureElement element) {
        summary.recordTagOccurrences(element);
        state.startElement();
    }

    @Override
    public void scenarioName(String keyword, String name, String fileColonLine, int sourceIndent) {
        printElementName(keyword, name, fileColonLine, sourceIndent);
    }

    @Override
    public void afterFeatureElement(FeatureElement element) {
        println("");
    }

    @Override
    public void beforeExamplesArray(List<Examples> examples) {
        state.indent = RenderState.EXAMPLES_INDENT;
        println("");
        state.firstExamplesName = true;
    }

    @Override
    public void examplesName(String keyword, String name) {
        if (!state.firstExamplesName) {
            println("");
        }
        state.firstExamplesName = false;
        List<String> names = StringUtils.isBlank(name) ? List.of("") : StringUtils.lines(name);
        println("    " + FeatureElement.heading(keyword, names.get(0)));
        for (String line : names.subList(1, names.size())) {
            println("      " + line);
        }
        state.indent = RenderState.STEP_INDENT;
        state.scenarioIndent = RenderState.STEP_INDENT;
    }

    @Override
    public void beforeOutlineTable(Table table) {
        state.skipMultiline = false;
        state.startTable(table);
    }

    @Override
    public void afterOutlineTable(Table table) {
        state.endTable();
        state.indent = RenderState.EXAMPLES_INDENT;
    }

    @Override
    public void beforeStep(Step step) {
        state.startStep(step);
    }

    @Override
    public void beforeStepResult(Step step, int sourceIndent) {
        if (state.requireStep("step result") != step) {
            throw new IllegalStateException("step result for a step that was not started: " + step);
        }
        state.setStatus(step.getStatus());
        state.hideStep = isHidden(step);
    }

    /**
     * A step is hidden when its error was already printed in this feature, or,
     * if it has no error and did not fail, when it is a background step
     * rendered under a scenario (or the other way round).
     */
    private boolean isHidden(Step step) {
        StepError error = step.getError();
        if (error != null) {
            return !state.markPrinted(error);
        }
        return step.getStatus() != Status.FAILED && state.inBackground != step.isBackground();
    }

    @Override
    public void stepName(Step step, int sourceIndent) {
        if (state.hideStep) {
            return;
        }
        String line = formatStep(step);
        if (options.isShowSourceLocations()) {
            line = line + Console.comment(StringUtils.indent(" # " + step.getFileColonLine(), sourceIndent));
        }
        println(StringUtils.indent(line, state.scenarioIndent + 2));
    }

    @Override
    public void beforeMultilineArg(MultilineArgument argument) {
        state.skipMultiline = options.isSuppressMultilineArguments() || state.hideStep;
        if (!state.skipMultiline && argument instanceof Table table) {
            state.startTable(table);
        }
    }

    @Override
    public void afterMultilineArg(MultilineArgument argument) {
        state.endTable();
        state.skipMultiline = false;
    }

    @Override
    public void docString(DocString docString) {
        if (state.skipMultiline) {
            return;
        }
        Step step = state.requireStep("doc string");
        String quoted = DOC_STRING_QUOTES + "\n" + docString.getContent() + "\n" + DOC_STRING_QUOTES;
        StringBuilder sb = new StringBuilder();
        for (String line : StringUtils.lines(StringUtils.indent(quoted, state.indent))) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            if (!line.isBlank()) {
                sb.append(line);
            }
        }
        println(Console.style(sb.toString(), state.effectiveStatus(step.getStatus())));
    }

    @Override
    public void error(StepError error, Status status) {
        if (state.hideStep) {
            return;
        }
        printError(error);
    }

    @Override
    public void beforeTableRow(TableRow row) {
        if (state.skipMultiline) {
            return;
        }
        state.requireTable("table row");
        state.startRow();
        print(StringUtils.indent("  |", state.indent - 2));
    }

    @Override
    public void tableCellValue(String value, Status status) {
        if (state.skipMultiline) {
            return;
        }
        Table table = state.requireTable("table cell");
        Status cellStatus = state.effectiveStatus(status);
        String text = value == null ? "" : value;
        int width = table.getColumnWidth(state.getColumnIndex());
        String padded = text + StringUtils.repeat(' ', width - StringUtils.displayWidth(text));
        String prefix = options.getStatusPrefix(cellStatus);
        print(" " + Console.style(prefix + padded, cellStatus) + " |");
    }

    @Override
    public void afterTableCell(TableCell cell) {
        if (state.skipMultiline) {
            return;
        }
        state.nextColumn();
    }

    @Override
    public void afterTableRow(TableRow row) {
        if (state.skipMultiline) {
            return;
        }
        println("");
        StepError error = row.getError();
        if (error != null && state.markPrinted(error)) {
            printError(error);
        }
    }

    private void printElementName(String keyword, String name, String fileColonLine, int sourceIndent) {
        List<String> names = StringUtils.lines(name);
        String line = StringUtils.indent(FeatureElement.heading(keyword, names.get(0)), state.scenarioIndent);
        if (options.isShowSourceLocations()) {
            line = line + Console.comment(StringUtils.indent(" # " + fileColonLine, sourceIndent));
        }
        println(line);
        for (String more : names.subList(1, names.size())) {
            println("    " + more);
        }
    }

    private String formatStep(Step step) {
        Status status = step.getStatus();
        StepMatch match = step.getMatch();
        String text = match.getText();
        StringBuilder sb = new StringBuilder();
        StringBuilder plain = new StringBuilder(step.getKeyword()).append(' ');
        int pos = 0;
        for (StepMatch.Argument arg : match.getArguments()) {
            if (arg.offset() < pos) { // overlapping capture
                continue;
            }
            plain.append(text, pos, arg.offset());
            sb.append(Console.style(plain.toString(), status));
            plain.setLength(0);
            sb.append(Console.param(arg.value(), status));
            pos = arg.end();
        }
        plain.append(text.substring(pos));
        if (plain.length() > 0) {
            sb.append(Console.style(plain.toString(), status));
        }
        return sb.toString();
    }

    private void printError(StepError error) {
        println(Console.style(StringUtils.indent(error.toText(), state.indent), Status.FAILED));
    }

    private PrintStream openBatchOutput(Feature feature) {
        Path file = batchOutputFile(options.getBatchOutputDirectory(), feature);
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            logger.debug("writing {} to: {}", feature, file);
            return new PrintStream(Files.newOutputStream(file), false, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("failed to open output file: " + file, e);
        }
    }

    static Path batchOutputFile(Path dir, Feature feature) {
        String uri = feature.getUri();
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("feature has no uri, cannot write batch output: " + feature.getTitle());
        }
        int pos = uri.indexOf(':');
        if (pos > 1) { // "file:" or "classpath:" but not a windows drive letter
            uri = uri.substring(pos + 1);
        }
        while (uri.startsWith("/")) {
            uri = uri.substring(1);
        }
        Path root = dir.toAbsolutePath().normalize();
        Path file = root.resolve(uri).normalize();
        if (!file.startsWith(root) || file.equals(root)) {
            throw new IllegalArgumentException("feature uri escapes the output directory: " + feature.getUri());
        }
        return file;
    }

    void setTrace(ConsoleTrace trace) {
        this.trace = trace;
    }

    private void print(String text) {
        out.print(text);
        out.flush();
        if (out == console) {
            trace.append(text);
        }
    }

    private void println(String text) {
        print(text + '\n');
    }

}

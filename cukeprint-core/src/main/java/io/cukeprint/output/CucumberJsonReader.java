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

import io.cukeprint.common.Json;
import io.cukeprint.common.StringUtils;
import io.cukeprint.gherkin.Background;
import io.cukeprint.gherkin.DocString;
import io.cukeprint.gherkin.Feature;
import io.cukeprint.gherkin.FeatureElement;
import io.cukeprint.gherkin.Scenario;
import io.cukeprint.gherkin.Status;
import io.cukeprint.gherkin.Step;
import io.cukeprint.gherkin.StepError;
import io.cukeprint.gherkin.StepMatch;
import io.cukeprint.gherkin.StepResult;
import io.cukeprint.gherkin.Table;
import io.cukeprint.gherkin.TableCell;
import io.cukeprint.gherkin.TableRow;
import io.cukeprint.gherkin.Tag;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Cucumber JSON reports into result trees.
 * <p>
 * Expected input, as written by Cucumber and by most test runners:
 * <pre>
 * [
 *   {
 *     "uri": "path/to/feature.feature",
 *     "name": "Feature Name",
 *     "keyword": "Feature",
 *     "tags": [ { "name": "@smoke", "line": 1 } ],
 *     "elements": [
 *       {
 *         "name": "", "keyword": "Background", "type": "background", "line": 3,
 *         "steps": [ ... ]
 *       },
 *       {
 *         "name": "Scenario Name", "keyword": "Scenario", "type": "scenario", "line": 6,
 *         "steps": [
 *           {
 *             "keyword": "Given ",
 *             "name": "step text",
 *             "line": 7,
 *             "match": { "location": "Steps.java:12", "arguments": [ { "val": "5", "offset": 6 } ] },
 *             "result": { "status": "failed", "error_message": "java.lang.AssertionError: ..." },
 *             "doc_string": { "value": "..." },
 *             "rows": [ { "cells": [ "a", "b" ] } ]
 *           }
 *         ]
 *       }
 *     ]
 *   }
 * ]
 * </pre>
 * A report repeats the background before every scenario. The first copy
 * becomes the feature background and each copy is also prepended to the
 * scenario it ran for, flagged as background steps. A failure of the same
 * background step with the same message gets one error id across the
 * feature, so it is reported once.
 */
public final class CucumberJsonReader {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private static final Pattern ERROR_HEADER =
            Pattern.compile("^((?:[\\w$]+\\.)+[\\w$]*(?:Exception|Error)[\\w$]*)(?:: ?(.*))?$");

    private final String source;
    private int errorCount;

    private CucumberJsonReader(String source) {
        this.source = source;
    }

    public static List<Feature> read(Path path) {
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new RuntimeException("failed to read report: " + path, e);
        }
        return parse(json, path.toString());
    }

    /**
     * @param source name of the report, used in error messages
     */
    public static List<Feature> parse(String json, String source) {
        Json doc;
        try {
            doc = Json.of(json);
        } catch (RuntimeException e) {
            throw new RuntimeException("invalid report: " + source + ": " + e.getMessage(), e);
        }
        if (!doc.isArray()) {
            throw new RuntimeException("invalid report: " + source + ": expected an array of features");
        }
        CucumberJsonReader reader = new CucumberJsonReader(source);
        List<Feature> features = new ArrayList<>();
        try {
            for (Object o : doc.asList()) {
                features.add(reader.toFeature(reader.node(o)));
            }
        } catch (RuntimeException e) {
            throw new RuntimeException("invalid report: " + source + ": " + e.getMessage(), e);
        }
        logger.debug("read {} feature(s) from: {}", features.size(), source);
        return features;
    }

    private Json node(Object o) {
        if (!(o instanceof Map)) {
            throw new IllegalArgumentException("expected an object but was: " + o);
        }
        return Json.of(o);
    }

    private List<Object> list(Json json, String path) {
        return json.<List<Object>>getOptional(path).orElse(Collections.emptyList());
    }

    private static int line(Json json) {
        return json.<Number>getOptional("line").map(Number::intValue).orElse(0);
    }

    private static String keyword(Json json, String defaultValue) {
        String keyword = StringUtils.trimToNull(json.<String>getOptional("keyword").orElse(null));
        if (keyword == null) {
            return defaultValue;
        }
        return keyword.endsWith(":") ? keyword.substring(0, keyword.length() - 1).trim() : keyword;
    }

    private Feature toFeature(Json json) {
        String uri = json.<String>getOptional("uri")
                .orElseGet(() -> json.<String>getOptional("id").orElse("unknown") + ".feature");
        Feature feature = new Feature(uri);
        feature.setLine(line(json));
        feature.setKeyword(keyword(json, Feature.KEYWORD));
        feature.setName(nameAndDescription(json, 2));
        for (Tag tag : tags(json)) {
            feature.addTag(tag);
        }
        for (String comment : comments(json)) {
            feature.addComment(comment);
        }
        Json pendingBackground = null;
        for (Object o : list(json, "elements")) {
            Json element = node(o);
            if ("background".equals(element.<String>getOptional("type").orElse("scenario"))) {
                if (!feature.isBackgroundPresent()) {
                    Background background = new Background(feature, keyword(element, Background.KEYWORD));
                    fill(background, element);
                    addSteps(background, element, true);
                    feature.setBackground(background);
                }
                pendingBackground = element;
            } else {
                Scenario scenario = new Scenario(feature, keyword(element, Scenario.KEYWORD));
                fill(scenario, element);
                for (Tag tag : tags(element)) {
                    scenario.addTag(tag);
                }
                if (pendingBackground != null) {
                    addSteps(scenario, pendingBackground, true);
                    pendingBackground = null;
                }
                addSteps(scenario, element, false);
                feature.addElement(scenario);
            }
        }
        return feature;
    }

    // description lines follow the name, indented as they print under the heading
    private static String nameAndDescription(Json json, int indent) {
        String name = json.<String>getOptional("name").orElse("");
        String description = json.<String>getOptional("description").orElse(null);
        if (StringUtils.isBlank(description)) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name);
        for (String line : StringUtils.lines(description.strip())) {
            sb.append('\n').append(StringUtils.repeat(' ', indent)).append(line.strip());
        }
        return sb.toString();
    }

    private void fill(FeatureElement element, Json json) {
        element.setLine(line(json));
        element.setName(nameAndDescription(json, 0));
        for (String comment : comments(json)) {
            element.addComment(comment);
        }
    }

    private List<Tag> tags(Json json) {
        List<Tag> tags = new ArrayList<>();
        for (Object o : list(json, "tags")) {
            Json tag = node(o);
            String name = tag.<String>getOptional("name").orElse(null);
            if (StringUtils.isBlank(name)) {
                logger.warn("ignoring tag without a name in: {}", source);
                continue;
            }
            tags.add(new Tag(line(tag), name));
        }
        return tags;
    }

    private List<String> comments(Json json) {
        List<String> comments = new ArrayList<>();
        for (Object o : list(json, "comments")) {
            String value = node(o).<String>getOptional("value").orElse(null);
            if (value != null) {
                comments.add(value);
            }
        }
        return comments;
    }

    private void addSteps(FeatureElement element, Json json, boolean background) {
        String uri = element.getFeature().getUri();
        for (Object o : list(json, "steps")) {
            Json node = node(o);
            Step step = new Step(element);
            String text = node.<String>getOptional("name").orElse("");
            step.setKeyword(keyword(node, Step.KEYWORD));
            step.setText(text);
            step.setLine(line(node));
            step.setBackground(background);
            step.setMatch(toMatch(node, text));
            Status status = Status.of(node.<String>getOptional("result.status").orElse(null));
            String message = node.<String>getOptional("result.error_message").orElse(null);
            StepError error = null;
            if (message != null) {
                String id = background
                        ? "background:" + uri + ":" + step.getLine() + ":" + message
                        : uri + ":" + step.getLine() + "#" + (++errorCount);
                error = toError(id, message);
            }
            step.setResult(StepResult.of(status, error));
            node.<String>getOptional("doc_string.value")
                    .ifPresent(value -> step.setArgument(new DocString(value, step.getLine() + 1)));
            List<Object> rows = list(node, "rows");
            if (!rows.isEmpty()) {
                step.setArgument(toTable(rows));
            }
            element.addStep(step);
        }
    }

    private StepMatch toMatch(Json json, String text) {
        StepMatch match = new StepMatch(text, json.<String>getOptional("match.location").orElse(null));
        for (Object o : list(json, "match.arguments")) {
            Json arg = node(o);
            String value = arg.<String>getOptional("val").orElse(null);
            Integer offset = arg.<Number>getOptional("offset").map(Number::intValue).orElse(null);
            if (value == null || offset == null) {
                continue;
            }
            if (offset < 0 || offset + value.length() > text.length()) {
                logger.warn("ignoring argument '{}' at {} outside of step text: {}", value, offset, text);
                continue;
            }
            match.argument(offset, value);
        }
        return match;
    }

    private Table toTable(List<Object> rows) {
        List<TableRow> list = new ArrayList<>(rows.size());
        for (Object o : rows) {
            Json row = node(o);
            List<TableCell> cells = new ArrayList<>();
            for (Object cell : list(row, "cells")) {
                if (cell instanceof Map<?, ?> map) {
                    Object value = map.get("value");
                    cells.add(new TableCell(value == null ? "" : value.toString()));
                } else {
                    cells.add(new TableCell(cell == null ? "" : cell.toString()));
                }
            }
            TableRow tableRow = new TableRow(cells);
            tableRow.setLine(line(row));
            list.add(tableRow);
        }
        return new Table(list);
    }

    static StepError toError(String id, String text) {
        List<String> lines = StringUtils.lines(text.strip());
        String message = lines.get(0);
        String type = null;
        Matcher matcher = ERROR_HEADER.matcher(message);
        if (matcher.matches()) {
            type = matcher.group(1);
            message = matcher.group(2) == null ? "" : matcher.group(2);
        }
        List<String> backtrace = new ArrayList<>();
        for (String line : lines.subList(1, lines.size())) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                backtrace.add(trimmed);
            }
        }
        return new StepError(id, message, type, backtrace);
    }

}

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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A block of steps inside a feature: the background, a scenario or a scenario outline.
 */
public abstract class FeatureElement {

    private final Feature feature;
    private final String keyword;

    private int line;
    private String name = "";
    private List<Tag> tags;
    private List<String> comments;
    private final List<Step> steps = new ArrayList<>();

    protected FeatureElement(Feature feature, String keyword) {
        this.feature = feature;
        this.keyword = keyword;
    }

    public abstract boolean isBackground();

    /**
     * @return the heading line as written in the source, e.g. "Scenario: Login"
     */
    public static String heading(String keyword, String firstLine) {
        return firstLine == null || firstLine.isEmpty() ? keyword + ":" : keyword + ": " + firstLine;
    }

    public Feature getFeature() {
        return feature;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getFileColonLine() {
        return feature.getFileColonLine(line);
    }

    /**
     * Steps in execution order. For a scenario this includes the background
     * steps that ran before it, flagged with {@link Step#isBackground()}.
     */
    public List<Step> getSteps() {
        return steps;
    }

    public void addStep(Step step) {
        steps.add(step);
    }

    public int getLine() {
        return line;
    }

    public void setLine(int line) {
        this.line = line;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    public List<Tag> getTags() {
        return tags == null ? Collections.emptyList() : tags;
    }

    public void addTag(Tag tag) {
        if (tags == null) {
            tags = new ArrayList<>();
        }
        tags.add(tag);
    }

    /**
     * @return tag names of this element together with the ones inherited from the feature
     */
    public Set<String> getSourceTagNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Tag tag : getTags()) {
            names.add(tag.getName());
        }
        for (Tag tag : feature.getTags()) {
            names.add(tag.getName());
        }
        return names;
    }

    public List<String> getComments() {
        return comments == null ? Collections.emptyList() : comments;
    }

    public void addComment(String comment) {
        if (comments == null) {
            comments = new ArrayList<>();
        }
        comments.add(comment);
    }

    @Override
    public String toString() {
        return getFileColonLine();
    }

}

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
import java.util.List;

public class Feature {

    public static final String KEYWORD = "Feature";

    private final String uri;

    private int line;
    private String keyword = KEYWORD;
    private String name;
    private List<Tag> tags;
    private List<String> comments;
    private Background background;
    private final List<FeatureElement> elements = new ArrayList<>();

    public Feature(String uri) {
        this.uri = uri;
    }

    /**
     * @return path of the feature relative to its source root, also used to
     * mirror the feature into a batch output directory
     */
    public String getUri() {
        return uri;
    }

    public String getFileColonLine(int line) {
        return uri + ":" + line;
    }

    public boolean isBackgroundPresent() {
        return background != null;
    }

    public void addElement(FeatureElement element) {
        elements.add(element);
    }

    public List<FeatureElement> getElements() {
        return elements;
    }

    public void addTag(Tag tag) {
        if (tags == null) {
            tags = new ArrayList<>();
        }
        tags.add(tag);
    }

    public List<Tag> getTags() {
        return tags == null ? Collections.emptyList() : tags;
    }

    public void addComment(String comment) {
        if (comments == null) {
            comments = new ArrayList<>();
        }
        comments.add(comment);
    }

    public List<String> getComments() {
        return comments == null ? Collections.emptyList() : comments;
    }

    public int getLine() {
        return line;
    }

    public void setLine(int line) {
        this.line = line;
    }

    public String getKeyword() {
        return keyword;
    }

    public void setKeyword(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return the name including any description lines below it
     */
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return the heading line as written in the source, e.g. "Feature: Login"
     */
    public String getTitle() {
        return name == null || name.isEmpty() ? keyword + ":" : keyword + ": " + name;
    }

    public Background getBackground() {
        return background;
    }

    public void setBackground(Background background) {
        this.background = background;
    }

    @Override
    public String toString() {
        return uri;
    }

}

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

public class Step {

    public static final String KEYWORD = "*";

    private final FeatureElement element;

    private int line;
    private String keyword = KEYWORD;
    private String text;
    private StepMatch match;
    private StepResult result = StepResult.skipped();
    private MultilineArgument argument;
    private boolean background;

    public Step(FeatureElement element) {
        this.element = element;
    }

    public FeatureElement getElement() {
        return element;
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
        this.keyword = keyword == null ? KEYWORD : keyword;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    /**
     * @return the step definition match, falling back to an argument-less match
     * located at the step itself when the step is undefined
     */
    public StepMatch getMatch() {
        if (match == null) {
            return new StepMatch(text, null);
        }
        return match;
    }

    public void setMatch(StepMatch match) {
        this.match = match;
    }

    public StepResult getResult() {
        return result;
    }

    public void setResult(StepResult result) {
        this.result = result == null ? StepResult.skipped() : result;
    }

    public Status getStatus() {
        return result.getStatus();
    }

    public StepError getError() {
        return result.getError();
    }

    public MultilineArgument getArgument() {
        return argument;
    }

    public void setArgument(MultilineArgument argument) {
        this.argument = argument;
    }

    /**
     * @return true if this step was declared in the feature background, both
     * when listed under the background itself and when re-run before a scenario
     */
    public boolean isBackground() {
        return background;
    }

    public void setBackground(boolean background) {
        this.background = background;
    }

    /**
     * @return where the step definition lives, or the step's own location when
     * nothing matched
     */
    public String getFileColonLine() {
        String location = getMatch().getLocation();
        return location == null ? element.getFeature().getFileColonLine(line) : location;
    }

    @Override
    public String toString() {
        return keyword + " " + text;
    }

}

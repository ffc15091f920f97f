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

public class StepResult {

    private static final StepResult PASSED = new StepResult(Status.PASSED, null);
    private static final StepResult SKIPPED = new StepResult(Status.SKIPPED, null);
    private static final StepResult UNDEFINED = new StepResult(Status.UNDEFINED, null);
    private static final StepResult PENDING = new StepResult(Status.PENDING, null);

    private final Status status;
    private final StepError error;

    private StepResult(Status status, StepError error) {
        this.status = status;
        this.error = error;
    }

    public static StepResult of(Status status, StepError error) {
        if (error != null) {
            return new StepResult(status, error);
        }
        return switch (status) {
            case PASSED -> PASSED;
            case SKIPPED -> SKIPPED;
            case UNDEFINED -> UNDEFINED;
            case PENDING -> PENDING;
            case FAILED -> new StepResult(Status.FAILED, null);
        };
    }

    public static StepResult passed() {
        return PASSED;
    }

    public static StepResult failed(StepError error) {
        return new StepResult(Status.FAILED, error);
    }

    public static StepResult skipped() {
        return SKIPPED;
    }

    public static StepResult undefined() {
        return UNDEFINED;
    }

    public static StepResult pending() {
        return PENDING;
    }

    public Status getStatus() {
        return status;
    }

    public StepError getError() {
        return error;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    @Override
    public String toString() {
        return error == null ? status.getName() : status.getName() + ": " + error.getMessage();
    }

}

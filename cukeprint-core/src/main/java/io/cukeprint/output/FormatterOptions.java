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

import io.cukeprint.gherkin.Status;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of the pretty formatter.
 * <p>
 * Example:
 * <pre>
 * FormatterOptions options = FormatterOptions.builder()
 *     .showSourceLocations(true)
 *     .statusPrefix(Status.FAILED, "!")
 *     .tagLimit("wip", 3)
 *     .build();
 * </pre>
 */
public final class FormatterOptions {

    private final boolean showSourceLocations;
    private final boolean suppressMultilineArguments;
    private final Map<Status, String> statusPrefixes;
    private final Path batchOutputDirectory;
    private final boolean wip;
    private final Map<String, Integer> tagLimits;

    private FormatterOptions(Builder builder) {
        showSourceLocations = builder.showSourceLocations;
        suppressMultilineArguments = builder.suppressMultilineArguments;
        statusPrefixes = Collections.unmodifiableMap(new EnumMap<>(builder.statusPrefixes));
        batchOutputDirectory = builder.batchOutputDirectory;
        wip = builder.wip;
        tagLimits = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tagLimits));
    }

    public static FormatterOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isShowSourceLocations() {
        return showSourceLocations;
    }

    public boolean isSuppressMultilineArguments() {
        return suppressMultilineArguments;
    }

    /**
     * @return the glyph to show before table cells of the given status, empty if none
     */
    public String getStatusPrefix(Status status) {
        return statusPrefixes.getOrDefault(status, "");
    }

    public Map<Status, String> getStatusPrefixes() {
        return statusPrefixes;
    }

    /**
     * @return the directory receiving one file per feature, null when writing to the shared stream
     */
    public Path getBatchOutputDirectory() {
        return batchOutputDirectory;
    }

    public boolean isBatchOutput() {
        return batchOutputDirectory != null;
    }

    public boolean isWip() {
        return wip;
    }

    /**
     * @return tag names (without '@') mapped to the most elements allowed to carry them
     */
    public Map<String, Integer> getTagLimits() {
        return tagLimits;
    }

    public static class Builder {

        private boolean showSourceLocations;
        private boolean suppressMultilineArguments;
        private final Map<Status, String> statusPrefixes = new EnumMap<>(Status.class);
        private Path batchOutputDirectory;
        private boolean wip;
        private final Map<String, Integer> tagLimits = new LinkedHashMap<>();

        Builder() {
        }

        public Builder showSourceLocations(boolean enabled) {
            showSourceLocations = enabled;
            return this;
        }

        public Builder suppressMultilineArguments(boolean enabled) {
            suppressMultilineArguments = enabled;
            return this;
        }

        public Builder statusPrefix(Status status, String prefix) {
            if (prefix == null || prefix.isEmpty()) {
                statusPrefixes.remove(status);
            } else {
                statusPrefixes.put(status, prefix);
            }
            return this;
        }

        public Builder statusPrefixes(Map<Status, String> values) {
            values.forEach(this::statusPrefix);
            return this;
        }

        public Builder batchOutputDirectory(Path dir) {
            batchOutputDirectory = dir;
            return this;
        }

        public Builder batchOutputDirectory(String dir) {
            return batchOutputDirectory(dir == null ? null : Path.of(dir));
        }

        public Builder wip(boolean enabled) {
            wip = enabled;
            return this;
        }

        /**
         * @param tag   tag name, with or without the leading '@'
         * @param limit most elements allowed to carry the tag
         */
        public Builder tagLimit(String tag, int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("tag limit must not be negative: " + tag + ":" + limit);
            }
            String name = tag.startsWith("@") ? tag.substring(1) : tag;
            tagLimits.put(name, limit);
            return this;
        }

        public FormatterOptions build() {
            return new FormatterOptions(this);
        }

    }

}

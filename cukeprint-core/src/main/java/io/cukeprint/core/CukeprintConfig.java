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

import io.cukeprint.common.Json;
import io.cukeprint.gherkin.Status;
import io.cukeprint.output.FormatterOptions;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formatter settings loaded from a cukeprint.json file. Command-line options
 * override these values.
 * <p>
 * Example cukeprint.json:
 * <pre>
 * {
 *   "paths": ["target/cucumber.json"],
 *   "source": true,
 *   "noMultiline": false,
 *   "out": "target/pretty",
 *   "wip": false,
 *   "tagLimits": { "@wip": 3 },
 *   "prefixes": { "failed": "x ", "passed": "" },
 *   "logLevel": "info"
 * }
 * </pre>
 */
public class CukeprintConfig {

    public static final String DEFAULT_FILE = "cukeprint.json";

    private List<String> paths = new ArrayList<>();
    private boolean source;
    private boolean noMultiline;
    private String out;
    private boolean wip;
    private final Map<String, Integer> tagLimits = new LinkedHashMap<>();
    private final Map<Status, String> prefixes = new LinkedHashMap<>();
    private String logLevel; // trace, debug, info, warn, error

    public static CukeprintConfig load(Path configPath) {
        try {
            String content = Files.readString(configPath);
            return parse(content);
        } catch (Exception e) {
            throw new RuntimeException("failed to load config from: " + configPath, e);
        }
    }

    public static CukeprintConfig parse(String json) {
        Json j = Json.of(json);
        if (!j.isObject()) {
            throw new RuntimeException("invalid config: expected JSON object");
        }
        CukeprintConfig config = new CukeprintConfig();
        j.<List<String>>getOptional("paths").ifPresent(config::setPaths);
        j.<Boolean>getOptional("source").ifPresent(config::setSource);
        j.<Boolean>getOptional("noMultiline").ifPresent(config::setNoMultiline);
        j.<String>getOptional("out").ifPresent(config::setOut);
        j.<Boolean>getOptional("wip").ifPresent(config::setWip);
        j.<String>getOptional("logLevel").ifPresent(config::setLogLevel);
        j.<Map<String, Object>>getOptional("tagLimits").ifPresent(map -> map.forEach((tag, limit) -> {
            if (!(limit instanceof Number)) {
                throw new RuntimeException("invalid config: tag limit for " + tag + " is not a number: " + limit);
            }
            config.tagLimit(tag, ((Number) limit).intValue());
        }));
        j.<Map<String, Object>>getOptional("prefixes").ifPresent(map -> map.forEach((status, prefix) ->
                config.prefix(parseStatus(status), prefix == null ? "" : prefix.toString())));
        return config;
    }

    /**
     * Accepts the names printed in the summary, "failed" or "passed".
     */
    public static Status parseStatus(String name) {
        for (Status status : Status.values()) {
            if (status.getName().equalsIgnoreCase(name.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown status: " + name);
    }

    /**
     * Apply this configuration to a builder. CLI options should override config
     * file values, so call this before applying CLI options.
     */
    public FormatterOptions.Builder applyTo(FormatterOptions.Builder builder) {
        builder.showSourceLocations(source);
        builder.suppressMultilineArguments(noMultiline);
        builder.wip(wip);
        if (out != null) {
            builder.batchOutputDirectory(out);
        }
        tagLimits.forEach(builder::tagLimit);
        builder.statusPrefixes(prefixes);
        return builder;
    }

    public List<String> getPaths() {
        return paths;
    }

    public void setPaths(List<String> paths) {
        this.paths = paths != null ? new ArrayList<>(paths) : new ArrayList<>();
    }

    public boolean isSource() {
        return source;
    }

    public void setSource(boolean source) {
        this.source = source;
    }

    public boolean isNoMultiline() {
        return noMultiline;
    }

    public void setNoMultiline(boolean noMultiline) {
        this.noMultiline = noMultiline;
    }

    public String getOut() {
        return out;
    }

    public void setOut(String out) {
        this.out = out;
    }

    public boolean isWip() {
        return wip;
    }

    public void setWip(boolean wip) {
        this.wip = wip;
    }

    public Map<String, Integer> getTagLimits() {
        return tagLimits;
    }

    public void tagLimit(String tag, int limit) {
        tagLimits.put(tag.startsWith("@") ? tag.substring(1) : tag, limit);
    }

    public Map<Status, String> getPrefixes() {
        return prefixes;
    }

    public void prefix(Status status, String prefix) {
        prefixes.put(status, prefix);
    }

    public String getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(String logLevel) {
        this.logLevel = logLevel;
    }

}

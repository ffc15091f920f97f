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
package io.cukeprint.cli;

import io.cukeprint.core.CukeprintConfig;
import io.cukeprint.core.FeatureWalker;
import io.cukeprint.gherkin.Feature;
import io.cukeprint.output.Console;
import io.cukeprint.output.CucumberJsonReader;
import io.cukeprint.output.FormatterOptions;
import io.cukeprint.output.LogContext;
import io.cukeprint.output.PrettyFormatter;
import org.slf4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for pretty printing Cucumber JSON reports.
 * <p>
 * Usage examples:
 * <pre>
 * # Print a report with source locations
 * java -jar cukeprint.jar -s target/cucumber.json
 *
 * # One file per feature under target/pretty
 * java -jar cukeprint.jar -o target/pretty target/cucumber.json
 *
 * # Fail when more than 3 scenarios are tagged @wip
 * java -jar cukeprint.jar -t @wip:3 target/cucumber.json
 * </pre>
 * Options given here override those of the config file, which is
 * cukeprint.json in the working directory unless -c names another one.
 */
@Command(
        name = "cukeprint",
        mixinStandardHelpOptions = true,
        version = "cukeprint 0.1.0",
        description = "Pretty print Cucumber JSON reports"
)
public class Main implements Callable<Integer> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    @Parameters(
            description = "Cucumber JSON report files",
            arity = "0..*"
    )
    List<String> paths;

    @Option(
            names = {"-s", "--source"},
            description = "Print the source location of each step as a comment"
    )
    boolean source;

    @Option(
            names = {"-m", "--no-multiline"},
            description = "Do not print doc strings and data tables"
    )
    boolean noMultiline;

    @Option(
            names = {"-o", "--out"},
            description = "Write each feature to its own file under this directory"
    )
    String out;

    @Option(
            names = {"-w", "--wip"},
            description = "Expect every scenario to fail (work in progress)"
    )
    boolean wip;

    @Option(
            names = {"-t", "--tag-limit"},
            description = "Fail when more elements carry a tag than allowed (e.g., '@wip:3')"
    )
    List<String> tagLimits;

    @Option(
            names = {"-p", "--prefix"},
            description = "Prefix for table cells of a status (e.g., 'failed=x ')"
    )
    List<String> prefixes;

    @Option(
            names = {"-c", "--config"},
            description = "Config file (default: cukeprint.json if present)"
    )
    String configFile;

    @Option(
            names = {"-l", "--log-level"},
            description = "Log level: trace, debug, info, warn, error"
    )
    String logLevel;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output"
    )
    boolean noColor;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Tag limits start with '@', so arguments are never read as @-files.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new Main()).setExpandAtFiles(false);
    }

    @Override
    public Integer call() {
        if (noColor) {
            Console.setColorsEnabled(false);
        }
        try {
            CukeprintConfig config = loadConfig();
            String level = logLevel != null ? logLevel : config.getLogLevel();
            if (level != null && !LogContext.setRuntimeLogLevel(level)) {
                Console.println(Console.warn("could not set log level: " + level));
            }
            List<String> reports = paths != null && !paths.isEmpty() ? paths : config.getPaths();
            if (reports.isEmpty()) {
                Console.println(Console.warn("No reports specified."));
                Console.println("Usage: cukeprint [options] <report.json...>");
                Console.println("Run 'cukeprint --help' for more information.");
                return 0;
            }
            FormatterOptions options = buildOptions(config);
            List<Feature> features = new ArrayList<>();
            for (String report : reports) {
                features.addAll(CucumberJsonReader.read(Path.of(report)));
            }
            PrettyFormatter formatter = new PrettyFormatter(Console.getOutput(), options);
            new FeatureWalker(formatter).walk(features);
            return formatter.getSummary().isFailed(features) ? 1 : 0;
        } catch (Exception e) {
            logger.error("cukeprint failed: {}", e.getMessage(), e);
            Console.println(Console.fail("Error: " + e.getMessage()));
            return 1;
        }
    }

    private CukeprintConfig loadConfig() {
        if (configFile != null) {
            return CukeprintConfig.load(Path.of(configFile));
        }
        Path defaultFile = Path.of(CukeprintConfig.DEFAULT_FILE);
        if (Files.isRegularFile(defaultFile)) {
            logger.debug("using config: {}", defaultFile.toAbsolutePath());
            return CukeprintConfig.load(defaultFile);
        }
        return new CukeprintConfig();
    }

    FormatterOptions buildOptions(CukeprintConfig config) {
        FormatterOptions.Builder builder = config.applyTo(FormatterOptions.builder());
        if (source) {
            builder.showSourceLocations(true);
        }
        if (noMultiline) {
            builder.suppressMultilineArguments(true);
        }
        if (wip) {
            builder.wip(true);
        }
        if (out != null) {
            builder.batchOutputDirectory(out);
        }
        if (tagLimits != null) {
            for (String value : tagLimits) {
                int pos = value.lastIndexOf(':');
                if (pos < 1) {
                    throw new IllegalArgumentException("tag limit must look like @tag:N but was: " + value);
                }
                builder.tagLimit(value.substring(0, pos), parseLimit(value, value.substring(pos + 1)));
            }
        }
        if (prefixes != null) {
            for (String value : prefixes) {
                int pos = value.indexOf('=');
                if (pos < 1) {
                    throw new IllegalArgumentException("prefix must look like status=glyph but was: " + value);
                }
                builder.statusPrefix(CukeprintConfig.parseStatus(value.substring(0, pos)), value.substring(pos + 1));
            }
        }
        return builder.build();
    }

    private static int parseLimit(String option, String limit) {
        try {
            return Integer.parseInt(limit.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("tag limit is not a number: " + option, e);
        }
    }

    public List<String> getPaths() {
        return paths;
    }

    public String getOut() {
        return out;
    }

    /**
     * Parse command-line arguments without executing.
     */
    public static Main parse(String... args) {
        CommandLine commandLine = commandLine();
        commandLine.parseArgs(args);
        return commandLine.getCommand();
    }

}

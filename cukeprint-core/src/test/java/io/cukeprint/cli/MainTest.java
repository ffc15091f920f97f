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
import io.cukeprint.gherkin.Status;
import io.cukeprint.output.Console;
import io.cukeprint.output.FormatterOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    static final String PASSING = """
            [ { "uri": "features/pass.feature", "name": "Pass", "elements": [
              { "type": "scenario", "keyword": "Scenario", "name": "Works", "line": 3, "steps": [
                { "keyword": "Given ", "name": "it works", "line": 4,
                  "match": { "location": "Steps.works()" }, "result": { "status": "passed" } } ] } ] } ]
            """;

    static final String FAILING = """
            [ { "uri": "features/fail.feature", "name": "Fail", "elements": [
              { "type": "scenario", "keyword": "Scenario", "name": "Breaks", "line": 3, "steps": [
                { "keyword": "Given ", "name": "it breaks", "line": 4,
                  "result": { "status": "failed", "error_message": "java.lang.AssertionError: broken" } } ] } ] } ]
            """;

    @TempDir
    Path tempDir;

    private PrintStream original;
    private ByteArrayOutputStream baos;

    @BeforeEach
    void beforeEach() {
        Console.setColorsEnabled(false);
        original = Console.getOutput();
        baos = new ByteArrayOutputStream();
        Console.setOutput(new PrintStream(baos, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void afterEach() {
        Console.setOutput(original);
    }

    private Path report(String name, String json) throws Exception {
        Path path = tempDir.resolve(name);
        Files.writeString(path, json);
        return path;
    }

    private int run(String... args) {
        return Main.commandLine().execute(args);
    }

    private String output() {
        return baos.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testPassingReport() throws Exception {
        int code = run("--no-color", report("pass.json", PASSING).toString());
        assertEquals(0, code);
        assertTrue(output().contains("""
                  Scenario: Works
                    Given it works
                """), output());
        assertTrue(output().contains("1 scenario (1 passed)"));
    }

    @Test
    void testFailingReport() throws Exception {
        int code = run(report("fail.json", FAILING).toString());
        assertEquals(1, code);
        assertTrue(output().contains("      broken (java.lang.AssertionError)"), output());
    }

    @Test
    void testWipExpectsFailures() throws Exception {
        assertEquals(0, run("-w", report("fail.json", FAILING).toString()));
        baos.reset();
        assertEquals(1, run("--wip", report("pass.json", PASSING).toString()));
    }

    @Test
    void testSeveralReports() throws Exception {
        int code = run(report("pass.json", PASSING).toString(), report("fail.json", FAILING).toString());
        assertEquals(1, code);
        assertTrue(output().contains("2 scenarios (1 failed, 1 passed)"), output());
    }

    @Test
    void testSourceLocations() throws Exception {
        assertEquals(0, run("-s", report("pass.json", PASSING).toString()));
        assertTrue(output().contains("  Scenario: Works  # features/pass.feature:3"), output());
        assertTrue(output().contains("    Given it works # Steps.works()"), output());
    }

    @Test
    void testTagLimit() throws Exception {
        String tagged = PASSING.replace("\"name\": \"Works\",", "\"name\": \"Works\", \"tags\": [ { \"name\": \"@wip\" } ],");
        assertEquals(1, run("-t", "@wip:0", report("tagged.json", tagged).toString()));
        assertTrue(output().contains("@wip occurred:1 limit:0"), output());
    }

    @Test
    void testBatchOutput() throws Exception {
        Path out = tempDir.resolve("out");
        assertEquals(0, run("-o", out.toString(), report("pass.json", PASSING).toString()));
        assertEquals("", output());
        String text = Files.readString(out.resolve("features/pass.feature"));
        assertTrue(text.startsWith("Feature: Pass\n"), text);
    }

    @Test
    void testConfigFile() throws Exception {
        Path report = report("pass.json", PASSING);
        Path config = tempDir.resolve("cukeprint.json");
        Files.writeString(config, """
                { "paths": [ "%s" ], "source": true }
                """.formatted(report.toString().replace("\\", "\\\\")));
        assertEquals(0, run("-c", config.toString()));
        assertTrue(output().contains("# features/pass.feature:3"), output());
    }

    @Test
    void testMissingReport() {
        assertEquals(1, run(tempDir.resolve("missing.json").toString()));
        assertTrue(output().contains("Error: failed to read report"), output());
    }

    @Test
    void testInvalidTagLimit() throws Exception {
        assertEquals(1, run("-t", "wip", report("pass.json", PASSING).toString()));
        assertEquals(1, run("-t", "@wip:x", report("pass.json", PASSING).toString()));
    }

    @Test
    void testNoReports() {
        assertEquals(0, run());
        assertTrue(output().contains("Usage: cukeprint"), output());
    }

    @Test
    void testParseOptions() {
        Main main = Main.parse("-s", "-m", "-o", "out", "-t", "@wip:3", "-p", "failed=x ", "r.json");
        assertEquals(List.of("r.json"), main.getPaths());
        assertEquals("out", main.getOut());
        FormatterOptions options = main.buildOptions(new CukeprintConfig());
        assertTrue(options.isShowSourceLocations());
        assertTrue(options.isSuppressMultilineArguments());
        assertEquals(Path.of("out"), options.getBatchOutputDirectory());
        assertEquals(3, options.getTagLimits().get("wip"));
        assertEquals("x ", options.getStatusPrefix(Status.FAILED));
    }

    @Test
    void testCommandLineOverridesConfig() {
        CukeprintConfig config = CukeprintConfig.parse("""
                { "tagLimits": { "wip": 1 }, "prefixes": { "failed": "!" } }
                """);
        FormatterOptions options = Main.parse("-t", "wip:5", "-p", "failed=x").buildOptions(config);
        assertEquals(5, options.getTagLimits().get("wip"));
        assertEquals("x", options.getStatusPrefix(Status.FAILED));
    }

}

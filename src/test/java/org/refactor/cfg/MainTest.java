package org.refactor.cfg;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@RunWith(JUnit4.class)
public class MainTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path copyResource(String resource, String fileName) throws IOException {
        Path target = tmp.getRoot().toPath().resolve(fileName);
        try (InputStream in = MainTest.class.getResourceAsStream(resource)) {
            Files.copy(in, target);
        }
        return target;
    }

    private static JsonObject runOk(String... args) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int code = Main.run(args, new PrintStream(bytes, true, StandardCharsets.UTF_8));
        Assert.assertEquals(0, code);
        return JsonParser.parseString(bytes.toString(StandardCharsets.UTF_8)).getAsJsonObject();
    }

    @Test
    public void javaInputPrintsProgramAndFunctions() throws IOException {
        Path java = copyResource("/Sample.java", "Sample.java");
        JsonObject out = runOk("--optimize", java.toString());

        Assert.assertEquals("program_entry_point", out.getAsJsonObject("program").get("name").getAsString());
        JsonObject functions = out.getAsJsonObject("functions");
        Assert.assertTrue(functions.has("sum"));
        Assert.assertTrue(functions.has("twice"));
        Assert.assertTrue(functions.getAsJsonObject("sum").getAsJsonArray("nodes").size() > 2);
    }

    @Test
    public void jsonInputWithStrictMode() throws IOException {
        Path json = copyResource("/ast/while.json", "while.json");
        JsonObject out = runOk("--strict", "--scope", "all", json.toString());
        Assert.assertEquals("while_loop", out.getAsJsonObject("program").get("name").getAsString());
        Assert.assertEquals(0, out.getAsJsonObject("functions").size());
    }

    @Test
    public void outputIsStableAcrossRuns() throws IOException {
        Path json = copyResource("/ast/calls.json", "calls.json");
        JsonObject first = runOk(json.toString());
        Assert.assertEquals(first, runOk(json.toString()));
        Assert.assertTrue(first.getAsJsonObject("program").get("begin").getAsString().startsWith("calls:"));
        Assert.assertEquals("Sample", Main.scopeOf(Path.of("src", "Sample.java")));
    }

    @Test
    public void badArgumentsGiveUsageExitCode() {
        PrintStream sink = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
        Assert.assertEquals(2, Main.run(new String[0], sink));
        Assert.assertEquals(2, Main.run(new String[]{"--scope", "sideways", "x.json"}, sink));
        Assert.assertEquals(2, Main.run(new String[]{"--bogus", "x.json"}, sink));
        Assert.assertEquals(2, Main.run(new String[]{"--grammar"}, sink));
    }

    @Test
    public void buildFailureGivesExitCodeOne() throws IOException {
        Path json = copyResource("/ast/duplicate_function.json", "dup.json");
        PrintStream sink = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
        Assert.assertEquals(1, Main.run(new String[]{json.toString()}, sink));
        Assert.assertEquals(1, Main.run(new String[]{tmp.getRoot().toPath().resolve("missing.json").toString()}, sink));
    }
}

package com.initialone.jyardify.commands;

import com.initialone.jyardify.Main;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GenerateCmdTest {

    @TempDir
    Path dir;

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setErr(new PrintWriter(new StringWriter()));
        return cmd.execute(args);
    }

    private Path sources() throws IOException {
        Path src = dir.resolve("src");
        Files.createDirectories(src.resolve("sub"));
        Files.writeString(src.resolve("one.rb"), "class One\n  def a(x)\n  end\nend\n");
        Files.writeString(src.resolve("sub/two.rb"), "module Two\nend\n");
        return src;
    }

    @Test
    void directoryRunWithMockProvider() throws IOException {
        Path src = sources();
        Path out = dir.resolve("out");

        int code = run("generate", src.toString(), "--provider", "mock", "--output", out.toString(),
                "--output-structure", "mirror", "--yard");

        assertEquals(0, code);
        String one = Files.readString(out.resolve("documented/one.rb"));
        assertTrue(one.startsWith("# One class\n"));
        assertTrue(one.contains("  # @param x [Object] mock parameter\n"));
        assertTrue(one.contains("  # @return [Object] mock return value\n  def a(x)"));
        assertTrue(Files.exists(out.resolve("documented/sub/two.rb")));
        assertTrue(Files.exists(out.resolve("manifest.json")));
        assertTrue(Files.exists(out.resolve("metadata.json")));
        assertTrue(Files.exists(out.resolve("yard/one.rb.yard")));

        assertEquals(0, run("status", "--output", out.toString()));
    }

    @Test
    void singleFileMode() throws IOException {
        Path src = sources();
        Path out = dir.resolve("out");

        int code = run("generate", "--file", src.resolve("sub/two.rb").toString(),
                "--provider", "mock", "--output", out.toString());

        assertEquals(0, code);
        assertTrue(Files.readString(out.resolve("documented/two.rb")).startsWith("# Two module"));
    }

    @Test
    void inputIsRequired() {
        assertEquals(CommandLine.ExitCode.USAGE, run("generate", "--provider", "mock"));
    }

    @Test
    void badOutputStructureIsUsageError() throws IOException {
        Path src = sources();
        assertEquals(CommandLine.ExitCode.USAGE,
                run("generate", src.toString(), "--provider", "mock", "--output-structure", "tree"));
    }

    @Test
    void missingPathsExitWithOne() {
        assertEquals(1, run("generate", dir.resolve("nope").toString(), "--provider", "mock",
                "--output", dir.resolve("out").toString()));
        assertEquals(1, run("generate", "--file", dir.resolve("nope.rb").toString(), "--provider", "mock",
                "--output", dir.resolve("out").toString()));
    }

    @Test
    void unknownProviderFailsValidation() throws IOException {
        Path src = sources();
        assertEquals(1, run("generate", src.toString(), "--provider", "cohere", "--output", dir.resolve("out").toString()));
    }

    @Test
    void statusWithoutManifest() {
        assertEquals(0, run("status", "--output", dir.resolve("empty").toString()));
    }
}

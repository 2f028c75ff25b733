package com.initialone.jyardify.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jyardify.model.ManifestEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingManifestTest {

    @TempDir
    Path dir;

    private Path manifestFile;
    private Path outputDir;
    private Function<Path, Path> locator;

    @BeforeEach
    void setUp() throws IOException {
        manifestFile = dir.resolve("out/manifest.json");
        outputDir = dir.resolve("out/documented");
        Files.createDirectories(outputDir);
        locator = p -> outputDir.resolve(p.getFileName().toString());
    }

    private Path source(String name, String content) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, content);
        return p;
    }

    @Test
    void unwritableManifestIsLoggedAndWorkContinues() throws IOException {
        // a non-empty directory where the manifest should go makes every save fail
        Files.createDirectories(manifestFile);
        Files.writeString(manifestFile.resolve("keep"), "x");
        Path a = source("a.rb", "class A\nend\n");
        Path b = source("b.rb", "class B\nend\n");

        ProcessingManifest m = ProcessingManifest.load(manifestFile, "mock", true, locator);
        assertEquals(manifestFile, m.file());
        assertTrue(m.processedFiles().isEmpty());

        assertDoesNotThrow(() -> m.markProcessed(a, true));
        assertNotNull(m.entry(a));
        assertDoesNotThrow(() -> m.markProcessed(b, false));
        assertEquals(List.of(ProcessingManifest.key(b)), m.failedFiles());
        assertDoesNotThrow(() -> m.markProcessed(b, true));
        assertTrue(m.failedFiles().isEmpty());
        assertEquals(2, m.processedFiles().size());

        assertTrue(Files.isDirectory(manifestFile));
    }

    @Test
    void unchangedFileIsSkippedAndChangedFileIsNot() throws IOException {
        Path a = source("a.rb", "class A\n  def x\n  end\nend\n");
        ProcessingManifest m = ProcessingManifest.load(manifestFile, "mock", true, locator);
        assertFalse(m.isProcessed(a));

        Files.writeString(locator.apply(a), "# A\nclass A\n  def x\n  end\nend\n");
        m.markProcessed(a, true);

        ProcessingManifest reloaded = ProcessingManifest.load(manifestFile, "mock", true, locator);
        assertTrue(reloaded.isProcessed(a));

        Files.writeString(a, "class A\n  def y\n  end\nend\n");
        assertFalse(reloaded.isProcessed(a));
    }

    @Test
    void addingDocCommentsToSourceStillCountsAsProcessed() throws IOException {
        Path a = source("a.rb", "def x\nend\n");
        ProcessingManifest m = ProcessingManifest.load(manifestFile, "mock", true, locator);
        Files.writeString(locator.apply(a), "out");
        m.markProcessed(a, true);

        Files.writeString(a, "# Does x\n# @return [nil]\ndef x\nend\n");

        assertTrue(m.isProcessed(a));
    }

    @Test
    void missingOutputForcesReprocessing() throws IOException {
        Path a = source("a.rb", "def x\nend\n");
        ProcessingManifest m = ProcessingManifest.load(manifestFile, "mock", true, locator);
        m.markProcessed(a, true);

        assertNotNull(m.entry(a));
        assertFalse(m.isProcessed(a));
    }

    @Test
    void nonIncrementalNeverSkips() throws IOException {
        Path a = source("a.rb", "def x\nend\n");
        Files.writeString(locator.apply(a), "out");
        ProcessingManifest m = ProcessingManifest.load(manifestFile, "mock", false, locator);
        m.markProcessed(a, true);

        assertFalse(m.isProcessed(a));
        assertFalse(m.isIncremental());
    }

    @Test
    void failuresAreListedOnceAndClearedBySuccess() throws IOException {
        Path a = source("a.rb", "def x\nend\n");
        ProcessingManifest m = ProcessingManifest.load(manifestFile, "mock", true, locator);

        m.markProcessed(a, false);
        m.markProcessed(a, false);
        assertEquals(List.of(ProcessingManifest.key(a)), m.failedFiles());
        assertNull(m.entry(a));

        m.markProcessed(a, true, "def x\nend\n");
        assertTrue(m.failedFiles().isEmpty());
        assertEquals(ContentHasher.computeHash("def x\nend\n"), m.entry(a).contentHash);
    }

    @Test
    void persistedShapeUsesSnakeCaseKeys() throws IOException {
        Path a = source("a.rb", "def x\nend\n");
        ProcessingManifest m = ProcessingManifest.load(manifestFile, "openai", true, locator);
        m.markProcessed(a, true);

        JsonNode root = new ObjectMapper().readTree(manifestFile.toFile());
        JsonNode entry = root.path("processed_files").path(ProcessingManifest.key(a));
        assertEquals("openai", entry.path("provider").asText());
        assertEquals("a.rb", entry.path("file_name").asText());
        assertEquals(16, entry.path("content_hash").asText().length());
        assertFalse(entry.path("timestamp").asText().isEmpty());
        assertTrue(root.path("failed_files").isArray());
        assertFalse(Files.exists(manifestFile.resolveSibling("manifest.json.tmp")));
    }

    @Test
    void corruptManifestStartsEmpty() throws IOException {
        Files.createDirectories(manifestFile.getParent());
        Files.writeString(manifestFile, "{ not json");

        ProcessingManifest m = ProcessingManifest.load(manifestFile, "mock", true, locator);

        assertTrue(m.processedFiles().isEmpty());
        assertTrue(m.failedFiles().isEmpty());
    }

    @Test
    void concurrentMarksAreAllRecorded() throws Exception {
        ProcessingManifest m = ProcessingManifest.load(manifestFile, "mock", true, locator);
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 40; i++) files.add(source("f" + i + ".rb", "x = " + i + "\n"));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < files.size(); i++) {
                Path p = files.get(i);
                boolean ok = i % 4 != 0;
                futures.add(pool.submit(() -> m.markProcessed(p, ok)));
            }
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdown();
        }

        assertEquals(30, m.processedFiles().size());
        assertEquals(10, m.failedFiles().size());
        ProcessingManifest reloaded = ProcessingManifest.load(manifestFile, "mock", true, locator);
        assertEquals(30, reloaded.processedFiles().size());
        assertEquals(10, reloaded.failedFiles().size());
        ManifestEntry e = reloaded.entry(files.get(1));
        assertEquals("f1.rb", e.fileName);
    }
}

package com.initialone.jyardify.pipeline;

import com.initialone.jyardify.llm.GenerationException;
import com.initialone.jyardify.llm.PromptFactory;
import com.initialone.jyardify.llm.TextGenerator;
import com.initialone.jyardify.patch.ExtractionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DocumentationPipelineTest {

    @TempDir
    Path dir;

    private TextGenerator generator;
    private DocumentationPipeline pipeline;
    private OutputLayout layout;

    @BeforeEach
    void setUp() {
        generator = mock(TextGenerator.class);
        when(generator.name()).thenReturn("test");
        layout = new OutputLayout(dir.resolve("out"), dir, OutputLayout.Structure.FLAT);
        pipeline = new DocumentationPipeline(generator, layout);
    }

    @Test
    void insertsCommentsFromResponse() throws Exception {
        when(generator.generate(anyString(), anyString())).thenReturn(
                "```json\n[{\"line_number\": 2, \"anchor\": \"def go\", \"indent\": 2, \"comment\": \"# Goes\"}]\n```");

        String out = pipeline.document(dir.resolve("a.rb"), "class A\n  def go\n  end\nend\n");

        assertEquals("class A\n  # Goes\n  def go\n  end\nend\n", out);
        verify(generator).generate(contains("**a.rb**"), eq(PromptFactory.SYSTEM_PROMPT));
    }

    @Test
    void emptyArrayReturnsOriginal() throws Exception {
        when(generator.generate(anyString(), anyString())).thenReturn("[]");

        String original = "require 'json'\n";
        assertSame(original, pipeline.document(dir.resolve("req.rb"), original));
    }

    @Test
    void unparseableResponseIsSavedAndRethrown() throws Exception {
        when(generator.generate(anyString(), anyString())).thenReturn("I cannot do that.");

        assertThrows(ExtractionException.class, () -> pipeline.document(dir.resolve("broken.rb"), "x = 1\n"));

        Path saved = dir.resolve("out/broken_failed_response.txt");
        assertTrue(Files.exists(saved));
        String text = Files.readString(saved);
        assertTrue(text.startsWith("Failed to parse JSON for: broken.rb\nAI Response Length: 17 characters\n"));
        assertTrue(text.endsWith("=".repeat(80) + "\nI cannot do that."));
    }

    @Test
    void generatorFailurePropagates() throws Exception {
        when(generator.generate(anyString(), anyString())).thenThrow(new GenerationException("timeout"));

        assertThrows(GenerationException.class, () -> pipeline.document(dir.resolve("a.rb"), "x = 1\n"));
        assertFalse(Files.exists(dir.resolve("out/a_failed_response.txt")));
    }

    @Test
    void readsFileFromDisk() throws Exception {
        Path src = dir.resolve("b.rb");
        Files.writeString(src, "def b\nend\n");
        when(generator.generate(anyString(), anyString())).thenReturn(
                "[{\"line_number\": 1, \"anchor\": \"def b\", \"comment\": \"# B\"}]");

        assertEquals("# B\ndef b\nend\n", pipeline.document(src));
    }
}

package com.initialone.jyardify.llm;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PromptFactoryTest {

    @Test
    void numbersLinesRightAligned() {
        assertEquals("   1: class A\n   2:   def b\n   3: end", PromptFactory.numbered("class A\n  def b\nend"));
    }

    @Test
    void promptCarriesFileNameAndNumberedSource() {
        String p = PromptFactory.documentationPrompt("gameobj.rb", "x = '100%'");

        assertTrue(p.contains("**gameobj.rb**"));
        assertTrue(p.contains("   1: x = '100%'"));
        assertTrue(p.contains("\"line_number\""));
        assertTrue(p.contains("with \\n for newlines"));
    }
}

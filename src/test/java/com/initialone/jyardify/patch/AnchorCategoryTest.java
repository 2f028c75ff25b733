package com.initialone.jyardify.patch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnchorCategoryTest {

    private static boolean matches(String anchor, String line) {
        return AnchorCategory.matcherFor(anchor).matches(line);
    }

    @Test
    void classifiesByShape() {
        assertEquals(AnchorCategory.DECLARATION, AnchorCategory.classify("class GameObj"));
        assertEquals(AnchorCategory.DECLARATION, AnchorCategory.classify("  module Lich::Util "));
        assertEquals(AnchorCategory.DEFINITION, AnchorCategory.classify("def self.load(path)"));
        assertEquals(AnchorCategory.ATTRIBUTE_ACCESSOR, AnchorCategory.classify("attr_reader :mana"));
        assertEquals(AnchorCategory.CONSTANT, AnchorCategory.classify("MAX_RETRIES = 3"));
        assertEquals(AnchorCategory.CONSTANT, AnchorCategory.classify("VERSION"));
        assertEquals(AnchorCategory.FIELD_VARIABLE, AnchorCategory.classify("@@registry"));
        assertEquals(AnchorCategory.FALLBACK, AnchorCategory.classify("include Comparable"));
        assertEquals(AnchorCategory.FALLBACK, AnchorCategory.classify("Version"));
    }

    @Test
    void declarationIgnoresSuperclassAndIndent() {
        assertTrue(matches("class GameObj", "  class GameObj < Base"));
        assertTrue(matches("module Lich", "module Lich"));
        assertFalse(matches("class Game", "class GameObj"));
        assertFalse(matches("class GameObj", "module GameObj"));
    }

    @Test
    void definitionAcceptsAnyReceiver() {
        assertTrue(matches("def method", "    def method(a, b)"));
        assertTrue(matches("def method", "  def self.method"));
        assertTrue(matches("def method", "  def ClassName.method"));
        assertTrue(matches("def self.method", "  def method"));
        assertTrue(matches("def valid", "  def valid?"));
        assertTrue(matches("def name", "  def name=(v)"));
        assertTrue(matches("def []", "  def [](key)"));
    }

    @Test
    void definitionRequiresWholeName() {
        assertFalse(matches("def method", "  def method_missing(name, *args)"));
        assertFalse(matches("def load", "  def self.loader"));
        assertFalse(matches("def load", "  # we load things here"));
    }

    @Test
    void accessorMatchesSymbolInList() {
        assertTrue(matches("attr_reader :mana", "  attr_reader :mana, :spirit"));
        assertTrue(matches("attr_accessor :a,", "  attr_accessor :a, :b"));
        assertFalse(matches("attr_reader :mana", "  attr_writer :mana"));
        assertFalse(matches("attr_reader :man", "  attr_reader :mana"));
        assertTrue(matches("attr_reader", "  attr_reader :x"));
    }

    @Test
    void constantNeedsAssignment() {
        assertTrue(matches("MAX_RETRIES", "  MAX_RETRIES = 3"));
        assertTrue(matches("MAX_RETRIES = 5", "MAX_RETRIES=3"));
        assertFalse(matches("MAX_RETRIES", "  retry if tries < MAX_RETRIES"));
        assertFalse(matches("MAX", "  MAX_RETRIES = 3"));
    }

    @Test
    void fieldVariableAssignmentsOnly() {
        assertTrue(matches("@count", "    @count = 0"));
        assertTrue(matches("@count", "    @count ||= 0"));
        assertTrue(matches("@count = 0", "    @count += 1"));
        assertTrue(matches("@@registry", "  @@registry = {}"));
        assertFalse(matches("@count", "    if @count == 0"));
        assertFalse(matches("@count", "    @count =~ /x/"));
        assertFalse(matches("@registry", "  @@registry = {}"));
    }

    @Test
    void fallbackNeedsAllTokens() {
        assertTrue(matches("include Comparable", "  include Comparable"));
        assertTrue(matches("alias_method :old, :new", "  alias_method :old, :new"));
        assertFalse(matches("include Comparable", "  include Enumerable"));
        assertFalse(matches("   ", "anything"));
    }
}

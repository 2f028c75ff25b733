package com.initialone.jyardify.patch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Syntactic shapes an anchor can take, tried in declaration order.
 *
 * <p>Each constant decides from the anchor text alone whether it applies, and compiles an
 * {@link AnchorMatcher} for candidate lines. {@link #FALLBACK} accepts everything, so it must stay
 * last; a new shape is a new constant placed before it.
 */
public enum AnchorCategory {

    /** {@code class Foo}, {@code module Bar::Baz} */
    DECLARATION {
        @Override
        boolean accepts(String anchor) {
            return anchor.startsWith("class ") || anchor.startsWith("module ");
        }

        @Override
        AnchorMatcher compile(String anchor) {
            String[] kv = anchor.split("\\s+", 2);
            String name = beforeParen(kv[1]).trim();
            Pattern p = Pattern.compile("^\\s*" + Pattern.quote(kv[0]) + "\\s+" + Pattern.quote(name) + "\\b");
            return line -> p.matcher(line).find();
        }
    },

    /** {@code def name}, {@code def self.name}, {@code def Klass.name?}, {@code def []} */
    DEFINITION {
        @Override
        boolean accepts(String anchor) {
            return anchor.startsWith("def ");
        }

        @Override
        AnchorMatcher compile(String anchor) {
            String signature = beforeParen(anchor.substring(4)).trim();
            String exact = "def " + signature;
            String name = signature.contains(".")
                    ? signature.substring(signature.lastIndexOf('.') + 1)
                    : signature;
            if (name.isEmpty()) {
                return line -> line.contains(exact);
            }

            String qualifier = "\\bdef\\s+(?:(?:self|\\w+)\\.)?";
            Pattern p = "[]".equals(name)
                    ? Pattern.compile(qualifier + "\\[\\]")
                    : Pattern.compile(qualifier + Pattern.quote(name) + "[?!=]?(?!\\w)");
            // literal signature, e.g. "def initialize a, b" without parens
            Pattern literal = Pattern.compile(Pattern.quote(exact) + "(?!\\w)");
            return line -> p.matcher(line).find() || literal.matcher(line).find();
        }
    },

    /** {@code attr_reader :mana}, {@code attr_accessor :a, :b} */
    ATTRIBUTE_ACCESSOR {
        @Override
        boolean accepts(String anchor) {
            return anchor.startsWith("attr_");
        }

        @Override
        AnchorMatcher compile(String anchor) {
            String[] parts = anchor.split("\\s+");
            String accessor = parts[0];
            if (parts.length < 2) {
                return line -> line.contains(accessor);
            }
            String symbol = stripTrailing(parts[1].replaceFirst("^:+", ""), ',');
            Pattern p = Pattern.compile(Pattern.quote(accessor) + "\\s+:" + Pattern.quote(symbol) + "\\b");
            return line -> p.matcher(line).find();
        }
    },

    /** {@code MAX_RETRIES} or {@code MAX_RETRIES = 3} */
    CONSTANT {
        private final Pattern shape = Pattern.compile("^[A-Z][A-Z0-9_]*(?:\\s*=.*)?$");

        @Override
        boolean accepts(String anchor) {
            return shape.matcher(anchor).matches();
        }

        @Override
        AnchorMatcher compile(String anchor) {
            String name = anchor.split("=", 2)[0].trim();
            Pattern p = Pattern.compile("\\b" + Pattern.quote(name) + "\\s*=");
            return line -> p.matcher(line).find();
        }
    },

    /** {@code @var}, {@code @@class_var}, optionally followed by an assignment */
    FIELD_VARIABLE {
        @Override
        boolean accepts(String anchor) {
            return anchor.startsWith("@");
        }

        @Override
        AnchorMatcher compile(String anchor) {
            String name = anchor.split("\\s+")[0].split("=", 2)[0].trim();
            // plain or compound assignment, but not comparison
            Pattern p = Pattern.compile("(?<!@)" + Pattern.quote(name)
                    + "\\s*(?:\\|\\||&&|\\*\\*|<<|>>|[-+*/%|&^])?=(?![=~>])");
            return line -> p.matcher(line).find();
        }
    },

    /** every whitespace token of the anchor (before any '(') must occur in the line */
    FALLBACK {
        @Override
        boolean accepts(String anchor) {
            return true;
        }

        @Override
        AnchorMatcher compile(String anchor) {
            String clean = beforeParen(anchor).trim();
            List<String> tokens = new ArrayList<>();
            for (String t : clean.split("\\s+")) {
                if (!t.isEmpty()) tokens.add(t);
            }
            if (tokens.isEmpty()) {
                return line -> false;
            }
            return line -> {
                for (String t : tokens) {
                    if (!line.contains(t)) return false;
                }
                return true;
            };
        }
    };

    abstract boolean accepts(String anchor);

    abstract AnchorMatcher compile(String anchor);

    /** First category whose shape fits the (trimmed) anchor. */
    public static AnchorCategory classify(String anchor) {
        String a = anchor == null ? "" : anchor.trim();
        for (AnchorCategory c : values()) {
            if (c.accepts(a)) return c;
        }
        return FALLBACK;
    }

    /** Classifies the anchor and compiles its matcher in one step. */
    public static AnchorMatcher matcherFor(String anchor) {
        String a = anchor == null ? "" : anchor.trim();
        return classify(a).compile(a);
    }

    private static String beforeParen(String s) {
        int i = s.indexOf('(');
        return i >= 0 ? s.substring(0, i) : s;
    }

    private static String stripTrailing(String s, char c) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == c) end--;
        return s.substring(0, end);
    }
}

package com.initialone.jyardify.llm;

import com.initialone.jyardify.util.SourceText;

import java.util.List;
import java.util.Locale;

public class PromptFactory {

    public static final String SYSTEM_PROMPT = """
            You are an expert Ruby documentation specialist.
            Your task is to generate YARD-compatible documentation for Ruby code.
            You will return JSON with documentation comments and their anchor points.""";

    /** Source with right-aligned 1-based line numbers, e.g. {@code "  15: def foo"}. */
    public static String numbered(String content) {
        List<String> lines = SourceText.lines(content);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(String.format(Locale.ROOT, "%4d: %s", i + 1, lines.get(i)));
        }
        return sb.toString();
    }

    public static String documentationPrompt(String fileName, String content) {
        return """
                Analyze this Ruby file: **%s**

                ```ruby
                %s
                ```

                Generate **YARD-compatible** documentation for every public class, module, method, and constant.
                The line numbers are shown at the start of each line (e.g., "  15: def method_name").

                **CRITICAL RULES - READ CAREFULLY:**

                1. **DO NOT DOCUMENT ALREADY-DOCUMENTED CODE**
                   - If a method/class ALREADY has YARD comments (lines starting with # @param, # @return, etc.),
                     DO NOT generate documentation for it
                   - Only document code WITHOUT existing YARD tags

                2. **PARAMETER NAME RULES**
                   - @param tags MUST exactly match the method's parameter names
                   - For block parameters: Use "block" NOT "&block"
                   - For splat parameters (*args): Use "args" NOT "*args"

                Documentation structure:
                1. For classes/modules: brief description, longer description if needed, @example tag with usage
                2. For methods: brief description, @param tags for ALL parameters with [Type] and description,
                   @return tag with [Type], @raise tags for exceptions, @example with actual usage, @note for caveats
                3. For constants: brief description comment above

                Return a JSON array where each entry contains:
                - "line_number": The line number to insert before (1-indexed, counting from line 1)
                - "anchor": A snippet of the line for validation (e.g., "class GameObj", "def initialize")
                - "indent": The indentation level (number of spaces before the line)
                - "comment": The YARD comment block as a single string with \\n for newlines

                Example output format:
                ```json
                [
                  {
                    "line_number": 15,
                    "anchor": "class GameObj",
                    "indent": 0,
                    "comment": "# Represents a game object\\n# @example Creating a game object\\n#   obj = GameObj.new"
                  },
                  {
                    "line_number": 23,
                    "anchor": "def initialize",
                    "indent": 2,
                    "comment": "# Initializes a new game object\\n# @param id [String] The object ID\\n# @return [GameObj]"
                  }
                ]
                ```

                IMPORTANT:
                - Return ONLY the JSON array, no other text
                - Line numbers should match the ORIGINAL file (1-indexed)
                - Anchors should be concise (just the key part like "def method_name" or "class ClassName")
                - SKIP any code that already has YARD documentation (# @param, # @return, etc.)
                - In the "comment" field you MUST escape special characters:
                  * Double quotes: use \\" not "
                  * Backslashes: use \\\\ not \\
                  * Line breaks use \\n
                - Your JSON MUST be valid and parseable
                """.formatted(fileName, numbered(content));
    }
}

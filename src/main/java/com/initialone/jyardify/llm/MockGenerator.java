package com.initialone.jyardify.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jyardify.model.EditDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline provider. Reads the numbered source out of the prompt and answers with one directive per
 * {@code class}, {@code module} and {@code def} line, fenced as a json block like a real model would.
 */
public class MockGenerator extends AbstractTextGenerator {

    private static final Logger log = LoggerFactory.getLogger(MockGenerator.class);

    // "  12:     def foo(bar)" as produced by PromptFactory
    private static final Pattern NUMBERED = Pattern.compile("^\\s*(\\d+): (.*)$");
    private static final Pattern DECL = Pattern.compile("^(\\s*)(class|module|def)\\s+([^\\s(<;]+)(.*)$");

    private final ObjectMapper om = new ObjectMapper();

    public MockGenerator() {
        this(ProviderConfig.mock());
    }

    public MockGenerator(ProviderConfig config) {
        super(config);
    }

    @Override
    protected String doGenerate(String userPrompt, String systemPrompt) throws GenerationException {
        log.info("[MOCK] Generating response for prompt of {} chars", userPrompt.length());
        List<EditDirective> out = directivesFor(userPrompt);
        try {
            return "```json\n" + om.writerWithDefaultPrettyPrinter().writeValueAsString(out) + "\n```";
        } catch (JsonProcessingException e) {
            throw new GenerationException("mock serialization failed", e);
        }
    }

    static List<EditDirective> directivesFor(String prompt) {
        List<EditDirective> out = new ArrayList<>();
        String previous = "";
        for (String raw : prompt.split("\n")) {
            Matcher nm = NUMBERED.matcher(raw);
            if (!nm.matches()) continue;
            int lineNo = Integer.parseInt(nm.group(1));
            String code = nm.group(2);
            Matcher dm = DECL.matcher(code);
            if (dm.matches() && !previous.trim().startsWith("#")) {
                String kind = dm.group(2);
                String name = dm.group(3);
                String anchor = kind + " " + name;
                out.add(new EditDirective(lineNo, anchor, dm.group(1).length(), commentFor(kind, name, dm.group(4))));
            }
            previous = code;
        }
        return out;
    }

    private static String commentFor(String kind, String name, String rest) {
        if (!"def".equals(kind)) {
            return "# " + name + " " + kind + "\n#\n# Mock documentation for testing";
        }
        StringBuilder sb = new StringBuilder("# ").append(name).append(" method\n#");
        String params = rest.trim();
        if (params.startsWith("(") && params.contains(")")) {
            for (String p : params.substring(1, params.indexOf(')')).split(",")) {
                String pn = p.trim().split("[=:\\s]")[0].replaceAll("^[&*]+", "");
                if (!pn.isEmpty()) sb.append("\n# @param ").append(pn).append(" [Object] mock parameter");
            }
        }
        sb.append("\n# @return [Object] mock return value");
        return sb.toString();
    }
}

package com.initialone.jyardify.patch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jyardify.model.EditDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates and parses the JSON directive array inside a free-form generator response.
 *
 * <p>Candidates are tried in order, first success wins:
 * <ol>
 *   <li>the first {@code ```json} fenced block</li>
 *   <li>the widest {@code [ { ... } ]} span (greedy)</li>
 *   <li>the narrowest {@code [ { ... } ]} span, unless identical to an earlier candidate</li>
 *   <li>the whole trimmed response</li>
 * </ol>
 * Every candidate goes through {@link ResponseSanitizer} first. A parsed value only counts when it is
 * an array; an empty array is a valid "nothing to document" answer.
 */
public class DirectiveExtractor {

    private static final Logger log = LoggerFactory.getLogger(DirectiveExtractor.class);

    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern GREEDY_ARRAY = Pattern.compile("\\[\\s*\\{.*\\}\\s*\\]", Pattern.DOTALL);
    private static final Pattern LAZY_ARRAY = Pattern.compile("\\[\\s*\\{.*?\\}\\s*\\]", Pattern.DOTALL);

    private final ObjectMapper om;

    public DirectiveExtractor() {
        this(new ObjectMapper());
    }

    public DirectiveExtractor(ObjectMapper om) {
        // "[...] trailing prose" must not parse as a whole-response candidate
        this.om = om.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @return the directives, possibly empty
     * @throws ExtractionException when no candidate parses to a JSON array
     */
    public List<EditDirective> extract(String response) throws ExtractionException {
        String text = response == null ? "" : response;
        Map<String, String> attempts = candidates(text);

        for (Map.Entry<String, String> e : attempts.entrySet()) {
            String strategy = e.getKey();
            String sanitized = ResponseSanitizer.sanitize(e.getValue());
            try {
                JsonNode root = om.readTree(sanitized);
                if (root == null || !root.isArray()) {
                    log.debug("Strategy '{}' found non-list JSON, skipping", strategy);
                    continue;
                }
                List<EditDirective> out = new ArrayList<>(root.size());
                for (JsonNode item : root) {
                    out.add(toDirective(item));
                }
                log.debug("Strategy '{}' extracted {} entries", strategy, out.size());
                return out;
            } catch (JsonProcessingException ex) {
                int pos = ex.getLocation() == null ? -1 : (int) ex.getLocation().getCharOffset();
                log.error("Strategy '{}' failed to parse JSON: {}", strategy, ex.getOriginalMessage());
                if (pos >= 0) {
                    log.error("  Near position {}: {}", pos, window(sanitized, pos, 50));
                }
            }
        }

        log.error("Failed to parse JSON response with all {} strategies", attempts.size());
        log.error("Response preview (first 500 chars): {}", head(text, 500));
        log.error("Response preview (last 500 chars): {}", tail(text, 500));
        throw new ExtractionException("no parseable directive array in response ("
                + text.length() + " chars)", attempts.size());
    }

    /** strategy name -> candidate text, in trial order */
    Map<String, String> candidates(String text) {
        Map<String, String> attempts = new LinkedHashMap<>();

        Matcher fenced = FENCED_JSON.matcher(text);
        if (fenced.find()) {
            attempts.put("json code block", fenced.group(1).trim());
        }
        Matcher greedy = GREEDY_ARRAY.matcher(text);
        if (greedy.find()) {
            attempts.put("greedy array match", greedy.group());
        }
        Matcher lazy = LAZY_ARRAY.matcher(text);
        if (lazy.find() && !attempts.containsValue(lazy.group())) {
            attempts.put("non-greedy array match", lazy.group());
        }
        String trimmed = text.trim();
        if (!trimmed.isEmpty()) {
            attempts.put("raw response", trimmed);
        }
        return attempts;
    }

    /** Lenient field mapping; anything malformed ends up null and is dropped by the applier. */
    static EditDirective toDirective(JsonNode item) {
        EditDirective d = new EditDirective();
        if (item == null || !item.isObject()) return d;

        JsonNode ln = item.get("line_number");
        if (ln != null) {
            // values outside int range stay null rather than wrapping onto a real line
            if (ln.isIntegralNumber() && ln.canConvertToInt()) {
                d.lineNumber = ln.intValue();
            } else if (ln.isTextual()) {
                try {
                    d.lineNumber = Integer.parseInt(ln.asText().trim());
                } catch (NumberFormatException ignore) {
                    d.lineNumber = null;
                }
            }
        }
        JsonNode anchor = item.get("anchor");
        if (anchor != null && anchor.isValueNode() && !anchor.isNull()) d.anchor = anchor.asText();
        JsonNode indent = item.get("indent");
        if (indent != null && indent.canConvertToInt()) d.indent = indent.asInt();
        JsonNode comment = item.get("comment");
        if (comment != null && comment.isValueNode() && !comment.isNull()) d.comment = comment.asText();
        return d;
    }

    private static String window(String s, int pos, int radius) {
        int from = Math.max(0, pos - radius);
        int to = Math.min(s.length(), pos + radius);
        return from >= to ? "" : s.substring(from, to);
    }

    static String head(String s, int n) {
        return s.length() <= n ? s : s.substring(0, n);
    }

    static String tail(String s, int n) {
        return s.length() <= n ? s : s.substring(s.length() - n);
    }
}

package com.sitepilot.orchestrator.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepilot.orchestrator.apply.GenerationPayload;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the generator's free text into a {@link GenerationPayload}.
 *
 * Accepted shapes, tried in order:
 * <ol>
 *   <li>a JSON object, bare or in a ```json fence, with any of
 *       {@code files}, {@code files_to_correct}, {@code new_files}; each either
 *       a list of {@code {path, content}} / {@code {path, corrected_content}}
 *       or a map of path to content</li>
 *   <li>fenced code blocks whose info line names the file, e.g.
 *       {@code ```jsx src/App.jsx}</li>
 * </ol>
 */
@Component
public class GenerationPayloadParser {

    private static final Pattern JSON_FENCE = Pattern.compile(
            "```(?:json)?\\s*\\n(\\{.*?})\\s*\\n```",
            Pattern.DOTALL
    );

    // ```jsx src/App.jsx   or   ```src/components/Hero.jsx
    private static final Pattern FILE_FENCE = Pattern.compile(
            "```(?:[a-zA-Z]+\\s+)?([\\w./@-]+\\.(?:jsx|js|css|json|html))[ \\t]*\\n(.*?)\\n```",
            Pattern.DOTALL
    );

    private final ObjectMapper json;

    public GenerationPayloadParser(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    /**
     * @throws PayloadParseException if no files can be extracted
     */
    public GenerationPayload parse(String text) {
        if (text == null || text.isBlank()) {
            throw new PayloadParseException("Empty generation response");
        }

        Optional<JsonNode> root = findJsonObject(text);
        if (root.isPresent() && hasFileSections(root.get())) {
            return fromJson(root.get());
        }

        Map<String, String> fenced = new LinkedHashMap<>();
        Matcher m = FILE_FENCE.matcher(text);
        while (m.find()) {
            fenced.put(m.group(1), m.group(2));
        }
        if (!fenced.isEmpty()) {
            return GenerationPayload.of(fenced);
        }
        throw new PayloadParseException("No files found in generation response");
    }

    private Optional<JsonNode> findJsonObject(String text) {
        Matcher fence = JSON_FENCE.matcher(text);
        if (fence.find()) {
            Optional<JsonNode> node = tryRead(fence.group(1));
            if (node.isPresent()) return node;
        }
        int start = text.indexOf('{');
        int end   = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return tryRead(text.substring(start, end + 1));
        }
        return Optional.empty();
    }

    private Optional<JsonNode> tryRead(String candidate) {
        try {
            JsonNode node = json.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static boolean hasFileSections(JsonNode root) {
        return root.has("files") || root.has("files_to_correct") || root.has("new_files");
    }

    private static GenerationPayload fromJson(JsonNode root) {
        Map<String, String> files = new LinkedHashMap<>();
        readSection(root.get("files"), "files", files);
        readSection(root.get("files_to_correct"), "files_to_correct", files);

        Map<String, String> newFiles = new LinkedHashMap<>();
        readSection(root.get("new_files"), "new_files", newFiles);

        GenerationPayload payload = new GenerationPayload(files, newFiles);
        if (payload.isEmpty()) {
            throw new PayloadParseException("Generation response listed no files");
        }
        return payload;
    }

    private static void readSection(JsonNode section, String name, Map<String, String> into) {
        if (section == null || section.isNull()) {
            return;
        }
        if (section.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = section.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!e.getValue().isTextual()) {
                    throw new PayloadParseException("'" + name + "." + e.getKey() + "' is not a string");
                }
                into.put(e.getKey(), e.getValue().asText());
            }
            return;
        }
        if (!section.isArray()) {
            throw new PayloadParseException("'" + name + "' must be a list or an object");
        }
        for (JsonNode entry : section) {
            JsonNode path = entry.get("path");
            if (path == null || !path.isTextual() || path.asText().isBlank()) {
                throw new PayloadParseException("Entry in '" + name + "' has no path");
            }
            JsonNode content = entry.has("corrected_content") ? entry.get("corrected_content") : entry.get("content");
            if (content == null || !content.isTextual()) {
                throw new PayloadParseException("Entry '" + path.asText() + "' in '" + name + "' has no content");
            }
            into.put(path.asText(), content.asText());
        }
    }
}

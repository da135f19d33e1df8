package com.sitepilot.orchestrator.apply;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Files produced by one generation call, keyed by the path the generator
 * used. {@code files} replace existing files; {@code newFiles} are created.
 * Both are applied the same way; the split is kept for logging and prompts.
 */
public record GenerationPayload(Map<String, String> files, Map<String, String> newFiles) {

    public GenerationPayload {
        files    = files == null ? Map.of() : unmodifiableCopy(files);
        newFiles = newFiles == null ? Map.of() : unmodifiableCopy(newFiles);
    }

    public static GenerationPayload of(Map<String, String> files) {
        return new GenerationPayload(files, Map.of());
    }

    /** Every file to write, replacements first, in generator order. */
    public Map<String, String> allFiles() {
        Map<String, String> all = new LinkedHashMap<>(files);
        all.putAll(newFiles);
        return all;
    }

    public Collection<String> contents() {
        return allFiles().values();
    }

    public boolean isEmpty() {
        return files.isEmpty() && newFiles.isEmpty();
    }

    public int size() {
        return allFiles().size();
    }

    private static Map<String, String> unmodifiableCopy(Map<String, String> m) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }
}

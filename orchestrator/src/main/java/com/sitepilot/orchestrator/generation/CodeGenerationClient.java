package com.sitepilot.orchestrator.generation;

/**
 * Source of generated code. The returned text is opaque until
 * {@link GenerationPayloadParser} turns it into files.
 */
public interface CodeGenerationClient {

    /**
     * @param systemPrompt instructions and output contract
     * @param prompt       the request, including any existing code or errors
     * @throws GenerationException if the service fails or returns nothing usable
     */
    String generate(String systemPrompt, String prompt);
}

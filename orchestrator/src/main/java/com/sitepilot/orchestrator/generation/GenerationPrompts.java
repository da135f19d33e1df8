package com.sitepilot.orchestrator.generation;

import com.sitepilot.orchestrator.correction.FileCorrection;
import com.sitepilot.orchestrator.lifecycle.DependencyAllowList;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Prompts for the four kinds of generation call. Deliberately minimal: they
 * fix the output contract and the project conventions, nothing about design.
 */
@Component
public class GenerationPrompts {

    private final String packageRule;

    public GenerationPrompts(DependencyAllowList allowList) {
        this.packageRule = "You may import only react and these packages: "
                + String.join(", ", new TreeSet<>(allowList.packages())) + ".";
    }

    // ------------------------------------------------------------------
    // System prompts
    // ------------------------------------------------------------------

    public String generateSystem() {
        return GENERATE_PROMPT.replace("{{PACKAGES}}", packageRule);
    }

    public String correctionSystem() {
        return CORRECTION_PROMPT.replace("{{PACKAGES}}", packageRule);
    }

    // ------------------------------------------------------------------
    // User messages
    // ------------------------------------------------------------------

    public String initial(String request) {
        return "Build this app:\n\n" + request;
    }

    /** Fresh attempt after targeted corrections did not converge. */
    public String regeneration(String request, String errorReport) {
        return "Build this app:\n\n" + request
                + "\n\nA previous attempt failed with these errors. Write the app again from scratch "
                + "and avoid them:\n" + errorReport;
    }

    public String edit(String request, Map<String, String> baseline) {
        StringBuilder sb = new StringBuilder();
        sb.append("Change the existing app as follows:\n\n").append(request)
          .append("\n\nReturn every file you change or add, complete. Current files:\n");
        for (Map.Entry<String, String> file : baseline.entrySet()) {
            appendFile(sb, file.getKey(), file.getValue());
        }
        return sb.toString();
    }

    public String correction(String request, List<FileCorrection> corrections,
                             String errorReport, List<String> suggestions) {
        StringBuilder sb = new StringBuilder();
        sb.append("The app built for this request has errors:\n\n").append(request)
          .append("\n\nErrors:\n").append(errorReport);
        if (!suggestions.isEmpty()) {
            sb.append("\nHow to fix:\n");
            for (String s : suggestions) sb.append("- ").append(s).append('\n');
        }
        sb.append("\nFiles to correct:\n");
        for (FileCorrection c : corrections) {
            if (c.create()) {
                sb.append("\n").append(c.path()).append(" (missing, create it as a new file)\n");
            } else {
                appendFile(sb, c.path(), c.currentContent());
            }
        }
        return sb.toString();
    }

    private static void appendFile(StringBuilder sb, String path, String content) {
        sb.append("\n```").append(path).append('\n').append(content).append("\n```\n");
    }

    // ------------------------------------------------------------------
    // Prompt text  ({{PACKAGES}} is replaced per call)
    // ------------------------------------------------------------------

    private static final String GENERATE_PROMPT = """
            You write small React single-page apps that run on Vite.

            PROJECT:
              my-app/ is already scaffolded with package.json, index.html, vite.config.js,
              src/main.jsx (renders <App /> from ./App.jsx) and src/index.css.
              Tailwind is loaded from a CDN; style with className utilities only.

            RULES:
              - src/App.jsx must default-export the root component.
              - Put other components under src/components/, one default export per file.
              - Import React and every hook you use.
              - {{PACKAGES}}

            OUTPUT: a single JSON object and nothing else:
              {
                "files": [
                  { "path": "src/App.jsx", "content": "..." },
                  { "path": "src/components/Hero.jsx", "content": "..." }
                ]
              }
            Every file must be complete. Do not include package.json or main.jsx.
            """;

    private static final String CORRECTION_PROMPT = """
            You fix errors in a React + Vite app. Change only what the errors require.

            RULES:
              - Keep every default export and file path unless an error says otherwise.
              - Create every missing file that is imported.
              - {{PACKAGES}}

            OUTPUT: a single JSON object and nothing else:
              {
                "files_to_correct": [ { "path": "src/App.jsx", "corrected_content": "..." } ],
                "new_files":        [ { "path": "src/components/Hero.jsx", "content": "..." } ]
              }
            Every file must be complete.
            """;
}

package com.sitepilot.orchestrator.lifecycle;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Skeleton files written into a fresh sandbox. Styling comes from the
 * Tailwind CDN bootstrap injected into index.html, so the project needs no
 * PostCSS toolchain.
 */
final class ProjectTemplates {

    private ProjectTemplates() {}

    static final String TAILWIND_CDN = "https://cdn.tailwindcss.com";

    static final String TAILWIND_BOOTSTRAP = """
            <script>
              window.tailwind = window.tailwind || {};
              window.tailwind.config = { theme: { extend: {} }, darkMode: 'class', plugins: [] };
            </script>
            <script src="https://cdn.tailwindcss.com"></script>
            """;

    static final String PACKAGE_JSON = """
            {
              "name": "my-app",
              "private": true,
              "version": "0.0.0",
              "type": "module",
              "scripts": {
                "dev": "vite",
                "build": "vite build",
                "preview": "vite preview"
              },
              "dependencies": {
                "react": "^18.3.1",
                "react-dom": "^18.3.1"
              },
              "devDependencies": {
                "@vitejs/plugin-react": "^4.3.4",
                "vite": "^5.4.11"
              }
            }
            """;

    static final String INDEX_HTML = """
            <!doctype html>
            <html lang="en">
              <head>
                <meta charset="UTF-8" />
                <meta name="viewport" content="width=device-width, initial-scale=1.0" />
                <title>App</title>
                %s
              </head>
              <body>
                <div id="root"></div>
                <script type="module" src="/src/main.jsx"></script>
              </body>
            </html>
            """.formatted(TAILWIND_BOOTSTRAP.strip().replace("\n", "\n    "));

    static final String MAIN_JSX = """
            import React from 'react';
            import ReactDOM from 'react-dom/client';
            import App from './App.jsx';
            import './index.css';

            ReactDOM.createRoot(document.getElementById('root')).render(
              <React.StrictMode>
                <App />
              </React.StrictMode>,
            );
            """;

    static final String APP_JSX = """
            import React from 'react';

            function App() {
              return (
                <div className="min-h-screen flex items-center justify-center">
                  <p className="text-gray-500">Building your app...</p>
                </div>
              );
            }

            export default App;
            """;

    static final String INDEX_CSS = """
            @tailwind base;
            @tailwind components;
            @tailwind utilities;
            """;

    private static final String VITE_CONFIG = """
            import { defineConfig } from 'vite'
            import react from '@vitejs/plugin-react'

            export default defineConfig({
              plugins: [react()],
              server: {
                host: '0.0.0.0',
                port: %d,
                strictPort: true,
                allowedHosts: ['%s', 'localhost', '127.0.0.1'],
                hmr: false
              },
              preview: {
                host: '0.0.0.0',
                port: %d,
                strictPort: true,
                allowedHosts: ['%s', 'localhost', '127.0.0.1']
              }
            })
            """;

    private static final List<String> TAILWIND_DIRECTIVES =
            List.of("@tailwind base;", "@tailwind components;", "@tailwind utilities;");

    private static final Pattern APP_IMPORT =
            Pattern.compile("import\\s+App\\s+from\\s+[\"']\\./App(\\.jsx)?[\"'];?");

    private static final Pattern STYLESHEET_IMPORT =
            Pattern.compile("import\\s+[\"']\\./index\\.css[\"']");

    /** Stylesheet with the three Tailwind directives at the top. */
    static String withTailwindDirectives(String css) {
        if (css == null || css.isBlank()) {
            return INDEX_CSS;
        }
        StringBuilder missing = new StringBuilder();
        for (String directive : TAILWIND_DIRECTIVES) {
            if (!css.contains(directive)) {
                missing.append(directive).append('\n');
            }
        }
        return missing.length() == 0 ? css : missing + css;
    }

    /**
     * Entry point importing the base stylesheet right after the root
     * component. Left alone when missing or when it does not import App.
     */
    static String withStylesheetImport(String main) {
        if (main == null || STYLESHEET_IMPORT.matcher(main).find()) {
            return main;
        }
        Matcher app = APP_IMPORT.matcher(main);
        if (!app.find()) {
            return main;
        }
        return main.substring(0, app.end()) + "\nimport './index.css';" + main.substring(app.end());
    }

    /** index.html loading the Tailwind CDN before {@code </head>}. */
    static String withTailwindBootstrap(String html) {
        if (html == null || html.isBlank()) {
            return INDEX_HTML;
        }
        if (html.contains(TAILWIND_CDN)) {
            return html;
        }
        int head = html.indexOf("</head>");
        if (head < 0) {
            return html;
        }
        return html.substring(0, head) + TAILWIND_BOOTSTRAP + html.substring(head);
    }

    static String viteConfig(String publicHost, int port) {
        return VITE_CONFIG.formatted(port, publicHost, port, publicHost);
    }

    /** Project-relative path -> content, in write order. */
    static Map<String, String> skeleton(String publicHost, int port) {
        Map<String, String> files = new LinkedHashMap<>();
        files.put(ProjectLayout.MANIFEST, PACKAGE_JSON);
        files.put(ProjectLayout.INDEX_HTML, INDEX_HTML);
        files.put(ProjectLayout.VITE_CONFIG, viteConfig(publicHost, port));
        files.put(ProjectLayout.ENTRY_POINT, MAIN_JSX);
        files.put(ProjectLayout.ROOT_COMPONENT, APP_JSX);
        files.put(ProjectLayout.BASE_STYLES, INDEX_CSS);
        return files;
    }
}

package com.sitepilot.orchestrator.validation;

import com.sitepilot.orchestrator.config.TestProperties;
import com.sitepilot.orchestrator.lifecycle.ProjectSnapshotter;
import com.sitepilot.orchestrator.sandbox.FakeEnvironmentHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.sitepilot.orchestrator.sandbox.FakeEnvironmentHandle.fail;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * ValidationEngine with the real validators over an in-memory sandbox.
 */
class ValidationEngineTest {

    static final String MAIN = """
            import React from 'react';
            import ReactDOM from 'react-dom/client';
            import App from './App.jsx';
            import './index.css';
            ReactDOM.createRoot(document.getElementById('root')).render(<App />);
            """;

    static final String APP = """
            import React from 'react';
            import Hero from './components/Hero';
            export default function App() {
              return <main className="min-h-screen"><Hero /></main>;
            }
            """;

    static final String HERO = """
            import React from 'react';
            export default function Hero() {
              return <h1 className="text-4xl">Welcome</h1>;
            }
            """;

    ValidationEngine      engine;
    FakeEnvironmentHandle handle;

    @BeforeEach
    void setUp() {
        engine = new ValidationEngine(new StructuralValidator(), new BuildLogParser(),
                new ProjectSnapshotter(TestProperties.fast()));
        handle = new FakeEnvironmentHandle("h")
                .withFile("my-app/package.json", "{}")
                .withFile("my-app/src/main.jsx", MAIN)
                .withFile("my-app/src/App.jsx", APP)
                .withFile("my-app/src/components/Hero.jsx", HERO)
                .withFile("my-app/src/index.css", "@tailwind base;\n");
    }

    @Test
    void validate_healthyProject_cleanWithContents() {
        ValidationReport report = engine.validate(handle, "https://5173-h.sandbox.test");

        assertThat(report.isClean()).isTrue();
        assertThat(report.fileContents())
                .containsKeys("src/App.jsx", "src/main.jsx", "src/components/Hero.jsx", "src/index.css");
    }

    @Test
    void validate_noServerUrl_criticalUnreachable() {
        ValidationReport report = engine.validate(handle, null);

        assertThat(report.errors()).extracting(ValidationError::kind)
                .containsExactly(ErrorKind.SERVER_UNREACHABLE);
        assertThat(report.errors().get(0).severity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void validate_missingRootComponent_criticalMissingFile() {
        handle.files().remove("my-app/src/App.jsx");

        ValidationReport report = engine.validate(handle, "https://x");

        assertThat(report.errors()).anySatisfy(e -> {
            assertThat(e.kind()).isEqualTo(ErrorKind.MISSING_FILE);
            assertThat(e.file()).isEqualTo("src/App.jsx");
        });
    }

    @Test
    void validate_emptyStylesheet_mediumMissingStyles() {
        handle.files().put("my-app/src/index.css", "  \n");

        ValidationReport report = engine.validate(handle, "https://x");

        assertThat(report.errors()).singleElement().satisfies(e -> {
            assertThat(e.kind()).isEqualTo(ErrorKind.MISSING_STYLES);
            assertThat(e.severity()).isEqualTo(Severity.MEDIUM);
        });
        assertThat(report.isClean()).isFalse();
    }

    @Test
    void validate_devLogErrors_included() {
        handle.files().put("my-app/dev.log",
                "my-app/src/components/Hero.jsx:3:10: ERROR: Unexpected \"<\"\n");

        ValidationReport report = engine.validate(handle, "https://x");

        assertThat(report.errors()).extracting(ValidationError::file)
                .containsExactly("src/components/Hero.jsx");
    }

    @Test
    void validate_listingFails_fileAccessErrorAndRootStillChecked() {
        handle.on("find ", fail("find: permission denied"));
        handle.files().put("my-app/src/App.jsx", "export const x = 1;\n");

        ValidationReport report = engine.validate(handle, "https://x");

        assertThat(report.errors()).extracting(ValidationError::kind)
                .containsExactly(ErrorKind.FILE_ACCESS, ErrorKind.INVALID_COMPONENT);
    }
}

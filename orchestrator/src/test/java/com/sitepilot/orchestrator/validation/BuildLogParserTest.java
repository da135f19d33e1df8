package com.sitepilot.orchestrator.validation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BuildLogParserTest {

    final BuildLogParser parser = new BuildLogParser();

    @Test
    void parse_blankLog_noErrors() {
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    void parse_esbuildError_locatedCriticalBuildError() {
        String log = "✘ [ERROR] my-app/src/App.jsx:12:4: ERROR: Expected identifier but found end of file\n";

        List<ValidationError> errors = parser.parse(log);

        assertThat(errors).hasSize(1);
        ValidationError e = errors.get(0);
        assertThat(e.kind()).isEqualTo(ErrorKind.BUILD_ERROR);
        assertThat(e.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(e.file()).isEqualTo("src/App.jsx");
        assertThat(e.line()).isEqualTo(12);
        assertThat(e.column()).isEqualTo(4);
    }

    @Test
    void parse_unresolvedImportAfterLocation_attributedAndDeduplicated() {
        String log = """
                10:02:11 AM [vite] Pre-transform error
                  File: /home/user/my-app/src/components/Header.jsx:3:19
                [plugin:vite:import-analysis] Failed to resolve import "./Logo" from "src/components/Header.jsx". Does the file exist?
                  File: /home/user/my-app/src/components/Header.jsx:3:19
                [plugin:vite:import-analysis] Failed to resolve import "./Logo" from "src/components/Header.jsx". Does the file exist?
                """;

        List<ValidationError> errors = parser.parse(log);

        assertThat(errors).hasSize(1);
        ValidationError e = errors.get(0);
        assertThat(e.kind()).isEqualTo(ErrorKind.UNRESOLVED_IMPORT);
        assertThat(e.category()).isEqualTo(ErrorCategory.DEPENDENCY);
        assertThat(e.file()).isEqualTo("src/components/Header.jsx");
        assertThat(e.line()).isEqualTo(3);
        assertThat(e.module()).isEqualTo("./Logo");
        assertThat(e.missingComponentPath()).isEqualTo("src/components/Logo.jsx");
    }

    @Test
    void parse_unresolvedImportWithoutLocation_defaultsToRootComponent() {
        String log = "[plugin:vite:import-analysis] Failed to resolve import \"./components/Hero\"\n";

        ValidationError e = parser.parse(log).get(0);

        assertThat(e.file()).isEqualTo("src/App.jsx");
        assertThat(e.line()).isZero();
        assertThat(e.missingComponentPath()).isEqualTo("src/components/Hero.jsx");
    }

    @Test
    void parse_unresolvedPackage_hasNoMissingComponentPath() {
        String log = "Failed to resolve import \"framer-motion\" from \"src/App.jsx\"\n";

        ValidationError e = parser.parse(log).get(0);

        assertThat(e.module()).isEqualTo("framer-motion");
        assertThat(e.missingComponentPath()).isNull();
    }

    @Test
    void parse_transformBannerAlone_singleUnlocatedBuildError() {
        List<ValidationError> errors = parser.parse("[plugin:vite:esbuild] Transform failed with 1 error\n");

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).kind()).isEqualTo(ErrorKind.BUILD_ERROR);
        assertThat(errors.get(0).hasLocation()).isFalse();
    }

    @Test
    void parse_transformBannerWithLocatedError_bannerSuppressed() {
        String log = """
                [plugin:vite:esbuild] Transform failed with 1 error:
                my-app/src/App.jsx:5:2: ERROR: Expected ";" but found "return"
                """;

        assertThat(parser.parse(log)).extracting(ValidationError::file).containsExactly("src/App.jsx");
    }

    @Test
    void parse_referenceError_namesSymbol() {
        List<ValidationError> errors = parser.parse("Uncaught ReferenceError: 'Hero' is not defined\n");

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).kind()).isEqualTo(ErrorKind.UNDEFINED_SYMBOL);
        assertThat(errors.get(0).message()).contains("Hero");
    }

    @Test
    void missingComponentPath_resolvesAgainstImporterDirectory() {
        assertThat(BuildLogParser.missingComponentPath("src/App.jsx", "./components/Hero"))
                .isEqualTo("src/components/Hero.jsx");
        assertThat(BuildLogParser.missingComponentPath("src/components/Header.jsx", "../utils/x"))
                .isEqualTo("src/utils/x.jsx");
        assertThat(BuildLogParser.missingComponentPath("src/pages/Home.jsx", "components/Nav.js"))
                .isEqualTo("src/components/Nav.js");
    }

    @Test
    void missingComponentPath_specifierWithExtension_keptAsIs() {
        assertThat(BuildLogParser.missingComponentPath("src/App.jsx", "./App.css"))
                .isEqualTo("src/App.css");
        assertThat(BuildLogParser.missingComponentPath("src/components/Hero.jsx", "../assets/logo.svg"))
                .isEqualTo("src/assets/logo.svg");
        assertThat(BuildLogParser.missingComponentPath("src/App.jsx", "./components/Card.jsx"))
                .isEqualTo("src/components/Card.jsx");
    }

    @Test
    void missingComponentPath_outsideSourceOrBarePackage_null() {
        assertThat(BuildLogParser.missingComponentPath("src/App.jsx", "../../secrets")).isNull();
        assertThat(BuildLogParser.missingComponentPath("src/App.jsx", "../index.html")).isNull();
        assertThat(BuildLogParser.missingComponentPath("src/App.jsx", "react-icons/fa")).isNull();
    }
}

package com.sitepilot.orchestrator.apply;

import com.sitepilot.orchestrator.sandbox.FakeEnvironmentHandle;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CriticalFileBackupTest {

    @Test
    void capture_includesCriticalFilesAndTouchedPaths() {
        FakeEnvironmentHandle handle = new FakeEnvironmentHandle("h")
                .withFile("my-app/src/App.jsx", "app");

        CriticalFileBackup backup = CriticalFileBackup.capture(handle,
                List.of("src/components/Hero.jsx"), Duration.ofSeconds(1));

        assertThat(backup.paths()).containsExactly("package.json", "src/main.jsx", "src/App.jsx",
                "src/index.css", "src/components/Hero.jsx");
        assertThat(backup.wasPresent("src/App.jsx")).isTrue();
        assertThat(backup.wasPresent("src/components/Hero.jsx")).isFalse();
    }

    @Test
    void restoreAll_rewritesPresentAndDeletesAbsent() {
        FakeEnvironmentHandle handle = new FakeEnvironmentHandle("h")
                .withFile("my-app/src/App.jsx", "app");
        CriticalFileBackup backup = CriticalFileBackup.capture(handle,
                List.of("src/components/Hero.jsx"), Duration.ofSeconds(1));
        handle.files().put("my-app/src/App.jsx", "broken");
        handle.files().put("my-app/src/components/Hero.jsx", "new");

        List<String> failed = backup.restoreAll();

        assertThat(failed).isEmpty();
        assertThat(handle.files())
                .containsEntry("my-app/src/App.jsx", "app")
                .doesNotContainKey("my-app/src/components/Hero.jsx");
    }

    @Test
    void restoreAll_reportsPathsThatCouldNotBeRestored() {
        FakeEnvironmentHandle handle = new FakeEnvironmentHandle("h")
                .withFile("my-app/src/App.jsx", "app")
                .failWritesTo("my-app/src/App.jsx");
        CriticalFileBackup backup = CriticalFileBackup.capture(handle, List.of(), Duration.ofSeconds(1));

        assertThat(backup.restoreAll()).containsExactly("src/App.jsx");
    }

    @Test
    void discard_makesRestoreANoOp() {
        FakeEnvironmentHandle handle = new FakeEnvironmentHandle("h")
                .withFile("my-app/src/App.jsx", "app");
        CriticalFileBackup backup = CriticalFileBackup.capture(handle, List.of(), Duration.ofSeconds(1));
        handle.files().put("my-app/src/App.jsx", "accepted");

        backup.discard();
        backup.restoreAll();

        assertThat(handle.files()).containsEntry("my-app/src/App.jsx", "accepted");
    }
}

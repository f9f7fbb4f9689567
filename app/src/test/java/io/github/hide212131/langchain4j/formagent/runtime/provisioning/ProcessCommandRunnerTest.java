package io.github.hide212131.langchain4j.formagent.runtime.provisioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.formagent.runtime.agent.ResourceAcquisitionException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

class ProcessCommandRunnerTest {

    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @Test
    @DisplayName("起動できないコマンドは論理名付きの ResourceAcquisitionException")
    void missingExecutableFails() {
        assertThatThrownBy(() -> runner.run(List.of("form-agent-no-such-binary-for-test"), "docker version",
                Duration.ofSeconds(5)))
                .isInstanceOf(ResourceAcquisitionException.class)
                .hasMessageContaining("docker version");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("終了コードと stdout / stderr をそのまま返す")
    void capturesExitCodeAndBothStreams() {
        ProcessResult result = runner.run(List.of("sh", "-c", "echo started; echo denied >&2; exit 3"),
                "docker run", Duration.ofSeconds(10));

        assertThat(result.command()).isEqualTo("docker run");
        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stdout()).isEqualTo("started\n");
        assertThat(result.stderr()).isEqualTo("denied\n");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("期限を過ぎたプロセスは強制終了され ResourceAcquisitionException")
    void killsProcessPastDeadline() {
        long startedAt = System.nanoTime();

        assertThatThrownBy(() -> runner.run(List.of("sleep", "30"), "docker run", Duration.ofMillis(200)))
                .isInstanceOf(ResourceAcquisitionException.class)
                .hasMessageContaining("docker run")
                .hasMessageContaining("200 ms");
        assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(10));
    }
}

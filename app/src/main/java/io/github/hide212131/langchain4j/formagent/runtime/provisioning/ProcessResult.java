package io.github.hide212131.langchain4j.formagent.runtime.provisioning;

import java.util.Objects;

record ProcessResult(String command, int exitCode, String stdout, String stderr, long elapsedMs) {

    ProcessResult {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(stdout, "stdout");
        Objects.requireNonNull(stderr, "stderr");
    }
}

package io.github.hide212131.langchain4j.formagent.app;

final class ExitCodes {

    static final int VALIDATION_FAILED = 2;
    static final int RUN_FAILED = 3;
    static final int CONFIGURATION_ERROR = 4;
    static final int SCHEMA_ERROR = 5;

    private ExitCodes() {
    }
}

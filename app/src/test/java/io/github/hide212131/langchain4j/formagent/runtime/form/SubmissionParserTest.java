package io.github.hide212131.langchain4j.formagent.runtime.form;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SubmissionParserTest {

    private final SubmissionParser parser = new SubmissionParser();

    @Test
    @DisplayName("data オブジェクトを値ツリーとして読み込む")
    void readsDataObject() {
        Map<String, Object> data = parser.parse("""
                {"data": {"name": "Alice", "agree": true, "members": [{"email": "a@example.com"}]}}
                """);

        assertThat(data).containsEntry("name", "Alice").containsEntry("agree", true);
        assertThat(data.get("members")).isEqualTo(List.of(Map.of("email", "a@example.com")));
    }

    @Test
    @DisplayName("data が無い・オブジェクトでない場合は Form data is required")
    void requiresDataObject() {
        assertThatThrownBy(() -> parser.parse("{}"))
                .isInstanceOf(SubmissionFormatException.class)
                .hasMessage("Form data is required");
        assertThatThrownBy(() -> parser.parse("{\"data\": [1, 2]}"))
                .isInstanceOf(SubmissionFormatException.class)
                .hasMessage("Form data is required");
        assertThatThrownBy(() -> parser.parse(""))
                .isInstanceOf(SubmissionFormatException.class)
                .hasMessage("Form data is required");
    }

    @Test
    @DisplayName("不正な JSON は Submission is not valid JSON")
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> parser.parse("{\"data\": "))
                .isInstanceOf(SubmissionFormatException.class)
                .hasMessage("Submission is not valid JSON");
    }
}

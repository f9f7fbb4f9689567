package io.github.hide212131.langchain4j.formagent.runtime.form;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@SuppressWarnings("PMD.JUnitTestContainsTooManyAsserts")
class FormSchemaParserTest {

    private final FormSchemaParser parser = new FormSchemaParser();

    @Test
    @DisplayName("JSON のフォーム定義を order 順のフィールドへ正規化する")
    void parsesAndSortsByOrder() throws IOException {
        FormDefinition form = parser.parse(Files.readString(Path.of("src/test/resources/forms/family.json"),
                StandardCharsets.UTF_8));

        assertThat(form.formId()).isEqualTo("family-registration");
        assertThat(form.title()).isEqualTo("Family registration");
        assertThat(form.fields()).extracting(FieldDefinition::id)
                .containsExactly("name", "birthdate", "plan", "members");
        assertThat(form.fields()).extracting(FieldDefinition::kind)
                .containsExactly(FieldKind.TEXT, FieldKind.DATE, FieldKind.CHOICE, FieldKind.GROUP);

        ScalarField plan = (ScalarField) form.fields().get(2);
        assertThat(plan.options()).containsExactly(new ChoiceOption("basic", "Basic"), new ChoiceOption("pro", "Pro"));
        assertThat(plan.required()).isFalse();

        GroupField members = (GroupField) form.fields().get(3);
        assertThat(members.required()).isTrue();
        assertThat(members.children()).extracting(ScalarField::id)
                .containsExactly("memberName", "relationship", "dependent");
        assertThat(members.children().get(2).kind()).isEqualTo(FieldKind.BOOLEAN);
    }

    @Test
    @DisplayName("required 省略時は false、order 省略時は位置 + 1")
    void appliesDefaults() {
        FormDefinition form = parser.parse("""
                {"formId": "f", "fields": [
                  {"id": "b", "type": "text", "label": "B"},
                  {"id": "a", "type": "checkbox", "label": "A", "required": "true"}
                ]}
                """);

        assertThat(form.title()).isNull();
        assertThat(form.fields()).extracting(FieldDefinition::order).containsExactly(1, 2);
        assertThat(form.fields()).extracting(FieldDefinition::required).containsExactly(false, true);
    }

    @Test
    @DisplayName("formId や fields が無い定義は構造エラー")
    void rejectsMissingFormIdOrFields() {
        assertThatThrownBy(() -> parser.parse("{\"fields\": []}"))
                .isInstanceOf(FormSchemaException.class)
                .hasMessage("Invalid form data structure: formId and fields are required");
        assertThatThrownBy(() -> parser.parse("{\"formId\": \"x\", \"fields\": {}}"))
                .isInstanceOf(FormSchemaException.class)
                .hasMessage("Invalid form data structure: formId and fields are required");
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(FormSchemaException.class)
                .hasMessage("Form definition is empty");
        assertThatThrownBy(() -> parser.parse("{not json"))
                .isInstanceOf(FormSchemaException.class)
                .hasMessageStartingWith("Form definition is not valid JSON");
    }

    @Test
    @DisplayName("id / type / label が欠けたフィールドや未知の type を拒否する")
    void rejectsInvalidFields() {
        assertThatThrownBy(() -> parser.parse(
                Map.of("formId", "f", "fields", List.of(Map.of("id", "a", "type", "text")))))
                .isInstanceOf(FormSchemaException.class)
                .hasMessage("Invalid field at index 0: missing id, type, or label");
        assertThatThrownBy(() -> parser.parse(
                Map.of("formId", "f", "fields", List.of(Map.of("id", "a", "type", "slider", "label", "A")))))
                .isInstanceOf(FormSchemaException.class)
                .hasMessage("Invalid field type: slider");
    }

    @Test
    @DisplayName("dynamic フィールドは fields 配列が必須で、入れ子の dynamic は不可")
    void validatesDynamicFields() {
        assertThatThrownBy(() -> parser.parse(
                Map.of("formId", "f", "fields", List.of(Map.of("id", "g", "type", "dynamic", "label", "G")))))
                .isInstanceOf(FormSchemaException.class)
                .hasMessage("Dynamic field \"g\" must have a \"fields\" array");
        assertThatThrownBy(() -> parser.parse(Map.of("formId", "f", "fields", List.of(Map.of("id", "g", "type",
                "dynamic", "label", "G", "fields", List.of(Map.of("id", "x", "type", "dynamic", "label", "X",
                        "fields", List.of())))))))
                .isInstanceOf(FormSchemaException.class)
                .hasMessage("Invalid nested field type in dynamic field \"g\": dynamic");
        assertThatThrownBy(() -> parser.parse(Map.of("formId", "f", "fields", List.of(Map.of("id", "g", "type",
                "dynamic", "label", "G", "fields", List.of(Map.of("id", "x")))))))
                .isInstanceOf(FormSchemaException.class)
                .hasMessage("Invalid nested field in dynamic field \"g\": missing id, type, or label");
    }

    @Test
    @DisplayName("フィールド ID の重複を拒否する")
    void rejectsDuplicateIds() {
        assertThatThrownBy(() -> parser.parse(Map.of("formId", "f", "fields", List.of(
                Map.of("id", "a", "type", "text", "label", "A"),
                Map.of("id", "a", "type", "date", "label", "A2")))))
                .isInstanceOf(FormSchemaException.class)
                .hasMessageContaining("Duplicate field id \"a\"");
    }

    @Test
    @DisplayName("dropdown の options は value を持つオブジェクトの配列")
    void rejectsMalformedOptions() {
        assertThatThrownBy(() -> parser.parse(Map.of("formId", "f", "fields", List.of(
                Map.of("id", "p", "type", "dropdown", "label", "P", "options", "basic,pro")))))
                .isInstanceOf(FormSchemaException.class)
                .hasMessage("Field \"p\" options must be an array");
        assertThatThrownBy(() -> parser.parse(Map.of("formId", "f", "fields", List.of(
                Map.of("id", "p", "type", "dropdown", "label", "P", "options", List.of(Map.of("label", "x")))))))
                .isInstanceOf(FormSchemaException.class)
                .hasMessage("Field \"p\" has an option without a value");
    }

    @Test
    @DisplayName("dropdown の options 省略と空配列は区別され、空配列はすべての値を拒否する")
    void distinguishesAbsentOptionsFromEmptyOptions() {
        FormDefinition form = parser.parse(Map.of("formId", "f", "fields", List.of(
                Map.of("id", "country", "type", "dropdown", "label", "Country", "options", List.of()),
                Map.of("id", "city", "type", "dropdown", "label", "City"))));
        SubmissionValidator validator = new SubmissionValidator();

        ValidationResult result = validator.validate(form.fields(), Map.of("country", "anything", "city", "Kyoto"));

        assertThat(((ScalarField) form.fields().get(0)).options()).isEmpty();
        assertThat(((ScalarField) form.fields().get(1)).options()).isNull();
        assertThat(result.messages()).containsExactly("country: Country must be one of the allowed options");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> fields = (List<Map<String, Object>>) parser.toWire(form).get("fields");
        assertThat(fields.get(0)).containsEntry("options", List.of());
        assertThat(fields.get(1)).doesNotContainKey("options");
    }

    @Test
    @DisplayName("toWire は dropdown だけに options、dynamic だけに fields を出力する")
    void writesWireFormat() {
        FormDefinition form = new FormDefinition("f", null, List.of(
                ScalarField.of("name", FieldKind.TEXT, "Name", true),
                ScalarField.choice("plan", "Plan", false, List.of(new ChoiceOption("basic", null))),
                GroupField.of("members", "Members", false,
                        List.of(ScalarField.of("email", FieldKind.TEXT, "Email", true)))));

        Map<String, Object> wire = parser.toWire(form);

        assertThat(wire).containsOnlyKeys("formId", "fields");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> fields = (List<Map<String, Object>>) wire.get("fields");
        assertThat(fields.get(0)).containsOnlyKeys("id", "type", "label", "required", "order");
        assertThat(fields.get(1)).containsEntry("type", "dropdown")
                .containsEntry("options", List.of(Map.of("value", "basic", "label", "basic")));
        assertThat(fields.get(2)).containsEntry("type", "dynamic")
                .containsEntry("fields", List.of(Map.of("id", "email", "type", "text", "label", "Email",
                        "required", true)));
    }

    @Test
    @DisplayName("toJson の出力は再度 parse できる")
    void jsonOutputParsesBack() throws IOException {
        FormDefinition original = parser.parse(Files.readString(Path.of("src/test/resources/forms/family.json"),
                StandardCharsets.UTF_8));

        assertThat(parser.parse(parser.toJson(original))).isEqualTo(original);
    }
}

package io.github.hide212131.langchain4j.formagent.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.hide212131.langchain4j.formagent.runtime.form.FormDefinition;
import io.github.hide212131.langchain4j.formagent.runtime.form.FormDefinitionLoader;
import io.github.hide212131.langchain4j.formagent.runtime.form.FormSchemaException;
import io.github.hide212131.langchain4j.formagent.runtime.form.FormSchemaParser;
import io.github.hide212131.langchain4j.formagent.runtime.form.SubmissionFormatException;
import io.github.hide212131.langchain4j.formagent.runtime.form.SubmissionParser;
import io.github.hide212131.langchain4j.formagent.runtime.form.SubmissionValidator;
import io.github.hide212131.langchain4j.formagent.runtime.form.ValidationError;
import io.github.hide212131.langchain4j.formagent.runtime.form.ValidationResult;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * 投稿データをフォーム定義に照らして検証するコマンド (validate).
 *
 * <p>
 * 受理された値を JSON で標準出力へ書き出す。検証エラーは {@code path: message} 形式で標準エラーへ 1 行ずつ出力する。
 * </p>
 */
@Command(name = "validate", description = "投稿データをフォーム定義で検証します。", mixinStandardHelpOptions = true)
final class ValidateCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--form", required = true, paramLabel = "FILE", description = "フォーム定義ファイル (.json / .yaml)")
    private Path formPath;

    @Option(names = "--submission", required = true, paramLabel = "FILE", description = "投稿データ JSON ({\"data\": {...}})")
    private Path submissionPath;

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        FormDefinition form;
        try {
            form = new FormDefinitionLoader(new FormSchemaParser()).load(formPath);
        } catch (FormSchemaException ex) {
            err.println("フォーム定義が不正です: " + ex.getMessage());
            err.flush();
            return ExitCodes.SCHEMA_ERROR;
        } catch (IllegalStateException ex) {
            err.println(ex.getMessage());
            err.flush();
            return ExitCodes.CONFIGURATION_ERROR;
        }

        Map<String, Object> data;
        try {
            data = new SubmissionParser().parse(Files.readString(submissionPath, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            err.println("投稿データを読み込めません: " + submissionPath);
            err.flush();
            return ExitCodes.CONFIGURATION_ERROR;
        } catch (SubmissionFormatException ex) {
            err.println(ex.getMessage());
            err.flush();
            return ExitCodes.VALIDATION_FAILED;
        }

        ValidationResult result = new SubmissionValidator().validate(form, data);
        if (!result.isValid()) {
            err.println("Validation failed");
            for (ValidationError error : result.errors()) {
                err.println(error);
            }
            err.flush();
            return ExitCodes.VALIDATION_FAILED;
        }
        try {
            out.println(objectMapper.writeValueAsString(result.acceptedValues()));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("受理データを JSON へ変換できません", ex);
        }
        out.flush();
        return CommandLine.ExitCode.OK;
    }
}

package io.github.hide212131.langchain4j.formagent.runtime.generation;

import io.github.hide212131.langchain4j.formagent.runtime.agent.AgentRunner;
import io.github.hide212131.langchain4j.formagent.runtime.agent.TaskDefinition;
import io.github.hide212131.langchain4j.formagent.runtime.agent.TaskInput;
import io.github.hide212131.langchain4j.formagent.runtime.agent.TaskOutput;
import io.github.hide212131.langchain4j.formagent.runtime.form.AgentResponseJsonExtractor;
import io.github.hide212131.langchain4j.formagent.runtime.form.FormDefinition;
import io.github.hide212131.langchain4j.formagent.runtime.form.FormSchemaParser;
import java.util.Objects;

/**
 * Generates a normalised form definition from a free-text description by running the form generator agent and
 * parsing its reply.
 */
public final class FormGenerationService {

    private final AgentRunner.Agent agent;
    private final FormSchemaParser parser;

    public FormGenerationService(AgentRunner runner, FormSchemaParser parser) {
        this(runner, FormGeneratorAgent.definition(), parser);
    }

    FormGenerationService(AgentRunner runner, TaskDefinition definition, FormSchemaParser parser) {
        this.agent = Objects.requireNonNull(runner, "runner").agent(definition);
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * @throws IllegalArgumentException when the description is blank
     * @throws io.github.hide212131.langchain4j.formagent.runtime.form.FormSchemaException when the reply holds
     *         no usable form definition
     */
    public GeneratedForm generate(String description) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Description is required");
        }
        TaskOutput output = agent.run(TaskInput.of(description));
        FormDefinition form = parser.parse(AgentResponseJsonExtractor.extract(output.text()));
        return new GeneratedForm(form, output.metadata());
    }
}

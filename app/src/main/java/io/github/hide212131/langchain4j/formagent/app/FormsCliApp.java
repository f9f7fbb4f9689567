package io.github.hide212131.langchain4j.formagent.app;

import io.github.hide212131.langchain4j.formagent.runtime.config.EnvironmentResolver;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Entry point that wires PicoCLI with the form agent runtime.
 */
@Command(name = "forms", mixinStandardHelpOptions = true, description = "Generate form definitions and validate submissions")
public final class FormsCliApp implements Runnable {

    public static void main(String[] args) {
        int exitCode = commandLineInstance(EnvironmentResolver.system()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static CommandLine commandLineInstance(EnvironmentResolver environment) {
        CommandLine cmd = new CommandLine(new FormsCliApp());
        cmd.addSubcommand("generate", new GenerateCommand(environment));
        cmd.addSubcommand("validate", new ValidateCommand());
        return cmd;
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }
}

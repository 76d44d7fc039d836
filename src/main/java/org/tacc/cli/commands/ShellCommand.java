package org.tacc.cli.commands;

import com.typesafe.config.Config;
import org.tacc.cli.CommandLineInterface;
import org.tacc.cli.shell.CompilerSession;
import org.tacc.cli.shell.InteractiveShell;
import org.tacc.cli.shell.SampleCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command starting the interactive compiler shell on standard input.
 */
@Command(
    name = "shell",
    mixinStandardHelpOptions = true,
    description = "Start an interactive session: compile programs, define variables, browse samples and history"
)
public class ShellCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ShellCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    /** Replaced by tests. */
    InputStream input = System.in;

    @Override
    public Integer call() throws IOException {
        Config config = parent.getConfig();
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        InteractiveShell shell;
        try {
            shell = new InteractiveShell(CompilerSession.fromConfig(config), new SampleCatalog(), reader,
                    spec.commandLine().getOut(), config.getInt("tacc.shell.preview-length"));
        } catch (IllegalArgumentException e) {
            log.error("Invalid shell configuration: {}", e.getMessage());
            throw new ParameterException(spec.commandLine(), "Invalid shell configuration: " + e.getMessage(), e);
        }
        shell.run();
        return 0;
    }
}

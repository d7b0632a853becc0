package org.quarterlang.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.quarterlang.cli.commands.DebugCommand;
import org.quarterlang.cli.commands.EmitCommand;
import org.quarterlang.cli.commands.ReplCommand;
import org.quarterlang.cli.commands.RunCommand;
import org.quarterlang.cli.config.LoggingConfigurator;
import org.quarterlang.runtime.ExecutionMode;
import org.quarterlang.runtime.InterpreterOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "quarterlang",
    mixinStandardHelpOptions = true,
    version = "QuarterLang 1.0",
    description = "QuarterLang - lowers programs to a control-flow graph and runs them",
    subcommands = {
        RunCommand.class,
        DebugCommand.class,
        ReplCommand.class,
        EmitCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String CONFIG_FILE_NAME = "quarterlang.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: quarterlang.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("quarterlang");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        // Config load order: System Props > Env Vars > File > Classpath defaults
        final File fileToLoad;
        if (this.configFile != null) {
            logger.debug("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            fileToLoad = this.configFile;
        } else {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.exists()) {
                logger.debug("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                fileToLoad = cwdConfigFile;
            } else {
                logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                fileToLoad = null;
            }
        }

        final Config fileConfig = fileToLoad != null
                ? ConfigFactory.parseFile(fileToLoad, ConfigParseOptions.defaults().setAllowMissing(false))
                : ConfigFactory.empty();
        this.config = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * Loads the configuration on first use.
     *
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Reads the interpreter settings from the configuration.
     *
     * @param linear Forces {@link ExecutionMode#LINEAR} when true.
     * @return The interpreter settings.
     * @throws com.typesafe.config.ConfigException if a setting is invalid.
     */
    public InterpreterOptions interpreterOptions(boolean linear) {
        InterpreterOptions options = InterpreterOptions.fromConfig(getConfig());
        return linear ? options.withMode(ExecutionMode.LINEAR) : options;
    }
}

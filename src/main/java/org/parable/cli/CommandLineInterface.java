package org.parable.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.parable.cli.commands.DisassembleCommand;
import org.parable.cli.commands.RunMessageCommand;
import org.parable.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "parable",
    mixinStandardHelpOptions = true,
    version = "Parable 1.0",
    description = "Parable - message procedure interpreter for paged adventure text files",
    subcommands = {
        RunMessageCommand.class,
        DisassembleCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "parable.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: parable.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("parable");
        System.exit(commandLine.execute(args));
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        // Config load order: System Props > Env Vars > File > Classpath defaults
        final File source = resolveConfigFile(logger);
        Config fileConfig = ConfigFactory.empty();
        if (source != null) {
            fileConfig = ConfigFactory.parseFile(source);
        }
        this.config = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    private File resolveConfigFile(final Logger logger) {
        // 1) Highest precedence: explicit CLI option --config
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new ConfigException.Generic(
                    "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            return this.configFile;
        }

        // 2) Next: standard Typesafe Config system property -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new ConfigException.Generic(
                    "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile);
            }
            logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
            return systemConfigFile;
        }

        // 3) Then: parable.conf in the current working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return cwdConfigFile;
        }

        // 4) Finally: classpath defaults only
        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return null;
    }

    /**
     * Returns the effective configuration, loading it on first use.
     *
     * @return the resolved configuration
     * @throws ConfigException if a configuration file is missing or malformed
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}

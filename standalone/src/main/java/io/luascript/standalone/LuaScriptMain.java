package io.luascript.standalone;

import io.luascript.standalone.cli.CompileCommand;
import io.luascript.standalone.cli.LogbackConfigurator;
import io.luascript.standalone.config.CompilerConfig;
import io.luascript.standalone.config.ConfigLoadException;
import io.luascript.standalone.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code luascript} command.
 *
 * <p>Loads the configuration, sets up logging and runs {@link CompileCommand}. Usage errors and
 * configuration failures exit with status 2; compilation failures with status 1.
 */
public final class LuaScriptMain {

    private static final Logger LOG = LoggerFactory.getLogger(LuaScriptMain.class);

    static final int EXIT_USAGE = 2;

    static final String USAGE = "usage: luascript [--config file.yaml] [--emit-ir] [--out dir] <file.js>...";

    private LuaScriptMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs the command and returns the exit status instead of exiting. */
    static int run(String[] args) {
        CompileCommand.Arguments arguments;
        try {
            arguments = CompileCommand.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        CompilerConfig config;
        try {
            config = arguments.configPath() != null
                    ? ConfigLoader.load(arguments.configPath())
                    : ConfigLoader.resolve(new String[0], System::getenv);
        } catch (ConfigLoadException e) {
            LOG.error("Configuration failed: {}", e.getMessage(), e);
            return EXIT_USAGE;
        }
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        return new CompileCommand(config).run(arguments);
    }
}

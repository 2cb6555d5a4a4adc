/**
 *
 */
package org.theseed.metrics.cli;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for command processors.  The subclass specifies its default option values, validates
 * the parsed parameters, and runs the command.  The base class handles the help and debug-logging options and
 * converts failures into a FALSE return from the parse or a runtime exception from the run.
 *
 * The common command-line options are
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 */
public abstract class BaseProcessor implements ICommand {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true)
    private boolean help;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "display more frequent log messages")
    private boolean debug;

    @Override
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        CmdLineParser parser = new CmdLineParser(this);
        try {
            this.help = false;
            this.debug = false;
            this.setDefaults();
            parser.parseArgument(args);
            if (this.help) {
                parser.printUsage(System.err);
            } else {
                if (this.debug)
                    setDebugLogging();
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        } catch (IOException e) {
            System.err.println(e.getMessage());
        }
        return retVal;
    }

    /**
     * Raise the root logging level to DEBUG.
     */
    private static void setDebugLogging() {
        Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger)
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        log.debug("Debug logging enabled.");
    }

    @Override
    public void run() {
        try {
            long start = System.currentTimeMillis();
            this.runCommand();
            log.info("{} seconds to run command.", (System.currentTimeMillis() - start) / 1000.0);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Specify the default values for the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options and parameters.
     *
     * @return TRUE if the command should run, FALSE if it should be skipped
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Run the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}

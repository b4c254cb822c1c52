/**
 *
 */
package org.theseed.xrf.utils;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for a command processor.  The subclass declares its parameters using args4j
 * annotations, sets their defaults in {@link #setDefaults()}, checks them in {@link #validateParms()}, and
 * does the work in {@link #runCommand()}.
 *
 * Every command supports the following options.
 *
 * -h	display command-line usage
 * -v	display more detailed log messages
 *
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** start time of the command */
    private long startTime;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "--help", aliases = { "-h" }, help = true, usage = "display command-line usage")
    private boolean help;

    /** debug-message flag */
    @Option(name = "--verbose", aliases = { "-v", "--debug" }, usage = "display more detailed log messages")
    private boolean debug;

    /**
     * Parse the command-line parameters and validate them.
     *
     * @param args	command-line parameters
     *
     * @return TRUE if the command is ready to run, else FALSE
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help)
                parser.printUsage(System.err);
            else {
                if (this.debug) {
                    ch.qos.logback.classic.Logger root =
                            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
                    root.setLevel(Level.DEBUG);
                    log.debug("Debug logging enabled.");
                }
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
     * Execute the command.  A failure is logged and then rethrown as an unchecked exception.
     */
    public void run() {
        this.startTime = System.currentTimeMillis();
        try {
            this.runCommand();
            log.info("{} seconds to run command.", (System.currentTimeMillis() - this.startTime) / 1000.0);
        } catch (Exception e) {
            log.error("Command failed: {}", e.getMessage());
            throw new RuntimeException(e);
        }
    }

    /**
     * Set the parameter defaults.
     */
    protected abstract void setDefaults();

    /**
     * Validate the parameters after parsing.
     *
     * @return TRUE if the command can proceed, else FALSE
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Perform the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}

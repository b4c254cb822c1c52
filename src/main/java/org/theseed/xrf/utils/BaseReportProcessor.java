/**
 *
 */
package org.theseed.xrf.utils;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;

import org.kohsuke.args4j.Option;

/**
 * This is the base class for a command that writes a text report.  The report goes to the standard output
 * unless an output file is specified.
 *
 * -o	output file (if not STDOUT)
 *
 */
public abstract class BaseReportProcessor extends BaseProcessor {

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "--output", aliases = { "-o" }, metaVar = "report.tbl", usage = "output file (if not STDOUT)")
    private File outFile;

    @Override
    protected final void setDefaults() {
        this.outFile = null;
        this.setReporterDefaults();
    }

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        this.validateReporterParms();
        if (this.outFile == null)
            log.info("Report will be written to the standard output.");
        else
            log.info("Report will be written to {}.", this.outFile);
        return true;
    }

    @Override
    protected final void runCommand() throws Exception {
        OutputStream outStream = (this.outFile == null ? System.out : new FileOutputStream(this.outFile));
        PrintWriter writer = new PrintWriter(outStream);
        try {
            this.runReporter(writer);
        } finally {
            writer.flush();
            if (this.outFile != null)
                writer.close();
        }
    }

    /**
     * Set the defaults for the subclass parameters.
     */
    protected abstract void setReporterDefaults();

    /**
     * Validate the subclass parameters.
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract void validateReporterParms() throws IOException, ParseFailureException;

    /**
     * Produce the report.
     *
     * @param writer	output writer for the report
     *
     * @throws Exception
     */
    protected abstract void runReporter(PrintWriter writer) throws Exception;

}

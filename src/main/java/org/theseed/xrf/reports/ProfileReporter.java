/**
 *
 */
package org.theseed.xrf.reports;

import java.io.IOException;
import java.io.OutputStream;

/**
 * This is the base class for depth-profile reports.  The report has a header row followed by one row per
 * measurement, with the depth in the first column.
 *
 */
public abstract class ProfileReporter implements AutoCloseable {

    // FIELDS
    /** output stream */
    private OutputStream outStream;

    /**
     * This enum represents the different report types.
     */
    public static enum Type {
        TEXT {
            @Override
            public ProfileReporter create(OutputStream outStream) {
                return new TextProfileReporter(outStream);
            }

            @Override
            public boolean needsFile() {
                return false;
            }
        }, EXCEL {
            @Override
            public ProfileReporter create(OutputStream outStream) {
                return new ExcelProfileReporter(outStream);
            }

            @Override
            public boolean needsFile() {
                return true;
            }
        };

        /**
         * @return a reporting object of this type
         *
         * @param outStream	output stream for the report
         */
        public abstract ProfileReporter create(OutputStream outStream);

        /**
         * @return TRUE if this report type cannot be written to the standard output
         */
        public abstract boolean needsFile();
    }

    /**
     * Construct a profile report writer.
     *
     * @param outStream		output stream for the report
     */
    public ProfileReporter(OutputStream outStream) {
        this.outStream = outStream;
    }

    /**
     * Initialize the report for output.
     *
     * @param title		title of the report (usually the sample ID)
     */
    public abstract void openReport(String title);

    /**
     * Write the column headers.
     *
     * @param columns	array of column headers, in order
     */
    public abstract void writeHeaders(String[] columns);

    /**
     * Write a data row.  Missing values are written as blanks.
     *
     * @param depth		depth of the measurement
     * @param values	array of column values for the row
     */
    public abstract void writeRow(double depth, double[] values);

    /**
     * @return the output stream
     */
    protected OutputStream getOutStream() {
        return this.outStream;
    }

    /**
     * Finish the report.  The output stream is not closed.
     */
    protected abstract void cleanup() throws IOException;

    @Override
    public void close() throws IOException {
        this.cleanup();
        this.outStream.flush();
    }

}

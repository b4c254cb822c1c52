/**
 *
 */
package org.theseed.xrf.reports;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.stream.Collectors;
import java.util.stream.DoubleStream;

import org.apache.commons.lang3.StringUtils;

/**
 * This reporter writes the depth profile as a tab-delimited file, suitable for loading into a spreadsheet or a
 * plotting program.
 *
 */
public class TextProfileReporter extends ProfileReporter {

    // FIELDS
    /** output writer */
    private PrintWriter writer;

    public TextProfileReporter(OutputStream outStream) {
        super(outStream);
        this.writer = null;
    }

    @Override
    public void openReport(String title) {
        this.writer = new PrintWriter(this.getOutStream());
    }

    @Override
    public void writeHeaders(String[] columns) {
        this.writer.println(StringUtils.join(columns, '\t'));
    }

    @Override
    public void writeRow(double depth, double[] values) {
        String dataLine = DoubleStream.concat(DoubleStream.of(depth), Arrays.stream(values))
                .mapToObj(x -> (Double.isNaN(x) ? "" : Double.toString(x))).collect(Collectors.joining("\t"));
        this.writer.println(dataLine);
    }

    @Override
    protected void cleanup() throws IOException {
        if (this.writer != null)
            this.writer.flush();
    }

}

/**
 *
 */
package org.theseed.xrf.io;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class reads a tab-delimited XRF export file.  The first lines of the file are a header block that is kept
 * as unparsed strings.  Every line after that is a data row of floating-point numbers.  The rows are not guaranteed to be
 * the same length, so short rows are padded with NaN on the right to the length of the longest row.  Completely
 * blank lines are skipped.
 *
 * The file is read in its entirety and closed before the table is returned.
 *
 */
public class XrfTableReader {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(XrfTableReader.class);
    /** number of header lines */
    private int headerCount;

    /**
     * Create a reader for files with the specified number of header lines.
     *
     * @param headerCount	number of header lines at the start of the file
     */
    public XrfTableReader(int headerCount) {
        this.headerCount = headerCount;
    }

    /**
     * Read an XRF export file.
     *
     * @param inFile	file to read
     *
     * @return the header rows and the padded data matrix
     *
     * @throws IOException
     */
    public RawTable read(File inFile) throws IOException {
        List<String[]> header = new ArrayList<String[]>(this.headerCount);
        List<double[]> rows = new ArrayList<double[]>();
        int maxWidth = 0;
        int lineNum = 0;
        try (LineIterator iter = FileUtils.lineIterator(inFile, StandardCharsets.UTF_8.name())) {
            // Save the header lines.
            while (header.size() < this.headerCount && iter.hasNext()) {
                String line = iter.nextLine();
                lineNum++;
                header.add(StringUtils.splitPreserveAllTokens(line, '\t'));
            }
            if (header.size() < this.headerCount)
                throw new XrfFormatException(String.format("File %s has only %d lines, but the header requires %d.",
                        inFile, header.size(), this.headerCount));
            // Parse the data lines.
            while (iter.hasNext()) {
                String line = iter.nextLine();
                lineNum++;
                if (! StringUtils.isBlank(line)) {
                    double[] row = parseRow(line, lineNum);
                    if (row.length > maxWidth)
                        maxWidth = row.length;
                    rows.add(row);
                }
            }
        }
        log.debug("{} data rows read from {}.  Maximum row width is {}.", rows.size(), inFile, maxWidth);
        // Pad the short rows.
        double[][] data = new double[rows.size()][];
        int padded = 0;
        for (int i = 0; i < data.length; i++) {
            double[] row = rows.get(i);
            if (row.length < maxWidth) {
                int oldLen = row.length;
                row = Arrays.copyOf(row, maxWidth);
                Arrays.fill(row, oldLen, maxWidth, Double.NaN);
                padded++;
            }
            data[i] = row;
        }
        if (padded > 0)
            log.info("{} short data rows in {} padded with missing values.", padded, inFile);
        return new RawTable(header, data, maxWidth);
    }

    /**
     * Parse a single data line into numbers.
     *
     * @param line		input line to parse
     * @param lineNum	line number (for error messages)
     *
     * @return an array of the numbers in the line
     *
     * @throws XrfFormatException
     */
    protected static double[] parseRow(String line, int lineNum) throws XrfFormatException {
        String[] cells = StringUtils.splitPreserveAllTokens(line, '\t');
        double[] retVal = new double[cells.length];
        for (int i = 0; i < cells.length; i++) {
            try {
                retVal[i] = Double.parseDouble(cells[i].trim());
            } catch (NumberFormatException e) {
                throw new XrfFormatException(lineNum, i, "invalid numeric value \"" + cells[i] + "\".");
            }
        }
        return retVal;
    }

}

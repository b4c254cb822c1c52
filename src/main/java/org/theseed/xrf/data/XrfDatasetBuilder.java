/**
 *
 */
package org.theseed.xrf.data;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xrf.io.RawTable;
import org.theseed.xrf.io.XrfFormatException;

/**
 * This class converts a raw XRF table into a structured dataset.  The header provides the sample identifier and the
 * element symbols, and the data columns are extracted according to an {@link XrfLayout}.
 *
 */
public class XrfDatasetBuilder {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(XrfDatasetBuilder.class);
    /** column layout of the input */
    private XrfLayout layout;

    /**
     * Create a dataset builder for a particular export layout.
     *
     * @param layout	column layout of the input tables
     */
    public XrfDatasetBuilder(XrfLayout layout) {
        this.layout = layout;
    }

    /**
     * Build a dataset from a raw table.
     *
     * @param table		raw header and data read from an export file
     *
     * @return the structured dataset
     *
     * @throws XrfFormatException	if the header is missing required information or does not match the layout
     */
    public XrfDataset build(RawTable table) throws XrfFormatException {
        String id = this.parseId(table);
        List<String> elements = this.parseElements(table);
        log.info("Sample {} has {} elements: {}.", id, elements.size(), StringUtils.join(elements, ", "));
        // Verify the data is wide enough for the elements.
        int n = table.size();
        int required = this.layout.requiredWidth(elements.size());
        if (n > 0 && table.width() < required)
            throw new LayoutMismatchException(this.layout, String.format("%d elements require %d data columns, but "
                    + "the data rows have only %d.", elements.size(), required, table.width()));
        // Extract the columns.
        double[][] data = table.getData();
        double[] depth = this.column(data, this.layout.getDepthCol());
        double[] sectionNumber = this.column(data, this.layout.getSectionCol());
        double[] sectionDepth = this.column(data, this.layout.getSectionDepthCol());
        double[] totalCounts = this.column(data, this.layout.getCountsCol());
        double[] liveTime = this.column(data, this.layout.getLiveTimeCol());
        int w = elements.size();
        double[][] comp = new double[n][w];
        double[][] error = new double[n][w];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < w; j++) {
                comp[i][j] = data[i][this.layout.compCol(j)];
                error[i][j] = data[i][this.layout.errorCol(j)];
            }
        }
        return new XrfDataset(id, elements, depth, sectionNumber, sectionDepth, totalCounts, liveTime, comp, error);
    }

    /**
     * @return a copy of the specified data column
     *
     * @param data	data matrix
     * @param col	index of the desired column
     */
    private double[] column(double[][] data, int col) {
        double[] retVal = new double[data.length];
        for (int i = 0; i < data.length; i++)
            retVal[i] = data[i][col];
        return retVal;
    }

    /**
     * @return the sample identifier from the header, with the file extension removed
     *
     * @param table		raw input table
     *
     * @throws XrfFormatException
     */
    protected String parseId(RawTable table) throws XrfFormatException {
        int rowIdx = this.layout.getIdRow();
        String[] row = table.getHeaderRow(rowIdx);
        if (row == null)
            throw new XrfFormatException(String.format("Missing identifier header row %d.", rowIdx + 1));
        String[] tokens = StringUtils.split(StringUtils.join(row, ' '));
        int tokenIdx = this.layout.getIdToken();
        if (tokens.length <= tokenIdx)
            throw new XrfFormatException(rowIdx + 1, 0, String.format("identifier header needs at least %d tokens, "
                    + "but only %d were found.", tokenIdx + 1, tokens.length));
        return FilenameUtils.removeExtension(tokens[tokenIdx]);
    }

    /**
     * @return the list of element symbols from the header
     *
     * @param table		raw input table
     *
     * @throws XrfFormatException
     */
    protected List<String> parseElements(RawTable table) throws XrfFormatException {
        int rowIdx = this.layout.getElementRow();
        String[] row = table.getHeaderRow(rowIdx);
        if (row == null)
            throw new XrfFormatException(String.format("Missing element header row %d.", rowIdx + 1));
        int offset = this.layout.getElementOffset();
        // Trailing blank cells are not part of the layout.
        int end = row.length;
        while (end > offset && StringUtils.isBlank(row[end - 1])) end--;
        if (end <= offset)
            throw new XrfFormatException(rowIdx + 1, offset, "no element symbols found in element header.");
        int stride = this.layout.getStride();
        if ((end - offset) % stride != 0)
            throw new LayoutMismatchException(this.layout, String.format("element header row %d has %d entries "
                    + "after column %d, which is not a multiple of %d.", rowIdx + 1, end - offset, offset, stride));
        List<String> retVal = new ArrayList<String>((end - offset) / stride);
        for (int i = offset; i < end; i += stride) {
            String symbol = StringUtils.trim(row[i]);
            if (symbol.isEmpty())
                throw new LayoutMismatchException(this.layout, String.format("blank element symbol in header row %d, "
                        + "column %d.", rowIdx + 1, i));
            if (retVal.contains(symbol))
                throw new LayoutMismatchException(this.layout, "element " + symbol + " occurs twice in the header.");
            retVal.add(symbol);
        }
        return retVal;
    }

}

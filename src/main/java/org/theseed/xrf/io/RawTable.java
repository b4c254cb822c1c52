/**
 *
 */
package org.theseed.xrf.io;

import java.util.List;

/**
 * This object contains the raw contents of an XRF export file:  the header rows as unparsed strings and
 * the data rows as a rectangular numeric matrix.  Short data rows have already been padded with NaN.
 *
 */
public class RawTable {

    // FIELDS
    /** header rows, each split on tabs */
    private List<String[]> header;
    /** data matrix, one row per measurement */
    private double[][] data;
    /** number of columns in each data row */
    private int width;

    /**
     * Create a raw table.
     *
     * @param header	list of header rows
     * @param data		rectangular data matrix
     * @param width		number of columns in the data matrix
     */
    public RawTable(List<String[]> header, double[][] data, int width) {
        this.header = header;
        this.data = data;
        this.width = width;
    }

    /**
     * @return the header row at the specified index, or NULL if there is none
     *
     * @param idx	0-based index of the desired header row
     */
    public String[] getHeaderRow(int idx) {
        String[] retVal = null;
        if (idx >= 0 && idx < this.header.size())
            retVal = this.header.get(idx);
        return retVal;
    }

    /**
     * @return the number of header rows
     */
    public int getHeaderCount() {
        return this.header.size();
    }

    /**
     * @return the data matrix
     */
    public double[][] getData() {
        return this.data;
    }

    /**
     * @return the number of data rows
     */
    public int size() {
        return this.data.length;
    }

    /**
     * @return the number of columns in every data row
     */
    public int width() {
        return this.width;
    }

}

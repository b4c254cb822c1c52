/**
 *
 */
package org.theseed.xrf.data;

/**
 * This enum describes the fixed positional layout of an XRF export file.  Each constant corresponds to one version of
 * the instrument's export format.  Header row and token positions are 0-based.  The per-element columns are interleaved,
 * so the concentration and error columns each start at a base offset and advance by a stride.
 *
 */
public enum XrfLayout {
    /** Geotek MSCL version 7.9 with the Olympus XRF head */
    MSCL_7_9(10, 0, 4, 7, 5, 0, 1, 2, 3, 4, 5, 6, 2);

    // FIELDS
    /** number of header rows */
    private final int headerRows;
    /** header row containing the sample identifier */
    private final int idRow;
    /** whitespace-delimited token holding the sample identifier */
    private final int idToken;
    /** header row containing the element symbols */
    private final int elementRow;
    /** first element symbol position in the element row */
    private final int elementOffset;
    /** depth column */
    private final int depthCol;
    /** section number column */
    private final int sectionCol;
    /** section depth column */
    private final int sectionDepthCol;
    /** total counts column */
    private final int countsCol;
    /** live time column */
    private final int liveTimeCol;
    /** first concentration column */
    private final int compOffset;
    /** first error column */
    private final int errorOffset;
    /** distance between successive columns of the same kind (also used for the element row) */
    private final int stride;

    private XrfLayout(int headerRows, int idRow, int idToken, int elementRow, int elementOffset, int depthCol,
            int sectionCol, int sectionDepthCol, int countsCol, int liveTimeCol, int compOffset, int errorOffset,
            int stride) {
        this.headerRows = headerRows;
        this.idRow = idRow;
        this.idToken = idToken;
        this.elementRow = elementRow;
        this.elementOffset = elementOffset;
        this.depthCol = depthCol;
        this.sectionCol = sectionCol;
        this.sectionDepthCol = sectionDepthCol;
        this.countsCol = countsCol;
        this.liveTimeCol = liveTimeCol;
        this.compOffset = compOffset;
        this.errorOffset = errorOffset;
        this.stride = stride;
    }

    /**
     * @return the number of header rows
     */
    public int getHeaderRows() {
        return this.headerRows;
    }

    /**
     * @return the index of the header row containing the sample identifier
     */
    public int getIdRow() {
        return this.idRow;
    }

    /**
     * @return the index of the identifier token in the ID header row
     */
    public int getIdToken() {
        return this.idToken;
    }

    /**
     * @return the index of the header row containing the element symbols
     */
    public int getElementRow() {
        return this.elementRow;
    }

    /**
     * @return the position of the first element symbol in the element row
     */
    public int getElementOffset() {
        return this.elementOffset;
    }

    /**
     * @return the depth column index
     */
    public int getDepthCol() {
        return this.depthCol;
    }

    /**
     * @return the section number column index
     */
    public int getSectionCol() {
        return this.sectionCol;
    }

    /**
     * @return the section depth column index
     */
    public int getSectionDepthCol() {
        return this.sectionDepthCol;
    }

    /**
     * @return the total XRF counts column index
     */
    public int getCountsCol() {
        return this.countsCol;
    }

    /**
     * @return the live time column index
     */
    public int getLiveTimeCol() {
        return this.liveTimeCol;
    }

    /**
     * @return the stride between interleaved columns
     */
    public int getStride() {
        return this.stride;
    }

    /**
     * @return the data column holding the concentration of the specified element
     *
     * @param i		index of the element in the element list
     */
    public int compCol(int i) {
        return this.compOffset + i * this.stride;
    }

    /**
     * @return the data column holding the measurement error of the specified element
     *
     * @param i		index of the element in the element list
     */
    public int errorCol(int i) {
        return this.errorOffset + i * this.stride;
    }

    /**
     * @return the minimum data row width needed to hold the specified number of elements
     *
     * @param nElements		number of elements
     */
    public int requiredWidth(int nElements) {
        int retVal = Math.max(this.depthCol, Math.max(this.sectionCol, Math.max(this.sectionDepthCol,
                Math.max(this.countsCol, this.liveTimeCol)))) + 1;
        if (nElements > 0)
            retVal = Math.max(retVal, Math.max(this.compCol(nElements - 1), this.errorCol(nElements - 1)) + 1);
        return retVal;
    }

}

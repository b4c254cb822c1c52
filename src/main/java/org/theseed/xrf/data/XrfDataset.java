/**
 *
 */
package org.theseed.xrf.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.DoublePredicate;
import java.util.function.IntPredicate;

/**
 * This object contains the structured measurements for a single XRF core scan.  Each row is one measurement,
 * and the metadata vectors, the composition matrix, the error matrix, the CLR matrix, and every derived series
 * are kept in row correspondence.  Rows can only be removed through {@link #retainRows(IntPredicate)}, which
 * updates every field at once.
 *
 * The concentration vector for an element is always extracted from the composition matrix, so it reflects any
 * masking done to the matrix.
 *
 */
public class XrfDataset {

    // FIELDS
    /** sample identifier */
    private String id;
    /** element symbols, in column order */
    private List<String> elements;
    /** map of element symbols to column indices */
    private Map<String, Integer> elementMap;
    /** depth of each measurement */
    private double[] depth;
    /** core section number */
    private double[] sectionNumber;
    /** depth within the core section */
    private double[] sectionDepth;
    /** total XRF counts */
    private double[] totalCounts;
    /** live time */
    private double[] liveTime;
    /** concentrations, measurements x elements */
    private double[][] comp;
    /** concentration errors, measurements x elements */
    private double[][] error;
    /** centered log-ratio values, measurements x elements */
    private double[][] clr;
    /** derived series, keyed by name */
    private Map<String, double[]> derived;
    /** name of the depth series */
    public static final String DEPTH = "depth";
    /** name of the section number series */
    public static final String SECTION_NUMBER = "section number";
    /** name of the section depth series */
    public static final String SECTION_DEPTH = "section depth";
    /** name of the total counts series */
    public static final String TOTAL_COUNTS = "xrf total counts";
    /** name of the live time series */
    public static final String LIVE_TIME = "live time";

    /**
     * Create a dataset.  The CLR matrix starts out filled with NaN.
     *
     * @param id			sample identifier
     * @param elements		list of element symbols
     * @param depth			depth vector
     * @param sectionNumber	section number vector
     * @param sectionDepth	section depth vector
     * @param totalCounts	total counts vector
     * @param liveTime		live time vector
     * @param comp			composition matrix
     * @param error			error matrix
     */
    public XrfDataset(String id, List<String> elements, double[] depth, double[] sectionNumber, double[] sectionDepth,
            double[] totalCounts, double[] liveTime, double[][] comp, double[][] error) {
        this.id = id;
        this.elements = new ArrayList<String>(elements);
        this.elementMap = new LinkedHashMap<String, Integer>(elements.size() * 2);
        for (int i = 0; i < elements.size(); i++)
            this.elementMap.put(elements.get(i), i);
        int n = depth.length;
        for (double[] vector : new double[][] { sectionNumber, sectionDepth, totalCounts, liveTime }) {
            if (vector.length != n)
                throw new IllegalArgumentException("Metadata vectors for " + id + " have inconsistent lengths.");
        }
        checkShape(comp, n, "composition");
        checkShape(error, n, "error");
        this.depth = depth;
        this.sectionNumber = sectionNumber;
        this.sectionDepth = sectionDepth;
        this.totalCounts = totalCounts;
        this.liveTime = liveTime;
        this.comp = comp;
        this.error = error;
        this.clr = new double[n][elements.size()];
        for (double[] row : this.clr)
            Arrays.fill(row, Double.NaN);
        this.derived = new LinkedHashMap<String, double[]>();
    }

    /**
     * Verify that a matrix has one row per measurement and one column per element.
     *
     * @param matrix	matrix to check
     * @param n			expected row count
     * @param name		name of the matrix (for error messages)
     */
    private void checkShape(double[][] matrix, int n, String name) {
        if (matrix.length != n)
            throw new IllegalArgumentException("The " + name + " matrix for " + this.id + " has " + matrix.length
                    + " rows, but " + n + " were expected.");
        for (double[] row : matrix) {
            if (row.length != this.elements.size())
                throw new IllegalArgumentException("The " + name + " matrix for " + this.id + " has a row of width "
                        + row.length + ", but there are " + this.elements.size() + " elements.");
        }
    }

    /**
     * @return the sample identifier
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the element symbols, in column order
     */
    public List<String> getElements() {
        return Collections.unmodifiableList(this.elements);
    }

    /**
     * @return TRUE if the specified element is in this dataset
     *
     * @param element	element symbol to check
     */
    public boolean hasElement(String element) {
        return this.elementMap.containsKey(element);
    }

    /**
     * @return the column index of an element, or -1 if the element is not present
     *
     * @param element	element symbol of interest
     */
    public int getElementIndex(String element) {
        return this.elementMap.getOrDefault(element, -1);
    }

    /**
     * @return the number of measurements
     */
    public int size() {
        return this.depth.length;
    }

    /**
     * @return the number of elements
     */
    public int width() {
        return this.elements.size();
    }

    /**
     * @return the depth vector
     */
    public double[] getDepth() {
        return this.depth;
    }

    /**
     * @return the section number vector
     */
    public double[] getSectionNumber() {
        return this.sectionNumber;
    }

    /**
     * @return the section depth vector
     */
    public double[] getSectionDepth() {
        return this.sectionDepth;
    }

    /**
     * @return the total counts vector
     */
    public double[] getTotalCounts() {
        return this.totalCounts;
    }

    /**
     * @return the live time vector
     */
    public double[] getLiveTime() {
        return this.liveTime;
    }

    /**
     * @return the composition matrix
     */
    public double[][] getComp() {
        return this.comp;
    }

    /**
     * @return the error matrix
     */
    public double[][] getError() {
        return this.error;
    }

    /**
     * @return the CLR matrix
     */
    public double[][] getClr() {
        return this.clr;
    }

    /**
     * Store a new CLR matrix.
     *
     * @param clr	CLR matrix; must have the same shape as the composition matrix
     */
    public void setClr(double[][] clr) {
        checkShape(clr, this.size(), "CLR");
        this.clr = clr;
    }

    /**
     * @return the concentration vector for an element
     *
     * @param element	symbol of the desired element
     */
    public double[] getConcentrations(String element) {
        return this.getColumn(this.comp, this.requireElement(element));
    }

    /**
     * @return the CLR vector for an element
     *
     * @param element	symbol of the desired element
     */
    public double[] getClrValues(String element) {
        return this.getColumn(this.clr, this.requireElement(element));
    }

    /**
     * @return the column index of the specified element, throwing an error if it is not present
     *
     * @param element	symbol of the desired element
     */
    private int requireElement(String element) {
        Integer retVal = this.elementMap.get(element);
        if (retVal == null)
            throw new IllegalArgumentException("Element \"" + element + "\" is not present in dataset " + this.id + ".");
        return retVal;
    }

    /**
     * @return a copy of a single column from a matrix
     *
     * @param matrix	source matrix
     * @param col		index of the desired column
     */
    private double[] getColumn(double[][] matrix, int col) {
        double[] retVal = new double[matrix.length];
        for (int i = 0; i < retVal.length; i++)
            retVal[i] = matrix[i][col];
        return retVal;
    }

    /**
     * Store a derived series.
     *
     * @param name		name of the series
     * @param values	series values, one per measurement
     */
    public void putSeries(String name, double[] values) {
        if (values.length != this.size())
            throw new IllegalArgumentException("Derived series " + name + " has " + values.length
                    + " values, but dataset " + this.id + " has " + this.size() + " measurements.");
        this.derived.put(name, values);
    }

    /**
     * @return the named series (metadata, element concentration, or derived series), or NULL if there is none
     *
     * @param name		name of the desired series
     */
    public double[] getSeries(String name) {
        double[] retVal;
        switch (name) {
        case DEPTH :
            retVal = this.depth;
            break;
        case SECTION_NUMBER :
            retVal = this.sectionNumber;
            break;
        case SECTION_DEPTH :
            retVal = this.sectionDepth;
            break;
        case TOTAL_COUNTS :
            retVal = this.totalCounts;
            break;
        case LIVE_TIME :
            retVal = this.liveTime;
            break;
        default :
            if (this.elementMap.containsKey(name))
                retVal = this.getConcentrations(name);
            else
                retVal = this.derived.get(name);
        }
        return retVal;
    }

    /**
     * @return the names of all the series available:  metadata, elements, and derived series
     */
    public Set<String> getKeys() {
        Set<String> retVal = new LinkedHashSet<String>();
        retVal.addAll(Arrays.asList(DEPTH, SECTION_NUMBER, SECTION_DEPTH, TOTAL_COUNTS, LIVE_TIME));
        retVal.addAll(this.elements);
        retVal.addAll(this.derived.keySet());
        return retVal;
    }

    /**
     * Remove every measurement row that fails a test.  All the correlated arrays are updated together, and the
     * surviving rows keep their relative order.
     *
     * @param keep		predicate that takes a row index and returns TRUE if the row should be kept
     *
     * @return the number of rows removed
     */
    public int retainRows(IntPredicate keep) {
        int n = this.size();
        // Compute the surviving rows before changing anything.
        int[] kept = new int[n];
        int newSize = 0;
        for (int i = 0; i < n; i++) {
            if (keep.test(i)) {
                kept[newSize] = i;
                newSize++;
            }
        }
        int retVal = n - newSize;
        if (retVal > 0) {
            final int[] rows = Arrays.copyOf(kept, newSize);
            this.depth = select(this.depth, rows);
            this.sectionNumber = select(this.sectionNumber, rows);
            this.sectionDepth = select(this.sectionDepth, rows);
            this.totalCounts = select(this.totalCounts, rows);
            this.liveTime = select(this.liveTime, rows);
            this.comp = select(this.comp, rows);
            this.error = select(this.error, rows);
            this.clr = select(this.clr, rows);
            this.derived.replaceAll((k, v) -> select(v, rows));
        }
        return retVal;
    }

    /**
     * @return a new vector containing the selected entries of the old one
     *
     * @param vector	source vector
     * @param rows		indices of the entries to keep, in order
     */
    private static double[] select(double[] vector, int[] rows) {
        double[] retVal = new double[rows.length];
        for (int i = 0; i < rows.length; i++)
            retVal[i] = vector[rows[i]];
        return retVal;
    }

    /**
     * @return a new matrix containing the selected rows of the old one
     *
     * @param matrix	source matrix
     * @param rows		indices of the rows to keep, in order
     */
    private static double[][] select(double[][] matrix, int[] rows) {
        double[][] retVal = new double[rows.length][];
        for (int i = 0; i < rows.length; i++)
            retVal[i] = matrix[rows[i]];
        return retVal;
    }

    /**
     * Replace every composition value satisfying a test with NaN.  No rows are removed.
     *
     * @param mask		predicate that returns TRUE for a value that should be marked missing
     *
     * @return the number of values newly masked
     */
    public int maskComposition(DoublePredicate mask) {
        int retVal = 0;
        for (double[] row : this.comp) {
            for (int j = 0; j < row.length; j++) {
                if (! Double.isNaN(row[j]) && mask.test(row[j])) {
                    row[j] = Double.NaN;
                    retVal++;
                }
            }
        }
        return retVal;
    }

    /**
     * @return the number of missing values in the composition matrix
     */
    public int countMissing() {
        int retVal = 0;
        for (double[] row : this.comp) {
            for (double v : row)
                if (Double.isNaN(v)) retVal++;
        }
        return retVal;
    }

    @Override
    public String toString() {
        return this.id;
    }

}

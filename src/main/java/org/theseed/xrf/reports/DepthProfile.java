/**
 *
 */
package org.theseed.xrf.reports;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xrf.data.XrfDataset;
import org.theseed.xrf.transform.RatioDeriver;
import org.theseed.xrf.transform.RunningMeanSmoother;

/**
 * This object assembles the columns of a depth-profile report.  Each requested series contributes a raw column and,
 * if smoothing is enabled, a smoothed column.  A plain element name is represented by its CLR values, and a name of the
 * form "e1/e2" by the log ratio of the two elements, which is derived on demand.
 *
 */
public class DepthProfile {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(DepthProfile.class);
    /** source dataset */
    private XrfDataset dataset;
    /** smoother to use, or NULL if there is no smoothing */
    private RunningMeanSmoother smoother;
    /** column headers, not including depth */
    private List<String> headers;
    /** column values, parallel to the headers */
    private List<double[]> columns;

    /**
     * Create a depth profile for a dataset.
     *
     * @param dataset	processed dataset
     * @param smoother	smoother for the smoothed columns, or NULL to omit them
     */
    public DepthProfile(XrfDataset dataset, RunningMeanSmoother smoother) {
        this.dataset = dataset;
        this.smoother = smoother;
        this.headers = new ArrayList<String>();
        this.columns = new ArrayList<double[]>();
    }

    /**
     * Add a series to the profile.
     *
     * @param name		element symbol or ratio specification
     *
     * @return TRUE if the series was added, FALSE if the name is not a valid series
     */
    public boolean addSeries(String name) {
        double[] values = null;
        String[] ratio = RatioDeriver.parse(name);
        if (ratio != null) {
            if (this.dataset.hasElement(ratio[0]) && this.dataset.hasElement(ratio[1])) {
                RatioDeriver.derive(this.dataset, name);
                values = this.dataset.getSeries(name);
            }
        } else if (this.dataset.hasElement(name))
            values = this.dataset.getClrValues(name);
        boolean retVal = (values != null);
        if (! retVal)
            log.warn("Series \"{}\" is not available for {}:  skipped.", name, this.dataset);
        else {
            this.headers.add(name);
            this.columns.add(values);
            if (this.smoother != null) {
                this.headers.add(name + " smoothed");
                this.columns.add(this.smoother.smooth(values));
            }
        }
        return retVal;
    }

    /**
     * @return the column headers, starting with depth
     */
    public String[] getHeaders() {
        String[] retVal = new String[this.headers.size() + 1];
        retVal[0] = XrfDataset.DEPTH;
        for (int i = 0; i < this.headers.size(); i++)
            retVal[i + 1] = this.headers.get(i);
        return retVal;
    }

    /**
     * @return the number of rows in the profile
     */
    public int size() {
        return this.dataset.size();
    }

    /**
     * @return the depth of a profile row
     *
     * @param i		index of the row
     */
    public double getDepth(int i) {
        return this.dataset.getDepth()[i];
    }

    /**
     * @return the values in a profile row, not including the depth
     *
     * @param i		index of the row
     */
    public double[] getRow(int i) {
        double[] retVal = new double[this.columns.size()];
        for (int j = 0; j < retVal.length; j++)
            retVal[j] = this.columns.get(j)[i];
        return retVal;
    }

    /**
     * Write this profile to a report.
     *
     * @param reporter	reporter to receive the profile
     */
    public void write(ProfileReporter reporter) {
        reporter.openReport(this.dataset.getId());
        reporter.writeHeaders(this.getHeaders());
        for (int i = 0; i < this.size(); i++)
            reporter.writeRow(this.getDepth(i), this.getRow(i));
    }

}

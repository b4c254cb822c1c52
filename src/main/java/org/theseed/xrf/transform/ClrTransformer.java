/**
 *
 */
package org.theseed.xrf.transform;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xrf.data.XrfDataset;

/**
 * This class computes the centered log-ratio transform of compositional data.  For each row, the natural log of each
 * value is taken and the mean of the row's usable logs is subtracted.  Missing, non-positive, and infinite values
 * produce NaN and are left out of the mean.  A row with no usable values becomes entirely NaN.
 *
 * The algorithm follows CoDaPack (Thio-Henestrosa and Martin-Fernandez, Math. Geol. 37(7), 2005).
 *
 */
public class ClrTransformer {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ClrTransformer.class);

    /**
     * Compute the CLR of a dataset's composition and store it in the dataset.
     *
     * @param dataset	dataset to transform
     */
    public static void apply(XrfDataset dataset) {
        double[][] clr = compute(dataset.getComp());
        dataset.setClr(clr);
        log.info("CLR transform computed for {} measurements of {}.", clr.length, dataset);
    }

    /**
     * @return the CLR transform of a composition matrix
     *
     * @param comp	matrix of compositions, one row per measurement
     */
    public static double[][] compute(double[][] comp) {
        double[][] retVal = new double[comp.length][];
        for (int i = 0; i < comp.length; i++)
            retVal[i] = computeRow(comp[i]);
        return retVal;
    }

    /**
     * @return the CLR transform of a single composition
     *
     * @param row	concentrations in the composition
     */
    public static double[] computeRow(double[] row) {
        double[] retVal = new double[row.length];
        SummaryStatistics stats = new SummaryStatistics();
        for (int j = 0; j < row.length; j++) {
            double v = row[j];
            if (v > 0.0 && Double.isFinite(v)) {
                retVal[j] = Math.log(v);
                stats.addValue(retVal[j]);
            } else
                retVal[j] = Double.NaN;
        }
        // If there are no usable values, the mean is NaN and so is the whole row.
        double mean = stats.getMean();
        for (int j = 0; j < retVal.length; j++)
            retVal[j] -= mean;
        return retVal;
    }

}

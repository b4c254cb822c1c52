/**
 *
 */
package org.theseed.xrf.transform;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xrf.data.XrfDataset;

/**
 * This class adds element log-ratio series to a dataset.  The ratio is specified as two element symbols separated by
 * a slash (e.g. "Ca/Ti").  The new series is stored under the specification string and contains the natural log of
 * the ratio of the two concentration vectors.  A zero or missing concentration yields NaN.
 *
 * A specification that is not of the form "e1/e2" is ignored without an error, so the caller can pass in plain
 * element names as well as ratios.
 *
 */
public class RatioDeriver {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RatioDeriver.class);
    /** separator between the element symbols */
    public static final char SEPARATOR = '/';

    /**
     * @return TRUE if the specified string is a well-formed ratio specification
     *
     * @param ratio		string to check
     */
    public static boolean isRatio(String ratio) {
        return parse(ratio) != null;
    }

    /**
     * @return the two element symbols in a ratio specification, or NULL if the specification is malformed
     *
     * @param ratio		ratio specification to parse
     */
    public static String[] parse(String ratio) {
        String[] retVal = null;
        if (ratio != null) {
            String[] parts = StringUtils.splitPreserveAllTokens(ratio, SEPARATOR);
            if (parts.length == 2 && ! StringUtils.isBlank(parts[0]) && ! StringUtils.isBlank(parts[1]))
                retVal = new String[] { parts[0].trim(), parts[1].trim() };
        }
        return retVal;
    }

    /**
     * Add a log-ratio series to a dataset.  If the specification is malformed, the dataset is left unchanged.
     *
     * @param dataset	dataset to update
     * @param ratio		ratio specification, in the form "e1/e2"
     *
     * @return the dataset
     *
     * @throws IllegalArgumentException	if a well-formed specification names an element not in the dataset
     */
    public static XrfDataset derive(XrfDataset dataset, String ratio) {
        String[] elements = parse(ratio);
        if (elements == null)
            log.debug("\"{}\" is not a ratio specification.  {} unchanged.", ratio, dataset);
        else {
            double[] num = dataset.getConcentrations(elements[0]);
            double[] denom = dataset.getConcentrations(elements[1]);
            double[] series = new double[num.length];
            for (int i = 0; i < series.length; i++)
                series[i] = logRatio(num[i], denom[i]);
            dataset.putSeries(ratio, series);
            log.debug("Ratio series {} added to {}.", ratio, dataset);
        }
        return dataset;
    }

    /**
     * @return the natural log of a ratio, or NaN if it is undefined
     *
     * @param num		numerator
     * @param denom		denominator
     */
    private static double logRatio(double num, double denom) {
        double retVal = Double.NaN;
        if (num > 0.0 && denom > 0.0) {
            retVal = Math.log(num / denom);
            if (! Double.isFinite(retVal))
                retVal = Double.NaN;
        }
        return retVal;
    }

}

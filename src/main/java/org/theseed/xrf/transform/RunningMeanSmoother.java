/**
 *
 */
package org.theseed.xrf.transform;

/**
 * This class smooths a depth series using a running mean over 2n+1 successive points, n on each side of the current
 * point.  Near the ends of the series the window is truncated, so skewed (one-sided) means are used.  Missing values
 * are left out of each mean.
 *
 * Optionally, positions that were missing in the input are restored to missing in the output, so that the smoothed
 * curve bridges gaps for neighboring points without inventing data inside them.  Infinite values can be treated as
 * missing.
 *
 * Adapted from the running-mean smoother of Olof Liungman (Göteborg University, 1997).
 *
 */
public class RunningMeanSmoother {

    // FIELDS
    /** number of points on each side of the current point */
    private int halfWindow;
    /** TRUE to convert infinite values to missing */
    private boolean infToNan;
    /** TRUE to keep missing values in their original positions */
    private boolean keepNans;

    /**
     * Construct a smoother with the default options (infinite values treated as missing, gaps preserved).
     *
     * @param halfWindow	number of points on each side of the current point
     */
    public RunningMeanSmoother(int halfWindow) {
        this(halfWindow, true, true);
    }

    /**
     * Construct a smoother.
     *
     * @param halfWindow	number of points on each side of the current point
     * @param infToNan		TRUE to convert infinite values to missing before smoothing
     * @param keepNans		TRUE to restore missing values at their original positions after smoothing
     */
    public RunningMeanSmoother(int halfWindow, boolean infToNan, boolean keepNans) {
        if (halfWindow < 0)
            throw new IllegalArgumentException("Smoothing half-window cannot be negative.");
        this.halfWindow = halfWindow;
        this.infToNan = infToNan;
        this.keepNans = keepNans;
    }

    /**
     * @return a smoothed copy of a series
     *
     * @param y		series to smooth (will not be modified)
     */
    public double[] smooth(double[] y) {
        final int d = y.length;
        double[] input = y.clone();
        if (this.infToNan) {
            for (int i = 0; i < d; i++)
                if (Double.isInfinite(input[i])) input[i] = Double.NaN;
        }
        double[] retVal = new double[d];
        for (int i = 0; i < d; i++) {
            if (this.keepNans && Double.isNaN(input[i]))
                retVal[i] = Double.NaN;
            else {
                int start = Math.max(0, i - this.halfWindow);
                int end = Math.min(d - 1, i + this.halfWindow);
                double sum = 0.0;
                int count = 0;
                for (int k = start; k <= end; k++) {
                    if (! Double.isNaN(input[k])) {
                        sum += input[k];
                        count++;
                    }
                }
                retVal[i] = (count > 0 ? sum / count : Double.NaN);
            }
        }
        return retVal;
    }

    /**
     * @return the number of points on each side of the current point
     */
    public int getHalfWindow() {
        return this.halfWindow;
    }

}

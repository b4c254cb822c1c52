/**
 *
 */
package org.theseed.xrf.filters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xrf.data.XrfDataset;

/**
 * This filter removes measurements whose concentrations do not add up to the closure constant.  The row sum is
 * rounded to the nearest whole unit before the comparison.  A row with a missing concentration has no valid sum,
 * so it is removed as well.
 *
 */
public class ClosureFilter extends DatasetFilter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ClosureFilter.class);
    /** expected row total */
    private double closure;

    public ClosureFilter(IParms processor) {
        super(processor);
        this.closure = processor.getClosureConstant();
    }

    @Override
    public int apply(XrfDataset dataset) {
        final double[][] comp = dataset.getComp();
        int retVal = dataset.retainRows(i -> this.isClosed(comp[i]));
        log.info("{} measurements removed from {} for failing closure at {}.  {} remain.", retVal, dataset,
                this.closure, dataset.size());
        return retVal;
    }

    /**
     * @return TRUE if the specified composition sums to the closure constant
     *
     * @param row	row of concentrations to check
     */
    public boolean isClosed(double[] row) {
        double sum = 0.0;
        for (double v : row)
            sum += v;
        return Math.rint(sum) == this.closure;
    }

}

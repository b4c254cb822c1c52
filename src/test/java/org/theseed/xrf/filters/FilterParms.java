/**
 *
 */
package org.theseed.xrf.filters;

/**
 * Simple filter parameter object for tests.
 *
 */
public class FilterParms implements DatasetFilter.IParms {

    private double closure;
    private double tolerance;

    public FilterParms(double closure, double tolerance) {
        this.closure = closure;
        this.tolerance = tolerance;
    }

    @Override
    public double getClosureConstant() {
        return this.closure;
    }

    @Override
    public double getDetectionTolerance() {
        return this.tolerance;
    }

}

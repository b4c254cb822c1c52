/**
 *
 */
package org.theseed.xrf.filters;

/**
 * This enum describes the scanner's XRF measurement modes.  Each mode has a different recommended detection limit
 * in parts per million.
 *
 */
public enum ScanMode {
    GEOCHEM(500.0), SOIL(50.0);

    /** recommended minimum concentration */
    private final double tolerance;

    private ScanMode(double tolerance) {
        this.tolerance = tolerance;
    }

    /**
     * @return the recommended detection tolerance for this mode
     */
    public double getTolerance() {
        return this.tolerance;
    }

}

/**
 *
 */
package org.theseed.xrf.filters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xrf.data.XrfDataset;

/**
 * This filter marks concentrations below the instrument's detection limit as missing.  It never removes rows.
 *
 */
public class DetectionLimitFilter extends DatasetFilter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(DetectionLimitFilter.class);
    /** minimum reliable concentration */
    private double tolerance;

    public DetectionLimitFilter(IParms processor) {
        super(processor);
        this.tolerance = processor.getDetectionTolerance();
    }

    @Override
    public int apply(XrfDataset dataset) {
        int retVal = dataset.maskComposition(v -> v < this.tolerance);
        log.info("{} concentrations below {} masked in {}.", retVal, this.tolerance, dataset);
        return retVal;
    }

}

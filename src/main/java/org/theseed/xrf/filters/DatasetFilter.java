/**
 *
 */
package org.theseed.xrf.filters;

import org.theseed.xrf.data.XrfDataset;

/**
 * This is the base class for a dataset quality filter.  A filter modifies a dataset in place, either by removing
 * whole measurement rows or by marking individual values as missing.  Either way, row correspondence across the
 * dataset is preserved.
 *
 */
public abstract class DatasetFilter {

    /**
     * This interface is used to specify parameters the filter may need from the client.
     */
    public interface IParms {

        /**
         * @return the expected sum of each compositional row
         */
        public double getClosureConstant();

        /**
         * @return the minimum reliable concentration
         */
        public double getDetectionTolerance();

    }

    /**
     * This enum describes the different types of filters.
     */
    public static enum Type {
        CLOSURE {
            @Override
            public DatasetFilter create(IParms processor) {
                return new ClosureFilter(processor);
            }
        }, DETECTION_LIMIT {
            @Override
            public DatasetFilter create(IParms processor) {
                return new DetectionLimitFilter(processor);
            }
        };

        /**
         * @return a filter of this type
         *
         * @param processor		controlling command processor
         */
        public abstract DatasetFilter create(IParms processor);

    }

    /**
     * Construct a dataset filter.
     *
     * @param processor		controlling command processor
     */
    public DatasetFilter(IParms processor) { }

    /**
     * Apply this filter to a dataset.
     *
     * @param dataset	dataset to filter in place
     *
     * @return the number of rows removed or values masked
     */
    public abstract int apply(XrfDataset dataset);

}

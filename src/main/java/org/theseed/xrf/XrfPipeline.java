/**
 *
 */
package org.theseed.xrf;

import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xrf.data.XrfDataset;
import org.theseed.xrf.data.XrfDatasetBuilder;
import org.theseed.xrf.data.XrfLayout;
import org.theseed.xrf.filters.DatasetFilter;
import org.theseed.xrf.io.RawTable;
import org.theseed.xrf.io.XrfTableReader;
import org.theseed.xrf.transform.ClrTransformer;

/**
 * This object loads an XRF export file and runs the standard processing on it.  The file is read and parsed into
 * a dataset, the closure filter removes measurements that do not sum to the closure constant, the detection-limit
 * filter masks unreliable concentrations, and finally the CLR transform is computed.  The stages must run in
 * this order, since each depends on the rows and values left by the one before.
 *
 * A pipeline holds no state between files, so separate instances can run on separate threads.
 *
 */
public class XrfPipeline {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(XrfPipeline.class);
    /** column layout of the input files */
    private XrfLayout layout;
    /** filters to apply, in order */
    private DatasetFilter[] filters;
    /** number of rows in the last file read, before filtering */
    private int rawCount;

    /**
     * Construct a pipeline.
     *
     * @param processor		controlling command processor, which supplies the filter parameters
     * @param layout		column layout of the input files
     */
    public XrfPipeline(DatasetFilter.IParms processor, XrfLayout layout) {
        this.layout = layout;
        this.filters = new DatasetFilter[] { DatasetFilter.Type.CLOSURE.create(processor),
                DatasetFilter.Type.DETECTION_LIMIT.create(processor) };
        this.rawCount = 0;
    }

    /**
     * Load and process an XRF export file.
     *
     * @param inFile	export file to read
     *
     * @return the filtered and transformed dataset
     *
     * @throws IOException
     */
    public XrfDataset load(File inFile) throws IOException {
        log.info("Reading XRF data from {}.", inFile);
        RawTable table = new XrfTableReader(this.layout.getHeaderRows()).read(inFile);
        XrfDataset retVal = new XrfDatasetBuilder(this.layout).build(table);
        this.rawCount = retVal.size();
        this.process(retVal);
        return retVal;
    }

    /**
     * Run the filters and the CLR transform on a dataset.
     *
     * @param dataset	dataset to process in place
     */
    public void process(XrfDataset dataset) {
        for (DatasetFilter filter : this.filters)
            filter.apply(dataset);
        ClrTransformer.apply(dataset);
    }

    /**
     * @return the number of measurements in the most recent file before filtering
     */
    public int getRawCount() {
        return this.rawCount;
    }

}

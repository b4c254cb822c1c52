/**
 *
 */
package org.theseed.xrf;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xrf.data.XrfDataset;
import org.theseed.xrf.data.XrfLayout;
import org.theseed.xrf.filters.DatasetFilter;
import org.theseed.xrf.filters.ScanMode;
import org.theseed.xrf.utils.BaseReportProcessor;
import org.theseed.xrf.utils.ParseFailureException;

/**
 * This command produces a summary report for an XRF export file.  The report begins with the sample ID and the number
 * of measurements before and after the closure filter.  It then lists, for each element, the number of usable
 * concentrations, the number masked as missing, the minimum, maximum, and mean concentration, and the mean CLR value.
 *
 * The positional parameter is the name of the XRF export file.  The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more detailed log messages
 * -o	output file (if not STDOUT)
 *
 * --closure	expected sum of each measurement's concentrations (default 1000000)
 * --mode		scanner mode, which determines the default detection tolerance (GEOCHEM or SOIL)
 * --tol		minimum reliable concentration (overrides the mode default)
 * --layout		export file layout version
 *
 */
public class SummaryProcessor extends BaseReportProcessor implements DatasetFilter.IParms {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SummaryProcessor.class);
    /** detection tolerance to use */
    private double tolerance;

    // COMMAND-LINE OPTIONS

    /** closure constant */
    @Option(name = "--closure", aliases = { "-k" }, metaVar = "100", usage = "expected sum of each measurement")
    private double closure;

    /** scanner mode */
    @Option(name = "--mode", usage = "scanner mode (determines default detection tolerance)")
    private ScanMode mode;

    /** detection tolerance override */
    @Option(name = "--tol", metaVar = "50", usage = "minimum reliable concentration (if not the mode default)")
    private double tolOverride;

    /** export layout */
    @Option(name = "--layout", usage = "export file layout version")
    private XrfLayout layout;

    /** input file */
    @Argument(index = 0, metaVar = "core.out", usage = "XRF export file", required = true)
    private File inFile;

    @Override
    protected void setReporterDefaults() {
        this.closure = 1000000.0;
        this.mode = ScanMode.GEOCHEM;
        this.tolOverride = Double.NaN;
        this.layout = XrfLayout.MSCL_7_9;
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        if (! this.inFile.canRead())
            throw new FileNotFoundException("XRF file " + this.inFile + " is not found or unreadable.");
        if (this.closure <= 0.0)
            throw new ParseFailureException("Closure constant must be positive.");
        if (Double.isNaN(this.tolOverride))
            this.tolerance = this.mode.getTolerance();
        else if (this.tolOverride < 0.0)
            throw new ParseFailureException("Detection tolerance cannot be negative.");
        else
            this.tolerance = this.tolOverride;
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        XrfPipeline pipeline = new XrfPipeline(this, this.layout);
        XrfDataset dataset = pipeline.load(this.inFile);
        writer.format("sample\t%s%n", dataset.getId());
        writer.format("measurements\t%d%n", pipeline.getRawCount());
        writer.format("closed\t%d%n", dataset.size());
        writer.println("element\tgood\tmissing\tmin\tmax\tmean\tmean_clr");
        double[][] comp = dataset.getComp();
        double[][] clr = dataset.getClr();
        for (int j = 0; j < dataset.width(); j++) {
            SummaryStatistics compStats = new SummaryStatistics();
            SummaryStatistics clrStats = new SummaryStatistics();
            int missing = 0;
            for (int i = 0; i < comp.length; i++) {
                if (Double.isNaN(comp[i][j]))
                    missing++;
                else {
                    compStats.addValue(comp[i][j]);
                    if (Double.isFinite(clr[i][j]))
                        clrStats.addValue(clr[i][j]);
                }
            }
            String element = dataset.getElements().get(j);
            if (compStats.getN() == 0)
                writer.format("%s\t0\t%d\t\t\t\t%n", element, missing);
            else
                writer.format("%s\t%d\t%d\t%.1f\t%.1f\t%.1f\t%.4f%n", element, compStats.getN(), missing,
                        compStats.getMin(), compStats.getMax(), compStats.getMean(), clrStats.getMean());
        }
        log.info("Summary complete for {} elements of {}.", dataset.width(), dataset);
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

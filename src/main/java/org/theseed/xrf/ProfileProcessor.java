/**
 *
 */
package org.theseed.xrf;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xrf.data.XrfDataset;
import org.theseed.xrf.data.XrfLayout;
import org.theseed.xrf.filters.DatasetFilter;
import org.theseed.xrf.filters.ScanMode;
import org.theseed.xrf.reports.DepthProfile;
import org.theseed.xrf.reports.ProfileReporter;
import org.theseed.xrf.transform.RunningMeanSmoother;
import org.theseed.xrf.utils.BaseProcessor;
import org.theseed.xrf.utils.ParseFailureException;

/**
 * This command reads an XRF export file and produces a depth-profile report.  For each requested series, the report
 * contains the unsmoothed values and a running-mean smoothed version.  An element symbol produces the element's
 * centered log-ratio values; a specification of the form "e1/e2" produces the log ratio of the two elements.
 *
 * The positional parameters are the name of the XRF export file and the series to report.  If no series are specified,
 * every element will be reported.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more detailed log messages
 * -o	output file (if not STDOUT; required for Excel output)
 *
 * --closure	expected sum of each measurement's concentrations (default 1000000)
 * --mode		scanner mode, which determines the default detection tolerance (GEOCHEM or SOIL)
 * --tol		minimum reliable concentration (overrides the mode default)
 * --smooth		number of points on each side for smoothing, or 0 for no smoothing (default 5)
 * --fillGaps	if specified, smoothed values will be computed at positions with missing data
 * --keepInf	if specified, infinite values will not be treated as missing during smoothing
 * --format		output format (TEXT or EXCEL)
 * --layout		export file layout version
 *
 */
public class ProfileProcessor extends BaseProcessor implements DatasetFilter.IParms {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ProfileProcessor.class);
    /** detection tolerance to use */
    private double tolerance;

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "--output", aliases = { "-o" }, metaVar = "profile.tbl", usage = "output file (if not STDOUT)")
    private File outFile;

    /** closure constant */
    @Option(name = "--closure", aliases = { "-k" }, metaVar = "100", usage = "expected sum of each measurement")
    private double closure;

    /** scanner mode */
    @Option(name = "--mode", usage = "scanner mode (determines default detection tolerance)")
    private ScanMode mode;

    /** detection tolerance override */
    @Option(name = "--tol", metaVar = "50", usage = "minimum reliable concentration (if not the mode default)")
    private double tolOverride;

    /** smoothing half-window */
    @Option(name = "--smooth", aliases = { "-n" }, metaVar = "3", usage = "smoothing half-window size (0 for none)")
    private int halfWindow;

    /** if specified, gaps will be filled in by the smoother */
    @Option(name = "--fillGaps", usage = "if specified, smoothed values will be output at missing-data positions")
    private boolean fillGaps;

    /** if specified, infinite values will be averaged in by the smoother */
    @Option(name = "--keepInf", usage = "if specified, infinite values will not be treated as missing when smoothing")
    private boolean keepInf;

    /** output format */
    @Option(name = "--format", usage = "output report format")
    private ProfileReporter.Type outFormat;

    /** export layout */
    @Option(name = "--layout", usage = "export file layout version")
    private XrfLayout layout;

    /** input file */
    @Argument(index = 0, metaVar = "core.out", usage = "XRF export file", required = true)
    private File inFile;

    /** series to report */
    @Argument(index = 1, metaVar = "Fe Ca/Ti ...", usage = "elements and element ratios to report")
    private List<String> series;

    @Override
    protected void setDefaults() {
        this.outFile = null;
        this.closure = 1000000.0;
        this.mode = ScanMode.GEOCHEM;
        this.tolOverride = Double.NaN;
        this.halfWindow = 5;
        this.fillGaps = false;
        this.keepInf = false;
        this.outFormat = ProfileReporter.Type.TEXT;
        this.layout = XrfLayout.MSCL_7_9;
        this.series = new ArrayList<String>();
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (! this.inFile.canRead())
            throw new FileNotFoundException("XRF file " + this.inFile + " is not found or unreadable.");
        if (this.closure <= 0.0)
            throw new ParseFailureException("Closure constant must be positive.");
        if (this.halfWindow < 0)
            throw new ParseFailureException("Smoothing half-window cannot be negative.");
        if (Double.isNaN(this.tolOverride))
            this.tolerance = this.mode.getTolerance();
        else if (this.tolOverride < 0.0)
            throw new ParseFailureException("Detection tolerance cannot be negative.");
        else
            this.tolerance = this.tolOverride;
        if (this.outFile == null && this.outFormat.needsFile())
            throw new ParseFailureException("An output file is required for " + this.outFormat + " reports.");
        log.info("Closure constant is {}.  Detection tolerance is {}.", this.closure, this.tolerance);
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        XrfPipeline pipeline = new XrfPipeline(this, this.layout);
        XrfDataset dataset = pipeline.load(this.inFile);
        if (this.series.isEmpty())
            this.series.addAll(dataset.getElements());
        // Set up the smoother.
        RunningMeanSmoother smoother = null;
        if (this.halfWindow > 0)
            smoother = new RunningMeanSmoother(this.halfWindow, ! this.keepInf, ! this.fillGaps);
        DepthProfile profile = new DepthProfile(dataset, smoother);
        int count = 0;
        for (String name : this.series) {
            if (profile.addSeries(name))
                count++;
        }
        log.info("{} series selected for profile of {}.", count, dataset);
        // Write the report.
        OutputStream outStream = (this.outFile == null ? System.out : new FileOutputStream(this.outFile));
        try (ProfileReporter reporter = this.outFormat.create(outStream)) {
            profile.write(reporter);
        } finally {
            if (this.outFile != null)
                outStream.close();
        }
        log.info("{} profile rows written.", profile.size());
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

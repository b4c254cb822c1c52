/**
 *
 */
package org.theseed.xrf;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theseed.xrf.data.XrfDataset;
import org.theseed.xrf.data.XrfLayout;
import org.theseed.xrf.filters.FilterParms;

/**
 * Tests for the full processing pipeline and the commands built on it.
 *
 */
public class XrfPipelineTest {

    @TempDir
    File tempDir;

    @Test
    public void testPipeline() throws IOException {
        XrfPipeline pipeline = new XrfPipeline(new FilterParms(1000000.0, 500.0), XrfLayout.MSCL_7_9);
        XrfDataset dataset = pipeline.load(new File("data", "core1.out"));
        assertThat(pipeline.getRawCount(), equalTo(6));
        assertThat(dataset.size(), equalTo(4));
        assertThat(dataset.getId(), equalTo("VC22-667-817cm_archive"));
        // Every correlated array has the same row count.
        int n = dataset.size();
        assertThat(dataset.getComp().length, equalTo(n));
        assertThat(dataset.getError().length, equalTo(n));
        assertThat(dataset.getClr().length, equalTo(n));
        assertThat(dataset.getSectionNumber().length, equalTo(n));
        assertThat(dataset.getSectionDepth().length, equalTo(n));
        assertThat(dataset.getTotalCounts().length, equalTo(n));
        assertThat(dataset.getLiveTime().length, equalTo(n));
        assertThat(dataset.getTotalCounts(), equalTo(new double[] { 120000.0, 118000.0, 121000.0, 119000.0 }));
        // Each CLR row sums to zero over its usable values.
        for (double[] row : dataset.getClr()) {
            double sum = 0.0;
            for (double v : row)
                if (! Double.isNaN(v)) sum += v;
            assertThat(sum, closeTo(0.0, 1e-9));
        }
        assertThat(Double.isNaN(dataset.getClr()[1][3]), equalTo(true));
        double expected = Math.log(600000.0) - (Math.log(600000.0) + Math.log(200000.0) + Math.log(150000.0)
                + Math.log(50000.0)) / 4.0;
        assertThat(dataset.getClrValues("Si")[0], closeTo(expected, 1e-9));
        // Independent loads produce independent datasets.
        XrfDataset other = pipeline.load(new File("data", "core1.out"));
        other.retainRows(i -> i == 0);
        assertThat(dataset.size(), equalTo(4));
    }

    @Test
    public void testSoilMode() throws IOException {
        XrfPipeline pipeline = new XrfPipeline(new FilterParms(1000000.0, 50.0), XrfLayout.MSCL_7_9);
        XrfDataset dataset = pipeline.load(new File("data", "core1.out"));
        assertThat(dataset.countMissing(), equalTo(0));
        assertThat(Double.isNaN(dataset.getClr()[1][3]), equalTo(false));
    }

    @Test
    public void testSummaryCommand() throws IOException {
        File outFile = new File(this.tempDir, "summary.tbl");
        SummaryProcessor processor = new SummaryProcessor();
        boolean ok = processor.parseCommand(new String[] { "-o", outFile.getPath(), "data/core1.out" });
        assertThat(ok, equalTo(true));
        processor.run();
        List<String> lines = FileUtils.readLines(outFile, StandardCharsets.UTF_8);
        assertThat(lines.size(), equalTo(8));
        assertThat(lines.get(0), equalTo("sample\tVC22-667-817cm_archive"));
        assertThat(lines.get(1), equalTo("measurements\t6"));
        assertThat(lines.get(2), equalTo("closed\t4"));
        assertThat(lines.get(4), startsWith("Si\t4\t0\t"));
        assertThat(lines.get(7), startsWith("Fe\t3\t1\t"));
    }

    @Test
    public void testProfileCommand() throws IOException {
        File outFile = new File(this.tempDir, "profile.tbl");
        ProfileProcessor processor = new ProfileProcessor();
        boolean ok = processor.parseCommand(new String[] { "-o", outFile.getPath(), "--smooth", "1",
                "data/core1.out", "Fe", "Ca/Ti", "Ca/K" });
        assertThat(ok, equalTo(true));
        processor.run();
        List<String> lines = FileUtils.readLines(outFile, StandardCharsets.UTF_8);
        assertThat(lines.size(), equalTo(5));
        assertThat(lines.get(0), equalTo("depth\tFe\tFe smoothed\tCa/K\tCa/K smoothed"));
        // Excel output needs a file.
        processor = new ProfileProcessor();
        ok = processor.parseCommand(new String[] { "--format", "EXCEL", "data/core1.out" });
        assertThat(ok, equalTo(false));
        // All the elements are reported by default.
        File excelFile = new File(this.tempDir, "profile.xlsx");
        processor = new ProfileProcessor();
        ok = processor.parseCommand(new String[] { "--format", "EXCEL", "-o", excelFile.getPath(), "--smooth", "0",
                "data/core1.out" });
        assertThat(ok, equalTo(true));
        processor.run();
        assertThat(excelFile.length(), greaterThan(0L));
    }

}

/**
 *
 */
package org.theseed.xrf.data;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.theseed.xrf.io.RawTable;
import org.theseed.xrf.io.XrfFormatException;
import org.theseed.xrf.io.XrfTableReader;

/**
 * Tests for converting raw tables to datasets.
 *
 */
public class XrfDatasetBuilderTest {

    /**
     * @return a raw table with a standard header and the specified element row and data
     *
     * @param idLine		first header line
     * @param elementRow	element header cells
     * @param data			data rows
     */
    private static RawTable makeTable(String idLine, String[] elementRow, double[][] data) {
        List<String[]> header = new ArrayList<String[]>(10);
        for (int i = 0; i < 10; i++)
            header.add(new String[] { "header" });
        header.set(0, new String[] { idLine });
        header.set(7, elementRow);
        int width = (data.length == 0 ? 0 : data[0].length);
        return new RawTable(header, data, width);
    }

    @Test
    public void testFixture() throws IOException {
        RawTable table = new XrfTableReader(10).read(new File("data", "core1.out"));
        XrfDataset dataset = new XrfDatasetBuilder(XrfLayout.MSCL_7_9).build(table);
        assertThat(dataset.getId(), equalTo("VC22-667-817cm_archive"));
        assertThat(dataset.getElements(), contains("Si", "K", "Ca", "Fe"));
        assertThat(dataset.size(), equalTo(6));
        assertThat(dataset.width(), equalTo(4));
        assertThat(dataset.getDepth()[1], equalTo(1.0));
        assertThat(dataset.getSectionNumber()[5], equalTo(2.0));
        assertThat(dataset.getSectionDepth()[5], equalTo(0.0));
        assertThat(dataset.getTotalCounts()[2], equalTo(90000.0));
        assertThat(dataset.getLiveTime()[0], equalTo(30.0));
        assertThat(dataset.getComp()[0][2], equalTo(150000.0));
        assertThat(dataset.getError()[0][2], equalTo(300.0));
        assertThat(dataset.getComp()[1][3], equalTo(300.0));
        assertThat(dataset.getError()[1][3], equalTo(80.0));
        assertThat(Double.isNaN(dataset.getComp()[4][3]), equalTo(true));
        double[] kValues = dataset.getConcentrations("K");
        assertThat(kValues[0], equalTo(200000.0));
        assertThat(kValues[5], equalTo(250000.0));
        assertThat(Double.isNaN(dataset.getClr()[0][0]), equalTo(true));
    }

    @Test
    public void testIdParsing() throws IOException {
        String[] elements = new String[] { "Depth", "Section", "Sec Depth", "Counts", "Live", "Fe", "Fe Err" };
        double[][] data = new double[][] { { 1.0, 1.0, 1.0, 100.0, 30.0, 1000000.0, 10.0 } };
        RawTable table = makeTable("a b c d core7.final.out e", elements, data);
        XrfDataset dataset = new XrfDatasetBuilder(XrfLayout.MSCL_7_9).build(table);
        assertThat(dataset.getId(), equalTo("core7.final"));
        assertThat(dataset.getElements(), contains("Fe"));
        // Trailing blank cells on the element row are ignored.
        elements = new String[] { "Depth", "Section", "Sec Depth", "Counts", "Live", "Fe", "Fe Err", "", "" };
        dataset = new XrfDatasetBuilder(XrfLayout.MSCL_7_9).build(makeTable("a b c d core8", elements, data));
        assertThat(dataset.getId(), equalTo("core8"));
        assertThat(dataset.getElements(), contains("Fe"));
    }

    @Test
    public void testFormatErrors() {
        XrfDatasetBuilder builder = new XrfDatasetBuilder(XrfLayout.MSCL_7_9);
        String[] elements = new String[] { "Depth", "Section", "Sec Depth", "Counts", "Live", "Fe", "Fe Err" };
        double[][] data = new double[][] { { 1.0, 1.0, 1.0, 100.0, 30.0, 1000000.0, 10.0 } };
        // Too few identifier tokens is a format error, but not a layout mismatch.
        XrfFormatException e = assertThrows(XrfFormatException.class,
                () -> builder.build(makeTable("a b c", elements, data)));
        assertThat(e, not(instanceOf(LayoutMismatchException.class)));
        // An element row with nothing past the offset is a format error.
        String[] noElements = new String[] { "Depth", "Section" };
        e = assertThrows(XrfFormatException.class, () -> builder.build(makeTable("a b c d e", noElements, data)));
        assertThat(e, not(instanceOf(LayoutMismatchException.class)));
    }

    @Test
    public void testLayoutMismatch() {
        XrfDatasetBuilder builder = new XrfDatasetBuilder(XrfLayout.MSCL_7_9);
        double[][] data = new double[][] { { 1.0, 1.0, 1.0, 100.0, 30.0, 1000000.0, 10.0 } };
        // An odd number of element entries means the interleaving is broken.
        String[] oddRow = new String[] { "Depth", "Section", "Sec Depth", "Counts", "Live", "Fe", "Fe Err", "Ca" };
        assertThrows(LayoutMismatchException.class, () -> builder.build(makeTable("a b c d e", oddRow, data)));
        // A blank symbol in the middle is a mismatch.
        String[] blankRow = new String[] { "Depth", "Section", "Sec Depth", "Counts", "Live", "", "Err", "Fe", "Err" };
        assertThrows(LayoutMismatchException.class, () -> builder.build(makeTable("a b c d e", blankRow, data)));
        // Two elements need nine data columns, and we only have seven.
        String[] twoRow = new String[] { "Depth", "Section", "Sec Depth", "Counts", "Live", "Fe", "Fe Err", "Ca", "Ca Err" };
        assertThrows(LayoutMismatchException.class, () -> builder.build(makeTable("a b c d e", twoRow, data)));
    }

    @Test
    public void testLayout() {
        XrfLayout layout = XrfLayout.MSCL_7_9;
        assertThat(layout.getHeaderRows(), equalTo(10));
        assertThat(layout.compCol(0), equalTo(5));
        assertThat(layout.errorCol(0), equalTo(6));
        assertThat(layout.compCol(3), equalTo(11));
        assertThat(layout.errorCol(3), equalTo(12));
        assertThat(layout.requiredWidth(4), equalTo(13));
        assertThat(layout.requiredWidth(0), equalTo(5));
    }

}

/**
 *
 */
package org.theseed.xrf.data;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

/**
 * Tests for the dataset's correlated-array operations.
 *
 */
public class XrfDatasetTest {

    /**
     * @return a small dataset where every value encodes its original row index
     *
     * @param n		number of rows
     */
    public static XrfDataset makeDataset(int n) {
        double[] depth = new double[n];
        double[] section = new double[n];
        double[] secDepth = new double[n];
        double[] counts = new double[n];
        double[] live = new double[n];
        double[][] comp = new double[n][2];
        double[][] error = new double[n][2];
        for (int i = 0; i < n; i++) {
            depth[i] = i;
            section[i] = 100 + i;
            secDepth[i] = 200 + i;
            counts[i] = 300 + i;
            live[i] = 400 + i;
            comp[i][0] = 1000 * (i + 1);
            comp[i][1] = 10 * (i + 1);
            error[i][0] = -i;
            error[i][1] = -i - 0.5;
        }
        return new XrfDataset("test", Arrays.asList("Fe", "Ca"), depth, section, secDepth, counts, live, comp, error);
    }

    @Test
    public void testRetainRows() {
        XrfDataset dataset = makeDataset(6);
        double[][] clr = new double[6][2];
        for (int i = 0; i < 6; i++)
            Arrays.fill(clr[i], 500 + i);
        dataset.setClr(clr);
        dataset.putSeries("Fe/Ca", new double[] { 0, 1, 2, 3, 4, 5 });
        int removed = dataset.retainRows(i -> i % 2 == 0);
        assertThat(removed, equalTo(3));
        assertThat(dataset.size(), equalTo(3));
        for (int i = 0; i < dataset.size(); i++) {
            int orig = (int) dataset.getDepth()[i];
            assertThat(orig, equalTo(2 * i));
            assertThat(dataset.getSectionNumber()[i], equalTo(100.0 + orig));
            assertThat(dataset.getSectionDepth()[i], equalTo(200.0 + orig));
            assertThat(dataset.getTotalCounts()[i], equalTo(300.0 + orig));
            assertThat(dataset.getLiveTime()[i], equalTo(400.0 + orig));
            assertThat(dataset.getComp()[i][0], equalTo(1000.0 * (orig + 1)));
            assertThat(dataset.getConcentrations("Ca")[i], equalTo(10.0 * (orig + 1)));
            assertThat(dataset.getError()[i][1], equalTo(-orig - 0.5));
            assertThat(dataset.getClr()[i][1], equalTo(500.0 + orig));
            assertThat(dataset.getSeries("Fe/Ca")[i], equalTo((double) orig));
        }
        // Removing nothing leaves everything alone.
        assertThat(dataset.retainRows(i -> true), equalTo(0));
        assertThat(dataset.size(), equalTo(3));
        assertThat(dataset.retainRows(i -> false), equalTo(3));
        assertThat(dataset.size(), equalTo(0));
        assertThat(dataset.getComp().length, equalTo(0));
        assertThat(dataset.getClr().length, equalTo(0));
    }

    @Test
    public void testMaskAndSeries() {
        XrfDataset dataset = makeDataset(4);
        int masked = dataset.maskComposition(v -> v < 25.0);
        assertThat(masked, equalTo(2));
        assertThat(dataset.countMissing(), equalTo(2));
        assertThat(dataset.size(), equalTo(4));
        // The element vector sees the masking.
        double[] ca = dataset.getConcentrations("Ca");
        assertThat(Double.isNaN(ca[0]), equalTo(true));
        assertThat(Double.isNaN(ca[1]), equalTo(true));
        assertThat(ca[2], equalTo(30.0));
        // Masking again does not recount missing values.
        assertThat(dataset.maskComposition(v -> v < 25.0), equalTo(0));
        assertThat(dataset.getKeys(), contains("depth", "section number", "section depth", "xrf total counts",
                "live time", "Fe", "Ca"));
        assertThat(dataset.getSeries("depth")[3], equalTo(3.0));
        assertThat(dataset.getSeries("Fe")[3], equalTo(4000.0));
        assertThat(dataset.getSeries("Zr"), nullValue());
        assertThat(dataset.getElementIndex("Ca"), equalTo(1));
        assertThat(dataset.getElementIndex("Zr"), equalTo(-1));
        assertThrows(IllegalArgumentException.class, () -> dataset.getConcentrations("Zr"));
        assertThrows(IllegalArgumentException.class, () -> dataset.putSeries("bad", new double[3]));
        assertThrows(IllegalArgumentException.class, () -> dataset.setClr(new double[4][3]));
    }

}

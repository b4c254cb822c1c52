/**
 *
 */
package org.theseed.xrf.reports;

import java.io.IOException;
import java.io.OutputStream;

import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This report version writes the depth profile to an Excel workbook with a single sheet named for the sample.
 * Missing values are left as empty cells so that charts show gaps.
 *
 */
public class ExcelProfileReporter extends ProfileReporter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ExcelProfileReporter.class);
    /** current workbook */
    private Workbook workbook;
    /** current worksheet */
    private Sheet worksheet;
    /** next row number */
    private int rowNum;
    /** current row */
    private Row ssRow;
    /** header style */
    private CellStyle headStyle;
    /** normal style */
    private CellStyle numStyle;
    /** number of columns in each row */
    private int colCount;
    /** column width, in 1/256ths of a character */
    private static final int COL_WIDTH = 16 * 256;

    public ExcelProfileReporter(OutputStream outStream) {
        super(outStream);
        this.colCount = 0;
    }

    @Override
    public void openReport(String title) {
        log.info("Initializing workbook.");
        this.workbook = new XSSFWorkbook();
        String sheetName = (StringUtils.isBlank(title) ? "Profile" : WorkbookUtil.createSafeSheetName(title));
        this.worksheet = this.workbook.createSheet(sheetName);
        DataFormat format = this.workbook.createDataFormat();
        short fmt = format.getFormat("###0.0000");
        // Create the header style.
        this.headStyle = this.workbook.createCellStyle();
        this.headStyle.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        this.headStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        // Create the number style.
        this.numStyle = this.workbook.createCellStyle();
        this.numStyle.setDataFormat(fmt);
        this.rowNum = 0;
    }

    @Override
    public void writeHeaders(String[] columns) {
        this.addRow();
        for (int i = 0; i < columns.length; i++) {
            Cell labelCell = this.ssRow.createCell(i);
            labelCell.setCellValue(columns[i]);
            labelCell.setCellStyle(this.headStyle);
        }
        if (columns.length > this.colCount)
            this.colCount = columns.length;
        this.worksheet.createFreezePane(0, 1);
    }

    @Override
    public void writeRow(double depth, double[] values) {
        this.addRow();
        this.setNumCell(0, depth);
        for (int i = 0; i < values.length; i++)
            this.setNumCell(i + 1, values[i]);
    }

    /**
     * Store a number in a cell of the current row.  A missing value leaves the cell blank.
     *
     * @param col		column index of the cell
     * @param value		value to store
     */
    private void setNumCell(int col, double value) {
        Cell dataCell = this.ssRow.createCell(col);
        if (Double.isFinite(value)) {
            dataCell.setCellValue(value);
            dataCell.setCellStyle(this.numStyle);
        }
    }

    /**
     * Add a new row to the spreadsheet.
     */
    private void addRow() {
        this.ssRow = this.worksheet.createRow(this.rowNum);
        this.rowNum++;
    }

    @Override
    protected void cleanup() throws IOException {
        if (this.workbook != null) {
            for (int i = 0; i < this.colCount; i++)
                this.worksheet.setColumnWidth(i, COL_WIDTH);
            log.info("Writing workbook.");
            this.workbook.write(this.getOutStream());
            this.workbook.close();
        }
    }

}

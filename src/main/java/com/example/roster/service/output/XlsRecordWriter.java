package com.example.roster.service.output;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Component;

/**
 * Legacy Excel 97-2003 workbook ({@code .xls}, OLE2 container).
 */
@Component
public class XlsRecordWriter extends WorkbookRecordWriter {

    @Override
    protected Workbook createWorkbook() {
        return new HSSFWorkbook();
    }
}

package com.example.roster.service.output;

import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

/**
 * Office Open XML workbook ({@code .xlsx}).
 */
@Component
public class XlsxRecordWriter extends WorkbookRecordWriter {

    @Override
    protected Workbook createWorkbook() {
        return new XSSFWorkbook();
    }
}

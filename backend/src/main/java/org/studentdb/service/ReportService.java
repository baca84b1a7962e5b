package org.studentdb.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.studentdb.dto.EnrollmentRosterResponse;
import org.studentdb.dto.PaymentSummaryResponse;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Spreadsheet exports of the reporting queries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportService {

    public static final String XLSX_CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private static final int COLUMN_WIDTH = 24 * 256;

    private static final String[] PAYMENT_HEADERS = {"Student ID", "Full name", "Total paid"};
    private static final String[] ROSTER_HEADERS = {"Student ID", "Full name", "Course", "Enroll date"};

    private final PaymentService paymentService;
    private final EnrollmentService enrollmentService;

    public void exportPaymentSummary(OutputStream out) throws IOException {
        List<PaymentSummaryResponse> rows = paymentService.getPaymentSummary();

        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Payments");
            writeHeader(workbook, sheet, PAYMENT_HEADERS);

            int rowNum = 1;
            for (PaymentSummaryResponse summary : rows) {
                Row row = sheet.createRow(rowNum++);
                row.createCell(0).setCellValue(summary.getStudentId());
                row.createCell(1).setCellValue(summary.getFullName());
                row.createCell(2).setCellValue(summary.getTotalPaid().doubleValue());
            }

            setColumnWidths(sheet, PAYMENT_HEADERS.length);
            workbook.write(out);
        }
        log.info("Payment summary exported: {} students", rows.size());
    }

    public void exportEnrollmentRoster(OutputStream out) throws IOException {
        List<EnrollmentRosterResponse> rows = enrollmentService.getEnrollmentRoster();

        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Enrollments");
            writeHeader(workbook, sheet, ROSTER_HEADERS);

            CreationHelper creationHelper = workbook.getCreationHelper();
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(creationHelper.createDataFormat().getFormat("yyyy-mm-dd hh:mm"));

            int rowNum = 1;
            for (EnrollmentRosterResponse entry : rows) {
                Row row = sheet.createRow(rowNum++);
                row.createCell(0).setCellValue(entry.getStudentId());
                row.createCell(1).setCellValue(entry.getFullName());
                row.createCell(2).setCellValue(entry.getCourseName());
                if (entry.getEnrollDate() != null) {
                    var cell = row.createCell(3);
                    cell.setCellValue(entry.getEnrollDate());
                    cell.setCellStyle(dateStyle);
                }
            }

            setColumnWidths(sheet, ROSTER_HEADERS.length);
            workbook.write(out);
        }
        log.info("Enrollment roster exported: {} rows", rows.size());
    }

    private void writeHeader(Workbook workbook, Sheet sheet, String[] headers) {
        CellStyle headerStyle = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        headerStyle.setFont(font);

        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < headers.length; i++) {
            var cell = headerRow.createCell(i);
            cell.setCellValue(headers[i]);
            cell.setCellStyle(headerStyle);
        }
    }

    // autoSizeColumn needs AWT fonts
    private void setColumnWidths(Sheet sheet, int columns) {
        for (int i = 0; i < columns; i++) {
            sheet.setColumnWidth(i, COLUMN_WIDTH);
        }
    }
}

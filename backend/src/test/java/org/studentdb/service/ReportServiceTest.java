package org.studentdb.service;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.studentdb.IntegrationTestSupport;
import org.studentdb.TestClockConfig;
import org.studentdb.dto.CourseRequest;
import org.studentdb.dto.PaymentRequest;
import org.studentdb.dto.StudentRegistrationRequest;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class ReportServiceTest extends IntegrationTestSupport {

    @Autowired
    private ReportService reportService;

    @Autowired
    private StudentService studentService;

    @Autowired
    private CourseService courseService;

    @Autowired
    private EnrollmentService enrollmentService;

    @Autowired
    private PaymentService paymentService;

    private Long ashaId;
    private Long raviId;

    @BeforeEach
    void setUp() {
        ashaId = studentService.registerStudent(StudentRegistrationRequest.builder()
            .firstName("Asha").lastName("Patel").build());
        raviId = studentService.registerStudent(StudentRegistrationRequest.builder()
            .firstName("Ravi").lastName("Kumar").build());
        Long courseId = courseService.createCourse(CourseRequest.builder()
            .name("Database Systems").code("DB101").credits(4).build());
        enrollmentService.enroll(ashaId, courseId);
        paymentService.recordPayment(PaymentRequest.builder().studentId(ashaId).amount(new BigDecimal("5000.50")).build());
    }

    @Test
    void exportPaymentSummary_writesOneRowPerStudent() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        reportService.exportPaymentSummary(out);

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(out.toByteArray()))) {
            Sheet sheet = workbook.getSheet("Payments");
            assertThat(sheet).isNotNull();
            Row header = sheet.getRow(0);
            assertThat(header.getCell(0).getStringCellValue()).isEqualTo("Student ID");
            assertThat(header.getCell(2).getStringCellValue()).isEqualTo("Total paid");
            assertThat(sheet.getLastRowNum()).isEqualTo(2);

            Row asha = sheet.getRow(1);
            assertThat((long) asha.getCell(0).getNumericCellValue()).isEqualTo(ashaId);
            assertThat(asha.getCell(1).getStringCellValue()).isEqualTo("Asha Patel");
            assertThat(asha.getCell(2).getNumericCellValue()).isEqualTo(5000.50);

            Row ravi = sheet.getRow(2);
            assertThat((long) ravi.getCell(0).getNumericCellValue()).isEqualTo(raviId);
            assertThat(ravi.getCell(2).getNumericCellValue()).isZero();
        }
    }

    @Test
    void exportEnrollmentRoster_writesEnrollmentsWithDates() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        reportService.exportEnrollmentRoster(out);

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(out.toByteArray()))) {
            Sheet sheet = workbook.getSheet("Enrollments");
            assertThat(sheet.getLastRowNum()).isEqualTo(1);

            Row row = sheet.getRow(1);
            assertThat(row.getCell(1).getStringCellValue()).isEqualTo("Asha Patel");
            assertThat(row.getCell(2).getStringCellValue()).isEqualTo("Database Systems");
            assertThat(row.getCell(3).getLocalDateTimeCellValue()).isEqualTo(TestClockConfig.NOW);
        }
    }
}

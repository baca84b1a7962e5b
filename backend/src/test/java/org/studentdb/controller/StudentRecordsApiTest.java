package org.studentdb.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.studentdb.IntegrationTestSupport;
import org.studentdb.dto.CourseRequest;
import org.studentdb.service.CourseService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class StudentRecordsApiTest extends IntegrationTestSupport {

    private static final String ASHA = """
        {"firstName":"Asha","lastName":"Patel","dateOfBirth":"2003-08-14",
         "email":"asha.patel@example.com","phone":"9988776655","gender":"F"}
        """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CourseService courseService;

    private Long courseId;

    @BeforeEach
    void setUp() {
        courseId = courseService.createCourse(CourseRequest.builder()
            .name("Database Systems").code("DB101").credits(4).build());
    }

    private Long registerAsha() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/students")
                .with(httpBasic("registrar", "registrar-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(ASHA))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("id").asLong();
    }

    @Test
    void registerStudent_returnsIdAndRecordsActor() throws Exception {
        Long id = registerAsha();

        mockMvc.perform(get("/api/students/{id}", id).with(httpBasic("registrar", "registrar-secret")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fullName").value("Asha Patel"))
            .andExpect(jsonPath("$.gender").value("F"));

        mockMvc.perform(get("/api/audit/students/{id}", id).with(httpBasic("admin", "admin-secret")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].changeType").value("INSERT"))
            .andExpect(jsonPath("$[0].changedBy").value("registrar"));
    }

    @Test
    void registerStudent_duplicateEmail_returnsConflict() throws Exception {
        registerAsha();

        mockMvc.perform(post("/api/students")
                .with(httpBasic("registrar", "registrar-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(ASHA))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("DUPLICATE_VALUE"))
            .andExpect(jsonPath("$.error", startsWith("Student registration failed")));
    }

    @Test
    void registerStudent_invalidBody_returnsFieldErrors() throws Exception {
        mockMvc.perform(post("/api/students")
                .with(httpBasic("registrar", "registrar-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"firstName\":\"\",\"lastName\":\"Patel\",\"phone\":\"12\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.fields.firstName").exists())
            .andExpect(jsonPath("$.fields.phone").value("Phone must be 10 digits"));
    }

    @Test
    void registerStudent_invalidGender_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/students")
                .with(httpBasic("registrar", "registrar-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"firstName\":\"Asha\",\"lastName\":\"Patel\",\"gender\":\"X\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_GENDER"));
    }

    @Test
    void getStudent_unknownId_returnsNotFound() throws Exception {
        mockMvc.perform(get("/api/students/{id}", 424242).with(httpBasic("registrar", "registrar-secret")))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Student with ID 424242 not found"));
    }

    @Test
    void fullName_unknownId_returnsEmptyString() throws Exception {
        mockMvc.perform(get("/api/students/{id}/full-name", 424242).with(httpBasic("registrar", "registrar-secret")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fullName").value(""));
    }

    @Test
    void enrollTwice_returnsCreatedThenConflict() throws Exception {
        Long id = registerAsha();
        String body = "{\"studentId\":" + id + ",\"courseId\":" + courseId + "}";

        mockMvc.perform(post("/api/enrollments")
                .with(httpBasic("registrar", "registrar-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").isNumber());

        mockMvc.perform(post("/api/enrollments")
                .with(httpBasic("registrar", "registrar-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isConflict());

        mockMvc.perform(get("/api/students/{id}/courses", id).with(httpBasic("registrar", "registrar-secret")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].courseCode").value("DB101"));
    }

    @Test
    void negativePayment_returnsBadRequest() throws Exception {
        Long id = registerAsha();

        mockMvc.perform(post("/api/payments")
                .with(httpBasic("registrar", "registrar-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"studentId\":" + id + ",\"amount\":-10}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("CHECK_FAILED"));
    }

    @Test
    void paymentTotal_sumsRecordedPayments() throws Exception {
        Long id = registerAsha();

        mockMvc.perform(post("/api/payments")
                .with(httpBasic("registrar", "registrar-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"studentId\":" + id + ",\"amount\":5000}"))
            .andExpect(status().isCreated());

        mockMvc.perform(get("/api/students/{id}/payments/total", id).with(httpBasic("registrar", "registrar-secret")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalPaid").value(5000.0));
    }

    @Test
    void updateStudent_emailChange_isAudited() throws Exception {
        Long id = registerAsha();

        mockMvc.perform(patch("/api/students/{id}", id)
                .with(httpBasic("admin", "admin-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"asha2@example.com\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.email").value("asha2@example.com"));

        mockMvc.perform(get("/api/audit/students/{id}", id).with(httpBasic("admin", "admin-secret")))
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[1].changedField").value("Email"))
            .andExpect(jsonPath("$[1].oldValue").value("asha.patel@example.com"))
            .andExpect(jsonPath("$[1].newValue").value("asha2@example.com"))
            .andExpect(jsonPath("$[1].changedBy").value("admin"));
    }

    @Test
    void updateStudent_shortPhone_returnsFieldError() throws Exception {
        Long id = registerAsha();

        mockMvc.perform(patch("/api/students/{id}", id)
                .with(httpBasic("registrar", "registrar-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"phone\":\"12345\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.fields.phone").value("Phone must be 10 digits, or empty to clear it"));
    }

    @Test
    void exportPayments_returnsSpreadsheet() throws Exception {
        registerAsha();

        mockMvc.perform(get("/api/reports/payments/export").with(httpBasic("registrar", "registrar-secret")))
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Disposition", "attachment; filename=payments.xlsx"));
    }

    @Test
    void unauthenticatedRequest_isRejected() throws Exception {
        mockMvc.perform(get("/api/students/{id}", 1000))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void wrongPassword_isRejected() throws Exception {
        mockMvc.perform(get("/api/students/{id}", 1000).with(httpBasic("registrar", "wrong")))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void registrar_cannotDeleteOrReadAudit() throws Exception {
        Long id = registerAsha();

        mockMvc.perform(delete("/api/students/{id}", id).with(httpBasic("registrar", "registrar-secret")))
            .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/audit/students/{id}", id).with(httpBasic("registrar", "registrar-secret")))
            .andExpect(status().isForbidden());
    }

    @Test
    void admin_deletesStudentAndHistoryRemains() throws Exception {
        Long id = registerAsha();

        mockMvc.perform(delete("/api/students/{id}", id).with(httpBasic("admin", "admin-secret")))
            .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/students/{id}", id).with(httpBasic("admin", "admin-secret")))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/audit/students/{id}", id).with(httpBasic("admin", "admin-secret")))
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[1].changeType").value("DELETE"));
    }
}

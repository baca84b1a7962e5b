package org.studentdb.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.studentdb.dto.StudentRegistrationRequest;
import org.studentdb.dto.StudentUpdateRequest;
import org.studentdb.entity.Gender;
import org.studentdb.entity.Student;
import org.studentdb.exception.ConstraintViolationException;
import org.studentdb.exception.PersistenceErrorTranslator;
import org.studentdb.exception.ResourceNotFoundException;
import org.studentdb.repository.StudentRepository;
import org.studentdb.service.audit.StudentAuditService;
import org.studentdb.service.audit.StudentSnapshot;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class StudentService {

    // Phone is CHAR(10): shorter values would come back blank-padded
    private static final Pattern PHONE = Pattern.compile("\\d{10}");

    private final StudentRepository studentRepository;
    private final StudentAuditService auditService;
    private final PersistenceErrorTranslator errorTranslator;
    private final Clock clock;

    /**
     * Registers a student and appends its INSERT audit row.
     *
     * @return the new student id
     */
    @Transactional
    public Long registerStudent(StudentRegistrationRequest request) {
        String firstName = requireName(request.getFirstName(), "First name");
        String lastName = requireName(request.getLastName(), "Last name");
        Gender gender = Gender.fromCode(request.getGender());

        Student student = Student.builder()
            .firstName(firstName)
            .lastName(lastName)
            .dateOfBirth(request.getDateOfBirth())
            .email(emptyToNull(request.getEmail()))
            .phone(normalizePhone(request.getPhone()))
            .gender(gender)
            .admissionDate(LocalDateTime.now(clock))
            .active(true)
            .build();

        Student saved;
        try {
            saved = studentRepository.saveAndFlush(student);
        } catch (DataAccessException e) {
            throw errorTranslator.translate("Student registration", e);
        }
        auditService.recordChanges(List.of(), List.of(StudentSnapshot.of(saved)));

        log.info("Student registered: id={}, email={}", saved.getId(), saved.getEmail());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public Student getStudent(Long studentId) {
        return studentRepository.findById(studentId)
            .orElseThrow(() -> ResourceNotFoundException.studentNotFound(studentId));
    }

    /**
     * "First Last" for the student, or an empty string when no such student exists.
     */
    @Transactional(readOnly = true)
    public String getFullName(Long studentId) {
        if (studentId == null) {
            return "";
        }
        return studentRepository.findById(studentId)
            .map(Student::getFullName)
            .orElse("");
    }

    @Transactional
    public Student updateStudent(Long studentId, StudentUpdateRequest request) {
        return updateStudents(Collections.singletonMap(studentId, request)).get(0);
    }

    /**
     * Applies several partial updates as one statement: either every student is
     * updated and audited, or none is.
     */
    @Transactional
    public List<Student> updateStudents(Map<Long, StudentUpdateRequest> updates) {
        List<Student> students = new ArrayList<>();
        List<StudentSnapshot> before = new ArrayList<>();
        for (Long studentId : updates.keySet()) {
            Student student = studentRepository.findById(studentId)
                .orElseThrow(() -> ResourceNotFoundException.studentNotFound(studentId));
            before.add(StudentSnapshot.of(student));
            applyUpdate(student, updates.get(studentId));
            students.add(student);
        }

        List<Student> saved;
        try {
            saved = studentRepository.saveAllAndFlush(students);
        } catch (DataAccessException e) {
            throw errorTranslator.translate("Student update", e);
        }
        auditService.recordChanges(before, saved.stream().map(StudentSnapshot::of).toList());

        log.info("Students updated: {}", updates.keySet());
        return saved;
    }

    /**
     * Deletes a student. Enrollments and payments go with it through the
     * cascading foreign keys; the audit trail is kept.
     */
    @Transactional
    public void deleteStudent(Long studentId) {
        Student student = studentRepository.findById(studentId)
            .orElseThrow(() -> ResourceNotFoundException.studentNotFound(studentId));
        StudentSnapshot before = StudentSnapshot.of(student);

        try {
            studentRepository.delete(student);
            studentRepository.flush();
        } catch (DataAccessException e) {
            throw errorTranslator.translate("Student deletion", e);
        }
        auditService.recordChanges(List.of(before), List.of());

        log.info("Student deleted: id={}", studentId);
    }

    private void applyUpdate(Student student, StudentUpdateRequest request) {
        if (request == null) {
            return;
        }
        if (request.getFirstName() != null) {
            student.setFirstName(requireName(request.getFirstName(), "First name"));
        }
        if (request.getLastName() != null) {
            student.setLastName(requireName(request.getLastName(), "Last name"));
        }
        if (request.getDateOfBirth() != null) {
            student.setDateOfBirth(request.getDateOfBirth());
        }
        if (request.getEmail() != null) {
            student.setEmail(emptyToNull(request.getEmail()));
        }
        if (request.getPhone() != null) {
            student.setPhone(normalizePhone(request.getPhone()));
        }
        if (request.getGender() != null) {
            student.setGender(Gender.fromCode(request.getGender()));
        }
        if (request.getActive() != null) {
            student.setActive(request.getActive());
        }
    }

    private static String requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw ConstraintViolationException.required(field);
        }
        return value.trim();
    }

    private static String normalizePhone(String value) {
        String phone = emptyToNull(value);
        if (phone != null && !PHONE.matcher(phone).matches()) {
            throw ConstraintViolationException.invalidPhone(phone);
        }
        return phone;
    }

    private static String emptyToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

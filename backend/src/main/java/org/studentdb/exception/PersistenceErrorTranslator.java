package org.studentdb.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps data access failures raised while writing to the error taxonomy.
 * Classification uses the SQLState of the driver exception; the named
 * schema constraint, when it can be found in the driver message, gives the
 * human readable field.
 */
@Slf4j
@Component
public class PersistenceErrorTranslator {

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String NOT_NULL_VIOLATION = "23502";
    private static final String FK_VIOLATION = "23503";
    private static final String FK_PARENT_MISSING = "23506";
    private static final String CHECK_VIOLATION = "23514";
    private static final String CHECK_VIOLATION_H2 = "23513";
    private static final String VALUE_TOO_LONG = "22001";
    private static final String NUMERIC_OUT_OF_RANGE = "22003";

    private static final Map<String, String> CONSTRAINTS = new LinkedHashMap<>();

    static {
        CONSTRAINTS.put("uq_students_email", "student email");
        CONSTRAINTS.put("uq_courses_code", "course code");
        CONSTRAINTS.put("uq_faculty_email", "faculty email");
        CONSTRAINTS.put("uq_student_course", "enrollment for this student and course");
        CONSTRAINTS.put("ck_students_gender", "gender must be one of M, F, O");
        CONSTRAINTS.put("ck_courses_credits", "credits must be between 1 and 10");
        CONSTRAINTS.put("ck_faculty_salary", "salary must not be negative");
        CONSTRAINTS.put("ck_payments_amount", "amount must not be negative");
        CONSTRAINTS.put("fk_enroll_student", "student");
        CONSTRAINTS.put("fk_enroll_course", "course");
        CONSTRAINTS.put("fk_payment_student", "student");
    }

    public BaseException translate(String operation, DataAccessException ex) {
        SQLException sqlException = findSqlException(ex);
        String sqlState = sqlException != null ? sqlException.getSQLState() : null;
        String engineMessage = sqlException != null ? sqlException.getMessage() : ex.getMessage();
        String constraint = describeConstraint(engineMessage);

        log.warn("{} rejected by database (SQLState {}): {}", operation, sqlState, engineMessage);

        if (UNIQUE_VIOLATION.equals(sqlState)) {
            return ConflictException.duplicate(operation, constraint != null ? constraint : "value", ex);
        }
        if (CHECK_VIOLATION.equals(sqlState) || CHECK_VIOLATION_H2.equals(sqlState)) {
            return ConstraintViolationException.checkFailed(operation,
                constraint != null ? constraint : "check constraint violated", ex);
        }
        if (NOT_NULL_VIOLATION.equals(sqlState)) {
            return ConstraintViolationException.checkFailed(operation, "a required value is missing", ex);
        }
        if (VALUE_TOO_LONG.equals(sqlState)) {
            return ConstraintViolationException.checkFailed(operation, "a value is longer than its column allows", ex);
        }
        if (NUMERIC_OUT_OF_RANGE.equals(sqlState)) {
            return ConstraintViolationException.checkFailed(operation, "a number is outside the range its column allows", ex);
        }
        if (FK_VIOLATION.equals(sqlState) || FK_PARENT_MISSING.equals(sqlState)) {
            return new ResourceNotFoundException("REFERENCE_NOT_FOUND",
                String.format("%s failed: referenced %s does not exist", operation,
                    constraint != null ? constraint : "row"), ex);
        }

        log.error("{} failed with an unexpected storage error", operation, ex);
        return new StorageFailureException(operation, ex);
    }

    private SQLException findSqlException(Throwable ex) {
        Throwable current = ex;
        SQLException found = null;
        while (current != null) {
            if (current instanceof SQLException sql) {
                found = sql;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return found;
    }

    private String describeConstraint(String engineMessage) {
        if (engineMessage == null) {
            return null;
        }
        String message = engineMessage.toLowerCase(Locale.ROOT);
        return CONSTRAINTS.entrySet().stream()
            .filter(entry -> message.contains(entry.getKey()))
            .map(Map.Entry::getValue)
            .findFirst()
            .orElse(null);
    }
}

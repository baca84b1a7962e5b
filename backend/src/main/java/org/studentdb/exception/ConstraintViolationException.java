package org.studentdb.exception;

import org.springframework.http.HttpStatus;

/**
 * A value is outside its allowed range or set, or a required value is missing (HTTP 400).
 */
public class ConstraintViolationException extends BaseException {

    public ConstraintViolationException(String code, String message) {
        super(code, message, HttpStatus.BAD_REQUEST);
    }

    public ConstraintViolationException(String code, String message, Throwable cause) {
        super(code, message, HttpStatus.BAD_REQUEST, cause);
    }

    public static ConstraintViolationException invalidGender(String code) {
        return new ConstraintViolationException(
            "INVALID_GENDER",
            String.format("Gender '%s' is not one of M, F, O", code)
        );
    }

    public static ConstraintViolationException invalidPhone(String phone) {
        return new ConstraintViolationException(
            "INVALID_PHONE",
            String.format("Phone '%s' must be exactly 10 digits", phone)
        );
    }

    public static ConstraintViolationException required(String field) {
        return new ConstraintViolationException(
            "REQUIRED_VALUE",
            String.format("%s must not be empty", field)
        );
    }

    public static ConstraintViolationException checkFailed(String operation, String rule, Throwable cause) {
        return new ConstraintViolationException(
            "CHECK_FAILED",
            String.format("%s failed: %s", operation, rule),
            cause
        );
    }
}

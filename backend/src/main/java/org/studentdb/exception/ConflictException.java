package org.studentdb.exception;

import org.springframework.http.HttpStatus;

/**
 * A unique column or column pair would be duplicated (HTTP 409).
 */
public class ConflictException extends BaseException {

    public ConflictException(String code, String message, Throwable cause) {
        super(code, message, HttpStatus.CONFLICT, cause);
    }

    public static ConflictException duplicate(String operation, String field, Throwable cause) {
        return new ConflictException(
            "DUPLICATE_VALUE",
            String.format("%s failed: %s already exists", operation, field),
            cause
        );
    }
}

package org.studentdb.exception;

import org.springframework.http.HttpStatus;

/**
 * Any other failure raised by the database (HTTP 500).
 */
public class StorageFailureException extends BaseException {

    public StorageFailureException(String operation, Throwable cause) {
        super("STORAGE_FAILURE", operation + " failed: " + cause.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }
}

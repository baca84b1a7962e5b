package org.studentdb.entity;

import org.studentdb.exception.ConstraintViolationException;

/**
 * Gender codes accepted by the Students.Gender column.
 */
public enum Gender {
    M, F, O;

    public static Gender fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (Gender gender : values()) {
            if (gender.name().equalsIgnoreCase(code.trim())) {
                return gender;
            }
        }
        throw ConstraintViolationException.invalidGender(code);
    }
}

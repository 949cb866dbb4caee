package com.carbonledger.factor;

import lombok.Getter;

/**
 * Thrown by EmissionFactorAdminService when a request is invalid or a business rule is violated.
 */
@Getter
public class EmissionFactorAdminException extends RuntimeException {

    public static final String FACTOR_NOT_FOUND = "FACTOR_NOT_FOUND";
    public static final String FACTOR_IN_USE = "FACTOR_IN_USE";
    public static final String INVALID_FACTOR = "INVALID_FACTOR";

    /** FACTOR_NOT_FOUND, FACTOR_IN_USE or INVALID_FACTOR. */
    private final String errorCode;

    public EmissionFactorAdminException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}

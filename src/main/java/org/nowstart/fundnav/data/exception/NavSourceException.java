package org.nowstart.fundnav.data.exception;

import lombok.Getter;

/**
 * Raised when an external NAV source answers but the payload cannot be used.
 */
@Getter
public class NavSourceException extends RuntimeException {

    private final String schemeCode;

    public NavSourceException(String schemeCode, String message) {
        super(message);
        this.schemeCode = schemeCode;
    }

    public NavSourceException(String schemeCode, String message, Throwable cause) {
        super(message, cause);
        this.schemeCode = schemeCode;
    }
}

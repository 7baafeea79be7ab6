package org.nowstart.fundnav.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class NavSyncApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public NavSyncApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }
}

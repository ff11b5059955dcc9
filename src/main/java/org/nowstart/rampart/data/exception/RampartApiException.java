package org.nowstart.rampart.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class RampartApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public RampartApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

}

package com.github.salilvnair.convintel.engine.exception;

import lombok.Getter;

@Getter
public class ConvIntelException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;

    public ConvIntelException(ConvIntelErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ConvIntelException(ConvIntelErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ConvIntelException(ConvIntelErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public boolean is(ConvIntelErrorCode code) {
        return code != null && code.name().equals(errorCode);
    }
}

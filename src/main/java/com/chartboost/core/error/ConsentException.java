package com.chartboost.core.error;

import java.util.Objects;

public class ConsentException extends RuntimeException {

    private final ConsentError error;

    public ConsentException(ConsentError error) {
        super(Objects.requireNonNull(error).message());
        this.error = error;
    }

    public ConsentException(ConsentError error, Throwable cause) {
        super(Objects.requireNonNull(error).message(), cause);
        this.error = error;
    }

    public ConsentError getError() {
        return error;
    }
}

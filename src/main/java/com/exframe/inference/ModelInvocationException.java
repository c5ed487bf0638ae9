package com.exframe.inference;

import com.exframe.exception.RouterException;

public class ModelInvocationException extends RouterException {
    public ModelInvocationException(String message) {
        super(message);
    }

    public ModelInvocationException(String message, Throwable cause) {
        super(message, null, cause);
    }
}

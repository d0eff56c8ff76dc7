package com.company.placeholder.exception;

public class InvalidDateException extends RuntimeException {
    public InvalidDateException(String value) {
        super("Invalid base date: " + value);
    }

    public InvalidDateException(String value, Throwable cause) {
        super("Invalid base date: " + value, cause);
    }
}

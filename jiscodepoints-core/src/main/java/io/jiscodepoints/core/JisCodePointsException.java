package io.jiscodepoints.core;

public class JisCodePointsException extends RuntimeException {

    public JisCodePointsException(Throwable cause) {
        super(cause);
    }

    public JisCodePointsException(String message, Throwable cause) {
        super(message, cause);
    }

    public JisCodePointsException(String message) {
        super(message);
    }

}

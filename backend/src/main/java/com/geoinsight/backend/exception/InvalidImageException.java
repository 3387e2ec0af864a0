package com.geoinsight.backend.exception;

/**
 * Image bytes that are empty, undecodable or have zero area.
 */
public class InvalidImageException extends AnalysisException {

    public InvalidImageException(String message) {
        super(ErrorType.INVALID_IMAGE, message);
    }

    public InvalidImageException(String message, Throwable cause) {
        super(ErrorType.INVALID_IMAGE, message, cause);
    }
}

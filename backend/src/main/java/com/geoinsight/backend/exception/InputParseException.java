package com.geoinsight.backend.exception;

/**
 * Malformed caller input, e.g. an amount like "12 LCr" or a blank address.
 */
public class InputParseException extends AnalysisException {

    public InputParseException(String message) {
        super(ErrorType.PARSE_ERROR, message);
    }
}

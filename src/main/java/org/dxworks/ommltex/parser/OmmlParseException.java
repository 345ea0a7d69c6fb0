package org.dxworks.ommltex.parser;

/**
 * Raised when an input string is not well-formed XML.
 */
public class OmmlParseException extends Exception {

    public OmmlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

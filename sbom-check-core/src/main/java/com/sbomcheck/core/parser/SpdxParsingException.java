package com.sbomcheck.core.parser;

import java.util.List;

/**
 * Thrown when a JSON value does not have the shape of an SPDX document.
 *
 * <p>Carries the parser's messages verbatim; the library's exception, when there is
 * one, is kept as the cause.
 */
public class SpdxParsingException extends Exception {

    private final List<String> messages;

    public SpdxParsingException(List<String> messages) {
        this(messages, null);
    }

    public SpdxParsingException(List<String> messages, Throwable cause) {
        super(String.join("; ", messages), cause);
        this.messages = List.copyOf(messages);
    }

    /**
     * Returns the parser's messages, in the order they were found.
     *
     * @return error messages
     */
    public List<String> getMessages() {
        return messages;
    }
}

/**
 *
 */
package org.theseed.xrf.io;

import java.io.IOException;

/**
 * This exception is thrown when an XRF export file is malformed:  a non-numeric data cell, a missing header row,
 * or a missing header token.  The message includes the line and column where the problem was found.
 *
 */
public class XrfFormatException extends IOException {

    /** serialization version ID */
    private static final long serialVersionUID = 3198547006412398611L;

    /**
     * Construct a format exception with a plain message.
     *
     * @param message	description of the problem
     */
    public XrfFormatException(String message) {
        super(message);
    }

    /**
     * Construct a format exception for a specific cell of the input.
     *
     * @param lineNum	1-based line number in the file
     * @param col		0-based column index in the line
     * @param message	description of the problem
     */
    public XrfFormatException(int lineNum, int col, String message) {
        super(String.format("Line %d, column %d: %s", lineNum, col, message));
    }

}

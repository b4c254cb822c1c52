/**
 *
 */
package org.theseed.xrf.utils;

/**
 * This exception is thrown when a command-line parameter is invalid.
 *
 */
public class ParseFailureException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = -4380513618472384213L;

    public ParseFailureException(String message) {
        super(message);
    }

}

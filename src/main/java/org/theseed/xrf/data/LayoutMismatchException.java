/**
 *
 */
package org.theseed.xrf.data;

import org.theseed.xrf.io.XrfFormatException;

/**
 * This exception is thrown when the header or data structure of an XRF export does not match the expected
 * column layout.  Continuing would attribute values to the wrong elements, so it is always fatal.
 *
 */
public class LayoutMismatchException extends XrfFormatException {

    /** serialization version ID */
    private static final long serialVersionUID = -6711042259618405722L;

    public LayoutMismatchException(XrfLayout layout, String message) {
        super("Layout " + layout + " mismatch: " + message);
    }

}

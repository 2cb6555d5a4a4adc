/**
 *
 */
package org.theseed.metrics.cli;

/**
 * This exception is thrown when the command-line parameters are invalid.
 *
 */
public class ParseFailureException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = 2046581245379418253L;

    /**
     * Construct a parse failure exception.
     *
     * @param message	description of the problem
     */
    public ParseFailureException(String message) {
        super(message);
    }

}

package com.gridfacts.core.host;

/**
 * Thrown when the Grid Infrastructure home or its tools cannot be found.
 *
 * <p>Nothing is collected once this is raised.
 */
public class PreconditionFailedException extends RuntimeException {

    public PreconditionFailedException(String message) {
        super(message);
    }
}

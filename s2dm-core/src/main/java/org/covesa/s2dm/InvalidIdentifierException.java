package org.covesa.s2dm;

import javax.annotation.Nullable;

/**
 * Signals a schema element name that cannot be represented as an IRI path segment.
 */
public class InvalidIdentifierException extends MaterializationException {

    private static final long serialVersionUID = 1L;

    public InvalidIdentifierException(@Nullable final String qualifiedPath, final String message) {
        super(qualifiedPath, message);
    }

}

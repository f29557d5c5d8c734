package org.covesa.s2dm;

/**
 * Signals two schema elements resolving to the same qualified path.
 */
public class DuplicateDefinitionException extends MaterializationException {

    private static final long serialVersionUID = 1L;

    public DuplicateDefinitionException(final String qualifiedPath) {
        super(qualifiedPath, "duplicate definition");
    }

}

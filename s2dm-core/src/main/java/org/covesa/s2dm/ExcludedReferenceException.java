package org.covesa.s2dm;

/**
 * Signals a field whose output type is a root operation type or an introspection type, when such
 * references are rejected.
 * 
 * @see RootReferencePolicy#REJECT
 */
public class ExcludedReferenceException extends MaterializationException {

    private static final long serialVersionUID = 1L;

    private final String referencedType;

    public ExcludedReferenceException(final String qualifiedPath, final String referencedType) {
        super(qualifiedPath, "field references excluded type " + referencedType);
        this.referencedType = referencedType;
    }

    public final String getReferencedType() {
        return this.referencedType;
    }

}

package org.covesa.s2dm.schema;

/**
 * The kinds of named type definitions a {@link SchemaModel} may contain.
 */
public enum TypeKind {

    OBJECT(true),

    INTERFACE(true),

    INPUT_OBJECT(true),

    UNION(false),

    ENUM(false),

    SCALAR(false);

    private final boolean fieldContainer;

    private TypeKind(final boolean fieldContainer) {
        this.fieldContainer = fieldContainer;
    }

    /**
     * Returns whether definitions of this kind declare fields.
     * 
     * @return true for object, interface and input object types
     */
    public boolean isFieldContainer() {
        return this.fieldContainer;
    }

}

package org.covesa.s2dm.schema;

import java.io.Serializable;

import com.google.common.base.Preconditions;

/**
 * A field of an object, interface or input object type.
 */
public final class FieldDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String ownerName;

    private final String name;

    private final TypeSignature signature;

    FieldDefinition(final String ownerName, final String name, final TypeSignature signature) {
        this.ownerName = Preconditions.checkNotNull(ownerName);
        this.name = Preconditions.checkNotNull(name);
        this.signature = Preconditions.checkNotNull(signature);
    }

    public String getOwnerName() {
        return this.ownerName;
    }

    public String getName() {
        return this.name;
    }

    public TypeSignature getSignature() {
        return this.signature;
    }

    /**
     * Returns the qualified path of the field, i.e., {@code OwnerName.fieldName}.
     * 
     * @return the qualified path
     */
    public String getQualifiedPath() {
        return this.ownerName + "." + this.name;
    }

    @Override
    public String toString() {
        return getQualifiedPath() + ": " + this.signature;
    }

}

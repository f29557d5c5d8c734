package org.covesa.s2dm.schema;

import java.io.Serializable;

import com.google.common.base.Preconditions;

/**
 * A value of an enum type.
 */
public final class EnumValueDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String enumName;

    private final String name;

    EnumValueDefinition(final String enumName, final String name) {
        this.enumName = Preconditions.checkNotNull(enumName);
        this.name = Preconditions.checkNotNull(name);
    }

    public String getEnumName() {
        return this.enumName;
    }

    public String getName() {
        return this.name;
    }

    /**
     * Returns the qualified path of the value, i.e., {@code EnumName.VALUE_NAME}.
     * 
     * @return the qualified path
     */
    public String getQualifiedPath() {
        return this.enumName + "." + this.name;
    }

    @Override
    public String toString() {
        return getQualifiedPath();
    }

}

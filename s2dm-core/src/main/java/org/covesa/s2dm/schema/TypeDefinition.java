package org.covesa.s2dm.schema;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import org.covesa.s2dm.DuplicateDefinitionException;

/**
 * A named type definition of a {@link SchemaModel}.
 * <p>
 * A {@code TypeDefinition} is a tagged variant over the six {@link TypeKind}s: the kind determines
 * which children are populated. Object, interface and input object types have an ordered list of
 * {@link FieldDefinition}s (declaration order); union types have a set of member type names; enum
 * types have an ordered list of {@link EnumValueDefinition}s; scalar types have no children.
 * Children not applicable to the kind are always empty. Instances are immutable and are created
 * via {@link #builder(TypeKind, String)}, which rejects duplicate field and enum value names.
 * </p>
 */
public final class TypeDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TypeKind kind;

    private final String name;

    @Nullable
    private final String description;

    private final List<FieldDefinition> fields;

    private final Set<String> memberTypeNames;

    private final List<EnumValueDefinition> values;

    private TypeDefinition(final Builder builder) {
        this.kind = builder.kind;
        this.name = builder.name;
        this.description = Strings.emptyToNull(builder.description);
        this.fields = ImmutableList.copyOf(builder.fields);
        this.memberTypeNames = ImmutableSet.copyOf(builder.memberTypeNames);
        this.values = ImmutableList.copyOf(builder.values);
    }

    /**
     * Returns a builder for a type definition of the kind and name specified.
     * 
     * @param kind
     *            the kind of type
     * @param name
     *            the type name, not empty
     * @return the created builder
     */
    public static Builder builder(final TypeKind kind, final String name) {
        return new Builder(kind, name);
    }

    public TypeKind getKind() {
        return this.kind;
    }

    public String getName() {
        return this.name;
    }

    /**
     * Returns the description attached to the type in the schema source.
     * 
     * @return the description, or null if missing or empty
     */
    @Nullable
    public String getDescription() {
        return this.description;
    }

    /**
     * Returns the fields of an object, interface or input object type, in declaration order.
     * 
     * @return an immutable list of fields, empty for other kinds
     */
    public List<FieldDefinition> getFields() {
        return this.fields;
    }

    /**
     * Returns the names of the member types of a union type.
     * 
     * @return an immutable set of type names in declaration order, empty for other kinds
     */
    public Set<String> getMemberTypeNames() {
        return this.memberTypeNames;
    }

    /**
     * Returns the values of an enum type, in declaration order.
     * 
     * @return an immutable list of values, empty for other kinds
     */
    public List<EnumValueDefinition> getValues() {
        return this.values;
    }

    @Override
    public String toString() {
        return this.kind.toString().toLowerCase() + " " + this.name;
    }

    public static final class Builder {

        private final TypeKind kind;

        private final String name;

        @Nullable
        private String description;

        private final List<FieldDefinition> fields;

        private final Set<String> memberTypeNames;

        private final List<EnumValueDefinition> values;

        private final Set<String> childNames;

        Builder(final TypeKind kind, final String name) {
            Preconditions.checkNotNull(kind);
            Preconditions.checkNotNull(name);
            Preconditions.checkArgument(!name.isEmpty(), "Empty type name");
            this.kind = kind;
            this.name = name;
            this.fields = Lists.newArrayList();
            this.memberTypeNames = Sets.newLinkedHashSet();
            this.values = Lists.newArrayList();
            this.childNames = Sets.newHashSet();
        }

        public Builder description(@Nullable final String description) {
            this.description = description;
            return this;
        }

        public Builder field(final String name, final TypeSignature signature) {
            Preconditions.checkState(this.kind.isFieldContainer(), "%s type %s cannot have fields",
                    this.kind, this.name);
            final FieldDefinition field = new FieldDefinition(this.name, name, signature);
            checkUnique(field.getQualifiedPath(), name);
            this.fields.add(field);
            return this;
        }

        public Builder field(final String name, final String signature) {
            return field(name, TypeSignature.parse(signature));
        }

        public Builder member(final String typeName) {
            Preconditions.checkState(this.kind == TypeKind.UNION,
                    "%s type %s cannot have union members", this.kind, this.name);
            Preconditions.checkNotNull(typeName);
            this.memberTypeNames.add(typeName);
            return this;
        }

        public Builder value(final String name) {
            Preconditions.checkState(this.kind == TypeKind.ENUM, "%s type %s cannot have values",
                    this.kind, this.name);
            final EnumValueDefinition value = new EnumValueDefinition(this.name, name);
            checkUnique(value.getQualifiedPath(), name);
            this.values.add(value);
            return this;
        }

        public TypeDefinition build() {
            return new TypeDefinition(this);
        }

        private void checkUnique(final String qualifiedPath, final String childName) {
            if (!this.childNames.add(childName)) {
                throw new DuplicateDefinitionException(qualifiedPath);
            }
        }

    }

}

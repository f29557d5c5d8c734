package org.covesa.s2dm.schema;

import java.io.Serializable;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.covesa.s2dm.DuplicateDefinitionException;

/**
 * An already validated GraphQL schema, reduced to the named type definitions relevant for
 * materialization.
 * <p>
 * A {@code SchemaModel} holds every named type definition of the schema (keyed by name, in
 * declaration order) together with the names of its root operation types. Root operation types
 * and introspection types (names starting with {@value #INTROSPECTION_PREFIX}) are kept in the
 * model, as fields may still reference them, but are <i>excluded</i> from materialization:
 * {@link #getRetainedTypes()} returns only the remaining definitions. Type names are unique;
 * {@link Builder#build()} fails with a {@link DuplicateDefinitionException} otherwise.
 * </p>
 */
public final class SchemaModel implements Serializable {

    /** Name prefix reserved to GraphQL introspection types. */
    public static final String INTROSPECTION_PREFIX = "__";

    /** Names of the GraphQL built-in scalar types. */
    public static final Set<String> BUILTIN_SCALARS = ImmutableSet.of("Int", "Float", "String",
            "Boolean", "ID");

    private static final long serialVersionUID = 1L;

    private final Map<String, TypeDefinition> types;

    private final Set<String> rootTypeNames;

    private SchemaModel(final Map<String, TypeDefinition> types, final Set<String> rootTypeNames) {
        this.types = types;
        this.rootTypeNames = rootTypeNames;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks whether the type name specified denotes a GraphQL built-in scalar.
     * 
     * @param typeName
     *            the type name
     * @return true if the name is one of {@code Int, Float, String, Boolean, ID}
     */
    public static boolean isBuiltinScalar(final String typeName) {
        return BUILTIN_SCALARS.contains(typeName);
    }

    /**
     * Returns all the type definitions in the model, including excluded ones.
     * 
     * @return an immutable collection of definitions, in declaration order
     */
    public Collection<TypeDefinition> getTypes() {
        return this.types.values();
    }

    @Nullable
    public TypeDefinition getType(final String name) {
        return this.types.get(name);
    }

    public Set<String> getRootTypeNames() {
        return this.rootTypeNames;
    }

    /**
     * Checks whether the type name specified is excluded from materialization, i.e., whether it
     * is a root operation type or it starts with the introspection prefix.
     * 
     * @param typeName
     *            the type name
     * @return true if the type contributes no concept declaration
     */
    public boolean isExcluded(final String typeName) {
        return this.rootTypeNames.contains(typeName)
                || typeName.startsWith(INTROSPECTION_PREFIX);
    }

    /**
     * Returns the definitions that are materialized, i.e., all the definitions except root
     * operation types and introspection types.
     * 
     * @return an immutable list of definitions, in declaration order
     */
    public List<TypeDefinition> getRetainedTypes() {
        final ImmutableList.Builder<TypeDefinition> builder = ImmutableList.builder();
        for (final TypeDefinition type : this.types.values()) {
            if (!isExcluded(type.getName())) {
                builder.add(type);
            }
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "SchemaModel(" + this.types.size() + " types, roots " + this.rootTypeNames + ")";
    }

    public static final class Builder {

        private final Map<String, TypeDefinition> types;

        private final Set<String> rootTypeNames;

        Builder() {
            this.types = Maps.newLinkedHashMap();
            this.rootTypeNames = Sets.newLinkedHashSet();
        }

        public Builder type(final TypeDefinition type) {
            Preconditions.checkNotNull(type);
            if (this.types.containsKey(type.getName())) {
                throw new DuplicateDefinitionException(type.getName());
            }
            this.types.put(type.getName(), type);
            return this;
        }

        public Builder types(final Iterable<TypeDefinition> types) {
            for (final TypeDefinition type : types) {
                type(type);
            }
            return this;
        }

        /**
         * Declares a root operation type (query, mutation or subscription root). The type does
         * not need to be defined in the model.
         * 
         * @param typeName
         *            the name of the root type
         * @return this builder
         */
        public Builder rootType(final String typeName) {
            this.rootTypeNames.add(Preconditions.checkNotNull(typeName));
            return this;
        }

        public SchemaModel build() {
            return new SchemaModel(ImmutableMap.copyOf(this.types),
                    ImmutableSet.copyOf(this.rootTypeNames));
        }

    }

}

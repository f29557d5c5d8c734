package org.covesa.s2dm.schema;

import java.io.Serializable;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * The raw output type of a field: a base type name wrapped by list and non-null modifiers.
 * <p>
 * Modifiers are stored innermost to outermost: signature {@code [Door!]} is represented by base
 * type {@code Door} and modifiers {@code NON_NULL, LIST}. A {@code TypeSignature} does not
 * restrict the nesting it can describe; mapping it to one of the supported shapes is the job of
 * {@link TypeWrapperClassifier}. Instances are immutable and can be parsed from / rendered to
 * GraphQL SDL notation via {@link #parse(String)} and {@link #toString()}.
 * </p>
 */
public final class TypeSignature implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String baseTypeName;

    private final List<Modifier> modifiers;

    private TypeSignature(final String baseTypeName, final List<Modifier> modifiers) {
        this.baseTypeName = baseTypeName;
        this.modifiers = modifiers;
    }

    /**
     * Creates a signature for the base type and the modifiers specified.
     * 
     * @param baseTypeName
     *            the name of the wrapped named type, not empty
     * @param modifiers
     *            the modifiers, innermost first
     * @return the created signature
     */
    public static TypeSignature create(final String baseTypeName, final Modifier... modifiers) {
        return create(baseTypeName, ImmutableList.copyOf(modifiers));
    }

    /**
     * Creates a signature for the base type and the modifiers specified.
     * 
     * @param baseTypeName
     *            the name of the wrapped named type, not empty
     * @param modifiers
     *            the modifiers, innermost first
     * @return the created signature
     */
    public static TypeSignature create(final String baseTypeName,
            final Iterable<Modifier> modifiers) {
        Preconditions.checkNotNull(baseTypeName);
        Preconditions.checkArgument(!baseTypeName.isEmpty(), "Empty base type name");
        return new TypeSignature(baseTypeName, ImmutableList.copyOf(modifiers));
    }

    /**
     * Parses a signature in GraphQL SDL notation, e.g., {@code [Door!]!}.
     * 
     * @param string
     *            the string to parse
     * @return the parsed signature
     * @throws IllegalArgumentException
     *             if the string is not a well-formed type reference
     */
    public static TypeSignature parse(final String string) throws IllegalArgumentException {
        final List<Modifier> outerFirst = Lists.newArrayList();
        String s = string.trim();
        while (true) {
            if (s.endsWith("!")) {
                outerFirst.add(Modifier.NON_NULL);
                s = s.substring(0, s.length() - 1).trim();
            } else if (s.startsWith("[") && s.endsWith("]")) {
                outerFirst.add(Modifier.LIST);
                s = s.substring(1, s.length() - 1).trim();
            } else {
                break;
            }
        }
        for (int i = 0; i < s.length(); ++i) {
            final char c = s.charAt(i);
            if (c == '[' || c == ']' || c == '!' || Character.isWhitespace(c)) {
                throw new IllegalArgumentException("Invalid type signature: " + string);
            }
        }
        Preconditions.checkArgument(!s.isEmpty(), "Invalid type signature: %s", string);
        return new TypeSignature(s, ImmutableList.copyOf(Lists.reverse(outerFirst)));
    }

    public String getBaseTypeName() {
        return this.baseTypeName;
    }

    /**
     * Returns the modifiers applied to the base type, innermost first.
     * 
     * @return an immutable list of modifiers, possibly empty
     */
    public List<Modifier> getModifiers() {
        return this.modifiers;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof TypeSignature)) {
            return false;
        }
        final TypeSignature other = (TypeSignature) object;
        return this.baseTypeName.equals(other.baseTypeName)
                && this.modifiers.equals(other.modifiers);
    }

    @Override
    public int hashCode() {
        return this.baseTypeName.hashCode() * 31 + this.modifiers.hashCode();
    }

    /**
     * {@inheritDoc} The returned string is the GraphQL SDL notation of the signature.
     */
    @Override
    public String toString() {
        String result = this.baseTypeName;
        for (final Modifier modifier : this.modifiers) {
            result = modifier == Modifier.LIST ? "[" + result + "]" : result + "!";
        }
        return result;
    }

    /**
     * A type modifier.
     */
    public enum Modifier {

        /** The wrapped type cannot be null (trailing {@code !}). */
        NON_NULL,

        /** The wrapped type is the element type of a list (enclosing {@code [...]}). */
        LIST

    }

}

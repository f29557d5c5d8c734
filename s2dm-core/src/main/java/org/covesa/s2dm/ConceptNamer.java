package org.covesa.s2dm;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;

import org.covesa.s2dm.schema.EnumValueDefinition;
import org.covesa.s2dm.schema.FieldDefinition;
import org.covesa.s2dm.vocabulary.S2DM;

/**
 * Generates the concept URIs of schema elements.
 * <p>
 * URIs follow a fixed convention: a type {@code T} is named {@code {namespace}T}, a field
 * {@code f} of {@code T} is named {@code {namespace}T.f} and a value {@code V} of enum {@code E}
 * is named {@code {namespace}E.V}. The five GraphQL built-in scalars are the exception, being
 * mapped to the fixed individuals {@code s2dm:Int}, {@code s2dm:Float}, {@code s2dm:String},
 * {@code s2dm:Boolean} and {@code s2dm:ID}.
 * </p>
 * <p>
 * Each name segment is percent-escaped (UTF-8) when it contains characters not allowed in an IRI
 * path segment, including {@code %} itself, so distinct qualified paths always yield distinct
 * URIs. Names that are empty or contain the path separator {@code .} cannot be represented
 * unambiguously and are rejected with an {@link InvalidIdentifierException}.
 * </p>
 */
public final class ConceptNamer {

    private static final Escaper ESCAPER = UrlEscapers.urlPathSegmentEscaper();

    private static final ImmutableMap<String, URI> BUILTIN_SCALARS = ImmutableMap.of(//
            "Int", S2DM.INT, "Float", S2DM.FLOAT, "String", S2DM.STRING, //
            "Boolean", S2DM.BOOLEAN, "ID", S2DM.ID);

    private final String namespace;

    private final ValueFactory factory;

    /**
     * Creates a new instance minting URIs in the namespace of the configuration specified.
     * 
     * @param config
     *            the configuration
     */
    public ConceptNamer(final MaterializerConfig config) {
        this.namespace = config.getNamespace();
        this.factory = ValueFactoryImpl.getInstance();
    }

    /**
     * Returns the URI of a named type. Built-in scalars are mapped to the s2dm vocabulary.
     * 
     * @param typeName
     *            the type name
     * @return the type URI
     * @throws InvalidIdentifierException
     *             if the name cannot be represented as an IRI path segment
     */
    public URI typeURI(final String typeName) throws InvalidIdentifierException {
        final URI builtin = BUILTIN_SCALARS.get(typeName);
        if (builtin != null) {
            return builtin;
        }
        return this.factory.createURI(this.namespace + escape(typeName, typeName));
    }

    public URI fieldURI(final FieldDefinition field) throws InvalidIdentifierException {
        return memberURI(field.getOwnerName(), field.getName(), field.getQualifiedPath());
    }

    public URI valueURI(final EnumValueDefinition value) throws InvalidIdentifierException {
        return memberURI(value.getEnumName(), value.getName(), value.getQualifiedPath());
    }

    private URI memberURI(final String typeName, final String memberName,
            final String qualifiedPath) {
        return this.factory.createURI(this.namespace + escape(typeName, qualifiedPath) + "."
                + escape(memberName, qualifiedPath));
    }

    /**
     * Escapes a single name segment.
     * 
     * @param segment
     *            the name segment
     * @param qualifiedPath
     *            the qualified path the segment belongs to, for error reporting
     * @return the escaped segment
     * @throws InvalidIdentifierException
     *             if the segment is empty or contains the path separator
     */
    static String escape(final String segment, final String qualifiedPath)
            throws InvalidIdentifierException {
        Preconditions.checkNotNull(segment);
        if (segment.isEmpty()) {
            throw new InvalidIdentifierException(qualifiedPath, "empty name");
        }
        if (segment.indexOf('.') >= 0) {
            throw new InvalidIdentifierException(qualifiedPath, "name '" + segment
                    + "' contains the path separator '.'");
        }
        try {
            return ESCAPER.escape(segment);
        } catch (final IllegalArgumentException ex) {
            // unpaired surrogates cannot be encoded in UTF-8
            throw new InvalidIdentifierException(qualifiedPath, "name '" + segment
                    + "' is not a valid Unicode string");
        }
    }

    @Override
    public String toString() {
        return "ConceptNamer(" + this.namespace + ")";
    }

}

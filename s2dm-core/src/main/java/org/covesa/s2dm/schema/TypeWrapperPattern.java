package org.covesa.s2dm.schema;

import org.openrdf.model.URI;

import org.covesa.s2dm.vocabulary.S2DM;

/**
 * The six canonical shapes a field type can take with respect to list and non-null wrapping.
 */
public enum TypeWrapperPattern {

    /** Shape {@code Type}. */
    BARE("bare", S2DM.BARE),

    /** Shape {@code Type!}. */
    NON_NULL("nonNull", S2DM.NON_NULL),

    /** Shape {@code [Type]}. */
    LIST("list", S2DM.LIST),

    /** Shape {@code [Type!]}. */
    LIST_OF_NON_NULL("listOfNonNull", S2DM.LIST_OF_NON_NULL),

    /** Shape {@code [Type]!}. */
    NON_NULL_LIST("nonNullList", S2DM.NON_NULL_LIST),

    /** Shape {@code [Type!]!}. */
    NON_NULL_LIST_OF_NON_NULL("nonNullListOfNonNull", S2DM.NON_NULL_LIST_OF_NON_NULL);

    private final String tag;

    private final URI uri;

    private TypeWrapperPattern(final String tag, final URI uri) {
        this.tag = tag;
        this.uri = uri;
    }

    /**
     * Returns the shape tag, which is also the local name of the corresponding s2dm individual.
     * 
     * @return the tag, e.g., {@code listOfNonNull}
     */
    public String getTag() {
        return this.tag;
    }

    /**
     * Returns the s2dm individual denoting this pattern.
     * 
     * @return the URI, e.g., {@code s2dm:listOfNonNull}
     */
    public URI getURI() {
        return this.uri;
    }

    @Override
    public String toString() {
        return this.tag;
    }

}

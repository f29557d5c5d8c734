package org.covesa.s2dm.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the subset of the Simple Knowledge Organization System (SKOS) vocabulary used
 * when materializing schemas.
 * 
 * @see <a href="http://www.w3.org/TR/skos-reference/">vocabulary specification</a>
 */
public final class SKOS {

    /** Recommended prefix for the vocabulary namespace: "skos". */
    public static final String PREFIX = "skos";

    /** Vocabulary namespace: "http://www.w3.org/2004/02/skos/core#". */
    public static final String NAMESPACE = "http://www.w3.org/2004/02/skos/core#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // CLASSES

    /** Class skos:Concept. */
    public static final URI CONCEPT = createURI("Concept");

    // PROPERTIES

    /** Property skos:prefLabel. */
    public static final URI PREF_LABEL = createURI("prefLabel");

    /** Property skos:definition. */
    public static final URI DEFINITION = createURI("definition");

    // HELPER METHODS

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private SKOS() {
    }

}

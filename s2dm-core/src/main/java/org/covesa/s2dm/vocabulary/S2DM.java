package org.covesa.s2dm.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the s2dm ontology, the vocabulary describing the structure of GraphQL schemas.
 * 
 * @see <a href="https://covesa.global/models/s2dm">vocabulary specification</a>
 */
public final class S2DM {

    /** Recommended prefix for the vocabulary namespace: "s2dm". */
    public static final String PREFIX = "s2dm";

    /** Vocabulary namespace: "https://covesa.global/models/s2dm#". */
    public static final String NAMESPACE = "https://covesa.global/models/s2dm#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // CLASSES

    /** Class s2dm:ObjectType. */
    public static final URI OBJECT_TYPE = createURI("ObjectType");

    /** Class s2dm:InterfaceType. */
    public static final URI INTERFACE_TYPE = createURI("InterfaceType");

    /** Class s2dm:InputObjectType. */
    public static final URI INPUT_OBJECT_TYPE = createURI("InputObjectType");

    /** Class s2dm:UnionType. */
    public static final URI UNION_TYPE = createURI("UnionType");

    /** Class s2dm:EnumType. */
    public static final URI ENUM_TYPE = createURI("EnumType");

    /** Class s2dm:ScalarType. */
    public static final URI SCALAR_TYPE = createURI("ScalarType");

    /** Class s2dm:Field. */
    public static final URI FIELD = createURI("Field");

    /** Class s2dm:EnumValue. */
    public static final URI ENUM_VALUE = createURI("EnumValue");

    // PROPERTIES

    /** Property s2dm:hasField. */
    public static final URI HAS_FIELD = createURI("hasField");

    /** Property s2dm:hasOutputType. */
    public static final URI HAS_OUTPUT_TYPE = createURI("hasOutputType");

    /** Property s2dm:usesTypeWrapperPattern. */
    public static final URI USES_TYPE_WRAPPER_PATTERN = createURI("usesTypeWrapperPattern");

    /** Property s2dm:hasUnionMember. */
    public static final URI HAS_UNION_MEMBER = createURI("hasUnionMember");

    /** Property s2dm:hasEnumValue. */
    public static final URI HAS_ENUM_VALUE = createURI("hasEnumValue");

    // INDIVIDUALS - TYPE WRAPPER PATTERNS

    /** Individual s2dm:bare. */
    public static final URI BARE = createURI("bare");

    /** Individual s2dm:nonNull. */
    public static final URI NON_NULL = createURI("nonNull");

    /** Individual s2dm:list. */
    public static final URI LIST = createURI("list");

    /** Individual s2dm:listOfNonNull. */
    public static final URI LIST_OF_NON_NULL = createURI("listOfNonNull");

    /** Individual s2dm:nonNullList. */
    public static final URI NON_NULL_LIST = createURI("nonNullList");

    /** Individual s2dm:nonNullListOfNonNull. */
    public static final URI NON_NULL_LIST_OF_NON_NULL = createURI("nonNullListOfNonNull");

    // INDIVIDUALS - BUILT-IN SCALARS

    /** Individual s2dm:Int. */
    public static final URI INT = createURI("Int");

    /** Individual s2dm:Float. */
    public static final URI FLOAT = createURI("Float");

    /** Individual s2dm:String. */
    public static final URI STRING = createURI("String");

    /** Individual s2dm:Boolean. */
    public static final URI BOOLEAN = createURI("Boolean");

    /** Individual s2dm:ID. */
    public static final URI ID = createURI("ID");

    // HELPER METHODS

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private S2DM() {
    }

}

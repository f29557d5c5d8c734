package org.covesa.s2dm;

/**
 * Policy for fields whose output type is excluded from materialization (root operation types and
 * introspection types).
 */
public enum RootReferencePolicy {

    /**
     * Emit the {@code s2dm:hasOutputType} reference to the excluded type, while still suppressing
     * the declaration of the excluded type itself.
     */
    EMIT,

    /** Fail with an {@link ExcludedReferenceException}. */
    REJECT

}

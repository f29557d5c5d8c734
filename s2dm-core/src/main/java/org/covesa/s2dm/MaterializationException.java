package org.covesa.s2dm;

import javax.annotation.Nullable;

/**
 * Signals that a schema cannot be materialized as RDF.
 * <p>
 * This exception and its subclasses report deterministic input-data errors: materializing the
 * same schema again yields the same failure, so callers should not retry but correct the schema
 * element identified by {@link #getQualifiedPath()}. A run failing with this exception never
 * produces any artifact.
 * </p>
 */
public class MaterializationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    @Nullable
    private final String qualifiedPath;

    /**
     * Creates a new instance with the qualified path of the offending element and the error
     * message specified.
     * 
     * @param qualifiedPath
     *            the qualified path (e.g., {@code Cabin} or {@code Cabin.doors}) of the schema
     *            element causing the failure, null if not applicable
     * @param message
     *            the error message, to which the qualified path is prepended
     */
    public MaterializationException(@Nullable final String qualifiedPath, final String message) {
        this(qualifiedPath, message, null);
    }

    /**
     * Creates a new instance with the qualified path, error message and cause specified.
     * 
     * @param qualifiedPath
     *            the qualified path of the schema element causing the failure, null if not
     *            applicable
     * @param message
     *            the error message, to which the qualified path is prepended
     * @param cause
     *            the optional cause of this exception
     */
    public MaterializationException(@Nullable final String qualifiedPath, final String message,
            @Nullable final Throwable cause) {
        super((qualifiedPath == null ? "" : qualifiedPath + ": ") + message, cause);
        this.qualifiedPath = qualifiedPath;
    }

    /**
     * Returns the qualified path of the schema element causing the failure.
     * 
     * @return the qualified path, or null if the failure is not tied to a specific element
     */
    @Nullable
    public final String getQualifiedPath() {
        return this.qualifiedPath;
    }

}

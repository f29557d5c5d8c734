package org.covesa.s2dm;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Signals a field type signature that does not match any of the six supported type wrapper
 * patterns, e.g., a nested list such as {@code [[Int]]}.
 */
public class UnsupportedShapeException extends MaterializationException {

    private static final long serialVersionUID = 1L;

    private final String signature;

    public UnsupportedShapeException(@Nullable final String qualifiedPath, final String signature) {
        super(qualifiedPath, "unsupported type signature " + signature
                + " (only bare, non-null and single-level list types are supported)");
        this.signature = Preconditions.checkNotNull(signature);
    }

    /**
     * Returns the rendered type signature that could not be classified.
     * 
     * @return the signature, in GraphQL SDL notation
     */
    public final String getSignature() {
        return this.signature;
    }

}

package org.covesa.s2dm.schema;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.covesa.s2dm.UnsupportedShapeException;
import org.covesa.s2dm.schema.TypeSignature.Modifier;

/**
 * Reduces a field {@link TypeSignature} to its {@link TypeWrapperPattern}.
 * <p>
 * Classification is a pure function of the modifier sequence: the innermost element may be
 * non-null, it may be wrapped by one list, and the list may be non-null. Any other sequence (nested
 * lists, repeated non-null modifiers) is rejected with an {@link UnsupportedShapeException}.
 * </p>
 */
public final class TypeWrapperClassifier {

    private static final ImmutableMap<List<Modifier>, TypeWrapperPattern> PATTERNS = ImmutableMap
            .<List<Modifier>, TypeWrapperPattern>builder()
            .put(ImmutableList.<Modifier>of(), TypeWrapperPattern.BARE)
            .put(ImmutableList.of(Modifier.NON_NULL), TypeWrapperPattern.NON_NULL)
            .put(ImmutableList.of(Modifier.LIST), TypeWrapperPattern.LIST)
            .put(ImmutableList.of(Modifier.NON_NULL, Modifier.LIST),
                    TypeWrapperPattern.LIST_OF_NON_NULL)
            .put(ImmutableList.of(Modifier.LIST, Modifier.NON_NULL),
                    TypeWrapperPattern.NON_NULL_LIST)
            .put(ImmutableList.of(Modifier.NON_NULL, Modifier.LIST, Modifier.NON_NULL),
                    TypeWrapperPattern.NON_NULL_LIST_OF_NON_NULL)
            .build();

    /**
     * Classifies the signature specified.
     * 
     * @param signature
     *            the signature to classify
     * @return the corresponding pattern
     * @throws UnsupportedShapeException
     *             if the signature matches none of the six patterns
     */
    public static TypeWrapperPattern classify(final TypeSignature signature)
            throws UnsupportedShapeException {
        return classify(signature, null);
    }

    /**
     * Classifies the signature of a field, reporting the field qualified path on failure.
     * 
     * @param signature
     *            the signature to classify
     * @param qualifiedPath
     *            the qualified path of the field (e.g., {@code Cabin.doors}), used only for error
     *            reporting
     * @return the corresponding pattern
     * @throws UnsupportedShapeException
     *             if the signature matches none of the six patterns
     */
    public static TypeWrapperPattern classify(final TypeSignature signature,
            @Nullable final String qualifiedPath) throws UnsupportedShapeException {
        final TypeWrapperPattern pattern = PATTERNS.get(signature.getModifiers());
        if (pattern == null) {
            throw new UnsupportedShapeException(qualifiedPath, signature.toString());
        }
        return pattern;
    }

    private TypeWrapperClassifier() {
    }

}

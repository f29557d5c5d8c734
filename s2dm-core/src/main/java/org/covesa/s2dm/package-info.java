/**
 * GraphQL schema to RDF materialization engine ({@code s2dm-core}).
 * <p>
 * A {@link org.covesa.s2dm.schema.SchemaModel} is turned into a {@link org.covesa.s2dm.TripleSet}
 * by a {@link org.covesa.s2dm.Materializer}, which names every schema element with a
 * {@link org.covesa.s2dm.ConceptNamer} and classifies field types with the
 * {@link org.covesa.s2dm.schema.TypeWrapperClassifier}. The resulting statements are rendered by
 * the {@link org.covesa.s2dm.CanonicalSerializer} as a sorted N-Triples document and a
 * subject-grouped Turtle document, both byte-for-byte reproducible.
 * </p>
 * <p>
 * All the settings of a run are carried by an immutable
 * {@link org.covesa.s2dm.MaterializerConfig}. Invalid input is reported by unchecked
 * {@link org.covesa.s2dm.MaterializationException}s naming the offending qualified path, and
 * aborts the run as a whole.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package org.covesa.s2dm;

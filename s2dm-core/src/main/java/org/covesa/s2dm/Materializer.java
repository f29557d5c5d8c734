package org.covesa.s2dm;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;

import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.RDF;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.covesa.s2dm.schema.EnumValueDefinition;
import org.covesa.s2dm.schema.FieldDefinition;
import org.covesa.s2dm.schema.SchemaModel;
import org.covesa.s2dm.schema.TypeDefinition;
import org.covesa.s2dm.schema.TypeWrapperClassifier;
import org.covesa.s2dm.schema.TypeWrapperPattern;
import org.covesa.s2dm.vocabulary.S2DM;
import org.covesa.s2dm.vocabulary.SKOS;

/**
 * Materializes a {@link SchemaModel} as a {@link TripleSet} of SKOS / s2dm statements.
 * <p>
 * Every retained type definition (see {@link SchemaModel#getRetainedTypes()}) is processed
 * independently, emitting the fixed statement pattern of its kind:
 * </p>
 * <ul>
 * <li>object, interface and input object types: {@code rdf:type skos:Concept} and
 * {@code s2dm:ObjectType} / {@code s2dm:InterfaceType} / {@code s2dm:InputObjectType},
 * {@code skos:prefLabel}, one {@code s2dm:hasField} per field; each field is in turn a
 * {@code skos:Concept} and {@code s2dm:Field} with {@code skos:prefLabel},
 * {@code s2dm:hasOutputType} and {@code s2dm:usesTypeWrapperPattern};</li>
 * <li>union types: the concept header with {@code s2dm:UnionType} plus one
 * {@code s2dm:hasUnionMember} per member;</li>
 * <li>enum types: the concept header with {@code s2dm:EnumType} plus one {@code s2dm:hasEnumValue}
 * per value; each value is a {@code skos:Concept} and {@code s2dm:EnumValue} with
 * {@code skos:prefLabel};</li>
 * <li>custom scalar types: the concept header with {@code s2dm:ScalarType}; built-in scalars are
 * never declared.</li>
 * </ul>
 * <p>
 * Types with a non-blank description additionally get a {@code skos:definition}. Labels use the
 * configured language tag. Any {@link MaterializationException} aborts the whole run: no partial
 * {@code TripleSet} is ever returned. Instances are immutable and thread safe.
 * </p>
 */
public final class Materializer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Materializer.class);

    private final MaterializerConfig config;

    private final ConceptNamer namer;

    private final ValueFactory factory;

    private final Map<String, String> namespaces;

    /**
     * Creates a new instance for the configuration specified.
     *
     * @param config
     *            the configuration, not null
     */
    public Materializer(final MaterializerConfig config) {
        this.config = Preconditions.checkNotNull(config);
        this.namer = new ConceptNamer(config);
        this.factory = ValueFactoryImpl.getInstance();
        this.namespaces = ImmutableMap.of("rdf", RDF.NAMESPACE, SKOS.PREFIX, SKOS.NAMESPACE,
                S2DM.PREFIX, S2DM.NAMESPACE, config.getPrefix(), config.getNamespace());
    }

    public MaterializerConfig getConfig() {
        return this.config;
    }

    /**
     * Materializes the schema specified, processing its type definitions in the calling thread.
     *
     * @param model
     *            the schema to materialize
     * @return the resulting statements
     * @throws MaterializationException
     *             on any classification, naming or duplication error
     */
    public TripleSet materialize(final SchemaModel model) throws MaterializationException {
        final List<TypeDefinition> types = retainedTypes(model);
        final List<TypeTriples> results = Lists.newArrayListWithCapacity(types.size());
        for (final TypeDefinition type : types) {
            results.add(emit(model, type));
        }
        return merge(model, results);
    }

    /**
     * Materializes the schema specified, processing each type definition as a separate task of
     * the executor supplied. The result is identical to {@link #materialize(SchemaModel)}.
     *
     * @param model
     *            the schema to materialize
     * @param executor
     *            the executor running the per-type emission tasks
     * @return the resulting statements
     * @throws MaterializationException
     *             on any classification, naming or duplication error
     * @throws InterruptedException
     *             if the calling thread is interrupted while waiting for the tasks
     */
    public TripleSet materialize(final SchemaModel model, final ListeningExecutorService executor)
            throws MaterializationException, InterruptedException {
        Preconditions.checkNotNull(executor);
        final List<ListenableFuture<TypeTriples>> futures = Lists.newArrayList();
        for (final TypeDefinition type : retainedTypes(model)) {
            futures.add(executor.submit(new Callable<TypeTriples>() {

                @Override
                public TypeTriples call() {
                    return emit(model, type);
                }

            }));
        }
        final ListenableFuture<List<TypeTriples>> all = Futures.allAsList(futures);
        try {
            return merge(model, all.get());
        } catch (final ExecutionException ex) {
            final Throwable cause = ex.getCause();
            Throwables.throwIfUnchecked(cause);
            throw new IllegalStateException("Materialization failed", cause);
        } finally {
            all.cancel(true);
        }
    }

    private static List<TypeDefinition> retainedTypes(final SchemaModel model) {
        if (LOGGER.isDebugEnabled()) {
            for (final TypeDefinition type : model.getTypes()) {
                if (model.isExcluded(type.getName())) {
                    LOGGER.debug("Excluded {}", type);
                }
            }
        }
        return model.getRetainedTypes();
    }

    private TripleSet merge(final SchemaModel model, final List<TypeTriples> results) {

        final Map<URI, String> concepts = Maps.newHashMap();
        final List<Statement> statements = Lists.newArrayList();
        for (final TypeTriples result : results) {
            for (final Map.Entry<URI, String> entry : result.concepts.entrySet()) {
                if (concepts.put(entry.getKey(), entry.getValue()) != null) {
                    throw new DuplicateDefinitionException(entry.getValue());
                }
            }
            statements.addAll(result.statements);
        }

        if (statements.isEmpty()) {
            LOGGER.warn("Schema contains no type to materialize ({} types declared); "
                    + "empty artifacts will be produced", model.getTypes().size());
        } else {
            LOGGER.info("Materialized {} types as {} concepts and {} triples", results.size(),
                    concepts.size(), statements.size());
        }

        return new TripleSet(statements, this.namespaces);
    }

    TypeTriples emit(final SchemaModel model, final TypeDefinition type) {
        final TypeTriples out = new TypeTriples();
        final URI uri = this.namer.typeURI(type.getName());
        switch (type.getKind()) {
        case OBJECT:
            emitFieldContainer(model, type, uri, S2DM.OBJECT_TYPE, out);
            break;
        case INTERFACE:
            emitFieldContainer(model, type, uri, S2DM.INTERFACE_TYPE, out);
            break;
        case INPUT_OBJECT:
            emitFieldContainer(model, type, uri, S2DM.INPUT_OBJECT_TYPE, out);
            break;
        case UNION:
            emitConcept(uri, type.getName(), type.getDescription(), S2DM.UNION_TYPE, out);
            for (final String member : type.getMemberTypeNames()) {
                out.add(uri, S2DM.HAS_UNION_MEMBER, this.namer.typeURI(member));
            }
            break;
        case ENUM:
            emitConcept(uri, type.getName(), type.getDescription(), S2DM.ENUM_TYPE, out);
            for (final EnumValueDefinition value : type.getValues()) {
                final URI valueURI = this.namer.valueURI(value);
                out.add(uri, S2DM.HAS_ENUM_VALUE, valueURI);
                emitConcept(valueURI, value.getQualifiedPath(), null, S2DM.ENUM_VALUE, out);
            }
            break;
        case SCALAR:
            if (!SchemaModel.isBuiltinScalar(type.getName())) {
                emitConcept(uri, type.getName(), type.getDescription(), S2DM.SCALAR_TYPE, out);
            }
            break;
        default:
            throw new AssertionError(type.getKind());
        }
        LOGGER.debug("Emitted {} triples for {}", out.statements.size(), type);
        return out;
    }

    private void emitFieldContainer(final SchemaModel model, final TypeDefinition type,
            final URI uri, final URI s2dmType, final TypeTriples out) {

        emitConcept(uri, type.getName(), type.getDescription(), s2dmType, out);

        for (final FieldDefinition field : type.getFields()) {
            final String path = field.getQualifiedPath();
            final String outputType = field.getSignature().getBaseTypeName();
            final TypeWrapperPattern pattern = TypeWrapperClassifier.classify(
                    field.getSignature(), path);
            if (model.isExcluded(outputType)
                    && this.config.getRootReferencePolicy() == RootReferencePolicy.REJECT) {
                throw new ExcludedReferenceException(path, outputType);
            }

            final URI fieldURI = this.namer.fieldURI(field);
            out.add(uri, S2DM.HAS_FIELD, fieldURI);
            emitConcept(fieldURI, path, null, S2DM.FIELD, out);
            out.add(fieldURI, S2DM.HAS_OUTPUT_TYPE, this.namer.typeURI(outputType));
            out.add(fieldURI, S2DM.USES_TYPE_WRAPPER_PATTERN, pattern.getURI());
        }
    }

    private void emitConcept(final URI uri, final String label,
            @Nullable final String description, final URI s2dmType, final TypeTriples out) {

        if (out.concepts.put(uri, label) != null) {
            throw new DuplicateDefinitionException(label);
        }
        out.add(uri, RDF.TYPE, SKOS.CONCEPT);
        out.add(uri, RDF.TYPE, s2dmType);
        out.add(uri, SKOS.PREF_LABEL, this.factory.createLiteral(label, this.config.getLanguage()));
        if (description != null && !description.trim().isEmpty()) {
            out.add(uri, SKOS.DEFINITION, this.factory.createLiteral(description));
        }
    }

    @Override
    public String toString() {
        return "Materializer(" + this.config + ")";
    }

    final class TypeTriples {

        final List<Statement> statements = Lists.newArrayList();

        // concept URI -> qualified path
        final Map<URI, String> concepts = Maps.newLinkedHashMap();

        void add(final URI subject, final URI predicate, final Value object) {
            this.statements.add(Materializer.this.factory.createStatement(subject, predicate,
                    object));
        }

    }

}

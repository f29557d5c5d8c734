package org.covesa.s2dm;

import java.util.List;
import java.util.concurrent.Executors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.RDF;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import org.covesa.s2dm.schema.SchemaModel;
import org.covesa.s2dm.schema.TypeDefinition;
import org.covesa.s2dm.schema.TypeKind;
import org.covesa.s2dm.vocabulary.S2DM;
import org.covesa.s2dm.vocabulary.SKOS;

public class MaterializerTest {

    private static final String NS = "https://covesa.org/s2dm/mydomain#";

    private static final ValueFactory VF = ValueFactoryImpl.getInstance();

    private static final Materializer MATERIALIZER = new Materializer(MaterializerConfig.builder(NS)
            .build());

    @Test
    public void testListField() {
        final TripleSet triples = MATERIALIZER.materialize(model(TypeDefinition
                .builder(TypeKind.OBJECT, "Cabin").field("doors", "[Door]").build()));

        assertContains(triples, ns("Cabin"), RDF.TYPE, SKOS.CONCEPT);
        assertContains(triples, ns("Cabin"), RDF.TYPE, S2DM.OBJECT_TYPE);
        assertContains(triples, ns("Cabin"), SKOS.PREF_LABEL, VF.createLiteral("Cabin", "en"));
        assertContains(triples, ns("Cabin"), S2DM.HAS_FIELD, ns("Cabin.doors"));
        assertContains(triples, ns("Cabin.doors"), RDF.TYPE, SKOS.CONCEPT);
        assertContains(triples, ns("Cabin.doors"), RDF.TYPE, S2DM.FIELD);
        assertContains(triples, ns("Cabin.doors"), SKOS.PREF_LABEL,
                VF.createLiteral("Cabin.doors", "en"));
        assertContains(triples, ns("Cabin.doors"), S2DM.USES_TYPE_WRAPPER_PATTERN, S2DM.LIST);
        assertContains(triples, ns("Cabin.doors"), S2DM.HAS_OUTPUT_TYPE, ns("Door"));
        Assert.assertEquals(9, triples.size());
    }

    @Test
    public void testEnum() {
        final TripleSet triples = MATERIALIZER.materialize(model(TypeDefinition
                .builder(TypeKind.ENUM, "CabinKindEnum").value("SUV").value("VAN").build()));

        assertContains(triples, ns("CabinKindEnum"), RDF.TYPE, S2DM.ENUM_TYPE);
        assertContains(triples, ns("CabinKindEnum"), S2DM.HAS_ENUM_VALUE, ns("CabinKindEnum.SUV"));
        assertContains(triples, ns("CabinKindEnum"), S2DM.HAS_ENUM_VALUE, ns("CabinKindEnum.VAN"));
        for (final String value : ImmutableList.of("SUV", "VAN")) {
            final URI uri = ns("CabinKindEnum." + value);
            assertContains(triples, uri, RDF.TYPE, SKOS.CONCEPT);
            assertContains(triples, uri, RDF.TYPE, S2DM.ENUM_VALUE);
            assertContains(triples, uri, SKOS.PREF_LABEL,
                    VF.createLiteral("CabinKindEnum." + value, "en"));
        }
        Assert.assertEquals(11, triples.size());
    }

    @Test
    public void testBuiltinScalarField() {
        final TripleSet triples = MATERIALIZER.materialize(model(TypeDefinition
                .builder(TypeKind.OBJECT, "Door").field("name", "String!").build(), TypeDefinition
                .builder(TypeKind.SCALAR, "String").build()));

        assertContains(triples, ns("Door.name"), S2DM.HAS_OUTPUT_TYPE, S2DM.STRING);
        assertContains(triples, ns("Door.name"), S2DM.USES_TYPE_WRAPPER_PATTERN, S2DM.NON_NULL);
        for (final Statement statement : triples) {
            Assert.assertNotEquals(S2DM.STRING, statement.getSubject());
        }
    }

    @Test
    public void testInterfaceInputUnionScalar() {
        final TripleSet triples = MATERIALIZER.materialize(model(
                TypeDefinition.builder(TypeKind.INTERFACE, "Vehicle").field("id", "ID!").build(),
                TypeDefinition.builder(TypeKind.INPUT_OBJECT, "DoorInput")
                        .field("position", "[Int!]!").build(),
                TypeDefinition.builder(TypeKind.UNION, "Part").member("Door").member("Window")
                        .build(),
                TypeDefinition.builder(TypeKind.SCALAR, "DateTime").build()));

        assertContains(triples, ns("Vehicle"), RDF.TYPE, S2DM.INTERFACE_TYPE);
        assertContains(triples, ns("Vehicle.id"), S2DM.HAS_OUTPUT_TYPE, S2DM.ID);
        assertContains(triples, ns("DoorInput"), RDF.TYPE, S2DM.INPUT_OBJECT_TYPE);
        assertContains(triples, ns("DoorInput.position"), S2DM.USES_TYPE_WRAPPER_PATTERN,
                S2DM.NON_NULL_LIST_OF_NON_NULL);
        assertContains(triples, ns("Part"), RDF.TYPE, S2DM.UNION_TYPE);
        assertContains(triples, ns("Part"), S2DM.HAS_UNION_MEMBER, ns("Door"));
        assertContains(triples, ns("Part"), S2DM.HAS_UNION_MEMBER, ns("Window"));
        assertContains(triples, ns("DateTime"), RDF.TYPE, SKOS.CONCEPT);
        assertContains(triples, ns("DateTime"), RDF.TYPE, S2DM.SCALAR_TYPE);
        assertContains(triples, ns("DateTime"), SKOS.PREF_LABEL,
                VF.createLiteral("DateTime", "en"));
    }

    @Test
    public void testDefinition() {
        final TripleSet triples = MATERIALIZER.materialize(model(
                TypeDefinition.builder(TypeKind.OBJECT, "Cabin").description("A vehicle cabin")
                        .field("doors", "[Door]").build(),
                TypeDefinition.builder(TypeKind.ENUM, "CabinKindEnum").description("  ")
                        .value("SUV").build()));

        assertContains(triples, ns("Cabin"), SKOS.DEFINITION,
                VF.createLiteral("A vehicle cabin"));
        int definitions = 0;
        for (final Statement statement : triples) {
            if (statement.getPredicate().equals(SKOS.DEFINITION)) {
                ++definitions;
            }
        }
        Assert.assertEquals(1, definitions);
    }

    @Test
    public void testLanguage() {
        final Materializer materializer = new Materializer(MaterializerConfig.builder(NS)
                .language("de-DE").build());
        final TripleSet triples = materializer.materialize(model(TypeDefinition.builder(
                TypeKind.OBJECT, "Cabin").build()));
        assertContains(triples, ns("Cabin"), SKOS.PREF_LABEL, VF.createLiteral("Cabin", "de-DE"));
    }

    @Test
    public void testExclusions() {
        final SchemaModel model = SchemaModel.builder()
                .type(TypeDefinition.builder(TypeKind.OBJECT, "Query").field("cabin", "Cabin")
                        .build())
                .type(TypeDefinition.builder(TypeKind.OBJECT, "Cabin").field("query", "Query")
                        .build())
                .type(TypeDefinition.builder(TypeKind.ENUM, "__TypeKind").value("OBJECT").build())
                .rootType("Query").build();
        final TripleSet triples = MATERIALIZER.materialize(model);

        assertContains(triples, ns("Cabin.query"), S2DM.HAS_OUTPUT_TYPE, ns("Query"));
        for (final Statement statement : triples) {
            Assert.assertNotEquals(ns("Query"), statement.getSubject());
            Assert.assertFalse(statement.getSubject().stringValue().contains("__"));
        }
    }

    @Test
    public void testEmptySchema() {
        final SchemaModel model = SchemaModel.builder()
                .type(TypeDefinition.builder(TypeKind.OBJECT, "Query").field("id", "ID").build())
                .type(TypeDefinition.builder(TypeKind.OBJECT, "__Schema").build())
                .rootType("Query").build();
        final Logger logger = (Logger) LoggerFactory.getLogger(Materializer.class);
        final ListAppender<ILoggingEvent> appender = new ListAppender<ILoggingEvent>();
        appender.start();
        logger.addAppender(appender);
        try {
            final TripleSet triples = MATERIALIZER.materialize(model);
            Assert.assertTrue(triples.isEmpty());
            Assert.assertEquals(NS, triples.getNamespaces().get("ns"));
        } finally {
            logger.detachAppender(appender);
            appender.stop();
        }
        final List<ILoggingEvent> warnings = Lists.newArrayList();
        for (final ILoggingEvent event : appender.list) {
            if (event.getLevel() == Level.WARN) {
                warnings.add(event);
            }
        }
        Assert.assertEquals(1, warnings.size());
        Assert.assertTrue(warnings.get(0).getFormattedMessage().startsWith(
                "Schema contains no type to materialize (2 types declared)"));
    }

    @Test
    public void testRejectRootReference() {
        final Materializer materializer = new Materializer(MaterializerConfig.builder(NS)
                .rootReferencePolicy(RootReferencePolicy.REJECT).build());
        final SchemaModel model = SchemaModel.builder()
                .type(TypeDefinition.builder(TypeKind.OBJECT, "Cabin").field("query", "Query!")
                        .build()).rootType("Query").build();
        try {
            materializer.materialize(model);
            Assert.fail();
        } catch (final ExcludedReferenceException ex) {
            Assert.assertEquals("Cabin.query", ex.getQualifiedPath());
            Assert.assertEquals("Query", ex.getReferencedType());
        }
    }

    @Test
    public void testUnsupportedShapeAborts() {
        try {
            MATERIALIZER.materialize(model(
                    TypeDefinition.builder(TypeKind.OBJECT, "Cabin").field("doors", "[Door]")
                            .build(),
                    TypeDefinition.builder(TypeKind.OBJECT, "Seat").field("grid", "[[Int]]")
                            .build()));
            Assert.fail();
        } catch (final UnsupportedShapeException ex) {
            Assert.assertEquals("Seat.grid", ex.getQualifiedPath());
        }
    }

    @Test(expected = InvalidIdentifierException.class)
    public void testInvalidIdentifierAborts() {
        MATERIALIZER.materialize(model(TypeDefinition.builder(TypeKind.OBJECT, "Cabin")
                .field("door.left", "Door").build()));
    }

    @Test
    public void testParallelMatchesSequential() throws Exception {
        final List<TypeDefinition> types = Lists.newArrayList();
        for (int i = 0; i < 50; ++i) {
            types.add(TypeDefinition.builder(TypeKind.OBJECT, "Type" + i)
                    .field("next", "[Type" + (i + 1) + "!]").field("id", "ID!").build());
            types.add(TypeDefinition.builder(TypeKind.ENUM, "Enum" + i).value("A").value("B")
                    .build());
        }
        final SchemaModel model = SchemaModel.builder().types(types).build();
        final ListeningExecutorService executor = MoreExecutors.listeningDecorator(Executors
                .newFixedThreadPool(4));
        try {
            final TripleSet parallel = MATERIALIZER.materialize(model, executor);
            final TripleSet sequential = MATERIALIZER.materialize(model);
            Assert.assertEquals(sequential, parallel);
            Assert.assertEquals(CanonicalSerializer.toNTriples(sequential),
                    CanonicalSerializer.toNTriples(parallel));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testParallelFailure() throws Exception {
        final ListeningExecutorService executor = MoreExecutors.listeningDecorator(Executors
                .newFixedThreadPool(2));
        try {
            MATERIALIZER.materialize(model(TypeDefinition.builder(TypeKind.OBJECT, "Seat")
                    .field("grid", "[[Int]]").build()), executor);
            Assert.fail();
        } catch (final UnsupportedShapeException ex) {
            Assert.assertEquals("Seat.grid", ex.getQualifiedPath());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testOrderIndependent() {
        final TypeDefinition cabin = TypeDefinition.builder(TypeKind.OBJECT, "Cabin")
                .field("doors", "[Door]").field("kind", "CabinKindEnum!").build();
        final TypeDefinition door = TypeDefinition.builder(TypeKind.OBJECT, "Door")
                .field("isOpen", "Boolean").build();
        final TypeDefinition kind = TypeDefinition.builder(TypeKind.ENUM, "CabinKindEnum")
                .value("SUV").value("VAN").build();
        final TripleSet first = MATERIALIZER.materialize(model(cabin, door, kind));
        final TripleSet second = MATERIALIZER.materialize(model(kind, door, cabin));
        Assert.assertEquals(CanonicalSerializer.toNTriples(first),
                CanonicalSerializer.toNTriples(second));
        Assert.assertEquals(CanonicalSerializer.toTurtle(first),
                CanonicalSerializer.toTurtle(second));
    }

    private static SchemaModel model(final TypeDefinition... types) {
        return SchemaModel.builder().types(ImmutableList.copyOf(types)).build();
    }

    private static URI ns(final String localName) {
        return VF.createURI(NS + localName);
    }

    private static void assertContains(final TripleSet triples, final Resource subject,
            final URI predicate, final Value object) {
        final Statement statement = VF.createStatement(subject, predicate, object);
        Assert.assertTrue("Missing " + statement, triples.getStatements().contains(statement));
    }

}

package org.covesa.s2dm.graphql;

import java.io.File;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.junit.Assert;
import org.junit.Test;

import org.covesa.s2dm.CanonicalSerializer;
import org.covesa.s2dm.Materializer;
import org.covesa.s2dm.MaterializerConfig;
import org.covesa.s2dm.TripleSet;
import org.covesa.s2dm.schema.FieldDefinition;
import org.covesa.s2dm.schema.SchemaModel;
import org.covesa.s2dm.schema.TypeDefinition;
import org.covesa.s2dm.schema.TypeKind;
import org.covesa.s2dm.schema.TypeSignature;

public class SchemaLoaderTest {

    @Test
    public void testLoadDirectory() throws Exception {
        final Path directory = Paths.get(SchemaLoaderTest.class.getResource("/schema").toURI());
        final List<URL> urls = SchemaLoader.resolve(directory.toString());
        Assert.assertEquals(3, urls.size());
        Assert.assertTrue(urls.get(0).toString().endsWith("cabin.graphql"));
        Assert.assertTrue(urls.get(1).toString().endsWith("door.graphqls"));
        Assert.assertTrue(urls.get(2).toString().endsWith("seat.gql"));

        final SchemaModel model = SchemaLoader.load(ImmutableList.of(directory.toString()));

        final TypeDefinition cabin = model.getType("Cabin");
        Assert.assertEquals(TypeKind.OBJECT, cabin.getKind());
        Assert.assertEquals("A vehicle cabin.", cabin.getDescription());
        Assert.assertEquals(ImmutableList.of("doors", "kind", "seats", "windows"),
                names(cabin.getFields()));
        Assert.assertEquals(TypeSignature.parse("[Seat!]!"), cabin.getFields().get(2)
                .getSignature());
        Assert.assertEquals(TypeSignature.parse("[Window]!"), cabin.getFields().get(3)
                .getSignature());

        final TypeDefinition kind = model.getType("CabinKindEnum");
        Assert.assertEquals(3, kind.getValues().size());
        Assert.assertEquals("TRUCK", kind.getValues().get(2).getName());

        Assert.assertEquals(TypeKind.INTERFACE, model.getType("Part").getKind());
        Assert.assertEquals(ImmutableList.of("Door", "Window"),
                ImmutableList.copyOf(model.getType("Opening").getMemberTypeNames()));
        Assert.assertEquals(TypeKind.INPUT_OBJECT, model.getType("SeatFilter").getKind());
        Assert.assertEquals(ImmutableList.of("heated", "ids"),
                names(model.getType("SeatFilter").getFields()));
        Assert.assertEquals(TypeKind.SCALAR, model.getType("DateTime").getKind());
        Assert.assertEquals("Date and time, ISO 8601", model.getType("DateTime")
                .getDescription());
        Assert.assertNull(model.getType("String"));

        Assert.assertTrue(model.isExcluded("Query"));
        Assert.assertTrue(model.isExcluded("Mutation"));
        for (final TypeDefinition type : model.getRetainedTypes()) {
            Assert.assertNotEquals("Query", type.getName());
        }
    }

    @Test
    public void testLoadFileAndURL() throws Exception {
        final URL url = SchemaLoaderTest.class.getResource("/schema/parts/seat.gql");
        final String file = new File(url.toURI()).getPath();
        final List<URL> resolved = SchemaLoader.resolve(file);
        Assert.assertEquals(1, resolved.size());
        Assert.assertEquals(new File(url.toURI()), new File(resolved.get(0).toURI()));
        Assert.assertEquals(1, SchemaLoader.resolve(url.toString()).size());

        final SchemaModel model = SchemaLoader.loadURLs(ImmutableList.of(url));
        Assert.assertEquals(ImmutableList.of("id", "heated", "installedAt"),
                names(model.getType("Seat").getFields()));
    }

    @Test
    public void testSchemaDefinition() {
        final SchemaModel model = SchemaLoader.parse("schema { query: Root }\n"
                + "type Root { cabin: Query }\n" + "type Query { id: ID }\n");
        Assert.assertEquals(ImmutableSet.of("Root"), model.getRootTypeNames());
        Assert.assertTrue(model.isExcluded("Root"));
        Assert.assertFalse(model.isExcluded("Query"));
        Assert.assertEquals(1, model.getRetainedTypes().size());
    }

    @Test
    public void testSignatures() {
        final SchemaModel model = SchemaLoader.parse("type Seat {\n a: Int\n b: Int!\n"
                + " c: [Int]\n d: [Int!]\n e: [Int]!\n f: [Int!]!\n g: [[Int]]\n}\n");
        final List<String> signatures = ImmutableList.of("Int", "Int!", "[Int]", "[Int!]",
                "[Int]!", "[Int!]!", "[[Int]]");
        final List<FieldDefinition> fields = model.getType("Seat").getFields();
        for (int i = 0; i < signatures.size(); ++i) {
            Assert.assertEquals(signatures.get(i), fields.get(i).getSignature().toString());
        }
    }

    @Test
    public void testEndToEnd() throws Exception {
        final Path directory = Paths.get(SchemaLoaderTest.class.getResource("/schema").toURI());
        final SchemaModel model = SchemaLoader.load(ImmutableList.of(directory.toString()));
        final TripleSet triples = new Materializer(MaterializerConfig.builder(
                "https://covesa.org/s2dm/mydomain#").build()).materialize(model);
        final String ntriples = CanonicalSerializer.toNTriples(triples);
        Assert.assertTrue(ntriples.contains("<https://covesa.org/s2dm/mydomain#Cabin.doors> "
                + "<https://covesa.global/models/s2dm#usesTypeWrapperPattern> "
                + "<https://covesa.global/models/s2dm#list> .\n"));
        Assert.assertTrue(ntriples.contains("<https://covesa.org/s2dm/mydomain#Seat.installedAt> "
                + "<https://covesa.global/models/s2dm#hasOutputType> "
                + "<https://covesa.org/s2dm/mydomain#DateTime> .\n"));
        Assert.assertFalse(ntriples.contains("mydomain#Query"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSyntaxError() {
        SchemaLoader.parse("type Cabin {");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingSource() {
        SchemaLoader.resolve("does/not/exist.graphql");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUndefinedExtension() {
        SchemaLoader.parse("extend type Cabin { doors: [Door] }\n");
    }

    @Test
    public void testConflictingSources() throws Exception {
        final URL url = SchemaLoaderTest.class.getResource("/schema/cabin.graphql");
        try {
            SchemaLoader.loadURLs(ImmutableList.of(url, url));
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            Assert.assertTrue(ex.getMessage().contains("cabin.graphql"));
        }
    }

    private static List<String> names(final List<FieldDefinition> fields) {
        final ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (final FieldDefinition field : fields) {
            builder.add(field.getName());
        }
        return builder.build();
    }

}

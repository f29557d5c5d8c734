package org.covesa.s2dm.tool;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.common.base.Charsets;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MaterializeTest {

    private static final String NS = "https://covesa.org/s2dm/mydomain#";

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private File schema;

    private File output;

    @Before
    public void setUp() throws Exception {
        this.schema = this.folder.newFile("cabin.graphql");
        write(this.schema, "type Query { cabin: Cabin }\n"
                + "type Cabin { doors: [Door] kind: CabinKindEnum! }\n"
                + "type Door { isOpen: Boolean }\n" + "enum CabinKindEnum { SUV VAN }\n");
        this.output = new File(this.folder.getRoot(), "out");
    }

    @Test
    public void testSuccess() throws Exception {
        Assert.assertEquals(0, run("-o", this.output.getPath(), "-n", NS, "-p", "dom",
                this.schema.getPath()));

        final Path nt = this.output.toPath().resolve("schema.nt");
        final Path ttl = this.output.toPath().resolve("schema.ttl");
        final String ntriples = new String(Files.readAllBytes(nt), Charsets.UTF_8);
        final String turtle = new String(Files.readAllBytes(ttl), Charsets.UTF_8);
        Assert.assertTrue(ntriples.contains("<" + NS + "Cabin.doors> "
                + "<https://covesa.global/models/s2dm#hasOutputType> <" + NS + "Door> .\n"));
        Assert.assertTrue(turtle.startsWith("@prefix dom: <" + NS + "> .\n"));
        Assert.assertTrue(turtle.contains("dom:Cabin.doors "));
        Assert.assertFalse(ntriples.contains(NS + "Query>"));
    }

    @Test
    public void testParallelAndBaseName() throws Exception {
        Assert.assertEquals(0, run("-o", this.output.getPath(), "-n", NS, "-b", "sequential",
                this.schema.getPath()));
        Assert.assertEquals(0, run("--output", this.output.getPath(), "--namespace", NS,
                "--base-name", "parallel", "--threads", "4", "--language", "en",
                this.schema.getPath()));
        for (final String extension : new String[] { ".nt", ".ttl" }) {
            Assert.assertArrayEquals(
                    Files.readAllBytes(this.output.toPath().resolve("sequential" + extension)),
                    Files.readAllBytes(this.output.toPath().resolve("parallel" + extension)));
        }
    }

    @Test
    public void testUnsupportedShape() throws Exception {
        write(this.schema, "type Seat { grid: [[Int]] }\n");
        Assert.assertEquals(-1, run("-o", this.output.getPath(), "-n", NS,
                this.schema.getPath()));
        Assert.assertTrue(errors().contains("Seat.grid"));
        Assert.assertFalse(this.output.exists());
    }

    @Test
    public void testRejectRootReferences() throws Exception {
        write(this.schema, "type Query { cabin: Cabin }\ntype Cabin { query: Query }\n");
        Assert.assertEquals(0, run("-o", this.output.getPath(), "-n", NS,
                this.schema.getPath()));
        Assert.assertEquals(-1, run("-o", this.output.getPath(), "-n", NS, "-r",
                this.schema.getPath()));
        Assert.assertTrue(errors().contains("Cabin.query"));
    }

    @Test
    public void testInvalidNamespace() throws Exception {
        Assert.assertEquals(-1, run("-o", this.output.getPath(), "-n", "no-separator",
                this.schema.getPath()));
        Assert.assertTrue(errors().startsWith("INVALID INPUT."));
    }

    @Test
    public void testSyntaxErrors() throws Exception {
        Assert.assertEquals(-2, run("-o", this.output.getPath(), this.schema.getPath()));
        Assert.assertEquals(-2, run("-o", this.output.getPath(), "-n", NS));
        Assert.assertEquals(-2, run("-o", this.output.getPath(), "-n", NS, "-t", "zero",
                this.schema.getPath()));
        Assert.assertEquals(-2, run("-o", this.schema.getPath(), "-n", NS,
                this.schema.getPath()));
        Assert.assertEquals(-2, run("--unknown"));
        Assert.assertTrue(errors().contains("SYNTAX ERROR"));
    }

    @Test
    public void testHelpAndVersion() {
        Assert.assertEquals(0, run("-h"));
        Assert.assertEquals(0, run("--version"));
    }

    @Test
    public void testInterruptedKeepsFlag() throws Exception {
        Thread.currentThread().interrupt();
        try {
            Assert.assertEquals(-1, run("-o", this.output.getPath(), "-n", NS, "-t", "2",
                    this.schema.getPath()));
            Assert.assertTrue(Thread.currentThread().isInterrupted());
            Assert.assertTrue(errors().contains("INTERRUPTED"));
            Assert.assertFalse(this.output.exists());
        } finally {
            Thread.interrupted();
        }
    }

    private int run(final String... args) {
        return Materialize.run(args, new PrintStream(this.err, true));
    }

    private String errors() {
        return new String(this.err.toByteArray(), Charsets.UTF_8);
    }

    private static void write(final File file, final String content) throws Exception {
        Files.write(file.toPath(), content.getBytes(Charsets.UTF_8));
    }

}

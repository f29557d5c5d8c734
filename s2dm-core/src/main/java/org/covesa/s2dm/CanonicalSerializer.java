package org.covesa.s2dm;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;

import org.openrdf.model.Statement;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.covesa.s2dm.internal.rdf.CanonicalRDF;

/**
 * Renders a {@link TripleSet} in its two canonical textual forms.
 * <p>
 * The flat form ({@link #toNTriples(TripleSet)}) is an N-Triples document with one sorted line per
 * statement; the grouped form ({@link #toTurtle(TripleSet)}) is a Turtle document with sorted
 * prefix declarations followed by one block per subject. Both are pure functions of the statement
 * set and its namespaces: serializing equal sets always yields identical strings. See
 * {@link CanonicalRDF} for the exact formatting rules.
 * </p>
 */
public final class CanonicalSerializer {

    /** Default base name of the artifacts produced by {@link #writeArtifacts}. */
    public static final String DEFAULT_BASE_NAME = "schema";

    public static final String NTRIPLES_EXTENSION = ".nt";

    public static final String TURTLE_EXTENSION = ".ttl";

    private static final Logger LOGGER = LoggerFactory.getLogger(CanonicalSerializer.class);

    /**
     * Renders the statements specified in the flat form.
     *
     * @param triples
     *            the statements
     * @return the N-Triples document; the empty string if there are no statements
     */
    public static String toNTriples(final TripleSet triples) {
        final StringWriter writer = new StringWriter();
        write(triples, CanonicalRDF.newNTriplesWriter(writer));
        return writer.toString();
    }

    /**
     * Renders the statements specified in the grouped form.
     *
     * @param triples
     *            the statements
     * @return the Turtle document, always starting with the prefix declarations
     */
    public static String toTurtle(final TripleSet triples) {
        final StringWriter writer = new StringWriter();
        write(triples, CanonicalRDF.newTurtleWriter(writer));
        return writer.toString();
    }

    /**
     * Writes the flat and grouped forms of the statements specified as {@code baseName.nt} and
     * {@code baseName.ttl} in the directory specified, which is created if missing. Both
     * documents are rendered before any file is written.
     *
     * @param triples
     *            the statements
     * @param directory
     *            the output directory
     * @param baseName
     *            the base file name, without extension
     * @throws IOException
     *             on failure
     */
    public static void writeArtifacts(final TripleSet triples, final Path directory,
            final String baseName) throws IOException {

        Preconditions.checkNotNull(directory);
        Preconditions.checkArgument(!baseName.isEmpty() && baseName.indexOf('/') < 0
                && baseName.indexOf('\\') < 0, "Invalid base name: %s", baseName);

        final String ntriples = toNTriples(triples);
        final String turtle = toTurtle(triples);

        final Path ntriplesPath = directory.resolve(baseName + NTRIPLES_EXTENSION);
        final Path turtlePath = directory.resolve(baseName + TURTLE_EXTENSION);
        Files.createDirectories(directory);
        Files.write(ntriplesPath, ntriples.getBytes(Charsets.UTF_8));
        Files.write(turtlePath, turtle.getBytes(Charsets.UTF_8));

        LOGGER.info("Written {} triples to {} and {}", triples.size(), ntriplesPath, turtlePath);
    }

    private static void write(final TripleSet triples, final RDFWriter writer) {
        try {
            writer.startRDF();
            for (final Map.Entry<String, String> entry : triples.getNamespaces().entrySet()) {
                writer.handleNamespace(entry.getKey(), entry.getValue());
            }
            for (final Statement statement : triples) {
                writer.handleStatement(statement);
            }
            writer.endRDF();
        } catch (final RDFHandlerException ex) {
            // no I/O error on a StringWriter
            throw new IllegalStateException("Cannot render " + triples, ex);
        }
    }

    private CanonicalSerializer() {
    }

}

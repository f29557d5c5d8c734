package org.covesa.s2dm.tool;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.covesa.s2dm.CanonicalSerializer;
import org.covesa.s2dm.Materializer;
import org.covesa.s2dm.MaterializerConfig;
import org.covesa.s2dm.RootReferencePolicy;
import org.covesa.s2dm.TripleSet;
import org.covesa.s2dm.graphql.SchemaLoader;
import org.covesa.s2dm.schema.SchemaModel;

/**
 * Command line tool {@code s2dm-rdf}, materializing GraphQL schemas as SKOS / s2dm RDF.
 */
public final class Materialize {

    private static final Logger LOGGER = LoggerFactory.getLogger(Materialize.class);

    public static void main(final String... args) {
        System.exit(run(args, System.err));
    }

    /**
     * Runs the tool with the arguments specified, without terminating the JVM.
     *
     * @param args
     *            the command line arguments
     * @param err
     *            the stream where to report failures
     * @return the exit status: 0 on success, -1 on invalid input, interruption or execution
     *         failure, -2 on syntax errors in the command line
     */
    public static int run(final String[] args, final PrintStream err) {
        try {
            final CommandLine cmd = CommandLine
                    .parser()
                    .withName("s2dm-rdf")
                    .withHeader("Materializes one or more GraphQL schema sources (files, " //
                            + "directories or URLs) as SKOS concepts annotated with the s2dm " //
                            + "vocabulary, producing a sorted N-Triples file and a grouped " //
                            + "Turtle file")
                    .withOption("o", "output", "the output directory", "DIR",
                            CommandLine.Type.DIRECTORY, true)
                    .withOption("n", "namespace", "the namespace of concept URIs, ending in " //
                            + "'#' or '/'", "IRI", CommandLine.Type.STRING, true)
                    .withOption("p", "prefix", "the prefix bound to the namespace (default: " //
                            + MaterializerConfig.DEFAULT_PREFIX + ")", "PREFIX",
                            CommandLine.Type.STRING, false)
                    .withOption("l", "language", "the language tag of concept labels " //
                            + "(default: " + MaterializerConfig.DEFAULT_LANGUAGE + ")", "TAG",
                            CommandLine.Type.STRING, false)
                    .withOption("b", "base-name", "the base name of the output files " //
                            + "(default: " + CanonicalSerializer.DEFAULT_BASE_NAME + ")", "NAME",
                            CommandLine.Type.STRING, false)
                    .withOption("t", "threads", "the number of threads emitting concepts " //
                            + "(default: 1)", "N", CommandLine.Type.POSITIVE_INTEGER, false)
                    .withOption("r", "reject-root-references",
                            "fail on fields whose type is a root operation or introspection type")
                    .withFooter("Exit status is 0 on success, -1 on invalid input, " //
                            + "-2 on syntax errors")
                    .withLogger(LoggerFactory.getLogger("org.covesa.s2dm")).parse(args);

            if (cmd.getArgCount() == 0) {
                throw new CommandLine.Exception("no schema source specified");
            }

            final Path output = cmd.getOptionValue("o", Path.class);
            final String baseName = cmd.getOptionValue("b", String.class,
                    CanonicalSerializer.DEFAULT_BASE_NAME);
            final int threads = cmd.getOptionValue("t", Integer.class, 1);
            final MaterializerConfig config = MaterializerConfig
                    .builder(cmd.getOptionValue("n", String.class))
                    .prefix(cmd.getOptionValue("p", String.class))
                    .language(cmd.getOptionValue("l", String.class))
                    .rootReferencePolicy(cmd.hasOption("r") ? RootReferencePolicy.REJECT
                            : RootReferencePolicy.EMIT).build();

            final SchemaModel model = SchemaLoader.load(cmd.getArgs());
            final TripleSet triples = materialize(new Materializer(config), model, threads);
            CanonicalSerializer.writeArtifacts(triples, output, baseName);
            return 0;

        } catch (final IllegalArgumentException ex) {
            // includes MaterializationException, whose message starts with the offending path
            LOGGER.debug("Invalid input", ex);
            err.println("INVALID INPUT. " + ex.getMessage());
            return -1;

        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            err.println("INTERRUPTED. Materialization aborted");
            return -1;

        } catch (final Throwable ex) {
            return CommandLine.exitCode(ex, err);
        }
    }

    private static TripleSet materialize(final Materializer materializer,
            final SchemaModel model, final int threads) throws InterruptedException {
        if (threads <= 1) {
            return materializer.materialize(model);
        }
        final ThreadFactory factory = new ThreadFactoryBuilder().setNameFormat("s2dm-emit-%d")
                .setDaemon(true).build();
        final ListeningExecutorService executor = MoreExecutors.listeningDecorator(Executors
                .newFixedThreadPool(threads, factory));
        try {
            return materializer.materialize(model, executor);
        } finally {
            executor.shutdownNow();
        }
    }

    private Materialize() {
    }

}

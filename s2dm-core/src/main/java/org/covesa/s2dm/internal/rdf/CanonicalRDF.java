package org.covesa.s2dm.internal.rdf;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFWriter;
import org.openrdf.rio.helpers.RDFWriterBase;

import org.covesa.s2dm.vocabulary.S2DM;
import org.covesa.s2dm.vocabulary.SKOS;

/**
 * Canonical, deterministic N-Triples and Turtle writers.
 * <p>
 * The writers returned by {@link #newNTriplesWriter(Writer)} and {@link #newTurtleWriter(Writer)}
 * buffer all the statements they receive and emit them on {@code endRDF()} in a canonical order
 * that depends only on the set of statements received, not on the order they were received in.
 * Duplicate statements are emitted once. Ordering is defined by {@link #statementOrdering()}:
 * statements are compared by the N-Triples rendering of their subject, then predicate, then object
 * (see {@link #render(Value)}), using plain string comparison.
 * </p>
 * <p>
 * The N-Triples writer emits one {@code subject predicate object .} line per statement, each line
 * terminated by {@code \n}, with no comments and no blank lines. The Turtle writer emits the
 * {@code @prefix} declarations received via {@code handleNamespace()} (sorted by prefix) followed
 * by one block per subject, in canonical subject order. Within a block, predicates follow the fixed
 * order {@code rdf:type}, {@code skos:prefLabel}, {@code skos:definition}, {@code s2dm:hasField},
 * {@code s2dm:hasOutputType}, {@code s2dm:usesTypeWrapperPattern}, {@code s2dm:hasUnionMember},
 * {@code s2dm:hasEnumValue}, then any other predicate in canonical order; objects of the same
 * predicate are comma-separated in canonical order. URIs are abbreviated using the declared
 * prefixes whenever the local name is a valid Turtle local name.
 * </p>
 */
public final class CanonicalRDF {

    private static final int BUFFER_SIZE = 64 * 1024;

    private static final List<URI> PREDICATE_ORDER = ImmutableList.of(RDF.TYPE, SKOS.PREF_LABEL,
            SKOS.DEFINITION, S2DM.HAS_FIELD, S2DM.HAS_OUTPUT_TYPE, S2DM.USES_TYPE_WRAPPER_PATTERN,
            S2DM.HAS_UNION_MEMBER, S2DM.HAS_ENUM_VALUE);

    private static final Ordering<Value> VALUE_ORDERING = new Ordering<Value>() {

        @Override
        public int compare(final Value first, final Value second) {
            return render(first).compareTo(render(second));
        }

    };

    private static final Ordering<Statement> STATEMENT_ORDERING = new Ordering<Statement>() {

        @Override
        public int compare(final Statement first, final Statement second) {
            int result = VALUE_ORDERING.compare(first.getSubject(), second.getSubject());
            if (result == 0) {
                result = VALUE_ORDERING.compare(first.getPredicate(), second.getPredicate());
                if (result == 0) {
                    result = VALUE_ORDERING.compare(first.getObject(), second.getObject());
                }
            }
            return result;
        }

    };

    private static final Ordering<URI> PREDICATE_ORDERING = new Ordering<URI>() {

        @Override
        public int compare(final URI first, final URI second) {
            final int firstRank = rank(first);
            final int secondRank = rank(second);
            if (firstRank != secondRank) {
                return firstRank < secondRank ? -1 : 1;
            }
            return VALUE_ORDERING.compare(first, second);
        }

        private int rank(final URI predicate) {
            final int index = PREDICATE_ORDER.indexOf(predicate);
            return index >= 0 ? index : PREDICATE_ORDER.size();
        }

    };

    /**
     * Returns the total ordering over values used by the canonical writers.
     *
     * @return an ordering comparing the N-Triples rendering of values
     */
    public static Ordering<Value> valueOrdering() {
        return VALUE_ORDERING;
    }

    /**
     * Returns the total ordering over statements used by the canonical writers.
     *
     * @return an ordering comparing rendered subject, predicate and object, in this order
     */
    public static Ordering<Statement> statementOrdering() {
        return STATEMENT_ORDERING;
    }

    /**
     * Returns the N-Triples rendering of a value, e.g., {@code <http://example.org/x>} or
     * {@code "label"@en}.
     *
     * @param value
     *            the value to render
     * @return the rendered string
     */
    public static String render(final Value value) {
        final StringBuilder builder = new StringBuilder();
        render(value, builder);
        return builder.toString();
    }

    public static RDFWriter newNTriplesWriter(final Writer writer) {
        return new NTriplesWriter(writer);
    }

    public static RDFWriter newTurtleWriter(final Writer writer) {
        return new TurtleWriter(writer);
    }

    private static void render(final Value value, final StringBuilder out) {
        if (value instanceof URI) {
            renderURI((URI) value, out);
        } else if (value instanceof BNode) {
            out.append('_').append(':').append(((BNode) value).getID());
        } else {
            renderLiteral((Literal) value, out);
        }
    }

    private static void renderURI(final URI uri, final StringBuilder out) {
        renderIRI(uri.stringValue(), out);
    }

    private static void renderIRI(final String string, final StringBuilder out) {
        final int length = string.length();
        out.append('<');
        for (int i = 0; i < length; ++i) {
            final char ch = string.charAt(i);
            switch (ch) {
            case '<':
            case '>':
            case '"':
            case '{':
            case '}':
            case '|':
            case '^':
            case '`':
            case '\\':
                appendUnicodeEscape(ch, out);
                break;
            default:
                if (ch <= 0x20) {
                    appendUnicodeEscape(ch, out);
                } else {
                    out.append(ch);
                }
            }
        }
        out.append('>');
    }

    private static void renderLiteral(final Literal literal, final StringBuilder out) {
        final String label = literal.getLabel();
        final int length = label.length();
        out.append('"');
        for (int i = 0; i < length; ++i) {
            final char ch = label.charAt(i);
            switch (ch) {
            case '\\':
                out.append('\\').append('\\');
                break;
            case '\t':
                out.append('\\').append('t');
                break;
            case '\n':
                out.append('\\').append('n');
                break;
            case '\r':
                out.append('\\').append('r');
                break;
            case '\"':
                out.append('\\').append('\"');
                break;
            default:
                if (ch < 0x20 || ch == 0x7F) {
                    appendUnicodeEscape(ch, out);
                } else {
                    out.append(ch);
                }
            }
        }
        out.append('"');
        final String language = literal.getLanguage();
        final URI datatype = literal.getDatatype();
        if (language != null) {
            out.append('@').append(language);
        } else if (datatype != null) {
            out.append('^').append('^');
            renderURI(datatype, out);
        }
    }

    private static void appendUnicodeEscape(final char ch, final StringBuilder out) {
        final String hex = Integer.toHexString(ch).toUpperCase();
        out.append('\\').append('u');
        for (int i = hex.length(); i < 4; ++i) {
            out.append('0');
        }
        out.append(hex);
    }

    private static boolean isLocalNameChar(final char ch) {
        return ch >= 'A' && ch <= 'Z' || ch >= 'a' && ch <= 'z' || ch >= '0' && ch <= '9'
                || ch == '_' || ch == '-' || ch == '.';
    }

    private static boolean isHexDigit(final char ch) {
        return ch >= '0' && ch <= '9' || ch >= 'A' && ch <= 'F' || ch >= 'a' && ch <= 'f';
    }

    // Conservative subset of Turtle PN_LOCAL: ASCII name chars and %XX escapes, no leading '-'
    // or '.', no trailing '.'
    private static boolean isLocalName(final String name) {
        final int length = name.length();
        if (length == 0) {
            return false;
        }
        final char first = name.charAt(0);
        if (first == '-' || first == '.' || name.charAt(length - 1) == '.') {
            return false;
        }
        for (int i = 0; i < length; ++i) {
            final char ch = name.charAt(i);
            if (ch == '%') {
                if (i + 2 >= length || !isHexDigit(name.charAt(i + 1))
                        || !isHexDigit(name.charAt(i + 2))) {
                    return false;
                }
                i += 2;
            } else if (!isLocalNameChar(ch)) {
                return false;
            }
        }
        return true;
    }

    private static final class NTriplesWriter extends RDFWriterBase {

        private final Writer writer;

        private final SortedSet<Statement> statements;

        NTriplesWriter(final Writer writer) {
            this.writer = Preconditions.checkNotNull(writer);
            this.statements = Sets.newTreeSet(STATEMENT_ORDERING);
        }

        @Override
        public RDFFormat getRDFFormat() {
            return RDFFormat.NTRIPLES;
        }

        @Override
        public void startRDF() throws RDFHandlerException {
            this.statements.clear();
        }

        @Override
        public void handleComment(final String comment) throws RDFHandlerException {
            // comments are not part of the canonical form
        }

        @Override
        public void handleNamespace(final String prefix, final String uri)
                throws RDFHandlerException {
            // N-Triples has no prefixes
        }

        @Override
        public void handleStatement(final Statement statement) throws RDFHandlerException {
            checkNoContext(statement);
            this.statements.add(statement);
        }

        @Override
        public void endRDF() throws RDFHandlerException {
            try {
                final StringBuilder builder = new StringBuilder(BUFFER_SIZE);
                for (final Statement statement : this.statements) {
                    render(statement.getSubject(), builder);
                    builder.append(' ');
                    render(statement.getPredicate(), builder);
                    builder.append(' ');
                    render(statement.getObject(), builder);
                    builder.append(' ').append('.').append('\n');
                    if (builder.length() >= BUFFER_SIZE) {
                        this.writer.append(builder);
                        builder.setLength(0);
                    }
                }
                this.writer.append(builder);
                this.writer.flush();
            } catch (final IOException ex) {
                throw new RDFHandlerException(ex);
            } finally {
                this.statements.clear();
            }
        }

    }

    private static final class TurtleWriter extends RDFWriterBase {

        private final Writer writer;

        private final SortedMap<String, String> namespaces;

        private final SortedSet<Statement> statements;

        TurtleWriter(final Writer writer) {
            this.writer = Preconditions.checkNotNull(writer);
            this.namespaces = Maps.newTreeMap();
            this.statements = Sets.newTreeSet(STATEMENT_ORDERING);
        }

        @Override
        public RDFFormat getRDFFormat() {
            return RDFFormat.TURTLE;
        }

        @Override
        public void startRDF() throws RDFHandlerException {
            this.namespaces.clear();
            this.statements.clear();
        }

        @Override
        public void handleComment(final String comment) throws RDFHandlerException {
            // comments are not part of the canonical form
        }

        @Override
        public void handleNamespace(final String prefix, final String uri)
                throws RDFHandlerException {
            final String previous = this.namespaces.put(prefix, uri);
            if (previous != null && !previous.equals(uri)) {
                throw new RDFHandlerException("Prefix " + prefix + " bound to both " + previous
                        + " and " + uri);
            }
        }

        @Override
        public void handleStatement(final Statement statement) throws RDFHandlerException {
            checkNoContext(statement);
            this.statements.add(statement);
        }

        @Override
        public void endRDF() throws RDFHandlerException {
            try {
                final StringBuilder builder = new StringBuilder(BUFFER_SIZE);
                for (final Map.Entry<String, String> entry : this.namespaces.entrySet()) {
                    builder.append("@prefix ").append(entry.getKey()).append(": ");
                    renderIRI(entry.getValue(), builder);
                    builder.append(" .\n");
                }

                // Statements are sorted by subject first, so each subject forms a contiguous run
                Resource subject = null;
                final Map<URI, SortedSet<Value>> objects = Maps.newTreeMap(PREDICATE_ORDERING);
                for (final Statement statement : this.statements) {
                    if (!statement.getSubject().equals(subject)) {
                        emitBlock(subject, objects, builder);
                        subject = statement.getSubject();
                        objects.clear();
                    }
                    SortedSet<Value> set = objects.get(statement.getPredicate());
                    if (set == null) {
                        set = Sets.newTreeSet(VALUE_ORDERING);
                        objects.put(statement.getPredicate(), set);
                    }
                    set.add(statement.getObject());
                }
                emitBlock(subject, objects, builder);

                this.writer.append(builder);
                this.writer.flush();

            } catch (final IOException ex) {
                throw new RDFHandlerException(ex);
            } finally {
                this.namespaces.clear();
                this.statements.clear();
            }
        }

        private void emitBlock(@Nullable final Resource subject,
                final Map<URI, SortedSet<Value>> objects, final StringBuilder out) {
            if (subject == null) {
                return;
            }
            out.append('\n');
            emitTerm(subject, out);
            String separator = " ";
            for (final Map.Entry<URI, SortedSet<Value>> entry : objects.entrySet()) {
                out.append(separator);
                emitTerm(entry.getKey(), out);
                String objectSeparator = " ";
                for (final Value object : entry.getValue()) {
                    out.append(objectSeparator);
                    emitTerm(object, out);
                    objectSeparator = ", ";
                }
                separator = " ;\n    ";
            }
            out.append(" .\n");
        }

        private void emitTerm(final Value value, final StringBuilder out) {
            if (value instanceof URI) {
                final String string = value.stringValue();
                String bestPrefix = null;
                String bestNamespace = "";
                for (final Map.Entry<String, String> entry : this.namespaces.entrySet()) {
                    final String namespace = entry.getValue();
                    if (string.startsWith(namespace)
                            && namespace.length() > bestNamespace.length()
                            && isLocalName(string.substring(namespace.length()))) {
                        bestPrefix = entry.getKey();
                        bestNamespace = namespace;
                    }
                }
                if (bestPrefix != null) {
                    out.append(bestPrefix).append(':')
                            .append(string.substring(bestNamespace.length()));
                    return;
                }
            }
            render(value, out);
        }

    }

    private static void checkNoContext(final Statement statement) throws RDFHandlerException {
        if (statement.getContext() != null) {
            throw new RDFHandlerException("Quads are not supported: " + statement);
        }
    }

    private CanonicalRDF() {
    }

}

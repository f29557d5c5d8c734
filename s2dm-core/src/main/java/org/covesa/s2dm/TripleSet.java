package org.covesa.s2dm;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.openrdf.model.Statement;

/**
 * The immutable set of statements materialized from a schema, together with the prefix-to-namespace
 * bindings to use when rendering it.
 * <p>
 * A {@code TripleSet} is created once per run by a {@link Materializer} and then handed to a
 * {@link CanonicalSerializer}. Iteration order is the emission order, which carries no meaning:
 * serializers impose their own canonical order. Equality is defined in terms of the statement set
 * only.
 * </p>
 */
public final class TripleSet implements Iterable<Statement> {

    private final Set<Statement> statements;

    private final Map<String, String> namespaces;

    TripleSet(final Iterable<Statement> statements, final Map<String, String> namespaces) {
        this.statements = ImmutableSet.copyOf(statements);
        this.namespaces = ImmutableMap.copyOf(namespaces);
    }

    /**
     * Creates a {@code TripleSet} with the statements and prefix-to-namespace bindings specified.
     * 
     * @param statements
     *            the statements; duplicates are merged
     * @param namespaces
     *            the prefix-to-namespace bindings
     * @return the created set
     */
    public static TripleSet create(final Iterable<Statement> statements,
            final Map<String, String> namespaces) {
        Preconditions.checkNotNull(statements);
        Preconditions.checkNotNull(namespaces);
        return new TripleSet(statements, namespaces);
    }

    public Set<Statement> getStatements() {
        return this.statements;
    }

    /**
     * Returns the prefix-to-namespace bindings to use when rendering the statements.
     * 
     * @return an immutable prefix-to-namespace map
     */
    public Map<String, String> getNamespaces() {
        return this.namespaces;
    }

    public int size() {
        return this.statements.size();
    }

    public boolean isEmpty() {
        return this.statements.isEmpty();
    }

    @Override
    public Iterator<Statement> iterator() {
        return this.statements.iterator();
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof TripleSet)) {
            return false;
        }
        return this.statements.equals(((TripleSet) object).statements);
    }

    @Override
    public int hashCode() {
        return this.statements.hashCode();
    }

    @Override
    public String toString() {
        return "TripleSet(" + this.statements.size() + " statements)";
    }

}

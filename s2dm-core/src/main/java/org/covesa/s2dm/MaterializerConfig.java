package org.covesa.s2dm;

import java.io.Serializable;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import org.covesa.s2dm.vocabulary.S2DM;
import org.covesa.s2dm.vocabulary.SKOS;

/**
 * Immutable configuration of a materialization run.
 * <p>
 * The configuration specifies the namespace under which concept URIs are minted (an absolute IRI
 * ending in {@code #} or {@code /}), the prefix bound to that namespace in the grouped
 * serialization (default {@value #DEFAULT_PREFIX}), the BCP 47 language tag of
 * {@code skos:prefLabel} literals (default {@value #DEFAULT_LANGUAGE}) and the
 * {@link RootReferencePolicy} (default {@link RootReferencePolicy#EMIT}). A single instance is
 * shared, read-only, by all the components involved in a run.
 * </p>
 */
public final class MaterializerConfig implements Serializable {

    public static final String DEFAULT_PREFIX = "ns";

    public static final String DEFAULT_LANGUAGE = "en";

    private static final long serialVersionUID = 1L;

    private static final Pattern PREFIX_PATTERN = Pattern
            .compile("[A-Za-z]([A-Za-z0-9_.-]*[A-Za-z0-9_-])?");

    private static final Pattern LANGUAGE_PATTERN = Pattern
            .compile("[A-Za-z]{1,8}(-[A-Za-z0-9]{1,8})*");

    private static final ImmutableSet<String> RESERVED_PREFIXES = ImmutableSet.of("rdf",
            SKOS.PREFIX, S2DM.PREFIX);

    private final String namespace;

    private final String prefix;

    private final String language;

    private final RootReferencePolicy rootReferencePolicy;

    private MaterializerConfig(final Builder builder) {

        final String namespace = Preconditions.checkNotNull(builder.namespace);
        final String prefix = MoreObjects.firstNonNull(builder.prefix, DEFAULT_PREFIX);
        final String language = MoreObjects.firstNonNull(builder.language, DEFAULT_LANGUAGE);

        Preconditions.checkArgument(namespace.endsWith("#") || namespace.endsWith("/"),
                "Namespace must end with '#' or '/': %s", namespace);
        try {
            Preconditions.checkArgument(new java.net.URI(namespace).isAbsolute(),
                    "Namespace is not an absolute IRI: %s", namespace);
        } catch (final URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid namespace IRI: " + namespace, ex);
        }
        Preconditions.checkArgument(PREFIX_PATTERN.matcher(prefix).matches(),
                "Invalid prefix: %s", prefix);
        Preconditions.checkArgument(!RESERVED_PREFIXES.contains(prefix),
                "Prefix %s is reserved", prefix);
        Preconditions.checkArgument(LANGUAGE_PATTERN.matcher(language).matches(),
                "Invalid BCP 47 language tag: %s", language);

        this.namespace = namespace;
        this.prefix = prefix;
        this.language = language;
        this.rootReferencePolicy = MoreObjects.firstNonNull(builder.rootReferencePolicy,
                RootReferencePolicy.EMIT);
    }

    /**
     * Returns a builder for a configuration using the namespace specified.
     * 
     * @param namespace
     *            the namespace for concept URIs, e.g., {@code https://covesa.org/s2dm/mydomain#}
     * @return the created builder
     */
    public static Builder builder(final String namespace) {
        return new Builder(namespace);
    }

    public String getNamespace() {
        return this.namespace;
    }

    public String getPrefix() {
        return this.prefix;
    }

    public String getLanguage() {
        return this.language;
    }

    public RootReferencePolicy getRootReferencePolicy() {
        return this.rootReferencePolicy;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof MaterializerConfig)) {
            return false;
        }
        final MaterializerConfig other = (MaterializerConfig) object;
        return this.namespace.equals(other.namespace) && this.prefix.equals(other.prefix)
                && this.language.equals(other.language)
                && this.rootReferencePolicy == other.rootReferencePolicy;
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(this.namespace, this.prefix, this.language,
                this.rootReferencePolicy);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("namespace", this.namespace)
                .add("prefix", this.prefix).add("language", this.language)
                .add("rootReferencePolicy", this.rootReferencePolicy).toString();
    }

    public static final class Builder {

        final String namespace;

        @Nullable
        String prefix;

        @Nullable
        String language;

        @Nullable
        RootReferencePolicy rootReferencePolicy;

        Builder(final String namespace) {
            this.namespace = Preconditions.checkNotNull(namespace);
        }

        public Builder prefix(@Nullable final String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder language(@Nullable final String language) {
            this.language = language;
            return this;
        }

        public Builder rootReferencePolicy(
                @Nullable final RootReferencePolicy rootReferencePolicy) {
            this.rootReferencePolicy = rootReferencePolicy;
            return this;
        }

        public MaterializerConfig build() {
            return new MaterializerConfig(this);
        }

    }

}

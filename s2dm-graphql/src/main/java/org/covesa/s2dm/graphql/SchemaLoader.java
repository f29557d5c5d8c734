package org.covesa.s2dm.graphql;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.io.Resources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import graphql.language.Description;
import graphql.language.EnumTypeDefinition;
import graphql.language.EnumTypeExtensionDefinition;
import graphql.language.EnumValueDefinition;
import graphql.language.FieldDefinition;
import graphql.language.InputObjectTypeDefinition;
import graphql.language.InputObjectTypeExtensionDefinition;
import graphql.language.InputValueDefinition;
import graphql.language.InterfaceTypeDefinition;
import graphql.language.InterfaceTypeExtensionDefinition;
import graphql.language.ListType;
import graphql.language.NonNullType;
import graphql.language.ObjectTypeDefinition;
import graphql.language.ObjectTypeExtensionDefinition;
import graphql.language.OperationTypeDefinition;
import graphql.language.ScalarTypeDefinition;
import graphql.language.SchemaDefinition;
import graphql.language.SchemaExtensionDefinition;
import graphql.language.Type;
import graphql.language.TypeName;
import graphql.language.UnionTypeDefinition;
import graphql.language.UnionTypeExtensionDefinition;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import graphql.schema.idl.errors.SchemaProblem;

import org.covesa.s2dm.schema.SchemaModel;
import org.covesa.s2dm.schema.TypeDefinition;
import org.covesa.s2dm.schema.TypeKind;
import org.covesa.s2dm.schema.TypeSignature;
import org.covesa.s2dm.schema.TypeSignature.Modifier;

/**
 * Loads a {@link SchemaModel} from GraphQL SDL sources.
 * <p>
 * Sources are files, directories (scanned recursively for {@code *.graphql}, {@code *.graphqls}
 * and {@code *.gql} files, in sorted path order) and URLs. All the sources are parsed with
 * graphql-java and merged into a single type registry; {@code extend} definitions are folded into
 * the definitions they extend. Root operation types are taken from the {@code schema} definition
 * if present, otherwise they are the types named {@code Query}, {@code Mutation} and
 * {@code Subscription}. Field arguments and directives are not part of the model.
 * </p>
 * <p>
 * The loader performs no semantic validation of the schema beyond what the parser does. Any
 * failure (unreadable source, syntax error, conflicting definitions) is reported as an
 * {@link IllegalArgumentException} naming the offending source.
 * </p>
 */
public final class SchemaLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaLoader.class);

    /** File extensions recognized when scanning directories. */
    public static final Set<String> EXTENSIONS = ImmutableSet.of(".graphql", ".graphqls", ".gql");

    private static final List<String> DEFAULT_ROOT_TYPES = ImmutableList.of("Query", "Mutation",
            "Subscription");

    private static final Pattern URL_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9+.-]+:/.*");

    /**
     * Resolves a source location, given either as a URL or as a file or directory path, to the
     * list of SDL documents it denotes.
     *
     * @param location
     *            the location
     * @return the URLs of the SDL documents, in loading order
     * @throws IllegalArgumentException
     *             if the location does not exist or cannot be read
     */
    public static List<URL> resolve(final String location) throws IllegalArgumentException {
        Preconditions.checkNotNull(location);
        if (URL_PATTERN.matcher(location).matches()) {
            try {
                return ImmutableList.of(new URL(location));
            } catch (final MalformedURLException ex) {
                throw new IllegalArgumentException("Invalid schema URL " + location, ex);
            }
        }
        return resolve(Paths.get(location));
    }

    /**
     * Resolves a file or directory to the list of SDL documents it denotes.
     *
     * @param path
     *            the path of a file or directory
     * @return the URLs of the SDL documents, in loading order
     * @throws IllegalArgumentException
     *             if the path does not exist or cannot be read
     */
    public static List<URL> resolve(final Path path) throws IllegalArgumentException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Schema source " + path + " does not exist");
        }
        try {
            if (!Files.isDirectory(path)) {
                return ImmutableList.of(path.toUri().toURL());
            }
            final List<Path> found = Lists.newArrayList();
            Files.walkFileTree(path, new SimpleFileVisitor<Path>() {

                @Override
                public FileVisitResult visitFile(final Path file,
                        final BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isSchemaFile(file)) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

            });
            final List<Path> files = Ordering.<Path>natural().sortedCopy(found);
            if (files.isEmpty()) {
                LOGGER.warn("No schema file found in {}", path);
            }
            final List<URL> urls = Lists.newArrayListWithCapacity(files.size());
            for (final Path file : files) {
                urls.add(file.toUri().toURL());
            }
            return urls;
        } catch (final IOException ex) {
            throw new IllegalArgumentException("Cannot read schema source " + path, ex);
        }
    }

    /**
     * Loads the schema made of all the SDL documents at the locations specified.
     *
     * @param locations
     *            file, directory or URL locations, see {@link #resolve(String)}
     * @return the loaded schema
     * @throws IllegalArgumentException
     *             if a source cannot be read or parsed, or definitions conflict
     */
    public static SchemaModel load(final Iterable<String> locations)
            throws IllegalArgumentException {
        final List<URL> urls = Lists.newArrayList();
        for (final String location : locations) {
            urls.addAll(resolve(location));
        }
        return loadURLs(urls);
    }

    public static SchemaModel loadURLs(final Iterable<URL> urls) throws IllegalArgumentException {
        final SchemaParser parser = new SchemaParser();
        final TypeDefinitionRegistry registry = new TypeDefinitionRegistry();
        int count = 0;
        for (final URL url : urls) {
            final String sdl;
            try {
                sdl = Resources.toString(url, Charsets.UTF_8);
            } catch (final IOException ex) {
                throw new IllegalArgumentException("Cannot read schema source " + url, ex);
            }
            merge(registry, parse(parser, sdl, url.toString()), url.toString());
            LOGGER.debug("Parsed {}", url);
            ++count;
        }
        final SchemaModel model = toModel(registry);
        LOGGER.info("Loaded {} types from {} schema documents", model.getTypes().size(), count);
        return model;
    }

    /**
     * Loads the schema described by the SDL text specified.
     *
     * @param sdl
     *            the SDL text
     * @return the loaded schema
     * @throws IllegalArgumentException
     *             if the text cannot be parsed
     */
    public static SchemaModel parse(final String sdl) throws IllegalArgumentException {
        return toModel(parse(new SchemaParser(), sdl, "<string>"));
    }

    private static TypeDefinitionRegistry parse(final SchemaParser parser, final String sdl,
            final String source) {
        try {
            return parser.parse(sdl);
        } catch (final SchemaProblem ex) {
            throw new IllegalArgumentException("Invalid schema " + source + ": "
                    + ex.getMessage(), ex);
        }
    }

    private static void merge(final TypeDefinitionRegistry registry,
            final TypeDefinitionRegistry other, final String source) {
        try {
            registry.merge(other);
        } catch (final SchemaProblem ex) {
            throw new IllegalArgumentException("Conflicting definitions in " + source + ": "
                    + ex.getMessage(), ex);
        }
    }

    static SchemaModel toModel(final TypeDefinitionRegistry registry) {

        final SchemaModel.Builder builder = SchemaModel.builder();

        for (final graphql.language.TypeDefinition<?> definition : registry.types().values()) {
            final String name = definition.getName();
            if (definition instanceof ObjectTypeDefinition) {
                final TypeDefinition.Builder type = TypeDefinition.builder(TypeKind.OBJECT, name)
                        .description(text(((ObjectTypeDefinition) definition).getDescription()));
                addFields(type, ((ObjectTypeDefinition) definition).getFieldDefinitions());
                for (final ObjectTypeExtensionDefinition extension : extensions(registry
                        .objectTypeExtensions(), name)) {
                    addFields(type, extension.getFieldDefinitions());
                }
                builder.type(type.build());

            } else if (definition instanceof InterfaceTypeDefinition) {
                final TypeDefinition.Builder type = TypeDefinition.builder(TypeKind.INTERFACE,
                        name).description(
                        text(((InterfaceTypeDefinition) definition).getDescription()));
                addFields(type, ((InterfaceTypeDefinition) definition).getFieldDefinitions());
                for (final InterfaceTypeExtensionDefinition extension : extensions(registry
                        .interfaceTypeExtensions(), name)) {
                    addFields(type, extension.getFieldDefinitions());
                }
                builder.type(type.build());

            } else if (definition instanceof InputObjectTypeDefinition) {
                final TypeDefinition.Builder type = TypeDefinition.builder(TypeKind.INPUT_OBJECT,
                        name).description(
                        text(((InputObjectTypeDefinition) definition).getDescription()));
                addInputFields(type,
                        ((InputObjectTypeDefinition) definition).getInputValueDefinitions());
                for (final InputObjectTypeExtensionDefinition extension : extensions(registry
                        .inputObjectTypeExtensions(), name)) {
                    addInputFields(type, extension.getInputValueDefinitions());
                }
                builder.type(type.build());

            } else if (definition instanceof UnionTypeDefinition) {
                final TypeDefinition.Builder type = TypeDefinition.builder(TypeKind.UNION, name)
                        .description(text(((UnionTypeDefinition) definition).getDescription()));
                addMembers(type, ((UnionTypeDefinition) definition).getMemberTypes());
                for (final UnionTypeExtensionDefinition extension : extensions(registry
                        .unionTypeExtensions(), name)) {
                    addMembers(type, extension.getMemberTypes());
                }
                builder.type(type.build());

            } else if (definition instanceof EnumTypeDefinition) {
                final TypeDefinition.Builder type = TypeDefinition.builder(TypeKind.ENUM, name)
                        .description(text(((EnumTypeDefinition) definition).getDescription()));
                addValues(type, ((EnumTypeDefinition) definition).getEnumValueDefinitions());
                for (final EnumTypeExtensionDefinition extension : extensions(registry
                        .enumTypeExtensions(), name)) {
                    addValues(type, extension.getEnumValueDefinitions());
                }
                builder.type(type.build());
            }
        }

        for (final ScalarTypeDefinition scalar : registry.scalars().values()) {
            if (!SchemaModel.isBuiltinScalar(scalar.getName())) {
                builder.type(TypeDefinition.builder(TypeKind.SCALAR, scalar.getName())
                        .description(text(scalar.getDescription())).build());
            }
        }

        checkExtended(registry.objectTypeExtensions(), registry);
        checkExtended(registry.interfaceTypeExtensions(), registry);
        checkExtended(registry.inputObjectTypeExtensions(), registry);
        checkExtended(registry.unionTypeExtensions(), registry);
        checkExtended(registry.enumTypeExtensions(), registry);

        final List<OperationTypeDefinition> operations = Lists.newArrayList();
        final SchemaDefinition schema = registry.schemaDefinition().orElse(null);
        if (schema != null) {
            operations.addAll(schema.getOperationTypeDefinitions());
        }
        for (final SchemaExtensionDefinition extension : registry.getSchemaExtensionDefinitions()) {
            operations.addAll(extension.getOperationTypeDefinitions());
        }
        if (operations.isEmpty()) {
            for (final String name : DEFAULT_ROOT_TYPES) {
                builder.rootType(name);
            }
        } else {
            for (final OperationTypeDefinition operation : operations) {
                builder.rootType(operation.getTypeName().getName());
            }
        }

        return builder.build();
    }

    /**
     * Converts a GraphQL type reference to a {@code TypeSignature}.
     *
     * @param type
     *            the type reference, e.g., the AST of {@code [Door!]!}
     * @return the corresponding signature
     */
    static TypeSignature toSignature(final Type<?> type) {
        final List<Modifier> outerFirst = Lists.newArrayList();
        Type<?> current = type;
        while (!(current instanceof TypeName)) {
            if (current instanceof NonNullType) {
                outerFirst.add(Modifier.NON_NULL);
                current = ((NonNullType) current).getType();
            } else if (current instanceof ListType) {
                outerFirst.add(Modifier.LIST);
                current = ((ListType) current).getType();
            } else {
                throw new IllegalArgumentException("Unexpected type reference " + current);
            }
        }
        return TypeSignature.create(((TypeName) current).getName(), Lists.reverse(outerFirst));
    }

    private static void addFields(final TypeDefinition.Builder type,
            final List<FieldDefinition> fields) {
        for (final FieldDefinition field : fields) {
            type.field(field.getName(), toSignature(field.getType()));
        }
    }

    private static void addInputFields(final TypeDefinition.Builder type,
            final List<InputValueDefinition> fields) {
        for (final InputValueDefinition field : fields) {
            type.field(field.getName(), toSignature(field.getType()));
        }
    }

    @SuppressWarnings("rawtypes")
    private static void addMembers(final TypeDefinition.Builder type, final List<Type> members) {
        for (final Type<?> member : members) {
            type.member(((TypeName) member).getName());
        }
    }

    private static void addValues(final TypeDefinition.Builder type,
            final List<EnumValueDefinition> values) {
        for (final EnumValueDefinition value : values) {
            type.value(value.getName());
        }
    }

    private static <T> List<T> extensions(final Map<String, List<T>> extensions,
            final String name) {
        final List<T> list = extensions.get(name);
        return list != null ? list : Collections.<T>emptyList();
    }

    private static void checkExtended(final Map<String, ?> extensions,
            final TypeDefinitionRegistry registry) {
        for (final String name : extensions.keySet()) {
            if (!registry.getType(name).isPresent()) {
                throw new IllegalArgumentException("Extension of undefined type " + name);
            }
        }
    }

    @Nullable
    private static String text(@Nullable final Description description) {
        return description == null ? null : description.getContent();
    }

    private static boolean isSchemaFile(final Path path) {
        final String name = path.getFileName().toString();
        for (final String extension : EXTENSIONS) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private SchemaLoader() {
    }

}

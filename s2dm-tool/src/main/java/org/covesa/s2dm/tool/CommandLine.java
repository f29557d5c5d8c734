package org.covesa.s2dm.tool;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;

import ch.qos.logback.classic.Level;

/**
 * Parsed command line of a tool, with typed access to arguments and option values.
 * <p>
 * Instances are obtained via a {@link Parser}, which handles the {@code -h/--help},
 * {@code -v/--version} and (if a logger is configured) {@code -V/--verbose} options on its own.
 * Help and version requests, as well as syntax errors, are signalled by throwing a
 * {@link CommandLine.Exception}: its message is null for help and version requests.
 * </p>
 */
public final class CommandLine {

    private final List<String> args;

    private final Map<String, List<String>> optionValues;

    private CommandLine(final List<String> args, final Map<String, List<String>> optionValues) {
        this.args = args;
        this.optionValues = optionValues;
    }

    public List<String> getArgs() {
        return this.args;
    }

    public int getArgCount() {
        return this.args.size();
    }

    public boolean hasOption(final String letterOrName) {
        return this.optionValues.containsKey(letterOrName);
    }

    /**
     * Returns the single value of an option, converted to the type specified.
     *
     * @param letterOrName
     *            the letter or long name of the option
     * @param type
     *            the Java type of the value: {@code String}, {@code Integer} or {@code Path}
     * @param defaultValue
     *            the value to return if the option was not specified
     * @return the option value, or the default value
     * @throws CommandLine.Exception
     *             if the option has multiple values or its value cannot be converted
     */
    @Nullable
    public <T> T getOptionValue(final String letterOrName, final Class<T> type,
            @Nullable final T defaultValue) {
        final List<String> strings = this.optionValues.get(letterOrName);
        if (strings == null || strings.isEmpty()) {
            return defaultValue;
        }
        if (strings.size() > 1) {
            throw new Exception("Multiple values for option '" + letterOrName + "': "
                    + Joiner.on(", ").join(strings));
        }
        return convert(strings.get(0), type);
    }

    @Nullable
    public <T> T getOptionValue(final String letterOrName, final Class<T> type) {
        return getOptionValue(letterOrName, type, null);
    }

    private static <T> T convert(final String string, final Class<T> type) {
        try {
            if (type == String.class) {
                return type.cast(string);
            } else if (type == Integer.class) {
                return type.cast(Integer.valueOf(string));
            } else if (type == Path.class) {
                return type.cast(Paths.get(string));
            }
        } catch (final RuntimeException ex) {
            throw new Exception("'" + string + "' is not a valid " + type.getSimpleName(), ex);
        }
        throw new IllegalArgumentException("Unsupported type " + type);
    }

    /**
     * Reports the failure specified on the error stream and returns the process exit status.
     * Help and version requests yield 0, syntax errors -2, any other failure -1.
     *
     * @param throwable
     *            the failure
     * @param err
     *            the stream where to report the failure
     * @return the exit status
     */
    public static int exitCode(final Throwable throwable, final PrintStream err) {
        if (throwable instanceof Exception) {
            if (throwable.getMessage() == null) {
                return 0;
            }
            err.println("SYNTAX ERROR: " + throwable.getMessage());
            return -2;
        }
        err.println("EXECUTION FAILED: " + throwable.getMessage());
        throwable.printStackTrace(err);
        return -1;
    }

    public static Parser parser() {
        return new Parser();
    }

    public static final class Parser {

        @Nullable
        private String name;

        @Nullable
        private String header;

        @Nullable
        private String footer;

        @Nullable
        private Logger logger;

        private final Options options;

        private final Map<String, Type> optionTypes;

        private final Set<String> mandatoryOptions;

        Parser() {
            this.options = new Options();
            this.optionTypes = Maps.newHashMap();
            this.mandatoryOptions = Sets.newLinkedHashSet();
        }

        public Parser withName(@Nullable final String name) {
            this.name = name;
            return this;
        }

        public Parser withHeader(@Nullable final String header) {
            this.header = header;
            return this;
        }

        public Parser withFooter(@Nullable final String footer) {
            this.footer = footer;
            return this;
        }

        /**
         * Sets the logger whose level is lowered to DEBUG by the {@code -V/--verbose} option.
         *
         * @param logger
         *            the logger, null to disable the verbose option
         * @return this parser
         */
        public Parser withLogger(@Nullable final Logger logger) {
            this.logger = logger;
            return this;
        }

        public Parser withOption(@Nullable final String letter, final String name,
                final String description) {
            Preconditions.checkArgument(name.length() > 1);
            this.options.addOption(new Option(letter, name, false, description));
            return this;
        }

        public Parser withOption(@Nullable final String letter, final String name,
                final String description, final String argName, final Type argType,
                final boolean mandatory) {

            Preconditions.checkArgument(name.length() > 1);
            Preconditions.checkNotNull(argName);
            Preconditions.checkNotNull(argType);

            final Option option = new Option(letter, name, true, description);
            option.setArgName(argName);
            this.options.addOption(option);
            this.optionTypes.put(name, argType);
            if (mandatory) {
                this.mandatoryOptions.add(name);
            }
            return this;
        }

        public CommandLine parse(final String... args) {

            if (this.logger != null) {
                this.options.addOption("V", "verbose", false, "enable verbose output");
            }
            this.options.addOption("v", "version", false,
                    "display version information and terminate");
            this.options.addOption("h", "help", false, "display this help message and terminate");

            final org.apache.commons.cli.CommandLine cmd;
            try {
                cmd = new DefaultParser().parse(this.options, args);
            } catch (final ParseException ex) {
                printHelp();
                throw new Exception(ex.getMessage(), ex);
            }

            if (cmd.hasOption('V')) {
                if (this.logger instanceof ch.qos.logback.classic.Logger) {
                    ((ch.qos.logback.classic.Logger) this.logger).setLevel(Level.DEBUG);
                } else {
                    this.logger.warn("Verbose output not supported by logger binding");
                }
            }

            // Halt execution by throwing an exception with a null message
            if (cmd.hasOption('v')) {
                printVersion();
                throw new Exception(null);
            } else if (cmd.hasOption('h')) {
                printHelp();
                throw new Exception(null);
            }

            for (final String name : this.mandatoryOptions) {
                if (!cmd.hasOption(name)) {
                    printHelp();
                    throw new Exception("missing mandatory option --" + name);
                }
            }

            final Map<String, List<String>> optionValues = Maps.newHashMap();
            for (final Option option : cmd.getOptions()) {
                final Type type = this.optionTypes.get(option.getLongOpt());
                final List<String> values = Lists.newArrayList();
                if (option.getValues() != null) {
                    for (final String value : option.getValues()) {
                        if (type != null && !type.validate(value)) {
                            throw new Exception("'" + value + "' is not a valid value for option --"
                                    + option.getLongOpt() + " (expected "
                                    + type.toString().toLowerCase().replace('_', ' ') + ")");
                        }
                        values.add(value);
                    }
                }
                // repeated options accumulate their values
                final List<String> previous = optionValues.get(option.getLongOpt());
                final List<String> list = previous == null ? ImmutableList.copyOf(values)
                        : ImmutableList.<String>builder().addAll(previous).addAll(values).build();
                optionValues.put(option.getLongOpt(), list);
                if (option.getOpt() != null) {
                    optionValues.put(option.getOpt(), list);
                }
            }

            return new CommandLine(ImmutableList.copyOf(cmd.getArgList()), optionValues);
        }

        private void printVersion() {
            String version = "(development)";
            final URL url = CommandLine.class.getClassLoader().getResource(
                    "META-INF/maven/org.covesa.s2dm/s2dm-tool/pom.properties");
            if (url != null) {
                try (InputStream stream = url.openStream()) {
                    final Properties properties = new Properties();
                    properties.load(stream);
                    version = properties.getProperty("version").trim();
                } catch (final IOException ex) {
                    version = "(unknown)";
                }
            }
            final String name = MoreObjects.firstNonNull(this.name, "Version");
            System.out.println(String.format("%s %s\nJava %s (%s)\n", name, version,
                    System.getProperty("java.version"), System.getProperty("java.vendor")));
        }

        private void printHelp() {
            final HelpFormatter formatter = new HelpFormatter();
            final PrintWriter out = new PrintWriter(System.out);
            final String name = MoreObjects.firstNonNull(this.name, "java");
            formatter.printUsage(out, 80, name, this.options);
            if (this.header != null) {
                out.println();
                formatter.printWrapped(out, 80, this.header);
            }
            out.println();
            formatter.printOptions(out, 80, this.options, 2, 2);
            if (this.footer != null) {
                out.println();
                out.println(this.footer);
            }
            out.flush();
        }

    }

    public static final class Exception extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public Exception(@Nullable final String message) {
            super(message);
        }

        public Exception(@Nullable final String message, final Throwable cause) {
            super(message, cause);
        }

    }

    public enum Type {

        STRING,

        POSITIVE_INTEGER,

        DIRECTORY;

        public boolean validate(final String string) {
            if (this == POSITIVE_INTEGER) {
                try {
                    return Integer.parseInt(string) > 0;
                } catch (final NumberFormatException ex) {
                    return false;
                }
            } else if (this == DIRECTORY) {
                try {
                    final Path path = Paths.get(string);
                    return !Files.exists(path) || Files.isDirectory(path);
                } catch (final InvalidPathException ex) {
                    return false;
                }
            }
            return true;
        }

    }

}

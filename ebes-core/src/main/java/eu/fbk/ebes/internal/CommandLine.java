package eu.fbk.ebes.internal;

import java.io.File;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;

import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.openrdf.model.URI;
import org.openrdf.model.impl.URIImpl;
import org.slf4j.Logger;

/**
 * Arguments and option values of an ebes tool invocation, as produced by a {@link Parser}.
 * <p>
 * Options can be looked up either by letter or by long name. Values are kept as strings and
 * converted on access to {@code String}, {@code Integer}, {@code Long}, {@code Double},
 * {@code File}, {@code URI} or any enum type (matched case-insensitively).
 * </p>
 */
public final class CommandLine {

    private final List<String> args;

    private final ListMultimap<String, String> values;

    private final Set<String> keys;

    private final List<String> names;

    private CommandLine(final List<String> args, final ListMultimap<String, String> values,
            final Set<String> keys, final Iterable<String> names) {
        this.args = args;
        this.values = values;
        this.keys = ImmutableSet.copyOf(keys);
        this.names = Ordering.natural().immutableSortedCopy(names);
    }

    public <T> List<T> getArgs(final Class<T> type) {
        return convertAll(this.args, type);
    }

    public <T> T getArg(final int index, final Class<T> type) {
        if (index >= this.args.size()) {
            throw new Exception("Missing argument #" + (index + 1));
        }
        return convert(this.args.get(index), type);
    }

    public <T> T getArg(final int index, final Class<T> type, final T defaultValue) {
        return index >= this.args.size() ? defaultValue : convert(this.args.get(index), type);
    }

    public int getArgCount() {
        return this.args.size();
    }

    /**
     * Returns the long names of the options specified, sorted.
     */
    public List<String> getOptions() {
        return this.names;
    }

    public boolean hasOption(final String letterOrName) {
        return this.keys.contains(letterOrName);
    }

    public <T> List<T> getOptionValues(final String letterOrName, final Class<T> type) {
        return convertAll(this.values.get(letterOrName), type);
    }

    @Nullable
    public <T> T getOptionValue(final String letterOrName, final Class<T> type) {
        final List<String> strings = this.values.get(letterOrName);
        switch (strings.size()) {
        case 0:
            return null;
        case 1:
            return convert(strings.get(0), type);
        default:
            throw new Exception("Option '" + letterOrName + "' given more than once: "
                    + Joiner.on(", ").join(strings));
        }
    }

    @Nullable
    public <T> T getOptionValue(final String letterOrName, final Class<T> type,
            @Nullable final T defaultValue) {
        final T value = getOptionValue(letterOrName, type);
        return value == null ? defaultValue : value;
    }

    private static <T> List<T> convertAll(final List<String> strings, final Class<T> type) {
        final ImmutableList.Builder<T> builder = ImmutableList.builder();
        for (final String string : strings) {
            builder.add(convert(string, type));
        }
        return builder.build();
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static <T> T convert(final String string, final Class<T> type) {
        final String trimmed = string.trim();
        final Object result;
        try {
            if (type == String.class) {
                result = string;
            } else if (type == File.class) {
                result = new File(string);
            } else if (type == Integer.class) {
                result = Integer.valueOf(trimmed);
            } else if (type == Long.class) {
                result = Long.valueOf(trimmed);
            } else if (type == Double.class) {
                result = Double.valueOf(trimmed);
            } else if (type == URI.class) {
                result = new URIImpl(trimmed);
            } else if (type.isEnum()) {
                result = Enum.valueOf((Class<Enum>) type, trimmed.toUpperCase(Locale.ROOT));
            } else {
                throw new UnsupportedOperationException("Cannot convert to " + type.getName());
            }
        } catch (final IllegalArgumentException ex) {
            throw new Exception("Invalid " + type.getSimpleName().toLowerCase(Locale.ROOT)
                    + " '" + string + "'", ex);
        }
        return type.cast(result);
    }

    /**
     * Terminates the JVM after a tool failure. A {@link CommandLine.Exception} without message
     * means help or version was printed (exit 0); with a message it is a syntax error (exit -2).
     * Anything else is reported with its stack trace (exit -1).
     *
     * @param throwable
     *            the failure that stopped the tool
     */
    public static void fail(final Throwable throwable) {
        if (!(throwable instanceof Exception)) {
            System.err.println("EXECUTION FAILED: " + throwable.getMessage());
            throwable.printStackTrace();
            System.exit(-1);
        } else if (throwable.getMessage() != null) {
            System.err.println("SYNTAX ERROR: " + throwable.getMessage());
            System.exit(-2);
        } else {
            System.exit(0);
        }
    }

    public static Parser parser() {
        return new Parser();
    }

    public static final class Parser {

        private static final int WIDTH = 80;

        private final Options options = new Options();

        private final Set<String> mandatory = Sets.newLinkedHashSet();

        @Nullable
        private String name;

        @Nullable
        private String header;

        @Nullable
        private String footer;

        @Nullable
        private Logger logger;

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
         * Enables a {@code -V/--verbose} flag that switches the given logger to debug level.
         */
        public Parser withLogger(@Nullable final Logger logger) {
            this.logger = logger;
            return this;
        }

        public Parser withOption(@Nullable final String letter, final String name,
                final String description) {
            this.options.addOption(newOption(letter, name, description, false));
            return this;
        }

        public Parser withOption(@Nullable final String letter, final String name,
                final String description, final String argName, final Type argType,
                final boolean argRequired, final boolean multiValue, final boolean mandatory) {

            final Option option = newOption(letter, name, description, true);
            option.setArgName(Preconditions.checkNotNull(argName));
            option.setType(Preconditions.checkNotNull(argType));
            option.setOptionalArg(!argRequired);
            option.setArgs(multiValue ? Option.UNLIMITED_VALUES : 1);
            this.options.addOption(option);
            if (mandatory) {
                this.mandatory.add(name);
            }
            return this;
        }

        private static Option newOption(@Nullable final String letter, final String name,
                final String description, final boolean hasArg) {
            Preconditions.checkArgument(name.length() > 1, "Invalid long option name '%s'",
                    name);
            return new Option(letter, name, hasArg, Preconditions.checkNotNull(description));
        }

        /**
         * Parses the arguments of a tool invocation.
         *
         * @param args
         *            the arguments received by {@code main}
         * @return the parsed command line
         * @throws Exception
         *             on a syntax error, or with a null message after printing help or version
         */
        public CommandLine parse(final String... args) {

            if (this.logger != null) {
                this.options.addOption("V", "verbose", false, "enable debug logging");
            }
            this.options.addOption("v", "version", false, "print version and exit");
            this.options.addOption("h", "help", false, "print this help and exit");

            final org.apache.commons.cli.CommandLine cmd;
            try {
                cmd = new GnuParser().parse(this.options, args);
            } catch (final ParseException ex) {
                printHelp();
                throw new Exception(ex.getMessage(), ex);
            }

            if (cmd.hasOption('h')) {
                printHelp();
                throw new Exception(null);
            }
            if (cmd.hasOption('v')) {
                printVersion();
                throw new Exception(null);
            }
            if (this.logger != null && cmd.hasOption('V')) {
                Logging.setDebug(this.logger, true);
            }

            for (final String name : this.mandatory) {
                if (!cmd.hasOption(name)) {
                    printHelp();
                    throw new Exception("Option --" + name + " is required");
                }
            }

            final ImmutableListMultimap.Builder<String, String> values = ImmutableListMultimap
                    .builder();
            final Set<String> names = Sets.newHashSet();
            final Set<String> keys = Sets.newHashSet();
            for (final Option option : cmd.getOptions()) {
                final String name = option.getLongOpt();
                final String[] strings = MoreObjects.firstNonNull(option.getValues(),
                        new String[0]);
                for (final String string : strings) {
                    if (option.getType() instanceof Type
                            && !((Type) option.getType()).accepts(string)) {
                        throw new Exception("Option --" + name + " expects "
                                + ((Type) option.getType()).description + ", got '" + string
                                + "'");
                    }
                }
                names.add(name);
                keys.add(name);
                values.putAll(name, strings);
                if (option.getOpt() != null) {
                    keys.add(option.getOpt());
                    values.putAll(option.getOpt(), strings);
                }
            }

            @SuppressWarnings("unchecked")
            final List<String> argList = cmd.getArgList();
            return new CommandLine(ImmutableList.copyOf(argList), values.build(), keys, names);
        }

        private void printVersion() {
            System.out.println(MoreObjects.firstNonNull(this.name, "ebes") + " "
                    + Util.getVersion("eu.fbk.ebes", "ebes-core", "(development)") + " (Java "
                    + System.getProperty("java.version") + ", "
                    + System.getProperty("java.vendor") + ")");
        }

        private void printHelp() {
            final HelpFormatter formatter = new HelpFormatter();
            final PrintWriter out = new PrintWriter(System.out);
            formatter.printUsage(out, WIDTH, MoreObjects.firstNonNull(this.name, "java"),
                    this.options);
            if (this.header != null) {
                out.println();
                formatter.printWrapped(out, WIDTH, this.header);
            }
            out.println();
            formatter.printOptions(out, WIDTH, this.options, 2, 2);
            if (this.footer != null) {
                out.println();
                out.println(this.footer);
            }
            out.flush();
        }

    }

    /**
     * Syntax error in the command line. A null message means execution must simply stop.
     */
    public static final class Exception extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public Exception(@Nullable final String message) {
            super(message);
        }

        public Exception(@Nullable final String message, @Nullable final Throwable cause) {
            super(message, cause);
        }

    }

    /**
     * Kind of value an option accepts, checked at parse time.
     */
    public enum Type {

        STRING("a string") {

            @Override
            boolean accepts(final String string) {
                return true;
            }

        },

        INTEGER("an integer") {

            @Override
            boolean accepts(final String string) {
                return parseLong(string) != null;
            }

        },

        POSITIVE_INTEGER("a positive integer") {

            @Override
            boolean accepts(final String string) {
                final Long n = parseLong(string);
                return n != null && n > 0L;
            }

        },

        POSITIVE_FLOAT("a positive number") {

            @Override
            boolean accepts(final String string) {
                final Double n = parseDouble(string);
                return n != null && n > 0.0;
            }

        },

        NON_NEGATIVE_FLOAT("a non-negative number") {

            @Override
            boolean accepts(final String string) {
                final Double n = parseDouble(string);
                return n != null && n >= 0.0;
            }

        },

        FILE_EXISTING("an existing file") {

            @Override
            boolean accepts(final String string) {
                return new File(string).isFile();
            }

        };

        final String description;

        Type(final String description) {
            this.description = description;
        }

        abstract boolean accepts(String string);

        @Nullable
        private static Long parseLong(final String string) {
            try {
                return Long.valueOf(string.trim());
            } catch (final NumberFormatException ex) {
                return null;
            }
        }

        @Nullable
        private static Double parseDouble(final String string) {
            try {
                return Double.valueOf(string.trim());
            } catch (final NumberFormatException ex) {
                return null;
            }
        }

    }

}

package io.configurator.flags;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;

import org.apache.commons.lang3.StringUtils;
import org.docopt.Docopt;
import org.docopt.DocoptExitException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named command-line flags bound to configuration fields.
 *
 * <p> Registration is first-wins. Parsing generates a docopt usage document from the registered flags, e.g.:
 * <pre>
 * Usage:
 *   app [options] [--] [&lt;args&gt;...]
 *
 * Options:
 *   --env-bar=&lt;int&gt;     (default: 1234)
 *   --env-baz           (default: true)
 *   --env-foo=&lt;string&gt;  (default: foo)
 *   -h --help           show this screen.
 * </pre>
 * Boolean flags also accept an explicit value ({@code --env-baz=false}), long flags may be given with a single dash
 * ({@code -env-foo=x}). Everything following the first positional argument or {@code --} is positional. Flag names
 * must match exactly, unknown flags are reported while all other flags are still applied.
 */
public class FlagRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlagRegistry.class);
    private static final String DEFAULT_PROGRAM_NAME = "program";
    private static final String ARGUMENTS_KEY = "<args>";
    private static final String END_OF_OPTIONS = "--";
    private static final String HELP_SHORT = "-h";
    private static final String HELP_LONG = "--help";
    private final Map<String, Flag> flags = new ConcurrentSkipListMap<>();
    private volatile List<String> args = Collections.emptyList();
    private String programName = normaliseProgramName(System.getProperty("sun.java.command"));
    private FlagErrorPolicy errorPolicy = FlagErrorPolicy.CONTINUE;

    /**
     * @param flag the flag to add
     * @return {@code true} if the flag was added, {@code false} if a flag of the same name is already registered
     */
    public boolean register(@NotNull final Flag flag) {
        return flags.putIfAbsent(flag.getName(), flag) == null;
    }

    /**
     * @param name flag name without leading dashes
     * @return the registered flag or {@code null}
     */
    public Flag lookup(final String name) {
        return name == null ? null : flags.get(name);
    }

    /**
     * @return positional arguments of the last successful {@link #parse(String...)}
     */
    public List<String> getArgs() {
        return args;
    }

    public FlagErrorPolicy getErrorPolicy() {
        return errorPolicy;
    }

    /**
     * @return all flags sorted by name
     */
    public Map<String, Flag> getFlags() {
        return Collections.unmodifiableMap(flags);
    }

    public String getProgramName() {
        return programName;
    }

    /**
     * @return the help text: program name, one line per flag with its default value and the help option
     */
    public String getUsage() {
        return createDocument(programName, true);
    }

    /**
     * Parses the command line and assigns the given values to the bound fields.
     *
     * @param arguments command-line arguments, without the program name
     * @return {@code true} if all arguments were understood and all values assigned
     * @throws IllegalArgumentException on failure or {@code --help} if the error policy is {@link FlagErrorPolicy#THROW}
     */
    public boolean parse(@NotNull final String... arguments) {
        final List<String> docoptArgs = new ArrayList<>(arguments.length);
        final Map<Flag, String> explicitSwitches = new LinkedHashMap<>();
        final List<String> unknownArgs = new ArrayList<>();
        boolean helpRequested = false;
        boolean optionsEnded = false;
        boolean valueExpected = false;
        for (final String argument : arguments) {
            if (optionsEnded || valueExpected) {
                docoptArgs.add(argument);
                valueExpected = false;
                continue;
            }
            if (END_OF_OPTIONS.equals(argument) || !StringUtils.startsWith(argument, "-") || "-".equals(argument)) {
                optionsEnded = true;
                docoptArgs.add(argument);
                continue;
            }
            final String option = normaliseOption(argument);
            final boolean help = HELP_SHORT.equals(option) || HELP_LONG.equals(option);
            helpRequested |= help;
            final int assignment = option.indexOf('=');
            final Flag flag = option.startsWith(END_OF_OPTIONS) ? flags.get(option.substring(2, assignment < 0 ? option.length() : assignment)) : null;
            if (flag == null && !help) {
                // only exact flag names, the remaining arguments are still applied
                unknownArgs.add(argument);
                continue;
            }
            if (flag != null && flag.isBoolean() && assignment > 0) {
                explicitSwitches.put(flag, option.substring(assignment + 1));
                continue;
            }
            valueExpected = flag != null && !flag.isBoolean() && assignment < 0;
            docoptArgs.add(option);
        }

        final Map<String, Object> options;
        try {
            options = new Docopt(createDocument(DEFAULT_PROGRAM_NAME, false)).withHelp(true).withExit(false).withOptionsFirst(true).parse(docoptArgs);
        } catch (DocoptExitException e) {
            args = Collections.emptyList();
            if (helpRequested) {
                return fail(getUsage(), true, e);
            }
            return fail("could not parse command line arguments: " + Arrays.toString(arguments), false, e);
        }

        boolean success = true;
        for (final Flag flag : flags.values()) {
            final Object value = options.get(END_OF_OPTIONS + flag.getName());
            if (flag.isBoolean()) {
                if (Boolean.TRUE.equals(value)) {
                    success &= assign(flag, Boolean.TRUE.toString());
                }
            } else if (value != null) {
                success &= assign(flag, value.toString());
            }
        }
        for (final Map.Entry<Flag, String> entry : explicitSwitches.entrySet()) {
            success &= assign(entry.getKey(), entry.getValue());
        }

        final Object positional = options.get(ARGUMENTS_KEY);
        final List<String> parsedArgs = new ArrayList<>();
        if (positional instanceof List) {
            ((List<?>) positional).forEach(arg -> parsedArgs.add(String.valueOf(arg)));
        }
        args = Collections.unmodifiableList(parsedArgs);

        if (!unknownArgs.isEmpty()) {
            success &= fail("could not parse command line arguments: " + unknownArgs, false, null);
        }
        return success;
    }

    public void setErrorPolicy(@NotNull final FlagErrorPolicy errorPolicy) {
        this.errorPolicy = Objects.requireNonNull(errorPolicy, "errorPolicy must not be null");
    }

    /**
     * @param programName name shown in the usage, only the first whitespace-separated token is used
     */
    public void setProgramName(final String programName) {
        this.programName = normaliseProgramName(programName);
    }

    @Override
    public String toString() {
        return "FlagRegistry{" + flags.keySet() + '}';
    }

    private boolean assign(final Flag flag, final String value) {
        try {
            flag.set(value);
            LOGGER.atDebug().addArgument(flag.getField().getFieldNameRelative()).addArgument(flag.getName()).log("set '{}' from flag --{}");
            return true;
        } catch (IllegalArgumentException e) {
            return fail("invalid value '" + value + "' for flag --" + flag.getName() + ": " + e.getMessage(), false, e);
        }
    }

    private boolean fail(final String message, final boolean help, final Throwable cause) {
        switch (errorPolicy) {
        case THROW:
            throw new IllegalArgumentException(message, cause);
        case EXIT:
            if (help) {
                System.out.println(message); // NOPMD - usage output requested by the user
                System.exit(0); // NOPMD
            } else {
                System.err.println(message); // NOPMD
                System.err.println(getUsage()); // NOPMD
                System.exit(2); // NOPMD
            }
            return false;
        case CONTINUE:
        default:
            if (help) {
                LOGGER.atInfo().addArgument(message).log("requested help:\n{}");
            } else {
                LOGGER.atWarn().setCause(cause).addArgument(message).log("{}");
            }
            return false;
        }
    }

    /**
     * @param name program name shown in the first usage line
     * @param withDefaults {@code false} for the document handed to docopt: default values are arbitrary text that
     *        docopt would otherwise interpret (e.g. {@code usage:} sections or {@code [default: x]} annotations)
     */
    private String createDocument(final String name, final boolean withDefaults) {
        final StringBuilder builder = new StringBuilder(1000);
        builder.append("Usage:\n  ").append(name).append(" [options] [--] [").append(ARGUMENTS_KEY).append("...]\n\nOptions:\n");

        final List<String[]> descriptionItems = new ArrayList<>(flags.size() + 1);
        for (final Flag flag : flags.values()) {
            final String defaultValue = StringUtils.replaceChars(flag.getDefaultValue(), "\r\n", "  ");
            descriptionItems.add(new String[] { flag.getOptionPattern(), withDefaults && !defaultValue.isEmpty() ? "(default: " + defaultValue + ')' : "" });
        }
        descriptionItems.add(new String[] { HELP_SHORT + ' ' + HELP_LONG, "show this screen." });

        final int longestArg = descriptionItems.stream().mapToInt(s -> s[0].length()).max().orElse(0) + 2;
        for (final String[] line : descriptionItems) {
            if (line[1].isEmpty()) {
                builder.append("  ").append(line[0]).append('\n');
            } else {
                builder.append(String.format("  %-" + longestArg + "s %s", line[0], line[1])).append('\n');
            }
        }
        return builder.toString();
    }

    private String normaliseOption(final String argument) {
        if (argument.startsWith(END_OF_OPTIONS)) {
            return argument;
        }
        final int assignment = argument.indexOf('=');
        final String name = argument.substring(1, assignment < 0 ? argument.length() : assignment);
        if (flags.containsKey(name) || "help".equals(name)) {
            return '-' + argument;
        }
        return argument;
    }

    private static String normaliseProgramName(final String command) {
        final String[] tokens = StringUtils.split(command);
        return tokens == null || tokens.length == 0 ? DEFAULT_PROGRAM_NAME : tokens[0];
    }
}

package org.jellyfinmanager.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps the short command line flags ({@code --server}, {@code --apikey}, ...) to their
 * {@code app.*} properties. Flags take one or two dashes, and a value either after {@code =} or as the
 * next argument ({@code -server http://host:8096}). Unknown arguments pass through unchanged.
 */
public final class CommandLineAliases {

    private static final Map<String, String> ALIASES = Map.of(
            "server", "app.jellyfin.server-url",
            "apikey", "app.jellyfin.api-key",
            "user", "app.jellyfin.user-name",
            "tvdb-apikey", "app.tvdb.api-key",
            "file", "app.backup-file",
            "include-specials", "app.include-specials");

    private static final Set<String> BOOLEAN_ALIASES = Set.of("include-specials");

    private CommandLineAliases() {
    }

    public static String[] expand(String[] args) {
        List<String> expanded = new ArrayList<>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = optionName(arg);
            if (name != null && ALIASES.containsKey(name) && !arg.contains("=")
                    && !BOOLEAN_ALIASES.contains(name) && i + 1 < args.length) {
                expanded.add(toProperty(name, args[++i]));
            } else {
                expanded.add(expand(arg));
            }
        }
        return expanded.toArray(String[]::new);
    }

    static String expand(String arg) {
        String name = optionName(arg);
        if (name == null) {
            return arg;
        }
        if (!ALIASES.containsKey(name)) {
            return arg.startsWith("--") ? arg : "-" + arg;
        }
        String option = stripDashes(arg);
        int separator = option.indexOf('=');
        return toProperty(name, separator < 0 ? "true" : option.substring(separator + 1));
    }

    private static String optionName(String arg) {
        if (!arg.startsWith("-") || arg.equals("-") || arg.equals("--")) {
            return null;
        }
        String option = stripDashes(arg);
        int separator = option.indexOf('=');
        return separator < 0 ? option : option.substring(0, separator);
    }

    private static String stripDashes(String arg) {
        return arg.startsWith("--") ? arg.substring(2) : arg.substring(1);
    }

    private static String toProperty(String name, String value) {
        return "--" + ALIASES.get(name) + "=" + value;
    }
}

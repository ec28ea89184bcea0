package io.dbmaint.dump;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Dump utility invocation for one table.
 *
 * <p>The argument list embeds the password ({@code -p<password>}); only {@link #masked()} may be
 * logged or put into messages.
 */
public final class DumpCommand {
    public static final String PASSWORD_PLACEHOLDER = "******";

    private final List<String> arguments;
    private final String maskedLine;

    private DumpCommand(List<String> arguments, String maskedLine) {
        this.arguments = arguments;
        this.maskedLine = maskedLine;
    }

    /**
     * Builds {@code [dumpExecutable, -h host, -u user, -p<password>, database, table]}.
     *
     * @param destination compressed output file, used only for the masked rendering
     */
    public static DumpCommand of(ConnectionParams params, String database, String table, Path destination) {
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(database, "database");
        Objects.requireNonNull(table, "table");
        List<String> arguments = List.of(
                params.dumpExecutable(),
                "-h", params.host(),
                "-u", params.user(),
                "-p" + params.password(),
                database,
                table);
        String masked = String.join(" ",
                params.dumpExecutable(),
                "-h", params.host(),
                "-u", params.user(),
                "-p" + PASSWORD_PLACEHOLDER,
                database,
                table)
                + " | gzip > " + destination;
        return new DumpCommand(arguments, masked);
    }

    /** Arguments for the subprocess. Contains the credential; never log. */
    public List<String> arguments() {
        return arguments;
    }

    /** Loggable rendering with the credential replaced by {@link #PASSWORD_PLACEHOLDER}. */
    public String masked() {
        return maskedLine;
    }

    @Override
    public String toString() {
        return maskedLine;
    }
}

package io.dbmaint.dump;

import java.util.Objects;

/**
 * Credentials and location handed to the external dump utility.
 *
 * <p>{@link #toString()} never includes the password.
 *
 * @param host           database host
 * @param port           database port
 * @param user           user name
 * @param password       password; may be empty but not null
 * @param dumpExecutable dump utility path or name resolved via {@code PATH}
 */
public record ConnectionParams(String host, int port, String user, String password, String dumpExecutable) {

    public static final int DEFAULT_PORT = 3306;
    public static final String DEFAULT_DUMP_EXECUTABLE = "mysqldump";

    public ConnectionParams {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(user, "user");
        password = password != null ? password : "";
        dumpExecutable = dumpExecutable != null ? dumpExecutable : DEFAULT_DUMP_EXECUTABLE;
    }

    @Override
    public String toString() {
        return "ConnectionParams[host=" + host + ", port=" + port + ", user=" + user
                + ", password=" + DumpCommand.PASSWORD_PLACEHOLDER + ", dumpExecutable=" + dumpExecutable + "]";
    }
}

package io.dbmaint.dump;

import java.io.IOException;
import java.util.List;

/**
 * Starts the dump utility. The returned process's standard output is the dump stream.
 */
@FunctionalInterface
public interface ProcessLauncher {

    /**
     * Default launcher: standard error is inherited so utility diagnostics reach the console.
     */
    ProcessLauncher SYSTEM = command -> new ProcessBuilder(command)
            .redirectError(ProcessBuilder.Redirect.INHERIT)
            .start();

    Process start(List<String> command) throws IOException;
}

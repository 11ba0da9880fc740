package org.example.pkgdep.provider;

import org.example.pkgdep.exception.ProviderUnavailableException;

import java.time.Duration;
import java.util.List;

/**
 * Runs an external command and captures its standard output.
 */
public interface CommandRunner {

    /**
     * Runs the command to completion.
     *
     * @param command the executable followed by its arguments
     * @param timeout hard limit; the process is killed when exceeded
     * @return the output of a command that exited with status 0
     * @throws ProviderUnavailableException if the executable is missing, times out,
     *                                      exits with a non-zero status or cannot be run
     */
    CommandOutput run(List<String> command, Duration timeout) throws ProviderUnavailableException;
}

package org.example.pkgdep.provider;

/**
 * Captured result of a finished external command.
 */
public class CommandOutput {

    private final int exitCode;
    private final String stdout;

    public CommandOutput(int exitCode, String stdout) {
        this.exitCode = exitCode;
        this.stdout = stdout != null ? stdout : "";
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStdout() {
        return stdout;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}

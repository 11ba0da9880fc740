package org.example.pkgdep.provider;

import org.example.pkgdep.exception.ProviderUnavailableException;
import org.example.pkgdep.exception.ProviderUnavailableException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 * Standard error is discarded; standard output is read as UTF-8 on a separate reader thread.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private static final ExecutorService OUTPUT_READERS = Executors.newCachedThreadPool(new ReaderThreadFactory());

    private final Executor outputReader;

    public ProcessCommandRunner() {
        this(OUTPUT_READERS);
    }

    /**
     * @param outputReader runs the blocking reads of each process's standard output
     */
    public ProcessCommandRunner(Executor outputReader) {
        this.outputReader = Objects.requireNonNull(outputReader, "outputReader cannot be null");
    }

    @Override
    public CommandOutput run(List<String> command, Duration timeout) throws ProviderUnavailableException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command cannot be null or empty");
        }
        String description = String.join(" ", command);
        log.debug("Running: {} (timeout {}ms)", description, timeout.toMillis());

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectError(ProcessBuilder.Redirect.DISCARD);

        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException e) {
            throw new ProviderUnavailableException(Reason.NOT_FOUND,
                    "Cannot start '" + command.get(0) + "': " + e.getMessage(), e);
        }

        // Drain stdout while waiting for exit
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(
                () -> readFully(process.getInputStream()), outputReader);

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ProviderUnavailableException(Reason.TIMEOUT,
                        "'" + description + "' timed out after " + timeout.toMillis() + "ms");
            }

            String output = stdout.join();
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new ProviderUnavailableException(Reason.NON_ZERO_EXIT,
                        "'" + description + "' exited with code " + exitCode);
            }
            return new CommandOutput(exitCode, output);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ProviderUnavailableException(Reason.EXECUTION_ERROR,
                    "Interrupted while waiting for '" + description + "'", e);
        } catch (CompletionException e) {
            throw new ProviderUnavailableException(Reason.EXECUTION_ERROR,
                    "Failed to read output of '" + description + "': " + e.getCause().getMessage(), e.getCause());
        }
    }

    private static String readFully(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static class ReaderThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pkgdep-stdout-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

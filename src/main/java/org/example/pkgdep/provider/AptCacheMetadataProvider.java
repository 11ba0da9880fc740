package org.example.pkgdep.provider;

import org.example.pkgdep.exception.ProviderUnavailableException;
import org.example.pkgdep.model.PackageName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Reads package relationships from {@code apt-cache}.
 *
 * <p>Each lookup is one subprocess call. There are no retries and no caching:
 * a failed call is reported as a failed {@link LookupResult} and is final.</p>
 */
public class AptCacheMetadataProvider implements PackageMetadataProvider {

    private static final Logger log = LoggerFactory.getLogger(AptCacheMetadataProvider.class);

    public static final String DEFAULT_EXECUTABLE = "apt-cache";

    private final String executable;
    private final CommandRunner commandRunner;
    private final AptCacheOutputParser parser;

    public AptCacheMetadataProvider() {
        this(DEFAULT_EXECUTABLE, new ProcessCommandRunner());
    }

    public AptCacheMetadataProvider(String executable, CommandRunner commandRunner) {
        this(executable, commandRunner, new AptCacheOutputParser());
    }

    public AptCacheMetadataProvider(String executable, CommandRunner commandRunner, AptCacheOutputParser parser) {
        this.executable = Objects.requireNonNull(executable, "executable cannot be null");
        this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner cannot be null");
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
    }

    @Override
    public LookupResult getDirectDependencies(PackageName packageName, Duration timeout) {
        try {
            CommandOutput output = commandRunner.run(
                    List.of(executable, "depends", packageName.getValue()), timeout);
            List<PackageName> dependencies = parser.parseDepends(output.getStdout());
            log.debug("{} has {} direct dependencies", packageName, dependencies.size());
            return LookupResult.found(packageName, dependencies);
        } catch (ProviderUnavailableException e) {
            log.warn("Dependency lookup for {} failed ({}): {}", packageName, e.getReason(), e.getMessage());
            return LookupResult.failed(packageName, e.getMessage());
        }
    }

    @Override
    public LookupResult getReverseDependencies(PackageName packageName, Duration timeout) {
        try {
            CommandOutput output = commandRunner.run(
                    List.of(executable, "rdepends", packageName.getValue()), timeout);
            List<PackageName> dependents = parser.parseReverseDepends(output.getStdout());
            log.debug("{} has {} reverse dependencies", packageName, dependents.size());
            return LookupResult.found(packageName, dependents);
        } catch (ProviderUnavailableException e) {
            log.warn("Reverse dependency lookup for {} failed ({}): {}", packageName, e.getReason(), e.getMessage());
            return LookupResult.failed(packageName, e.getMessage());
        }
    }

    public String getExecutable() {
        return executable;
    }
}

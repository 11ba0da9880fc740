package org.example.pkgdep.provider;

import org.example.pkgdep.exception.ProviderUnavailableException;
import org.example.pkgdep.exception.ProviderUnavailableException.Reason;
import org.example.pkgdep.model.PackageName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AptCacheMetadataProvider.
 */
@ExtendWith(MockitoExtension.class)
class AptCacheMetadataProviderTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final PackageName BASH = PackageName.of("bash");

    @Mock
    private CommandRunner commandRunner;

    private AptCacheMetadataProvider provider;

    @BeforeEach
    void setUp() {
        provider = new AptCacheMetadataProvider("apt-cache", commandRunner);
    }

    @Test
    @DisplayName("should run depends and parse dependencies")
    void shouldRunDependsAndParse() throws ProviderUnavailableException {
        when(commandRunner.run(List.of("apt-cache", "depends", "bash"), TIMEOUT))
                .thenReturn(new CommandOutput(0, "bash\n  PreDepends: libc6\n  Depends: <awk>\n"));

        LookupResult result = provider.getDirectDependencies(BASH, TIMEOUT);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPackages()).containsExactly(PackageName.of("libc6"), PackageName.of("awk"));
    }

    @Test
    @DisplayName("should run rdepends and parse dependents")
    void shouldRunRdependsAndParse() throws ProviderUnavailableException {
        when(commandRunner.run(List.of("apt-cache", "rdepends", "bash"), TIMEOUT))
                .thenReturn(new CommandOutput(0, "bash\nReverse Depends:\n  bash-completion\n |command-not-found\n"));

        LookupResult result = provider.getReverseDependencies(BASH, TIMEOUT);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPackages()).containsExactly(PackageName.of("bash-completion"));
    }

    @Test
    @DisplayName("should distinguish empty result from failure")
    void shouldDistinguishEmptyFromFailure() throws ProviderUnavailableException {
        when(commandRunner.run(anyList(), eq(TIMEOUT))).thenReturn(new CommandOutput(0, "bash\n"));

        LookupResult result = provider.getDirectDependencies(BASH, TIMEOUT);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPackages()).isEmpty();
        assertThat(result.getErrorMessage()).isNull();
    }

    @Test
    @DisplayName("should report missing executable as failed lookup")
    void shouldReportMissingExecutable() throws ProviderUnavailableException {
        when(commandRunner.run(anyList(), eq(TIMEOUT)))
                .thenThrow(new ProviderUnavailableException(Reason.NOT_FOUND, "Cannot start 'apt-cache'"));

        LookupResult result = provider.getDirectDependencies(BASH, TIMEOUT);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getPackages()).isEmpty();
        assertThat(result.getErrorMessage()).contains("Cannot start");
    }

    @Test
    @DisplayName("should report timeout as failed reverse lookup")
    void shouldReportTimeout() throws ProviderUnavailableException {
        when(commandRunner.run(anyList(), eq(TIMEOUT)))
                .thenThrow(new ProviderUnavailableException(Reason.TIMEOUT, "timed out after 10000ms"));

        LookupResult result = provider.getReverseDependencies(BASH, TIMEOUT);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("timed out");
    }

    @Test
    @DisplayName("should make exactly one call per lookup without retries")
    void shouldNotRetry() throws ProviderUnavailableException {
        when(commandRunner.run(anyList(), eq(TIMEOUT)))
                .thenThrow(new ProviderUnavailableException(Reason.NON_ZERO_EXIT, "exited with code 100"));

        provider.getDirectDependencies(BASH, TIMEOUT);

        verify(commandRunner, times(1)).run(anyList(), eq(TIMEOUT));
    }

    @Test
    @DisplayName("should use configured executable")
    void shouldUseConfiguredExecutable() throws ProviderUnavailableException {
        AptCacheMetadataProvider custom = new AptCacheMetadataProvider("/usr/local/bin/apt-cache", commandRunner);
        when(commandRunner.run(anyList(), eq(TIMEOUT))).thenReturn(new CommandOutput(0, ""));

        custom.getDirectDependencies(BASH, TIMEOUT);

        verify(commandRunner).run(List.of("/usr/local/bin/apt-cache", "depends", "bash"), TIMEOUT);
    }
}

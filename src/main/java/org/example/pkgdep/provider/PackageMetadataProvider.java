package org.example.pkgdep.provider;

import org.example.pkgdep.model.PackageName;

import java.time.Duration;

/**
 * Source of package relationship data.
 * Implementations never throw for provider failures; they report them as failed lookups.
 */
public interface PackageMetadataProvider {

    /**
     * Looks up the direct dependencies of a package.
     *
     * @param packageName the package to look up
     * @param timeout     hard limit for the lookup
     * @return the dependencies in provider order, or a failed result
     */
    LookupResult getDirectDependencies(PackageName packageName, Duration timeout);

    /**
     * Looks up the packages that declare a dependency on a package.
     *
     * @param packageName the package to look up
     * @param timeout     hard limit for the lookup
     * @return the dependents verbatim from the provider, or a failed result
     */
    LookupResult getReverseDependencies(PackageName packageName, Duration timeout);
}

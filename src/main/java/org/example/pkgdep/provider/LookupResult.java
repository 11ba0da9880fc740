package org.example.pkgdep.provider;

import org.example.pkgdep.model.PackageName;

import java.util.List;
import java.util.Objects;

/**
 * Result of a single provider lookup.
 *
 * <p>A successful lookup carries a (possibly empty) list of package names.
 * A failed lookup carries the reason instead, so "no dependencies" stays
 * distinguishable from "the provider could not answer".</p>
 */
public class LookupResult {

    private final PackageName packageName;
    private final List<PackageName> packages;
    private final boolean success;
    private final String errorMessage;

    private LookupResult(PackageName packageName, List<PackageName> packages,
                         boolean success, String errorMessage) {
        this.packageName = Objects.requireNonNull(packageName, "packageName cannot be null");
        this.packages = packages;
        this.success = success;
        this.errorMessage = errorMessage;
    }

    public static LookupResult found(PackageName packageName, List<PackageName> packages) {
        return new LookupResult(packageName, List.copyOf(packages), true, null);
    }

    public static LookupResult failed(PackageName packageName, String errorMessage) {
        return new LookupResult(packageName, List.of(), false,
                errorMessage != null ? errorMessage : "lookup failed");
    }

    public PackageName getPackageName() {
        return packageName;
    }

    /**
     * Returns the packages reported by the provider, empty when the lookup failed.
     */
    public List<PackageName> getPackages() {
        return packages;
    }

    public int size() {
        return packages.size();
    }

    public boolean isSuccess() {
        return success;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        if (success) {
            return String.format("LookupResult{package=%s, success=true, packages=%s}", packageName, packages);
        } else {
            return String.format("LookupResult{package=%s, success=false, error='%s'}", packageName, errorMessage);
        }
    }
}

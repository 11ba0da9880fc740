package org.example.pkgdep.provider;

import org.example.pkgdep.model.PackageName;

import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * In-memory provider for tests. Packages without a script have no dependencies;
 * packages marked as failing report a failed lookup. Every call is recorded.
 */
public class ScriptedMetadataProvider implements PackageMetadataProvider {

    private final Map<PackageName, List<PackageName>> dependencies = new HashMap<>();
    private final Map<PackageName, List<PackageName>> dependents = new HashMap<>();
    private final Set<PackageName> failing = new HashSet<>();
    private final List<PackageName> dependencyCalls = Collections.synchronizedList(new ArrayList<>());
    private final List<PackageName> reverseCalls = Collections.synchronizedList(new ArrayList<>());

    public ScriptedMetadataProvider depends(String packageName, String... deps) {
        dependencies.put(PackageName.of(packageName), names(deps));
        return this;
    }

    public ScriptedMetadataProvider dependents(String packageName, String... names) {
        dependents.put(PackageName.of(packageName), names(names));
        return this;
    }

    public ScriptedMetadataProvider failing(String packageName) {
        failing.add(PackageName.of(packageName));
        return this;
    }

    @Override
    public LookupResult getDirectDependencies(PackageName packageName, Duration timeout) {
        dependencyCalls.add(packageName);
        if (failing.contains(packageName)) {
            return LookupResult.failed(packageName, "scripted failure for " + packageName);
        }
        return LookupResult.found(packageName, dependencies.getOrDefault(packageName, List.of()));
    }

    @Override
    public LookupResult getReverseDependencies(PackageName packageName, Duration timeout) {
        reverseCalls.add(packageName);
        if (failing.contains(packageName)) {
            return LookupResult.failed(packageName, "scripted failure for " + packageName);
        }
        return LookupResult.found(packageName, dependents.getOrDefault(packageName, List.of()));
    }

    public List<String> getDependencyCalls() {
        synchronized (dependencyCalls) {
            return dependencyCalls.stream().map(PackageName::getValue).collect(Collectors.toList());
        }
    }

    public List<String> getReverseCalls() {
        synchronized (reverseCalls) {
            return reverseCalls.stream().map(PackageName::getValue).collect(Collectors.toList());
        }
    }

    public int getTotalCalls() {
        return dependencyCalls.size() + reverseCalls.size();
    }

    private static List<PackageName> names(String... values) {
        return Arrays.stream(values).map(PackageName::of).collect(Collectors.toList());
    }
}

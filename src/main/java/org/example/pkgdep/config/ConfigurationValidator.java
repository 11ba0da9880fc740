package org.example.pkgdep.config;

import org.example.pkgdep.exception.ConfigurationException;
import org.example.pkgdep.query.QueryType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validates plugin configuration parameters.
 */
public class ConfigurationValidator {

    /**
     * Characters allowed in a Debian package name pattern, plus the {@code *} and {@code ?} wildcards.
     */
    private static final Pattern FILTER_PATTERN = Pattern.compile("^[a-zA-Z0-9.+*?_:-]+$");

    private static final String VALID_QUERIES = Arrays.stream(QueryType.values())
            .map(QueryType::getId)
            .collect(Collectors.joining(", "));

    /**
     * Validates the plugin configuration.
     *
     * @param config the configuration to validate
     * @return list of validation errors (empty if valid)
     */
    public List<String> validate(PluginConfiguration config) {
        List<String> errors = new ArrayList<>();

        validateRequired(config, errors);
        validateValues(config, errors);

        return errors;
    }

    /**
     * Validates configuration and throws exception if invalid.
     *
     * @param config the configuration to validate
     * @throws ConfigurationException if validation fails
     */
    public void validateOrThrow(PluginConfiguration config) throws ConfigurationException {
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Invalid plugin configuration:\n- " + String.join("\n- ", errors),
                    errors
            );
        }
    }

    private void validateRequired(PluginConfiguration config, List<String> errors) {
        if (isBlank(config.getPackageName())) {
            errors.add("packageName is required");
        }

        if (isBlank(config.getQuery())) {
            errors.add("query is required");
        }

        if (isBlank(config.getProviderExecutable())) {
            errors.add("providerExecutable is required");
        }
    }

    private void validateValues(PluginConfiguration config, List<String> errors) {
        if (!isBlank(config.getQuery()) && QueryType.fromId(config.getQuery()).isEmpty()) {
            errors.add("query must be one of: " + VALID_QUERIES + ", but was: " + config.getQuery());
        }

        if (config.getTimeoutSeconds() < 1) {
            errors.add("timeoutSeconds must be >= 1, but was: " + config.getTimeoutSeconds());
        }

        if (config.getBreadthCap() < 1) {
            errors.add("breadthCap must be >= 1, but was: " + config.getBreadthCap());
        }

        if (config.getMaxDepth() < -1) {
            errors.add("maxDepth must be -1 (unlimited) or >= 0, but was: " + config.getMaxDepth());
        }

        if (config.getMaxDisplayedCycles() < 1) {
            errors.add("maxDisplayedCycles must be >= 1, but was: " + config.getMaxDisplayedCycles());
        }

        if (config.getOutputFile() != null && config.getOutputFile().isDirectory()) {
            errors.add("outputFile must be a file, but is a directory: " + config.getOutputFile());
        }

        validateFilters(config.getIncludeFilters(), "includeFilters", errors);
        validateFilters(config.getExcludeFilters(), "excludeFilters", errors);
    }

    private void validateFilters(List<String> filters, String filterName, List<String> errors) {
        if (filters == null) return;

        for (String filter : filters) {
            if (isBlank(filter)) {
                errors.add(filterName + " contains empty filter");
            } else if (!FILTER_PATTERN.matcher(filter.trim()).matches()) {
                errors.add(filterName + " contains invalid pattern: " + filter +
                           ". Must be a package name with optional * or ? wildcards");
            }
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}

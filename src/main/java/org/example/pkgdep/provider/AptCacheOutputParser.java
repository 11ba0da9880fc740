package org.example.pkgdep.provider;

import org.example.pkgdep.model.PackageName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the text output of {@code apt-cache depends} and {@code apt-cache rdepends}.
 *
 * <p>Lines that do not fit the expected format are skipped one at a time;
 * a malformed line never aborts the whole parse.</p>
 */
public class AptCacheOutputParser {

    private static final Logger log = LoggerFactory.getLogger(AptCacheOutputParser.class);

    private static final String DEPENDS_MARKER = "Depends:";
    private static final String PRE_DEPENDS_MARKER = "PreDepends:";

    /**
     * Header lines printed by {@code rdepends} before the dependents (package name, "Reverse Depends:").
     */
    private static final int REVERSE_HEADER_LINES = 2;

    private static final String TREE_PREFIX = "|";

    /**
     * Extracts direct dependencies from {@code depends} output.
     *
     * <p>Only lines starting with {@code Depends:} or {@code PreDepends:} count.
     * The first whitespace-delimited token after the colon is the package name,
     * with virtual-package brackets removed.</p>
     *
     * @param output raw standard output
     * @return dependencies in output order, duplicates kept
     */
    public List<PackageName> parseDepends(String output) {
        List<PackageName> dependencies = new ArrayList<>();
        if (output == null) {
            return dependencies;
        }

        for (String rawLine : output.split("\\R")) {
            String line = rawLine.trim();
            if (!line.startsWith(DEPENDS_MARKER) && !line.startsWith(PRE_DEPENDS_MARKER)) {
                continue;
            }

            String rest = line.substring(line.indexOf(':') + 1).trim();
            if (rest.isEmpty()) {
                log.debug("Skipping dependency line without a package: '{}'", line);
                continue;
            }

            String token = rest.split("\\s+")[0];
            try {
                dependencies.add(PackageName.normalize(token));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping dependency line with unusable token '{}': '{}'", token, line);
            }
        }

        return dependencies;
    }

    /**
     * Extracts dependents from {@code rdepends} output.
     *
     * <p>The first two lines are a header. Every remaining non-empty line that does
     * not start with the {@code |} alternative marker is taken verbatim as a package name.</p>
     *
     * @param output raw standard output
     * @return dependents in output order, duplicates kept
     */
    public List<PackageName> parseReverseDepends(String output) {
        List<PackageName> dependents = new ArrayList<>();
        if (output == null) {
            return dependents;
        }

        String[] lines = output.split("\\R");
        for (int i = REVERSE_HEADER_LINES; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith(TREE_PREFIX)) {
                continue;
            }
            dependents.add(PackageName.of(line));
        }

        return dependents;
    }
}

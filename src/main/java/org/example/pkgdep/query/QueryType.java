package org.example.pkgdep.query;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The three queries the core answers.
 */
public enum QueryType {

    DEPENDENCIES("dependencies"),
    REVERSE("reverse"),
    CYCLES("cycles");

    private final String id;

    QueryType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Looks up a query type by its id, ignoring case.
     */
    public static Optional<QueryType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.id.equals(normalized))
                .findFirst();
    }
}

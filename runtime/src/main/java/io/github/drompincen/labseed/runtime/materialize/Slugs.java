package io.github.drompincen.labseed.runtime.materialize;

import java.util.Locale;

/**
 * URL path segments derived from group and project names.
 */
public final class Slugs {

    private Slugs() {}

    public static String of(String name) {
        String slug = slugify(name);
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive a path from name '" + name + "'");
        }
        return slug;
    }

    /** Whether {@link #of(String)} yields a path for this name. */
    public static boolean isDerivable(String name) {
        return name != null && !slugify(name).isEmpty();
    }

    private static String slugify(String name) {
        return name.strip().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_.-]+", "-")
                .replaceAll("-{2,}", "-")
                .replaceAll("^[-.]+|[-.]+$", "");
    }
}

package com.yoursp.oauthconnect.modules.tenant;

import java.text.Normalizer;
import java.util.Locale;

final class TenantSlugs {

    static final int MAX_LENGTH = 90;
    private static final String FALLBACK = "team";

    private TenantSlugs() {
    }

    /** Lower-case ASCII, runs of anything else collapsed to a single dash. */
    static String slugify(String name) {
        if (name == null) {
            return FALLBACK;
        }
        String ascii = Normalizer.normalize(name, Normalizer.Form.NFKD).replaceAll("\\p{M}", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > MAX_LENGTH) {
            slug = slug.substring(0, MAX_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? FALLBACK : slug;
    }
}

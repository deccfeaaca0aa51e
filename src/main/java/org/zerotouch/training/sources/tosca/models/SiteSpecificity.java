package org.zerotouch.training.sources.tosca.models;

import java.util.Locale;

/**
 * Heuristics that flag annotations and assertions as site-specific.
 * These are plain substring matches; a step can deviate from the enterprise default
 * without tripping either rule.
 */
public final class SiteSpecificity {

    private SiteSpecificity() {
    }

    /**
     * An annotation is site-specific when its type contains "SPECIFIC", ignoring case.
     */
    public static boolean isSiteSpecificAnnotation(Annotation annotation) {
        return annotation.type() != null && annotation.type().toUpperCase(Locale.ROOT).contains("SPECIFIC");
    }

    /**
     * An assertion reason is site-specific when it mentions "site" or the site's name, ignoring case.
     *
     * @param reason   the assertion reason, may be empty
     * @param siteName the script's site name; an empty name is never matched on its own
     */
    public static boolean isSiteSpecificReason(String reason, String siteName) {
        if (reason == null || reason.isEmpty()) {
            return false;
        }
        String lowered = reason.toLowerCase(Locale.ROOT);
        if (lowered.contains("site")) {
            return true;
        }
        return siteName != null && !siteName.isBlank() && lowered.contains(siteName.toLowerCase(Locale.ROOT));
    }
}

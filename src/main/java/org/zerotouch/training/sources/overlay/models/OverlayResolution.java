package org.zerotouch.training.sources.overlay.models;

import java.util.List;

/**
 * The site lens handed to content generators: site metadata plus every overlay rule in normalized form.
 */
public record OverlayResolution(SiteInfo site, List<ResolvedOverlay> overlays) {
    public OverlayResolution {
        site = site == null ? new SiteInfo() : site;
        overlays = overlays == null ? List.of() : List.copyOf(overlays);
    }

    public static OverlayResolution empty() {
        return new OverlayResolution(new SiteInfo(), List.of());
    }
}

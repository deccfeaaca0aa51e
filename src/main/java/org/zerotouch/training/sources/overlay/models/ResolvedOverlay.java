package org.zerotouch.training.sources.overlay.models;

import java.util.List;

public record ResolvedOverlay(String process, String transaction, List<Variation> variations) {
    public ResolvedOverlay {
        variations = variations == null ? List.of() : List.copyOf(variations);
    }
}

package org.zerotouch.training.sources.overlay.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * An overlay rule as written in the overlay file: the variations a site applies to one transaction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawOverlayRule {
    public String process;

    /**
     * Transaction code the rule applies to, e.g. "MIGO". Matched exactly.
     */
    public String transaction;

    public List<Variation> variations;

    public RawOverlayRule copy() {
        RawOverlayRule copy = new RawOverlayRule();
        copy.process = process;
        copy.transaction = transaction;
        if (variations != null) {
            copy.variations = new ArrayList<>(variations.size());
            for (Variation variation : variations) {
                copy.variations.add(variation == null ? null : variation.copy());
            }
        }
        return copy;
    }
}

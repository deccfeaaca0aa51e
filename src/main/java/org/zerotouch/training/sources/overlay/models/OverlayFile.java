package org.zerotouch.training.sources.overlay.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Root structure of an overlay YAML file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OverlayFile {
    public SiteInfo site;
    public List<RawOverlayRule> overlays;
}

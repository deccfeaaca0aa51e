package org.zerotouch.training.sources.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Root structure of the pipeline configuration file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineConfig {
    /**
     * Who the training is for.
     * Example: {"company": "Acme", "site": "Anniston", "site_code": "ANN", "role": "Buyer", ...}
     */
    public Scope scope;

    /**
     * Source files per type, relative to the config file's directory unless absolute.
     */
    public Sources sources;
}

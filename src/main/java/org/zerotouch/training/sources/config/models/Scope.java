package org.zerotouch.training.sources.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Scope {
    public String company;
    public String site;

    @JsonProperty("site_code")
    public String siteCode;

    public String role;
    public String process;
}

package org.zerotouch.training.sources.overlay.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Site metadata from the {@code site} block of an overlay file. Every field is optional;
 * an empty instance serializes as {@code {}}.
 * <p>
 * Example:
 * <pre>
 * site:
 *   name: Anniston
 *   code: ANN
 *   system: S4P
 *   company: Acme Defense
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@EqualsAndHashCode
@ToString
public class SiteInfo {
    public String name;
    public String code;
    public String system;
    public String company;

    public SiteInfo copy() {
        SiteInfo copy = new SiteInfo();
        copy.name = name;
        copy.code = code;
        copy.system = system;
        copy.company = company;
        return copy;
    }
}

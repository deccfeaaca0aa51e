package org.zerotouch.training.sources.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Sources {
    /**
     * Tosca test scripts. Example: ["data/tosca/migo_goods_receipt.xml"]
     */
    public List<String> tosca;

    /**
     * BPMN process diagrams. Example: ["data/bpmn/procure_to_pay.bpmn"]
     */
    public List<String> bpmn;

    /**
     * Site overlay files. Example: ["data/overlays/anniston.yaml"]
     */
    public List<String> overlay;
}

package org.zerotouch.training.sources.tosca;

import org.w3c.dom.Element;

/**
 * The two document shapes Tosca exports come in.
 */
public enum ToscaSchema {
    /**
     * Elements qualified with {@link ToscaHelper#TOSCA_NS}.
     */
    NAMESPACED,
    /**
     * Unqualified elements with inconsistent container casing.
     */
    BARE;

    /**
     * Picks the schema from the root element alone: a namespaced root means a namespaced document.
     */
    public static ToscaSchema detect(Element root) {
        String namespace = root.getNamespaceURI();
        return namespace != null && !namespace.isEmpty() ? NAMESPACED : BARE;
    }
}

package io.mersel.services.oscal.infrastructure.extraction;

import io.mersel.services.oscal.application.interfaces.XmlNode;

final class ExtractorSupport {

    private ExtractorSupport() {
    }

    /**
     * Extractor'lar yalnızca element düğümlerini kabul eder; eksik çocuklar hata değildir.
     */
    static void requireElement(XmlNode node, String expected) {
        if (node == null || !node.isElement()) {
            throw new IllegalArgumentException(expected + " için element düğümü bekleniyordu: " + node);
        }
    }
}

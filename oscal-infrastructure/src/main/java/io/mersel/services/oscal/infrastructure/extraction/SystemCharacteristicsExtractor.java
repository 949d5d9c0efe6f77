package io.mersel.services.oscal.infrastructure.extraction;

import io.mersel.services.oscal.application.interfaces.XmlNode;
import io.mersel.services.oscal.application.models.SystemCharacteristics;
import io.mersel.services.oscal.infrastructure.tree.XmlNavigator;
import org.springframework.stereotype.Component;

/**
 * {@code system-characteristics} elementinden {@link SystemCharacteristics} üretir.
 */
@Component
public class SystemCharacteristicsExtractor {

    public SystemCharacteristics extract(XmlNode node) {
        ExtractorSupport.requireElement(node, "system-characteristics");

        return new SystemCharacteristics(
                XmlNavigator.childText(node, "system-name"),
                XmlNavigator.childText(node, "system-id"),
                XmlNavigator.childText(node, "security-sensitivity-level"));
    }
}

package io.mersel.services.oscal.infrastructure.extraction;

import io.mersel.services.oscal.application.interfaces.XmlNode;
import io.mersel.services.oscal.application.models.Parameter;
import io.mersel.services.oscal.application.models.Property;
import io.mersel.services.oscal.application.models.ResponsibleRole;
import io.mersel.services.oscal.application.models.SecurityControl;
import io.mersel.services.oscal.application.models.Statement;
import io.mersel.services.oscal.infrastructure.tree.XmlNavigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code implemented-requirement} elementinden {@link SecurityControl} üretir.
 * <p>
 * Çocuklar belge sırasıyla tek geçişte taranır:
 * <ul>
 *   <li>{@code prop} → {@link Property}</li>
 *   <li>{@code statement} → {@link Statement}</li>
 *   <li>{@code set-parameter} → {@link Parameter}</li>
 *   <li>{@code responsible-role} → {@link ResponsibleRole}</li>
 * </ul>
 * Diğer çocuklar sessizce atlanır. Çocuk eşleştirmesi verilen namespace'e göre yapılır;
 * namespace boşsa yalnızca yerel ada bakılır.
 * <p>
 * Durumsuzdur; farklı kontroller farklı thread'lerde aynı anda çıkarılabilir.
 */
@Component
public class SecurityControlExtractor {

    private static final Logger log = LoggerFactory.getLogger(SecurityControlExtractor.class);

    /**
     * @param node         {@code implemented-requirement} elementi
     * @param ordinalIndex kontrolün kardeşleri arasındaki sıfır tabanlı konumu
     * @param namespaceUri belgenin namespace'i
     * @return kontrol; {@code control-id} attribute'u yoksa boş
     * @throws IllegalArgumentException düğüm bir element değilse
     */
    public Optional<SecurityControl> extract(XmlNode node, int ordinalIndex, String namespaceUri) {
        ExtractorSupport.requireElement(node, "implemented-requirement");

        Optional<String> controlId = node.attribute("control-id");
        if (controlId.isEmpty()) {
            log.debug("control-id olmayan implemented-requirement atlandı (sıra: {})", ordinalIndex);
            return Optional.empty();
        }

        List<Property> properties = new ArrayList<>();
        List<Statement> statements = new ArrayList<>();
        List<Parameter> parameters = new ArrayList<>();
        List<ResponsibleRole> responsibleRoles = new ArrayList<>();

        for (XmlNode child : node.children()) {
            if (!child.isElement() || !inNamespace(child, namespaceUri)) {
                continue;
            }
            switch (child.localName()) {
                case "prop" -> properties.add(new Property(
                        child.attribute("name").orElse(""),
                        child.attribute("value").orElse("")));
                case "statement" -> statements.add(new Statement(
                        child.attribute("statement-id").orElse(""),
                        XmlNavigator.firstChild(child, "description", namespaceUri)
                                .map(XmlNavigator::text)
                                .orElse("")));
                case "set-parameter" -> parameters.add(new Parameter(
                        child.attribute("param-id").orElse(""),
                        XmlNavigator.firstChild(child, "value", namespaceUri)
                                .map(XmlNavigator::text)
                                .orElse("")));
                case "responsible-role" -> responsibleRoles.add(new ResponsibleRole(
                        child.attribute("role-id").orElse(""),
                        XmlNavigator.children(child, "party-uuid", namespaceUri).stream()
                                .map(XmlNavigator::text)
                                .toList()));
                default -> {
                    // tanınmayan çocuk
                }
            }
        }

        return Optional.of(new SecurityControl(
                controlId.get(),
                node.attribute("uuid").orElse(null),
                ordinalIndex,
                properties,
                statements,
                parameters,
                responsibleRoles));
    }

    private static boolean inNamespace(XmlNode node, String namespaceUri) {
        return namespaceUri == null || namespaceUri.isEmpty() || namespaceUri.equals(node.namespaceUri());
    }
}

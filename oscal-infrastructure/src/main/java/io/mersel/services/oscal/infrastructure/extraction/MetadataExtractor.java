package io.mersel.services.oscal.infrastructure.extraction;

import io.mersel.services.oscal.application.interfaces.XmlNode;
import io.mersel.services.oscal.application.models.Metadata;
import io.mersel.services.oscal.infrastructure.tree.XmlNavigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * {@code metadata} elementinden {@link Metadata} üretir.
 */
@Component
public class MetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    public Metadata extract(XmlNode node) {
        ExtractorSupport.requireElement(node, "metadata");

        return new Metadata(
                XmlNavigator.childText(node, "title"),
                XmlNavigator.childText(node, "version"),
                XmlNavigator.childText(node, "oscal-version"),
                parseTimestamp(XmlNavigator.childText(node, "last-modified")));
    }

    private static OffsetDateTime parseTimestamp(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text);
        } catch (DateTimeParseException e) {
            log.warn("last-modified değeri ayrıştırılamadı, boş bırakılıyor: '{}' ({})", text, e.getMessage());
            return null;
        }
    }
}

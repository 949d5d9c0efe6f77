package io.mersel.services.oscal.infrastructure;

import io.mersel.services.oscal.application.enums.BaselineLevel;
import io.mersel.services.oscal.application.interfaces.IBaselineClassifier;
import io.mersel.services.oscal.application.interfaces.IOscalDocumentParser;
import io.mersel.services.oscal.application.interfaces.OscalParseException;
import io.mersel.services.oscal.application.interfaces.XmlNode;
import io.mersel.services.oscal.infrastructure.diagnostics.OscalMetrics;
import io.mersel.services.oscal.infrastructure.tree.XmlNavigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * {@code security-sensitivity-level} tabanlı baseline tespiti.
 * <p>
 * Belgedeki ilk {@code security-sensitivity-level} elementinin metni
 * büyük/küçük harf duyarsız olarak {@code low}, {@code moderate}, {@code high}
 * ile eşleştirilir. Diğer tüm durumlarda (eksik element, tanınmayan değer,
 * ayrıştırma hatası) {@link BaselineLevel#MODERATE} döner.
 */
@Service
public class BaselineClassifier implements IBaselineClassifier {

    private static final Logger log = LoggerFactory.getLogger(BaselineClassifier.class);

    private static final BaselineLevel DEFAULT_BASELINE = BaselineLevel.MODERATE;

    private final IOscalDocumentParser parser;
    private final OscalMetrics metrics;

    public BaselineClassifier(IOscalDocumentParser parser, OscalMetrics metrics) {
        this.parser = parser;
        this.metrics = metrics;
    }

    @Override
    public BaselineLevel detect(byte[] xmlContent) {
        try {
            return detect(parser.parse(xmlContent));
        } catch (OscalParseException e) {
            log.debug("Baseline tespiti: belge ayrıştırılamadı, {} varsayılıyor — {}", DEFAULT_BASELINE, e.getMessage());
            metrics.recordBaseline(DEFAULT_BASELINE);
            return DEFAULT_BASELINE;
        }
    }

    @Override
    public BaselineLevel detect(XmlNode root) {
        String level = XmlNavigator.firstDescendant(root, "security-sensitivity-level")
                .map(XmlNavigator::text)
                .map(text -> text.toLowerCase(Locale.ROOT))
                .orElse("");

        BaselineLevel baseline = switch (level) {
            case "low" -> BaselineLevel.LOW;
            case "moderate" -> BaselineLevel.MODERATE;
            case "high" -> BaselineLevel.HIGH;
            default -> DEFAULT_BASELINE;
        };

        log.debug("Baseline tespit edildi: {} (security-sensitivity-level='{}')", baseline, level);
        metrics.recordBaseline(baseline);
        return baseline;
    }
}

package io.mersel.services.oscal.infrastructure;

import io.mersel.services.oscal.application.interfaces.IOscalDocumentParser;
import io.mersel.services.oscal.application.interfaces.IOscalValidator;
import io.mersel.services.oscal.application.interfaces.OscalParseException;
import io.mersel.services.oscal.application.interfaces.XmlNode;
import io.mersel.services.oscal.application.models.ValidationResult;
import io.mersel.services.oscal.infrastructure.config.OscalProperties;
import io.mersel.services.oscal.infrastructure.diagnostics.OscalMetrics;
import io.mersel.services.oscal.infrastructure.tree.XmlNavigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * OSCAL SSP yapısal doğrulama implementasyonu.
 * <p>
 * Kontroller birbirinden bağımsızdır ve tümü çalıştırılır:
 * <ul>
 *   <li>Kök namespace beklenen OSCAL namespace'i olmalı: hata</li>
 *   <li>{@code metadata} elementi bulunmalı: hata</li>
 *   <li>{@code system-characteristics} elementi bulunmalı: hata</li>
 *   <li>{@code control-implementation} elementi bulunmalı: yalnızca uyarı</li>
 * </ul>
 * Belge hiç ayrıştırılamazsa tek bir hata döner, kısmi doğrulama yapılmaz.
 */
@Service
public class OscalDocumentValidator implements IOscalValidator {

    private static final Logger log = LoggerFactory.getLogger(OscalDocumentValidator.class);

    private final IOscalDocumentParser parser;
    private final OscalProperties properties;
    private final OscalMetrics metrics;

    public OscalDocumentValidator(IOscalDocumentParser parser, OscalProperties properties, OscalMetrics metrics) {
        this.parser = parser;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public ValidationResult validate(byte[] xmlContent) {
        XmlNode root;
        try {
            root = parser.parse(xmlContent);
        } catch (OscalParseException e) {
            log.debug("Doğrulama: belge ayrıştırılamadı — {}", e.getMessage());
            metrics.recordValidation(false, 0);
            return ValidationResult.failed(parseErrorMessage(e));
        }
        return validate(root);
    }

    @Override
    public ValidationResult validate(XmlNode root) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        String expectedNamespace = properties.getExpectedNamespace();

        if (!expectedNamespace.equals(root.namespaceUri())) {
            errors.add("Invalid namespace. Expected " + expectedNamespace);
        }

        if (XmlNavigator.firstDescendant(root, "metadata").isEmpty()) {
            errors.add("Missing required 'metadata' element");
        }

        if (XmlNavigator.firstDescendant(root, "system-characteristics").isEmpty()) {
            errors.add("Missing required 'system-characteristics' element");
        }

        if (XmlNavigator.firstDescendant(root, "control-implementation").isEmpty()) {
            warnings.add("No 'control-implementation' element found");
        }

        var result = new ValidationResult(errors, warnings);
        log.debug("Doğrulama tamamlandı: valid={}, {} hata, {} uyarı (root={}, namespace={})",
                result.isValid(), errors.size(), warnings.size(), root.name(), root.namespaceUri());
        metrics.recordValidation(result.isValid(), warnings.size());
        return result;
    }

    /**
     * Ayrıştırma hatasının kullanıcıya raporlanan metni.
     */
    static String parseErrorMessage(OscalParseException e) {
        return "XML parsing error: " + e.getMessage();
    }
}

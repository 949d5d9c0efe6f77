package io.mersel.services.oscal.application.interfaces;

import io.mersel.services.oscal.application.models.ValidationResult;

/**
 * OSCAL SSP belgesinin yapısal doğrulama servisi arayüzü.
 * <p>
 * Yalnızca yapısal varlık/yokluk kontrolleri yapar; iş kuralı veya XSD doğrulaması yapmaz.
 */
public interface IOscalValidator {

    /**
     * Ham XML içeriğini ayrıştırıp doğrular. Ayrıştırma hatası tek bir hata
     * olarak raporlanır; istisna fırlatılmaz.
     */
    ValidationResult validate(byte[] xmlContent);

    /**
     * Önceden ayrıştırılmış kök element üzerinde doğrulama yapar.
     */
    ValidationResult validate(XmlNode root);
}

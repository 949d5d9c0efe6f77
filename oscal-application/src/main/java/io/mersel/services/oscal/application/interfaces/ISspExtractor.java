package io.mersel.services.oscal.application.interfaces;

import io.mersel.services.oscal.application.models.ExtractionResult;

/**
 * SSP belgesinden metadata, sistem özellikleri ve güvenlik kontrollerini çıkaran orkestratör.
 */
public interface ISspExtractor {

    /**
     * XML içeriğini ayrıştırır ve modeli çıkarır.
     *
     * @throws OscalParseException içerik XML olarak ayrıştırılamazsa
     */
    ExtractionResult extract(byte[] xmlContent) throws OscalParseException;

    /**
     * Önceden ayrıştırılmış kök elementten modeli çıkarır. Eksik bölümler
     * sonuçta boş kalır, istisna fırlatılmaz.
     */
    ExtractionResult extract(XmlNode root);
}

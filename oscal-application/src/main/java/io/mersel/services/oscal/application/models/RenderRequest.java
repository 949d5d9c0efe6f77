package io.mersel.services.oscal.application.models;

import io.mersel.services.oscal.application.enums.BaselineLevel;

/**
 * {@link io.mersel.services.oscal.application.interfaces.IDocumentRenderer}'a teslim edilen istek.
 *
 * @param baseline       Tespit edilen baseline
 * @param templateName   Baseline'a göre seçilen şablon dosyası adı
 * @param outputFileName Üretilecek çıktı dosyasının adı
 * @param extraction     Çıkarılmış SSP modeli
 */
public record RenderRequest(
        BaselineLevel baseline,
        String templateName,
        String outputFileName,
        ExtractionResult extraction
) {
}

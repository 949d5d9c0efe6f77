package io.mersel.services.oscal.application.interfaces;

import io.mersel.services.oscal.application.models.ConversionResult;

/**
 * OSCAL SSP → çıktı belgesi dönüşüm akışı.
 * <p>
 * Doğrulama, baseline tespiti, şablon seçimi, model çıkarma ve
 * {@link IDocumentRenderer}'a teslim adımlarını sırayla yürütür.
 */
public interface IOscalConversionService {

    /**
     * @param xmlContent yüklenen OSCAL SSP XML içeriği
     * @return dönüşüm sonucu; hata durumları istisna yerine sonuç içinde raporlanır
     */
    ConversionResult convert(byte[] xmlContent);
}

package io.mersel.services.oscal.application.interfaces;

import io.mersel.services.oscal.application.models.RenderRequest;

/**
 * Çıkarılan SSP modelinden çıktı belgesi üreten dış bileşen arayüzü.
 * <p>
 * Şablon işleme (Word vb.) bu servisin kapsamı dışındadır; implementasyon
 * uygulamayı kullanan katman tarafından sağlanır.
 */
public interface IDocumentRenderer {

    /**
     * @param request baseline, şablon adı, çıktı dosya adı ve çıkarılmış model
     * @return üretilen belgenin içeriği
     * @throws RenderException belge üretilemediğinde
     */
    byte[] render(RenderRequest request) throws RenderException;

    /**
     * Belge üretimi başarısız olduğunda fırlatılan istisna.
     */
    class RenderException extends Exception {
        public RenderException(String message) {
            super(message);
        }

        public RenderException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

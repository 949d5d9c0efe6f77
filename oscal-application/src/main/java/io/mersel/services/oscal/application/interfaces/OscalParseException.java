package io.mersel.services.oscal.application.interfaces;

/**
 * Girdi bir XML ağacı olarak hiç ayrıştırılamadığında fırlatılan istisna.
 * <p>
 * Boş içerik veya bozuk (well-formed olmayan) XML durumlarında kullanılır.
 * Veri şekline bağlı eksiklikler (eksik bölüm, eksik attribute) bu istisnaya yol açmaz.
 */
public class OscalParseException extends Exception {

    public OscalParseException(String message) {
        super(message);
    }

    public OscalParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

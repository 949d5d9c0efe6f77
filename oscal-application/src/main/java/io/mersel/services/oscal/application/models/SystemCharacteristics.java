package io.mersel.services.oscal.application.models;

/**
 * Belgenin {@code system-characteristics} bölümünden çıkarılan bilgiler.
 *
 * @param systemName               Sistem adı
 * @param systemId                 İlk {@code system-id} değeri
 * @param securitySensitivityLevel Güvenlik hassasiyet seviyesi (boş olabilir)
 */
public record SystemCharacteristics(
        String systemName,
        String systemId,
        String securitySensitivityLevel
) {
}

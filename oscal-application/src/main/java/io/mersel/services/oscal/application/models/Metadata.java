package io.mersel.services.oscal.application.models;

import java.time.OffsetDateTime;

/**
 * Belgenin {@code metadata} bölümünden çıkarılan bilgiler.
 *
 * @param title        Belge başlığı
 * @param version      Belge sürümü
 * @param oscalVersion OSCAL şema sürümü
 * @param lastModified Son değiştirilme zamanı; eksik veya ayrıştırılamazsa {@code null}
 */
public record Metadata(
        String title,
        String version,
        String oscalVersion,
        OffsetDateTime lastModified
) {
}

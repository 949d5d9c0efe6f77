package io.mersel.services.oscal.application.models;

import java.util.List;
import java.util.Optional;

/**
 * Tek bir SSP belgesinden çıkarılan toplu model.
 * <p>
 * {@code metadata} veya {@code system-characteristics} bölümü eksikse ilgili alan boştur;
 * çağıran taraf bu durumu açıkça ele almalıdır.
 */
public final class ExtractionResult {

    private final Metadata metadata;
    private final SystemCharacteristics systemCharacteristics;
    private final List<SecurityControl> securityControls;

    public ExtractionResult(Metadata metadata,
                            SystemCharacteristics systemCharacteristics,
                            List<SecurityControl> securityControls) {
        this.metadata = metadata;
        this.systemCharacteristics = systemCharacteristics;
        this.securityControls = List.copyOf(securityControls);
    }

    public Optional<Metadata> getMetadata() {
        return Optional.ofNullable(metadata);
    }

    public Optional<SystemCharacteristics> getSystemCharacteristics() {
        return Optional.ofNullable(systemCharacteristics);
    }

    /** Belge sırasıyla güvenlik kontrolleri. */
    public List<SecurityControl> getSecurityControls() {
        return securityControls;
    }
}

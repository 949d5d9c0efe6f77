package io.mersel.services.oscal.application.enums;

/**
 * FedRAMP uyum baseline seviyeleri.
 * <p>
 * Belgenin {@code security-sensitivity-level} değerinden türetilir ve
 * hangi çıktı şablonunun kullanılacağını belirler.
 */
public enum BaselineLevel {
    UNKNOWN,
    LOW,
    MODERATE,
    HIGH
}

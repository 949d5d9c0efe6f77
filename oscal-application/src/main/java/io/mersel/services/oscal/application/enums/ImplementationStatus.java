package io.mersel.services.oscal.application.enums;

import java.util.Optional;

/**
 * {@code implementation-status} property'sinin tanınan değerleri.
 * <p>
 * Her değer, çıktı şablonunda ilgili bölgeyi seçmek için kullanılan
 * sabit bir sıra koduna ({@link #code()}) sahiptir.
 */
public enum ImplementationStatus {

    IMPLEMENTED("implemented", 0),
    PARTIALLY_IMPLEMENTED("partially-implemented", 1),
    PLANNED("planned", 2),
    ALTERNATIVE_IMPLEMENTATION("alternative-implementation", 3),
    NOT_APPLICABLE("not-applicable", 4);

    /** Belgede property adı olarak geçen değer */
    public static final String PROPERTY_NAME = "implementation-status";

    private final String value;
    private final int code;

    ImplementationStatus(String value, int code) {
        this.value = value;
        this.code = code;
    }

    public String value() {
        return value;
    }

    public int code() {
        return code;
    }

    /**
     * Belgedeki ham değerden enum'u çözümler. Eşleşme birebirdir (büyük/küçük harf duyarlı).
     */
    public static Optional<ImplementationStatus> fromValue(String value) {
        for (ImplementationStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}

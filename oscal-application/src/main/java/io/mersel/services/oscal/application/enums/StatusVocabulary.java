package io.mersel.services.oscal.application.enums;

import java.util.Arrays;
import java.util.Map;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Durum sözlüğü. {@code implementation-status} ve {@code control-origination}
 * değerlerinin sabit sıra kodu tabloları.
 * <p>
 * Değiştirilemez referans verisidir; çekirdek bu kodları yorumlamaz,
 * yalnızca dış çıktı üreticisinin (renderer) kullanımına sunar.
 */
public final class StatusVocabulary {

    /** implementation-status değeri → sıra kodu (0-4) */
    public static final Map<String, Integer> IMPLEMENTATION_STATUS_CODES = Arrays.stream(ImplementationStatus.values())
            .collect(Collectors.toUnmodifiableMap(ImplementationStatus::value, ImplementationStatus::code));

    /** control-origination değeri → sıra kodu (5-11) */
    public static final Map<String, Integer> CONTROL_ORIGINATION_CODES = Arrays.stream(ControlOrigination.values())
            .collect(Collectors.toUnmodifiableMap(ControlOrigination::value, ControlOrigination::code));

    private StatusVocabulary() {
    }

    public static OptionalInt implementationStatusCode(String value) {
        Integer code = value == null ? null : IMPLEMENTATION_STATUS_CODES.get(value);
        return code == null ? OptionalInt.empty() : OptionalInt.of(code);
    }

    public static OptionalInt controlOriginationCode(String value) {
        Integer code = value == null ? null : CONTROL_ORIGINATION_CODES.get(value);
        return code == null ? OptionalInt.empty() : OptionalInt.of(code);
    }
}

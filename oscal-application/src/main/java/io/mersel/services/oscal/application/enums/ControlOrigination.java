package io.mersel.services.oscal.application.enums;

import java.util.Optional;

/**
 * {@code control-origination} property'sinin tanınan değerleri.
 * <p>
 * Sıra kodları {@link ImplementationStatus} kodlarının devamıdır (5-11).
 */
public enum ControlOrigination {

    SERVICE_PROVIDER_CORPORATE("service-provider-corporate", 5),
    SERVICE_PROVIDER_SYSTEM_SPECIFIC("service-provider-system-specific", 6),
    SERVICE_PROVIDER_HYBRID("service-provider-hybrid", 7),
    CONFIGURED_BY_CUSTOMER("configured-by-customer", 8),
    PROVIDED_BY_CUSTOMER("provided-by-customer", 9),
    SHARED("shared", 10),
    INHERITED("inherited", 11);

    public static final String PROPERTY_NAME = "control-origination";

    private final String value;
    private final int code;

    ControlOrigination(String value, int code) {
        this.value = value;
        this.code = code;
    }

    public String value() {
        return value;
    }

    public int code() {
        return code;
    }

    public static Optional<ControlOrigination> fromValue(String value) {
        for (ControlOrigination origination : values()) {
            if (origination.value.equals(value)) {
                return Optional.of(origination);
            }
        }
        return Optional.empty();
    }
}

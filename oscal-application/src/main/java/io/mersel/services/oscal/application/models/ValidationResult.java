package io.mersel.services.oscal.application.models;

import java.util.List;

/**
 * Yapısal doğrulama sonucu.
 * <p>
 * Hata listesi boş değilse belge geçersizdir; uyarılar geçerliliği etkilemez.
 *
 * @param errors   Doğrulama hataları
 * @param warnings Uyarılar (ör. {@code control-implementation} yok)
 */
public record ValidationResult(List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public static ValidationResult failed(String error) {
        return new ValidationResult(List.of(error), List.of());
    }
}

package io.mersel.services.oscal.application.models;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ValidationResult")
class ValidationResultTest {

    @Test
    @DisplayName("Uyarılar geçerliliği etkilemez")
    void warningsDoNotInvalidate() {
        var result = new ValidationResult(List.of(), List.of("No 'control-implementation' element found"));

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    @DisplayName("failed → tek hata, uyarı yok")
    void failed() {
        var result = ValidationResult.failed("XML parsing error: XML content is empty");

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly("XML parsing error: XML content is empty");
        assertThat(result.warnings()).isEmpty();
    }
}

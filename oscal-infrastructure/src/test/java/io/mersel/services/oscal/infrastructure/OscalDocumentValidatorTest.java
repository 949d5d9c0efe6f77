package io.mersel.services.oscal.infrastructure;

import io.mersel.services.oscal.application.models.ValidationResult;
import io.mersel.services.oscal.infrastructure.config.OscalProperties;
import io.mersel.services.oscal.infrastructure.diagnostics.OscalMetrics;
import io.mersel.services.oscal.infrastructure.tree.SaxonOscalDocumentParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.mersel.services.oscal.infrastructure.SspFixtures.bytes;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * OscalDocumentValidator birim testleri.
 * <p>
 * Namespace, zorunlu bölüm, opsiyonel bölüm ve bozuk XML senaryoları.
 */
@DisplayName("OscalDocumentValidator")
class OscalDocumentValidatorTest {

    private SimpleMeterRegistry registry;
    private OscalDocumentValidator validator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        validator = new OscalDocumentValidator(
                new SaxonOscalDocumentParser(), new OscalProperties(), new OscalMetrics(registry));
    }

    @Test
    @DisplayName("Tam belge geçerli, hata ve uyarı yok")
    void validate_completeDocument() {
        ValidationResult result = validator.validate(bytes(SspFixtures.SAMPLE_SSP));

        assertThat(result.isValid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(registry.counter("oscal_validations_total", "result", "valid").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Farklı namespace → geçersiz, namespace hatası")
    void validate_wrongNamespace() {
        ValidationResult result = validator.validate(bytes("""
                <system-security-plan xmlns="http://csrc.nist.gov/ns/oscal/0.9">
                    <metadata/>
                    <system-characteristics/>
                    <control-implementation/>
                </system-security-plan>
                """));

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly("Invalid namespace. Expected http://csrc.nist.gov/ns/oscal/1.0");
    }

    @Test
    @DisplayName("Zorunlu bölümler eksikse her biri ayrı hata, kontroller bağımsız")
    void validate_missingRequiredSections() {
        ValidationResult result = validator.validate(bytes("""
                <system-security-plan xmlns="urn:not-oscal">
                    <control-implementation/>
                </system-security-plan>
                """));

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).hasSize(3);
        assertThat(result.errors()).anyMatch(e -> e.contains("namespace"));
        assertThat(result.errors()).contains(
                "Missing required 'metadata' element",
                "Missing required 'system-characteristics' element");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("Bölümler kökün herhangi bir altında aranır")
    void validate_nestedSections() {
        ValidationResult result = validator.validate(bytes("""
                <system-security-plan xmlns="http://csrc.nist.gov/ns/oscal/1.0">
                    <wrapper><metadata/></wrapper>
                    <system-characteristics/>
                    <control-implementation/>
                </system-security-plan>
                """));

        assertThat(result.isValid()).isTrue();
    }

    @Test
    @DisplayName("control-implementation yoksa yalnızca uyarı")
    void validate_missingControlImplementation() {
        ValidationResult result = validator.validate(bytes("""
                <system-security-plan xmlns="http://csrc.nist.gov/ns/oscal/1.0">
                    <metadata/>
                    <system-characteristics/>
                </system-security-plan>
                """));

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).containsExactly("No 'control-implementation' element found");
        assertThat(registry.counter("oscal_validation_warnings_total").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Bozuk XML tek bir ayrıştırma hatası döner")
    void validate_malformed() {
        ValidationResult result = validator.validate(bytes("<system-security-plan><metadata>"));

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0)).startsWith("XML parsing error:");
        assertThat(result.warnings()).isEmpty();
        assertThat(registry.counter("oscal_validations_total", "result", "invalid").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Boş içerik İngilizce ayrıştırma hatası döner")
    void validate_emptyContent() {
        ValidationResult result = validator.validate(new byte[0]);

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly("XML parsing error: XML content is empty");
    }

    @Test
    @DisplayName("Yapılandırılan namespace kullanılır")
    void validate_configuredNamespace() {
        var properties = new OscalProperties();
        properties.setExpectedNamespace("urn:custom");
        var customValidator = new OscalDocumentValidator(
                new SaxonOscalDocumentParser(), properties, new OscalMetrics(registry));

        ValidationResult result = customValidator.validate(bytes("""
                <ssp xmlns="urn:custom"><metadata/><system-characteristics/><control-implementation/></ssp>
                """));

        assertThat(result.isValid()).isTrue();
    }
}

package io.mersel.services.oscal.infrastructure.diagnostics;

import io.mersel.services.oscal.application.enums.BaselineLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * OSCAL servisi özel metrikleri.
 * <p>
 * Prometheus üzerinden dışa aktarılan tüm uygulama metriklerini yönetir.
 */
@Component
public class OscalMetrics {

    private final MeterRegistry registry;

    public OscalMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Çıkarım metrikleri kaydet.
     *
     * @param controlCount  Sonuca eklenen kontrol sayısı
     * @param skippedCount  {@code control-id} olmadığı için atlanan kontrol sayısı
     * @param durationMs    Çıkarım süresi (milisaniye)
     */
    public void recordExtraction(int controlCount, int skippedCount, long durationMs) {
        Counter.builder("oscal_extractions_total")
                .description("Toplam çıkarım sayısı")
                .register(registry)
                .increment();

        Counter.builder("oscal_extracted_controls_total")
                .description("Çıkarılan güvenlik kontrolü sayısı")
                .register(registry)
                .increment(controlCount);

        if (skippedCount > 0) {
            Counter.builder("oscal_skipped_controls_total")
                    .description("control-id olmadığı için atlanan kontrol sayısı")
                    .register(registry)
                    .increment(skippedCount);
        }

        Timer.builder("oscal_extraction_duration")
                .description("Çıkarım süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Doğrulama metrikleri kaydet.
     *
     * @param valid    Belge geçerli mi
     * @param warnings Uyarı sayısı
     */
    public void recordValidation(boolean valid, int warnings) {
        Counter.builder("oscal_validations_total")
                .tag("result", valid ? "valid" : "invalid")
                .description("Toplam doğrulama sayısı")
                .register(registry)
                .increment();

        if (warnings > 0) {
            Counter.builder("oscal_validation_warnings_total")
                    .description("Doğrulama uyarı sayısı")
                    .register(registry)
                    .increment(warnings);
        }
    }

    /**
     * Baseline tespit dağılımı.
     */
    public void recordBaseline(BaselineLevel baseline) {
        Counter.builder("oscal_baseline_detections_total")
                .tag("baseline", baseline.name())
                .description("Baseline tespit sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Dönüşüm metrikleri kaydet.
     */
    public void recordConversion(boolean success, long durationMs) {
        Counter.builder("oscal_conversions_total")
                .tag("status", success ? "success" : "failure")
                .description("Toplam dönüşüm sayısı")
                .register(registry)
                .increment();

        Timer.builder("oscal_conversion_duration")
                .description("Dönüşüm süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Hata metrikleri kaydet.
     */
    public void recordError(String operation) {
        Counter.builder("oscal_errors_total")
                .tag("operation", operation)
                .description("Toplam hata sayısı")
                .register(registry)
                .increment();
    }
}

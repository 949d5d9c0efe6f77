package io.mersel.services.oscal.infrastructure.config;

import io.mersel.services.oscal.application.enums.BaselineLevel;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OSCAL servisi yapılandırma özellikleri.
 * <p>
 * {@code oscal} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code expected-namespace}: Kök elementte beklenen OSCAL namespace'i</li>
 *   <li>{@code extraction.parallel}: Kontrol çıkarımını paralel çalıştır (varsayılan: false)</li>
 *   <li>{@code extraction.parallel-threshold}: Paralel çıkarım için en az kontrol sayısı (pozitif olmalı)</li>
 *   <li>{@code templates.low/moderate/high}: Baseline'a göre çıktı şablonu adları</li>
 *   <li>{@code output-file-pattern}: Çıktı dosya adı kalıbı (baseline, zaman damgası)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "oscal")
public class OscalProperties {

    private static final Logger log = LoggerFactory.getLogger(OscalProperties.class);

    public static final String OSCAL_NAMESPACE = "http://csrc.nist.gov/ns/oscal/1.0";
    static final int DEFAULT_PARALLEL_THRESHOLD = 64;

    private String expectedNamespace = OSCAL_NAMESPACE;
    private String outputFilePattern = "SSP-%s-%s.docx";
    private final Extraction extraction = new Extraction();
    private final Templates templates = new Templates();

    @PostConstruct
    void validate() {
        if (extraction.parallelThreshold <= 0) {
            log.warn("extraction.parallel-threshold değeri pozitif olmalı (verilen: {}), varsayılan {} kullanılıyor",
                    extraction.parallelThreshold, DEFAULT_PARALLEL_THRESHOLD);
            extraction.parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;
        }
        if (expectedNamespace == null || expectedNamespace.isBlank()) {
            log.warn("expected-namespace boş, varsayılan {} kullanılıyor", OSCAL_NAMESPACE);
            expectedNamespace = OSCAL_NAMESPACE;
        }
    }

    public String getExpectedNamespace() {
        return expectedNamespace;
    }

    public void setExpectedNamespace(String expectedNamespace) {
        this.expectedNamespace = expectedNamespace;
    }

    public String getOutputFilePattern() {
        return outputFilePattern;
    }

    public void setOutputFilePattern(String outputFilePattern) {
        this.outputFilePattern = outputFilePattern;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public Templates getTemplates() {
        return templates;
    }

    public static class Extraction {

        private boolean parallel = false;
        private int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;

        public boolean isParallel() {
            return parallel;
        }

        public void setParallel(boolean parallel) {
            this.parallel = parallel;
        }

        public int getParallelThreshold() {
            return parallelThreshold;
        }

        public void setParallelThreshold(int parallelThreshold) {
            this.parallelThreshold = parallelThreshold;
        }
    }

    public static class Templates {

        private String low = "FedRAMP-SSP-Low-Baseline-Template.docx";
        private String moderate = "FedRAMP-SSP-Moderate-Baseline-Template.docx";
        private String high = "FedRAMP-SSP-High-Baseline-Template.docx";

        /**
         * Baseline için şablon adı. {@link BaselineLevel#UNKNOWN} moderate şablonuna düşer.
         */
        public String templateFor(BaselineLevel baseline) {
            return switch (baseline) {
                case LOW -> low;
                case HIGH -> high;
                case MODERATE, UNKNOWN -> moderate;
            };
        }

        public String getLow() {
            return low;
        }

        public void setLow(String low) {
            this.low = low;
        }

        public String getModerate() {
            return moderate;
        }

        public void setModerate(String moderate) {
            this.moderate = moderate;
        }

        public String getHigh() {
            return high;
        }

        public void setHigh(String high) {
            this.high = high;
        }
    }
}

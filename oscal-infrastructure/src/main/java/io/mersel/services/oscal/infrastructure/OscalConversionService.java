package io.mersel.services.oscal.infrastructure;

import io.mersel.services.oscal.application.enums.BaselineLevel;
import io.mersel.services.oscal.application.interfaces.IBaselineClassifier;
import io.mersel.services.oscal.application.interfaces.IDocumentRenderer;
import io.mersel.services.oscal.application.interfaces.IDocumentRenderer.RenderException;
import io.mersel.services.oscal.application.interfaces.IOscalConversionService;
import io.mersel.services.oscal.application.interfaces.IOscalDocumentParser;
import io.mersel.services.oscal.application.interfaces.IOscalValidator;
import io.mersel.services.oscal.application.interfaces.ISspExtractor;
import io.mersel.services.oscal.application.interfaces.OscalParseException;
import io.mersel.services.oscal.application.interfaces.XmlNode;
import io.mersel.services.oscal.application.models.ConversionResult;
import io.mersel.services.oscal.application.models.ExtractionResult;
import io.mersel.services.oscal.application.models.RenderRequest;
import io.mersel.services.oscal.application.models.ValidationResult;
import io.mersel.services.oscal.infrastructure.config.OscalProperties;
import io.mersel.services.oscal.infrastructure.diagnostics.OscalMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * OSCAL SSP → çıktı belgesi dönüşüm akışı.
 * <p>
 * Belge bir kez ayrıştırılır, ardından:
 * <ol>
 *   <li>Yapısal doğrulama: geçersizse hatalar {@code "; "} ile birleştirilip döner</li>
 *   <li>Baseline tespiti ve şablon seçimi</li>
 *   <li>Model çıkarımı</li>
 *   <li>{@link IDocumentRenderer}'a teslim</li>
 * </ol>
 * Hiçbir hata istisna olarak dışarı sızmaz; sonuç {@link ConversionResult} içinde raporlanır.
 */
@Service
public class OscalConversionService implements IOscalConversionService {

    private static final Logger log = LoggerFactory.getLogger(OscalConversionService.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final IOscalDocumentParser parser;
    private final IOscalValidator validator;
    private final IBaselineClassifier classifier;
    private final ISspExtractor extractor;
    private final IDocumentRenderer renderer;
    private final OscalProperties properties;
    private final OscalMetrics metrics;
    private final Clock clock;

    @Autowired
    public OscalConversionService(IOscalDocumentParser parser,
                                  IOscalValidator validator,
                                  IBaselineClassifier classifier,
                                  ISspExtractor extractor,
                                  IDocumentRenderer renderer,
                                  OscalProperties properties,
                                  OscalMetrics metrics,
                                  ObjectProvider<Clock> clock) {
        this(parser, validator, classifier, extractor, renderer, properties, metrics,
                clock.getIfAvailable(Clock::systemDefaultZone));
    }

    OscalConversionService(IOscalDocumentParser parser,
                           IOscalValidator validator,
                           IBaselineClassifier classifier,
                           ISspExtractor extractor,
                           IDocumentRenderer renderer,
                           OscalProperties properties,
                           OscalMetrics metrics,
                           Clock clock) {
        this.parser = parser;
        this.validator = validator;
        this.classifier = classifier;
        this.extractor = extractor;
        this.renderer = renderer;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public ConversionResult convert(byte[] xmlContent) {
        long startTime = System.currentTimeMillis();
        ConversionResult result = doConvert(xmlContent);
        metrics.recordConversion(result.isSuccess(), System.currentTimeMillis() - startTime);
        return result;
    }

    private ConversionResult doConvert(byte[] xmlContent) {
        try {
            XmlNode root;
            try {
                root = parser.parse(xmlContent);
            } catch (OscalParseException e) {
                log.warn("Dönüşüm reddedildi: belge ayrıştırılamadı — {}", e.getMessage());
                return ConversionResult.failure(OscalDocumentValidator.parseErrorMessage(e));
            }

            ValidationResult validation = validator.validate(root);
            if (!validation.isValid()) {
                log.warn("Dönüşüm reddedildi: {} doğrulama hatası", validation.errors().size());
                return ConversionResult.failure(String.join("; ", validation.errors()));
            }
            validation.warnings().forEach(w -> log.info("Doğrulama uyarısı: {}", w));

            BaselineLevel baseline = classifier.detect(root);
            String templateName = properties.getTemplates().templateFor(baseline);
            log.info("{} baseline şablonu kullanılıyor: {}", baseline, templateName);

            ExtractionResult extraction = extractor.extract(root);
            String outputFileName = String.format(properties.getOutputFilePattern(),
                    baseline.name(), TIMESTAMP.format(LocalDateTime.now(clock)));

            byte[] content = renderer.render(new RenderRequest(baseline, templateName, outputFileName, extraction));

            log.info("Dönüşüm tamamlandı: {} ({} kontrol)", outputFileName, extraction.getSecurityControls().size());
            return ConversionResult.builder()
                    .success(true)
                    .outputFileName(outputFileName)
                    .content(content)
                    .baseline(baseline)
                    .controlCount(extraction.getSecurityControls().size())
                    .build();

        } catch (RenderException e) {
            log.error("Çıktı belgesi üretilemedi: {}", e.getMessage(), e);
            metrics.recordError("render");
            return ConversionResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("OSCAL dönüşümü sırasında beklenmeyen hata", e);
            metrics.recordError("conversion");
            return ConversionResult.failure(e.getMessage());
        }
    }
}

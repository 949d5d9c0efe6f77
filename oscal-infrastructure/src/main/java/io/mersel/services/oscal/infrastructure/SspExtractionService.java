package io.mersel.services.oscal.infrastructure;

import io.mersel.services.oscal.application.interfaces.IOscalDocumentParser;
import io.mersel.services.oscal.application.interfaces.ISspExtractor;
import io.mersel.services.oscal.application.interfaces.OscalParseException;
import io.mersel.services.oscal.application.interfaces.XmlNode;
import io.mersel.services.oscal.application.models.ExtractionResult;
import io.mersel.services.oscal.application.models.Metadata;
import io.mersel.services.oscal.application.models.SecurityControl;
import io.mersel.services.oscal.application.models.SystemCharacteristics;
import io.mersel.services.oscal.infrastructure.config.OscalProperties;
import io.mersel.services.oscal.infrastructure.diagnostics.OscalMetrics;
import io.mersel.services.oscal.infrastructure.extraction.MetadataExtractor;
import io.mersel.services.oscal.infrastructure.extraction.SecurityControlExtractor;
import io.mersel.services.oscal.infrastructure.extraction.SystemCharacteristicsExtractor;
import io.mersel.services.oscal.infrastructure.tree.XmlNavigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * SSP çıkarım orkestratörü.
 * <p>
 * Kök elementin doğrudan çocukları üzerinde tek geçiş yapar:
 * <ul>
 *   <li>ilk {@code metadata} → {@link Metadata}</li>
 *   <li>ilk {@code system-characteristics} → {@link SystemCharacteristics}</li>
 *   <li>her {@code control-implementation} altındaki {@code implemented-requirement}'lar → {@link SecurityControl}</li>
 * </ul>
 * Kontroller belge sırasıyla eklenir. {@code control-id} olmayan gereksinimler sessizce atlanır.
 * <p>
 * {@code oscal.extraction.parallel} açıksa ve bir {@code control-implementation} eşik kadar
 * gereksinim içeriyorsa kontroller paralel çıkarılır; sonuç sırası yine belge sırasıdır.
 */
@Service
public class SspExtractionService implements ISspExtractor {

    private static final Logger log = LoggerFactory.getLogger(SspExtractionService.class);

    private final IOscalDocumentParser parser;
    private final MetadataExtractor metadataExtractor;
    private final SystemCharacteristicsExtractor systemCharacteristicsExtractor;
    private final SecurityControlExtractor securityControlExtractor;
    private final OscalProperties properties;
    private final OscalMetrics metrics;

    public SspExtractionService(IOscalDocumentParser parser,
                                MetadataExtractor metadataExtractor,
                                SystemCharacteristicsExtractor systemCharacteristicsExtractor,
                                SecurityControlExtractor securityControlExtractor,
                                OscalProperties properties,
                                OscalMetrics metrics) {
        this.parser = parser;
        this.metadataExtractor = metadataExtractor;
        this.systemCharacteristicsExtractor = systemCharacteristicsExtractor;
        this.securityControlExtractor = securityControlExtractor;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public ExtractionResult extract(byte[] xmlContent) throws OscalParseException {
        return extract(parser.parse(xmlContent));
    }

    @Override
    public ExtractionResult extract(XmlNode root) {
        long startTime = System.currentTimeMillis();
        String namespaceUri = root.namespaceUri();

        Metadata metadata = null;
        SystemCharacteristics systemCharacteristics = null;
        List<SecurityControl> controls = new ArrayList<>();
        int skipped = 0;

        for (XmlNode child : XmlNavigator.elements(root)) {
            if (!namespaceUri.equals(child.namespaceUri())) {
                continue;
            }
            switch (child.localName()) {
                case "metadata" -> {
                    if (metadata == null) {
                        metadata = metadataExtractor.extract(child);
                    }
                }
                case "system-characteristics" -> {
                    if (systemCharacteristics == null) {
                        systemCharacteristics = systemCharacteristicsExtractor.extract(child);
                    }
                }
                case "control-implementation" -> {
                    List<XmlNode> requirements = XmlNavigator.children(child, "implemented-requirement", namespaceUri);
                    List<SecurityControl> extracted = extractControls(requirements, namespaceUri);
                    skipped += requirements.size() - extracted.size();
                    controls.addAll(extracted);
                }
                default -> {
                    // çıkarım kapsamı dışında
                }
            }
        }

        if (metadata == null) {
            log.warn("Belgede 'metadata' bölümü yok, sonuçta boş bırakılıyor");
        }
        if (systemCharacteristics == null) {
            log.warn("Belgede 'system-characteristics' bölümü yok, sonuçta boş bırakılıyor");
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("SSP çıkarımı tamamlandı — {} kontrol, {} atlandı ({} ms)", controls.size(), skipped, elapsed);
        metrics.recordExtraction(controls.size(), skipped, elapsed);

        return new ExtractionResult(metadata, systemCharacteristics, controls);
    }

    /**
     * Her gereksinimi kardeşleri arasındaki sıfır tabanlı konumuyla çıkarır.
     * Paralel yolda da sonuç listesi giriş sırasını korur.
     */
    private List<SecurityControl> extractControls(List<XmlNode> requirements, String namespaceUri) {
        var extraction = properties.getExtraction();
        IntStream indices = IntStream.range(0, requirements.size());

        if (extraction.isParallel() && requirements.size() >= extraction.getParallelThreshold()) {
            log.debug("{} kontrol paralel çıkarılıyor", requirements.size());
            indices = indices.parallel();
        }

        return indices
                .mapToObj(i -> securityControlExtractor.extract(requirements.get(i), i, namespaceUri))
                .flatMap(Optional::stream)
                .toList();
    }
}

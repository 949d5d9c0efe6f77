package io.mersel.services.oscal.infrastructure.diagnostics;

import io.mersel.services.oscal.application.interfaces.IOscalDocumentParser;
import io.mersel.services.oscal.application.interfaces.XmlNode;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * OSCAL ayrıştırıcı sağlık kontrolü.
 * <p>
 * Saxon motorunun çalışır durumda olduğunu küçük bir SSP belgesini ayrıştırarak doğrular.
 */
@Component
public class OscalParserHealthCheck implements HealthIndicator {

    private static final byte[] PROBE_DOCUMENT = """
            <?xml version="1.0" encoding="UTF-8"?>
            <system-security-plan xmlns="http://csrc.nist.gov/ns/oscal/1.0" uuid="health-probe">
                <metadata><title>probe</title></metadata>
            </system-security-plan>""".getBytes(StandardCharsets.UTF_8);

    private final IOscalDocumentParser parser;

    public OscalParserHealthCheck(IOscalDocumentParser parser) {
        this.parser = parser;
    }

    @Override
    public Health health() {
        try {
            XmlNode root = parser.parse(PROBE_DOCUMENT);
            if (!"system-security-plan".equals(root.localName())) {
                return Health.down()
                        .withDetail("engine", "Saxon HE")
                        .withDetail("error", "Beklenmeyen kök element: " + root.name())
                        .build();
            }

            return Health.up()
                    .withDetail("engine", "Saxon HE")
                    .withDetail("version", net.sf.saxon.Version.getProductVersion())
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("engine", "Saxon HE")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}

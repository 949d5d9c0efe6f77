package io.mersel.services.oscal.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Bu katmandaki tüm bileşenleri (Saxon parser, extractor'lar, doğrulama, metrikler) otomatik tarar.
 * OSCAL yapılandırma özelliklerini etkinleştirir. {@link io.mersel.services.oscal.application.interfaces.IDocumentRenderer}
 * ve {@code MeterRegistry} bean'leri kullanan uygulama tarafından sağlanır. Bir {@code java.time.Clock}
 * bean'i tanımlanmışsa dönüşüm dosya adlarında o kullanılır, yoksa sistem saati.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.oscal.infrastructure")
@EnableConfigurationProperties(OscalProperties.class)
public class InfrastructureConfig {
}

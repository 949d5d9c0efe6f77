package io.mersel.services.oscal.infrastructure;

import io.mersel.services.oscal.application.interfaces.IOscalDocumentParser;
import io.mersel.services.oscal.application.interfaces.OscalParseException;
import io.mersel.services.oscal.infrastructure.diagnostics.OscalParserHealthCheck;
import io.mersel.services.oscal.infrastructure.tree.SaxonOscalDocumentParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("OscalParserHealthCheck")
class OscalParserHealthCheckTest {

    @Test
    @DisplayName("Çalışan parser → UP, Saxon sürümü raporlanır")
    void health_up() {
        Health health = new OscalParserHealthCheck(new SaxonOscalDocumentParser()).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("engine", "Saxon HE");
        assertThat(health.getDetails()).containsKey("version");
    }

    @Test
    @DisplayName("Parser hata verirse DOWN")
    void health_down() throws OscalParseException {
        IOscalDocumentParser parser = mock(IOscalDocumentParser.class);
        when(parser.parse(any())).thenThrow(new OscalParseException("motor başlatılamadı"));

        Health health = new OscalParserHealthCheck(parser).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "motor başlatılamadı");
    }
}

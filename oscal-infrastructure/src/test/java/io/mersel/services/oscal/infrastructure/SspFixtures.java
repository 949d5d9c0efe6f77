package io.mersel.services.oscal.infrastructure;

import io.mersel.services.oscal.application.interfaces.XmlNode;
import io.mersel.services.oscal.infrastructure.tree.SaxonOscalDocumentParser;

import java.nio.charset.StandardCharsets;

/**
 * Testlerde ortak kullanılan OSCAL SSP belgeleri.
 */
public final class SspFixtures {

    public static final String OSCAL_NS = "http://csrc.nist.gov/ns/oscal/1.0";

    /**
     * Üç gereksinimli örnek SSP: ac-1, control-id'siz bir gereksinim, ac-2.
     */
    public static final String SAMPLE_SSP = """
            <?xml version="1.0" encoding="UTF-8"?>
            <system-security-plan xmlns="http://csrc.nist.gov/ns/oscal/1.0" uuid="ssp-001">
                <!-- örnek belge -->
                <metadata>
                    <title>Example Cloud Service SSP</title>
                    <last-modified>2024-03-01T12:00:00Z</last-modified>
                    <version>1.2</version>
                    <oscal-version>1.0.4</oscal-version>
                </metadata>
                <import-profile href="#fedramp-moderate"/>
                <system-characteristics>
                    <system-id identifier-type="https://fedramp.gov">F00000000</system-id>
                    <system-name>Example Cloud Service</system-name>
                    <security-sensitivity-level>moderate</security-sensitivity-level>
                </system-characteristics>
                <control-implementation>
                    <description><p>FedRAMP moderate kontrolleri</p></description>
                    <implemented-requirement control-id="ac-1" uuid="ir-001">
                        <prop name="implementation-status" value="implemented"/>
                        <prop name="control-origination" value="service-provider-corporate"/>
                        <responsible-role role-id="system-owner">
                            <party-uuid>party-001</party-uuid>
                        </responsible-role>
                        <statement statement-id="ac-1_smt.a" uuid="st-001">
                            <description><p>Access control <em>policy</em> is documented.</p></description>
                        </statement>
                    </implemented-requirement>
                    <implemented-requirement uuid="ir-002">
                        <prop name="implementation-status" value="planned"/>
                    </implemented-requirement>
                    <implemented-requirement control-id="ac-2" uuid="ir-003">
                        <set-parameter param-id="ac-2_prm_1">
                            <value>30 days</value>
                        </set-parameter>
                        <responsible-role role-id="system-owner"/>
                        <responsible-role role-id="authorizing-official"/>
                    </implemented-requirement>
                </control-implementation>
            </system-security-plan>
            """;

    private static final SaxonOscalDocumentParser PARSER = new SaxonOscalDocumentParser();

    private SspFixtures() {
    }

    public static byte[] bytes(String xml) {
        return xml.getBytes(StandardCharsets.UTF_8);
    }

    public static XmlNode parse(String xml) {
        try {
            return PARSER.parse(bytes(xml));
        } catch (Exception e) {
            throw new IllegalStateException("Test belgesi ayrıştırılamadı", e);
        }
    }

    /**
     * Kontrol içeriğini OSCAL namespace'li bir implemented-requirement ile sarar.
     */
    public static XmlNode requirement(String attributes, String body) {
        return parse("<implemented-requirement xmlns=\"" + OSCAL_NS + "\" " + attributes + ">"
                + body + "</implemented-requirement>");
    }
}

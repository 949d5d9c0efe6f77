package io.mersel.services.oscal.application.interfaces;

/**
 * OSCAL XML içeriğini salt okunur {@link XmlNode} ağacına ayrıştıran servis arayüzü.
 */
public interface IOscalDocumentParser {

    /**
     * XML byte içeriğini ayrıştırır ve belgenin kök elementini döndürür.
     *
     * @param xmlContent XML belgesinin byte dizisi
     * @return kök element
     * @throws OscalParseException içerik boşsa veya XML olarak ayrıştırılamazsa
     */
    XmlNode parse(byte[] xmlContent) throws OscalParseException;
}

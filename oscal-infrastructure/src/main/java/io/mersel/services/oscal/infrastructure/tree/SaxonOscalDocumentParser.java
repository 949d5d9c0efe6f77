package io.mersel.services.oscal.infrastructure.tree;

import io.mersel.services.oscal.application.interfaces.IOscalDocumentParser;
import io.mersel.services.oscal.application.interfaces.OscalParseException;
import io.mersel.services.oscal.application.interfaces.XmlNode;
import net.sf.saxon.s9api.DocumentBuilder;
import net.sf.saxon.s9api.Processor;
import net.sf.saxon.s9api.SaxonApiException;
import net.sf.saxon.s9api.XdmNode;
import net.sf.saxon.s9api.XdmNodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.XMLReader;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;
import javax.xml.transform.sax.SAXSource;
import java.io.ByteArrayInputStream;

/**
 * Saxon HE tabanlı OSCAL belge ayrıştırıcı.
 * <p>
 * Belgeyi Saxon TinyTree olarak yükler ve kök elementi {@link SaxonXmlNode}
 * ile sarmalar. XML okuyucu XXE'ye karşı sıkılaştırılmıştır (DOCTYPE yasak,
 * dış entity'ler kapalı).
 */
@Service
public class SaxonOscalDocumentParser implements IOscalDocumentParser {

    private static final Logger log = LoggerFactory.getLogger(SaxonOscalDocumentParser.class);

    /** Processor thread-safe; DocumentBuilder her çağrıda yeniden oluşturulur */
    private final Processor processor = new Processor(false);

    @Override
    public XmlNode parse(byte[] xmlContent) throws OscalParseException {
        if (xmlContent == null || xmlContent.length == 0) {
            throw new OscalParseException("XML content is empty");
        }

        try {
            DocumentBuilder builder = processor.newDocumentBuilder();
            var source = new SAXSource(newSecureReader(), new InputSource(new ByteArrayInputStream(xmlContent)));
            XdmNode document = builder.build(source);

            for (XdmNode child : document.children()) {
                if (child.getNodeKind() == XdmNodeKind.ELEMENT) {
                    log.debug("Belge ayrıştırıldı: root={}", child.getNodeName());
                    return new SaxonXmlNode(child);
                }
            }
            throw new OscalParseException("No root element found in document");

        } catch (SaxonApiException | SAXException | ParserConfigurationException e) {
            throw new OscalParseException(e.getMessage(), e);
        }
    }

    private static XMLReader newSecureReader() throws ParserConfigurationException, SAXException {
        SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(true);
        // XXE koruma
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return factory.newSAXParser().getXMLReader();
    }
}

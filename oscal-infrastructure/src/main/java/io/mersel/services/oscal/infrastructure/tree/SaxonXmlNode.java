package io.mersel.services.oscal.infrastructure.tree;

import io.mersel.services.oscal.application.interfaces.XmlNode;
import net.sf.saxon.s9api.Axis;
import net.sf.saxon.s9api.QName;
import net.sf.saxon.s9api.XdmNode;
import net.sf.saxon.s9api.XdmNodeKind;
import net.sf.saxon.s9api.XdmSequenceIterator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Saxon {@link XdmNode} üzerinde salt okunur {@link XmlNode} adaptörü.
 * <p>
 * Saxon TinyTree düğümleri değişmezdir; adaptör de durum tutmaz ve
 * birden fazla thread tarafından aynı anda okunabilir.
 * Eşitlik, sarmalanan düğümün kimliğine göredir.
 */
public final class SaxonXmlNode implements XmlNode {

    private final XdmNode node;

    public SaxonXmlNode(XdmNode node) {
        this.node = node;
    }

    /** Sarmalanan Saxon düğümü. */
    public XdmNode unwrap() {
        return node;
    }

    @Override
    public Kind kind() {
        XdmNodeKind nodeKind = node.getNodeKind();
        return switch (nodeKind) {
            case ELEMENT -> Kind.ELEMENT;
            case TEXT -> Kind.TEXT;
            case COMMENT -> Kind.COMMENT;
            default -> Kind.OTHER;
        };
    }

    @Override
    public String name() {
        QName qName = node.getNodeName();
        return qName == null ? "" : lexicalName(qName);
    }

    @Override
    public String localName() {
        QName qName = node.getNodeName();
        return qName == null ? "" : qName.getLocalName();
    }

    @Override
    public String namespaceUri() {
        QName qName = node.getNodeName();
        return qName == null ? "" : qName.getNamespaceURI();
    }

    @Override
    public Optional<String> attribute(String name) {
        if (!isElement()) {
            return Optional.empty();
        }
        return Optional.ofNullable(node.getAttributeValue(new QName(name)));
    }

    @Override
    public Map<String, String> attributes() {
        if (!isElement()) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>();
        XdmSequenceIterator<XdmNode> iterator = node.axisIterator(Axis.ATTRIBUTE);
        while (iterator.hasNext()) {
            XdmNode attr = iterator.next();
            result.put(lexicalName(attr.getNodeName()), attr.getStringValue());
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public List<XmlNode> children() {
        List<XmlNode> result = new ArrayList<>();
        for (XdmNode child : node.children()) {
            result.add(new SaxonXmlNode(child));
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String textContent() {
        return node.getStringValue();
    }

    @Override
    public Optional<XmlNode> parent() {
        XdmNode parent = node.getParent();
        if (parent == null || parent.getNodeKind() == XdmNodeKind.DOCUMENT) {
            return Optional.empty();
        }
        return Optional.of(new SaxonXmlNode(parent));
    }

    @Override
    public boolean isDocumentRoot() {
        XdmNode parent = node.getParent();
        return isElement() && parent != null && parent.getNodeKind() == XdmNodeKind.DOCUMENT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SaxonXmlNode other && node.equals(other.node);
    }

    @Override
    public int hashCode() {
        return node.hashCode();
    }

    @Override
    public String toString() {
        return isElement() ? "<" + name() + ">" : kind().name();
    }

    private static String lexicalName(QName qName) {
        String prefix = qName.getPrefix();
        return prefix == null || prefix.isEmpty() ? qName.getLocalName() : prefix + ":" + qName.getLocalName();
    }
}

package io.mersel.services.oscal.infrastructure.tree;

import io.mersel.services.oscal.application.interfaces.XmlNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * {@link XmlNode} ağacı üzerinde genel gezinme yardımcıları.
 * <p>
 * Tüm eşleştirmeler namespace'siz yerel ada göredir. Namespace parametresi
 * alan varyantlarda {@code null} veya boş namespace, namespace kontrolünü kapatır.
 * Bulunamayan düğümler boş sonuç döner.
 */
public final class XmlNavigator {

    private XmlNavigator() {
    }

    /** Yalnızca element çocuklar, belge sırasıyla. */
    public static List<XmlNode> elements(XmlNode node) {
        return node.children().stream()
                .filter(XmlNode::isElement)
                .toList();
    }

    public static List<XmlNode> children(XmlNode node, String localName) {
        return children(node, localName, null);
    }

    public static List<XmlNode> children(XmlNode node, String localName, String namespaceUri) {
        return node.children().stream()
                .filter(child -> matches(child, localName, namespaceUri))
                .toList();
    }

    public static Optional<XmlNode> firstChild(XmlNode node, String localName) {
        return firstChild(node, localName, null);
    }

    public static Optional<XmlNode> firstChild(XmlNode node, String localName, String namespaceUri) {
        for (XmlNode child : node.children()) {
            if (matches(child, localName, namespaceUri)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * İlk eşleşen çocuğun trim edilmiş metni; çocuk yoksa boş string.
     */
    public static String childText(XmlNode node, String localName) {
        return firstChild(node, localName)
                .map(XmlNavigator::text)
                .orElse("");
    }

    /** Düğümün tüm alt metni, baş/son boşluklar atılmış. */
    public static String text(XmlNode node) {
        return node.textContent().trim();
    }

    /**
     * Düğümün kendisi dahil, belge sırasında (derinlik öncelikli) ilk eşleşen element.
     */
    public static Optional<XmlNode> firstDescendant(XmlNode node, String localName) {
        Deque<XmlNode> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            XmlNode current = stack.pop();
            if (matches(current, localName, null)) {
                return Optional.of(current);
            }
            List<XmlNode> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                if (children.get(i).isElement()) {
                    stack.push(children.get(i));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * {@code <} ve {@code >} karakterlerini siler, geri kalan her şeyi olduğu gibi bırakır.
     * <p>
     * Gerçek bir etiket temizleyici değildir: etiket adları ve aradaki metin korunur,
     * dengesiz köşeli parantezler de tek tek silinir. Tekrar uygulanması sonucu değiştirmez.
     */
    public static String removeTag(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '<' && c != '>') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean matches(XmlNode node, String localName, String namespaceUri) {
        if (!node.isElement() || !node.localName().equals(localName)) {
            return false;
        }
        return namespaceUri == null || namespaceUri.isEmpty() || namespaceUri.equals(node.namespaceUri());
    }
}

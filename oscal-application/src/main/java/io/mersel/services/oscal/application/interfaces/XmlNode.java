package io.mersel.services.oscal.application.interfaces;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Namespace farkında, sıralı ve salt okunur XML ağaç düğümü.
 * <p>
 * Çekirdek (extractor, validator, fingerprint) yalnızca bu arayüzü kullanır;
 * somut XML motoru (Saxon) infrastructure katmanında bu arayüzün arkasında kalır.
 * Böylece çekirdek, bellek içi bir test ağacı ile de çalıştırılabilir.
 * <p>
 * Hiçbir metot yan etki üretmez. Bulunamayan attribute veya çocuk
 * boş sonuç döner, hata fırlatılmaz.
 */
public interface XmlNode {

    /**
     * Düğüm türleri. Belge düğümü ağaçta temsil edilmez; kök element
     * {@link #isDocumentRoot()} ile ayırt edilir.
     */
    enum Kind { ELEMENT, TEXT, COMMENT, OTHER }

    Kind kind();

    default boolean isElement() {
        return kind() == Kind.ELEMENT;
    }

    /**
     * Belgede yazıldığı haliyle nitelikli ad (ör. {@code oscal:metadata}).
     * Element olmayan düğümlerde boş string.
     */
    String name();

    /** Namespace prefix'i olmadan yerel ad. */
    String localName();

    /** Namespace URI; namespace yoksa boş string. */
    String namespaceUri();

    /** Attribute değeri; attribute yoksa boş. */
    Optional<String> attribute(String name);

    /** Belge sırasını koruyan attribute haritası (ad → değer). */
    Map<String, String> attributes();

    /** Tüm çocuk düğümler (text ve comment dahil), belge sırasıyla. */
    List<XmlNode> children();

    /** Tüm alt text düğümlerinin birleştirilmiş içeriği. */
    String textContent();

    /** Ebeveyn element; kök element ve bağımsız düğümler için boş. */
    Optional<XmlNode> parent();

    /** Düğüm belgenin kök elementi mi? */
    boolean isDocumentRoot();
}

package io.mersel.services.oscal.infrastructure.tree;

import io.mersel.services.oscal.application.interfaces.XmlNode;
import io.mersel.services.oscal.infrastructure.SspFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.mersel.services.oscal.infrastructure.tree.InMemoryXmlNode.element;
import static io.mersel.services.oscal.infrastructure.tree.InMemoryXmlNode.text;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * XmlFingerprint birim testleri.
 * <p>
 * Kardeş indeksleri, indeksli/indekssiz yollar, yol bölme ve
 * yeniden ayrıştırılmış belgede yolun tekrar çözümlenmesi.
 */
@DisplayName("XmlFingerprint")
class XmlFingerprintTest {

    @Nested
    @DisplayName("findElementIndex")
    class FindElementIndex {

        @Test
        @DisplayName("Aynı adlı üç kardeş 1, 2, 3 döner")
        void sameNameSiblings() {
            var first = element("item");
            var second = element("item");
            var third = element("item");
            element("root").add(first, text(" "), second, text(" "), third);

            assertThat(XmlFingerprint.findElementIndex(first)).isEqualTo(1);
            assertThat(XmlFingerprint.findElementIndex(second)).isEqualTo(2);
            assertThat(XmlFingerprint.findElementIndex(third)).isEqualTo(3);
        }

        @Test
        @DisplayName("Farklı adlı kardeşler sayılmaz")
        void otherNamesIgnored() {
            var target = element("item");
            element("root").add(element("other"), element("other"), target, element("item"));

            assertThat(XmlFingerprint.findElementIndex(target)).isEqualTo(1);
        }

        @Test
        @DisplayName("Tek çocuk ve kök 1 döner")
        void onlyChildAndRoot() {
            var child = element("child");
            var root = element("root").add(child).asDocumentRoot();

            assertThat(XmlFingerprint.findElementIndex(child)).isEqualTo(1);
            assertThat(XmlFingerprint.findElementIndex(root)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("findXPath / findXPathWithoutIndex")
    class Paths {

        private final InMemoryXmlNode grandchild = element("grandchild").add(text("Value"));
        private final InMemoryXmlNode root = element("root").add(
                element("child"),
                element("child").add(element("grandchild"), grandchild))
                .asDocumentRoot();

        @Test
        @DisplayName("Kökten düğüme kadar tüm adımlar indeksli")
        void indexedPath() {
            assertThat(XmlFingerprint.findXPath(grandchild))
                    .isEqualTo("/root[1]/child[2]/grandchild[2]");
        }

        @Test
        @DisplayName("İndekssiz yol, indeksli yoldan [n] çıkarılmış haline eşittir")
        void pathWithoutIndex() {
            String indexed = XmlFingerprint.findXPath(grandchild);
            String bare = XmlFingerprint.findXPathWithoutIndex(grandchild);

            assertThat(bare).isEqualTo("/root/child/grandchild");
            assertThat(bare).isEqualTo(indexed.replaceAll("\\[\\d+]", ""));
            assertThat(bare).doesNotContain("[").doesNotContain("]");
        }

        @Test
        @DisplayName("Kök için yol tek adımdır")
        void rootPath() {
            assertThat(XmlFingerprint.findXPath(root)).isEqualTo("/root[1]");
        }

        @Test
        @DisplayName("Text düğümü text() adımı ile ifade edilir")
        void textNodePath() {
            XmlNode textNode = grandchild.children().get(0);

            assertThat(XmlFingerprint.findXPath(textNode))
                    .isEqualTo("/root[1]/child[2]/grandchild[2]/text()[1]");
        }
    }

    @Nested
    @DisplayName("components")
    class Components {

        @Test
        @DisplayName("Boş yol boş liste döner")
        void emptyPath() {
            assertThat(XmlFingerprint.components("")).isEmpty();
            assertThat(XmlFingerprint.components(null)).isEmpty();
        }

        @Test
        @DisplayName("Yol soldan sağa adımlarına bölünür")
        void splitsInOrder() {
            assertThat(XmlFingerprint.components("/root/child/grandchild"))
                    .containsExactly("root", "child", "grandchild");
        }

        @Test
        @DisplayName("Boş adımlar atlanır, indeksler korunur")
        void skipsEmptySegments() {
            assertThat(XmlFingerprint.components("root[1]//child[2]/"))
                    .containsExactly("root[1]", "child[2]");
        }
    }

    @Nested
    @DisplayName("Saxon ağacında kararlılık")
    class OnParsedDocument {

        @Test
        @DisplayName("Namespace'li belgede yol tüm ata adlarını içerir")
        void namespacedDocument() {
            XmlNode root = SspFixtures.parse("""
                    <root xmlns="http://csrc.nist.gov/ns/oscal/1.0">
                        <child>
                            <grandchild>Value</grandchild>
                        </child>
                    </root>
                    """);
            XmlNode grandchild = XmlNavigator.firstDescendant(root, "grandchild").orElseThrow();

            assertThat(XmlFingerprint.findXPath(grandchild)).isEqualTo("/root[1]/child[1]/grandchild[1]");
        }

        @Test
        @DisplayName("Yeniden ayrıştırılan belgede aynı yol aynı kontrolü bulur")
        void stableAcrossReparse() {
            XmlNode first = SspFixtures.parse(SspFixtures.SAMPLE_SSP);
            List<XmlNode> requirements = XmlNavigator.children(
                    XmlNavigator.firstChild(first, "control-implementation").orElseThrow(),
                    "implemented-requirement");
            String locator = XmlFingerprint.findXPath(requirements.get(2));

            XmlNode reparsed = SspFixtures.parse(SspFixtures.SAMPLE_SSP);
            XmlNode found = XmlFingerprint.resolve(reparsed, locator).orElseThrow();

            assertThat(locator).isEqualTo(
                    "/system-security-plan[1]/control-implementation[1]/implemented-requirement[3]");
            assertThat(found.attribute("control-id")).contains("ac-2");
            assertThat(XmlFingerprint.findXPath(found)).isEqualTo(locator);
        }

        @Test
        @DisplayName("İndekssiz yol ilk eşleşmeye çözümlenir, olmayan yol boş döner")
        void resolveBareAndMissing() {
            XmlNode root = SspFixtures.parse(SspFixtures.SAMPLE_SSP);

            assertThat(XmlFingerprint.resolve(root,
                    "/system-security-plan/control-implementation/implemented-requirement"))
                    .get()
                    .satisfies(node -> assertThat(node.attribute("control-id")).contains("ac-1"));
            assertThat(XmlFingerprint.resolve(root, "/system-security-plan[1]/metadata[2]")).isEmpty();
            assertThat(XmlFingerprint.resolve(root, "/other-root")).isEmpty();
            assertThat(XmlFingerprint.resolve(root, "")).isEmpty();
        }
    }
}

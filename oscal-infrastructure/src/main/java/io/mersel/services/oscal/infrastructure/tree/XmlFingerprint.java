package io.mersel.services.oscal.infrastructure.tree;

import io.mersel.services.oscal.application.interfaces.XmlNode;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Düğüm konum parmak izleri (locator).
 * <p>
 * Bir düğümün yolunu kökten kendisine kadar {@code /ad[n]} adımlarıyla ifade eder.
 * İndeks, mutlak çocuk konumu değil, aynı adı taşıyan kardeşler arasındaki
 * 1 tabanlı konumdur. Bu sayede yol, değişmemiş bir belgenin yeniden
 * ayrıştırılmasında aynı kalır ve aynı adlı öğeleri birbirinden ayırır.
 * <p>
 * Ad karşılaştırması belgede yazılan nitelikli ada ({@link XmlNode#name()}) göredir.
 * Element olmayan düğümler {@code text()}, {@code comment()} ve {@code node()} adımlarıyla temsil edilir.
 */
public final class XmlFingerprint {

    private static final Pattern SEGMENT = Pattern.compile("^(.+?)(?:\\[(\\d{1,9})])?$");

    private XmlFingerprint() {
    }

    /**
     * Düğümün, ebeveyninin aynı adlı çocukları arasındaki 1 tabanlı konumu.
     * Ebeveyni olmayan düğüm (kök) için 1.
     */
    public static int findElementIndex(XmlNode element) {
        Optional<XmlNode> parent = element.parent();
        if (parent.isEmpty()) {
            return 1;
        }
        String step = stepName(element);
        int index = 0;
        for (XmlNode sibling : parent.get().children()) {
            if (stepName(sibling).equals(step)) {
                index++;
                if (sibling.equals(element)) {
                    return index;
                }
            }
        }
        // Düğüm ebeveyninin çocukları arasında bulunamadı; tek çocuk gibi değerlendir
        return 1;
    }

    /**
     * Kökten düğüme kadar indeksli yol, ör. {@code /system-security-plan[1]/control-implementation[1]/implemented-requirement[3]}.
     */
    public static String findXPath(XmlNode node) {
        return buildPath(node, true);
    }

    /**
     * {@link #findXPath(XmlNode)} ile aynı yol, {@code [n]} indeksleri olmadan.
     */
    public static String findXPathWithoutIndex(XmlNode node) {
        return buildPath(node, false);
    }

    /**
     * Yolu soldan sağa boş olmayan adımlarına böler. Boş girdi boş liste döner.
     */
    public static List<String> components(String xpath) {
        if (xpath == null || xpath.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(xpath.split("/"))
                .filter(segment -> !segment.isEmpty())
                .toList();
    }

    /**
     * {@link #findXPath(XmlNode)} veya {@link #findXPathWithoutIndex(XmlNode)} ile üretilmiş
     * bir yolu verilen kök altında yeniden çözümler. İndeksi olmayan adım 1 kabul edilir.
     *
     * @return yolun işaret ettiği düğüm; eşleşme yoksa boş
     */
    public static Optional<XmlNode> resolve(XmlNode root, String xpath) {
        List<String> segments = components(xpath);
        if (segments.isEmpty()) {
            return Optional.empty();
        }

        Step first = Step.parse(segments.get(0));
        if (first == null || !first.name().equals(stepName(root)) || first.index() != 1) {
            return Optional.empty();
        }

        XmlNode current = root;
        for (String segment : segments.subList(1, segments.size())) {
            Step step = Step.parse(segment);
            if (step == null) {
                return Optional.empty();
            }
            XmlNode next = null;
            int seen = 0;
            for (XmlNode child : current.children()) {
                if (stepName(child).equals(step.name()) && ++seen == step.index()) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return Optional.empty();
            }
            current = next;
        }
        return Optional.of(current);
    }

    private static String buildPath(XmlNode node, boolean withIndex) {
        Deque<String> segments = new ArrayDeque<>();
        XmlNode current = node;
        while (current != null) {
            String segment = stepName(current);
            if (withIndex) {
                segment = segment + "[" + findElementIndex(current) + "]";
            }
            segments.addFirst(segment);
            current = current.parent().orElse(null);
        }
        return "/" + String.join("/", segments);
    }

    private static String stepName(XmlNode node) {
        return switch (node.kind()) {
            case ELEMENT -> node.name();
            case TEXT -> "text()";
            case COMMENT -> "comment()";
            case OTHER -> "node()";
        };
    }

    private record Step(String name, int index) {

        static Step parse(String segment) {
            Matcher matcher = SEGMENT.matcher(segment);
            if (!matcher.matches()) {
                return null;
            }
            int index = matcher.group(2) == null ? 1 : Integer.parseInt(matcher.group(2));
            return new Step(matcher.group(1), index);
        }
    }
}

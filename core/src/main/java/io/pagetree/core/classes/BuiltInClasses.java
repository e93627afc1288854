package io.pagetree.core.classes;

import java.util.List;
import java.util.Map;

/**
 * Classes the page builder adds to elements of a given type on its own, and the prefixes that
 * mark a class name as builder-owned rather than user-authored.
 */
public final class BuiltInClasses {

    /** Class name prefixes reserved by the builders. */
    public static final List<String> PREFIXES = List.of("bde-", "breakdance-", "ee-", "oxy-");

    private static final Map<String, List<String>> BY_TYPE = Map.ofEntries(
            Map.entry("EssentialElements\\Section", List.of("bde-section")),
            Map.entry("EssentialElements\\Container", List.of("bde-container")),
            Map.entry("EssentialElements\\Div", List.of("bde-div")),
            Map.entry("EssentialElements\\Columns", List.of("bde-columns")),
            Map.entry("EssentialElements\\Column", List.of("bde-column")),
            Map.entry("EssentialElements\\Heading", List.of("bde-heading")),
            Map.entry("EssentialElements\\Text", List.of("bde-text")),
            Map.entry("EssentialElements\\RichText", List.of("bde-rich-text")),
            Map.entry("EssentialElements\\Button", List.of("bde-button")),
            Map.entry("EssentialElements\\ButtonV2", List.of("bde-button")),
            Map.entry("EssentialElements\\Image", List.of("bde-image")),
            Map.entry("EssentialElements\\Image2", List.of("bde-image2")),
            Map.entry("EssentialElements\\Icon", List.of("bde-icon")),
            Map.entry("EssentialElements\\IconBox", List.of("bde-icon-box")),
            Map.entry("EssentialElements\\Link", List.of("bde-link")),
            Map.entry("EssentialElements\\LinkWrapper", List.of("bde-link-wrapper")),
            Map.entry("EssentialElements\\Video", List.of("bde-video")),
            Map.entry("EssentialElements\\WpMenu", List.of("bde-wp-menu", "breakdance-menu")),
            Map.entry("EssentialElements\\MenuBuilder", List.of("bde-menu-builder", "breakdance-menu")),
            Map.entry("EssentialElements\\HeaderBuilder", List.of("bde-header-builder")),
            Map.entry("EssentialElements\\FooterBuilder", List.of("bde-footer-builder")),
            Map.entry("EssentialElements\\Tabs", List.of("bde-tabs")),
            Map.entry("EssentialElements\\Accordion", List.of("bde-accordion")),
            Map.entry("EssentialElements\\FormBuilder", List.of("bde-form-builder", "breakdance-form")),
            Map.entry("OxygenElements\\Container", List.of("oxy-container")),
            Map.entry("OxygenElements\\Section", List.of("oxy-section")),
            Map.entry("OxygenElements\\Div", List.of("oxy-div")),
            Map.entry("OxygenElements\\Text", List.of("oxy-text")),
            Map.entry("OxygenElements\\TextLink", List.of("oxy-text-link")),
            Map.entry("OxygenElements\\RichText", List.of("oxy-rich-text")),
            Map.entry("OxygenElements\\Image", List.of("oxy-image")),
            Map.entry("OxygenElements\\Video", List.of("oxy-video")),
            Map.entry("OxygenElements\\Icon", List.of("oxy-icon")));

    private BuiltInClasses() {}

    /** Classes implied by {@code type}; empty for unknown or null types. */
    public static List<String> forType(String type) {
        if (type == null) {
            return List.of();
        }
        return BY_TYPE.getOrDefault(type, List.of());
    }

    /** {@code true} if {@code className} carries a builder-reserved prefix. */
    public static boolean isBuiltIn(String className) {
        return className != null && PREFIXES.stream().anyMatch(className::startsWith);
    }
}

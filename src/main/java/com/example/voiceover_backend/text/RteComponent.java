package com.example.voiceover_backend.text;

/**
 * Custom rich-text components that may appear in lesson HTML, and how each one is voiced.
 */
public enum RteComponent {
    COLLAPSIBLE("oppia-noninteractive-collapsible", Voicing.SILENT),
    IMAGE("oppia-noninteractive-image", Voicing.SILENT),
    LINK("oppia-noninteractive-link", Voicing.TEXT_ATTRIBUTE),
    MATH("oppia-noninteractive-math", Voicing.MATH_ATTRIBUTE),
    VIDEO("oppia-noninteractive-video", Voicing.SILENT),
    SKILL_REVIEW("oppia-noninteractive-skillreview", Voicing.TEXT_ATTRIBUTE),
    TABS("oppia-noninteractive-tabs", Voicing.SILENT);

    public enum Voicing {
        /** Read the JSON string in {@code text-with-value}. */
        TEXT_ATTRIBUTE,
        /** Read {@code raw_latex} of the JSON object in {@code math_content-with-value}. */
        MATH_ATTRIBUTE,
        /** Attributes are never voiced. */
        SILENT
    }

    public static final String TEXT_ATTRIBUTE_NAME = "text-with-value";
    public static final String MATH_ATTRIBUTE_NAME = "math_content-with-value";

    private final String tagName;
    private final Voicing voicing;

    RteComponent(String tagName, Voicing voicing) {
        this.tagName = tagName;
        this.voicing = voicing;
    }

    public String tagName() {
        return tagName;
    }

    public Voicing voicing() {
        return voicing;
    }
}

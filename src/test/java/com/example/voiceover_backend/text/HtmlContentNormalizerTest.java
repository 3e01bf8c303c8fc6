package com.example.voiceover_backend.text;

import org.jsoup.nodes.Entities;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlContentNormalizerTest {

    private final HtmlContentNormalizer normalizer = new HtmlContentNormalizer();

    @Test
    void joinsParagraphsWithDelimiter() {
        assertThat(normalizer.normalize("<p>Hello</p><p>World</p>")).isEqualTo("Hello; World");
    }

    @Test
    void nestedInlineMarkupYieldsSeparateSegments() {
        assertThat(normalizer.normalize("<p>The <b>quick</b> fox</p>")).isEqualTo("The; quick; fox");
    }

    @Test
    void dropsWhitespaceOnlyAndNoBreakSpaceSegments() {
        String html = "<p>  First  </p>\n<p>&nbsp;</p>\n<p>\u00a0Second\u00a0</p>";
        assertThat(normalizer.normalize(html)).isEqualTo("First; Second");
    }

    @Test
    void linkIsVoicedWithItsDecodedText() {
        String html = "<p>Read <oppia-noninteractive-link text-with-value=\"&amp;quot;this article&amp;quot;\" "
                + "url-with-value=\"&amp;quot;https://example.com&amp;quot;\"></oppia-noninteractive-link> first.</p>";
        assertThat(normalizer.normalize(html)).isEqualTo("Read; this article; first.");
    }

    @Test
    void skillReviewIsVoicedWithItsDecodedText() {
        String html = "<oppia-noninteractive-skillreview skill_id-with-value=\"&amp;quot;abc&amp;quot;\" "
                + "text-with-value=\"&amp;quot;fractions&amp;quot;\"></oppia-noninteractive-skillreview>";
        assertThat(normalizer.normalize(html)).isEqualTo("fractions");
    }

    @Test
    void mathIsVoicedFromRawLatex() {
        String html = "<p>Half is <oppia-noninteractive-math math_content-with-value=\""
                + "{&amp;quot;raw_latex&amp;quot;:&amp;quot;\\\\frac{1}{2}&amp;quot;,"
                + "&amp;quot;svg_filename&amp;quot;:&amp;quot;&amp;quot;}\"></oppia-noninteractive-math></p>";
        assertThat(normalizer.normalize(html)).isEqualTo("Half is; 1/2");
    }

    @Test
    void imageAttributesAreNeverVoiced() {
        String html = "<p>Look:</p><oppia-noninteractive-image alt-with-value=\"&amp;quot;a cat&amp;quot;\" "
                + "caption-with-value=\"&amp;quot;My cat&amp;quot;\"></oppia-noninteractive-image><p>Nice.</p>";
        assertThat(normalizer.normalize(html)).isEqualTo("Look:; Nice.");
    }

    @Test
    void undecodableAttributeDegradesToEmptyText() {
        String html = "<p>Before</p><oppia-noninteractive-link text-with-value=\"not json\"></oppia-noninteractive-link>"
                + "<p>After</p>";
        assertThat(normalizer.normalize(html)).isEqualTo("Before; After");
    }

    @Test
    void malformedMarkupDoesNotThrow() {
        assertThat(normalizer.normalize("<p>Unclosed <b>bold")).isEqualTo("Unclosed; bold");
        assertThat(normalizer.normalize("<p><oppia-noninteractive-math></oppia-noninteractive-math>x</p>")).isEqualTo("x");
    }

    @Test
    void nullAndBlankInputGiveEmptyText() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize("   ")).isEmpty();
    }

    @Test
    void normalizationIsIdempotentOnItsOwnOutput() {
        String html = "<p>A &lt; B</p><p>x &amp; y</p><oppia-noninteractive-link "
                + "text-with-value=\"&amp;quot;link&amp;quot;\"></oppia-noninteractive-link>";
        String once = normalizer.normalize(html);
        String twice = normalizer.normalize("<p>" + Entities.escape(once) + "</p>");

        assertThat(once).isEqualTo("A < B; x & y; link");
        assertThat(twice).isEqualTo(once);
    }

    @Test
    void stripWhitespaceHandlesUnicodeSpaces() {
        assertThat(HtmlContentNormalizer.stripWhitespace("\u2003 text\u00a0\t")).isEqualTo("text");
    }

    @Test
    void selfClosingLinkWithSingleEscapedAttribute() {
        String html = "<p><oppia-noninteractive-link text-with-value=\"&quot;Oppia official website URL&quot;\" "
                + "url-with-value=\"&quot;https://www.oppia.org/&quot;\"/></p>";
        assertThat(normalizer.normalize(html)).isEqualTo("Oppia official website URL");
    }

    @Test
    void arithmeticSymbolsAndInnerSpacingSurvive() {
        String html = "\u003cp\u003eEvaluate the expression  4 \u00d7 (3-2) + 6 \u00f7 2.\u003c/p\u003e";
        assertThat(normalizer.normalize(html)).isEqualTo("Evaluate the expression  4 × (3-2) + 6 ÷ 2.");
    }

    @Test
    void listsAndSkillReviewAcrossBlocks() {
        String html = "<p>Hello world</p>\n\n<p><em>Italics text</em></p>\n\n<p>"
                + "Bullet list heading</p>\n\n<ul>\n\t<li>Bullet list item 1</li>\n"
                + "\t<li>\n\t<p>Bullet list item 2</p>\n\t</li>\n</ul>\n\n<p>"
                + "<oppia-noninteractive-skillreview ng-version=\"11.2.14\" "
                + "skill_id-with-value=\"&amp;quot;CjO0L1DTZRwv&amp;quot;\" "
                + "text-with-value=\"&amp;quot;concept card&amp;quot;\">"
                + "</oppia-noninteractive-skillreview></p>";
        assertThat(normalizer.normalize(html)).isEqualTo("Hello world; Italics text; Bullet list heading; "
                + "Bullet list item 1; Bullet list item 2; concept card");
    }

    @Test
    void deeplyNestedLatexDoesNotBreakNormalization() {
        String html = "<p>Intro</p><oppia-noninteractive-math math_content-with-value=\"{&quot;raw_latex&quot;:&quot;"
                + "{".repeat(20_000) + "x&quot;}\"></oppia-noninteractive-math>";
        assertThat(normalizer.normalize(html)).isEqualTo("Intro; x");
    }
}

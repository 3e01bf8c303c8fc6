package com.example.voiceover_backend.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SsmlContentBuilderTest {

    @Test
    void detectsArithmetic() {
        assertThat(SsmlContentBuilder.isMathematicalText("2 + 2 = 4")).isTrue();
        assertThat(SsmlContentBuilder.isMathematicalText("5 - 3")).isTrue();
        assertThat(SsmlContentBuilder.isMathematicalText("3 × 4")).isTrue();
        assertThat(SsmlContentBuilder.isMathematicalText("1/2")).isFalse();
        assertThat(SsmlContentBuilder.isMathematicalText("well-known facts")).isFalse();
        assertThat(SsmlContentBuilder.isMathematicalText("Hello there")).isFalse();
    }

    @Test
    void buildsOneBlockPerSegment() {
        String ssml = SsmlContentBuilder.build("Add the numbers; 2 + 3 = 5", "en-US", "en-US-JennyNeural");

        assertThat(ssml).startsWith("<speak version=\"1.0\" xmlns=\"http://www.w3.org/2001/10/synthesis\" xml:lang=\"en-US\">");
        assertThat(ssml).contains("<voice name=\"en-US-JennyNeural\">");
        assertThat(ssml).containsSubsequence("<p>", "Add the numbers", "</p>",
                "<say-as interpret-as=\"math\">", "2 + 3 = 5", "</say-as>");
        assertThat(ssml.strip()).endsWith("</speak>");
    }

    @Test
    void escapesSegmentText() {
        String ssml = SsmlContentBuilder.build("A < B & \"C\"", "en-US", "en-US-JennyNeural");

        assertThat(ssml).contains("A &lt; B &amp; &quot;C&quot;");
        assertThat(ssml).doesNotContain("A < B");
    }
}

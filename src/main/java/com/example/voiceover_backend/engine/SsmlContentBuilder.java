package com.example.voiceover_backend.engine;

import com.example.voiceover_backend.text.HtmlContentNormalizer;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns normalized lesson text into SSML for Azure text-to-speech. Every content block becomes its
 * own SSML block; blocks containing arithmetic are read as math.
 */
public final class SsmlContentBuilder {
    private static final String SSML_TEMPLATE = """
            <speak version="1.0" xmlns="http://www.w3.org/2001/10/synthesis" xml:lang="%s">
                <voice name="%s">
            %s    </voice>
            </speak>
            """;
    private static final String MATH_BLOCK = """
                    <say-as interpret-as="math">
                        %s
                    </say-as>
            """;
    private static final String PROSE_BLOCK = """
                    <p>
                        %s
                    </p>
            """;

    // " - " and " / " need surrounding spaces so hyphenated words and dates stay prose.
    static final List<String> ARITHMETIC_EXPRESSIONS = List.of("+", " - ", "*", " / ", "×", "÷");

    private static final Pattern BLOCK_SPLITTER = Pattern.compile(Pattern.quote(HtmlContentNormalizer.CONTENT_DELIMITER));

    private SsmlContentBuilder() {}

    public static boolean isMathematicalText(String text) {
        if (text == null) return false;
        for (String expression : ARITHMETIC_EXPRESSIONS) {
            if (text.contains(expression)) return true;
        }
        return false;
    }

    public static String build(String plaintext, String languageAccentCode, String voiceCode) {
        StringBuilder body = new StringBuilder();
        for (String block : BLOCK_SPLITTER.split(plaintext == null ? "" : plaintext, -1)) {
            String template = isMathematicalText(block) ? MATH_BLOCK : PROSE_BLOCK;
            body.append(template.formatted(escapeXml(block)));
        }
        return SSML_TEMPLATE.formatted(escapeXml(languageAccentCode), escapeXml(voiceCode), body);
    }

    static String escapeXml(String value) {
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;");
    }
}

package com.example.voiceover_backend.text;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens lesson HTML into the plain text that gets voiced. Content blocks are joined with
 * {@link #CONTENT_DELIMITER}; custom components are voiced according to {@link RteComponent}.
 * Never throws: markup that cannot be interpreted contributes no text.
 */
@Component
public class HtmlContentNormalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(HtmlContentNormalizer.class);
    public static final String CONTENT_DELIMITER = "; ";

    private final ObjectMapper om = new ObjectMapper();

    public String normalize(String html) {
        if (html == null || html.isBlank()) return "";

        Document doc = Jsoup.parseBodyFragment(html);
        for (RteComponent component : RteComponent.values()) {
            for (Element element : doc.body().getElementsByTag(component.tagName())) {
                convertToParagraph(element, component);
            }
        }

        List<String> segments = new ArrayList<>();
        doc.body().traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                String segment = stripWhitespace(textNode.getWholeText());
                if (!segment.isEmpty()) segments.add(segment);
            }
        });
        return String.join(CONTENT_DELIMITER, segments);
    }

    private void convertToParagraph(Element element, RteComponent component) {
        switch (component.voicing()) {
            case TEXT_ATTRIBUTE -> element.text(readTextAttribute(element));
            case MATH_ATTRIBUTE -> element.text(LatexToTextConverter.toText(readRawLatex(element)));
            case SILENT -> { }
        }
        element.tagName("p");
    }

    private String readTextAttribute(Element element) {
        String raw = unescape(element.attr(RteComponent.TEXT_ATTRIBUTE_NAME));
        if (raw.isBlank()) return "";
        try {
            JsonNode value = om.readTree(raw);
            return value == null || value.isNull() ? "" : value.asText("");
        } catch (JsonProcessingException e) {
            LOGGER.debug("Unreadable {} on <{}> value='{}'", RteComponent.TEXT_ATTRIBUTE_NAME, element.tagName(), raw);
            return "";
        }
    }

    private String readRawLatex(Element element) {
        String raw = unescape(element.attr(RteComponent.MATH_ATTRIBUTE_NAME));
        if (raw.isBlank()) return "";
        try {
            JsonNode mathContent = om.readTree(raw);
            return mathContent == null ? "" : mathContent.path("raw_latex").asText("");
        } catch (JsonProcessingException e) {
            LOGGER.debug("Unreadable {} on <{}> value='{}'", RteComponent.MATH_ATTRIBUTE_NAME, element.tagName(), raw);
            return "";
        }
    }

    // Attribute values arrive HTML-escaped once more than the parser undoes.
    private static String unescape(String value) {
        return value == null ? "" : Parser.unescapeEntities(value, true);
    }

    static String stripWhitespace(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isSpace(value.charAt(start))) start++;
        while (end > start && isSpace(value.charAt(end - 1))) end--;
        return value.substring(start, end);
    }

    private static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }
}

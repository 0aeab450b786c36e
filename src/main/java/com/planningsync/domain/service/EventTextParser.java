package com.planningsync.domain.service;

import com.planningsync.domain.model.EventRecord;
import com.planningsync.domain.model.ScrapeException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the rich-text blob of an event block into labeled fields.
 *
 * The blob is a bold title followed by {@code <br>}-separated lines. Lines are
 * labeled by position:
 * <pre>
 *   0        course (the bold title)
 *   1        room
 *   2        instructor
 *   3..n-2   group tags, zero or more
 *   n-1      notes
 * </pre>
 * Blank lines, such as the residue left before the closing tag, are dropped.
 */
public class EventTextParser {

    static final int MIN_SEGMENTS = 4;

    private static final String TEXT_CONTAINER = "div.eventText";

    public EventRecord parse(String textBlob) throws ScrapeException {
        if (textBlob == null || textBlob.isBlank()) {
            throw ScrapeException.malformedEventText("Empty event text");
        }

        Element body = Jsoup.parseBodyFragment(textBlob).body();
        Element root = body.selectFirst(TEXT_CONTAINER);
        if (root == null) {
            root = body;
        }

        Element title = root.selectFirst("b");
        if (title == null) {
            throw ScrapeException.malformedEventText("Event text has no bold title");
        }

        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        collectSegments(root, segments, current);
        flush(segments, current);

        if (segments.size() < MIN_SEGMENTS) {
            throw ScrapeException.malformedEventText(String.format(
                "Expected at least %d lines (course, room, instructor, notes) but found %d",
                MIN_SEGMENTS, segments.size()));
        }

        String course = normalize(title.text());
        if (!segments.get(0).equals(course)) {
            throw ScrapeException.malformedEventText(
                "Bold title '" + course + "' is not the first line");
        }

        int last = segments.size() - 1;
        return new EventRecord(
            course,
            segments.get(1),
            segments.get(2),
            segments.subList(3, last),
            segments.get(last)
        );
    }

    private void collectSegments(Element element, List<String> segments, StringBuilder current) {
        for (Node node : element.childNodes()) {
            if (node instanceof TextNode) {
                current.append(((TextNode) node).getWholeText());
            } else if (node instanceof Element) {
                Element child = (Element) node;
                if ("br".equals(child.normalName())) {
                    flush(segments, current);
                } else {
                    collectSegments(child, segments, current);
                }
            }
        }
    }

    private void flush(List<String> segments, StringBuilder current) {
        String segment = normalize(current.toString());
        if (!segment.isEmpty()) {
            segments.add(segment);
        }
        current.setLength(0);
    }

    private static String normalize(String text) {
        return text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }
}

package com.planningsync.infrastructure.publisher;

import com.planningsync.domain.model.AssembledCalendar;
import com.planningsync.domain.model.CalendarEvent;
import com.planningsync.domain.ports.CalendarPublisher;
import com.planningsync.infrastructure.config.TimetableProperties;
import com.planningsync.infrastructure.persistence.NormalizationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * iCalendar publisher. Writes one VEVENT per event to an .ics file.
 *
 * Decoded start times already carry the page's timezone correction, so they
 * are written as UTC date-times.
 */
@Component
@ConditionalOnProperty(prefix = "timetable", name = "ics-enabled", havingValue = "true", matchIfMissing = true)
public class IcsCalendarPublisher implements CalendarPublisher {

    private static final Logger logger = LoggerFactory.getLogger(IcsCalendarPublisher.class);

    private static final String PUBLISHER_NAME = "ics";
    private static final String PROD_ID = "-//PlanningSync//Timetable//FR";
    private static final String UID_DOMAIN = "@planningsync";
    private static final int MAX_LINE_OCTETS = 75;
    private static final DateTimeFormatter UTC_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");

    private final Path outputPath;

    @Autowired
    public IcsCalendarPublisher(TimetableProperties properties) {
        this(Paths.get(properties.getIcsOutputPath()));
    }

    public IcsCalendarPublisher(Path outputPath) {
        this.outputPath = outputPath;
    }

    @Override
    public String getPublisherName() {
        return PUBLISHER_NAME;
    }

    @Override
    public int publish(AssembledCalendar calendar) throws IOException {
        logger.info("Writing {} events to {}", calendar.size(), outputPath);

        String ics = render(calendar);

        Path absolute = outputPath.toAbsolutePath();
        Path directory = absolute.getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }
        Path temp = Files.createTempFile(directory, "planning", ".ics.tmp");
        try {
            Files.writeString(temp, ics, StandardCharsets.UTF_8);
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }

        return calendar.size();
    }

    String render(AssembledCalendar calendar) {
        String stamp = formatUtc(LocalDateTime.ofInstant(calendar.assembledAt(), ZoneOffset.UTC));
        StringBuilder sb = new StringBuilder(16_384);

        line(sb, "BEGIN:VCALENDAR");
        line(sb, "VERSION:2.0");
        line(sb, "PRODID:" + PROD_ID);
        line(sb, "CALSCALE:GREGORIAN");
        line(sb, "METHOD:PUBLISH");

        for (CalendarEvent event : calendar.events()) {
            line(sb, "BEGIN:VEVENT");
            line(sb, "UID:" + NormalizationUtils.generateNormalizedId(event) + UID_DOMAIN);
            line(sb, "DTSTAMP:" + stamp);
            line(sb, "DTSTART:" + formatUtc(event.start()));
            line(sb, "DTEND:" + formatUtc(event.end()));
            line(sb, "SUMMARY:" + escape(event.course()));
            if (event.room() != null && !event.room().isBlank()) {
                line(sb, "LOCATION:" + escape(event.room()));
            }
            line(sb, "DESCRIPTION:" + escape(describe(event)));
            line(sb, "END:VEVENT");
        }

        line(sb, "END:VCALENDAR");
        return sb.toString();
    }

    private static String describe(CalendarEvent event) {
        StringBuilder description = new StringBuilder();
        description.append(event.instructor());
        if (!event.groups().isEmpty()) {
            description.append('\n').append(String.join(", ", event.groups()));
        }
        if (event.notes() != null && !event.notes().isBlank()) {
            description.append('\n').append(event.notes());
        }
        return description.toString();
    }

    /**
     * Appends a content line, folded so no physical line exceeds 75 octets.
     */
    private static void line(StringBuilder sb, String content) {
        int octets = 0;
        for (int i = 0; i < content.length(); ) {
            int codePoint = content.codePointAt(i);
            int width = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (octets + width > MAX_LINE_OCTETS) {
                sb.append("\r\n ");
                octets = 1;
            }
            sb.appendCodePoint(codePoint);
            octets += width;
            i += Character.charCount(codePoint);
        }
        sb.append("\r\n");
    }

    private static String escape(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\")
            .replace(";", "\\;")
            .replace(",", "\\,")
            .replace("\r\n", "\\n")
            .replace("\n", "\\n");
    }

    private static String formatUtc(LocalDateTime utc) {
        return utc.format(UTC_FORMATTER);
    }
}

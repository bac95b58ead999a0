package io.github.riemr.pm.application.export;

import io.github.riemr.pm.domain.model.ScheduledAssignment;
import io.github.riemr.pm.domain.model.SchedulingResult;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.Writer;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * iCalendar (RFC 5545) 形式で1割当1イベントを出力する。日時はタイムゾーンなしのローカル時刻。
 * 長い行は RFC 5545 3.1 に従って折り返す。
 */
@Component
public class ScheduleIcsExporter {

    private static final String CRLF = "\r\n";
    private static final int MAX_LINE_OCTETS = 75;
    private static final DateTimeFormatter LOCAL = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");
    private static final DateTimeFormatter UTC = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");

    private final Clock clock;

    public ScheduleIcsExporter(Clock clock) {
        this.clock = clock;
    }

    public void write(SchedulingResult result, Writer out) {
        PrintWriter writer = new PrintWriter(out);
        String stamp = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC).format(UTC);

        line(writer, "BEGIN:VCALENDAR");
        line(writer, "VERSION:2.0");
        line(writer, "PRODID:-//pm-scheduler//PM Task Schedule//EN");
        List<ScheduledAssignment> assignments = result.getAssignments();
        for (int i = 0; i < assignments.size(); i++) {
            ScheduledAssignment a = assignments.get(i);
            line(writer, "BEGIN:VEVENT");
            line(writer, "UID:" + (i + 1) + "-" + a.getStartTime().format(LOCAL) + "@pm-scheduler");
            line(writer, "DTSTAMP:" + stamp);
            line(writer, "DTSTART:" + a.getStartTime().format(LOCAL));
            line(writer, "DTEND:" + a.getEndTime().format(LOCAL));
            line(writer, "SUMMARY:" + escapeText("PM Task: " + nullToEmpty(a.getDescription())));
            line(writer, "DESCRIPTION:" + escapeText("System: " + nullToEmpty(a.getSystem())
                    + "\nDuration: " + a.getDurationMinutes() + " minutes"));
            line(writer, "END:VEVENT");
        }
        line(writer, "END:VCALENDAR");
        writer.flush();
    }

    /**
     * 1行 75 オクテット（UTF-8）を超える場合は CRLF + 空白で折り返す。マルチバイト文字の途中では切らない。
     */
    static void line(PrintWriter writer, String content) {
        int octets = 0;
        for (int i = 0; i < content.length(); ) {
            int cp = content.codePointAt(i);
            int len = utf8Length(cp);
            if (octets + len > MAX_LINE_OCTETS) {
                writer.print(CRLF);
                writer.print(' ');
                octets = 1;
            }
            writer.print(Character.toChars(cp));
            octets += len;
            i += Character.charCount(cp);
        }
        writer.print(CRLF);
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) return 1;
        if (codePoint < 0x800) return 2;
        if (codePoint < 0x10000) return 3;
        return 4;
    }

    static String escapeText(String value) {
        return value.replace("\\", "\\\\")
                .replace(";", "\\;")
                .replace(",", "\\,")
                .replace("\r\n", "\\n")
                .replace("\n", "\\n");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}

package io.github.riemr.pm.application.export;

import io.github.riemr.pm.domain.model.ScheduledAssignment;
import io.github.riemr.pm.domain.model.SchedulingResult;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.Writer;
import java.time.format.DateTimeFormatter;

/**
 * 割当リストを1行1割当の CSV に書き出す。
 */
@Component
public class ScheduleCsvExporter {

    static final String HEADER = "Date,Task,Start,Finish,System,Duration (mins),Page Number";
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public void write(SchedulingResult result, Writer out) {
        PrintWriter writer = new PrintWriter(out);
        writer.println(HEADER);
        for (ScheduledAssignment a : result.getAssignments()) {
            String line = String.join(",",
                a.getDate().toString(),
                escape(a.getDescription()),
                a.getStartTime().format(TS),
                a.getEndTime().format(TS),
                escape(a.getSystem()),
                Integer.toString(a.getDurationMinutes()),
                escape(a.getReferencePage() != null ? a.getReferencePage() : "N/A")
            );
            writer.println(line);
        }
        writer.flush();
    }

    static String escape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}

package domain.render;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Reparses "21 de julio de 2025" into an ISO date. */
final class SpanishDates {

    private static final Pattern LONG_FORM = Pattern.compile("(\\d{1,2}) de ([a-z]+) de (\\d{4})");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("enero", 1),
            Map.entry("febrero", 2),
            Map.entry("marzo", 3),
            Map.entry("abril", 4),
            Map.entry("mayo", 5),
            Map.entry("junio", 6),
            Map.entry("julio", 7),
            Map.entry("agosto", 8),
            Map.entry("septiembre", 9),
            Map.entry("setiembre", 9),
            Map.entry("octubre", 10),
            Map.entry("noviembre", 11),
            Map.entry("diciembre", 12)
    );

    private SpanishDates() {
    }

    /** @return the ISO form (yyyy-MM-dd), or null when the text is not a valid calendar date */
    static String toIso(String text) {
        if (text == null) return null;
        Matcher m = LONG_FORM.matcher(text.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) return null;

        Integer month = MONTHS.get(m.group(2));
        if (month == null) return null;

        try {
            return LocalDate.of(Integer.parseInt(m.group(3)), month, Integer.parseInt(m.group(1))).toString();
        } catch (DateTimeException e) {
            return null;
        }
    }
}

package org.nowstart.fundnav.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundnav.data.dto.MfApiSchemeResponse;
import org.nowstart.fundnav.data.dto.NavPoint;
import org.springframework.stereotype.Component;

/**
 * Turns raw NAV feeds into {@link NavPoint}s.
 *
 * <p>The bulk feed is a semicolon-separated text file with one scheme per line:
 * {@code code;isin-growth;isin-reinvest;name;nav;DD-Mon-YYYY}. Header lines, AMC section titles
 * and blank lines carry fewer fields and are skipped along with any row whose code, value or date
 * does not parse. Parsing never fails as a whole because of a bad row.
 */
@Slf4j
@Component
public class NavFeedParser {

    private static final String FIELD_DELIMITER = ";";
    private static final int REQUIRED_FIELDS = 6;
    private static final int SCHEME_CODE_INDEX = 0;
    private static final int NAV_INDEX = 4;
    private static final int DATE_INDEX = 5;

    private static final Pattern SCHEME_CODE = Pattern.compile("\\d+");
    private static final Pattern DAY = Pattern.compile("\\d{1,2}");
    private static final Pattern YEAR = Pattern.compile("\\d{4}");
    private static final Set<String> UNAVAILABLE_NAV = Set.of("N.A.", "NA", "-", "");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1),
            Map.entry("feb", 2),
            Map.entry("mar", 3),
            Map.entry("apr", 4),
            Map.entry("may", 5),
            Map.entry("jun", 6),
            Map.entry("jul", 7),
            Map.entry("aug", 8),
            Map.entry("sep", 9),
            Map.entry("oct", 10),
            Map.entry("nov", 11),
            Map.entry("dec", 12)
    );

    public Stream<NavPoint> parse(String rawFeed) {
        if (rawFeed == null || rawFeed.isEmpty()) {
            return Stream.empty();
        }
        return parseLines(rawFeed.lines());
    }

    /**
     * Lazily parses a bulk feed read from {@code reader}. The stream reads the reader on demand
     * and can be consumed only once.
     */
    public Stream<NavPoint> parse(Reader reader) {
        BufferedReader buffered = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        return parseLines(buffered.lines()).onClose(() -> closeReader(buffered));
    }

    public Stream<NavPoint> parseLines(Stream<String> lines) {
        return lines
                .map(this::parseBulkLine)
                .filter(Objects::nonNull);
    }

    /**
     * Parses a per-scheme history document. Rows use {@code DD-MM-YYYY} dates and are attributed
     * to {@code schemeCode} regardless of what the document metadata says.
     */
    public Stream<NavPoint> parseSingle(String schemeCode, MfApiSchemeResponse document) {
        if (schemeCode == null || schemeCode.isBlank() || document == null || document.data() == null) {
            return Stream.empty();
        }

        String code = schemeCode.trim();
        List<MfApiSchemeResponse.NavRow> rows = document.data();
        return rows.stream()
                .filter(Objects::nonNull)
                .map(row -> toNavPoint(code, row))
                .filter(Objects::nonNull);
    }

    NavPoint parseBulkLine(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }

        String[] fields = line.split(FIELD_DELIMITER, -1);
        if (fields.length < REQUIRED_FIELDS) {
            return null;
        }

        String schemeCode = fields[SCHEME_CODE_INDEX].trim();
        if (!SCHEME_CODE.matcher(schemeCode).matches()) {
            return null;
        }

        BigDecimal value = parseNavValue(fields[NAV_INDEX]);
        if (value == null) {
            log.debug("Dropping bulk NAV row without usable value. scheme_code={} raw={}", schemeCode, fields[NAV_INDEX]);
            return null;
        }

        LocalDate date = parseFeedDate(fields[DATE_INDEX]);
        if (date == null) {
            log.debug("Dropping bulk NAV row with invalid date. scheme_code={} raw={}", schemeCode, fields[DATE_INDEX]);
            return null;
        }

        return new NavPoint(schemeCode, date, value);
    }

    /**
     * Parses {@code DD-Mon-YYYY}. The month abbreviation is matched ignoring case and a single
     * digit day is accepted. Returns null for anything else, including impossible dates.
     */
    LocalDate parseFeedDate(String raw) {
        if (raw == null) {
            return null;
        }

        String[] parts = raw.trim().split("-");
        if (parts.length != 3 || !DAY.matcher(parts[0]).matches() || !YEAR.matcher(parts[2]).matches()) {
            return null;
        }

        Integer month = MONTHS.get(parts[1].toLowerCase(Locale.ROOT));
        if (month == null) {
            return null;
        }

        return toDate(Integer.parseInt(parts[2]), month, Integer.parseInt(parts[0]));
    }

    // DD-MM-YYYY
    LocalDate parseDocumentDate(String raw) {
        if (raw == null) {
            return null;
        }

        String[] parts = raw.trim().split("-");
        if (parts.length != 3
                || !DAY.matcher(parts[0]).matches()
                || !DAY.matcher(parts[1]).matches()
                || !YEAR.matcher(parts[2]).matches()) {
            return null;
        }

        return toDate(Integer.parseInt(parts[2]), Integer.parseInt(parts[1]), Integer.parseInt(parts[0]));
    }

    BigDecimal parseNavValue(String raw) {
        if (raw == null) {
            return null;
        }

        String trimmed = raw.trim();
        if (UNAVAILABLE_NAV.contains(trimmed.toUpperCase(Locale.ROOT))) {
            return null;
        }

        try {
            BigDecimal value = new BigDecimal(trimmed.replace(",", ""));
            return value.signum() > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private NavPoint toNavPoint(String schemeCode, MfApiSchemeResponse.NavRow row) {
        LocalDate date = parseDocumentDate(row.date());
        BigDecimal value = parseNavValue(row.nav());
        if (date == null || value == null) {
            log.debug("Dropping scheme NAV row. scheme_code={} date={} nav={}", schemeCode, row.date(), row.nav());
            return null;
        }
        return new NavPoint(schemeCode, date, value);
    }

    private LocalDate toDate(int year, int month, int day) {
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private void closeReader(BufferedReader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package com.birdopedia.trips;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.birdopedia.model.Capture;

/**
 * Resolves capture timestamps to local date-times and day keys.
 *
 * <p>A timestamp carrying a numeric UTC offset ({@code +02:00}) is read on its own
 * local clock, so the day key is the day the photo was taken where it was taken.
 * Timestamps without an offset, or in UTC ({@code Z}), are placed in the configured
 * default zone. EXIF style dates ({@code 2024:05:12 08:30:00}) are accepted.
 */
public final class CaptureClock {

    private static final Logger log = LoggerFactory.getLogger(CaptureClock.class);

    private static final Pattern EXIF_DATE = Pattern.compile("^(\\d{4}):(\\d{2}):(\\d{2})");
    private static final Pattern NUMERIC_OFFSET = Pattern.compile("[+-]\\d{2}:?\\d{2}$");
    private static final DateTimeFormatter DAY_KEY = DateTimeFormatter.ISO_LOCAL_DATE;

    private final ZoneId defaultZone;

    public CaptureClock(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    /**
     * Parses a capture timestamp; empty when the value is missing or unparseable.
     */
    public Optional<ZonedDateTime> resolve(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String iso = normalize(raw.trim());
        try {
            if (iso.endsWith("Z") || iso.endsWith("z")) {
                OffsetDateTime utc = OffsetDateTime.parse(iso.substring(0, iso.length() - 1) + "Z");
                return Optional.of(utc.atZoneSameInstant(defaultZone));
            }
            if (NUMERIC_OFFSET.matcher(iso).find() && iso.contains("T")) {
                OffsetDateTime withOffset = OffsetDateTime.parse(withColonOffset(iso));
                return Optional.of(withOffset.atZoneSameInstant(withOffset.getOffset()));
            }
            if (iso.contains("T")) {
                return Optional.of(LocalDateTime.parse(iso).atZone(defaultZone));
            }
            return Optional.of(LocalDate.parse(iso).atStartOfDay(defaultZone));
        } catch (DateTimeParseException ex) {
            log.debug("Unparseable capture timestamp '{}': {}", raw, ex.getMessage());
            return Optional.empty();
        }
    }

    public Optional<StampedCapture> stamp(Capture capture) {
        return resolve(capture.getCaptureDateIso())
                .map(at -> new StampedCapture(capture, at, dayKey(at)));
    }

    public static String dayKey(ZonedDateTime at) {
        return at.toLocalDate().format(DAY_KEY);
    }

    private static String normalize(String value) {
        String iso = EXIF_DATE.matcher(value).replaceFirst("$1-$2-$3");
        int space = iso.indexOf(' ');
        if (space > 0) {
            iso = iso.substring(0, space) + "T" + iso.substring(space + 1).replace(" ", "");
        }
        return iso;
    }

    private static String withColonOffset(String iso) {
        // +0200 -> +02:00
        int len = iso.length();
        char sign = iso.charAt(len - 5);
        if ((sign == '+' || sign == '-') && iso.charAt(len - 3) != ':') {
            return iso.substring(0, len - 2) + ":" + iso.substring(len - 2);
        }
        return iso;
    }
}

package io.github.byzatic.cronengine.schedulers;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Optional;

/**
 * Cron expression with optional seconds.
 * <ul>
 *   <li>5 fields: {@code min hour dom mon dow} (seconds fixed at 0)</li>
 *   <li>6 fields: {@code sec min hour dom mon dow}</li>
 * </ul>
 * Each field accepts {@code *}, {@code ?}, lists, ranges and steps. Day of week is 0..7 with both 0 and 7
 * meaning Sunday. When day-of-month and day-of-week are both restricted a day matches if either does,
 * as in classic cron.
 */
public final class CronExpr {
    private final String source;
    private final BitSet seconds = new BitSet(60);
    private final BitSet minutes = new BitSet(60);
    private final BitSet hours = new BitSet(24);
    private final BitSet dom = new BitSet(32);    // 1..31
    private final BitSet months = new BitSet(13); // 1..12
    private final BitSet dow = new BitSet(8);     // 0..6, 0=Sunday
    private boolean domRestricted;
    private boolean dowRestricted;

    private CronExpr(String source) {
        this.source = source;
    }

    /**
     * @throws IllegalArgumentException malformed expression
     */
    public static CronExpr parse(String s) {
        String[] p = s.trim().split("\\s+");
        if (p.length != 5 && p.length != 6)
            throw new IllegalArgumentException("Cron must have 5 or 6 fields (with seconds): " + s);

        CronExpr ce = new CronExpr(s.trim());
        int idx = 0;
        if (p.length == 6) {
            ce.parseField(p[idx++], 0, 59, ce.seconds);
        } else {
            ce.seconds.set(0);
        }
        ce.parseField(p[idx++], 0, 59, ce.minutes);
        ce.parseField(p[idx++], 0, 23, ce.hours);
        ce.domRestricted = ce.parseField(p[idx++], 1, 31, ce.dom);
        ce.parseField(p[idx++], 1, 12, ce.months);
        ce.dowRestricted = ce.parseField(p[idx], 0, 7, ce.dow);
        if (ce.dow.get(7)) {
            ce.dow.clear(7);
            ce.dow.set(0);
        }

        if (ce.seconds.isEmpty() || ce.minutes.isEmpty() || ce.hours.isEmpty()
                || ce.dom.isEmpty() || ce.months.isEmpty() || ce.dow.isEmpty()) {
            throw new IllegalArgumentException("Cron field parsed to empty set: " + s);
        }
        return ce;
    }

    /**
     * @return {@code true} if the field restricts values, {@code false} for a wildcard
     */
    private boolean parseField(String f, int min, int max, BitSet out) {
        if (f.equals("*") || f.equals("?")) {
            out.set(min, max + 1);
            return false;
        }
        for (String part : f.split(",")) {
            String stepPart = part;
            int step = 1;
            if (part.contains("/")) {
                String[] ar = part.split("/");
                if (ar.length != 2) throw new IllegalArgumentException("Bad step: " + part);
                stepPart = ar[0];
                step = parseNumber(ar[1], part);
                if (step <= 0) throw new IllegalArgumentException("Step must be > 0: " + part);
            }
            int start, end;
            if (stepPart.equals("*")) {
                start = min;
                end = max;
            } else if (stepPart.contains("-")) {
                String[] r = stepPart.split("-");
                if (r.length != 2) throw new IllegalArgumentException("Bad range: " + part);
                start = parseNumber(r[0], part);
                end = parseNumber(r[1], part);
            } else {
                start = parseNumber(stepPart, part);
                end = part.contains("/") ? max : start;
            }
            if (start < min || end > max || start > end) {
                throw new IllegalArgumentException("Out of range: " + part);
            }
            for (int v = start; v <= end; v += step) out.set(v);
        }
        return true;
    }

    private static int parseNumber(String value, String part) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number in '" + part + "': " + value, e);
        }
    }

    /**
     * First fire time strictly after {@code from}, evaluated on the wall clock of {@code zone}. Searches up to
     * two years ahead.
     * <p>
     * Each matching local time fires at most once. When clocks go back, a slot inside the repeated hour fires
     * at its earlier offset only. When clocks go forward, a slot inside the skipped hour fires at the same
     * local time shifted by the length of the gap.
     */
    public Optional<Instant> next(Instant from, ZoneId zone) {
        LocalDateTime t = LocalDateTime.ofInstant(from, zone)
                .plusSeconds(1)
                .withNano(0);
        int lastYear = t.getYear() + 2;

        for (int i = 0; i < 366 * 24 * 60 * 60 * 2; i++) {
            if (t.getYear() > lastYear) break;
            if (!months.get(t.getMonthValue())) {
                t = t.plusMonths(1).withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
                continue;
            }
            if (!dayMatches(t)) {
                t = t.plusDays(1).truncatedTo(ChronoUnit.DAYS);
                continue;
            }
            if (!hours.get(t.getHour())) {
                t = t.plusHours(1).truncatedTo(ChronoUnit.HOURS);
                continue;
            }
            if (!minutes.get(t.getMinute())) {
                t = t.plusMinutes(1).truncatedTo(ChronoUnit.MINUTES);
                continue;
            }
            if (!seconds.get(t.getSecond())) {
                t = t.plusSeconds(1);
                continue;
            }
            // ofLocal picks the earlier offset in an overlap and shifts forward across a gap
            Instant fire = ZonedDateTime.ofLocal(t, zone, null).toInstant();
            if (fire.isAfter(from)) return Optional.of(fire);
            t = t.plusSeconds(1);
        }
        return Optional.empty();
    }

    private boolean dayMatches(LocalDateTime t) {
        boolean domOk = dom.get(t.getDayOfMonth());
        boolean dowOk = dow.get(t.getDayOfWeek().getValue() % 7);
        if (domRestricted && dowRestricted) return domOk || dowOk;
        return domOk && dowOk;
    }

    @Override
    public String toString() {
        return source;
    }
}

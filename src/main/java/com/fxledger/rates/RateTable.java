package com.fxledger.rates;

import com.fxledger.domain.model.RateEntry;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, date-ascending series of daily rates with as-of lookup.
 *
 * <p>The rate applying to a date is the one of the latest entry dated on or before it. Dates
 * before the first entry have no rate; callers decide how to fall back.
 *
 * <p>Two access paths are offered: {@link #lookup} for a single date (binary search) and
 * {@link #resolveAsOf} for a whole batch of ascending dates, which walks both sequences once with
 * a cursor that only moves forward.
 */
public final class RateTable {

    private final LocalDate[] dates;
    private final BigDecimal[] rates;

    private RateTable(LocalDate[] dates, BigDecimal[] rates) {
        this.dates = dates;
        this.rates = rates;
    }

    /** Builds a table from entries in any order. For duplicate dates the last entry wins. */
    public static RateTable of(Collection<RateEntry> entries) {
        TreeMap<LocalDate, BigDecimal> byDate = new TreeMap<>();
        for (RateEntry entry : entries) {
            byDate.put(entry.getDate(), entry.getRate());
        }
        LocalDate[] dates = new LocalDate[byDate.size()];
        BigDecimal[] rates = new BigDecimal[byDate.size()];
        int i = 0;
        for (Map.Entry<LocalDate, BigDecimal> entry : byDate.entrySet()) {
            dates[i] = entry.getKey();
            rates[i] = entry.getValue();
            i++;
        }
        return new RateTable(dates, rates);
    }

    public int size() {
        return dates.length;
    }

    public boolean isEmpty() {
        return dates.length == 0;
    }

    public Optional<LocalDate> earliestDate() {
        return isEmpty() ? Optional.empty() : Optional.of(dates[0]);
    }

    public List<RateEntry> entries() {
        List<RateEntry> entries = new ArrayList<>(dates.length);
        for (int i = 0; i < dates.length; i++) {
            entries.add(RateEntry.of(dates[i], rates[i]));
        }
        return entries;
    }

    /** Rate of the latest entry dated on or before {@code date}; empty if {@code date} precedes the table. */
    public Optional<BigDecimal> lookup(LocalDate date) {
        int low = 0;
        int high = dates.length - 1;
        int found = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (dates[mid].isAfter(date)) {
                high = mid - 1;
            } else {
                found = mid;
                low = mid + 1;
            }
        }
        return found < 0 ? Optional.empty() : Optional.of(rates[found]);
    }

    /**
     * As-of join of an ascending date sequence against this table in O(n + m).
     *
     * @param ascendingDates dates sorted ascending (duplicates allowed)
     * @return one rate per input date, in the same order; {@code null} where no entry precedes the date
     * @throws IllegalArgumentException if the input is not ascending
     */
    public List<BigDecimal> resolveAsOf(List<LocalDate> ascendingDates) {
        List<BigDecimal> resolved = new ArrayList<>(ascendingDates.size());
        int cursor = -1;
        LocalDate previous = null;
        for (LocalDate date : ascendingDates) {
            if (previous != null && date.isBefore(previous)) {
                throw new IllegalArgumentException("Dates must be ascending: " + date + " after " + previous);
            }
            while (cursor + 1 < dates.length && !dates[cursor + 1].isAfter(date)) {
                cursor++;
            }
            resolved.add(cursor < 0 ? null : rates[cursor]);
            previous = date;
        }
        return resolved;
    }
}

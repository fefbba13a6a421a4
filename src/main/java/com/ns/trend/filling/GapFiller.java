package com.ns.trend.filling;

import com.ns.trend.model.AggregateResult;
import com.ns.trend.model.Granularity;
import com.ns.trend.model.TrendSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns sparse per-bucket aggregates into a dense series covering a whole range.
 *
 * Every bucket from the one containing {@code start} to the one containing {@code end} is
 * emitted exactly once, in order. Buckets without a result get zero; results sharing a timestamp
 * are summed into one entry.
 */
public final class GapFiller {
    private static final Logger logger = LoggerFactory.getLogger(GapFiller.class);

    private GapFiller() {
    }

    /**
     * @throws com.ns.trend.exception.UnsupportedGranularityException for unknown granularity names
     */
    public static TrendSeries fill(List<AggregateResult> sparse, LocalDateTime start, LocalDateTime end, String granularity) {
        return fill(sparse, start, end, Granularity.fromName(granularity));
    }

    public static TrendSeries fill(List<AggregateResult> sparse, LocalDateTime start, LocalDateTime end, Granularity granularity) {
        Objects.requireNonNull(sparse, "sparse is null");
        Objects.requireNonNull(start, "start is null");
        Objects.requireNonNull(end, "end is null");
        Objects.requireNonNull(granularity, "granularity is null");

        List<LocalDateTime> buckets = enumerateBuckets(start, end, granularity);
        Map<LocalDateTime, AggregateResult> byTimestamp = coalesce(sparse);

        List<AggregateResult> filled = new ArrayList<>(buckets.size());
        int zeroFilled = 0;
        for (LocalDateTime bucket : buckets) {
            AggregateResult result = byTimestamp.remove(bucket);
            if (result != null) {
                filled.add(result);
            } else {
                filled.add(AggregateResult.zero(bucket));
                zeroFilled++;
            }
        }

        if (!byTimestamp.isEmpty()) {
            logger.warn("Dropped {} results outside the {} buckets of [{}, {}]: {}",
                    byTimestamp.size(), granularity, start, end, byTimestamp.keySet());
        }
        logger.debug("Filled {} {} buckets ({} from data, {} zero-filled)",
                filled.size(), granularity, filled.size() - zeroFilled, zeroFilled);

        return new TrendSeries(filled);
    }

    /**
     * Lists the start of every bucket between the buckets containing {@code start} and {@code end},
     * inclusive. Empty when {@code end} falls in an earlier bucket than {@code start}.
     */
    public static List<LocalDateTime> enumerateBuckets(LocalDateTime start, LocalDateTime end, Granularity granularity) {
        LocalDateTime current = granularity.truncate(start);
        LocalDateTime last = granularity.truncate(end);

        List<LocalDateTime> buckets = new ArrayList<>();
        while (!current.isAfter(last)) {
            buckets.add(current);
            current = granularity.next(current);
        }
        return buckets;
    }

    private static Map<LocalDateTime, AggregateResult> coalesce(List<AggregateResult> sparse) {
        Map<LocalDateTime, AggregateResult> byTimestamp = new HashMap<>();
        for (AggregateResult result : sparse) {
            AggregateResult existing = byTimestamp.get(result.getTimestamp());
            if (existing == null) {
                byTimestamp.put(result.getTimestamp(), result);
            } else {
                logger.debug("Coalescing duplicate result at {}", result.getTimestamp());
                byTimestamp.put(result.getTimestamp(), existing.plus(result));
            }
        }
        return byTimestamp;
    }
}

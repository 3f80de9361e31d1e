package dev.tokenbench.bench;

import dev.tokenbench.task.Approach;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * What a run does: which approaches, how tasks are scheduled, and whether responses are graded.
 *
 * @param approaches selected approaches. iteration follows {@link Approach} declaration order
 */
public record RunOptions(Set<Approach> approaches, ConcurrencyMode concurrency, boolean grading) {

    public enum ConcurrencyMode {
        /** One task at a time, in catalog order. */
        SEQUENTIAL,
        /** Every task dispatched at once onto a bounded worker pool. */
        CONCURRENT
    }

    public RunOptions {
        if (approaches == null || approaches.isEmpty()) {
            throw new IllegalArgumentException("at least one approach must be selected");
        }
        approaches = Collections.unmodifiableSet(EnumSet.copyOf(approaches));
        concurrency = concurrency == null ? ConcurrencyMode.CONCURRENT : concurrency;
    }

    /** Both approaches, concurrent, graded. */
    public static RunOptions defaults() {
        return new RunOptions(EnumSet.allOf(Approach.class), ConcurrencyMode.CONCURRENT, true);
    }

    /**
     * Options from CLI-style flags. {@code xlOnly} and {@code xlsxOnly} are mutually exclusive.
     */
    public static RunOptions of(boolean xlOnly, boolean xlsxOnly, boolean sequential, boolean grading) {
        if (xlOnly && xlsxOnly) {
            throw new IllegalArgumentException("xl-only and xlsx-only are mutually exclusive");
        }
        Set<Approach> approaches =
                xlOnly
                        ? EnumSet.of(Approach.XL)
                        : xlsxOnly ? EnumSet.of(Approach.XLSX) : EnumSet.allOf(Approach.class);
        return new RunOptions(
                approaches,
                sequential ? ConcurrencyMode.SEQUENTIAL : ConcurrencyMode.CONCURRENT,
                grading);
    }

    public boolean includes(Approach approach) {
        return approaches.contains(approach);
    }

    /** True when both approaches run, so tasks can be compared. */
    public boolean comparing() {
        return approaches.size() == Approach.values().length;
    }
}

package dev.tokenbench.bench;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.Optional;

/**
 * Letter grade on the five-symbol correctness scale, plus {@link #UNGRADED}: the sentinel "?" for a
 * grading call that failed. The sentinel has no ordinal value and is never averaged.
 */
public enum Grade {
    A("A", 4),
    B("B", 3),
    C("C", 2),
    D("D", 1),
    F("F", 0),
    UNGRADED("?", -1);

    private final String symbol;
    private final int points;

    Grade(String symbol, int points) {
        this.symbol = symbol;
        this.points = points;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /** A=4 down to F=0. */
    public int points() {
        if (this == UNGRADED) {
            throw new IllegalStateException("the ungraded sentinel has no points");
        }
        return points;
    }

    public boolean isReal() {
        return this != UNGRADED;
    }

    @JsonCreator
    public static Grade fromSymbol(String symbol) {
        return parse(symbol)
                .orElseThrow(() -> new IllegalArgumentException("Unknown grade: " + symbol));
    }

    /** Case-insensitive lookup, surrounding whitespace ignored. */
    public static Optional<Grade> parse(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        var trimmed = symbol.trim();
        for (var grade : values()) {
            if (grade.symbol.equalsIgnoreCase(trimmed)) {
                return Optional.of(grade);
            }
        }
        return Optional.empty();
    }

    /** Letter for a mean of ordinal points: >=3.5 A, >=2.5 B, >=1.5 C, >=0.5 D, else F. */
    public static Grade bucket(double mean) {
        if (mean >= 3.5) {
            return A;
        } else if (mean >= 2.5) {
            return B;
        } else if (mean >= 1.5) {
            return C;
        } else if (mean >= 0.5) {
            return D;
        }
        return F;
    }

    /**
     * Bucketed mean of the real grades in {@code grades}. Empty when there are none; sentinels are
     * skipped.
     */
    public static Optional<Grade> average(Collection<Grade> grades) {
        var mean =
                grades.stream().filter(Grade::isReal).mapToInt(Grade::points).average();
        return mean.isPresent() ? Optional.of(bucket(mean.getAsDouble())) : Optional.empty();
    }

    @Override
    public String toString() {
        return symbol;
    }
}

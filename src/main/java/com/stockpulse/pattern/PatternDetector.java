package com.stockpulse.pattern;

import com.stockpulse.model.Direction;
import com.stockpulse.model.PatternKind;
import com.stockpulse.model.PricePoint;
import com.stockpulse.model.PriceSeries;
import com.stockpulse.model.TechnicalPattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Rolling-window pattern detection over daily closes.
 * <p>
 * Pure: the same series and settings always give the same list, ordered by anchor date, kind, direction.
 * A series too short for a pattern kind simply yields none of that kind.
 */
public final class PatternDetector {
    private static final Logger LOG = LogManager.getLogger(PatternDetector.class);
    private static final Comparator<TechnicalPattern> ORDER = Comparator
            .comparing(TechnicalPattern::anchorDate)
            .thenComparing(TechnicalPattern::kind)
            .thenComparing(TechnicalPattern::direction);

    private final PatternSettings settings;

    public PatternDetector() {
        this(PatternSettings.defaults());
    }

    public PatternDetector(PatternSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings").validated();
    }

    public PatternSettings settings() {
        return settings;
    }

    public List<TechnicalPattern> detect(PriceSeries series) {
        if (series == null || series.isEmpty()) {
            return List.of();
        }
        List<PricePoint> points = series.points();
        double[] closes = series.closes();

        List<TechnicalPattern> out = new ArrayList<>();
        detectMoves(points, closes, out);
        detectBreakouts(points, closes, out);
        detectReversals(points, closes, out);
        if (settings.sidewaysEnabled) {
            detectSideways(points, closes, out);
        }
        out.sort(ORDER);
        LOG.debug("detected {} patterns over {} bars", out.size(), points.size());
        return List.copyOf(out);
    }

    /**
     * Cumulative change over {@code moveWindow} sessions. Consecutive qualifying days of the same sign
     * form one episode, anchored on the day with the largest change.
     */
    private void detectMoves(List<PricePoint> points, double[] closes, List<TechnicalPattern> out) {
        int window = settings.moveWindow;
        if (closes.length <= window) {
            return;
        }
        int episodeSign = 0;
        int episodeStart = -1;
        int bestIdx = -1;
        int lastIdx = -1;
        double bestChange = 0.0;
        for (int i = window; i < closes.length; i++) {
            double change = pctChange(closes[i - window], closes[i]);
            int sign = Math.abs(change) > settings.moveThreshold ? (change > 0 ? 1 : -1) : 0;
            if (sign != 0 && sign == episodeSign) {
                if (Math.abs(change) > Math.abs(bestChange)) {
                    bestChange = change;
                    bestIdx = i;
                }
                lastIdx = i;
                continue;
            }
            if (episodeSign != 0) {
                out.add(moveEpisode(points, episodeStart, bestIdx, lastIdx, bestChange));
            }
            episodeSign = sign;
            if (sign != 0) {
                episodeStart = i - window;
                bestIdx = i;
                lastIdx = i;
                bestChange = change;
            }
        }
        if (episodeSign != 0) {
            out.add(moveEpisode(points, episodeStart, bestIdx, lastIdx, bestChange));
        }
    }

    private TechnicalPattern moveEpisode(List<PricePoint> points, int startIdx, int anchorIdx, int endIdx, double change) {
        Direction direction = Direction.ofSign(change);
        PatternKind kind = direction == Direction.BULLISH ? PatternKind.BULLISH_MOVE : PatternKind.BEARISH_MOVE;
        String note = String.format(
                Locale.US,
                "%+.2f%% over %d sessions",
                change * 100.0,
                settings.moveWindow
        );
        return TechnicalPattern.of(
                kind,
                points.get(startIdx).date(),
                points.get(anchorIdx).date(),
                points.get(endIdx).date(),
                direction,
                Math.abs(change),
                note
        );
    }

    /**
     * Close beyond the extreme of the preceding {@code breakoutWindow} closes. A run of consecutive
     * same-direction breakout days is reported once, on its first day.
     */
    private void detectBreakouts(List<PricePoint> points, double[] closes, List<TechnicalPattern> out) {
        int window = settings.breakoutWindow;
        if (closes.length <= window) {
            return;
        }
        double threshold = settings.breakoutThreshold;
        int previousSign = 0;
        for (int i = window; i < closes.length; i++) {
            double max = Double.NEGATIVE_INFINITY;
            double min = Double.POSITIVE_INFINITY;
            for (int j = i - window; j < i; j++) {
                max = Math.max(max, closes[j]);
                min = Math.min(min, closes[j]);
            }
            int sign = 0;
            double magnitude = 0.0;
            double level = 0.0;
            if (max > 0 && closes[i] > max * (1.0 + threshold)) {
                sign = 1;
                level = max;
                magnitude = (closes[i] - max) / max;
            } else if (min > 0 && closes[i] < min * (1.0 - threshold)) {
                sign = -1;
                level = min;
                magnitude = (min - closes[i]) / min;
            }
            if (sign != 0 && sign != previousSign) {
                String note = String.format(
                        Locale.US,
                        "close %.2f %s %d-session %s %.2f by %.2f%%",
                        closes[i],
                        sign > 0 ? "above" : "below",
                        window,
                        sign > 0 ? "high" : "low",
                        level,
                        magnitude * 100.0
                );
                out.add(TechnicalPattern.of(
                        PatternKind.BREAKOUT,
                        points.get(i - window).date(),
                        points.get(i).date(),
                        points.get(i).date(),
                        Direction.ofSign(sign),
                        magnitude,
                        note
                ));
            }
            previousSign = sign;
        }
    }

    /**
     * At least {@code reversalRunLength} same-direction daily moves ending at a pivot, then an opposite
     * move from the pivot close beyond the threshold within {@code reversalConfirmDays}. Anchored on the pivot.
     */
    private void detectReversals(List<PricePoint> points, double[] closes, List<TechnicalPattern> out) {
        int runLength = settings.reversalRunLength;
        if (closes.length < runLength + 2) {
            return;
        }
        for (int pivot = runLength; pivot < closes.length - 1; pivot++) {
            int runSign = dailySign(closes, pivot);
            if (runSign == 0 || !isRun(closes, pivot, runLength, runSign)) {
                continue;
            }
            if (dailySign(closes, pivot + 1) != -runSign) {
                continue;
            }
            int limit = Math.min(closes.length - 1, pivot + settings.reversalConfirmDays);
            for (int q = pivot + 1; q <= limit; q++) {
                double change = pctChange(closes[pivot], closes[q]);
                if (change * -runSign > settings.reversalThreshold) {
                    String note = String.format(
                            Locale.US,
                            "%d-session %s run turned %+.2f%% by %s",
                            runLength,
                            runSign > 0 ? "up" : "down",
                            change * 100.0,
                            points.get(q).date()
                    );
                    out.add(TechnicalPattern.of(
                            PatternKind.REVERSAL,
                            points.get(pivot - runLength).date(),
                            points.get(pivot).date(),
                            points.get(q).date(),
                            Direction.ofSign(-runSign),
                            Math.abs(change),
                            note
                    ));
                    break;
                }
            }
        }
    }

    private void detectSideways(List<PricePoint> points, double[] closes, List<TechnicalPattern> out) {
        if (closes.length < settings.sidewaysMinPoints || !(closes[0] > 0)) {
            return;
        }
        int last = closes.length - 1;
        double change = pctChange(closes[0], closes[last]);
        if (Math.abs(change) >= settings.sidewaysThreshold) {
            return;
        }
        out.add(TechnicalPattern.of(
                PatternKind.SIDEWAYS_RANGE,
                points.get(0).date(),
                points.get(0).date(),
                points.get(last).date(),
                Direction.NEUTRAL,
                Math.abs(change),
                String.format(Locale.US, "net change %+.2f%% across the range", change * 100.0)
        ));
    }

    private static boolean isRun(double[] closes, int end, int length, int sign) {
        for (int j = end - length + 1; j <= end; j++) {
            if (dailySign(closes, j) != sign) {
                return false;
            }
        }
        return true;
    }

    private static int dailySign(double[] closes, int index) {
        double diff = closes[index] - closes[index - 1];
        if (diff > 0) {
            return 1;
        }
        if (diff < 0) {
            return -1;
        }
        return 0;
    }

    private static double pctChange(double from, double to) {
        if (!(from > 0) || !Double.isFinite(to)) {
            return 0.0;
        }
        return (to - from) / from;
    }
}

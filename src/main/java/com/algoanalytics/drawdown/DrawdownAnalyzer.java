package com.algoanalytics.drawdown;

import com.algoanalytics.domain.model.DrawdownEpisode;
import com.algoanalytics.domain.model.EquityCurve;
import com.algoanalytics.domain.model.EquityPoint;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Peak / trough / recovery reconstruction from an equity curve.
 *
 * <p>Single pass over the curve tracking the running peak. A point below the running peak
 * opens (or extends) an underwater episode whose trough is the first occurrence of its lowest
 * value; the first later point at or above the peak closes it as recovered. The peak of an
 * episode is the last point equal to the running peak before the trough. The maximum drawdown
 * is the deepest episode, earliest first on ties.
 *
 * <p>Durations are whole calendar days: peak to trough, and trough to recovery.
 */
@Slf4j
@Component
public class DrawdownAnalyzer {

    /**
     * Analyzes drawdowns of the given curve.
     *
     * @throws com.algoanalytics.exception.ValidationException if the curve is empty or contains
     *     non-positive values
     */
    public DrawdownAnalysis analyze(EquityCurve equityCurve) {
        equityCurve.validate();

        int n = equityCurve.size();
        double[] values = equityCurve.values();
        List<Double> underwater = new ArrayList<>(n);
        List<DrawdownEpisode> episodes = new ArrayList<>();

        double peak = values[0];
        int peakIndex = 0;
        int troughIndex = -1;

        for (int i = 0; i < n; i++) {
            double value = values[i];
            if (value >= peak) {
                if (troughIndex >= 0) {
                    episodes.add(buildEpisode(equityCurve, peakIndex, troughIndex, i));
                    troughIndex = -1;
                }
                peak = value;
                peakIndex = i;
                underwater.add(0.0);
            } else {
                if (troughIndex < 0 || value < values[troughIndex]) {
                    troughIndex = i;
                }
                underwater.add((value - peak) / peak);
            }
        }
        if (troughIndex >= 0) {
            episodes.add(buildEpisode(equityCurve, peakIndex, troughIndex, -1));
        }

        DrawdownEpisode worst = null;
        for (DrawdownEpisode episode : episodes) {
            if (worst == null || episode.getDepth() < worst.getDepth()) {
                worst = episode;
            }
        }

        double maxDrawdown = worst != null ? worst.getDepth() : 0.0;
        if (worst != null) {
            log.debug(
                    "Max drawdown {} from {} to {} ({} episode(s), recovered={})",
                    maxDrawdown,
                    worst.getPeakTime(),
                    worst.getTroughTime(),
                    episodes.size(),
                    worst.isRecovered());
        }

        return DrawdownAnalysis.builder()
                .maxDrawdown(maxDrawdown)
                .maxDrawdownEpisode(worst)
                .episodes(List.copyOf(episodes))
                .underwater(List.copyOf(underwater))
                .currentDrawdown(underwater.get(n - 1))
                .build();
    }

    private DrawdownEpisode buildEpisode(EquityCurve curve, int peakIndex, int troughIndex, int recoveryIndex) {
        EquityPoint peak = curve.get(peakIndex);
        EquityPoint trough = curve.get(troughIndex);
        EquityPoint recovery = recoveryIndex >= 0 ? curve.get(recoveryIndex) : null;

        double depth = (trough.doubleValue() - peak.doubleValue()) / peak.doubleValue();

        return DrawdownEpisode.builder()
                .peakValue(peak.getValue())
                .peakTime(peak.getTimestamp())
                .troughValue(trough.getValue())
                .troughTime(trough.getTimestamp())
                .recoveryTime(recovery != null ? recovery.getTimestamp() : null)
                .depth(depth)
                .durationDays(ChronoUnit.DAYS.between(peak.getTimestamp(), trough.getTimestamp()))
                .recoveryDays(
                        recovery != null
                                ? ChronoUnit.DAYS.between(trough.getTimestamp(), recovery.getTimestamp())
                                : null)
                .build();
    }
}

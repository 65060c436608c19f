package com.algoanalytics.drawdown;

import com.algoanalytics.domain.model.DrawdownEpisode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Drawdown reconstruction of one equity curve.
 *
 * <p>{@code maxDrawdownEpisode} is null when the curve never fell below a prior peak, in which
 * case {@code maxDrawdown} is 0.
 */
@Value
@Builder
public class DrawdownAnalysis {

    /** Most negative (V - running peak) / running peak; always &lt;= 0. */
    double maxDrawdown;

    DrawdownEpisode maxDrawdownEpisode;

    /** Every underwater stretch in time order. The last one may be unrecovered. */
    List<DrawdownEpisode> episodes;

    /** Drawdown at each equity point, aligned with the curve. */
    List<Double> underwater;

    double currentDrawdown;

    public boolean isCurrentlyInDrawdown() {
        return currentDrawdown < 0.0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("max_drawdown", maxDrawdown);
        if (maxDrawdownEpisode != null) {
            map.put("drawdown_start", maxDrawdownEpisode.getPeakTime());
            map.put("drawdown_trough", maxDrawdownEpisode.getTroughTime());
            map.put("recovery_date", maxDrawdownEpisode.getRecoveryTime());
            map.put("duration_days", maxDrawdownEpisode.getDurationDays());
            map.put("recovery_days", maxDrawdownEpisode.getRecoveryDays());
        } else {
            map.put("drawdown_start", null);
            map.put("drawdown_trough", null);
            map.put("recovery_date", null);
            map.put("duration_days", 0L);
            map.put("recovery_days", null);
        }
        map.put("current_drawdown", currentDrawdown);
        map.put("currently_in_drawdown", isCurrentlyInDrawdown());
        map.put("episode_count", episodes.size());
        map.put("episodes", episodes.stream().map(DrawdownEpisode::toMap).toList());
        return map;
    }
}

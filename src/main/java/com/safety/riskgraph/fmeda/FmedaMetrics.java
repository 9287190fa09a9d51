package com.safety.riskgraph.fmeda;

import com.safety.riskgraph.asil.Asil;

import java.util.List;
import java.util.Map;

/**
 * Result of an FMEDA evaluation, either for one safety goal or for the whole
 * item (in which case {@link #goalMetrics()} holds the per-goal breakdown).
 *
 * @param total    Sum of failure-mode FIT.
 * @param spfRaw   Residual single-point FIT, {@code sum(FIT * (1 - dc))} over permanent modes.
 * @param lpfRaw   Residual latent FIT, the same sum over transient modes.
 * @param dc       Aggregate diagnostic coverage.
 * @param spfm     Single-point fault metric.
 * @param lpfm     Latent fault metric.
 * @param asil     Level whose targets were applied.
 * @param okDc     {@code dc >= target.dc}.
 * @param okSpfm   {@code spfm >= target.spfm}.
 * @param okLpfm   {@code lpfm >= target.lpfm}.
 * @param warnings Fault-fraction imbalances, never fatal.
 */
public record FmedaMetrics(
        double total,
        double spfRaw,
        double lpfRaw,
        double dc,
        double spfm,
        double lpfm,
        Asil asil,
        boolean okDc,
        boolean okSpfm,
        boolean okLpfm,
        Map<String, FmedaMetrics> goalMetrics,
        List<String> warnings) {

    /** Derives the metrics from the raw FIT sums and checks them against {@code target}. */
    static FmedaMetrics of(double total, double spf, double lpf, Asil asil, AsilTarget target,
            Map<String, FmedaMetrics> goalMetrics, List<String> warnings) {
        double dc = total != 0.0 ? (total - (spf + lpf)) / total : 0.0;
        double spfm = total != 0.0 ? 1.0 - spf / total : 0.0;
        double lpfm = total > spf ? 1.0 - lpf / (total - spf) : 0.0;
        return new FmedaMetrics(total, spf, lpf, dc, spfm, lpfm, asil,
                dc >= target.dc(), spfm >= target.spfm(), lpfm >= target.lpfm(),
                goalMetrics, warnings);
    }

    public boolean allOk() {
        return okDc && okSpfm && okLpfm;
    }
}

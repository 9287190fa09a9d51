package com.safety.riskgraph.fmeda;

import com.safety.riskgraph.api.FaultType;
import com.safety.riskgraph.asil.Asil;
import com.safety.riskgraph.model.FaultNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

import lombok.extern.log4j.Log4j2;

/**
 * Computes the ISO 26262 hardware architectural metrics from a list of
 * failure modes.
 *
 * Each failure mode is a {@link FaultNode} carrying its fault type, fault
 * fraction, diagnostic coverage, safety goal and the component it belongs to.
 * The component's FIT rate (from the reliability prediction) is split across
 * its failure modes by fraction:
 *
 * <pre>
 * modeFit = componentFit * fraction        (fractions above 1 are percentages)
 * spf    += modeFit * (1 - dc)             (permanent faults)
 * lpf    += modeFit * (1 - dc)             (transient faults)
 * DC      = 1 - (spf + lpf) / total
 * SPFM    = 1 - spf / total
 * LPFM    = 1 - lpf / (total - spf)
 * </pre>
 *
 * Every ratio is 0 when its denominator is not positive. Metrics are computed
 * per safety goal against that goal's targets, then for the item as a whole
 * against the targets of the highest goal ASIL. Targets come from the
 * function given at construction, by default the ISO 26262 values.
 */
@Log4j2
public class FmedaCalculator {
    public static final double DEFAULT_FRACTION_TOLERANCE = 0.01;

    private final double fractionTolerance;
    private final Function<Asil, AsilTarget> targets;

    public FmedaCalculator() {
        this(DEFAULT_FRACTION_TOLERANCE);
    }

    public FmedaCalculator(double fractionTolerance) {
        this(fractionTolerance, AsilTarget::forAsil);
    }

    /**
     * @param targets Metric targets per ASIL, e.g. a configuration's overrides
     *                over {@link AsilTarget#forAsil(Asil)}.
     */
    public FmedaCalculator(double fractionTolerance, Function<Asil, AsilTarget> targets) {
        this.fractionTolerance = fractionTolerance;
        this.targets = targets != null ? targets : AsilTarget::forAsil;
    }

    /** Component name to total FIT ({@code fit * quantity}). Later duplicates win. */
    public static Map<String, Double> componentFitMap(Collection<ReliabilityComponent> components) {
        Map<String, Double> map = new HashMap<>();
        if (components != null) {
            for (ReliabilityComponent c : components)
                map.put(c.getName(), c.totalFit());
        }
        return map;
    }

    /**
     * The component a failure mode belongs to: its explicit FMEA component,
     * else the name of its first parent.
     */
    public static String componentOf(FaultNode mode) {
        String comp = mode.getFmeaComponent();
        if (comp != null && !comp.isEmpty())
            return comp;
        List<FaultNode> parents = mode.getParents();
        return parents.isEmpty() ? "" : parents.get(0).getUserName();
    }

    public static double normalizedFraction(double fraction) {
        return fraction > 1.0 ? fraction / 100.0 : fraction;
    }

    /**
     * FIT attributed to one failure mode. Without a known component the mode's
     * own FIT is used, and a missing FIT reads as 0.
     */
    public static double modeFit(FaultNode mode, Map<String, Double> componentFits) {
        Double compFit = componentFits != null ? componentFits.get(componentOf(mode)) : null;
        if (compFit != null)
            return compFit * normalizedFraction(mode.getFaultFraction());
        Double own = mode.getFmedaFit();
        return own != null && !own.isNaN() ? own : 0.0;
    }

    /** Residual FIT of one mode after diagnostics: {@code modeFit * (1 - dc)}. */
    public static double residualFit(FaultNode mode, Map<String, Double> componentFits) {
        return modeFit(mode, componentFits) * (1.0 - mode.getDiagnosticCoverage());
    }

    public FmedaMetrics compute(Collection<FaultNode> modes, Collection<ReliabilityComponent> components,
            Function<String, Asil> goalAsil) {
        return compute(modes, components, goalAsil, Collections.emptyMap());
    }

    /**
     * @param modes       Failure modes to evaluate.
     * @param components  Reliability prediction BOM.
     * @param goalAsil    Resolves a safety goal name to its ASIL.
     * @param goalTargets Explicit per-goal targets overriding the ASIL defaults.
     */
    public FmedaMetrics compute(Collection<FaultNode> modes, Collection<ReliabilityComponent> components,
            Function<String, Asil> goalAsil, Map<String, AsilTarget> goalTargets) {
        Map<String, Double> compFit = componentFitMap(components);
        Map<String, GoalSums> sums = new LinkedHashMap<>();

        for (FaultNode mode : modes) {
            String goal = mode.getFmedaSafetyGoal() != null ? mode.getFmedaSafetyGoal() : "";
            GoalSums s = sums.computeIfAbsent(goal, g -> new GoalSums(resolveAsil(goalAsil, g)));
            double fit = modeFit(mode, compFit);
            double residual = fit * (1.0 - mode.getDiagnosticCoverage());
            s.total += fit;
            if (mode.getFaultType() == FaultType.TRANSIENT)
                s.lpf += residual;
            else
                s.spf += residual;
        }

        Map<String, FmedaMetrics> perGoal = new LinkedHashMap<>();
        double total = 0.0, spf = 0.0, lpf = 0.0;
        Asil worst = Asil.QM;
        for (Map.Entry<String, GoalSums> e : sums.entrySet()) {
            GoalSums s = e.getValue();
            AsilTarget target = goalTargets != null && goalTargets.containsKey(e.getKey())
                    ? goalTargets.get(e.getKey())
                    : targetFor(s.asil);
            perGoal.put(e.getKey(), FmedaMetrics.of(s.total, s.spf, s.lpf, s.asil, target,
                    Collections.emptyMap(), Collections.emptyList()));
            total += s.total;
            spf += s.spf;
            lpf += s.lpf;
            worst = Asil.max(worst, s.asil);
        }

        List<String> warnings = checkFaultFractions(modes);
        FmedaMetrics result = FmedaMetrics.of(total, spf, lpf, worst, targetFor(worst),
                Collections.unmodifiableMap(perGoal), warnings);
        log.debug("FMEDA over {} modes: total={} spf={} lpf={} asil={}", modes.size(), total, spf, lpf, worst);
        return result;
    }

    /**
     * Flags every component whose failure-mode fractions do not add up to 1
     * within the tolerance.
     */
    public List<String> checkFaultFractions(Collection<FaultNode> modes) {
        Map<String, Double> byComponent = new LinkedHashMap<>();
        for (FaultNode mode : modes) {
            String comp = componentOf(mode);
            if (comp.isEmpty())
                continue;
            byComponent.merge(comp, normalizedFraction(mode.getFaultFraction()), Double::sum);
        }
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<String, Double> e : byComponent.entrySet()) {
            if (Math.abs(e.getValue() - 1.0) > fractionTolerance) {
                String msg = String.format(Locale.ROOT, "Fault fractions for %s sum to %.2f", e.getKey(), e.getValue());
                log.warn(msg);
                warnings.add(msg);
            }
        }
        return warnings;
    }

    private AsilTarget targetFor(Asil asil) {
        AsilTarget t = targets.apply(asil);
        return t != null ? t : AsilTarget.NONE;
    }

    private static Asil resolveAsil(Function<String, Asil> goalAsil, String goal) {
        Asil a = goalAsil != null ? goalAsil.apply(goal) : null;
        return a != null ? a : Asil.QM;
    }

    private static final class GoalSums {
        final Asil asil;
        double total;
        double spf;
        double lpf;

        GoalSums(Asil asil) {
            this.asil = asil;
        }
    }
}

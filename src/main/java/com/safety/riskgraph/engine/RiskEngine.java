package com.safety.riskgraph.engine;

import com.safety.riskgraph.api.CalculationListener;
import com.safety.riskgraph.api.FaultType;
import com.safety.riskgraph.api.NodeType;
import com.safety.riskgraph.api.ProbabilityFormula;
import com.safety.riskgraph.asil.Asil;
import com.safety.riskgraph.asil.AsilTable;
import com.safety.riskgraph.config.EngineConfig;
import com.safety.riskgraph.fmeda.FailureProbabilities;
import com.safety.riskgraph.fmeda.FmedaCalculator;
import com.safety.riskgraph.fmeda.FmedaMetrics;
import com.safety.riskgraph.fmeda.ReliabilityComponent;
import com.safety.riskgraph.fn.gate.SumProbability;
import com.safety.riskgraph.model.FaultNode;
import com.safety.riskgraph.util.Coercions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point of every "recalculate" action.
 *
 * The engine owns one instance of each calculator and runs them in numbered
 * passes. A pass re-stamps the same annotation fields on the nodes it visits
 * and keeps no other state, so any number of passes over an unchanged tree
 * leave identical annotations behind.
 *
 * Passes:
 * 1. assurance: PAL levels of a subtree and of every top event above it.
 * 2. probability: failure probability of one node.
 * 3. pmhf: probability of every top event, summed, plus the residual
 * single-point and latent FIT stamped on each top event.
 * 4. refresh: basic-event probabilities recomputed from FIT and the mission
 * profile.
 *
 * Cut sets, FMEDA metrics and ASIL lookups are pure queries and do not advance
 * the pass counter.
 *
 * Not thread-safe. The tree is owned by the caller and must not change while a
 * pass is running.
 */
public final class RiskEngine {
    private static final Logger log = LogManager.getLogger(RiskEngine.class);

    private final EngineConfig config;
    private final ForwardingListener forwarding = new ForwardingListener();
    private final AssuranceAggregator assurance = new AssuranceAggregator(forwarding);
    private final ProbabilityPropagator probability = new ProbabilityPropagator(forwarding);
    private final CutSetEnumerator cutSets = new CutSetEnumerator();
    private final SumProbability sum = new SumProbability();
    private final FmedaCalculator fmeda;

    private long pass;
    private int lastEvaluatedCount;

    public RiskEngine() {
        this(new EngineConfig());
    }

    public RiskEngine(EngineConfig config) {
        this.config = config;
        this.fmeda = new FmedaCalculator(config.getFractionTolerance(), config::targetFor);
    }

    public void setListener(CalculationListener listener) {
        forwarding.delegate = listener != null ? listener : CalculationListener.NOOP;
    }

    public EngineConfig config() {
        return config;
    }

    public long pass() {
        return pass;
    }

    /** Node evaluations performed by the most recent pass. */
    public int lastEvaluatedCount() {
        return lastEvaluatedCount;
    }

    // ── Assurance ────────────────────────────────────────────────

    /**
     * Recalculates the PAL of {@code node}'s subtree, then of every top event
     * that contains {@code node}, so ancestors reflect the edit.
     *
     * @return The level stamped on {@code node}.
     */
    public double calculateAssurance(FaultNode node, List<FaultNode> topEvents) {
        begin("assurance");
        double value = assurance.calculate(node, new HashSet<>());
        int evaluated = assurance.evaluated();
        if (topEvents != null) {
            for (FaultNode te : topEvents) {
                if (te != node && contains(te, node)) {
                    assurance.beginPass(pass);
                    assurance.calculate(te, new HashSet<>());
                    evaluated += assurance.evaluated();
                }
            }
        }
        end("assurance", evaluated);
        return value;
    }

    /** Recalculates the PAL of every top event. */
    public void calculateAllAssurance(List<FaultNode> topEvents) {
        begin("assurance");
        int evaluated = 0;
        for (FaultNode te : topEvents) {
            assurance.beginPass(pass);
            assurance.calculate(te, new HashSet<>());
            evaluated += assurance.evaluated();
        }
        end("assurance", evaluated);
    }

    // ── Quantitative FTA ─────────────────────────────────────────

    public double calculateProbability(FaultNode node) {
        begin("probability");
        double p = probability.propagate(node, new HashSet<>());
        end("probability", probability.evaluated());
        return p;
    }

    /**
     * Probabilistic metric for random hardware failures: the sum of the top
     * event probabilities. Each top event also receives the residual
     * single-point FIT (permanent basic events) and latent FIT (transient
     * basic events) of the distinct basic events below it.
     *
     * @param componentFits Component name to FIT; modes of unknown components use their own FIT.
     */
    public double calculatePmhf(List<FaultNode> topEvents, Map<String, Double> componentFits) {
        begin("pmhf");
        Map<String, Double> fits = componentFits != null ? componentFits : Collections.emptyMap();
        double[] probs = new double[topEvents.size()];
        int evaluated = 0;
        for (int i = 0; i < probs.length; i++) {
            FaultNode te = topEvents.get(i);
            probability.beginPass(pass);
            probs[i] = probability.propagate(te, new HashSet<>());
            evaluated += probability.evaluated();

            double spf = 0.0, lpf = 0.0;
            for (FaultNode be : basicEvents(te)) {
                double residual = FmedaCalculator.residualFit(be, fits);
                if (be.getFaultType() == FaultType.TRANSIENT)
                    lpf += residual;
                else
                    spf += residual;
            }
            te.setSpfmRaw(spf);
            te.setLpfmRaw(lpf);
        }
        double pmhf = sum.apply(probs);
        end("pmhf", evaluated);
        log.info("PMHF over {} top events = {}", topEvents.size(), pmhf);
        return pmhf;
    }

    public double calculatePmhf(List<FaultNode> topEvents, Collection<ReliabilityComponent> components) {
        return calculatePmhf(topEvents, FmedaCalculator.componentFitMap(components));
    }

    /**
     * Failure probability of one basic event from its FIT rate over the
     * configured mission duration.
     */
    public double computeFailureProb(FaultNode node, ProbabilityFormula formula, double fit) {
        return FailureProbabilities.compute(node, formula, fit, config.getMissionProfile());
    }

    public double computeFailureProb(FaultNode node, double fit) {
        return computeFailureProb(node, config.getProbabilityFormula(), fit);
    }

    /**
     * Recomputes the failure probability of every basic event below the top
     * events from its mode FIT. Events using the constant formula keep the
     * probability they were given.
     *
     * @return Number of basic events updated.
     */
    public int refreshFailureProbabilities(List<FaultNode> topEvents, Map<String, Double> componentFits) {
        begin("refresh");
        Map<String, Double> fits = componentFits != null ? componentFits : Collections.emptyMap();
        Set<Integer> seen = new HashSet<>();
        int updated = 0;
        for (FaultNode te : topEvents) {
            for (FaultNode be : basicEvents(te)) {
                if (!seen.add(be.getUniqueId()))
                    continue;
                ProbabilityFormula f = be.getProbFormula() == ProbabilityFormula.CONSTANT
                        ? ProbabilityFormula.CONSTANT
                        : config.getProbabilityFormula();
                double p = computeFailureProb(be, f, FmedaCalculator.modeFit(be, fits));
                be.stampFailureProb(p);
                forwarding.onNodeEvaluated(pass, be.getUniqueId(), be.getNodeType(), p);
                updated++;
            }
        }
        end("refresh", updated);
        return updated;
    }

    // ── Queries ──────────────────────────────────────────────────

    public List<Set<Integer>> cutSets(FaultNode node) {
        return cutSets.cutSets(node);
    }

    public FmedaMetrics fmedaMetrics(Collection<FaultNode> modes, Collection<ReliabilityComponent> components,
            Function<String, Asil> goalAsil) {
        return fmeda.compute(modes, components, goalAsil);
    }

    public Asil calcAsil(int severity, int controllability, int exposure) {
        return AsilTable.calcAsil(severity, controllability, exposure);
    }

    /** Lookup on untyped HARA cells; anything non-numeric lands outside the table and yields QM. */
    public Asil calcAsil(Object severity, Object controllability, Object exposure) {
        return AsilTable.calcAsil(Coercions.toInt(severity, 0), Coercions.toInt(controllability, 0),
                Coercions.toInt(exposure, 0));
    }

    // ── Internals ────────────────────────────────────────────────

    private void begin(String operation) {
        pass++;
        assurance.beginPass(pass);
        probability.beginPass(pass);
        forwarding.onPassStart(pass, operation);
    }

    private void end(String operation, int evaluated) {
        lastEvaluatedCount = evaluated;
        forwarding.onPassEnd(pass, operation, evaluated);
        log.debug("Pass {} ({}) evaluated {} nodes", pass, operation, evaluated);
    }

    /** Distinct basic events below {@code root}, in depth-first order. */
    static List<FaultNode> basicEvents(FaultNode root) {
        List<FaultNode> result = new ArrayList<>();
        Set<Integer> visited = new HashSet<>();
        Deque<FaultNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            FaultNode n = stack.pop();
            if (!visited.add(n.getUniqueId()))
                continue;
            if (n.getNodeType() == NodeType.BASIC_EVENT)
                result.add(n);
            List<FaultNode> children = n.getChildren();
            for (int i = children.size() - 1; i >= 0; i--)
                stack.push(children.get(i));
        }
        return result;
    }

    private static boolean contains(FaultNode root, FaultNode target) {
        Set<Integer> visited = new HashSet<>();
        Deque<FaultNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            FaultNode n = stack.pop();
            if (n == target)
                return true;
            if (visited.add(n.getUniqueId()))
                n.getChildren().forEach(stack::push);
        }
        return false;
    }

    /** Fixed target for the calculators; the actual listener can be swapped between passes. */
    private static final class ForwardingListener implements CalculationListener {
        CalculationListener delegate = CalculationListener.NOOP;

        @Override
        public void onPassStart(long pass, String operation) {
            delegate.onPassStart(pass, operation);
        }

        @Override
        public void onNodeEvaluated(long pass, int nodeId, NodeType type, double value) {
            delegate.onNodeEvaluated(pass, nodeId, type, value);
        }

        @Override
        public void onNodeWarning(long pass, int nodeId, String message) {
            delegate.onNodeWarning(pass, nodeId, message);
        }

        @Override
        public void onPassEnd(long pass, String operation, int nodesEvaluated) {
            delegate.onPassEnd(pass, operation, nodesEvaluated);
        }
    }
}

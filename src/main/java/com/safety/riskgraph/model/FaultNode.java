package com.safety.riskgraph.model;

import com.safety.riskgraph.api.AssuranceLevel;
import com.safety.riskgraph.api.FaultType;
import com.safety.riskgraph.api.GateType;
import com.safety.riskgraph.api.NodeType;
import com.safety.riskgraph.api.ProbabilityFormula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * A node of the analysis DAG.
 *
 * One record type serves every analysis hosted by the tree: assurance trees
 * (quant value, severity, controllability), classical FTA (failure probability)
 * and FMEDA (FIT, diagnostic coverage, fault type and fraction). Calculators
 * write their results back onto the node as annotations (quant value,
 * probability, display label and the audit trail in the detailed equation).
 *
 * Instances:
 * Exactly one instance per id space is the primary (canonical) record. Copies
 * pasted elsewhere in the tree are clones: they carry their own id and
 * position, a non-owning reference to the primary, and mirror the primary's
 * children and semantic fields. Clones are only ever updated by
 * {@link FaultTree#syncClones(FaultNode)}; they are never authoritative.
 *
 * Edges:
 * Children and parents are read-only views here; edges are created and removed
 * through {@link FaultTree} so both directions stay consistent.
 *
 * Setters of semantic fields reject clones with an
 * {@link IllegalStateException}; edit the primary, usually through
 * {@link FaultTree#edit(FaultNode, java.util.function.Consumer)}. Calculators
 * write their results through the {@code stamp*} methods, which accept any
 * instance.
 */
@Getter
@Setter
public class FaultNode {
    @Setter(AccessLevel.NONE)
    private final int uniqueId;

    private NodeType nodeType;
    private GateType gateType;
    private String userName = "";
    private String description = "";
    private String rationale = "";

    // 1..5 on assurance trees; null means "not set" and reads as 1
    private Double quantValue;
    // 1..3, top events only; null reads as 3
    private Integer severity;
    private Integer controllability;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<FaultNode> children = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<FaultNode> parents = new ArrayList<>();

    @Setter(AccessLevel.PACKAGE)
    private boolean primaryInstance = true;
    @Setter(AccessLevel.PACKAGE)
    private int originalId;
    @Setter(AccessLevel.PACKAGE)
    private FaultNode original;

    // Clone-local geometry
    private double x;
    private double y;

    // Quantitative FTA
    private Double failureProb;
    private Double probability;
    private ProbabilityFormula probFormula = ProbabilityFormula.LINEAR;

    // FMEDA
    private Double fmedaFit;
    private double diagnosticCoverage;
    private FaultType faultType = FaultType.PERMANENT;
    private double faultFraction;
    private String fmeaComponent = "";
    private String fmedaSafetyGoal = "";

    // Safety goal carried by top events
    private String safetyGoalDescription = "";
    private String safetyGoalAsil = "";

    // Annotations written by the calculators
    private String displayLabel = "";
    private String detailedEquation = "";
    private AssuranceLevel assuranceLevel;
    private Double spfmRaw;
    private Double lpfmRaw;

    public FaultNode(int uniqueId, NodeType nodeType) {
        this.uniqueId = uniqueId;
        this.nodeType = nodeType;
        this.originalId = uniqueId;
        this.original = this;
    }

    public List<FaultNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<FaultNode> getParents() {
        return Collections.unmodifiableList(parents);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** The canonical record of this node: itself for primaries, the original for clones. */
    public FaultNode primary() {
        return primaryInstance || original == null ? this : original;
    }

    // ── Semantic setters (primary only) ──────────────────────────

    public void setNodeType(NodeType nodeType) {
        checkPrimary("nodeType");
        this.nodeType = nodeType;
    }

    public void setGateType(GateType gateType) {
        checkPrimary("gateType");
        this.gateType = gateType;
    }

    public void setUserName(String userName) {
        checkPrimary("userName");
        this.userName = userName;
    }

    public void setDescription(String description) {
        checkPrimary("description");
        this.description = description;
    }

    public void setRationale(String rationale) {
        checkPrimary("rationale");
        this.rationale = rationale;
    }

    public void setQuantValue(Double quantValue) {
        checkPrimary("quantValue");
        this.quantValue = quantValue;
    }

    public void setSeverity(Integer severity) {
        checkPrimary("severity");
        this.severity = severity;
    }

    public void setControllability(Integer controllability) {
        checkPrimary("controllability");
        this.controllability = controllability;
    }

    public void setFailureProb(Double failureProb) {
        checkPrimary("failureProb");
        this.failureProb = failureProb;
    }

    public void setProbFormula(ProbabilityFormula probFormula) {
        checkPrimary("probFormula");
        this.probFormula = probFormula;
    }

    public void setFmedaFit(Double fmedaFit) {
        checkPrimary("fmedaFit");
        this.fmedaFit = fmedaFit;
    }

    public void setDiagnosticCoverage(double diagnosticCoverage) {
        checkPrimary("diagnosticCoverage");
        this.diagnosticCoverage = diagnosticCoverage;
    }

    public void setFaultType(FaultType faultType) {
        checkPrimary("faultType");
        this.faultType = faultType;
    }

    public void setFaultFraction(double faultFraction) {
        checkPrimary("faultFraction");
        this.faultFraction = faultFraction;
    }

    public void setFmeaComponent(String fmeaComponent) {
        checkPrimary("fmeaComponent");
        this.fmeaComponent = fmeaComponent;
    }

    public void setFmedaSafetyGoal(String fmedaSafetyGoal) {
        checkPrimary("fmedaSafetyGoal");
        this.fmedaSafetyGoal = fmedaSafetyGoal;
    }

    public void setSafetyGoalDescription(String safetyGoalDescription) {
        checkPrimary("safetyGoalDescription");
        this.safetyGoalDescription = safetyGoalDescription;
    }

    public void setSafetyGoalAsil(String safetyGoalAsil) {
        checkPrimary("safetyGoalAsil");
        this.safetyGoalAsil = safetyGoalAsil;
    }

    // ── Calculated values ────────────────────────────────────────

    /** Writes a calculated assurance level back onto this instance. */
    public void stampQuantValue(double value) {
        this.quantValue = value;
    }

    /** Writes a failure probability derived from FIT back onto this instance. */
    public void stampFailureProb(double p) {
        this.failureProb = p;
    }

    private void checkPrimary(String field) {
        if (!primaryInstance)
            throw new IllegalStateException("Cannot set " + field + " on clone " + uniqueId
                    + "; edit its primary " + originalId);
    }

    List<FaultNode> childList() {
        return children;
    }

    List<FaultNode> parentList() {
        return parents;
    }

    /**
     * Copies every semantic (non-geometric, non-structural) field from the
     * given primary. Annotations are left alone; they are per instance.
     */
    void copySemanticsFrom(FaultNode src) {
        this.nodeType = src.nodeType;
        this.gateType = src.gateType;
        this.userName = src.userName;
        this.description = src.description;
        this.rationale = src.rationale;
        this.quantValue = src.quantValue;
        this.severity = src.severity;
        this.controllability = src.controllability;
        this.failureProb = src.failureProb;
        this.probFormula = src.probFormula;
        this.fmedaFit = src.fmedaFit;
        this.diagnosticCoverage = src.diagnosticCoverage;
        this.faultType = src.faultType;
        this.faultFraction = src.faultFraction;
        this.fmeaComponent = src.fmeaComponent;
        this.fmedaSafetyGoal = src.fmedaSafetyGoal;
        this.safetyGoalDescription = src.safetyGoalDescription;
        this.safetyGoalAsil = src.safetyGoalAsil;
    }

    @Override
    public String toString() {
        return nodeType.displayName() + "#" + uniqueId
                + (userName.isEmpty() ? "" : " '" + userName + "'")
                + (primaryInstance ? "" : " (clone of " + originalId + ")");
    }
}

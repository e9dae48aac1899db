package com.phillippitts.hierarchicalforecast.service.reconcile;


import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Base class deriving the label from a name and hyperparameters.
 *
 * <p>The label is {@code name()} followed by {@code "_key-value"} pairs sorted by key, so the
 * order in which subclasses list hyperparameters never changes it:
 * <pre>{@code
 * public final class MyReconciler extends AbstractHierarchicalReconciler {
 *     public MyReconciler(double lambda) {
 *         super(EnumSet.of(ReconcilerInput.SUMMING_MATRIX));
 *         this.lambda = lambda;
 *     }
 *     protected String name() { return "Mine"; }
 *     protected Map<String, Object> hyperparameters() { return Map.of("lambda", lambda); }
 *     protected ReconciliationResult doReconcile(ReconciliationInput input) { ... }
 * }
 * // label: "Mine_lambda-0.5"
 * }</pre>
 */
public abstract class AbstractHierarchicalReconciler implements HierarchicalReconciler {

    private final Set<ReconcilerInput> capabilities;
    private volatile String label;

    protected AbstractHierarchicalReconciler(Set<ReconcilerInput> capabilities) {
        Objects.requireNonNull(capabilities, "capabilities must not be null");
        this.capabilities = capabilities.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ReconcilerInput.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
    }

    /**
     * Canonical method name without hyperparameters.
     *
     * @return name, e.g. {@code "BottomUp"}
     */
    protected abstract String name();

    /**
     * Hyperparameters fixed at construction. Empty by default.
     *
     * @return hyperparameter name to value
     */
    protected Map<String, Object> hyperparameters() {
        return Map.of();
    }

    /**
     * Reconciles a non-null input.
     *
     * @param input staged input bundle (never null)
     * @return reconciled result
     */
    protected abstract ReconciliationResult doReconcile(ReconciliationInput input);

    @Override
    public final String label() {
        String l = label;
        if (l == null) {
            l = buildLabel();
            label = l;
        }
        return l;
    }

    @Override
    public final Set<ReconcilerInput> capabilities() {
        return capabilities;
    }

    @Override
    public final ReconciliationResult reconcile(ReconciliationInput input) {
        Objects.requireNonNull(input, "input must not be null");
        return doReconcile(input);
    }

    private String buildLabel() {
        Map<String, Object> params = new TreeMap<>(hyperparameters());
        if (params.isEmpty()) {
            return name();
        }
        return name() + "_" + params.entrySet().stream()
                .map(e -> e.getKey() + "-" + e.getValue())
                .collect(Collectors.joining("_"));
    }

    @Override
    public String toString() {
        return label();
    }
}

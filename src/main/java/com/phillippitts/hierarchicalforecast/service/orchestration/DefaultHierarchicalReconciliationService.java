package com.phillippitts.hierarchicalforecast.service.orchestration;

import com.phillippitts.hierarchicalforecast.domain.ReconciliationRequest;
import com.phillippitts.hierarchicalforecast.domain.SeriesTable;
import com.phillippitts.hierarchicalforecast.exception.HierarchicalForecastException;
import com.phillippitts.hierarchicalforecast.exception.ReconcilerContractException;
import com.phillippitts.hierarchicalforecast.service.bootstrap.BootstrapSampler;
import com.phillippitts.hierarchicalforecast.service.bootstrap.ResidualBootstrapSampler;
import com.phillippitts.hierarchicalforecast.service.context.HierarchyContext;
import com.phillippitts.hierarchicalforecast.service.context.HierarchyContextBuilder;
import com.phillippitts.hierarchicalforecast.service.interval.IntervalColumns;
import com.phillippitts.hierarchicalforecast.service.metrics.ReconciliationMetrics;
import com.phillippitts.hierarchicalforecast.service.reconcile.HierarchicalReconciler;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconcilerInput;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationInput;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Default implementation of {@link HierarchicalReconciliationService}.
 *
 * <p><b>Reconciliation Process:</b>
 * <ol>
 *   <li>Build the shared {@link HierarchyContext} once</li>
 *   <li>Pivot every model column (and its interval and in-sample columns) once</li>
 *   <li>For each reconciler and each model, stage a fresh input bundle through
 *       {@link InputStager} and invoke the reconciler</li>
 *   <li>Check the result against the output contract</li>
 *   <li>Append the reconciled columns through {@link ForecastColumnAssembler}</li>
 * </ol>
 *
 * <p><b>Thread Model:</b> Without an executor, tasks run sequentially on the caller thread. With an
 * executor, every (reconciler, model) task runs as its own {@link CompletableFuture}; tasks share
 * only the immutable context, so the output equals the sequential one.
 *
 * <p><b>Error Handling:</b> Structural input errors abort the call. Exceptions thrown by a
 * reconciler are propagated unchanged (unwrapped from {@link CompletionException}).
 */
public final class DefaultHierarchicalReconciliationService implements HierarchicalReconciliationService {
    private static final Logger LOG = LogManager.getLogger(DefaultHierarchicalReconciliationService.class);

    /** Log4j2 ThreadContext key correlating all log lines of one call. */
    public static final String RECONCILIATION_ID = "reconciliationId";

    private final List<HierarchicalReconciler> reconcilers;
    private final HierarchyContextBuilder contextBuilder = new HierarchyContextBuilder();
    private final ForecastColumnAssembler assembler = new ForecastColumnAssembler();
    private final InputStager stager;
    private final ReconciliationMetrics metrics;
    private final Executor executor;

    /**
     * Constructs the service.
     *
     * @param reconcilers reconcilers in invocation order; labels must be distinct
     * @param sampler bootstrap sampler used when bootstrap intervals are requested
     * @param bootstrapSamples number of bootstrap paths per model
     * @param metrics metrics sink
     * @param executor executor for parallel tasks, or null to run sequentially
     * @throws IllegalArgumentException if reconcilers is empty or two reconcilers share a label
     */
    public DefaultHierarchicalReconciliationService(List<HierarchicalReconciler> reconcilers,
                                                    BootstrapSampler sampler,
                                                    int bootstrapSamples,
                                                    ReconciliationMetrics metrics,
                                                    Executor executor) {
        Objects.requireNonNull(reconcilers, "reconcilers must not be null");
        if (reconcilers.isEmpty()) {
            throw new IllegalArgumentException("at least one reconciler is required");
        }
        Set<String> labels = new HashSet<>();
        for (HierarchicalReconciler reconciler : reconcilers) {
            if (!labels.add(reconciler.label())) {
                throw new IllegalArgumentException("Duplicate reconciler label: " + reconciler.label());
            }
        }
        this.reconcilers = List.copyOf(reconcilers);
        this.stager = new InputStager(sampler, bootstrapSamples);
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.executor = executor;
    }

    /**
     * Creates a sequential service with the default sampler and an in-memory meter registry.
     *
     * @param reconcilers reconcilers in invocation order
     * @return new service
     */
    public static DefaultHierarchicalReconciliationService sequential(List<HierarchicalReconciler> reconcilers) {
        return new DefaultHierarchicalReconciliationService(reconcilers, new ResidualBootstrapSampler(),
                BootstrapSampler.DEFAULT_SAMPLE_COUNT, new ReconciliationMetrics(new SimpleMeterRegistry()), null);
    }

    @Override
    public List<String> labels() {
        return reconcilers.stream().map(HierarchicalReconciler::label).toList();
    }

    @Override
    public SeriesTable reconcile(ReconciliationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        boolean ownsId = !ThreadContext.containsKey(RECONCILIATION_ID);
        if (ownsId) {
            ThreadContext.put(RECONCILIATION_ID, UUID.randomUUID().toString());
        }
        try {
            long t0 = System.nanoTime();
            HierarchyContext context = contextBuilder.build(request);
            List<ModelSlice> slices = modelColumns(request.forecasts()).stream()
                    .map(model -> ModelSlice.of(model, request.forecasts(), request.history(), context))
                    .toList();

            List<Supplier<ModelReconciliation>> tasks = new ArrayList<>();
            for (HierarchicalReconciler reconciler : reconcilers) {
                for (ModelSlice slice : slices) {
                    tasks.add(() -> runTask(reconciler, slice, context, request));
                }
            }
            List<ModelReconciliation> outputs = execute(tasks);
            SeriesTable result = assembler.assemble(request.forecasts(), context.forecastLayout(), outputs);

            LOG.info("Reconciled {} model(s) x {} reconciler(s) over {} series in {} ms (levels={}, bootstrap={})",
                    slices.size(), reconcilers.size(), context.uniqueIds().size(),
                    (System.nanoTime() - t0) / 1_000_000L, request.levels(), request.bootstrap());
            return result;
        } finally {
            if (ownsId) {
                ThreadContext.remove(RECONCILIATION_ID);
            }
        }
    }

    /**
     * Model columns of the base forecasts: everything except the target column and interval columns.
     */
    static List<String> modelColumns(SeriesTable forecasts) {
        return forecasts.columnNames().stream()
                .filter(name -> !SeriesTable.TARGET_COLUMN.equals(name))
                .filter(name -> !IntervalColumns.isIntervalColumn(name))
                .toList();
    }

    private List<ModelReconciliation> execute(List<Supplier<ModelReconciliation>> tasks) {
        if (executor == null) {
            return tasks.stream().map(Supplier::get).toList();
        }
        List<CompletableFuture<ModelReconciliation>> futures = tasks.stream()
                .map(task -> CompletableFuture.supplyAsync(task, executor))
                .toList();
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException ce) {
            throw unwrap(ce);
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private static RuntimeException unwrap(CompletionException ce) {
        Throwable cause = ce.getCause();
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new HierarchicalForecastException("Reconciliation task failed", cause);
    }

    private ModelReconciliation runTask(HierarchicalReconciler reconciler, ModelSlice slice,
                                        HierarchyContext context, ReconciliationRequest request) {
        String label = reconciler.label();
        ReconciliationInput input = stager.stage(reconciler, slice, context, request.levels(), request.bootstrap());
        LOG.debug("{} on model {} with inputs {}", label, slice.model(), input.provided());

        long t0 = System.nanoTime();
        ReconciliationResult result;
        try {
            result = reconciler.reconcile(input);
        } catch (RuntimeException e) {
            metrics.incrementFailure(label, e.getClass().getSimpleName());
            throw e;
        }
        metrics.recordLatency(label, System.nanoTime() - t0);

        List<Double> levels = input.isProvided(ReconcilerInput.LEVELS) ? input.levels() : List.of();
        verify(label, slice.forecast(), result, levels);
        metrics.incrementSuccess(label);
        return new ModelReconciliation(slice.model(), label, result, levels);
    }

    private static void verify(String label, RealMatrix forecast, ReconciliationResult result, List<Double> levels) {
        if (result == null) {
            throw new ReconcilerContractException(label, "Reconciler returned no result");
        }
        requireShape(label, "mean", forecast, result.mean());
        for (double level : levels) {
            ReconciliationResult.Interval interval = result.interval(level).orElseThrow(() ->
                    new ReconcilerContractException(label, "Missing interval for level " + level));
            requireShape(label, "lower bound at level " + level, forecast, interval.lower());
            requireShape(label, "upper bound at level " + level, forecast, interval.upper());
        }
    }

    private static void requireShape(String label, String what, RealMatrix expected, RealMatrix actual) {
        if (actual.getRowDimension() != expected.getRowDimension()
                || actual.getColumnDimension() != expected.getColumnDimension()) {
            throw new ReconcilerContractException(label, what + " is " + actual.getRowDimension() + "x"
                    + actual.getColumnDimension() + ", expected " + expected.getRowDimension() + "x"
                    + expected.getColumnDimension());
        }
    }
}

package com.phillippitts.hierarchicalforecast.config.reconcile;

import com.phillippitts.hierarchicalforecast.config.properties.ReconciliationProperties;
import com.phillippitts.hierarchicalforecast.service.bootstrap.BootstrapSampler;
import com.phillippitts.hierarchicalforecast.service.bootstrap.ResidualBootstrapSampler;
import com.phillippitts.hierarchicalforecast.service.metrics.ReconciliationMetrics;
import com.phillippitts.hierarchicalforecast.service.orchestration.DefaultHierarchicalReconciliationService;
import com.phillippitts.hierarchicalforecast.service.orchestration.HierarchicalReconciliationService;
import com.phillippitts.hierarchicalforecast.service.reconcile.HierarchicalReconciler;
import com.phillippitts.hierarchicalforecast.service.reconcile.impl.BottomUpReconciler;
import com.phillippitts.hierarchicalforecast.service.reconcile.impl.TopDownReconciler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the configured reconciliation methods into a {@link HierarchicalReconciliationService}.
 */
@Configuration
public class ReconciliationConfig {
    private static final Logger LOG = LogManager.getLogger(ReconciliationConfig.class);

    @Bean
    public BootstrapSampler bootstrapSampler(ReconciliationProperties props) {
        return new ResidualBootstrapSampler(props.getBootstrapSeed());
    }

    @Bean
    public HierarchicalReconciliationService hierarchicalReconciliationService(
            ReconciliationProperties props,
            BootstrapSampler bootstrapSampler,
            ReconciliationMetrics metrics,
            @Qualifier("reconciliationExecutor") Executor reconciliationExecutor) {
        List<HierarchicalReconciler> reconcilers = props.getMethods().stream()
                .map(method -> reconcilerFor(method, props))
                .toList();
        Executor executor = props.isParallel() ? reconciliationExecutor : null;
        DefaultHierarchicalReconciliationService service = new DefaultHierarchicalReconciliationService(
                reconcilers, bootstrapSampler, props.getBootstrapSamples(), metrics, executor);
        LOG.info("Hierarchical reconciliation configured: methods={}, parallel={}, bootstrapSamples={}",
                service.labels(), props.isParallel(), props.getBootstrapSamples());
        return service;
    }

    static HierarchicalReconciler reconcilerFor(ReconciliationProperties.Method method,
                                                ReconciliationProperties props) {
        return switch (method) {
            case BOTTOM_UP -> new BottomUpReconciler();
            case TOP_DOWN -> new TopDownReconciler(props.getTopDownMethod());
        };
    }
}

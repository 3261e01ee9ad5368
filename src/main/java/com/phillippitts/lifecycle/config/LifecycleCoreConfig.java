package com.phillippitts.lifecycle.config;

import com.phillippitts.lifecycle.config.properties.ErrorRecoveryProperties;
import com.phillippitts.lifecycle.config.properties.StatusCoordinatorProperties;
import com.phillippitts.lifecycle.service.coordination.ErrorCoordinator;
import com.phillippitts.lifecycle.service.event.DefaultEventDispatcher;
import com.phillippitts.lifecycle.service.event.EventDispatcher;
import com.phillippitts.lifecycle.service.metrics.JvmResourceSnapshotProvider;
import com.phillippitts.lifecycle.service.metrics.LifecycleMetrics;
import com.phillippitts.lifecycle.service.metrics.MetricsSink;
import com.phillippitts.lifecycle.service.metrics.MicrometerMetricsSink;
import com.phillippitts.lifecycle.service.metrics.ResourceSnapshotProvider;
import com.phillippitts.lifecycle.service.recovery.CircuitBreakerRegistry;
import com.phillippitts.lifecycle.service.recovery.ErrorAggregation;
import com.phillippitts.lifecycle.service.recovery.ErrorRecoveryEngine;
import com.phillippitts.lifecycle.service.recovery.RecoveryAction;
import com.phillippitts.lifecycle.service.recovery.Sleeper;
import com.phillippitts.lifecycle.service.status.LoggingStatusReportSink;
import com.phillippitts.lifecycle.service.status.RuleBasedStatusValidator;
import com.phillippitts.lifecycle.service.status.StatusChangeListener;
import com.phillippitts.lifecycle.service.status.StatusCoordinator;
import com.phillippitts.lifecycle.service.status.StatusReportSink;
import com.phillippitts.lifecycle.service.status.StatusValidator;
import com.phillippitts.lifecycle.service.status.TransitionRules;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Composition root: every collaborator is built explicitly and passed by constructor.
 *
 * <p>An application can supply a {@link RecoveryAction} bean to act as the recovery
 * engine's fallback handler, and a {@link StatusChangeListener} bean to observe every
 * completed transition synchronously.
 */
@Configuration
public class LifecycleCoreConfig {

    private final StatusCoordinatorProperties statusProperties;
    private final ErrorRecoveryProperties recoveryProperties;

    public LifecycleCoreConfig(StatusCoordinatorProperties statusProperties,
                               ErrorRecoveryProperties recoveryProperties) {
        this.statusProperties = statusProperties;
        this.recoveryProperties = recoveryProperties;
    }

    @Bean
    public Clock lifecycleClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResourceSnapshotProvider resourceSnapshotProvider(Clock lifecycleClock) {
        return new JvmResourceSnapshotProvider(lifecycleClock);
    }

    @Bean
    public LifecycleMetrics lifecycleMetrics(MeterRegistry meterRegistry) {
        return new LifecycleMetrics(meterRegistry);
    }

    @Bean
    public MetricsSink metricsSink(LifecycleMetrics lifecycleMetrics, MeterRegistry meterRegistry) {
        return new MicrometerMetricsSink(lifecycleMetrics, meterRegistry);
    }

    @Bean
    public EventDispatcher eventDispatcher(@Qualifier("dispatchExecutor") Executor dispatchExecutor) {
        return new DefaultEventDispatcher(dispatchExecutor);
    }

    /**
     * Built-in rule tables plus any {@code lifecycle.status.transitions} entries.
     */
    @Bean
    public TransitionRules transitionRules() {
        return TransitionRules.defaults().withConfigured(statusProperties.getTransitions());
    }

    @Bean
    public StatusValidator statusValidator(TransitionRules transitionRules,
                                           @Qualifier("validationExecutor") Executor validationExecutor) {
        return new RuleBasedStatusValidator(transitionRules, validationExecutor);
    }

    @Bean
    public StatusReportSink statusReportSink() {
        return new LoggingStatusReportSink();
    }

    @Bean
    public StatusCoordinator statusCoordinator(StatusValidator statusValidator,
                                               EventDispatcher eventDispatcher,
                                               MetricsSink metricsSink,
                                               StatusReportSink statusReportSink,
                                               ObjectProvider<StatusChangeListener> statusChangeListener,
                                               @Qualifier("subscriberExecutor") Executor subscriberExecutor,
                                               Clock lifecycleClock) {
        return new StatusCoordinator(statusProperties, statusValidator, eventDispatcher, metricsSink,
                statusReportSink, statusChangeListener.getIfAvailable(() -> StatusChangeListener.NO_OP),
                subscriberExecutor, lifecycleClock);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return new CircuitBreakerRegistry();
    }

    @Bean
    public ErrorAggregation errorAggregation(Clock lifecycleClock, ResourceSnapshotProvider resourceSnapshotProvider) {
        return new ErrorAggregation(lifecycleClock, resourceSnapshotProvider);
    }

    @Bean
    public ErrorRecoveryEngine errorRecoveryEngine(ObjectProvider<RecoveryAction> fallbackHandler,
                                                   CircuitBreakerRegistry circuitBreakerRegistry,
                                                   ErrorAggregation errorAggregation,
                                                   LifecycleMetrics lifecycleMetrics,
                                                   Clock lifecycleClock) {
        return new ErrorRecoveryEngine(recoveryProperties, fallbackHandler.getIfAvailable(),
                circuitBreakerRegistry, errorAggregation, lifecycleMetrics, Sleeper.THREAD_SLEEP, lifecycleClock);
    }

    @Bean
    public ErrorCoordinator errorCoordinator(StatusCoordinator statusCoordinator,
                                             ErrorRecoveryEngine errorRecoveryEngine,
                                             ResourceSnapshotProvider resourceSnapshotProvider,
                                             Clock lifecycleClock) {
        return new ErrorCoordinator(statusCoordinator, errorRecoveryEngine, resourceSnapshotProvider,
                lifecycleClock);
    }
}

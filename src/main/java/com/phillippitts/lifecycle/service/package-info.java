/**
 * Service layer of lifecycle-core.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.event} - Typed event dispatch with validate-then-handle fan-out</li>
 *   <li>{@code service.status} - Status coordinator, transition rules, validators and history</li>
 *   <li>{@code service.recovery} - Error recovery engine (circuit breaker, retry, fallback)
 *       and error aggregation</li>
 *   <li>{@code service.coordination} - Error coordinator tying status marking and recovery together</li>
 *   <li>{@code service.metrics} - Micrometer instrumentation and resource snapshots</li>
 *   <li>{@code service.health} - Actuator health indicator for recovery</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Collaborators are plain classes wired in {@code LifecycleCoreConfig}</li>
 *   <li>Every dependency is passed by constructor, so tests can substitute any of them</li>
 *   <li>Services throw {@code LifecycleException} subtypes, never checked exceptions</li>
 *   <li>Services are thread-safe</li>
 * </ul>
 */
package com.phillippitts.lifecycle.service;

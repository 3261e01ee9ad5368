/**
 * Exception hierarchy for lifecycle-core.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.lifecycle.exception.LifecycleException} - Base exception
 *       carrying an {@link com.phillippitts.lifecycle.exception.ErrorKind}, component and
 *       context map</li>
 *   <li>{@link com.phillippitts.lifecycle.exception.StatusValidationException} - Malformed
 *       transition context or rejected transition ({@code ValidationError})</li>
 *   <li>{@link com.phillippitts.lifecycle.exception.ValidationTimeoutException} - Validator
 *       did not answer in time ({@code TimeoutError})</li>
 *   <li>{@link com.phillippitts.lifecycle.exception.CircuitBreakerOpenException} - Recovery
 *       refused because the breaker is open ({@code CircuitBreakerError})</li>
 *   <li>{@link com.phillippitts.lifecycle.exception.HandlerExecutionException} - An event
 *       handler or subscriber failed ({@code ExecutionError})</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining via {@code cause}.
 *
 * @see com.phillippitts.lifecycle.exception.LifecycleExceptionBuilder
 */
package com.phillippitts.lifecycle.exception;

/**
 * Utility package for ToonLink.
 *
 * <p>
 * Provides reusable helpers used across the project, including CSV utilities, error reporting and
 * log-path helpers.
 * </p>
 *
 * <p>
 * Utilities in this package are designed to be stateless and to keep core workflows focused on
 * orchestration.
 * </p>
 */
package io.github.yok.toonlink.util;

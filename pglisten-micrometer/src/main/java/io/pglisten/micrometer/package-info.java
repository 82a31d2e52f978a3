/**
 * Micrometer binding for listener metrics.
 */
package io.pglisten.micrometer;

/**
 * Observability hooks for signals and registries. The SLF4J adapter is the
 * only place the library logs.
 */
package com.questrail.stabilizer.observability;

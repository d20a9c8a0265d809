/**
 * Dependency-ordered, checkpointed execution of a run plan with per-group
 * ordering and branch-local failure handling.
 */
package io.ticketforge.engine;

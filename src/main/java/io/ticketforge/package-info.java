/**
 * TicketForge source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.ticketforge.runtime.Provisioner} wires storage, audit, client and engine for a namespace.</li>
 *   <li>{@code io.ticketforge.plan.PlanBuilder} turns a manifest into a dependency-ordered task plan.</li>
 *   <li>{@code io.ticketforge.engine.ProvisioningEngine} executes the plan, checkpointing every step.</li>
 *   <li>{@code io.ticketforge.storage.SqliteCheckpointStore} is the authoritative resume state.</li>
 * </ul>
 */
package io.ticketforge;

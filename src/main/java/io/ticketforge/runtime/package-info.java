/**
 * Facade that owns a namespace's database, checkpoint, run history, audit log
 * and shared request throttle, and drives preview, run and reconciliation.
 */
package io.ticketforge.runtime;

/**
 * Errors surfaced synchronously to callers of a task processor adapter.
 * Handler failures never appear here; they end up as a FAILURE task status.
 */
package com.sailfish.taskproc.exception;

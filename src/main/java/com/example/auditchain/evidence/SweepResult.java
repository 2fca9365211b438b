package com.example.auditchain.evidence;

/**
 * Totals of one TTL sweep. {@code failed} counts artifacts that were due but could not be deleted.
 */
public record SweepResult(int scanned, int deleted, int failed) { }

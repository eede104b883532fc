package com.quartermaster.isolation;

/**
 * Outcome of bringing a branch up to date with its upstream.
 *
 * @param branch   branch that was updated
 * @param upstream branch merged or rebased into it
 * @param outcome  what happened
 * @param message  detail for logs and escalations
 */
public record SyncResult(String branch, String upstream, Outcome outcome, String message) {

    public enum Outcome { SYNCED, SKIPPED, FAILED }

    public static SyncResult synced(String branch, String upstream, String message) {
        return new SyncResult(branch, upstream, Outcome.SYNCED, message);
    }

    public static SyncResult skipped(String branch, String upstream, String reason) {
        return new SyncResult(branch, upstream, Outcome.SKIPPED, reason);
    }

    public static SyncResult failed(String branch, String upstream, String error) {
        return new SyncResult(branch, upstream, Outcome.FAILED, error);
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}

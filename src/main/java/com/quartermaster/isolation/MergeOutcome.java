package com.quartermaster.isolation;

import com.quartermaster.core.model.MergeStrategy;

import java.util.List;

/**
 * Result of integrating a task branch into its target.
 *
 * @param success    whether the target now contains the task's work
 * @param strategy   strategy that was used
 * @param conflicted whether the pre-merge probe found conflicts (no merge was attempted)
 * @param conflicts  files the probe reported as conflicting
 * @param error      failure detail, null on success
 */
public record MergeOutcome(
    boolean success,
    MergeStrategy strategy,
    boolean conflicted,
    List<String> conflicts,
    String error
) {

    public MergeOutcome {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static MergeOutcome merged(MergeStrategy strategy) {
        return new MergeOutcome(true, strategy, false, List.of(), null);
    }

    public static MergeOutcome conflicted(MergeStrategy strategy, List<String> files) {
        return new MergeOutcome(false, strategy, true, files, "Merge conflicts detected");
    }

    public static MergeOutcome failed(MergeStrategy strategy, String error) {
        return new MergeOutcome(false, strategy, false, List.of(), error);
    }
}

package com.quartermaster.isolation;

/**
 * Commit counts between a branch and its upstream.
 *
 * @param ahead  commits on the branch that the upstream lacks
 * @param behind commits on the upstream that the branch lacks
 */
public record AheadBehind(int ahead, int behind) {

    public static AheadBehind unknown() {
        return new AheadBehind(0, 0);
    }
}

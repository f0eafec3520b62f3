package com.github.ylgrgyq.phsp;

/**
 * What a writer does with a record that has no {@code zlast} when it writes an {@link PhspFormat#Extended} file.
 * Records written into a {@link PhspFormat#Standard} file always drop their {@code zlast}.
 */
public enum MissingZlastPolicy {
    /**
     * Fail the write with an {@link IllegalArgumentException}.
     */
    Reject,
    /**
     * Write the configured default value as {@code zlast}.
     */
    FillDefault
}

package com.docinsight.core.repair;

import java.time.Duration;

/**
 * Outcome of an external process run.
 *
 * @param exitCode process exit code, negative if the process timed out or could not start
 * @param stdout captured standard output
 * @param stderr captured standard error, or the start failure message
 * @param timedOut true if the process was killed after exceeding its timeout
 * @param duration wall-clock run time
 */
public record ProcessResult(
    int exitCode,
    String stdout,
    String stderr,
    boolean timedOut,
    Duration duration
) {
    /** Exit code reported when the process exceeded its timeout. */
    public static final int TIMED_OUT = -1;

    /** Exit code reported when the process could not be started. */
    public static final int NOT_STARTED = -2;

    public ProcessResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        duration = duration == null ? Duration.ZERO : duration;
    }

    /**
     * Returns whether the process exited with code 0.
     *
     * @return true on success
     */
    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }
}

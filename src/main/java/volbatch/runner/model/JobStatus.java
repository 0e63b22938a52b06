package volbatch.runner.model;

/**
 * Terminal status of a job.
 */
public enum JobStatus {
    /** Tool exited with code 0 */
    DONE,
    /** Tool could not be launched, exited non-zero, or the wait was interrupted */
    FAILED,
    /** Output file could not be created; the tool was never started */
    SKIPPED
}

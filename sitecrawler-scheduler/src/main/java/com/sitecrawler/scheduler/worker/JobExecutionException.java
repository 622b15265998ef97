package com.sitecrawler.scheduler.worker;

/**
 * A job failed. May carry what the job produced before failing.
 */
public class JobExecutionException extends RuntimeException {

    private final JobOutcome partialOutcome;

    public JobExecutionException(String message) {
        this(message, null, null);
    }

    public JobExecutionException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public JobExecutionException(String message, JobOutcome partialOutcome, Throwable cause) {
        super(message, cause);
        this.partialOutcome = partialOutcome;
    }

    /**
     * @return partial results, or null if nothing is known
     */
    public JobOutcome getPartialOutcome() {
        return partialOutcome;
    }
}

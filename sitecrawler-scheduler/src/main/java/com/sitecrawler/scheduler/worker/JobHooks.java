package com.sitecrawler.scheduler.worker;

/**
 * Progress callbacks a worker may invoke while a job runs. Implementations
 * must tolerate calls from any thread.
 */
public interface JobHooks {

    void onLog(String message);

    /**
     * An item (page URL) was processed.
     */
    void onItem(String ref);

    void onDone(long count);

}

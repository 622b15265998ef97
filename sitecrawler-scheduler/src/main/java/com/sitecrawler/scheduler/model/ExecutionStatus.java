package com.sitecrawler.scheduler.model;

public enum ExecutionStatus {
    RUNNING, COMPLETED, FAILED;

    public boolean isFinal() {
        return this != RUNNING;
    }
}

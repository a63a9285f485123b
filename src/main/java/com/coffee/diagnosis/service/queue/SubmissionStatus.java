package com.coffee.diagnosis.service.queue;

public enum SubmissionStatus {

    /** Queued; poll the status endpoint for the result. */
    PROCESSING,

    /** The queue was unavailable and the request ran synchronously. */
    COMPLETED
}

package io.hhplus.eventledger.application.usecase.event;

public enum RepublishOutcome {
    PUBLISHED,
    NOT_FOUND,
    PUBLISH_FAILED,
    STORE_UNAVAILABLE
}

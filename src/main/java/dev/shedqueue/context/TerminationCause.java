package dev.shedqueue.context;

public enum TerminationCause {
    CANCELLED,
    DEADLINE_EXCEEDED
}

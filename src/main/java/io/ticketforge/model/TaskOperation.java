package io.ticketforge.model;

public enum TaskOperation {
    CREATE,
    SET_FIELD,
    LINK
}

package org.jellyfinmanager.model.enums;

public enum TaskStatus {
    COMPLETED,
    FAILED
}

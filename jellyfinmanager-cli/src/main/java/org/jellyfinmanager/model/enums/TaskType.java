package org.jellyfinmanager.model.enums;

import lombok.Getter;

@Getter
public enum TaskType {
    BACKUP("backup"),
    RESTORE("restore"),
    FIND_MISSING("find-missing");

    private final String option;

    TaskType(String option) {
        this.option = option;
    }
}

package org.jellyfinmanager.model.dto;

public record RestoreResult(int successful, int failed) {

    public static final RestoreResult EMPTY = new RestoreResult(0, 0);

    public static RestoreResult failedAll(int count) {
        return new RestoreResult(0, count);
    }

    public RestoreResult plus(RestoreResult other) {
        return new RestoreResult(successful + other.successful, failed + other.failed);
    }

    public int total() {
        return successful + failed;
    }
}

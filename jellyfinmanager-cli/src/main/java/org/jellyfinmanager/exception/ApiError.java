package org.jellyfinmanager.exception;

import lombok.Getter;

@Getter
public enum ApiError {
    MISSING_CONFIGURATION("Missing required configuration: %s"),
    JELLYFIN_REQUEST_FAILED("Jellyfin request %s failed: %s"),
    JELLYFIN_USER_NOT_FOUND("User not found: %s"),
    SERIES_NOT_FOUND("Series not found: %s"),
    TVDB_LOGIN_FAILED("TVDB login failed: %s"),
    TVDB_NOT_AUTHENTICATED("Not authenticated with TVDB, login first"),
    TVDB_REQUEST_FAILED("TVDB request %s failed: %s"),
    BACKUP_READ_FAILED("Reading backup file %s failed: %s"),
    BACKUP_WRITE_FAILED("Writing backup file %s failed: %s");

    private final String message;

    ApiError(String message) {
        this.message = message;
    }

    public APIException createException(Object... details) {
        return new APIException(this, String.format(message, details));
    }

    public APIException createException(Throwable cause, Object... details) {
        return new APIException(this, String.format(message, details), cause);
    }
}

package com.versionrace.core.exception;

import java.util.UUID;

/**
 * Thrown when a writer's conditional update affected a different number of rows
 * on its second attempt than on its first.
 *
 * This is the expected outcome for the losing writer of a race, not an
 * infrastructure failure, so it deliberately does not extend {@link StorageException}.
 */
public class ConcurrentUpdateException extends VersionRaceException {
    
    public static final String ERROR_CODE = "CONCURRENT_UPDATE";
    
    private final UUID key;
    private final long expectedVersion;
    private final long firstCount;
    private final long secondCount;
    
    public ConcurrentUpdateException(UUID key, long expectedVersion, long firstCount, long secondCount) {
        super(ERROR_CODE, String.format(
            "Concurrent update violation on entity %s at version %d: first attempt affected %d row(s), second attempt affected %d",
            key, expectedVersion, firstCount, secondCount
        ));
        this.key = key;
        this.expectedVersion = expectedVersion;
        this.firstCount = firstCount;
        this.secondCount = secondCount;
    }
    
    public UUID getKey() {
        return key;
    }
    
    public long getExpectedVersion() {
        return expectedVersion;
    }
    
    public long getFirstCount() {
        return firstCount;
    }
    
    public long getSecondCount() {
        return secondCount;
    }
}

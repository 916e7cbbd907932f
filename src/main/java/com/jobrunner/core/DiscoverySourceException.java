package com.jobrunner.core;

/**
 * Exception thrown when one job source (a jobs directory, a jar, or a Git clone)
 * cannot be scanned or synchronized.
 *
 * <p>Discovery logs it and skips that source; other sources still load and no single
 * execution ever sees this exception.</p>
 */
public class DiscoverySourceException extends Exception {

    private final String sourceGrouping;

    public DiscoverySourceException(String sourceGrouping, String message) {
        super(message);
        this.sourceGrouping = sourceGrouping;
    }

    public DiscoverySourceException(String sourceGrouping, String message, Throwable cause) {
        super(message, cause);
        this.sourceGrouping = sourceGrouping;
    }

    public String getSourceGrouping() {
        return sourceGrouping;
    }
}

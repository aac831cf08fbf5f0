package com.williamcallahan.docarchive.support;

/**
 * Reads process environment variables. Injected so that environment precedence can be
 * exercised without mutating the real process environment.
 */
@FunctionalInterface
public interface EnvironmentVariableSource {

    /**
     * Returns the variable's value, or {@code null} when it is not set.
     */
    String get(String name);

    static EnvironmentVariableSource system() {
        return System::getenv;
    }
}

package io.github.byzatic.ratelimit.token_bucket_limiter;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a limiter is built or reconfigured with parameters that break its invariants.
 * The limiter state is left untouched whenever this is thrown.
 */
public class LimiterConfigurationException extends Exception {
    private final ConfigurationError error;

    public LimiterConfigurationException(@NotNull ConfigurationError error) {
        super(error.message());
        this.error = error;
    }

    public LimiterConfigurationException(@NotNull ConfigurationError error, String detail) {
        super(error.message() + ": " + detail);
        this.error = error;
    }

    public LimiterConfigurationException(@NotNull ConfigurationError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public @NotNull ConfigurationError getError() {
        return error;
    }
}

package com.codurance.resilience;

import com.codurance.resilience.reliability.RetryAttempt;

/**
 * Notified once per completed call inside a {@link RetryExecutor} run.
 */
@FunctionalInterface
public interface AttemptListener {

    AttemptListener NONE = (operation, attempt) -> { };

    void onAttempt(String operation, RetryAttempt attempt);
}

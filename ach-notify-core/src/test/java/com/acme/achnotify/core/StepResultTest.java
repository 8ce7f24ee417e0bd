package com.acme.achnotify.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StepResult
 */
class StepResultTest {

    @Test
    @DisplayName("attempt - should wrap the returned value")
    void testAttemptSuccess() {
        StepResult<String> result = StepResult.attempt(ErrorKind.TEMPLATE_RESOLUTION, () -> "42");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isFailure()).isFalse();
        assertThat(result.value()).isEqualTo("42");
        assertThat(result.errorKind()).isNull();
    }

    @Test
    @DisplayName("attempt - should capture a runtime failure under the given kind")
    void testAttemptFailure() {
        TemplateNotFoundException boom = new TemplateNotFoundException("A9");

        StepResult<String> result = StepResult.attempt(ErrorKind.TEMPLATE_RESOLUTION, () -> {
            throw boom;
        });

        assertThat(result.isFailure()).isTrue();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.TEMPLATE_RESOLUTION);
        assertThat(result.error()).isEqualTo("No email template found for account ID: A9");
        assertThat(result.cause()).isSameAs(boom);
        assertThat(result.value()).isNull();
    }

    @Test
    @DisplayName("failure - should fall back to the exception class when there is no message")
    void testFailureWithoutMessage() {
        StepResult<Void> result = StepResult.failure(ErrorKind.SEND, new NullPointerException());

        assertThat(result.error()).isEqualTo("java.lang.NullPointerException");
    }

    @Test
    @DisplayName("attemptRun - should run the call and report success")
    void testAttemptRun() {
        AtomicBoolean ran = new AtomicBoolean();

        StepResult<Void> result = StepResult.attemptRun(ErrorKind.PERSISTENCE, () -> ran.set(true));

        assertThat(ran).isTrue();
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("attemptRun - should not swallow errors that are not runtime exceptions")
    void testAttemptRunError() {
        assertThatThrownBy(() -> StepResult.attemptRun(ErrorKind.SEND, () -> {
            throw new AssertionError("fatal");
        })).isInstanceOf(AssertionError.class);
    }
}

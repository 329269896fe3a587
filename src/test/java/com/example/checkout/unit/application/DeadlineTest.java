package com.example.checkout.unit.application;

import com.example.checkout.application.service.Deadline;
import com.example.checkout.application.service.DeadlineExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Deadline Tests")
class DeadlineTest {

    @Test
    @DisplayName("should_pass_through_call_that_finishes_in_time")
    void should_pass_through_call_that_finishes_in_time() throws Exception {
        Deadline deadline = Deadline.after(Duration.ofSeconds(1));

        String result = deadline.bound(CompletableFuture.completedFuture("done")).get(1, TimeUnit.SECONDS);

        assertThat(result).isEqualTo("done");
        assertThat(deadline.isExpired()).isFalse();
    }

    @Test
    @DisplayName("should_cancel_call_and_fail_when_budget_runs_out")
    void should_cancel_call_and_fail_when_budget_runs_out() {
        Deadline deadline = Deadline.after(Duration.ofMillis(100));
        CompletableFuture<String> call = new CompletableFuture<>();

        CompletableFuture<String> bounded = deadline.bound(call);

        assertThatThrownBy(() -> bounded.get(2, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(DeadlineExceededException.class);
        assertThat(call).isCancelled();
        assertThat(deadline.isExpired()).isTrue();
    }

    @Test
    @DisplayName("should_fail_immediately_when_already_expired")
    void should_fail_immediately_when_already_expired() throws Exception {
        Deadline deadline = Deadline.after(Duration.ofMillis(1));
        Thread.sleep(20);
        CompletableFuture<String> call = new CompletableFuture<>();

        CompletableFuture<String> bounded = deadline.bound(call);

        assertThat(bounded).isCompletedExceptionally();
        assertThat(call).isCancelled();
        assertThat(deadline.remaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("should_propagate_call_failure_unchanged")
    void should_propagate_call_failure_unchanged() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(1));

        CompletableFuture<String> bounded = deadline.bound(
                CompletableFuture.failedFuture(new IllegalStateException("boom")));

        assertThatThrownBy(() -> bounded.get(1, TimeUnit.SECONDS))
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}

package com.example.checkout.infrastructure.adapter.out;

import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.infrastructure.exception.NonRetryableServiceException;
import com.example.checkout.infrastructure.exception.RetryableServiceException;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Translation of collaborator HTTP errors into {@link StepOutcome} failures.
 *
 * <ul>
 *     <li>4xx → {@link NonRetryableServiceException} → {@code rejected}, not retryable</li>
 *     <li>5xx or connection error → {@link RetryableServiceException} → {@code unavailable}, retryable</li>
 *     <li>time limit exceeded → {@code timeout}, retryable</li>
 * </ul>
 */
public final class CollaboratorFailures {

    private CollaboratorFailures() {
    }

    /**
     * Turns 4xx and 5xx answers into the matching service exception, carrying the response body.
     */
    public static WebClient.ResponseSpec onErrorStatus(WebClient.ResponseSpec spec, String collaborator) {
        return spec
                .onStatus(HttpStatusCode::is4xxClientError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new NonRetryableServiceException(
                                        collaborator, response.statusCode().value(),
                                        describe(collaborator, response.statusCode().value(), body)))))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new RetryableServiceException(
                                        collaborator, response.statusCode().value(),
                                        describe(collaborator, response.statusCode().value(), body)))));
    }

    public static <T> StepOutcome<T> toOutcome(String collaborator, Throwable throwable) {
        Throwable cause = unwrap(throwable);

        if (isTimeout(cause)) {
            return StepOutcome.timeout(collaborator + " did not answer within its time limit");
        }
        if (cause instanceof NonRetryableServiceException e) {
            return StepOutcome.failure(StepOutcome.REJECTED, e.getMessage(), false);
        }
        if (cause instanceof RetryableServiceException e) {
            return StepOutcome.failure(StepOutcome.UNAVAILABLE, e.getMessage(), true);
        }
        if (cause instanceof WebClientResponseException e) {
            return e.getStatusCode().is4xxClientError()
                    ? StepOutcome.failure(StepOutcome.REJECTED, e.getMessage(), false)
                    : StepOutcome.failure(StepOutcome.UNAVAILABLE, e.getMessage(), true);
        }
        if (cause instanceof WebClientRequestException) {
            return StepOutcome.failure(StepOutcome.UNAVAILABLE,
                    collaborator + " unreachable: " + cause.getMessage(), true);
        }
        if (cause instanceof CancellationException) {
            return StepOutcome.failure(StepOutcome.ERROR, collaborator + " call cancelled", false);
        }
        return StepOutcome.failure(StepOutcome.ERROR,
                collaborator + " call failed: " + cause.getMessage(), false);
    }

    /**
     * HTTP status carried by a service exception, or 0 when there is none.
     */
    public static int statusOf(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        if (cause instanceof NonRetryableServiceException e) {
            return e.getStatusCode();
        }
        if (cause instanceof RetryableServiceException e) {
            return e.getStatusCode();
        }
        if (cause instanceof WebClientResponseException e) {
            return e.getStatusCode().value();
        }
        return 0;
    }

    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean isTimeout(Throwable cause) {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static String describe(String collaborator, int status, String body) {
        return body.isBlank()
                ? collaborator + " answered " + status
                : collaborator + " answered " + status + ": " + body;
    }
}

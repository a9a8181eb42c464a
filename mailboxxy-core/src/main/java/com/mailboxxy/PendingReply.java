package com.mailboxxy;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Implementation of Reply backed by CompletableFuture.
 */
record PendingReply<T>(CompletableFuture<T> future) implements Reply<T> {

    @Override
    public T get() {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReplyException("Interrupted while waiting for reply", e);
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        } catch (CancellationException e) {
            throw new ReplyException("Reply was cancelled", e);
        }
    }

    @Override
    public T get(Duration timeout) throws TimeoutException {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReplyException("Interrupted while waiting for reply", e);
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        } catch (CancellationException e) {
            throw new ReplyException("Reply was cancelled", e);
        }
    }

    @Override
    public Result<T> await() {
        try {
            return Result.success(get());
        } catch (RuntimeException e) {
            return Result.failure(e);
        }
    }

    @Override
    public Result<T> await(Duration timeout) {
        try {
            return Result.success(get(timeout));
        } catch (TimeoutException | RuntimeException e) {
            return Result.failure(e);
        }
    }

    @Override
    public Optional<Result<T>> poll() {
        if (!future.isDone()) {
            return Optional.empty();
        }
        return Optional.of(await());
    }

    @Override
    public boolean isDone() {
        return future.isDone();
    }

    @Override
    public <U> Reply<U> map(Function<T, U> fn) {
        return new PendingReply<>(future.thenApply(fn));
    }

    @Override
    public Reply<T> recover(Function<Throwable, T> fn) {
        return new PendingReply<>(future.exceptionally(error -> fn.apply(unwrap(error))));
    }

    @Override
    public void onComplete(Consumer<T> onSuccess, Consumer<Throwable> onFailure) {
        future.whenComplete((value, error) -> {
            if (error != null) {
                onFailure.accept(unwrap(error));
            } else {
                onSuccess.accept(value);
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
    }

    private static RuntimeException propagate(Throwable cause) {
        Throwable actual = unwrap(cause);
        if (actual instanceof MailboxException mailboxException) {
            return mailboxException;
        }
        return new ReplyException("Reply failed", actual);
    }
}

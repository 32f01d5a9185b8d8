package com.chartboost.core.consent.usercentrics;

import com.chartboost.core.consent.usercentrics.sdk.UsercentricsError;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsOptions;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsReadyStatus;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsSdk;
import com.chartboost.core.error.ConsentError;
import com.chartboost.core.error.ConsentException;
import com.chartboost.core.log.Logger;
import com.chartboost.core.log.LoggerFactory;
import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs actions against the Usercentrics SDK once it reports ready.
 * <p>
 * If the SDK is not ready and options are known, it is initialized once more and asked again. A second
 * failure clears the consent state and fails with {@link ConsentError#INITIALIZATION_ERROR}. Each readiness
 * check is answered by whichever SDK callback comes first, the other one is ignored. Actions, the
 * retry and the failure handling all run on the main context. The returned future is resolved at most once,
 * whatever the SDK does with its callbacks.
 */
public class UsercentricsReadinessGate {

    private static final Logger logger = LoggerFactory.getLogger(UsercentricsReadinessGate.class);

    private final UsercentricsSdk usercentricsSdk;
    private final Context mainContext;
    private final Supplier<UsercentricsOptions> optionsSupplier;
    private final Consumer<UsercentricsOptions> initializer;
    private final Runnable initializationFailureHandler;

    public UsercentricsReadinessGate(UsercentricsSdk usercentricsSdk,
                                     Context mainContext,
                                     Supplier<UsercentricsOptions> optionsSupplier,
                                     Consumer<UsercentricsOptions> initializer,
                                     Runnable initializationFailureHandler) {

        this.usercentricsSdk = Objects.requireNonNull(usercentricsSdk);
        this.mainContext = Objects.requireNonNull(mainContext);
        this.optionsSupplier = Objects.requireNonNull(optionsSupplier);
        this.initializer = Objects.requireNonNull(initializer);
        this.initializationFailureHandler = Objects.requireNonNull(initializationFailureHandler);
    }

    public <T> Future<T> executeWhenReady(Function<UsercentricsReadyStatus, Future<T>> action) {
        return executeWhenReady(action, initializationFailureHandler);
    }

    /**
     * Same as {@link #executeWhenReady(Function)}, running the given handler instead of the default one when
     * the retry fails.
     */
    public <T> Future<T> executeWhenReady(Function<UsercentricsReadyStatus, Future<T>> action,
                                          Runnable failureHandler) {

        final Promise<T> promise = Promise.promise();

        try {
            checkReadiness(
                    readyStatus -> executeOnMainContext(action, readyStatus, promise),
                    error -> retryInitialization(action, error, failureHandler, promise));
        } catch (Exception e) {
            logger.warn("{} when checking Usercentrics readiness", e, e);
            resolve(promise, Future.failedFuture(new ConsentException(ConsentError.UNKNOWN, e)));
        }

        return promise.future();
    }

    /**
     * Asks the SDK whether it is ready. Only the first callback of this check is acted upon.
     */
    private void checkReadiness(Handler<UsercentricsReadyStatus> onReady, Handler<UsercentricsError> onNotReady) {
        final AtomicBoolean answered = new AtomicBoolean();

        usercentricsSdk.isReady(
                readyStatus -> {
                    if (answered.compareAndSet(false, true)) {
                        onReady.handle(readyStatus);
                    } else {
                        logger.debug("Ignoring readiness success reported after the check was answered");
                    }
                },
                error -> {
                    if (answered.compareAndSet(false, true)) {
                        onNotReady.handle(error);
                    } else {
                        logger.debug("Ignoring readiness failure reported after the check was answered: {}",
                                messageOf(error));
                    }
                });
    }

    private <T> void retryInitialization(Function<UsercentricsReadyStatus, Future<T>> action,
                                         UsercentricsError error,
                                         Runnable failureHandler,
                                         Promise<T> promise) {

        if (promise.future().isComplete()) {
            logger.debug("Ignoring readiness failure for an already resolved action: {}", messageOf(error));
            return;
        }

        final UsercentricsOptions options = optionsSupplier.get();
        if (options == null) {
            logger.debug("Usercentrics is not ready ({}) and no options are available to initialize it",
                    messageOf(error));
            resolve(promise, initializationFailure());
            return;
        }

        mainContext.runOnContext(ignored -> {
            logger.debug("Usercentrics is not ready ({}). Retrying initialization", messageOf(error));
            try {
                initializer.accept(options);
                checkReadiness(
                        readyStatus -> executeOnMainContext(action, readyStatus, promise),
                        retryError -> mainContext.runOnContext(v ->
                                failInitialization(retryError, failureHandler, promise)));
            } catch (Exception e) {
                logger.warn("{} when retrying Usercentrics initialization", e, e);
                failInitialization(UsercentricsError.of(e.getMessage(), e), failureHandler, promise);
            }
        });
    }

    private <T> void failInitialization(UsercentricsError error, Runnable failureHandler, Promise<T> promise) {
        if (promise.future().isComplete()) {
            logger.debug("Ignoring initialization failure for an already resolved action: {}", messageOf(error));
            return;
        }

        logger.debug("{} when retrying initialization. Clearing consents", messageOf(error));
        failureHandler.run();
        resolve(promise, initializationFailure());
    }

    private <T> void executeOnMainContext(Function<UsercentricsReadyStatus, Future<T>> action,
                                          UsercentricsReadyStatus readyStatus,
                                          Promise<T> promise) {

        mainContext.runOnContext(ignored -> {
            if (promise.future().isComplete()) {
                logger.debug("Skipping Usercentrics action, its result has already been resolved");
                return;
            }
            executeSafely(action, readyStatus).onComplete(result -> resolve(promise, result));
        });
    }

    private static <T> Future<T> executeSafely(Function<UsercentricsReadyStatus, Future<T>> action,
                                               UsercentricsReadyStatus readyStatus) {
        final Future<T> result;
        try {
            result = action.apply(readyStatus);
        } catch (Exception e) {
            logger.warn("{} when executing Usercentrics action", e, e);
            return Future.failedFuture(new ConsentException(ConsentError.UNKNOWN, e));
        }

        return result != null
                ? result.recover(UsercentricsReadinessGate::toConsentFailure)
                : Future.failedFuture(new ConsentException(ConsentError.UNKNOWN));
    }

    private static <T> Future<T> toConsentFailure(Throwable throwable) {
        if (throwable instanceof ConsentException) {
            return Future.failedFuture(throwable);
        }

        logger.warn("{} when executing Usercentrics action", throwable, throwable);
        return Future.failedFuture(new ConsentException(ConsentError.UNKNOWN, throwable));
    }

    private static <T> Future<T> initializationFailure() {
        return Future.failedFuture(new ConsentException(ConsentError.INITIALIZATION_ERROR));
    }

    private static <T> void resolve(Promise<T> promise, AsyncResult<T> result) {
        final boolean resolved = result.succeeded()
                ? promise.tryComplete(result.result())
                : promise.tryFail(result.cause());

        if (!resolved) {
            logger.debug("Usercentrics action was already resolved, dropping late result");
        }
    }

    private static String messageOf(UsercentricsError error) {
        return error != null ? error.getMessage() : null;
    }
}

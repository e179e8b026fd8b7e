package com.nft.market.nft_market.external;

import java.util.function.Supplier;

import com.nft.market.nft_market.exception.MarketplaceException;

import lombok.extern.slf4j.Slf4j;

/**
 * Wraps a single call into a collaborator and classifies how it failed.
 *
 * Each external call of the settlement flow goes through here on its own, so
 * every failure is handled at the step that caused it.
 */
@Slf4j
public final class ExternalCalls {

    private ExternalCalls() {
    }

    public static <T> CallResult<T> attempt(String operation, Supplier<T> call) {
        try {
            return CallResult.success(call.get());
        } catch (MarketplaceException e) {
            // raised by our own callback further down the call chain
            log.debug("{} reverted by nested marketplace error: {}", operation, e.getErrorCode());
            return CallResult.failure(new CallFailure(FailureKind.REASON, e.getMessage(), e));
        } catch (ExternalCallException e) {
            log.debug("{} reverted: {}", operation, e.getReason());
            return CallResult.failure(new CallFailure(FailureKind.REASON, e.getReason(), e));
        } catch (ArithmeticException e) {
            log.debug("{} hit arithmetic fault: {}", operation, e.getMessage());
            return CallResult.failure(new CallFailure(FailureKind.ARITHMETIC, e.getMessage(), e));
        } catch (RuntimeException e) {
            log.debug("{} failed: {}", operation, e.toString());
            return CallResult.failure(new CallFailure(FailureKind.OPAQUE, null, e));
        }
    }

    public static CallResult<Void> attemptRun(String operation, Runnable call) {
        return attempt(operation, () -> {
            call.run();
            return null;
        });
    }
}

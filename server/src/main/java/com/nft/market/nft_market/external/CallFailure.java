package com.nft.market.nft_market.external;

import java.util.Optional;

import com.nft.market.nft_market.exception.MarketplaceException;

import lombok.Getter;

/**
 * Classified failure of one external call.
 */
@Getter
public final class CallFailure {

    private final FailureKind kind;
    private final String reason;
    private final RuntimeException cause;

    CallFailure(FailureKind kind, String reason, RuntimeException cause) {
        this.kind = kind;
        this.reason = reason;
        this.cause = cause;
    }

    /**
     * A call that returned normally but reported that it did nothing.
     */
    public static CallFailure rejected(String reason) {
        return new CallFailure(FailureKind.REASON, reason, null);
    }

    /**
     * A marketplace error raised by a nested callback and carried back through
     * the collaborator unchanged.
     */
    public Optional<MarketplaceException> nestedMarketplaceError() {
        if (cause instanceof MarketplaceException) {
            return Optional.of((MarketplaceException) cause);
        }
        return Optional.empty();
    }

    public String describe() {
        return switch (kind) {
            case REASON -> "reverted: " + reason;
            case ARITHMETIC -> "arithmetic fault" + (reason != null ? " (" + reason + ")" : "");
            case OPAQUE -> "failed without reason";
        };
    }

    @Override
    public String toString() {
        return describe();
    }
}

package com.nft.market.nft_market.exception;

import com.nft.market.nft_market.external.CallFailure;

/**
 * Typed failure of a marketplace request.
 *
 * Carries the identifiers involved so callers can trace the listing or order
 * that failed, and the classified external failure when a collaborator call
 * was the cause.
 */
public class MarketplaceException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Long listingId;
    private final Long orderId;
    private final CallFailure callFailure;

    private MarketplaceException(ErrorCode errorCode, String message, Long listingId, Long orderId,
            CallFailure callFailure) {
        super(message, callFailure != null ? callFailure.getCause() : null);
        this.errorCode = errorCode;
        this.listingId = listingId;
        this.orderId = orderId;
        this.callFailure = callFailure;
    }

    public static MarketplaceException of(ErrorCode errorCode, String message) {
        return new MarketplaceException(errorCode, message, null, null, null);
    }

    public static MarketplaceException forListing(ErrorCode errorCode, long listingId, String message) {
        return new MarketplaceException(errorCode, message, listingId, null, null);
    }

    public static MarketplaceException forOrder(ErrorCode errorCode, Long listingId, long orderId, String message) {
        return new MarketplaceException(errorCode, message, listingId, orderId, null);
    }

    /**
     * Re-raise an external failure with the error code matching its kind.
     */
    public static MarketplaceException external(CallFailure failure, Long listingId, Long orderId, String operation) {
        ErrorCode code = switch (failure.getKind()) {
            case REASON -> ErrorCode.EXTERNAL_CALL_REVERTED;
            case ARITHMETIC -> ErrorCode.EXTERNAL_ARITHMETIC_FAULT;
            case OPAQUE -> ErrorCode.EXTERNAL_CALL_FAILED;
        };
        return withFailure(code, failure, listingId, orderId, operation);
    }

    public static MarketplaceException withFailure(ErrorCode errorCode, CallFailure failure, Long listingId,
            Long orderId, String operation) {
        String message = String.format("%s failed: %s", operation, failure.describe());
        return new MarketplaceException(errorCode, message, listingId, orderId, failure);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Long getListingId() {
        return listingId;
    }

    public Long getOrderId() {
        return orderId;
    }

    public CallFailure getCallFailure() {
        return callFailure;
    }
}

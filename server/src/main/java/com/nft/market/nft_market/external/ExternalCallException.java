package com.nft.market.nft_market.external;

/**
 * Raised by a collaborator that rejects a call with an explicit reason.
 */
public class ExternalCallException extends RuntimeException {

    private final String reason;

    public ExternalCallException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}

package com.nft.market.nft_market.external;

/**
 * How an external collaborator call failed.
 */
public enum FailureKind {
    /** The collaborator rejected the call and said why. */
    REASON,
    /** Overflow, underflow or division by zero inside the collaborator. */
    ARITHMETIC,
    /** Anything else: the collaborator failed without explanation. */
    OPAQUE
}

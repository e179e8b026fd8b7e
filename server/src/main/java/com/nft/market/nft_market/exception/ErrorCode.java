package com.nft.market.nft_market.exception;

/**
 * Error taxonomy for every marketplace request.
 *
 * Each code belongs to a {@link Category}. Only the two drift codes retain the
 * state changes made before they were raised (listing removal and event);
 * every other code aborts the whole request.
 */
public enum ErrorCode {

    INVALID_REGISTRY(Category.VALIDATION, "Item registry address is the zero address"),
    INVALID_PRICE(Category.VALIDATION, "Price is below the minimum fee"),
    INVALID_ADDRESS(Category.VALIDATION, "Address is malformed or zero"),
    INVALID_FEE_PERCENT(Category.VALIDATION, "Fee percent must be between 0 and 10000 basis points"),
    SAME_PARTY(Category.VALIDATION, "Buyer and seller are the same account"),
    ARITHMETIC_OVERFLOW(Category.VALIDATION, "Amount arithmetic left the uint256 range"),

    NOT_AUTHORIZED(Category.AUTHORIZATION, "Caller is neither owner nor approved operator"),
    NOT_ADMIN(Category.AUTHORIZATION, "Caller is not the marketplace admin"),
    UNAUTHORIZED(Category.AUTHORIZATION, "Callback caller is not the configured ledger"),

    INVALID_LISTING(Category.CONSISTENCY, "Listing does not exist"),
    INVALID_ORDER(Category.CONSISTENCY, "Order does not match the ledger callback"),
    ITEM_NOT_FOUND(Category.CONSISTENCY, "Item registry does not know the item"),
    ITEM_NO_LONGER_EXISTS(Category.CONSISTENCY, "Listed item no longer exists", true),
    OWNERSHIP_CHANGED(Category.CONSISTENCY, "Listed item changed owner since listing", true),

    EXTERNAL_CALL_REVERTED(Category.EXTERNAL, "External call reverted with a reason"),
    EXTERNAL_ARITHMETIC_FAULT(Category.EXTERNAL, "External call failed with an arithmetic fault"),
    EXTERNAL_CALL_FAILED(Category.EXTERNAL, "External call failed without a reason"),

    INSUFFICIENT_ALLOWANCE(Category.INSUFFICIENCY, "Spending allowance granted to the marketplace is too low"),
    INSUFFICIENT_BALANCE(Category.INSUFFICIENCY, "Buyer balance is below the price");

    public enum Category {
        VALIDATION,
        AUTHORIZATION,
        CONSISTENCY,
        EXTERNAL,
        INSUFFICIENCY
    }

    private final Category category;
    private final String description;
    private final boolean stateRetained;

    ErrorCode(Category category, String description) {
        this(category, description, false);
    }

    ErrorCode(Category category, String description, boolean stateRetained) {
        this.category = category;
        this.description = description;
        this.stateRetained = stateRetained;
    }

    public Category getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    /**
     * True when the request commits what it did before failing.
     */
    public boolean isStateRetained() {
        return stateRetained;
    }
}

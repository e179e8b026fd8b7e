package com.nft.market.nft_market.service;

import java.math.BigInteger;
import java.util.Optional;
import java.util.function.Consumer;

import com.nft.market.nft_market.engine.FeeSchedule;
import com.nft.market.nft_market.entity.AdminConfig;
import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.Uint256;
import com.nft.market.nft_market.exception.ErrorCode;
import com.nft.market.nft_market.exception.MarketplaceException;
import com.nft.market.nft_market.execution.UnitOfWork;

import lombok.extern.slf4j.Slf4j;

/**
 * Fee configuration, changeable only by the current admin.
 *
 * Changes apply to listings and orders created afterwards. Orders already in
 * the book keep the fee they were placed with.
 */
@Slf4j
public class AdminPolicy {

    private AdminConfig config;
    private boolean dirty;

    public AdminPolicy(AdminConfig initial) {
        this.config = initial.copy();
    }

    public AdminConfig current() {
        return config.copy();
    }

    public int getFeePercent() {
        return config.getFeePercentBasisPoints();
    }

    public BigInteger getMinimumFee() {
        return config.getMinimumFee();
    }

    public String getAdmin() {
        return config.getAdmin();
    }

    public void changeFeePercent(String caller, int feePercentBasisPoints) {
        requireAdmin(caller);
        if (feePercentBasisPoints < 0 || feePercentBasisPoints > FeeSchedule.BASIS_POINTS) {
            throw MarketplaceException.of(ErrorCode.INVALID_FEE_PERCENT,
                    "Fee percent out of range: " + feePercentBasisPoints);
        }
        int previous = config.getFeePercentBasisPoints();
        apply(c -> c.setFeePercentBasisPoints(feePercentBasisPoints));
        log.info("Fee percent changed by {}: {} -> {} bp", caller, previous, feePercentBasisPoints);
    }

    public void changeMinimumFee(String caller, BigInteger minimumFee) {
        requireAdmin(caller);
        if (!Uint256.isValid(minimumFee)) {
            throw MarketplaceException.of(ErrorCode.INVALID_PRICE, "Minimum fee out of range: " + minimumFee);
        }
        BigInteger previous = config.getMinimumFee();
        apply(c -> c.setMinimumFee(minimumFee));
        log.info("Minimum fee changed by {}: {} -> {}", caller, previous, minimumFee);
    }

    /**
     * Hand the admin role to another account. The caller loses it immediately.
     */
    public void setAdmin(String caller, String newAdmin) {
        requireAdmin(caller);
        if (!Addresses.isValid(newAdmin) || Addresses.isZero(Addresses.normalize(newAdmin))) {
            throw MarketplaceException.of(ErrorCode.INVALID_ADDRESS, "Invalid admin address: " + newAdmin);
        }
        String normalized = Addresses.normalize(newAdmin);
        apply(c -> c.setAdmin(normalized));
        log.info("Admin role transferred: {} -> {}", caller, normalized);
    }

    /**
     * Replace the configuration with the persisted one (startup only).
     */
    public synchronized void load(AdminConfig persisted) {
        this.config = persisted.copy();
        this.dirty = false;
    }

    public synchronized Optional<AdminConfig> drainPendingWrite() {
        if (!dirty) {
            return Optional.empty();
        }
        dirty = false;
        return Optional.of(config.copy());
    }

    public synchronized void markPending() {
        dirty = true;
    }

    private void requireAdmin(String caller) {
        if (!Addresses.same(caller, config.getAdmin())) {
            throw MarketplaceException.of(ErrorCode.NOT_ADMIN, "Caller " + caller + " is not the admin");
        }
    }

    private synchronized void apply(Consumer<AdminConfig> change) {
        AdminConfig before = config.copy();
        AdminConfig next = config.copy();
        change.accept(next);
        config = next;
        dirty = true;
        UnitOfWork.onRollback(() -> config = before);
    }
}

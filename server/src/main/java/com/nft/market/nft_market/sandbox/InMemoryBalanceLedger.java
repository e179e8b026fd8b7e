package com.nft.market.nft_market.sandbox;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.Uint256;
import com.nft.market.nft_market.execution.UnitOfWork;
import com.nft.market.nft_market.external.BalanceLedger;
import com.nft.market.nft_market.external.ExternalCallException;
import com.nft.market.nft_market.external.TransferReceiver;

import lombok.extern.slf4j.Slf4j;

/**
 * In-process fungible ledger with allowance spending and callback-carrying
 * transfers.
 *
 * Mutations register compensations with the active unit of work, so a
 * marketplace request that aborts also reverts the balances it moved.
 */
@Slf4j
public class InMemoryBalanceLedger implements BalanceLedger {

    private final String address;
    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private final Map<String, Map<String, BigInteger>> allowances = new ConcurrentHashMap<>();
    private final Map<String, TransferReceiver> receivers = new ConcurrentHashMap<>();

    public InMemoryBalanceLedger(String address) {
        this.address = Addresses.normalize(address);
    }

    @Override
    public String address() {
        return address;
    }

    /**
     * Recipients registered here get {@link TransferReceiver#onTransferReceived}
     * after a callback-carrying transfer.
     */
    public void registerReceiver(String account, TransferReceiver receiver) {
        receivers.put(Addresses.normalize(account), receiver);
    }

    public void mint(String to, BigInteger amount) {
        requireAccount(to, "mint to the zero address");
        setBalance(key(to), Uint256.add(balanceOf(to), Uint256.requireInRange(amount)));
        log.debug("Minted {} to {}", amount, to);
    }

    public void approve(String owner, String spender, BigInteger amount) {
        requireAccount(owner, "approve from the zero address");
        requireAccount(spender, "approve to the zero address");
        setAllowance(key(owner), key(spender), Uint256.requireInRange(amount));
    }

    @Override
    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(key(account), BigInteger.ZERO);
    }

    @Override
    public BigInteger allowance(String owner, String spender) {
        Map<String, BigInteger> granted = allowances.get(key(owner));
        return granted == null ? BigInteger.ZERO : granted.getOrDefault(key(spender), BigInteger.ZERO);
    }

    @Override
    public boolean transferFrom(String spender, String from, String to, BigInteger amount) {
        BigInteger granted = allowance(from, spender);
        if (granted.compareTo(amount) < 0) {
            throw new ExternalCallException("ERC20: insufficient allowance");
        }
        move(from, to, amount);
        setAllowance(key(from), key(spender), Uint256.subtract(granted, amount));
        return true;
    }

    @Override
    public boolean transferWithCallback(String spender, String from, String to, BigInteger amount, byte[] payload) {
        TransferReceiver receiver = receivers.get(key(to));
        if (receiver == null) {
            throw new ExternalCallException("ERC1363: transfer to non ERC1363Receiver implementer");
        }
        transferFrom(spender, from, to, amount);
        receiver.onTransferReceived(address, key(from), amount, payload);
        return true;
    }

    private void move(String from, String to, BigInteger amount) {
        requireAccount(from, "transfer from the zero address");
        requireAccount(to, "transfer to the zero address");
        BigInteger fromBalance = balanceOf(from);
        if (fromBalance.compareTo(amount) < 0) {
            throw new ExternalCallException("ERC20: transfer amount exceeds balance");
        }
        setBalance(key(from), Uint256.subtract(fromBalance, amount));
        setBalance(key(to), Uint256.add(balanceOf(to), amount));
        log.debug("Moved {} from {} to {}", amount, from, to);
    }

    private void setBalance(String account, BigInteger value) {
        BigInteger previous = balances.put(account, value);
        UnitOfWork.onRollback(() -> restore(balances, account, previous));
    }

    private void setAllowance(String owner, String spender, BigInteger value) {
        Map<String, BigInteger> granted = allowances.computeIfAbsent(owner, o -> new ConcurrentHashMap<>());
        BigInteger previous = granted.put(spender, value);
        UnitOfWork.onRollback(() -> restore(granted, spender, previous));
    }

    private static void restore(Map<String, BigInteger> map, String key, BigInteger previous) {
        if (previous == null) {
            map.remove(key);
        } else {
            map.put(key, previous);
        }
    }

    private static void requireAccount(String account, String reason) {
        if (!Addresses.isValid(account) || Addresses.isZero(key(account))) {
            throw new ExternalCallException("ERC20: " + reason);
        }
    }

    private static String key(String account) {
        return account == null ? Addresses.ZERO : account.trim().toLowerCase();
    }
}

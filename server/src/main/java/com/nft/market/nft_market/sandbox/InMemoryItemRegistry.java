package com.nft.market.nft_market.sandbox;

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.execution.UnitOfWork;
import com.nft.market.nft_market.external.ExternalCallException;
import com.nft.market.nft_market.external.ItemRegistry;

import lombok.extern.slf4j.Slf4j;

/**
 * In-process registry of unique items with per-item and per-operator
 * approvals.
 *
 * Accounts marked as rejecting receivers refuse incoming items, which makes
 * {@link #safeTransferFrom} fail as a whole.
 */
@Slf4j
public class InMemoryItemRegistry implements ItemRegistry {

    private final String address;
    private final Map<BigInteger, String> owners = new ConcurrentHashMap<>();
    private final Map<BigInteger, String> approvals = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> operators = new ConcurrentHashMap<>();
    private final Set<String> rejectingReceivers = ConcurrentHashMap.newKeySet();

    public InMemoryItemRegistry(String address) {
        this.address = Addresses.normalize(address);
    }

    @Override
    public String address() {
        return address;
    }

    public void mint(String to, BigInteger itemId) {
        if (Addresses.isZero(key(to))) {
            throw new ExternalCallException("ERC721: mint to the zero address");
        }
        if (owners.containsKey(itemId)) {
            throw new ExternalCallException("ERC721: token already minted");
        }
        setOwner(itemId, key(to));
        log.debug("Minted item {} to {}", itemId, to);
    }

    public void burn(String caller, BigInteger itemId) {
        String owner = ownerOf(itemId);
        if (!isAuthorized(caller, owner, itemId)) {
            throw new ExternalCallException("ERC721: caller is not token owner or approved");
        }
        setOwner(itemId, null);
        setApproval(itemId, null);
    }

    public void approve(String caller, String to, BigInteger itemId) {
        String owner = ownerOf(itemId);
        if (!Addresses.same(caller, owner) && !isApprovedForAll(owner, caller)) {
            throw new ExternalCallException("ERC721: approve caller is not token owner or approved for all");
        }
        setApproval(itemId, Addresses.isZero(key(to)) ? null : key(to));
    }

    public void setApprovalForAll(String owner, String operator, boolean approved) {
        if (Addresses.same(owner, operator)) {
            throw new ExternalCallException("ERC721: approve to caller");
        }
        Set<String> granted = operators.computeIfAbsent(key(owner), o -> ConcurrentHashMap.newKeySet());
        boolean changed = approved ? granted.add(key(operator)) : granted.remove(key(operator));
        if (changed) {
            UnitOfWork.onRollback(() -> {
                if (approved) {
                    granted.remove(key(operator));
                } else {
                    granted.add(key(operator));
                }
            });
        }
    }

    /**
     * Makes safe transfers to the account fail, like a contract that does not
     * accept items.
     */
    public void rejectIncomingItems(String account, boolean reject) {
        String receiver = key(account);
        boolean changed = reject ? rejectingReceivers.add(receiver) : rejectingReceivers.remove(receiver);
        if (changed) {
            UnitOfWork.onRollback(() -> {
                if (reject) {
                    rejectingReceivers.remove(receiver);
                } else {
                    rejectingReceivers.add(receiver);
                }
            });
        }
    }

    /**
     * Plain transfer by the owner or an approved operator, without receiver
     * checks.
     */
    public void transferFrom(String caller, String from, String to, BigInteger itemId) {
        transfer(caller, from, to, itemId, false);
    }

    @Override
    public String ownerOf(BigInteger itemId) {
        String owner = owners.get(itemId);
        if (owner == null) {
            throw new ExternalCallException("ERC721: invalid token ID");
        }
        return owner;
    }

    @Override
    public String getApproved(BigInteger itemId) {
        ownerOf(itemId);
        return approvals.getOrDefault(itemId, Addresses.ZERO);
    }

    @Override
    public boolean isApprovedForAll(String owner, String operator) {
        Set<String> granted = operators.get(key(owner));
        return granted != null && granted.contains(key(operator));
    }

    @Override
    public void safeTransferFrom(String operator, String from, String to, BigInteger itemId) {
        transfer(operator, from, to, itemId, true);
    }

    private void transfer(String caller, String from, String to, BigInteger itemId, boolean checkReceiver) {
        String owner = ownerOf(itemId);
        if (!Addresses.same(owner, from)) {
            throw new ExternalCallException("ERC721: transfer from incorrect owner");
        }
        if (!isAuthorized(caller, owner, itemId)) {
            throw new ExternalCallException("ERC721: caller is not token owner or approved");
        }
        if (Addresses.isZero(key(to))) {
            throw new ExternalCallException("ERC721: transfer to the zero address");
        }
        if (checkReceiver && rejectingReceivers.contains(key(to))) {
            throw new ExternalCallException("ERC721: transfer to non ERC721Receiver implementer");
        }
        setApproval(itemId, null);
        setOwner(itemId, key(to));
        log.debug("Item {} moved from {} to {}", itemId, from, to);
    }

    private boolean isAuthorized(String caller, String owner, BigInteger itemId) {
        return Addresses.same(caller, owner)
                || isApprovedForAll(owner, caller)
                || Addresses.same(approvals.get(itemId), caller);
    }

    private void setOwner(BigInteger itemId, String owner) {
        String previous = owner == null ? owners.remove(itemId) : owners.put(itemId, owner);
        UnitOfWork.onRollback(() -> restore(owners, itemId, previous));
    }

    private void setApproval(BigInteger itemId, String approved) {
        String previous = approved == null ? approvals.remove(itemId) : approvals.put(itemId, approved);
        UnitOfWork.onRollback(() -> restore(approvals, itemId, previous));
    }

    private static void restore(Map<BigInteger, String> map, BigInteger key, String previous) {
        if (previous == null) {
            map.remove(key);
        } else {
            map.put(key, previous);
        }
    }

    private static String key(String account) {
        return account == null ? Addresses.ZERO : account.trim().toLowerCase();
    }
}

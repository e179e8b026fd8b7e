package com.nft.market.nft_market.external;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.market.nft_market.entity.Addresses;

/**
 * Resolves the item registry deployed at an address.
 *
 * Listings name their registry by address, so several registries can be
 * traded through one marketplace. Calls against an address with nothing
 * deployed fail without a reason.
 */
public class ItemRegistryDirectory {

    private final Map<String, ItemRegistry> registries = new ConcurrentHashMap<>();

    public void register(ItemRegistry registry) {
        registries.put(Addresses.normalize(registry.address()), registry);
    }

    public ItemRegistry at(String address) {
        ItemRegistry registry = Addresses.isValid(address) ? registries.get(Addresses.normalize(address)) : null;
        return registry != null ? registry : new Undeployed(address);
    }

    private static final class Undeployed implements ItemRegistry {
        private final String address;

        Undeployed(String address) {
            this.address = address;
        }

        @Override
        public String address() {
            return address;
        }

        @Override
        public String ownerOf(BigInteger itemId) {
            throw noCode();
        }

        @Override
        public String getApproved(BigInteger itemId) {
            throw noCode();
        }

        @Override
        public boolean isApprovedForAll(String owner, String operator) {
            throw noCode();
        }

        @Override
        public void safeTransferFrom(String operator, String from, String to, BigInteger itemId) {
            throw noCode();
        }

        private IllegalStateException noCode() {
            return new IllegalStateException("No item registry deployed at " + address);
        }
    }
}

package com.nft.market.nft_market.external;

import java.math.BigInteger;

/**
 * Capability the ledger holds to notify a recipient of a callback-carrying
 * transfer. The ledger passes its own address as {@code caller}; the recipient
 * decides whether to trust it.
 */
public interface TransferReceiver {

    /**
     * Called after the ledger credited {@code amount} from {@code from}. A
     * failure thrown here fails the whole transfer.
     */
    void onTransferReceived(String caller, String from, BigInteger amount, byte[] payload);
}

package com.giftsbuyer.application.ports;

import com.giftsbuyer.domain.acquisition.Recipient;
import com.giftsbuyer.domain.gift.Gift;

import java.util.List;

/**
 * Single port to the messaging platform: catalog, balance, recipients and purchases.
 *
 * Every call is a blocking remote call and may fail with {@link PlatformException}.
 */
public interface GiftPlatformPort {

    boolean isConnected();

    /** (Re)establish the session. Idempotent. */
    void connect() throws PlatformException;

    /** Current catalog in platform order. */
    List<Gift> listAvailableGifts() throws PlatformException;

    /** Current star balance. */
    long getBalance() throws PlatformException;

    RecipientInfo resolveRecipient(Recipient recipient) throws PlatformException;

    /** Buys and sends exactly one unit of the gift to the recipient. */
    void purchase(Recipient recipient, String giftId) throws PlatformException;
}

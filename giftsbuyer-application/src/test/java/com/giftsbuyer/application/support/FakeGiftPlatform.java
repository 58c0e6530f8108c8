package com.giftsbuyer.application.support;

import com.giftsbuyer.application.ports.GiftPlatformPort;
import com.giftsbuyer.application.ports.PlatformException;
import com.giftsbuyer.application.ports.RecipientInfo;
import com.giftsbuyer.domain.acquisition.Recipient;
import com.giftsbuyer.domain.gift.Gift;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.BiFunction;

/** In-memory platform: scripted catalog, balance and failures; records every purchase. */
public class FakeGiftPlatform implements GiftPlatformPort {

    public record Purchase(Recipient recipient, String giftId) {}

    public List<Gift> catalog = new ArrayList<>();
    public long balance;
    public boolean connected = true;
    public int connectCalls;
    public int fetchCalls;
    public boolean chargeBalance = true;

    public final Deque<PlatformException> fetchFailures = new ArrayDeque<>();
    public PlatformException connectFailure;
    public PlatformException balanceFailure;
    /** Returns the failure for a purchase call, or null for success. */
    public BiFunction<Recipient, String, PlatformException> purchaseFailure = (r, id) -> null;

    public final List<Purchase> purchases = new ArrayList<>();

    public FakeGiftPlatform withCatalog(Gift... gifts) {
        catalog = new ArrayList<>(List.of(gifts));
        return this;
    }

    public FakeGiftPlatform withBalance(long stars) {
        balance = stars;
        return this;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void connect() throws PlatformException {
        connectCalls++;
        if (connectFailure != null) throw connectFailure;
        connected = true;
    }

    @Override
    public List<Gift> listAvailableGifts() throws PlatformException {
        fetchCalls++;
        PlatformException f = fetchFailures.poll();
        if (f != null) throw f;
        return List.copyOf(catalog);
    }

    @Override
    public long getBalance() throws PlatformException {
        if (balanceFailure != null) throw balanceFailure;
        return balance;
    }

    @Override
    public RecipientInfo resolveRecipient(Recipient recipient) {
        return recipient.hasUserId()
                ? new RecipientInfo(recipient.raw(), "")
                : new RecipientInfo("@" + recipient.handle(), recipient.handle());
    }

    @Override
    public void purchase(Recipient recipient, String giftId) throws PlatformException {
        PlatformException f = purchaseFailure.apply(recipient, giftId);
        if (f != null) throw f;
        purchases.add(new Purchase(recipient, giftId));
        if (chargeBalance) {
            for (Gift g : catalog) {
                if (g.id().equals(giftId)) balance -= g.price();
            }
        }
    }
}

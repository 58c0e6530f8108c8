package com.giftsbuyer.application.purchase;

import com.giftsbuyer.application.notification.AcquisitionReporter;
import com.giftsbuyer.application.ports.GiftPlatformPort;
import com.giftsbuyer.application.ports.PlatformException;
import com.giftsbuyer.application.ports.RecipientInfo;
import com.giftsbuyer.domain.acquisition.Recipient;
import com.giftsbuyer.domain.gift.Gift;
import com.giftsbuyer.domain.purchase.Affordability;
import com.giftsbuyer.domain.purchase.PurchaseErrorClassifier;
import com.giftsbuyer.domain.purchase.PurchaseErrorKind;
import com.giftsbuyer.domain.purchase.PurchaseOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Buys units of one eligible gift for its configured recipients.
 *
 * Per gift:
 *  1) re-read live price and balance (never reuse detection-time values)
 *  2) affordable = min(requested, balance / price); unknown price counts as free
 *  3) nothing affordable -> insufficient-balance report, no purchase calls
 *  4) per recipient, in order: one purchase call per unit, spaced by {@link PurchaseThrottle}
 *  5) a failure is classified, reported and ends that recipient only
 *  6) affordable < requested -> partial-purchase report after all recipients
 *
 * Remote failures never escape this class; they end up in the returned report.
 */
public class PurchaseOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PurchaseOrchestrator.class);

    private final GiftPlatformPort platform;
    private final PurchaseThrottle throttle;
    private final PurchaseErrorClassifier classifier;
    private final AcquisitionReporter reporter;

    public PurchaseOrchestrator(GiftPlatformPort platform,
                                PurchaseThrottle throttle,
                                PurchaseErrorClassifier classifier,
                                AcquisitionReporter reporter) {
        this.platform = Objects.requireNonNull(platform, "platform");
        this.throttle = Objects.requireNonNull(throttle, "throttle");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public ItemAcquisitionReport acquire(Gift gift, int requestedQuantity, List<Recipient> recipients) {
        String giftId = gift.id();
        int price = livePrice(giftId);
        long balance = liveBalance();

        Affordability affordability = Affordability.compute(requestedQuantity, price, balance);
        List<RecipientResult> results = new ArrayList<>(recipients.size());

        if (affordability.none()) {
            reporter.insufficientBalance(giftId, affordability);
            for (Recipient r : recipients) {
                results.add(new RecipientResult(r, new RecipientInfo(r.raw(), ""),
                        new PurchaseOutcome.Aborted(PurchaseErrorKind.BALANCE_TOO_LOW)));
            }
            return new ItemAcquisitionReport(giftId, affordability, results, null);
        }

        for (Recipient recipient : recipients) {
            RecipientInfo info = resolve(recipient);
            PurchaseOutcome outcome = purchaseUnits(giftId, recipient, info, affordability.affordable(), price);
            results.add(new RecipientResult(recipient, info, outcome));
        }

        Long remaining = null;
        if (affordability.partial()) {
            remaining = liveBalance();
            reporter.partialPurchase(giftId, affordability, remaining);
        }
        return new ItemAcquisitionReport(giftId, affordability, results, remaining);
    }

    private PurchaseOutcome purchaseUnits(String giftId, Recipient recipient, RecipientInfo info, int units, int price) {
        for (int current = 1; current <= units; current++) {
            throttle.awaitTurn();
            try {
                platform.purchase(recipient, giftId);
            } catch (PlatformException | RuntimeException e) {
                PurchaseErrorKind kind = classifier.classify(e);
                reporter.purchaseFailed(giftId, info, kind, PurchaseErrorClassifier.describe(e), price, liveBalance());

                int bought = current - 1;
                return (bought == 0)
                        ? new PurchaseOutcome.Aborted(kind)
                        : new PurchaseOutcome.PartialFailure(kind, bought);
            } finally {
                throttle.callFinished();
            }
            reporter.giftSent(giftId, info, current, units);
        }
        return new PurchaseOutcome.Success(units, units);
    }

    private int livePrice(String giftId) {
        try {
            for (Gift g : platform.listAvailableGifts()) {
                if (g.id().equals(giftId)) return g.price();
            }
            log.warn("Gift {} not found in live catalog, price treated as unknown", giftId);
        } catch (PlatformException e) {
            log.warn("Live price lookup failed for gift {}: {}", giftId, e.getMessage());
        }
        return 0;
    }

    private long liveBalance() {
        try {
            return platform.getBalance();
        } catch (PlatformException e) {
            log.warn("Balance lookup failed, using 0: {}", e.getMessage());
            return 0L;
        }
    }

    private RecipientInfo resolve(Recipient recipient) {
        try {
            return platform.resolveRecipient(recipient);
        } catch (PlatformException e) {
            log.debug("Recipient {} not resolved: {}", recipient.raw(), e.getMessage());
            return new RecipientInfo(recipient.raw(), recipient.hasUserId() ? "" : recipient.handle());
        }
    }
}

package com.giftsbuyer.application.notification;

import com.giftsbuyer.application.config.AcquisitionSettings;
import com.giftsbuyer.application.ports.NotifierPort;
import com.giftsbuyer.application.ports.RecipientInfo;
import com.giftsbuyer.domain.acquisition.EligibilityVerdict;
import com.giftsbuyer.domain.acquisition.SkipTally;
import com.giftsbuyer.domain.gift.Gift;
import com.giftsbuyer.domain.purchase.Affordability;
import com.giftsbuyer.domain.purchase.PurchaseErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns engine events into console log lines and operator notifications.
 *
 * One call = at most one notification. A failing notifier never breaks the engine.
 */
public class AcquisitionReporter {

    private static final Logger log = LoggerFactory.getLogger(AcquisitionReporter.class);

    private final NotifierPort notifier;
    private final Messages messages;

    public AcquisitionReporter(NotifierPort notifier, Messages messages) {
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.messages = Objects.requireNonNull(messages, "messages");
    }

    public void started(AcquisitionSettings s) {
        double seconds = s.interval().toMillis() / 1000.0;
        log.info(messages.format("console.started",
                s.ranges().size(), seconds, s.upgradableOnly(), s.prioritizeLowSupply()));
        notify(messages.format("notify.started",
                s.ranges().size(), seconds, s.upgradableOnly(), s.prioritizeLowSupply()));
    }

    public void stopped() {
        log.info(messages.format("console.terminated"));
        notify(messages.format("notify.stopped"));
    }

    public void newGiftsDetected(int count) {
        log.info(messages.format("console.new_gifts", count));
    }

    public void processing(String giftId, int quantity, int recipients) {
        log.info(messages.format("console.processing_gift", giftId, quantity, recipients));
    }

    public void excluded(Gift gift, EligibilityVerdict verdict) {
        String key = "notify.excluded." + verdict.exclusionReason().code();
        String text = messages.format(key, gift.id(), verdict.price(), verdict.totalAmount());
        log.warn(text);
        notify(text);
    }

    public void giftSent(String giftId, RecipientInfo recipient, int current, int total) {
        String text = messages.format("notify.gift_sent", giftId, recipient.displayReference(), current, total);
        log.info(text);
        notify(text);
    }

    public void insufficientBalance(String giftId, Affordability a) {
        String text = messages.format("notify.insufficient_balance",
                giftId, a.requestedCost(), a.requested(), a.price(), a.balance());
        log.warn(text);
        notify(text);
    }

    public void partialPurchase(String giftId, Affordability a, long remainingBalance) {
        String text = messages.format("notify.partial_purchase",
                giftId, a.affordable(), a.requested(), a.shortfallCost(), remainingBalance);
        log.warn(text);
        notify(text);
    }

    public void purchaseFailed(String giftId,
                               RecipientInfo recipient,
                               PurchaseErrorKind kind,
                               String rawError,
                               int price,
                               long balance) {
        String key = "notify.error." + kind.code();
        String text = messages.format(key, giftId, recipient.displayReference(), price, balance, rawError);
        log.error("{} [{}]", text, rawError);
        notify(text);
    }

    public void summary(SkipTally tally) {
        String text = messages.format("notify.summary", tally.soldOut(), tally.nonLimited(), tally.nonUpgradable());
        if (tally.any()) {
            log.info(messages.format("console.skip_summary",
                    tally.soldOut(), tally.nonLimited(), tally.nonUpgradable()));
        }
        notify(text);
    }

    public void cycleFailed(String stage, Exception error) {
        String detail = (error.getMessage() == null) ? error.getClass().getSimpleName() : error.getMessage();
        String text = messages.format("notify.cycle_failed", stage, detail);
        log.warn(text, error);
        notify(text);
    }

    private void notify(String text) {
        try {
            notifier.send(text);
        } catch (RuntimeException e) {
            log.warn("Notifier failed: {}", e.getMessage(), e);
        }
    }
}

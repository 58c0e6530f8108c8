package com.giftsbuyer.application.engine;

import com.giftsbuyer.application.config.AcquisitionSettings;
import com.giftsbuyer.application.lifecycle.BotStateManager;
import com.giftsbuyer.application.notification.AcquisitionReporter;
import com.giftsbuyer.application.ports.GiftPlatformPort;
import com.giftsbuyer.application.ports.NewGiftListener;
import com.giftsbuyer.application.ports.PlatformException;
import com.giftsbuyer.application.ports.SnapshotStoreException;
import com.giftsbuyer.application.ports.SnapshotStorePort;
import com.giftsbuyer.application.purchase.PurchaseOrchestrator;
import com.giftsbuyer.domain.acquisition.EligibilityEvaluator;
import com.giftsbuyer.domain.acquisition.EligibilityVerdict;
import com.giftsbuyer.domain.acquisition.GiftPrioritizer;
import com.giftsbuyer.domain.acquisition.RangeMatcher;
import com.giftsbuyer.domain.acquisition.RankedGift;
import com.giftsbuyer.domain.acquisition.SkipTally;
import com.giftsbuyer.domain.gift.Gift;
import com.giftsbuyer.domain.gift.GiftCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Long-running detection loop.
 *
 * Cycle: connect -> load snapshot -> fetch catalog -> diff by id -> process new gifts
 * (tally, prioritize, evaluate, purchase; strictly sequential) -> save snapshot -> sleep.
 *
 * - A failed fetch skips straight to the sleep; the snapshot is left untouched.
 * - {@link #stop()} is honored at the top of a cycle or during the sleep.
 *   A cycle that is already processing runs to its end, snapshot write included.
 * - A failed snapshot write is fatal: {@link SnapshotStoreException} escapes {@link #run()}.
 *   Other exceptions besides platform failures are programming errors and escape as well.
 */
public class GiftMonitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(GiftMonitor.class);

    private final GiftPlatformPort platform;
    private final SnapshotStorePort snapshots;
    private final AcquisitionSettings settings;
    private final EligibilityEvaluator evaluator;
    private final GiftPrioritizer prioritizer;
    private final PurchaseOrchestrator orchestrator;
    private final AcquisitionReporter reporter;
    private final NewGiftListener listener;
    private final BotStateManager stateManager;

    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile MonitorPhase phase = MonitorPhase.IDLE;
    private long cycles;

    public GiftMonitor(GiftPlatformPort platform,
                       SnapshotStorePort snapshots,
                       AcquisitionSettings settings,
                       PurchaseOrchestrator orchestrator,
                       AcquisitionReporter reporter,
                       NewGiftListener listener,
                       BotStateManager stateManager) {
        this.platform = Objects.requireNonNull(platform, "platform");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.listener = (listener == null) ? NewGiftListener.NOOP : listener;
        this.stateManager = Objects.requireNonNull(stateManager, "stateManager");

        this.evaluator = new EligibilityEvaluator(new RangeMatcher(settings.ranges()), settings.upgradableOnly());
        this.prioritizer = new GiftPrioritizer(settings.prioritizeLowSupply());
    }

    @Override
    public void run() {
        if (!stateManager.startUnlessStopRequested()) {
            log.info("Stop requested before start, monitor not started");
            finished.countDown();
            return;
        }
        reporter.started(settings);
        try {
            while (stateManager.isRunning()) {
                runCycle();
                if (!stateManager.awaitStop(settings.interval())) break;
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.info("Monitor interrupted");
        } finally {
            stateManager.stop();
            reporter.stopped();
            finished.countDown();
        }
    }

    public void stop() {
        stateManager.stop();
    }

    /** Waits for {@link #run()} to return. */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    public MonitorPhase phase() {
        return phase;
    }

    /** One full detection cycle. Public so callers (and tests) can drive the loop step by step. */
    public CycleReport runCycle() {
        cycles++;

        // 1) connection
        if (!platform.isConnected()) {
            try {
                log.info("Platform not connected, reconnecting");
                platform.connect();
            } catch (PlatformException e) {
                reporter.cycleFailed("connect", e);
                return CycleReport.failed("connect");
            }
        }

        // 2) last snapshot
        GiftCatalog known;
        try {
            known = snapshots.load();
        } catch (SnapshotStoreException e) {
            reporter.cycleFailed("snapshot_load", e);
            return CycleReport.failed("snapshot_load");
        }

        // 3) current catalog
        GiftCatalog current;
        try {
            current = GiftCatalog.of(platform.listAvailableGifts());
        } catch (PlatformException e) {
            reporter.cycleFailed("fetch", e);
            return CycleReport.failed("fetch");
        }

        if (cycles % 20 == 0) {
            log.debug("heartbeat cycle={} catalog={} known={}", cycles, current.size(), known.size());
        }

        // 4) diff by id
        Map<String, Gift> fresh = current.newSince(known);

        // 5) new gifts
        SkipTally tally = SkipTally.ZERO;
        List<String> processed = new ArrayList<>();
        if (!fresh.isEmpty()) {
            phase = MonitorPhase.PROCESSING;
            try {
                tally = processNewGifts(fresh, current.discoveryOrder(), processed);
            } finally {
                phase = MonitorPhase.IDLE;
            }
        }

        // 6) replace snapshot; a failed write ends the loop, otherwise the next cycle re-buys
        try {
            snapshots.save(current.gifts());
        } catch (SnapshotStoreException e) {
            reporter.cycleFailed("snapshot_save", e);
            throw e;
        }

        return new CycleReport(null, current.size(), processed, tally);
    }

    private SkipTally processNewGifts(Map<String, Gift> fresh, List<String> discoveryOrder, List<String> processed) {
        reporter.newGiftsDetected(fresh.size());

        SkipTally tally = SkipTally.of(fresh.values(), settings.upgradableOnly());
        List<RankedGift> ranked = prioritizer.prioritize(fresh, discoveryOrder);

        for (RankedGift rg : ranked) {
            notifyListener(rg);

            Gift gift = rg.gift();
            EligibilityVerdict verdict = evaluator.evaluate(gift);
            if (verdict.eligible()) {
                reporter.processing(gift.id(), verdict.quantity(), verdict.recipients().size());
                orchestrator.acquire(gift, verdict.quantity(), verdict.recipients());
            } else {
                reporter.excluded(gift, verdict);
            }
            processed.add(gift.id());
        }

        reporter.summary(tally);
        return tally;
    }

    private void notifyListener(RankedGift rg) {
        try {
            listener.onNewGift(rg);
        } catch (RuntimeException e) {
            log.warn("New-gift listener failed for {}: {}", rg.id(), e.getMessage(), e);
        }
    }
}

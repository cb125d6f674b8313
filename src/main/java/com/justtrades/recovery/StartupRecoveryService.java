package com.justtrades.recovery;

import com.justtrades.core.engine.PositionEventLoop;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.exception.LedgerCorruptionException;
import com.justtrades.exit.ExitService;
import com.justtrades.ledger.PositionLedger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Restores engine state after a restart.
 *
 * <p>For each persisted position, inside its loop:
 * <ol>
 *   <li>Replay the fill log. A log that cannot be replayed halts the position.</li>
 *   <li>If the position was persisted mid-exit, resume confirmation polling.</li>
 * </ol>
 * Resting protective orders are not re-placed here; the first drift audit
 * compares the rebuilt ledger with the broker.
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final PositionLedger positionLedger;
    private final PositionEventLoop positionEventLoop;
    private final ExitService exitService;

    public StartupRecoveryService(
            PositionLedger positionLedger, PositionEventLoop positionEventLoop, ExitService exitService) {
        this.positionLedger = positionLedger;
        this.positionEventLoop = positionEventLoop;
        this.exitService = exitService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recover().join();
    }

    public CompletableFuture<Void> recover() {
        List<Position> loaded = positionLedger.loadAll();
        log.info("Recovering {} persisted positions", loaded.size());

        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        for (Position position : loaded) {
            PositionKey key = position.key();
            tasks.add(positionEventLoop.execute(key, () -> recoverPosition(key)));
        }
        return CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]))
                .exceptionally(error -> {
                    log.error("Startup recovery finished with errors: {}", error.getMessage());
                    return null;
                });
    }

    private void recoverPosition(PositionKey key) {
        Position position;
        try {
            position = positionLedger.rebuild(key.accountId(), key.symbol());
        } catch (LedgerCorruptionException e) {
            log.error("Position {} halted on startup: {}", key, e.getMessage());
            return;
        }
        exitService.resumeAfterRestart(position);
    }
}

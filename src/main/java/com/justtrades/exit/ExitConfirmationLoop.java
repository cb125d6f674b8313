package com.justtrades.exit;

import com.justtrades.broker.BrokerGateway;
import com.justtrades.config.EngineConfig;
import com.justtrades.core.engine.PositionEventLoop;
import com.justtrades.domain.model.BrokerPosition;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.exception.BrokerException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Polls the broker position while an exit is waiting for flat.
 *
 * <p>Queries run on the scheduler thread; each result is posted into the
 * position's event loop, so the exit state machine only ever sees them in
 * order with fills and snapshots. After {@code confirm-timeout} the timeout
 * callback is posted instead and polling stops.
 */
@Component
public class ExitConfirmationLoop {

    private static final Logger log = LoggerFactory.getLogger(ExitConfirmationLoop.class);

    private final BrokerGateway brokerGateway;
    private final PositionEventLoop positionEventLoop;
    private final TaskScheduler taskScheduler;
    private final EngineConfig engineConfig;
    private final Clock clock;

    private final Map<PositionKey, Session> sessions = new ConcurrentHashMap<>();

    public ExitConfirmationLoop(
            BrokerGateway brokerGateway,
            PositionEventLoop positionEventLoop,
            @Qualifier("engineScheduler") TaskScheduler taskScheduler,
            EngineConfig engineConfig,
            Clock clock) {
        this.brokerGateway = brokerGateway;
        this.positionEventLoop = positionEventLoop;
        this.taskScheduler = taskScheduler;
        this.engineConfig = engineConfig;
        this.clock = clock;
    }

    /**
     * Starts (or restarts) confirmation polling for {@code key}.
     *
     * @param onPoll    run in the loop with each polled broker position
     * @param onTimeout run in the loop once, if the deadline passes first
     */
    public void start(PositionKey key, Consumer<BrokerPosition> onPoll, Runnable onTimeout) {
        stop(key);
        Instant deadline = clock.instant().plus(engineConfig.getConfirmTimeout());
        Session session = new Session(key, deadline, onPoll, onTimeout);
        sessions.put(key, session);
        session.future = taskScheduler.scheduleWithFixedDelay(
                () -> poll(session),
                clock.instant().plus(engineConfig.getConfirmPollInterval()),
                engineConfig.getConfirmPollInterval());
        log.debug("Exit confirmation started for {} (deadline {})", key, deadline);
    }

    public void stop(PositionKey key) {
        Session session = sessions.remove(key);
        if (session != null) {
            session.stopped.set(true);
            if (session.future != null) {
                session.future.cancel(false);
            }
        }
    }

    public boolean isActive(PositionKey key) {
        return sessions.containsKey(key);
    }

    void poll(Session session) {
        if (session.stopped.get()) {
            return;
        }
        if (!clock.instant().isBefore(session.deadline)) {
            stop(session.key);
            log.warn("Exit confirmation timed out for {}", session.key);
            positionEventLoop.post(session.key, "exit-confirm-timeout", session.onTimeout);
            return;
        }
        BrokerPosition position;
        try {
            position = brokerGateway.queryPosition(session.key.accountId(), session.key.symbol());
        } catch (BrokerException e) {
            log.debug("Confirmation poll for {} failed: {}", session.key, e.getMessage());
            return;
        }
        positionEventLoop.post(session.key, "exit-confirm-poll", () -> {
            if (!session.stopped.get()) {
                session.onPoll.accept(position);
            }
        });
    }

    static final class Session {
        private final PositionKey key;
        private final Instant deadline;
        private final Consumer<BrokerPosition> onPoll;
        private final Runnable onTimeout;
        private final AtomicBoolean stopped = new AtomicBoolean();
        private volatile ScheduledFuture<?> future;

        Session(PositionKey key, Instant deadline, Consumer<BrokerPosition> onPoll, Runnable onTimeout) {
            this.key = key;
            this.deadline = deadline;
            this.onPoll = onPoll;
            this.onTimeout = onTimeout;
        }
    }
}

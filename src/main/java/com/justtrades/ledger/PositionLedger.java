package com.justtrades.ledger;

import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.model.Fill;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.entity.FillEntity;
import com.justtrades.entity.PositionEntity;
import com.justtrades.event.EventPublisherHelper;
import com.justtrades.event.PositionEventType;
import com.justtrades.event.RiskEventType;
import com.justtrades.event.RiskLevel;
import com.justtrades.exception.ConflictingIntentException;
import com.justtrades.exception.LedgerCorruptionException;
import com.justtrades.mapper.FillMapper;
import com.justtrades.mapper.PositionMapper;
import com.justtrades.marketdata.InstrumentRegistry;
import com.justtrades.repository.jpa.FillJpaRepository;
import com.justtrades.repository.jpa.PositionJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only fill log and the virtual position derived from it, per (account, symbol).
 *
 * <p>The fill log is the source of truth. The cached {@link Position} is rebuilt
 * from it on restart and whenever the drift reconciler asks. Both paths run the
 * same fold ({@link PositionCalculator}), so replaying a log always yields the
 * position that incremental recording produced.
 *
 * <p>Every mutating method must be called from the position's event loop. The
 * cache map is concurrent only so that status reads from other threads see a
 * consistent reference; they should still read through {@link Position#snapshot()}.
 *
 * <p>Rules enforced here:
 * <ul>
 *   <li>Fill ids are unique per position; a repeated fill id is ignored.</li>
 *   <li>A fill that would grow the position (or flip it) while an exit is in
 *       flight is refused with {@link ConflictingIntentException}.</li>
 *   <li>A fill log that cannot be replayed halts the position.</li>
 * </ul>
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final FillJpaRepository fillJpaRepository;
    private final PositionJpaRepository positionJpaRepository;
    private final FillMapper fillMapper;
    private final PositionMapper positionMapper;
    private final InstrumentRegistry instrumentRegistry;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final Map<PositionKey, Position> positions = new ConcurrentHashMap<>();
    private final Map<PositionKey, Set<String>> fillIds = new ConcurrentHashMap<>();

    public PositionLedger(
            FillJpaRepository fillJpaRepository,
            PositionJpaRepository positionJpaRepository,
            FillMapper fillMapper,
            PositionMapper positionMapper,
            InstrumentRegistry instrumentRegistry,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.fillJpaRepository = fillJpaRepository;
        this.positionJpaRepository = positionJpaRepository;
        this.fillMapper = fillMapper;
        this.positionMapper = positionMapper;
        this.instrumentRegistry = instrumentRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // READS
    // ========================

    public Position currentPosition(String accountId, String symbol) {
        return currentPosition(PositionKey.of(accountId, symbol));
    }

    /**
     * The live cached position for {@code key}, loading the persisted row on
     * first access. A key with no history is returned as a new flat position.
     */
    public Position currentPosition(PositionKey key) {
        return positions.computeIfAbsent(key, this::load);
    }

    public boolean hasFill(PositionKey key, String fillId) {
        return fillId != null && fillIdsFor(key).contains(fillId);
    }

    public List<PositionKey> knownKeys() {
        return new ArrayList<>(positions.keySet());
    }

    public List<PositionKey> keysForSymbol(String symbol) {
        return positions.keySet().stream()
                .filter(key -> key.symbol().equals(symbol))
                .toList();
    }

    // ========================
    // WRITES
    // ========================

    /**
     * Appends a broker fill and returns the recomputed position.
     *
     * @throws ConflictingIntentException if the fill would grow the position mid-exit
     */
    @Transactional
    public Position recordFill(Fill fill) {
        PositionKey key = PositionKey.of(fill.getAccountId(), fill.getSymbol());
        Position position = currentPosition(key);
        if (position.getExitState() != ExitState.IDLE
                && PositionCalculator.growsPosition(position.getQuantity(), fill.signedQuantity())) {
            throw new ConflictingIntentException(
                    key,
                    position.getExitState(),
                    "Refusing fill " + fill.getFillId() + " (" + fill.getSide() + " " + fill.getQuantity()
                            + ") that grows " + key + " during " + position.getExitState());
        }
        return append(key, position, fill);
    }

    /**
     * Appends an accounting-only correction. Only the drift reconciler calls this,
     * from inside the position's loop; it bypasses the mid-exit growth check
     * because it records what the broker already holds.
     */
    @Transactional
    public Position recordCorrection(Fill fill) {
        PositionKey key = PositionKey.of(fill.getAccountId(), fill.getSymbol());
        return append(key, currentPosition(key), fill);
    }

    /**
     * Replays the full fill log for a position. Engine state (exit state, DCA
     * bookkeeping, attention flags) is carried over from the cached position.
     *
     * @throws LedgerCorruptionException if the log cannot be replayed; the position is halted first
     */
    @Transactional(noRollbackFor = LedgerCorruptionException.class)
    public Position rebuild(String accountId, String symbol) {
        PositionKey key = PositionKey.of(accountId, symbol);
        Position existing = currentPosition(key);
        List<Fill> fills = fillMapper.toDomainList(
                fillJpaRepository.findByAccountIdAndSymbolOrderBySequenceAsc(accountId, symbol));

        Position rebuilt;
        try {
            rebuilt = replay(key, fills);
        } catch (IllegalArgumentException e) {
            halt(existing, "Ledger corruption: " + e.getMessage());
            eventPublisherHelper.publishRisk(
                    this, key, RiskEventType.LEDGER_CORRUPTION, RiskLevel.CRITICAL, e.getMessage());
            throw new LedgerCorruptionException(key, e.getMessage());
        }

        copyDerivedState(rebuilt, existing);
        Set<String> ids = ConcurrentHashMap.newKeySet();
        fills.forEach(f -> ids.add(f.getFillId()));
        fillIds.put(key, ids);
        persist(existing);
        log.info("Rebuilt {} from {} fills: qty={} avg={}", key, fills.size(), existing.getQuantity(),
                existing.getAverageEntryPrice());
        eventPublisherHelper.publishPositionChanged(this, existing, PositionEventType.REBUILT, null);
        return existing;
    }

    /** Persists engine state changes (exit state, DCA indices, flags) for a cached position. */
    public void save(Position position) {
        persist(position);
    }

    /** Marks a position halted. Automated order placement stops until an operator reset. */
    public void halt(Position position, String reason) {
        position.setHalted(true);
        position.setAttentionRequired(true);
        position.setAttentionReason(reason);
        position.recordEvent("HALTED: " + reason, clock.instant());
        persist(position);
        log.error("Position {} halted: {}", position.key(), reason);
    }

    /** Loads every persisted position into the cache. Called once at startup. */
    public List<Position> loadAll() {
        List<Position> loaded = new ArrayList<>();
        for (PositionEntity entity : positionJpaRepository.findAll()) {
            Position position = positionMapper.toDomain(entity);
            positions.put(position.key(), position);
            loaded.add(position);
        }
        return loaded;
    }

    // ========================
    // INTERNALS
    // ========================

    /**
     * Replays fills from flat. Pure apart from the instrument lookup.
     *
     * @throws IllegalArgumentException on any malformed fill, duplicate id or out-of-order sequence
     */
    Position replay(PositionKey key, List<Fill> fills) {
        BigDecimal multiplier = instrumentRegistry.specFor(key.symbol()).multiplier();
        Position position = Position.flat(key);
        Set<String> seen = new HashSet<>();
        long lastSequence = 0;
        for (Fill fill : fills) {
            if (fill.getFillId() == null || !seen.add(fill.getFillId())) {
                throw new IllegalArgumentException("duplicate or missing fill id " + fill.getFillId());
            }
            if (fill.getSequence() <= lastSequence) {
                throw new IllegalArgumentException("fill sequence out of order at " + fill.getFillId());
            }
            lastSequence = fill.getSequence();
            PositionCalculator.apply(position, fill, multiplier);
        }
        return position;
    }

    private Position append(PositionKey key, Position position, Fill fill) {
        if (hasFill(key, fill.getFillId())) {
            log.debug("Ignoring duplicate fill {} for {}", fill.getFillId(), key);
            return position;
        }
        Fill sequenced = fill.toBuilder()
                .sequence(position.getFillCount() + 1)
                .timestamp(fill.getTimestamp() != null ? fill.getTimestamp() : clock.instant())
                .build();
        BigDecimal multiplier = instrumentRegistry.specFor(key.symbol()).multiplier();

        PositionEventType type = PositionCalculator.apply(position, sequenced, multiplier);
        fillJpaRepository.save(fillMapper.toEntity(sequenced));
        fillIdsFor(key).add(sequenced.getFillId());
        position.recordEvent(
                "FILL " + sequenced.getRole() + " " + sequenced.getSide() + " " + sequenced.getQuantity() + " @ "
                        + sequenced.getPrice(),
                sequenced.getTimestamp());
        persist(position);

        log.info("Fill {} applied to {}: {} -> qty={} avg={} realized={}", sequenced.getFillId(), key, type,
                position.getQuantity(), position.getAverageEntryPrice(), position.getRealizedPnl());
        eventPublisherHelper.publishPositionChanged(this, position, type, sequenced);
        return position;
    }

    private Position load(PositionKey key) {
        return positionJpaRepository
                .findById(key.asId())
                .map(positionMapper::toDomain)
                .orElseGet(() -> Position.flat(key));
    }

    private Set<String> fillIdsFor(PositionKey key) {
        return fillIds.computeIfAbsent(key, k -> {
            Set<String> ids = ConcurrentHashMap.newKeySet();
            fillJpaRepository.findByAccountIdAndSymbolOrderBySequenceAsc(k.accountId(), k.symbol()).stream()
                    .map(FillEntity::getFillId)
                    .forEach(ids::add);
            return ids;
        });
    }

    private void persist(Position position) {
        PositionEntity entity = positionMapper.toEntity(position);
        entity.setUpdatedAt(clock.instant());
        positionJpaRepository.save(entity);
    }

    /**
     * Overwrites the fill-derived fields of the cached position with the replayed
     * ones, keeping the cached instance (and its engine state) in place.
     */
    private static void copyDerivedState(Position replayed, Position cached) {
        boolean sameOpen = !replayed.isFlat() && Objects.equals(replayed.getOpenedAt(), cached.getOpenedAt());
        cached.setSide(replayed.getSide());
        cached.setQuantity(replayed.getQuantity());
        cached.setAverageEntryPrice(replayed.getAverageEntryPrice());
        cached.setOpenedAt(replayed.getOpenedAt());
        cached.setClosedAt(replayed.getClosedAt());
        cached.setRealizedPnl(replayed.getRealizedPnl());
        cached.setFillCount(replayed.getFillCount());
        if (!sameOpen) {
            cached.setUnrealizedPnl(replayed.getUnrealizedPnl());
            cached.setWorstUnrealizedPnl(replayed.getWorstUnrealizedPnl());
            cached.setBestUnrealizedPnl(replayed.getBestUnrealizedPnl());
        }
    }
}

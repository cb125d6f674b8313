package com.justtrades.repository.jpa;

import com.justtrades.domain.enums.ExitState;
import com.justtrades.entity.PositionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the positions table. One row per (account, symbol), upserted
 * by the ledger on every change.
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, String> {

    List<PositionEntity> findBySymbol(String symbol);

    List<PositionEntity> findByExitStateNot(ExitState exitState);

    List<PositionEntity> findByQuantityNot(int quantity);
}

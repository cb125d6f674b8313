package com.justtrades.repository.jpa;

import com.justtrades.entity.FillEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the append-only fill log.
 */
@Repository
public interface FillJpaRepository extends JpaRepository<FillEntity, String> {

    /** Replay order for one position. */
    List<FillEntity> findByAccountIdAndSymbolOrderBySequenceAsc(String accountId, String symbol);

    long countByAccountIdAndSymbol(String accountId, String symbol);
}

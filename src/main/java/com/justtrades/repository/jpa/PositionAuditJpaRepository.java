package com.justtrades.repository.jpa;

import com.justtrades.entity.PositionAuditEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PositionAuditJpaRepository extends JpaRepository<PositionAuditEntity, Long> {

    List<PositionAuditEntity> findTop20ByAccountIdAndSymbolOrderByOccurredAtDescIdDesc(String accountId, String symbol);
}

package com.justtrades.repository.jpa;

import com.justtrades.entity.DriftRecordEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DriftRecordJpaRepository extends JpaRepository<DriftRecordEntity, String> {

    List<DriftRecordEntity> findTop20ByAccountIdAndSymbolOrderByDetectedAtDesc(String accountId, String symbol);
}

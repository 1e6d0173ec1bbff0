package com.jay.dossier.repository;

import com.jay.dossier.entity.MetricSnapshotRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MetricSnapshotRepository extends JpaRepository<MetricSnapshotRecord, Long> {

    // YYYY-Q# keys sort chronologically as strings
    List<MetricSnapshotRecord> findByTickerOrderByPeriodKeyAsc(String ticker);

    Optional<MetricSnapshotRecord> findByTickerAndPeriodKey(String ticker, String periodKey);
}

package com.jay.dossier.repository;

import com.jay.dossier.entity.TriggerRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TriggerRecordRepository extends JpaRepository<TriggerRecord, Long> {

    List<TriggerRecord> findByTickerOrderByMetricAsc(String ticker);

    Optional<TriggerRecord> findByTickerAndMetric(String ticker, String metric);

    long deleteByTickerAndMetric(String ticker, String metric);
}

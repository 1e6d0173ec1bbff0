package com.jay.dossier.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "metric_snapshots",
    uniqueConstraints = @UniqueConstraint(name = "uk_snapshot_ticker_period", columnNames = {"ticker", "period_key"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSnapshotRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 20)
    private String ticker;

    @Column(name = "period_key", nullable = false, length = 8)
    private String periodKey;     // YYYY-Q#

    @Lob
    private String valuesJson;

    private LocalDateTime recordedAt;
}

package com.jay.dossier.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "trigger_records",
    uniqueConstraints = @UniqueConstraint(name = "uk_trigger_ticker_metric", columnNames = {"ticker", "metric"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 20)
    private String ticker;

    @Column(nullable = false, length = 120)
    private String metric;

    private double threshold;

    @Column(nullable = false, length = 4)
    private String comparison;    // gte/lte/gt/lt/eq

    @Column(nullable = false)
    private LocalDate deadline;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

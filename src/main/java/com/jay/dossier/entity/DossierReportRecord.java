package com.jay.dossier.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/** Latest committed dossier for a ticker; each section is stored as canonical JSON. */
@Entity
@Table(name = "dossier_reports")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DossierReportRecord {

    @Id
    @Column(length = 20)
    private String ticker;

    private LocalDate asOf;

    @Column(length = 12)
    private String period;

    @Column(length = 10)
    private String qaStatus;      // PASS/BLOCKER

    @Column(length = 10)
    private String overall;       // Mature/Emergent/Fail

    @Lob
    private String analystJson;

    @Lob
    private String verifierJson;

    @Lob
    private String deltaJson;

    @Lob
    private String triggersJson;

    // Numeric metric values the trigger sweep evaluates against
    @Lob
    private String latestMetricsJson;

    private LocalDateTime committedAt;
    private LocalDateTime triggersUpdatedAt;
}

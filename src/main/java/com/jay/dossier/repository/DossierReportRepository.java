package com.jay.dossier.repository;

import com.jay.dossier.entity.DossierReportRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DossierReportRepository extends JpaRepository<DossierReportRecord, String> {
}

package com.medlake.telegram.repository;

import com.medlake.telegram.model.ProcessedMediaAsset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProcessedMediaAssetRepository extends JpaRepository<ProcessedMediaAsset, String> {
    /**
     * Counts ledger entries for assets on which the detector found nothing.
     */
    long countByDetectionCount(Integer detectionCount);
}

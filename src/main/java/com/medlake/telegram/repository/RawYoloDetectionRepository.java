package com.medlake.telegram.repository;

import com.medlake.telegram.model.RawYoloDetection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface RawYoloDetectionRepository extends JpaRepository<RawYoloDetection, Long> {
    /**
     * Counts distinct asset files that have at least one detection.
     */
    @Query("select count(distinct d.imageFilename) from RawYoloDetection d")
    long countDistinctImageFilenames();
}

package com.example.chronotrace.ingest;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SegmentRepository extends JpaRepository<SegmentRecord, String> {
    List<SegmentRecord> findByVideoIdOrderByStartOffsetAsc(String videoId);
    List<SegmentRecord> findByStatus(IngestStatus status);

    @Query(value = "select distinct r.videoId from SegmentRecord r order by r.videoId",
            countQuery = "select count(distinct r.videoId) from SegmentRecord r")
    Page<String> findVideoIds(Pageable pageable);

    @Query(value = "select distinct r.videoId from SegmentRecord r where r.status = :status order by r.videoId",
            countQuery = "select count(distinct r.videoId) from SegmentRecord r where r.status = :status")
    Page<String> findVideoIdsWithStatus(@Param("status") IngestStatus status, Pageable pageable);
}

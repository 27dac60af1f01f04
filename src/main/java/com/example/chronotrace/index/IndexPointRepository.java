package com.example.chronotrace.index;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface IndexPointRepository extends JpaRepository<IndexPointRecord, String> {
    List<IndexPointRecord> findBySegmentId(String segmentId);
}

package com.example.chronotrace.tracking;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TrackRepository extends JpaRepository<TrackRecord, String> {

    @Query("select coalesce(max(t.sequence), 0) from TrackRecord t where t.streamId = :streamId")
    long maxSequence(@Param("streamId") String streamId);

    List<TrackRecord> findByLastSeenGreaterThanEqualAndFirstSeenLessThanEqualOrderByFirstSeenAsc(long from, long to);

    List<TrackRecord> findByStreamIdOrderByFirstSeenAsc(String streamId);
}

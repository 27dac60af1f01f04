package com.example.chronotrace.embedding;

import org.springframework.data.jpa.repository.JpaRepository;

public interface EmbeddingCacheRepository extends JpaRepository<EmbeddingCacheRecord, String> {
}

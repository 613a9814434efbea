package com.example.changefeed.repository;

import com.example.changefeed.model.domain.FailedEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface FailedEventRepository extends JpaRepository<FailedEvent, Long> {

    List<FailedEvent> findByCreatedAtBefore(Instant cutoff);

    long countByCreatedAtAfter(Instant since);
}

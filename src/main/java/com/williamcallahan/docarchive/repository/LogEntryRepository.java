package com.williamcallahan.docarchive.repository;

import com.williamcallahan.docarchive.model.LogEntry;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LogEntryRepository extends JpaRepository<LogEntry, Long> {

    List<LogEntry> findByGroupOrderByCreatedAsc(UUID group);
}

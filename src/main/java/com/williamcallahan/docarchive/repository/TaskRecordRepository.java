package com.williamcallahan.docarchive.repository;

import com.williamcallahan.docarchive.model.TaskRecord;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TaskRecordRepository extends JpaRepository<TaskRecord, Long> {

    Optional<TaskRecord> findByTaskId(String taskId);

    List<TaskRecord> findByAcknowledgedFalseOrderByDateCreatedDesc();
}

package com.williamcallahan.docarchive.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * Tracks one background task run (for example, consuming an uploaded file) so the UI can show
 * its progress and result. All timestamps are UTC.
 */
@Entity
@Table(name = "task_records")
public class TaskRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_id", length = 255, nullable = false, unique = true)
    private String taskId;

    @Column(name = "acknowledged", nullable = false)
    private boolean acknowledged = false;

    @Column(name = "task_file_name", length = 255)
    private String taskFileName;

    @Column(name = "task_name", length = 255)
    private String taskName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 30, nullable = false)
    private TaskState status = TaskState.PENDING;

    @Column(name = "date_created")
    private Instant dateCreated = Instant.now();

    @Column(name = "date_started")
    private Instant dateStarted;

    @Column(name = "date_done")
    private Instant dateDone;

    @Lob
    @Column(name = "result")
    private String result;

    protected TaskRecord() {
    }

    public TaskRecord(String taskId, String taskName, String taskFileName) {
        this.taskId = taskId;
        this.taskName = taskName;
        this.taskFileName = taskFileName;
    }

    public void markStarted(Instant startedAt) {
        this.status = TaskState.STARTED;
        this.dateStarted = startedAt;
    }

    public void markFinished(TaskState finalState, Instant doneAt, String resultData) {
        if (!finalState.isReady()) {
            throw new IllegalArgumentException("Not a final task state: " + finalState);
        }
        this.status = finalState;
        this.dateDone = doneAt;
        this.result = resultData;
    }

    public Long getId() { return id; }

    public String getTaskId() { return taskId; }

    public boolean isAcknowledged() { return acknowledged; }
    public void setAcknowledged(boolean acknowledged) { this.acknowledged = acknowledged; }

    public String getTaskFileName() { return taskFileName; }

    public String getTaskName() { return taskName; }

    public TaskState getStatus() { return status; }

    public Instant getDateCreated() { return dateCreated; }

    public Instant getDateStarted() { return dateStarted; }

    public Instant getDateDone() { return dateDone; }

    public String getResult() { return result; }

    @Override
    public String toString() {
        return "Task " + taskId;
    }
}

package com.williamcallahan.docarchive.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.Lob;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A stored document: its metadata plus the names of its original and archived files on disk.
 *
 * <p>{@code filename} and {@code archiveFilename} are relative to the originals and archive
 * directories respectively. A {@code null} filename means the legacy {@code <id:07><ext>} name.</p>
 */
@Entity
@Table(name = "documents", indexes = {
        @Index(name = "idx_documents_title", columnList = "title"),
        @Index(name = "idx_documents_created", columnList = "created"),
        @Index(name = "idx_documents_modified", columnList = "modified"),
        @Index(name = "idx_documents_added", columnList = "added")
})
public class Document {
    public static final long ARCHIVE_SERIAL_NUMBER_MIN = 0L;
    public static final long ARCHIVE_SERIAL_NUMBER_MAX = 0xFF_FF_FF_FFL;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "correspondent_id")
    private Correspondent correspondent;

    @ManyToOne
    @JoinColumn(name = "storage_path_id")
    private StoragePath storagePath;

    @Column(name = "title", length = 128)
    private String title = "";

    @ManyToOne
    @JoinColumn(name = "document_type_id")
    private DocumentType documentType;

    /**
     * Raw, text-only content, primarily used for searching.
     */
    @Lob
    @Column(name = "content")
    private String content = "";

    @Column(name = "mime_type", length = 256, nullable = false)
    private String mimeType;

    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(name = "document_tags",
            joinColumns = @JoinColumn(name = "document_id"),
            inverseJoinColumns = @JoinColumn(name = "tag_id"))
    private Set<Tag> tags = new LinkedHashSet<>();

    @Column(name = "checksum", length = 32, nullable = false, unique = true)
    private String checksum;

    @Column(name = "archive_checksum", length = 32)
    private String archiveChecksum;

    @Column(name = "created", nullable = false)
    private Instant created;

    @Column(name = "modified", nullable = false)
    private Instant modified;

    @Enumerated(EnumType.STRING)
    @Column(name = "storage_type", length = 11, nullable = false)
    private StorageType storageType = StorageType.UNENCRYPTED;

    @Column(name = "added", nullable = false, updatable = false)
    private Instant added;

    @Column(name = "filename", length = 1024, unique = true)
    private String filename;

    @Column(name = "archive_filename", length = 1024, unique = true)
    private String archiveFilename;

    @Column(name = "original_filename", length = 1024, updatable = false)
    private String originalFilename;

    @Column(name = "archive_serial_number", unique = true)
    private Long archiveSerialNumber;

    @Column(name = "owner", length = 150)
    private String owner;

    protected Document() {
    }

    public Document(String title, String mimeType, String checksum) {
        this.title = title;
        this.mimeType = mimeType;
        this.checksum = checksum;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (created == null) {
            created = now;
        }
        if (added == null) {
            added = now;
        }
        modified = now;
        validateArchiveSerialNumber();
    }

    @PreUpdate
    void onUpdate() {
        modified = Instant.now();
        validateArchiveSerialNumber();
    }

    private void validateArchiveSerialNumber() {
        if (archiveSerialNumber == null) {
            return;
        }
        if (archiveSerialNumber < ARCHIVE_SERIAL_NUMBER_MIN || archiveSerialNumber > ARCHIVE_SERIAL_NUMBER_MAX) {
            throw new IllegalArgumentException("Archive serial number out of range: " + archiveSerialNumber);
        }
    }

    public boolean hasArchiveVersion() {
        return archiveFilename != null;
    }

    /**
     * Creation date as seen in the given zone.
     */
    public LocalDate createdDate(ZoneId zone) {
        return created.atZone(zone).toLocalDate();
    }

    /**
     * Human-readable label: the local creation date, then correspondent and title when present.
     *
     * @param zone zone used to derive the creation date
     * @return display label
     */
    public String displayName(ZoneId zone) {
        StringBuilder label = new StringBuilder();
        label.append(created == null ? "" : createdDate(zone).toString());
        if (correspondent != null) {
            label.append(' ').append(correspondent.getName());
        }
        if (title != null && !title.isEmpty()) {
            label.append(' ').append(title);
        }
        return label.toString();
    }

    @Override
    public String toString() {
        return displayName(ZoneOffset.UTC);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Correspondent getCorrespondent() { return correspondent; }
    public void setCorrespondent(Correspondent correspondent) { this.correspondent = correspondent; }

    public StoragePath getStoragePath() { return storagePath; }
    public void setStoragePath(StoragePath storagePath) { this.storagePath = storagePath; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public DocumentType getDocumentType() { return documentType; }
    public void setDocumentType(DocumentType documentType) { this.documentType = documentType; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getMimeType() { return mimeType; }
    public void setMimeType(String mimeType) { this.mimeType = mimeType; }

    public Set<Tag> getTags() { return tags; }
    public void setTags(Set<Tag> tags) { this.tags = tags; }

    public String getChecksum() { return checksum; }
    public void setChecksum(String checksum) { this.checksum = checksum; }

    public String getArchiveChecksum() { return archiveChecksum; }
    public void setArchiveChecksum(String archiveChecksum) { this.archiveChecksum = archiveChecksum; }

    public Instant getCreated() { return created; }
    public void setCreated(Instant created) { this.created = created; }

    public Instant getModified() { return modified; }

    public StorageType getStorageType() { return storageType; }
    public void setStorageType(StorageType storageType) { this.storageType = storageType; }

    public Instant getAdded() { return added; }
    public void setAdded(Instant added) { this.added = added; }

    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }

    public String getArchiveFilename() { return archiveFilename; }
    public void setArchiveFilename(String archiveFilename) { this.archiveFilename = archiveFilename; }

    public String getOriginalFilename() { return originalFilename; }
    public void setOriginalFilename(String originalFilename) { this.originalFilename = originalFilename; }

    public Long getArchiveSerialNumber() { return archiveSerialNumber; }
    public void setArchiveSerialNumber(Long archiveSerialNumber) { this.archiveSerialNumber = archiveSerialNumber; }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }
}

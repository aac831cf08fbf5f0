package com.williamcallahan.docarchive.repository;

import com.williamcallahan.docarchive.model.Document;
import com.williamcallahan.docarchive.model.StorageType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface DocumentRepository extends JpaRepository<Document, Long> {

    Optional<Document> findByChecksum(String checksum);

    boolean existsByFilename(String filename);

    boolean existsByArchiveFilename(String archiveFilename);

    /**
     * Documents that have no archived version yet.
     */
    List<Document> findByArchiveFilenameIsNullOrderByIdAsc();

    List<Document> findAllByOrderByIdAsc();

    List<Document> findByStorageTypeOrderByIdAsc(StorageType storageType);

    @Query("select d.filename from Document d where d.filename is not null")
    List<String> findAllFilenames();

    @Query("select d.archiveFilename from Document d where d.archiveFilename is not null")
    List<String> findAllArchiveFilenames();
}

package com.williamcallahan.docarchive.repository;

import com.williamcallahan.docarchive.model.StoragePath;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StoragePathRepository extends JpaRepository<StoragePath, Long> {

    Optional<StoragePath> findByNameAndOwnerIsNull(String name);
}

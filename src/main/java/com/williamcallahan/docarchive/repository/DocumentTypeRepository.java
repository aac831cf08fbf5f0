package com.williamcallahan.docarchive.repository;

import com.williamcallahan.docarchive.model.DocumentType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DocumentTypeRepository extends JpaRepository<DocumentType, Long> {

    Optional<DocumentType> findByNameAndOwnerIsNull(String name);
}

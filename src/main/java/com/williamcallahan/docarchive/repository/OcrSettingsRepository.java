package com.williamcallahan.docarchive.repository;

import com.williamcallahan.docarchive.model.OcrSettingsEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OcrSettingsRepository extends JpaRepository<OcrSettingsEntity, Long> {

    Optional<OcrSettingsEntity> findFirstByOrderByIdAsc();
}

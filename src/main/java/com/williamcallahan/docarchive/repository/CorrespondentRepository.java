package com.williamcallahan.docarchive.repository;

import com.williamcallahan.docarchive.model.Correspondent;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CorrespondentRepository extends JpaRepository<Correspondent, Long> {

    Optional<Correspondent> findByNameAndOwnerIsNull(String name);
}

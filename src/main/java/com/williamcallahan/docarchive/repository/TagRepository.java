package com.williamcallahan.docarchive.repository;

import com.williamcallahan.docarchive.model.Tag;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TagRepository extends JpaRepository<Tag, Long> {

    Optional<Tag> findByNameAndOwnerIsNull(String name);

    List<Tag> findByInboxTagTrue();
}

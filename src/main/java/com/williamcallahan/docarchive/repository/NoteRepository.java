package com.williamcallahan.docarchive.repository;

import com.williamcallahan.docarchive.model.Note;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface NoteRepository extends JpaRepository<Note, Long> {

    List<Note> findByDocumentIdOrderByCreatedAsc(Long documentId);
}

package com.williamcallahan.docarchive.repository;

import com.williamcallahan.docarchive.model.SavedView;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SavedViewRepository extends JpaRepository<SavedView, Long> {

    List<SavedView> findByShowOnDashboardTrueOrderByNameAsc();

    List<SavedView> findByShowInSidebarTrueOrderByNameAsc();
}

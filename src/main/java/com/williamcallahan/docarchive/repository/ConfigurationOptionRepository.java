package com.williamcallahan.docarchive.repository;

import com.williamcallahan.docarchive.model.ConfigurationOption;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConfigurationOptionRepository extends JpaRepository<ConfigurationOption, Long> {

    Optional<ConfigurationOption> findByKey(String key);
}

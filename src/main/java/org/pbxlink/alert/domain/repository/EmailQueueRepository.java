package org.pbxlink.alert.domain.repository;

import org.pbxlink.alert.domain.model.EmailQueueEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EmailQueueRepository extends JpaRepository<EmailQueueEntry, Long> {
}

package org.pbxlink.alert.domain.repository;

import org.pbxlink.alert.domain.model.EventQueueEntry;
import org.pbxlink.alert.domain.model.enums.PublishStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface EventQueueEntryRepository extends JpaRepository<EventQueueEntry, Long> {

    List<EventQueueEntry> findByPublishStatusAndCreatedAtBefore(PublishStatus publishStatus, OffsetDateTime cutoff);

    long countByPublishStatus(PublishStatus publishStatus);
}

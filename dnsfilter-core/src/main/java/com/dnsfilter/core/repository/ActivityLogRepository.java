package com.dnsfilter.core.repository;

import com.dnsfilter.core.domain.ActivityLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for the activity log.
 * Append-only: the service layer never updates or deletes entries.
 */
@Repository
public interface ActivityLogRepository extends JpaRepository<ActivityLog, UUID> {
}

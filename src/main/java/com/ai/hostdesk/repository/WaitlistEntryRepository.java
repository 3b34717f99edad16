package com.ai.hostdesk.repository;

import com.ai.hostdesk.entity.WaitlistEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WaitlistEntryRepository extends JpaRepository<WaitlistEntry, Long> {

    Optional<WaitlistEntry> findByPartyId(String partyId);

    List<WaitlistEntry> findAllByOrderByEnqueuedAtAscIdAsc();
}

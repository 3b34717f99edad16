package com.ai.hostdesk.repository;

import com.ai.hostdesk.entity.DiningTable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

@Repository
public interface DiningTableRepository extends JpaRepository<DiningTable, Long> {

    Optional<DiningTable> findByNumber(String number);

    boolean existsByNumber(String number);

    List<DiningTable> findByStatusOrderByCapacityAscIdAsc(DiningTable.Status status);

    @Query("SELECT COALESCE(MAX(t.capacity), 0) FROM DiningTable t")
    int findMaxCapacity();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM DiningTable t WHERE t.id = :id")
    Optional<DiningTable> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM DiningTable t WHERE t.number = :number")
    Optional<DiningTable> findByNumberForUpdate(@Param("number") String number);
}

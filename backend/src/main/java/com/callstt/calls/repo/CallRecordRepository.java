package com.callstt.calls.repo;

import com.callstt.calls.model.CallRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CallRecordRepository extends JpaRepository<CallRecordEntity, Long> {
}

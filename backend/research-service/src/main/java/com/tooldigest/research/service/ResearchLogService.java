package com.tooldigest.research.service;

import com.tooldigest.research.entity.ResearchLogEntry;
import com.tooldigest.research.repository.ResearchLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchLogService {

    private final ResearchLogRepository repository;

    /**
     * Appends an entry. Never throws; a failed write is only logged.
     */
    public void record(ResearchLogEntry entry) {
        try {
            repository.append(entry);
        } catch (RuntimeException e) {
            log.warn("Failed to write research log entry for run {}: {}", entry.runId(), e.getMessage());
        }
    }

    public List<ResearchLogEntry> recent() {
        return repository.findAll();
    }
}

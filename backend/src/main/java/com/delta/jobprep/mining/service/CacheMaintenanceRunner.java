package com.delta.jobprep.mining.service;

import com.delta.jobprep.mining.model.CacheStats;
import com.delta.jobprep.mining.persistence.JdbcContentCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
public class CacheMaintenanceRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CacheMaintenanceRunner.class);

    private final JdbcContentCache cache;

    public CacheMaintenanceRunner(JdbcContentCache cache) {
        this.cache = cache;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            int purged = cache.purgeExpired();
            CacheStats stats = cache.stats();
            log.info(
                "Content cache ready: total={} valid={} purged={}",
                stats.totalEntries(),
                stats.validEntries(),
                purged
            );
        } catch (DataAccessException e) {
            log.warn("Skipping content cache maintenance: {}", e.getMessage());
        }
    }
}

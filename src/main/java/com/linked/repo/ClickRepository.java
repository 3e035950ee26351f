package com.linked.repo;

import com.linked.model.LinkStats;
import com.linked.util.TimeFormats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;

/**
 * Append-only click ledger. Rows are only ever inserted here; they disappear through the
 * {@code ON DELETE CASCADE} on their link.
 */
@Slf4j
@Repository
public class ClickRepository {

    private static final RowMapper<LinkStats> STATS_MAPPER = (rs, rowNum) -> new LinkStats(
            rs.getLong("total"),
            TimeFormats.fromStorage(rs.getString("last_clicked_at")));

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public ClickRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    public void record(long linkId, String userAgent, String ipAddress) {
        jdbcTemplate.update(
                "INSERT INTO clicks (link_id, clicked_at, user_agent, ip_address) VALUES (?, ?, ?, ?)",
                linkId, TimeFormats.toStorage(clock.instant()), userAgent, ipAddress);
        log.debug("click recorded for link {} from {}", linkId, ipAddress);
    }

    /**
     * Aggregates always yield one row, so an unknown or unclicked link gives {@code {0, null}}.
     */
    public LinkStats statsFor(long linkId) {
        return jdbcTemplate.queryForObject(
                "SELECT COUNT(*) AS total, MAX(clicked_at) AS last_clicked_at FROM clicks WHERE link_id = ?",
                STATS_MAPPER, linkId);
    }
}

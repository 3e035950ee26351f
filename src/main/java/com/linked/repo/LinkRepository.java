package com.linked.repo;

import com.linked.exception.NotFoundException;
import com.linked.exception.SlugExistsException;
import com.linked.model.Link;
import com.linked.util.SlugGenerator;
import com.linked.util.TimeFormats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns the {@code links} table. Slug uniqueness is left to the {@code UNIQUE} constraint rather
 * than checked beforehand, so two concurrent creates cannot both win.
 */
@Slf4j
@Repository
public class LinkRepository {

    private static final String COLUMNS = "id, slug, url, created_at";

    private static final RowMapper<Link> LINK_MAPPER = (rs, rowNum) -> new Link(
            rs.getLong("id"),
            rs.getString("slug"),
            rs.getString("url"),
            TimeFormats.fromStorage(rs.getString("created_at")),
            null);

    private final JdbcTemplate jdbcTemplate;
    private final ClickRepository clickRepository;
    private final Clock clock;

    public LinkRepository(JdbcTemplate jdbcTemplate, ClickRepository clickRepository, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clickRepository = clickRepository;
        this.clock = clock;
    }

    /**
     * Inserts a link, generating a slug when {@code slug} is blank. The insert is tried once: a
     * collision surfaces as {@link SlugExistsException} even for a generated slug.
     */
    public Link create(String slug, String url) {
        String effectiveSlug = StringUtils.hasText(slug) ? slug : SlugGenerator.generate();
        try {
            jdbcTemplate.update(
                    "INSERT INTO links (slug, url, created_at) VALUES (?, ?, ?)",
                    effectiveSlug, url, TimeFormats.toStorage(clock.instant()));
        } catch (DataAccessException e) {
            if (isUniqueViolation(e)) {
                throw new SlugExistsException(effectiveSlug, e);
            }
            throw e;
        }

        // slug is unique and immutable, so it identifies the row just written
        return findBySlug(effectiveSlug)
                .orElseThrow(() -> new IllegalStateException("insert of " + effectiveSlug + " returned nothing"));
    }

    public Optional<Link> findBySlug(String slug) {
        List<Link> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM links WHERE slug = ?", LINK_MAPPER, slug);
        return rows.stream().findFirst();
    }

    public Link getBySlug(String slug) {
        return findBySlug(slug).orElseThrow(() -> new NotFoundException("link not found"));
    }

    /**
     * Newest first, each with its click stats (one aggregate query per link).
     */
    public List<Link> listAll() {
        List<Link> links = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM links ORDER BY id DESC", LINK_MAPPER);
        return links.stream()
                .map(link -> link.withStats(clickRepository.statsFor(link.getId())))
                .collect(Collectors.toList());
    }

    /**
     * @throws NotFoundException when no row has this id; deleting twice is an error
     */
    public void delete(long id) {
        int affected = jdbcTemplate.update("DELETE FROM links WHERE id = ?", id);
        if (affected == 0) {
            throw new NotFoundException("link not found");
        }
        log.debug("deleted link {}", id);
    }

    static boolean isUniqueViolation(DataAccessException e) {
        if (e instanceof DuplicateKeyException) {
            return true;
        }
        Throwable cause = e.getMostSpecificCause();
        if (!(cause instanceof SQLiteException)) {
            return false;
        }
        SQLiteErrorCode code = ((SQLiteException) cause).getResultCode();
        return code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
                || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY
                || (code == SQLiteErrorCode.SQLITE_CONSTRAINT && String.valueOf(cause.getMessage()).contains("UNIQUE"));
    }
}

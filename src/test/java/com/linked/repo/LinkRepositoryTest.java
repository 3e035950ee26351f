package com.linked.repo;

import com.linked.MutableClock;
import com.linked.exception.NotFoundException;
import com.linked.exception.SlugExistsException;
import com.linked.model.Link;
import com.linked.util.SlugGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class LinkRepositoryTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-04-01T00:00:00Z"));

    private JdbcTemplate jdbcTemplate;
    private ClickRepository clickRepository;
    private LinkRepository linkRepository;

    @BeforeEach
    void setUp() {
        jdbcTemplate = TestDatabase.open(tempDir);
        clickRepository = new ClickRepository(jdbcTemplate, clock);
        linkRepository = new LinkRepository(jdbcTemplate, clickRepository, clock);
    }

    @Test
    void createReturnsPopulatedLink() {
        Link link = linkRepository.create("abc123", "https://example.com/a");

        assertTrue(link.getId() > 0);
        assertEquals("abc123", link.getSlug());
        assertEquals("https://example.com/a", link.getUrl());
        assertEquals(clock.instant(), link.getCreatedAt());
        assertNull(link.getStats());
    }

    @Test
    void duplicateSlugIsRejectedAndOriginalSurvives() {
        Link first = linkRepository.create("abc123", "https://example.com/first");

        SlugExistsException e = assertThrows(SlugExistsException.class,
                () -> linkRepository.create("abc123", "https://example.com/second"));

        assertEquals("abc123", e.getSlug());
        Link found = linkRepository.getBySlug("abc123");
        assertEquals(first.getId(), found.getId());
        assertEquals("https://example.com/first", found.getUrl());
    }

    @Test
    void blankSlugIsGenerated() {
        Link link = linkRepository.create("", "https://example.com");

        assertEquals(SlugGenerator.LENGTH, link.getSlug().length());
        assertTrue(link.getSlug().chars().allMatch(c -> SlugGenerator.ALPHABET.indexOf(c) >= 0));
        assertEquals(link.getId(), linkRepository.getBySlug(link.getSlug()).getId());
    }

    @Test
    void lookupIsExactMatch() {
        linkRepository.create("abc123", "https://example.com");

        assertThrows(NotFoundException.class, () -> linkRepository.getBySlug("ABC123"));
        assertThrows(NotFoundException.class, () -> linkRepository.getBySlug("abc12"));
        assertTrue(linkRepository.findBySlug("abc1234").isEmpty());
    }

    @Test
    void listIsNewestFirstWithStats() {
        Link older = linkRepository.create("older", "https://example.com/1");
        clock.advance(Duration.ofMinutes(1));
        Link newer = linkRepository.create("newer", "https://example.com/2");
        clickRepository.record(older.getId(), "ua", "10.0.0.1");
        clickRepository.record(older.getId(), "ua", "10.0.0.1");

        List<Link> links = linkRepository.listAll();

        assertEquals(2, links.size());
        assertEquals(newer.getId(), links.get(0).getId());
        assertEquals(0, links.get(0).getStats().getTotalClicks());
        assertNull(links.get(0).getStats().getLastClickedAt());
        assertEquals(older.getId(), links.get(1).getId());
        assertEquals(2, links.get(1).getStats().getTotalClicks());
        assertEquals(clock.instant(), links.get(1).getStats().getLastClickedAt());
    }

    @Test
    void deletingMissingIdIsNotFound() {
        assertThrows(NotFoundException.class, () -> linkRepository.delete(42));
    }

    @Test
    void deleteCascadesToClicks() {
        Link link = linkRepository.create("gone1", "https://example.com");
        Link other = linkRepository.create("kept1", "https://example.com");
        clickRepository.record(link.getId(), "ua", "10.0.0.1");
        clickRepository.record(link.getId(), "ua", "10.0.0.2");
        clickRepository.record(other.getId(), "ua", "10.0.0.3");

        linkRepository.delete(link.getId());

        assertTrue(linkRepository.findBySlug("gone1").isEmpty());
        Integer orphans = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM clicks WHERE link_id = ?", Integer.class, link.getId());
        assertEquals(0, orphans);
        assertEquals(1, clickRepository.statsFor(other.getId()).getTotalClicks());
        assertThrows(NotFoundException.class, () -> linkRepository.delete(link.getId()));
    }

    @Test
    void slugCanBeReusedAfterDelete() {
        Link link = linkRepository.create("again", "https://example.com/old");
        linkRepository.delete(link.getId());

        Link reused = linkRepository.create("again", "https://example.com/new");

        assertNotEquals(link.getId(), reused.getId());
        assertEquals("https://example.com/new", linkRepository.getBySlug("again").getUrl());
    }

    @Test
    void concurrentCreatesOfSameSlugHaveOneWinner() throws Exception {
        int attempts = 4;
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        try {
            List<Callable<Link>> tasks = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                String url = "https://example.com/" + i;
                tasks.add(() -> linkRepository.create("race1", url));
            }

            int created = 0;
            int conflicts = 0;
            for (Future<Link> future : pool.invokeAll(tasks)) {
                try {
                    future.get();
                    created++;
                } catch (ExecutionException e) {
                    assertInstanceOf(SlugExistsException.class, e.getCause());
                    conflicts++;
                }
            }

            assertEquals(1, created);
            assertEquals(attempts - 1, conflicts);
        } finally {
            pool.shutdownNow();
        }
    }
}

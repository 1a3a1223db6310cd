package com.my.caddy.adapter.out.memory;

import com.my.caddy.config.TestAppConfig;
import com.my.caddy.domain.model.Lie;
import com.my.caddy.domain.model.MissDirection;
import com.my.caddy.domain.model.MissEvent;
import com.my.caddy.domain.model.MissPattern;
import com.my.caddy.domain.model.PressureContext;
import com.my.caddy.domain.model.StoredPatterns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteMissMemoryAdapterTest {

    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");
    private static final Instant EPOCH = Instant.EPOCH;

    @TempDir
    Path tempDir;

    private SqliteMissMemoryAdapter adapter;

    @BeforeEach
    void setUp() {
        TestAppConfig config = new TestAppConfig();
        config.sqlitePath = tempDir.resolve("memory/caddy.db").toString();
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + config.sqlitePath);
        adapter = new SqliteMissMemoryAdapter(dataSource, config);
        adapter.init();
    }

    @Test
    void duplicate_event_id_is_stored_once() {
        adapter.append(event("m1", NOW, "driver", MissDirection.SLICE, PressureContext.NONE, 4));
        adapter.append(event("m1", NOW, "driver", MissDirection.HOOK, PressureContext.NONE, 4));

        List<MissEvent> events = adapter.findEvents(null, false, EPOCH, 50);

        assertThat(events).singleElement().satisfies(stored -> {
            assertThat(stored.missDirection()).isEqualTo(MissDirection.SLICE);
            assertThat(stored.holeNumber()).isEqualTo(4);
        });
    }

    @Test
    void events_come_back_newest_first_with_limit() {
        adapter.append(event("a", NOW.minus(Duration.ofHours(2)), "driver", MissDirection.SLICE, PressureContext.NONE, null));
        adapter.append(event("b", NOW, "driver", MissDirection.PUSH, PressureContext.NONE, null));
        adapter.append(event("c", NOW.minus(Duration.ofHours(1)), "driver", MissDirection.HOOK, PressureContext.NONE, null));

        assertThat(adapter.findEvents(null, false, EPOCH, 2))
                .extracting(MissEvent::id)
                .containsExactly("b", "c");
    }

    @Test
    void filters_by_club_pressure_and_window() {
        adapter.append(event("d1", NOW, "driver", MissDirection.SLICE, PressureContext.NONE, null));
        adapter.append(event("d2", NOW, "driver", MissDirection.SLICE, new PressureContext(false, true), 18));
        adapter.append(event("i1", NOW, "7-iron", MissDirection.PULL, new PressureContext(true, false), null));
        adapter.append(event("old", NOW.minus(Duration.ofDays(40)), "driver", MissDirection.SLICE, PressureContext.NONE, null));

        Instant since = NOW.minus(Duration.ofDays(30));
        assertThat(adapter.findEvents("driver", false, since, 50)).extracting(MissEvent::id).containsExactly("d1", "d2");
        assertThat(adapter.findEvents(null, true, since, 50)).extracting(MissEvent::id).containsExactly("d2", "i1");
        assertThat(adapter.findEvents("driver", true, since, 50)).singleElement()
                .extracting(MissEvent::pressureContext)
                .isEqualTo(new PressureContext(false, true));
    }

    @Test
    void replace_patterns_swaps_whole_set_and_keeps_rank_order() {
        String key = "club=driver|pressure=false";
        adapter.replacePatterns(key, List.of(pattern("p-old", MissDirection.HOOK, 0.5)), NOW.minus(Duration.ofDays(1)));
        adapter.replacePatterns(key, List.of(
                pattern("p1", MissDirection.SLICE, 0.6),
                pattern("p2", MissDirection.PUSH, 0.3)), NOW);
        adapter.replacePatterns("club=*|pressure=false", List.of(pattern("other", MissDirection.FAT, 0.9)), NOW);

        StoredPatterns snapshot = adapter.findPatterns(key).orElseThrow();
        List<MissPattern> stored = snapshot.patterns();

        assertThat(snapshot.refreshedAt()).isEqualTo(NOW);
        assertThat(stored).extracting(MissPattern::id).containsExactly("p1", "p2");
        assertThat(stored.get(0).confidence()).isEqualTo(0.6);
        assertThat(stored.get(0).lastOccurrence()).isEqualTo(NOW);
        assertThat(stored.get(0).pressureContext()).isNull();
    }

    @Test
    void retention_deletes_only_events_before_cutoff() {
        Instant cutoff = NOW.minus(Duration.ofDays(90));
        adapter.append(event("gone", cutoff.minusMillis(1), "driver", MissDirection.SLICE, PressureContext.NONE, null));
        adapter.append(event("edge", cutoff, "driver", MissDirection.SLICE, PressureContext.NONE, null));

        int deleted = adapter.deleteEventsBefore(cutoff);

        assertThat(deleted).isEqualTo(1);
        assertThat(adapter.findEvents(null, false, EPOCH, 50)).extracting(MissEvent::id).containsExactly("edge");
    }

    @Test
    void clear_removes_events_and_patterns() {
        adapter.append(event("m1", NOW, "driver", MissDirection.SLICE, PressureContext.NONE, null));
        adapter.replacePatterns("k", List.of(pattern("p1", MissDirection.SLICE, 0.6)), NOW);

        adapter.clear();

        assertThat(adapter.findEvents(null, false, EPOCH, 50)).isEmpty();
        assertThat(adapter.findPatterns("k")).isEmpty();
    }

    @Test
    void empty_replacement_leaves_nothing_stored() {
        adapter.replacePatterns("k", List.of(pattern("p1", MissDirection.SLICE, 0.6)), NOW);
        adapter.replacePatterns("k", List.of(), NOW);

        assertThat(adapter.findPatterns("k")).isEmpty();
    }

    @Test
    void data_survives_a_new_adapter_on_the_same_file() {
        adapter.append(event("m1", NOW, "driver", MissDirection.SLICE, PressureContext.NONE, null));

        TestAppConfig config = new TestAppConfig();
        config.sqlitePath = tempDir.resolve("memory/caddy.db").toString();
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + config.sqlitePath);
        SqliteMissMemoryAdapter reopened = new SqliteMissMemoryAdapter(dataSource, config);
        reopened.init();

        assertThat(reopened.findEvents(null, false, EPOCH, 50)).extracting(MissEvent::id).containsExactly("m1");
    }

    @Test
    void pattern_table_without_refresh_time_is_rebuilt() throws Exception {
        Path legacyPath = tempDir.resolve("legacy/caddy.db");
        Files.createDirectories(legacyPath.getParent());
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + legacyPath);
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE miss_patterns (filter_key TEXT NOT NULL, id TEXT NOT NULL, rank INTEGER NOT NULL)");
            stmt.execute("INSERT INTO miss_patterns VALUES ('k', 'stale', 0)");
        }
        TestAppConfig config = new TestAppConfig();
        config.sqlitePath = legacyPath.toString();
        SqliteMissMemoryAdapter upgraded = new SqliteMissMemoryAdapter(dataSource, config);

        upgraded.init();
        upgraded.replacePatterns("k", List.of(pattern("p1", MissDirection.SLICE, 0.6)), NOW);

        assertThat(upgraded.findPatterns("k")).get()
                .extracting(StoredPatterns::refreshedAt).isEqualTo(NOW);
    }

    private static MissEvent event(String id, Instant at, String club, MissDirection direction,
                                   PressureContext pressure, Integer hole) {
        return new MissEvent(id, at, club, direction, Lie.TEE, pressure, hole, "note " + id);
    }

    private static MissPattern pattern(String id, MissDirection direction, double confidence) {
        return new MissPattern(id, direction, 3, confidence, NOW, "driver", null);
    }
}

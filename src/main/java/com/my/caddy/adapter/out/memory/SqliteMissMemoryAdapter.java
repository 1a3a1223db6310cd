package com.my.caddy.adapter.out.memory;

import com.my.caddy.config.AppConfig;
import com.my.caddy.domain.model.Lie;
import com.my.caddy.domain.model.MissDirection;
import com.my.caddy.domain.model.MissEvent;
import com.my.caddy.domain.model.MissPattern;
import com.my.caddy.domain.model.PressureContext;
import com.my.caddy.domain.model.StoredPatterns;
import com.my.caddy.domain.port.out.MissMemoryPort;
import io.quarkus.arc.properties.IfBuildProperty;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 재시작 후에도 미스 기록이 남도록 파일 기반 SQLite에 이벤트와 구체화된 패턴을 저장한다.
 *
 * <p>이벤트 ID가 같으면 다시 쓰지 않으므로 같은 메시지가 재전달돼도 한 번만 기록된다.
 */
@Startup
@IfBuildProperty(name = "app.memory.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteMissMemoryAdapter implements MissMemoryPort {

    private static final String EVENTS_DDL = """
            CREATE TABLE IF NOT EXISTS miss_events (
                id TEXT PRIMARY KEY,
                occurred_at INTEGER NOT NULL,
                club_id TEXT NOT NULL,
                direction TEXT NOT NULL,
                lie TEXT NOT NULL,
                user_tagged INTEGER NOT NULL,
                inferred INTEGER NOT NULL,
                hole INTEGER,
                notes TEXT
            )
            """;

    private static final String EVENTS_INDEX = "CREATE INDEX IF NOT EXISTS idx_miss_events_time ON miss_events(occurred_at)";

    private static final String PATTERNS_DDL = """
            CREATE TABLE IF NOT EXISTS miss_patterns (
                filter_key TEXT NOT NULL,
                id TEXT NOT NULL,
                direction TEXT NOT NULL,
                frequency INTEGER NOT NULL,
                confidence REAL NOT NULL,
                last_occurrence INTEGER NOT NULL,
                club_id TEXT,
                pressure_tagged INTEGER,
                pressure_inferred INTEGER,
                rank INTEGER NOT NULL,
                refreshed_at INTEGER NOT NULL,
                PRIMARY KEY (filter_key, id)
            )
            """;

    // 파생 데이터라 구 스키마면 버리고 다음 재계산에서 다시 채운다.
    private static final String LEGACY_PATTERNS_CHECK =
            "SELECT COUNT(*) FROM pragma_table_info('miss_patterns') WHERE name = 'refreshed_at'";
    private static final String LEGACY_PATTERNS_COLUMNS = "SELECT COUNT(*) FROM pragma_table_info('miss_patterns')";

    private static final String ENABLE_WAL = "PRAGMA journal_mode=WAL";

    private static final String INSERT_EVENT_SQL = """
            INSERT OR IGNORE INTO miss_events(id, occurred_at, club_id, direction, lie, user_tagged, inferred, hole, notes)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
    private static final String SELECT_EVENTS_SQL = """
            SELECT id, occurred_at, club_id, direction, lie, user_tagged, inferred, hole, notes
            FROM miss_events
            WHERE occurred_at >= ?
              AND (? IS NULL OR club_id = ?)
              AND (? = 0 OR user_tagged = 1 OR inferred = 1)
            ORDER BY occurred_at DESC, id ASC
            LIMIT ?
            """;
    private static final String DELETE_PATTERNS_SQL = "DELETE FROM miss_patterns WHERE filter_key = ?";
    private static final String INSERT_PATTERN_SQL = """
            INSERT INTO miss_patterns(filter_key, id, direction, frequency, confidence, last_occurrence,
                                      club_id, pressure_tagged, pressure_inferred, rank, refreshed_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
    private static final String SELECT_PATTERNS_SQL = """
            SELECT id, direction, frequency, confidence, last_occurrence, club_id, pressure_tagged, pressure_inferred,
                   refreshed_at
            FROM miss_patterns
            WHERE filter_key = ?
            ORDER BY rank ASC
            """;
    private static final String DELETE_OLD_EVENTS_SQL = "DELETE FROM miss_events WHERE occurred_at < ?";

    private final DataSource dataSource;
    private final Path sqlitePath;

    public SqliteMissMemoryAdapter(DataSource dataSource, AppConfig appConfig) {
        this.dataSource = dataSource;
        this.sqlitePath = Path.of(appConfig.memory().sqlitePath());
    }

    @PostConstruct
    void init() {
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (Exception e) {
            throw new IllegalStateException("SQLite 경로 생성 실패", e);
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(ENABLE_WAL);
            stmt.execute(EVENTS_DDL);
            stmt.execute(EVENTS_INDEX);
            if (count(stmt, LEGACY_PATTERNS_COLUMNS) > 0 && count(stmt, LEGACY_PATTERNS_CHECK) == 0) {
                stmt.execute("DROP TABLE miss_patterns");
            }
            stmt.execute(PATTERNS_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("미스 기억 테이블 초기화 실패", e);
        }
    }

    @Override
    public void append(MissEvent event) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_EVENT_SQL)) {
            ps.setString(1, event.id());
            ps.setLong(2, event.timestamp().toEpochMilli());
            ps.setString(3, event.clubId());
            ps.setString(4, event.missDirection().name());
            ps.setString(5, event.lie().name());
            ps.setInt(6, event.pressureContext().isUserTagged() ? 1 : 0);
            ps.setInt(7, event.pressureContext().isInferred() ? 1 : 0);
            if (event.holeNumber() == null) {
                ps.setNull(8, Types.INTEGER);
            } else {
                ps.setInt(8, event.holeNumber());
            }
            ps.setString(9, event.notes());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("미스 이벤트 기록 실패", e);
        }
    }

    @Override
    public List<MissEvent> findEvents(String clubId, boolean pressureOnly, Instant since, int limit) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_EVENTS_SQL)) {
            ps.setLong(1, since.toEpochMilli());
            ps.setString(2, clubId);
            ps.setString(3, clubId);
            ps.setInt(4, pressureOnly ? 1 : 0);
            ps.setInt(5, limit);
            List<MissEvent> events = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    events.add(toEvent(rs));
                }
            }
            return events;
        } catch (SQLException e) {
            throw new IllegalStateException("미스 이벤트 조회 실패", e);
        }
    }

    @Override
    public void replacePatterns(String filterKey, List<MissPattern> patterns, Instant refreshedAt) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement delete = conn.prepareStatement(DELETE_PATTERNS_SQL);
                 PreparedStatement insert = conn.prepareStatement(INSERT_PATTERN_SQL)) {
                delete.setString(1, filterKey);
                delete.executeUpdate();
                int rank = 0;
                for (MissPattern pattern : patterns) {
                    bindPattern(insert, filterKey, pattern, rank++, refreshedAt);
                    insert.addBatch();
                }
                insert.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("미스 패턴 교체 실패", e);
        }
    }

    @Override
    public Optional<StoredPatterns> findPatterns(String filterKey) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_PATTERNS_SQL)) {
            ps.setString(1, filterKey);
            List<MissPattern> patterns = new ArrayList<>();
            Instant refreshedAt = null;
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    patterns.add(toPattern(rs));
                    refreshedAt = Instant.ofEpochMilli(rs.getLong("refreshed_at"));
                }
            }
            return refreshedAt == null ? Optional.empty() : Optional.of(new StoredPatterns(patterns, refreshedAt));
        } catch (SQLException e) {
            throw new IllegalStateException("미스 패턴 조회 실패", e);
        }
    }

    @Override
    public int deleteEventsBefore(Instant cutoff) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(DELETE_OLD_EVENTS_SQL)) {
            ps.setLong(1, cutoff.toEpochMilli());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("미스 이벤트 정리 실패", e);
        }
    }

    @Override
    public void clear() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("DELETE FROM miss_events");
            stmt.executeUpdate("DELETE FROM miss_patterns");
        } catch (SQLException e) {
            throw new IllegalStateException("미스 기억 삭제 실패", e);
        }
    }

    private static int count(Statement stmt, String sql) throws SQLException {
        try (ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static void bindPattern(PreparedStatement ps, String filterKey, MissPattern pattern, int rank,
                                    Instant refreshedAt) throws SQLException {
        ps.setString(1, filterKey);
        ps.setString(2, pattern.id());
        ps.setString(3, pattern.direction().name());
        ps.setInt(4, pattern.frequency());
        ps.setDouble(5, pattern.confidence());
        ps.setLong(6, pattern.lastOccurrence().toEpochMilli());
        ps.setString(7, pattern.clubId());
        if (pattern.pressureContext() == null) {
            ps.setNull(8, Types.INTEGER);
            ps.setNull(9, Types.INTEGER);
        } else {
            ps.setInt(8, pattern.pressureContext().isUserTagged() ? 1 : 0);
            ps.setInt(9, pattern.pressureContext().isInferred() ? 1 : 0);
        }
        ps.setInt(10, rank);
        ps.setLong(11, refreshedAt.toEpochMilli());
    }

    private static MissEvent toEvent(ResultSet rs) throws SQLException {
        int hole = rs.getInt("hole");
        Integer holeNumber = rs.wasNull() ? null : hole;
        return new MissEvent(
                rs.getString("id"),
                Instant.ofEpochMilli(rs.getLong("occurred_at")),
                rs.getString("club_id"),
                MissDirection.valueOf(rs.getString("direction")),
                Lie.valueOf(rs.getString("lie")),
                new PressureContext(rs.getInt("user_tagged") == 1, rs.getInt("inferred") == 1),
                holeNumber,
                rs.getString("notes"));
    }

    private static MissPattern toPattern(ResultSet rs) throws SQLException {
        int tagged = rs.getInt("pressure_tagged");
        boolean noPressure = rs.wasNull();
        int inferred = rs.getInt("pressure_inferred");
        PressureContext pressure = noPressure ? null : new PressureContext(tagged == 1, inferred == 1);
        return new MissPattern(
                rs.getString("id"),
                MissDirection.valueOf(rs.getString("direction")),
                rs.getInt("frequency"),
                rs.getDouble("confidence"),
                Instant.ofEpochMilli(rs.getLong("last_occurrence")),
                rs.getString("club_id"),
                pressure);
    }
}

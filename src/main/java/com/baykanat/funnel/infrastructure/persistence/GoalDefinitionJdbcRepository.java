package com.baykanat.funnel.infrastructure.persistence;

import com.baykanat.funnel.domain.model.Filter;
import com.baykanat.funnel.domain.model.GoalDefinition;
import com.baykanat.funnel.domain.model.StepKind;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** goals tablosu; filters JSONB. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class GoalDefinitionJdbcRepository {

    private static final TypeReference<List<Filter>> FILTER_LIST = new TypeReference<>() {
    };

    private static final String SELECT_COLUMNS = """
            SELECT id, website_id, name, type, target, description, filters, ignore_historic_data,
                   is_active, created_at, updated_at
            FROM goals
            """;

    private static final String INSERT_SQL = """
            INSERT INTO goals (id, website_id, name, type, target, description, filters,
                               ignore_historic_data, is_active, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?)
            """;

    private static final String UPDATE_SQL = """
            UPDATE goals
            SET name = ?, type = ?, target = ?, description = ?, filters = ?::jsonb,
                ignore_historic_data = ?, is_active = ?, updated_at = ?
            WHERE id = ? AND website_id = ? AND deleted_at IS NULL
            """;

    private static final String SOFT_DELETE_SQL = """
            UPDATE goals
            SET deleted_at = ?, is_active = FALSE, updated_at = ?
            WHERE id = ? AND website_id = ? AND deleted_at IS NULL
            """;

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    private final RowMapper<GoalDefinition> rowMapper = this::mapRow;

    public List<GoalDefinition> findByWebsite(String websiteId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE website_id = ? AND deleted_at IS NULL ORDER BY created_at DESC",
                rowMapper, websiteId);
    }

    public Optional<GoalDefinition> findById(String websiteId, String id) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ? AND website_id = ? AND deleted_at IS NULL",
                        rowMapper, id, websiteId)
                .stream()
                .findFirst();
    }

    public void insert(GoalDefinition goal) {
        jdbcTemplate.update(INSERT_SQL,
                goal.getId(),
                goal.getWebsiteId(),
                goal.getName(),
                goal.getType().name(),
                goal.getTarget(),
                goal.getDescription(),
                jsonColumns.write(goal.getFilters()),
                goal.isIgnoreHistoricData(),
                goal.isActive(),
                Timestamp.from(goal.getCreatedAt()),
                Timestamp.from(goal.getUpdatedAt()));
        log.debug("Inserted goal id={} website_id={}", goal.getId(), goal.getWebsiteId());
    }

    public int update(GoalDefinition goal) {
        return jdbcTemplate.update(UPDATE_SQL,
                goal.getName(),
                goal.getType().name(),
                goal.getTarget(),
                goal.getDescription(),
                jsonColumns.write(goal.getFilters()),
                goal.isIgnoreHistoricData(),
                goal.isActive(),
                Timestamp.from(goal.getUpdatedAt()),
                goal.getId(),
                goal.getWebsiteId());
    }

    public int softDelete(String websiteId, String id, Instant deletedAt) {
        Timestamp now = Timestamp.from(deletedAt);
        return jdbcTemplate.update(SOFT_DELETE_SQL, now, now, id, websiteId);
    }

    private GoalDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
        return GoalDefinition.builder()
                .id(rs.getString("id"))
                .websiteId(rs.getString("website_id"))
                .name(rs.getString("name"))
                .type(StepKind.valueOf(rs.getString("type")))
                .target(rs.getString("target"))
                .description(rs.getString("description"))
                .filters(jsonColumns.read(rs.getString("filters"), FILTER_LIST))
                .ignoreHistoricData(rs.getBoolean("ignore_historic_data"))
                .active(rs.getBoolean("is_active"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .updatedAt(rs.getTimestamp("updated_at").toInstant())
                .build();
    }
}

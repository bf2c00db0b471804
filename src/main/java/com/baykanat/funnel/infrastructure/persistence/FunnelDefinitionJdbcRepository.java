package com.baykanat.funnel.infrastructure.persistence;

import com.baykanat.funnel.domain.model.Filter;
import com.baykanat.funnel.domain.model.FunnelDefinition;
import com.baykanat.funnel.domain.model.StepDefinition;
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

/** funnel_definitions tablosu; steps ve filters JSONB olarak saklanır. Silme soft delete'tir. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FunnelDefinitionJdbcRepository {

    private static final TypeReference<List<StepDefinition>> STEP_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<Filter>> FILTER_LIST = new TypeReference<>() {
    };

    private static final String SELECT_COLUMNS = """
            SELECT id, website_id, name, description, steps, filters, ignore_historic_data,
                   is_active, created_at, updated_at
            FROM funnel_definitions
            """;

    private static final String INSERT_SQL = """
            INSERT INTO funnel_definitions (id, website_id, name, description, steps, filters,
                                            ignore_historic_data, is_active, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?)
            """;

    private static final String UPDATE_SQL = """
            UPDATE funnel_definitions
            SET name = ?, description = ?, steps = ?::jsonb, filters = ?::jsonb,
                ignore_historic_data = ?, is_active = ?, updated_at = ?
            WHERE id = ? AND website_id = ? AND deleted_at IS NULL
            """;

    private static final String SOFT_DELETE_SQL = """
            UPDATE funnel_definitions
            SET deleted_at = ?, is_active = FALSE, updated_at = ?
            WHERE id = ? AND website_id = ? AND deleted_at IS NULL
            """;

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    private final RowMapper<FunnelDefinition> rowMapper = this::mapRow;

    /** Sitenin silinmemiş funnel'ları, en yenisi önce. */
    public List<FunnelDefinition> findByWebsite(String websiteId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE website_id = ? AND deleted_at IS NULL ORDER BY created_at DESC",
                rowMapper, websiteId);
    }

    public Optional<FunnelDefinition> findById(String websiteId, String id) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ? AND website_id = ? AND deleted_at IS NULL",
                        rowMapper, id, websiteId)
                .stream()
                .findFirst();
    }

    public void insert(FunnelDefinition definition) {
        jdbcTemplate.update(INSERT_SQL,
                definition.getId(),
                definition.getWebsiteId(),
                definition.getName(),
                definition.getDescription(),
                jsonColumns.write(definition.getSteps()),
                jsonColumns.write(definition.getFilters()),
                definition.isIgnoreHistoricData(),
                definition.isActive(),
                Timestamp.from(definition.getCreatedAt()),
                Timestamp.from(definition.getUpdatedAt()));
        log.debug("Inserted funnel id={} website_id={}", definition.getId(), definition.getWebsiteId());
    }

    /** Güncellenen satır sayısı; 0 ise kayıt yok veya silinmiş. */
    public int update(FunnelDefinition definition) {
        return jdbcTemplate.update(UPDATE_SQL,
                definition.getName(),
                definition.getDescription(),
                jsonColumns.write(definition.getSteps()),
                jsonColumns.write(definition.getFilters()),
                definition.isIgnoreHistoricData(),
                definition.isActive(),
                Timestamp.from(definition.getUpdatedAt()),
                definition.getId(),
                definition.getWebsiteId());
    }

    public int softDelete(String websiteId, String id, Instant deletedAt) {
        Timestamp now = Timestamp.from(deletedAt);
        return jdbcTemplate.update(SOFT_DELETE_SQL, now, now, id, websiteId);
    }

    private FunnelDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
        return FunnelDefinition.builder()
                .id(rs.getString("id"))
                .websiteId(rs.getString("website_id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .steps(jsonColumns.read(rs.getString("steps"), STEP_LIST))
                .filters(jsonColumns.read(rs.getString("filters"), FILTER_LIST))
                .ignoreHistoricData(rs.getBoolean("ignore_historic_data"))
                .active(rs.getBoolean("is_active"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .updatedAt(rs.getTimestamp("updated_at").toInstant())
                .build();
    }
}

package com.teknorix.jobcatalog.catalog.persistence;

import com.teknorix.jobcatalog.catalog.model.DepartmentView;
import com.teknorix.jobcatalog.catalog.model.EntityKind;
import com.teknorix.jobcatalog.catalog.model.JobDetailView;
import com.teknorix.jobcatalog.catalog.model.JobDraft;
import com.teknorix.jobcatalog.catalog.model.JobListQuery;
import com.teknorix.jobcatalog.catalog.model.JobSummary;
import com.teknorix.jobcatalog.catalog.model.LocationDraft;
import com.teknorix.jobcatalog.catalog.model.LocationView;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Repository
public class CatalogJdbcRepository {
    private static final char LIKE_ESCAPE = '\\';

    private final NamedParameterJdbcTemplate jdbc;

    public CatalogJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (EntityKind kind : EntityKind.values()) {
            counts.put(kind.tableName(), countTable(kind.tableName()));
        }
        return counts;
    }

    public long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    public boolean exists(EntityKind kind, long id) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM " + kind.tableName() + " WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            Long.class
        );
        return count != null && count > 0;
    }

    /**
     * True when a department other than {@code excludeId} already carries {@code title}.
     * Comparison is exact and case-sensitive.
     */
    public boolean departmentTitleTaken(String title, Long excludeId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("title", title)
            .addValue("excludeId", excludeId, Types.BIGINT);
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM departments
                WHERE title = :title
                  AND (:excludeId IS NULL OR id <> :excludeId)
                """,
            params,
            Long.class
        );
        return count != null && count > 0;
    }

    public long insertLocation(LocationDraft draft) {
        MapSqlParameterSource params = locationParams(draft);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO locations (title, city, state, country, zip)
                VALUES (:title, :city, :state, :country, :zip)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        return requireKey(keyHolder, "location");
    }

    public int updateLocation(long locationId, LocationDraft draft) {
        MapSqlParameterSource params = locationParams(draft)
            .addValue("locationId", locationId);
        return jdbc.update(
            """
                UPDATE locations
                SET title = :title,
                    city = :city,
                    state = :state,
                    country = :country,
                    zip = :zip
                WHERE id = :locationId
                """,
            params
        );
    }

    public LocationView findLocationById(long locationId) {
        List<LocationView> rows = jdbc.query(
            """
                SELECT id, title, city, state, country, zip
                FROM locations
                WHERE id = :locationId
                """,
            new MapSqlParameterSource().addValue("locationId", locationId),
            locationRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<LocationView> findAllLocations() {
        return jdbc.query(
            """
                SELECT id, title, city, state, country, zip
                FROM locations
                ORDER BY id
                """,
            new MapSqlParameterSource(),
            locationRowMapper()
        );
    }

    public long insertDepartment(String title) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO departments (title)
                VALUES (:title)
                """,
            new MapSqlParameterSource().addValue("title", title),
            keyHolder,
            new String[]{"id"}
        );
        return requireKey(keyHolder, "department");
    }

    public int updateDepartment(long departmentId, String title) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("departmentId", departmentId)
            .addValue("title", title);
        return jdbc.update(
            """
                UPDATE departments
                SET title = :title
                WHERE id = :departmentId
                """,
            params
        );
    }

    public DepartmentView findDepartmentById(long departmentId) {
        List<DepartmentView> rows = jdbc.query(
            """
                SELECT id, title
                FROM departments
                WHERE id = :departmentId
                """,
            new MapSqlParameterSource().addValue("departmentId", departmentId),
            departmentRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<DepartmentView> findAllDepartments() {
        return jdbc.query(
            """
                SELECT id, title
                FROM departments
                ORDER BY id
                """,
            new MapSqlParameterSource(),
            departmentRowMapper()
        );
    }

    public long insertJob(JobDraft draft, String code, Instant postedDate) {
        MapSqlParameterSource params = jobParams(draft)
            .addValue("code", code)
            .addValue("postedDate", toTimestamp(postedDate));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO jobs (
                    code,
                    title,
                    description,
                    location_id,
                    department_id,
                    posted_date,
                    closing_date
                )
                VALUES (
                    :code,
                    :title,
                    :description,
                    :locationId,
                    :departmentId,
                    :postedDate,
                    :closingDate
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        return requireKey(keyHolder, "job");
    }

    /**
     * Replaces the caller-editable fields. {@code code} and {@code posted_date} are never touched.
     */
    public int updateJob(long jobId, JobDraft draft) {
        MapSqlParameterSource params = jobParams(draft)
            .addValue("jobId", jobId);
        return jdbc.update(
            """
                UPDATE jobs
                SET title = :title,
                    description = :description,
                    location_id = :locationId,
                    department_id = :departmentId,
                    closing_date = :closingDate
                WHERE id = :jobId
                """,
            params
        );
    }

    public JobDetailView findJobById(long jobId) {
        List<JobDetailView> rows = jdbc.query(
            """
                SELECT j.id,
                       j.code,
                       j.title,
                       j.description,
                       j.location_id,
                       j.department_id,
                       j.posted_date,
                       j.closing_date,
                       l.id AS l_id,
                       l.title AS l_title,
                       l.city AS l_city,
                       l.state AS l_state,
                       l.country AS l_country,
                       l.zip AS l_zip,
                       d.id AS d_id,
                       d.title AS d_title
                FROM jobs j
                LEFT JOIN locations l ON l.id = j.location_id
                LEFT JOIN departments d ON d.id = j.department_id
                WHERE j.id = :jobId
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            (rs, rowNum) -> {
                long locationRowId = rs.getLong("l_id");
                LocationView location = rs.wasNull() ? null : new LocationView(
                    locationRowId,
                    rs.getString("l_title"),
                    rs.getString("l_city"),
                    rs.getString("l_state"),
                    rs.getString("l_country"),
                    rs.getString("l_zip")
                );
                long departmentRowId = rs.getLong("d_id");
                DepartmentView department = rs.wasNull()
                    ? null
                    : new DepartmentView(departmentRowId, rs.getString("d_title"));
                return new JobDetailView(
                    rs.getLong("id"),
                    rs.getString("code"),
                    rs.getString("title"),
                    rs.getString("description"),
                    rs.getLong("location_id"),
                    rs.getLong("department_id"),
                    location,
                    department,
                    toInstant(rs.getTimestamp("posted_date")),
                    toInstant(rs.getTimestamp("closing_date"))
                );
            }
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public long countJobs(JobListQuery query) {
        MapSqlParameterSource params = jobFilterParams(query);
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM jobs j
                """ + jobFilterClause("j", query.query()),
            params,
            Long.class
        );
        return count == null ? 0L : count;
    }

    public List<JobSummary> findJobsPage(JobListQuery query) {
        MapSqlParameterSource params = jobFilterParams(query)
            .addValue("limit", query.pageSize())
            .addValue("offset", query.offset());

        return jdbc.query(
            """
                SELECT j.id,
                       j.code,
                       j.title,
                       l.title AS location_title,
                       d.title AS department_title,
                       j.posted_date,
                       j.closing_date
                FROM jobs j
                LEFT JOIN locations l ON l.id = j.location_id
                LEFT JOIN departments d ON d.id = j.department_id
                """ + jobFilterClause("j", query.query()) + """
                ORDER BY j.posted_date DESC, j.id DESC
                LIMIT :limit
                OFFSET :offset
                """,
            params,
            (rs, rowNum) -> new JobSummary(
                rs.getLong("id"),
                rs.getString("code"),
                rs.getString("title"),
                rs.getString("location_title"),
                rs.getString("department_title"),
                toInstant(rs.getTimestamp("posted_date")),
                toInstant(rs.getTimestamp("closing_date"))
            )
        );
    }

    private MapSqlParameterSource locationParams(LocationDraft draft) {
        return new MapSqlParameterSource()
            .addValue("title", draft.title())
            .addValue("city", draft.city())
            .addValue("state", draft.state())
            .addValue("country", draft.country())
            .addValue("zip", draft.zip());
    }

    private MapSqlParameterSource jobParams(JobDraft draft) {
        return new MapSqlParameterSource()
            .addValue("title", draft.title())
            .addValue("description", draft.description())
            .addValue("locationId", draft.locationId())
            .addValue("departmentId", draft.departmentId())
            .addValue("closingDate", toTimestamp(draft.closingDate()));
    }

    private MapSqlParameterSource jobFilterParams(JobListQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("locationId", query.locationId(), Types.BIGINT)
            .addValue("departmentId", query.departmentId(), Types.BIGINT);
        params.addValue(
            "qLike",
            query.query() == null ? null : "%" + escapeLike(query.query().toLowerCase(Locale.ROOT)) + "%",
            Types.VARCHAR
        );
        return params;
    }

    private String jobFilterClause(String alias, String query) {
        String clause = """
            WHERE (:locationId IS NULL OR %s.location_id = :locationId)
              AND (:departmentId IS NULL OR %s.department_id = :departmentId)
            """.formatted(alias, alias);
        return clause + searchClause(alias, query) + "\n";
    }

    private String searchClause(String alias, String query) {
        if (query == null) {
            return "";
        }
        return "  AND (" +
            "LOWER(CAST(" + alias + ".title AS VARCHAR)) LIKE :qLike ESCAPE '" + LIKE_ESCAPE + "' OR " +
            "LOWER(CAST(" + alias + ".description AS VARCHAR)) LIKE :qLike ESCAPE '" + LIKE_ESCAPE + "'" +
            ")";
    }

    static String escapeLike(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                out.append(LIKE_ESCAPE);
            }
            out.append(c);
        }
        return out.toString();
    }

    private RowMapper<LocationView> locationRowMapper() {
        return (rs, rowNum) -> new LocationView(
            rs.getLong("id"),
            rs.getString("title"),
            rs.getString("city"),
            rs.getString("state"),
            rs.getString("country"),
            rs.getString("zip")
        );
    }

    private RowMapper<DepartmentView> departmentRowMapper() {
        return (rs, rowNum) -> new DepartmentView(
            rs.getLong("id"),
            rs.getString("title")
        );
    }

    private long requireKey(KeyHolder keyHolder, String entity) {
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert " + entity);
        }
        return key.longValue();
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}

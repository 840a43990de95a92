package com.poisearch.repository.impl;

import com.poisearch.config.PoiSearchProperties;
import com.poisearch.exception.MalformedRecordException;
import com.poisearch.model.Category;
import com.poisearch.model.PointOfInterest;
import com.poisearch.model.Position;
import com.poisearch.repository.KeysetCursor;
import com.poisearch.repository.PoiRemoval;
import com.poisearch.repository.PoiStore;
import com.poisearch.repository.ScanPosition;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * JDBC implementation of {@link PoiStore}.
 * Points live in table {@code poi}; removals leave a row in {@code poi_removal}.
 */
@Repository
public class JdbcPoiStore implements PoiStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcPoiStore.class);

    private static final String INSERT_POI =
            "INSERT INTO poi (name, latitude, longitude, category, last_modified) " +
            "VALUES (:name, :latitude, :longitude, :category, :lastModified)";

    private static final String SELECT_POI_BY_ID =
            "SELECT id, name, latitude, longitude, category, last_modified FROM poi WHERE id = :id";

    private static final String DELETE_POI = "DELETE FROM poi WHERE id = :id";

    private static final String INSERT_REMOVAL =
            "INSERT INTO poi_removal (poi_id, removed_at) VALUES (:poiId, :removedAt)";

    // Keyset page over the poi_by_lst index
    private static final String SCAN_POIS =
            "SELECT id, name, latitude, longitude, category, last_modified FROM poi " +
            "WHERE last_modified > :lastModified OR (last_modified = :lastModified AND id > :id) " +
            "ORDER BY last_modified, id LIMIT :limit";

    private static final String SCAN_REMOVALS =
            "SELECT seq, poi_id, removed_at FROM poi_removal " +
            "WHERE removed_at > :removedAt OR (removed_at = :removedAt AND seq > :seq) " +
            "ORDER BY removed_at, seq LIMIT :limit";

    private static final String LATEST_REMOVAL =
            "SELECT seq, poi_id, removed_at FROM poi_removal ORDER BY removed_at DESC, seq DESC LIMIT 1";

    private static final RowMapper<PoiRemoval> REMOVAL_MAPPER = (rs, rowNum) ->
            new PoiRemoval(rs.getLong("seq"), rs.getLong("poi_id"), rs.getLong("removed_at"));

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;
    private final String name;

    public JdbcPoiStore(DataSource dataSource, PoiSearchProperties properties, Clock clock) {
        JdbcTemplate template = new JdbcTemplate(dataSource);
        template.setQueryTimeout(properties.getStore().getQueryTimeoutSeconds());
        this.jdbc = new NamedParameterJdbcTemplate(template);
        this.clock = clock;
        this.name = properties.getStore().getName();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    @Transactional
    public PointOfInterest create(String poiName, Position position, Category category) {
        long lastModified = clock.millis();
        String storedName = poiName != null ? poiName : "";

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("name", storedName)
                .addValue("latitude", position.getLatitude())
                .addValue("longitude", position.getLongitude())
                .addValue("category", category.getCode())
                .addValue("lastModified", lastModified);

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(INSERT_POI, params, keyHolder, new String[]{"ID"});
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Store did not return an identifier for the new point of interest");
        }

        logger.debug("Created point of interest {} in store '{}'", key, name);
        return PointOfInterest.builder()
                .id(key.longValue())
                .lastModified(lastModified)
                .name(storedName)
                .position(position.copy())
                .category(category)
                .build();
    }

    @Override
    public Optional<PointOfInterest> get(long id) {
        List<PointOfInterest> found = jdbc.query(SELECT_POI_BY_ID,
                new MapSqlParameterSource("id", id), JdbcPoiStore::mapPoi);
        return found.stream().findFirst();
    }

    @Override
    @Transactional
    public boolean markForRemoval(long id) {
        int deleted = jdbc.update(DELETE_POI, new MapSqlParameterSource("id", id));
        if (deleted == 0) {
            return false;
        }
        jdbc.update(INSERT_REMOVAL, new MapSqlParameterSource()
                .addValue("poiId", id)
                .addValue("removedAt", clock.millis()));
        logger.debug("Marked point of interest {} for removal in store '{}'", id, name);
        return true;
    }

    @Override
    public Stream<PointOfInterest> scanSince(ScanPosition from, int batchSize) {
        return KeysetCursor.stream(from, batchSize, this::fetchPoiPage, ScanPosition::of);
    }

    @Override
    public ScanPosition latestRemovalPosition() {
        List<PoiRemoval> latest = jdbc.query(LATEST_REMOVAL, REMOVAL_MAPPER);
        return latest.isEmpty() ? ScanPosition.ORIGIN : latest.get(0).position();
    }

    @Override
    public Stream<PoiRemoval> scanRemovalsSince(ScanPosition from, int batchSize) {
        return KeysetCursor.stream(from, batchSize, this::fetchRemovalPage, PoiRemoval::position);
    }

    private List<PointOfInterest> fetchPoiPage(ScanPosition after, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("lastModified", after.getLastModified())
                .addValue("id", after.getId())
                .addValue("limit", limit);
        List<PointOfInterest> page = jdbc.query(SCAN_POIS, params, JdbcPoiStore::mapPoi);
        logger.trace("Fetched {} points after {} from store '{}'", page.size(), after, name);
        return page;
    }

    private List<PoiRemoval> fetchRemovalPage(ScanPosition after, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("removedAt", after.getLastModified())
                .addValue("seq", after.getId())
                .addValue("limit", limit);
        return jdbc.query(SCAN_REMOVALS, params, REMOVAL_MAPPER);
    }

    /**
     * Decode a row, rejecting category codes this version does not know
     */
    static PointOfInterest mapPoi(ResultSet rs, int rowNum) throws SQLException {
        long id = rs.getLong("id");
        int code = rs.getInt("category");
        if (rs.wasNull() || !Category.isKnownCode(code)) {
            throw new MalformedRecordException(id, "unknown category code " + code);
        }
        double latitude = rs.getDouble("latitude");
        boolean latitudeMissing = rs.wasNull();
        double longitude = rs.getDouble("longitude");
        if (latitudeMissing || rs.wasNull()) {
            throw new MalformedRecordException(id, "position is missing");
        }
        Position position = Position.of(latitude, longitude);
        if (!position.isWithinRange()) {
            throw new MalformedRecordException(id, "position out of range " + position);
        }
        return PointOfInterest.builder()
                .id(id)
                .lastModified(rs.getLong("last_modified"))
                .name(rs.getString("name"))
                .position(position)
                .category(Category.fromCode(code))
                .build();
    }
}

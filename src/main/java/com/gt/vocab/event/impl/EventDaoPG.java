package com.gt.vocab.event.impl;

import com.gt.vocab.event.EventDao;
import com.gt.vocab.model.Event;
import com.gt.vocab.util.JsonColumnMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class EventDaoPG implements EventDao {

    private static final String APPEND_EVENT_SQL =
            "INSERT INTO event (id, type, payload, created_at) " +
            "VALUES (:id, :type, CAST(:payload AS JSONB), :createdAt)";

    private static final String LOAD_ALL_EVENTS_SQL =
            "SELECT id, type, payload, created_at FROM event ORDER BY created_at ASC";

    private final NamedParameterJdbcTemplate template;
    private final JsonColumnMapper jsonColumnMapper;

    public EventDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, JsonColumnMapper jsonColumnMapper) {
        this.template = namedParameterJdbcTemplate;
        this.jsonColumnMapper = jsonColumnMapper;
    }

    @Override
    public void appendEvent(Event event) {
        template.update(APPEND_EVENT_SQL, getEventParams(event));
    }

    @Override
    public int appendEvents(List<Event> events) {
        if (events.isEmpty()) {
            return 0;
        }

        SqlParameterSource paramsArray[] = events.stream().map(this::getEventParams).toArray(SqlParameterSource[]::new);
        return Arrays.stream(template.batchUpdate(APPEND_EVENT_SQL, paramsArray))
                .map(updateCnt -> updateCnt < 0 ? 1 : updateCnt)
                .sum();
    }

    @Override
    public List<Event> loadAllEvents() {
        return template.query(LOAD_ALL_EVENTS_SQL, Map.of(), this::mapEventRow);
    }

    private MapSqlParameterSource getEventParams(Event event) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", event.id());
        params.addValue("type", event.type());
        params.addValue("payload", jsonColumnMapper.write(event.payload()));
        params.addValue("createdAt", Timestamp.from(event.createdAt()));
        return params;
    }

    private Event mapEventRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new Event(
                rs.getString("id"),
                rs.getString("type"),
                jsonColumnMapper.readTree(rs.getString("payload")),
                createdAt == null ? null : createdAt.toInstant());
    }
}

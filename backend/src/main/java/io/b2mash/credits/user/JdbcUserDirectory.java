package io.b2mash.credits.user;

import java.sql.Timestamp;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * {@link UserDirectory} over a relational user table. Ids are compared and ordered as text so UUID,
 * numeric and string keys all page the same way.
 */
@Repository
public class JdbcUserDirectory implements UserDirectory {

  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  private final NamedParameterJdbcTemplate jdbc;
  private final UserDirectoryProperties properties;
  private final String idExpression;

  public JdbcUserDirectory(NamedParameterJdbcTemplate jdbc, UserDirectoryProperties properties) {
    this.jdbc = jdbc;
    this.properties = properties;
    requireIdentifier("table", properties.table());
    requireIdentifier("id-column", properties.idColumn());
    requireIdentifier("registered-at-column", properties.registeredAtColumn());
    requireIdentifier("last-activity-column", properties.lastActivityColumn());
    this.idExpression = "CAST(" + properties.idColumn() + " AS TEXT)";
  }

  @Override
  public List<String> findUserIds(CohortQuery query) {
    var params = new MapSqlParameterSource();
    var sql = new StringBuilder("SELECT ").append(idExpression).append(" AS user_id FROM ");
    sql.append(properties.table()).append(" WHERE 1 = 1");
    appendFilters(sql, params, query);
    if (query.afterUserId() != null) {
      sql.append(" AND ").append(idExpression).append(" > :afterUserId");
      params.addValue("afterUserId", query.afterUserId());
    }
    sql.append(" ORDER BY ").append(idExpression).append(" LIMIT :limit");
    params.addValue("limit", query.limit());
    return jdbc.queryForList(sql.toString(), params, String.class);
  }

  @Override
  public long countUsers(CohortQuery query) {
    var params = new MapSqlParameterSource();
    var sql = new StringBuilder("SELECT COUNT(*) FROM ").append(properties.table());
    sql.append(" WHERE 1 = 1");
    appendFilters(sql, params, query);
    Long count = jdbc.queryForObject(sql.toString(), params, Long.class);
    return count == null ? 0 : count;
  }

  @Override
  public boolean hasSegment(String segment) {
    return properties.segments().containsKey(segment);
  }

  private void appendFilters(StringBuilder sql, MapSqlParameterSource params, CohortQuery query) {
    if (query.registeredFrom() != null) {
      sql.append(" AND ").append(properties.registeredAtColumn()).append(" >= :registeredFrom");
      params.addValue("registeredFrom", Timestamp.from(query.registeredFrom()));
    }
    if (query.registeredUntil() != null) {
      sql.append(" AND ").append(properties.registeredAtColumn()).append(" <= :registeredUntil");
      params.addValue("registeredUntil", Timestamp.from(query.registeredUntil()));
    }
    if (query.activeSince() != null) {
      sql.append(" AND ").append(properties.lastActivityColumn()).append(" >= :activeSince");
      params.addValue("activeSince", Timestamp.from(query.activeSince()));
    }
    if (query.segment() != null) {
      var expression = properties.segments().get(query.segment());
      if (expression == null) {
        throw new IllegalArgumentException("Unknown user segment: " + query.segment());
      }
      sql.append(" AND (").append(expression).append(")");
    }
  }

  private static void requireIdentifier(String property, String value) {
    if (value == null || !IDENTIFIER.matcher(value).matches()) {
      throw new IllegalStateException(
          "credits.users." + property + " must be a plain SQL identifier, got '" + value + "'");
    }
  }
}

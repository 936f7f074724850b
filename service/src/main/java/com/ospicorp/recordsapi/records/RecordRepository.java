package com.ospicorp.recordsapi.records;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * JDBC access to the {@code records} table. Each call is a single statement under auto-commit;
 * connections are borrowed from the pool by {@link JdbcTemplate} and returned on every path.
 */
@Repository
public class RecordRepository {

  private static final Logger log = LoggerFactory.getLogger(RecordRepository.class);

  private final JdbcTemplate jdbc;
  private final ObjectMapper mapper;

  public RecordRepository(JdbcTemplate jdbc, ObjectMapper mapper) {
    this.jdbc = jdbc;
    this.mapper = mapper;
  }

  /**
   * Inserts {@code record} and returns it with the generated id and creation time.
   *
   * @throws StorageException if the payload cannot be encoded or the insert fails
   */
  public DataRecord create(DataRecord record) {
    String sql = """
      INSERT INTO records (date, data)
      VALUES (?, CAST(? AS jsonb))
      RETURNING id, created_at
    """;
    String json = encode(record.data());
    try {
      DataRecord saved = jdbc.queryForObject(sql,
          (rs, i) -> new DataRecord(rs.getLong("id"), record.date(), record.data(),
                                    rs.getTimestamp("created_at").toInstant()),
          Date.valueOf(record.date()), json);
      log.debug("Inserted record {} for {}", saved.id(), saved.date());
      return saved;
    } catch (DataAccessException ex) {
      throw new StorageException(rootMessage(ex), ex);
    }
  }

  /**
   * Returns every record stored for {@code date}, in no particular order. The value is handed
   * to the database as-is and cast there.
   *
   * @throws StorageException if the query fails or a stored payload cannot be decoded
   */
  public List<DataRecord> findByDate(String date) {
    String sql = """
      SELECT id, date, data, created_at
      FROM records
      WHERE date = CAST(? AS date)
    """;
    try {
      List<DataRecord> records = jdbc.query(sql, this::mapRow, date);
      log.debug("Found {} records for {}", records.size(), date);
      return records;
    } catch (DataAccessException ex) {
      throw new StorageException(rootMessage(ex), ex);
    }
  }

  private DataRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    long id = rs.getLong("id");
    return new DataRecord(id,
        rs.getDate("date").toLocalDate(),
        decode(id, rs.getString("data")),
        rs.getTimestamp("created_at").toInstant());
  }

  private String encode(ObjectNode data) {
    try {
      return mapper.writeValueAsString(data);
    } catch (JsonProcessingException ex) {
      throw new StorageException("cannot encode record data: " + ex.getOriginalMessage(), ex);
    }
  }

  private ObjectNode decode(long id, String json) {
    try {
      JsonNode node = mapper.readTree(json);
      if (node instanceof ObjectNode object) {
        return object;
      }
      throw new StorageException("record " + id + " holds non-object data", null);
    } catch (JsonProcessingException ex) {
      throw new StorageException(
          "cannot decode data of record " + id + ": " + ex.getOriginalMessage(), ex);
    }
  }

  private static String rootMessage(DataAccessException ex) {
    String message = ex.getMostSpecificCause().getMessage();
    return message != null ? message : ex.getMessage();
  }
}

package com.acme.mailroute.persistence.jdbc.mapper;

import com.acme.mailroute.core.Jsons;
import com.acme.mailroute.dispatch.ActionResult;
import com.acme.mailroute.domain.ClassificationResult;
import com.acme.mailroute.domain.Message;
import com.acme.mailroute.domain.MessageRecord;
import com.acme.mailroute.domain.ProcessingStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Maps a {@code mail_message} row to a {@link MessageRecord}. */
public final class MessageRecordMapper {

  private static final TypeReference<List<ActionResult>> ACTION_LOG = new TypeReference<>() {};

  private MessageRecordMapper() {}

  public static MessageRecord map(ResultSet rs) throws SQLException {
    Message message =
        new Message(
            rs.getString("external_id"),
            rs.getString("subject"),
            rs.getString("body"),
            rs.getString("sender"),
            rs.getString("recipient"),
            toInstant(rs.getTimestamp("received_at")),
            Jsons.toStringMap(rs.getString("headers")));

    return new MessageRecord(
        rs.getObject("id", UUID.class),
        message,
        ProcessingStatus.valueOf(rs.getString("status")),
        classification(rs),
        actionLog(rs.getString("action_log")),
        rs.getString("error"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  /** Null until the pipeline has stored a result. */
  private static ClassificationResult classification(ResultSet rs) throws SQLException {
    String category = rs.getString("category");
    if (category == null) {
      return null;
    }
    return new ClassificationResult(
        category,
        rs.getDouble("confidence"),
        Jsons.toDoubleMap(rs.getString("probabilities")),
        rs.getString("department"),
        rs.getString("explanation"),
        rs.getString("stage"),
        rs.getString("sentiment"),
        rs.getString("priority"),
        Jsons.toListMap(rs.getString("keywords")));
  }

  private static List<ActionResult> actionLog(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    return Jsons.fromJson(json, ACTION_LOG);
  }

  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }
}

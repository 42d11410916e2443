/*
 * どこで: Push データアクセス
 * 何を: devices テーブルの登録/プロバイダ別取得/無効化を担う
 * なぜ: 単一テーブル上にプロバイダ別のビューを提供するため
 */
package com.example.push.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.push.model.DeviceProviderRef;
import com.example.push.model.DeviceRecord;
import com.example.push.model.DeviceRegistration;
import com.example.push.model.PushProvider;
import com.google.common.collect.Lists;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeviceRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT id, name, active, owner_id, created_at, device_id, registration_id, device_type
      FROM devices
      """;

  static final int IN_CLAUSE_CHUNK_SIZE = 1000;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public DeviceRecord insert(DeviceRegistration registration, String ownerModel, Instant createdAt) {
    final String sql =
        """
        INSERT INTO devices (
          name,
          active,
          owner_model,
          owner_id,
          created_at,
          device_id,
          registration_id,
          device_type
        ) VALUES (
          :name,
          :active,
          :ownerModel,
          :ownerId,
          :createdAt,
          :deviceId,
          :registrationId,
          :deviceType
        )
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", registration.name())
            .addValue("active", registration.active())
            .addValue("ownerModel", registration.ownerId() == null ? null : ownerModel)
            .addValue("ownerId", registration.ownerId())
            .addValue("createdAt", toTimestamp(createdAt))
            .addValue("deviceId", registration.deviceId())
            .addValue("registrationId", registration.registrationId())
            .addValue("deviceType", registration.provider().code());
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("device insert returned no id");
    }
    return new DeviceRecord(
        id,
        registration.name(),
        registration.active(),
        registration.ownerId(),
        createdAt,
        registration.deviceId(),
        registration.registrationId(),
        registration.provider().code());
  }

  public Optional<DeviceRecord> findById(long id) {
    final String sql = SELECT_COLUMNS + "WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<DeviceRecord> findByIds(Collection<Long> ids) {
    final String sql = SELECT_COLUMNS + "WHERE id IN (:ids)";
    final List<DeviceRecord> devices = new ArrayList<>();
    for (List<Long> chunk : chunks(ids)) {
      final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ids", chunk);
      devices.addAll(jdbcTemplate.query(sql, params, this::mapRow));
    }
    devices.sort(Comparator.comparingLong(DeviceRecord::id));
    return devices;
  }

  /** 混在コレクションの振り分け用に (id, device_type) だけを 1 クエリで取得する。 */
  public List<DeviceProviderRef> findProviderRefs(Collection<Long> ids) {
    final String sql =
        """
        SELECT id, device_type
        FROM devices
        WHERE id IN (:ids)
        """;
    final List<DeviceProviderRef> refs = new ArrayList<>();
    for (List<Long> chunk : chunks(ids)) {
      final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ids", chunk);
      refs.addAll(
          jdbcTemplate.query(
              sql,
              params,
              (rs, rowNum) -> new DeviceProviderRef(rs.getLong("id"), rs.getInt("device_type"))));
    }
    return refs;
  }

  public List<DeviceRecord> findByProvider(PushProvider provider) {
    final String sql = SELECT_COLUMNS + "WHERE device_type = :deviceType ORDER BY id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("deviceType", provider.code());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<DeviceRecord> findByProviderAndIds(PushProvider provider, Collection<Long> ids) {
    final String sql = SELECT_COLUMNS + "WHERE device_type = :deviceType AND id IN (:ids)";
    final List<DeviceRecord> devices = new ArrayList<>();
    for (List<Long> chunk : chunks(ids)) {
      final MapSqlParameterSource params =
          new MapSqlParameterSource()
              .addValue("deviceType", provider.code())
              .addValue("ids", chunk);
      devices.addAll(jdbcTemplate.query(sql, params, this::mapRow));
    }
    devices.sort(Comparator.comparingLong(DeviceRecord::id));
    return devices;
  }

  public List<DeviceRecord> findByOwner(String ownerModel, String ownerId) {
    final String sql =
        SELECT_COLUMNS + "WHERE owner_model = :ownerModel AND owner_id = :ownerId ORDER BY id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerModel", ownerModel)
            .addValue("ownerId", ownerId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deactivateByRegistrationIds(PushProvider provider, Collection<String> registrationIds) {
    final String sql =
        """
        UPDATE devices
        SET active = FALSE
        WHERE device_type = :deviceType
          AND active = TRUE
          AND registration_id IN (:registrationIds)
        """;
    int updated = 0;
    for (List<String> chunk : chunks(registrationIds)) {
      final MapSqlParameterSource params =
          new MapSqlParameterSource()
              .addValue("deviceType", provider.code())
              .addValue("registrationIds", chunk);
      updated += jdbcTemplate.update(sql, params);
    }
    return updated;
  }

  // IN 句は要素ごとにバインド変数が増えるため、PgJDBC の上限(32767)未満に分割する
  private static <T> List<List<T>> chunks(Collection<T> values) {
    return Lists.partition(new ArrayList<>(values), IN_CLAUSE_CHUNK_SIZE);
  }

  private DeviceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeviceRecord(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getBoolean("active"),
        rs.getString("owner_id"),
        getInstant(rs, "created_at"),
        rs.getString("device_id"),
        rs.getString("registration_id"),
        rs.getInt("device_type"));
  }
}

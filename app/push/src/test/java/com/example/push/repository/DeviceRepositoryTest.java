/*
 * どこで: devices リポジトリの DB テスト
 * 何を: プロバイダ別ビュー、所有者検索、失効トークンの無効化を検証する
 */
package com.example.push.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.push.AbstractPostgresContainerTest;
import com.example.push.model.DeviceProviderRef;
import com.example.push.model.DeviceRecord;
import com.example.push.model.DeviceRegistration;
import com.example.push.model.PushProvider;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DeviceRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-01-17T00:00:00Z");
  private static final String OWNER_MODEL = "account.user";

  @Autowired private DeviceRepository deviceRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notification_devices", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM devices", new MapSqlParameterSource());
  }

  @Test
  void insertAndFindRoundTripsAllColumns() {
    final DeviceRecord inserted =
        deviceRepository.insert(
            DeviceRegistration.apns("tok-1", "Phone", "u_1").withDeviceId("dev-1"),
            OWNER_MODEL,
            CREATED_AT);

    final DeviceRecord found = deviceRepository.findById(inserted.id()).orElseThrow();

    assertThat(found).isEqualTo(inserted);
    assertThat(found.provider()).isEqualTo(PushProvider.APNS);
    assertThat(found.createdAt()).isEqualTo(CREATED_AT);
  }

  @Test
  void ownerModelIsStoredOnlyWithOwner() {
    final DeviceRecord anonymous =
        deviceRepository.insert(DeviceRegistration.gcm("reg-1", null, null), OWNER_MODEL, CREATED_AT);

    final String ownerModel =
        jdbcTemplate.queryForObject(
            "SELECT owner_model FROM devices WHERE id = :id",
            new MapSqlParameterSource().addValue("id", anonymous.id()),
            String.class);

    assertThat(ownerModel).isNull();
  }

  @Test
  void duplicateExternalDeviceIdIsRejected() {
    deviceRepository.insert(
        DeviceRegistration.apns("tok-1", null, null).withDeviceId("dev-1"), OWNER_MODEL, CREATED_AT);

    assertThatThrownBy(
            () ->
                deviceRepository.insert(
                    DeviceRegistration.gcm("reg-1", null, null).withDeviceId("dev-1"),
                    OWNER_MODEL,
                    CREATED_AT))
        .isInstanceOf(DuplicateKeyException.class);
  }

  @Test
  void providerViewsReturnOnlyMatchingDeviceType() {
    final DeviceRecord apns = insert(DeviceRegistration.apns("tok-1", null, "u_1"));
    final DeviceRecord gcm = insert(DeviceRegistration.gcm("reg-1", null, "u_1"));
    final DeviceRecord inactiveApns = insert(DeviceRegistration.apns("tok-2", null, "u_1").inactive());

    assertThat(deviceRepository.findByProvider(PushProvider.APNS))
        .extracting(DeviceRecord::id)
        .containsExactly(apns.id(), inactiveApns.id());
    assertThat(
            deviceRepository.findByProviderAndIds(
                PushProvider.GCM, List.of(apns.id(), gcm.id(), inactiveApns.id())))
        .extracting(DeviceRecord::id)
        .containsExactly(gcm.id());
    assertThat(deviceRepository.findProviderRefs(Set.of(apns.id(), gcm.id())))
        .containsExactlyInAnyOrder(
            new DeviceProviderRef(apns.id(), PushProvider.APNS.code()),
            new DeviceProviderRef(gcm.id(), PushProvider.GCM.code()));
  }

  @Test
  void emptyIdCollectionsShortCircuit() {
    assertThat(deviceRepository.findByIds(List.of())).isEmpty();
    assertThat(deviceRepository.findProviderRefs(List.of())).isEmpty();
    assertThat(deviceRepository.findByProviderAndIds(PushProvider.APNS, List.of())).isEmpty();
    assertThat(deviceRepository.deactivateByRegistrationIds(PushProvider.APNS, List.of())).isZero();
  }

  @Test
  void idListsLargerThanOneChunkAreQueriedAcrossChunks() {
    final DeviceRecord apns = insert(DeviceRegistration.apns("tok-1", null, "u_1"));
    final DeviceRecord gcm = insert(DeviceRegistration.gcm("reg-1", null, "u_1"));
    // 実在 ID を先頭と末尾のチャンクに分けて置く
    final List<Long> ids = new ArrayList<>();
    ids.add(gcm.id());
    LongStream.rangeClosed(1, 2500).map(n -> -n).forEach(ids::add);
    ids.add(apns.id());
    assertThat(ids).hasSizeGreaterThan(2 * DeviceRepository.IN_CLAUSE_CHUNK_SIZE);

    assertThat(deviceRepository.findByIds(ids))
        .extracting(DeviceRecord::id)
        .containsExactly(apns.id(), gcm.id());
    assertThat(deviceRepository.findProviderRefs(ids))
        .extracting(DeviceProviderRef::deviceId)
        .containsExactlyInAnyOrder(apns.id(), gcm.id());
    assertThat(deviceRepository.findByProviderAndIds(PushProvider.GCM, ids))
        .extracting(DeviceRecord::id)
        .containsExactly(gcm.id());

    final List<String> tokens =
        IntStream.rangeClosed(1, 2500).mapToObj(n -> "stale-" + n).collect(Collectors.toList());
    tokens.add("tok-1");
    assertThat(deviceRepository.deactivateByRegistrationIds(PushProvider.APNS, tokens))
        .isEqualTo(1);
    assertThat(deviceRepository.findById(apns.id()).orElseThrow().active()).isFalse();
  }

  @Test
  void findByOwnerFiltersByOwnerModelAndId() {
    final DeviceRecord mine = insert(DeviceRegistration.apns("tok-1", null, "u_1"));
    insert(DeviceRegistration.gcm("reg-1", null, "u_2"));

    assertThat(deviceRepository.findByOwner(OWNER_MODEL, "u_1"))
        .extracting(DeviceRecord::id)
        .containsExactly(mine.id());
    assertThat(deviceRepository.findByOwner("other.model", "u_1")).isEmpty();
  }

  @Test
  void deactivateTouchesOnlyActiveDevicesOfProvider() {
    final DeviceRecord apns = insert(DeviceRegistration.apns("shared", null, null));
    final DeviceRecord gcm = insert(DeviceRegistration.gcm("shared", null, null));

    final int updated =
        deviceRepository.deactivateByRegistrationIds(PushProvider.APNS, Set.of("shared", "other"));

    assertThat(updated).isEqualTo(1);
    assertThat(deviceRepository.findById(apns.id()).orElseThrow().active()).isFalse();
    assertThat(deviceRepository.findById(gcm.id()).orElseThrow().active()).isTrue();
    assertThat(deviceRepository.deactivateByRegistrationIds(PushProvider.APNS, Set.of("shared")))
        .isZero();
  }

  private DeviceRecord insert(DeviceRegistration registration) {
    return deviceRepository.insert(registration, OWNER_MODEL, CREATED_AT);
  }
}

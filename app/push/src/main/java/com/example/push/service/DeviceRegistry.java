/*
 * どこで: Push サービス層
 * 何を: 端末の登録とプロバイダ別ビューの取得を担う登録簿
 * なぜ: 型付き端末コレクションの入手経路をここに限定するため
 */
package com.example.push.service;

import com.example.push.config.DeviceRegistryProperties;
import com.example.push.model.DeviceProviderRef;
import com.example.push.model.DeviceRecord;
import com.example.push.model.DeviceRegistration;
import com.example.push.model.ProviderDevices;
import com.example.push.model.PushProvider;
import com.example.push.repository.DeviceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeviceRegistry {

  private static final Logger logger = LoggerFactory.getLogger(DeviceRegistry.class);

  private final DeviceRepository deviceRepository;
  private final DeviceRegistryProperties properties;
  private final Clock clock;

  public DeviceRecord register(DeviceRegistration registration) {
    final DeviceRecord device;
    try {
      device = deviceRepository.insert(registration, properties.ownerModel(), Instant.now(clock));
    } catch (DuplicateKeyException ex) {
      // devices.device_id の一意制約違反
      throw new DuplicateDeviceException(registration.deviceId(), ex);
    }
    logger.info(
        "device registered id={} provider={} ownerId={}",
        device.id(),
        registration.provider(),
        registration.ownerId());
    return device;
  }

  public Optional<DeviceRecord> findById(long id) {
    return deviceRepository.findById(id);
  }

  /** 要求された ID が 1 件でも欠けていれば {@link DeviceNotFoundException}。 */
  public List<DeviceRecord> findAllById(Collection<Long> ids) {
    final Set<Long> requested = new LinkedHashSet<>(ids);
    final List<DeviceRecord> found = deviceRepository.findByIds(requested);
    if (found.size() < requested.size()) {
      found.forEach(device -> requested.remove(device.id()));
      throw new DeviceNotFoundException(requested);
    }
    return found;
  }

  public List<DeviceRecord> findByOwner(String ownerId) {
    return deviceRepository.findByOwner(properties.ownerModel(), ownerId);
  }

  public ProviderDevices byProvider(PushProvider provider) {
    return new ProviderDevices(provider, deviceRepository.findByProvider(provider));
  }

  public ProviderDevices byProvider(PushProvider provider, Collection<Long> ids) {
    return new ProviderDevices(provider, deviceRepository.findByProviderAndIds(provider, ids));
  }

  /**
   * 端末 ID をプロバイダごとに振り分ける。バケット内は入力順を保つ。
   *
   * <p>未知の device_type を含む場合は振り分け前に {@link
   * com.example.push.model.UnknownProviderException} を送出する。
   */
  public Map<PushProvider, List<Long>> groupByProvider(Collection<Long> ids) {
    final Set<Long> requested = new LinkedHashSet<>(ids);
    final Map<Long, PushProvider> providers = new LinkedHashMap<>();
    for (DeviceProviderRef ref : deviceRepository.findProviderRefs(requested)) {
      providers.put(ref.deviceId(), ref.provider());
    }
    final Map<PushProvider, List<Long>> buckets = new LinkedHashMap<>();
    for (Long id : requested) {
      final PushProvider provider = providers.get(id);
      if (provider == null) {
        throw new DeviceNotFoundException(List.of(id));
      }
      buckets.computeIfAbsent(provider, ignored -> new ArrayList<>()).add(id);
    }
    return buckets;
  }

  public int deactivate(PushProvider provider, Collection<String> registrationIds) {
    final int updated = deviceRepository.deactivateByRegistrationIds(provider, registrationIds);
    logger.info(
        "devices deactivated provider={} requested={} updated={}",
        provider,
        registrationIds.size(),
        updated);
    return updated;
  }
}

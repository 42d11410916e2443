/*
 * どこで: Push プロバイダクライアント層
 * 何を: APNs フィードバックサービスから失効トークンを読み出す
 * なぜ: 配信不能になった端末を保守ジョブで無効化できるようにするため
 */
package com.example.push.client;

import com.example.push.config.ApnsClientProperties;
import com.example.push.model.PushProvider;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.BaseEncoding;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ApnsFeedbackReader {

  private static final Logger logger = LoggerFactory.getLogger(ApnsFeedbackReader.class);
  // 4 バイトの失効時刻 + 2 バイトのトークン長
  private static final int TUPLE_HEADER_LENGTH = 6;

  private final ApnsClientProperties properties;

  public Set<String> fetch(String credentialFile) {
    final String path = hasText(credentialFile) ? credentialFile : properties.credentialFile();
    if (!hasText(path)) {
      throw new ProviderTransportException(
          PushProvider.APNS,
          ProviderTransportException.Reason.FEEDBACK_UNAVAILABLE,
          "apns credential file is not configured");
    }
    try (Socket socket = sslContext(path).getSocketFactory().createSocket()) {
      socket.connect(
          new InetSocketAddress(properties.feedbackHost(), properties.feedbackPort()),
          (int) properties.connectTimeout().toMillis());
      socket.setSoTimeout((int) properties.readTimeout().toMillis());
      ((SSLSocket) socket).startHandshake();
      final Set<String> tokens = parse(socket.getInputStream());
      logger.info(
          "apns feedback fetched host={} inactiveTokens={}",
          properties.feedbackHost(),
          tokens.size());
      return tokens;
    } catch (IOException | GeneralSecurityException ex) {
      logger.warn("apns feedback fetch failed host={}", properties.feedbackHost(), ex);
      throw new ProviderTransportException(
          PushProvider.APNS,
          ProviderTransportException.Reason.FEEDBACK_UNAVAILABLE,
          "apns feedback fetch failed",
          ex);
    }
  }

  @VisibleForTesting
  Set<String> parse(InputStream in) throws IOException {
    final ByteBuffer buffer = ByteBuffer.wrap(in.readAllBytes());
    final Set<String> tokens = new LinkedHashSet<>();
    while (buffer.hasRemaining()) {
      if (buffer.remaining() < TUPLE_HEADER_LENGTH) {
        throw truncated();
      }
      buffer.getInt();
      final int length = Short.toUnsignedInt(buffer.getShort());
      if (buffer.remaining() < length) {
        throw truncated();
      }
      final byte[] token = new byte[length];
      buffer.get(token);
      tokens.add(BaseEncoding.base16().lowerCase().encode(token));
    }
    return Collections.unmodifiableSet(tokens);
  }

  private SSLContext sslContext(String credentialFile) throws IOException, GeneralSecurityException {
    final char[] password =
        properties.credentialPassword() == null
            ? new char[0]
            : properties.credentialPassword().toCharArray();
    final KeyStore keyStore = KeyStore.getInstance("PKCS12");
    try (InputStream in = Files.newInputStream(Path.of(credentialFile))) {
      keyStore.load(in, password);
    }
    final KeyManagerFactory keyManagerFactory =
        KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
    keyManagerFactory.init(keyStore, password);
    final SSLContext context = SSLContext.getInstance("TLS");
    context.init(keyManagerFactory.getKeyManagers(), null, null);
    return context;
  }

  private ProviderTransportException truncated() {
    return new ProviderTransportException(
        PushProvider.APNS,
        ProviderTransportException.Reason.INVALID_RESPONSE,
        "apns feedback tuple truncated");
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}

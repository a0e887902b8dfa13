/*
 * どこで: Quota サービス層
 * 何を: テナントの送信プロバイダ API キーを AES-256-CBC で暗号化/復号する
 * なぜ: 平文の認証情報を DB に残さないため
 */
package com.notifyhub.quota.service;

import com.notifyhub.quota.api.QuotaConfigurationException;
import com.notifyhub.quota.config.CredentialVaultProperties;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.HexFormat;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * 認証情報の暗号化境界。
 *
 * <p>トークン形式は {@code "<ivHex>:<cipherHex>"}。IV は 16 バイトで毎回生成するため、同じ平文でも
 * 暗号文は一致しない。鍵はプロセス起動時に一度だけ読み込み、ローテーションはしない。
 */
@Component
public class CredentialVault {

  private static final String ALGORITHM = "AES/CBC/PKCS5Padding";
  private static final int KEY_LENGTH_BYTES = 32;
  private static final int IV_LENGTH_BYTES = 16;
  private static final char DELIMITER = ':';
  private static final HexFormat HEX = HexFormat.of();

  private final SecretKeySpec encryptionKey;
  private final SecureRandom secureRandom = new SecureRandom();

  public CredentialVault(CredentialVaultProperties properties) {
    this.encryptionKey = new SecretKeySpec(parseKey(properties.encryptionKey()), "AES");
  }

  public String encrypt(String plaintext) {
    if (plaintext == null) {
      throw new IllegalArgumentException("plaintext is required");
    }
    final byte[] iv = new byte[IV_LENGTH_BYTES];
    secureRandom.nextBytes(iv);
    try {
      final Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new IvParameterSpec(iv));
      final byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      return HEX.formatHex(iv) + DELIMITER + HEX.formatHex(ciphertext);
    } catch (GeneralSecurityException ex) {
      throw new CredentialVaultException("credential encryption failed", ex);
    }
  }

  public String decrypt(String token) {
    if (token == null) {
      throw new CredentialVaultException("credential token is missing");
    }
    // IV 側に ':' は現れないため、最初の区切りで分割する。
    final int delimiterIndex = token.indexOf(DELIMITER);
    if (delimiterIndex < 0) {
      throw new CredentialVaultException("credential token is malformed");
    }
    final byte[] iv = decodeHex(token.substring(0, delimiterIndex));
    final byte[] ciphertext = decodeHex(token.substring(delimiterIndex + 1));
    if (iv.length != IV_LENGTH_BYTES) {
      throw new CredentialVaultException("credential token has an invalid IV length");
    }
    try {
      final Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, encryptionKey, new IvParameterSpec(iv));
      return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
    } catch (GeneralSecurityException ex) {
      throw new CredentialVaultException("credential decryption failed", ex);
    }
  }

  private static byte[] parseKey(String encodedKey) {
    if (encodedKey == null || encodedKey.isBlank()) {
      throw new QuotaConfigurationException(
          "quota.credential-vault.encryption-key is not set."
              + " Cannot start without a key for credential storage.");
    }
    final byte[] keyBytes;
    try {
      keyBytes = HEX.parseHex(encodedKey.trim());
    } catch (IllegalArgumentException ex) {
      throw new QuotaConfigurationException(
          "quota.credential-vault.encryption-key must be a hex string", ex);
    }
    if (keyBytes.length != KEY_LENGTH_BYTES) {
      throw new QuotaConfigurationException(
          "quota.credential-vault.encryption-key must be a 64-character hex string (32 bytes). Got "
              + keyBytes.length
              + " bytes.");
    }
    return keyBytes;
  }

  private static byte[] decodeHex(String value) {
    try {
      return HEX.parseHex(value);
    } catch (IllegalArgumentException ex) {
      throw new CredentialVaultException("credential token is not hex encoded", ex);
    }
  }
}

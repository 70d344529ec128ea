package tech.yump.sealmail.entity.blocklist;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.sealmail.crypto.CryptoErrorKind;
import tech.yump.sealmail.crypto.SealMailCryptoException;
import tech.yump.sealmail.keys.KeyStore;
import tech.yump.sealmail.keys.KeyStoreException;
import tech.yump.sealmail.sealing.SealedValue;
import tech.yump.sealmail.sealing.SealingException;
import tech.yump.sealmail.sealing.SealingService;

/**
 * Unseals blocklist entries one by one. An entry that cannot be unsealed is returned with an empty
 * address and a failed status instead of failing the whole list.
 */
@Slf4j
@RequiredArgsConstructor
public class BlocklistUnsealer {

  private final KeyStore keyStore;
  private final SealingService sealingService;

  public List<UnsealedBlockedAddress> unseal(List<SealedBlockedAddress> blockedAddresses) {
    List<UnsealedBlockedAddress> result = new ArrayList<>(blockedAddresses.size());
    for (SealedBlockedAddress blockedAddress : blockedAddresses) {
      result.add(unseal(blockedAddress));
    }
    return result;
  }

  public UnsealedBlockedAddress unseal(SealedBlockedAddress blockedAddress) {
    SealedValue sealedValue = blockedAddress.sealedValue();
    try {
      if (!keyStore.symmetricKeyExists(sealedValue.keyId())) {
        log.warn("Symmetric key '{}' for blocked address '{}' not found.",
                sealedValue.keyId(), blockedAddress.hashedBlockedValue());
        return failed(blockedAddress, new SealingException(CryptoErrorKind.KEY_NOT_FOUND,
                "Symmetric key not found: " + sealedValue.keyId()));
      }
      byte[] sealedData = Base64.getDecoder().decode(sealedValue.base64EncodedSealedData());
      String address = new String(sealingService.unseal(sealedValue.keyId(), sealedData), StandardCharsets.UTF_8);
      return new UnsealedBlockedAddress(blockedAddress.hashedBlockedValue(), address,
              BlockedAddressStatus.completed(), blockedAddress.action(), blockedAddress.emailAddressId());
    } catch (SealMailCryptoException | KeyStoreException | IllegalArgumentException e) {
      log.warn("Failed to unseal blocked address '{}': {}", blockedAddress.hashedBlockedValue(), e.getMessage());
      return failed(blockedAddress, e);
    }
  }

  private static UnsealedBlockedAddress failed(SealedBlockedAddress blockedAddress, Exception cause) {
    return new UnsealedBlockedAddress(blockedAddress.hashedBlockedValue(), "",
            BlockedAddressStatus.failed(cause), blockedAddress.action(), blockedAddress.emailAddressId());
  }
}

package tech.yump.sealmail.entity.folder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.sealmail.entity.EntityUnsealer;
import tech.yump.sealmail.sealing.Unsealer;

/**
 * Unseals the custom name of an e-mail folder.
 */
@Slf4j
@RequiredArgsConstructor
public class EmailFolderUnsealer implements EntityUnsealer<SealedEmailFolder, UnsealedEmailFolder> {

  private final Unsealer unsealer;

  @Override
  public UnsealedEmailFolder unseal(SealedEmailFolder sealed) {
    String customFolderName = null;
    if (sealed.sealedCustomFolderName() != null) {
      log.trace("Unsealing custom name of folder '{}'.", sealed.id());
      customFolderName = unsealer.unseal(sealed.sealedCustomFolderName());
    }
    return UnsealedEmailFolder.builder()
            .id(sealed.id())
            .owner(sealed.owner())
            .owners(sealed.owners())
            .emailAddressId(sealed.emailAddressId())
            .folderName(sealed.folderName())
            .size(sealed.size())
            .unseenCount(sealed.unseenCount())
            .version(sealed.version())
            .createdAt(sealed.createdAt())
            .updatedAt(sealed.updatedAt())
            .customFolderName(customFolderName)
            .build();
  }
}

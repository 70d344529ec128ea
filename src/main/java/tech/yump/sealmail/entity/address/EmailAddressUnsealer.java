package tech.yump.sealmail.entity.address;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.sealmail.entity.EntityUnsealer;
import tech.yump.sealmail.entity.folder.EmailFolderUnsealer;
import tech.yump.sealmail.entity.folder.SealedEmailFolder;
import tech.yump.sealmail.entity.folder.UnsealedEmailFolder;
import tech.yump.sealmail.sealing.Unsealer;

/**
 * Unseals the alias of an e-mail address and each of its folders, keeping folder order.
 */
@Slf4j
@RequiredArgsConstructor
public class EmailAddressUnsealer implements EntityUnsealer<SealedEmailAddress, UnsealedEmailAddress> {

  private final Unsealer unsealer;
  private final EmailFolderUnsealer folderUnsealer;

  public EmailAddressUnsealer(Unsealer unsealer) {
    this(unsealer, new EmailFolderUnsealer(unsealer));
  }

  @Override
  public UnsealedEmailAddress unseal(SealedEmailAddress sealed) {
    String alias = null;
    if (sealed.sealedAlias() != null) {
      log.trace("Unsealing alias of email address '{}'.", sealed.id());
      alias = unsealer.unseal(sealed.sealedAlias());
    }
    List<UnsealedEmailFolder> folders = new ArrayList<>(sealed.folders().size());
    for (SealedEmailFolder folder : sealed.folders()) {
      folders.add(folderUnsealer.unseal(folder));
    }
    return UnsealedEmailAddress.builder()
            .id(sealed.id())
            .owner(sealed.owner())
            .owners(sealed.owners())
            .emailAddress(sealed.emailAddress())
            .size(sealed.size())
            .numberOfEmailMessages(sealed.numberOfEmailMessages())
            .version(sealed.version())
            .createdAt(sealed.createdAt())
            .updatedAt(sealed.updatedAt())
            .lastReceivedAt(sealed.lastReceivedAt())
            .alias(alias)
            .folders(folders)
            .build();
  }
}

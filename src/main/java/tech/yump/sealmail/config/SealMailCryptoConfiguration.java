package tech.yump.sealmail.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import tech.yump.sealmail.entity.address.EmailAddressUnsealer;
import tech.yump.sealmail.entity.blocklist.BlocklistUnsealer;
import tech.yump.sealmail.entity.folder.EmailFolderUnsealer;
import tech.yump.sealmail.entity.message.EmailMessageUnsealer;
import tech.yump.sealmail.keys.InMemoryKeyStore;
import tech.yump.sealmail.keys.KeyStore;
import tech.yump.sealmail.sealing.DefaultSealingService;
import tech.yump.sealmail.sealing.SealingService;
import tech.yump.sealmail.sealing.Unsealer;
import tech.yump.sealmail.secure.DefaultMultiRecipientCryptoService;
import tech.yump.sealmail.secure.MultiRecipientCryptoService;
import tech.yump.sealmail.secure.codec.SecureDataCodec;

/**
 * Wires the sealing and secure e-mail services. A host application replaces the in-memory key
 * store by declaring its own {@link KeyStore} bean.
 */
@AutoConfiguration
@EnableConfigurationProperties(SealMailProperties.class)
@Slf4j
public class SealMailCryptoConfiguration {

    @Bean
    @ConditionalOnMissingBean(KeyStore.class)
    public KeyStore sealMailKeyStore(SealMailProperties properties) {
        SealMailProperties.KeyStoreProperties keyStore = properties.keyStore();
        switch (keyStore.type()) {
            case IN_MEMORY:
                log.info("Configuring in-memory key store (RSA {} bits, AES {} bits).",
                        keyStore.rsaKeySize(), keyStore.symmetricKeySize());
                if (!keyStore.supportsSealedEnvelope()) {
                    log.warn("RSA key size {} exceeds {} bits. Generated key pairs can only be used for "
                                    + "multi-recipient secure e-mail, not for sealed envelope values.",
                            keyStore.rsaKeySize(), SealMailProperties.KeyStoreProperties.ENVELOPE_RSA_KEY_SIZE);
                }
                return new InMemoryKeyStore(keyStore.rsaKeySize(), keyStore.symmetricKeySize());
            case EXTERNAL:
                log.error("sealmail.key-store.type is EXTERNAL but no KeyStore bean was declared.");
                throw new IllegalStateException(
                        "sealmail.key-store.type=external requires the application to declare a KeyStore bean.");
            default:
                throw new IllegalStateException("Unhandled key store type: " + keyStore.type());
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public SecureDataCodec secureDataCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new SecureDataCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public Unsealer unsealer(KeyStore keyStore) {
        return new Unsealer(keyStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public SealingService sealingService(KeyStore keyStore) {
        return new DefaultSealingService(keyStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public MultiRecipientCryptoService multiRecipientCryptoService(KeyStore keyStore, SecureDataCodec codec) {
        return new DefaultMultiRecipientCryptoService(keyStore, codec);
    }

    @Bean
    @ConditionalOnMissingBean
    public EmailFolderUnsealer emailFolderUnsealer(Unsealer unsealer) {
        return new EmailFolderUnsealer(unsealer);
    }

    @Bean
    @ConditionalOnMissingBean
    public EmailAddressUnsealer emailAddressUnsealer(Unsealer unsealer, EmailFolderUnsealer folderUnsealer) {
        return new EmailAddressUnsealer(unsealer, folderUnsealer);
    }

    @Bean
    @ConditionalOnMissingBean
    public BlocklistUnsealer blocklistUnsealer(KeyStore keyStore, SealingService sealingService) {
        return new BlocklistUnsealer(keyStore, sealingService);
    }

    @Bean
    @ConditionalOnMissingBean
    public EmailMessageUnsealer emailMessageUnsealer(Unsealer unsealer, ObjectProvider<ObjectMapper> objectMapper) {
        return new EmailMessageUnsealer(unsealer, objectMapper.getIfAvailable(ObjectMapper::new));
    }
}

package com.williamcallahan.docarchive.service.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.Provider;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openpgp.PGPCompressedData;
import org.bouncycastle.openpgp.PGPEncryptedData;
import org.bouncycastle.openpgp.PGPEncryptedDataList;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPLiteralData;
import org.bouncycastle.openpgp.PGPPBEEncryptedData;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.jcajce.JcaPGPObjectFactory;
import org.bouncycastle.openpgp.operator.PBEDataDecryptorFactory;
import org.bouncycastle.openpgp.operator.jcajce.JcaPGPDigestCalculatorProviderBuilder;
import org.bouncycastle.openpgp.operator.jcajce.JcePBEDataDecryptorFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decrypts files written by {@code gpg --symmetric}: passphrase-protected OpenPGP messages,
 * optionally compressed and ASCII-armored.
 */
@Component
public class GpgFileDecryptor {
    private static final Logger log = LoggerFactory.getLogger(GpgFileDecryptor.class);

    private static final Provider PROVIDER = new BouncyCastleProvider();

    /**
     * Writes the plaintext of {@code encrypted} to {@code target}, creating parent directories.
     * Nothing is left at {@code target} when decryption fails.
     *
     * @param encrypted OpenPGP message
     * @param target destination of the plaintext; replaced if present
     * @param passphrase symmetric passphrase
     * @throws IOException when either file cannot be read or written
     * @throws GpgDecryptionException when the message is malformed, the passphrase is wrong or
     *     the integrity check fails
     */
    public void decrypt(Path encrypted, Path target, char[] passphrase) throws IOException {
        Files.createDirectories(target.getParent());
        boolean succeeded = false;
        try (InputStream encryptedStream = PGPUtil.getDecoderStream(Files.newInputStream(encrypted))) {
            PGPPBEEncryptedData encryptedData = findPassphraseEncryptedData(encryptedStream, encrypted);
            PBEDataDecryptorFactory decryptorFactory = new JcePBEDataDecryptorFactoryBuilder(
                    new JcaPGPDigestCalculatorProviderBuilder().setProvider(PROVIDER).build())
                    .setProvider(PROVIDER)
                    .build(passphrase);

            try (InputStream clearStream = encryptedData.getDataStream(decryptorFactory)) {
                PGPLiteralData literalData = readLiteralData(clearStream, encrypted);
                try (InputStream plaintext = literalData.getInputStream();
                     OutputStream output = Files.newOutputStream(target)) {
                    plaintext.transferTo(output);
                }
            }
            if (encryptedData.isIntegrityProtected() && !encryptedData.verify()) {
                throw new GpgDecryptionException("Integrity check failed for " + encrypted.getFileName());
            }
            succeeded = true;
        } catch (PGPException pgpFailure) {
            throw new GpgDecryptionException("Could not decrypt " + encrypted.getFileName()
                    + ": " + pgpFailure.getMessage(), pgpFailure);
        } finally {
            if (!succeeded) {
                Files.deleteIfExists(target);
            }
        }
        log.debug("Decrypted {} to {}", encrypted.getFileName(), target.getFileName());
    }

    private static PGPPBEEncryptedData findPassphraseEncryptedData(InputStream encryptedStream, Path encrypted)
            throws IOException {
        JcaPGPObjectFactory objectFactory = new JcaPGPObjectFactory(encryptedStream);
        Object packet = objectFactory.nextObject();
        // gpg may emit a marker packet ahead of the encrypted data
        while (packet != null && !(packet instanceof PGPEncryptedDataList)) {
            packet = objectFactory.nextObject();
        }
        if (packet == null) {
            throw new GpgDecryptionException(encrypted.getFileName() + " contains no encrypted data");
        }
        for (PGPEncryptedData candidate : (PGPEncryptedDataList) packet) {
            if (candidate instanceof PGPPBEEncryptedData passphraseData) {
                return passphraseData;
            }
        }
        throw new GpgDecryptionException(encrypted.getFileName() + " is not passphrase encrypted");
    }

    private static PGPLiteralData readLiteralData(InputStream clearStream, Path encrypted)
            throws IOException, PGPException {
        JcaPGPObjectFactory objectFactory = new JcaPGPObjectFactory(clearStream);
        Object message = objectFactory.nextObject();
        if (message instanceof PGPCompressedData compressedData) {
            objectFactory = new JcaPGPObjectFactory(compressedData.getDataStream());
            message = objectFactory.nextObject();
        }
        if (message instanceof PGPLiteralData literalData) {
            return literalData;
        }
        throw new GpgDecryptionException("Unexpected OpenPGP content in " + encrypted.getFileName());
    }
}

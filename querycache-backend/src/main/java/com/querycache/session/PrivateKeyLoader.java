package com.querycache.session;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.InputDecryptorProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.pkcs.PKCSException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;

/**
 * Loads PEM-encoded private keys for key-pair authentication.
 *
 * Accepts unencrypted PKCS#8, encrypted PKCS#8 and PKCS#1 (optionally encrypted) keys. The key is
 * re-encoded as unencrypted PKCS#8 DER before it is handed to the driver.
 */
public final class PrivateKeyLoader {

    private static final BouncyCastleProvider PROVIDER = new BouncyCastleProvider();

    private PrivateKeyLoader() {
    }

    /**
     * Read a PEM file and return the key as PKCS#8 DER bytes.
     *
     * @param path PEM file
     * @param passphrase passphrase for encrypted keys, may be null
     * @return PKCS#8 DER encoding
     * @throws IOException when the file cannot be read
     */
    public static byte[] loadDer(Path path, String passphrase) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             PEMParser parser = new PEMParser(reader)) {
            Object pemObject = parser.readObject();
            if (pemObject == null) {
                throw new PrivateKeyException("No PEM object found in " + path);
            }
            return toPrivateKeyInfo(pemObject, passphrase).getEncoded();
        }
    }

    /**
     * Read a PEM file into a {@link PrivateKey}.
     *
     * @param path PEM file
     * @param passphrase passphrase for encrypted keys, may be null
     * @return RSA private key
     * @throws IOException when the file cannot be read
     */
    public static PrivateKey load(Path path, String passphrase) throws IOException {
        return fromDer(loadDer(path, passphrase));
    }

    /**
     * Decode PKCS#8 DER bytes into an RSA private key.
     *
     * @param der PKCS#8 DER encoding
     * @return RSA private key
     */
    public static PrivateKey fromDer(byte[] der) {
        try {
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new PrivateKeyException("Unsupported private key: " + e.getMessage(), e);
        }
    }

    private static PrivateKeyInfo toPrivateKeyInfo(Object pemObject, String passphrase) throws IOException {
        try {
            if (pemObject instanceof PKCS8EncryptedPrivateKeyInfo encrypted) {
                InputDecryptorProvider decryptor = new JceOpenSSLPKCS8DecryptorProviderBuilder()
                        .setProvider(PROVIDER)
                        .build(requirePassphrase(passphrase));
                return encrypted.decryptPrivateKeyInfo(decryptor);
            }
            if (pemObject instanceof PEMEncryptedKeyPair encryptedPair) {
                PEMKeyPair pair = encryptedPair.decryptKeyPair(
                        new JcePEMDecryptorProviderBuilder().setProvider(PROVIDER).build(requirePassphrase(passphrase)));
                return pair.getPrivateKeyInfo();
            }
            if (pemObject instanceof PEMKeyPair pair) {
                return pair.getPrivateKeyInfo();
            }
            if (pemObject instanceof PrivateKeyInfo info) {
                return info;
            }
        } catch (OperatorCreationException | PKCSException e) {
            throw new PrivateKeyException("Could not decrypt private key: " + e.getMessage(), e);
        }
        throw new PrivateKeyException("Unsupported PEM object: " + pemObject.getClass().getSimpleName());
    }

    private static char[] requirePassphrase(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new PrivateKeyException("Private key is encrypted but no passphrase was configured");
        }
        return passphrase.toCharArray();
    }
}

package com.tradebot.session.client;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.tradebot.common.exception.InvalidCredentialsException;
import com.tradebot.session.session.CredentialVault;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Builds the per-request bearer token the exchange expects: an HS256 JWT signed with
 * the secret key, carrying {@code access_key}, a fresh {@code nonce} and, when the
 * request has parameters, the SHA-512 {@code query_hash} of its query string.
 */
public final class UpbitTokenSigner {

    private final CredentialVault credentials;

    public UpbitTokenSigner(CredentialVault credentials) {
        this.credentials = credentials;
    }

    /**
     * @param queryString url-encoded request parameters, or {@code null} when there are none
     * @throws InvalidCredentialsException when the vault is empty or the secret is unusable
     */
    public String authorization(String queryString) {
        String accessKey = credentials.accessKey();
        byte[] secret    = credentials.secretKeyBytes();
        if (accessKey == null || secret == null) {
            throw new InvalidCredentialsException("sign", "no exchange credentials in session");
        }
        try {
            JWTClaimsSet.Builder claims = new JWTClaimsSet.Builder()
                .claim("access_key", accessKey)
                .claim("nonce", UUID.randomUUID().toString());
            if (queryString != null && !queryString.isEmpty()) {
                claims.claim("query_hash", sha512Hex(queryString))
                      .claim("query_hash_alg", "SHA512");
            }
            SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims.build());
            jwt.sign(new MACSigner(secret));
            return "Bearer " + jwt.serialize();
        } catch (JOSEException e) {
            throw new InvalidCredentialsException("sign", "secret key cannot sign HS256 tokens", e);
        } finally {
            Arrays.fill(secret, (byte) 0);
        }
    }

    static String sha512Hex(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-512");
            return HexFormat.of().formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }
}

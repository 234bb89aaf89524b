/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.core;

import java.nio.file.Path;

/**
 * TLS material for the broker connection, either PEM files or a JKS/PKCS12 key store pair.
 * Unused paths are {@code null}.
 */
public record TlsSettings(Format format,
                          String protocol,
                          Path caCertPath,
                          Path clientCertPath,
                          Path clientKeyPath,
                          Path keystorePath,
                          String keystorePassword,
                          Path truststorePath,
                          String truststorePassword) {

    public static final String DEFAULT_PROTOCOL = "TLSv1.3";

    public enum Format { PEM, JKS, PKCS12 }

    public static TlsSettings pem(Path caCertPath, Path clientCertPath, Path clientKeyPath) {
        return new TlsSettings(Format.PEM, DEFAULT_PROTOCOL, caCertPath, clientCertPath, clientKeyPath,
                null, null, null, null);
    }

    public static TlsSettings keystore(Format format, Path keystorePath, String keystorePassword,
                                       Path truststorePath, String truststorePassword) {
        return new TlsSettings(format, DEFAULT_PROTOCOL, null, null, null,
                keystorePath, keystorePassword, truststorePath, truststorePassword);
    }

    public TlsSettings withProtocol(String protocol) {
        return new TlsSettings(format, protocol, caCertPath, clientCertPath, clientKeyPath,
                keystorePath, keystorePassword, truststorePath, truststorePassword);
    }

    @Override
    public String toString() {
        return "TlsSettings{format=" + format + ", protocol=" + protocol + "}";
    }
}

/*
 * Copyright (c) 2024-2026 VMware, Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package urlfetch.tcp;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.SupportedCipherSuiteFilter;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;
import urlfetch.UrlFetch;
import urlfetch.UrlFetchPipeline;

import static urlfetch.UrlFetch.format;

/**
 * TLS configuration of a client connection.
 * <p>
 * Two providers built from the same material are equal, which lets connection pools share
 * channels between requests that configure TLS identically.
 */
public final class SslProvider {

	/**
	 * Default SSL handshake timeout (milliseconds), fallback to 10 seconds.
	 */
	public static final long DEFAULT_SSL_HANDSHAKE_TIMEOUT =
			Long.parseLong(System.getProperty(UrlFetch.SSL_HANDSHAKE_TIMEOUT, "10000"));

	/**
	 * Creates a builder for {@link SslProvider SslProvider}.
	 *
	 * @return a new SslProvider builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Return the default client ssl provider: JDK trust store, hostname verification.
	 *
	 * @return default client ssl provider
	 */
	public static SslProvider defaultClientProvider() {
		return DEFAULT_CLIENT_PROVIDER;
	}

	final Builder    material;
	final SslContext sslContext;

	SslProvider(Builder builder) throws SSLException {
		this.material = builder.copy();
		this.sslContext = builder.createContext();
	}

	/**
	 * Return the underlying {@link SslContext}.
	 *
	 * @return the underlying {@link SslContext}
	 */
	public SslContext getSslContext() {
		return sslContext;
	}

	/**
	 * Return the handshake timeout in milliseconds.
	 *
	 * @return the handshake timeout in milliseconds
	 */
	public long getHandshakeTimeoutMillis() {
		return material.handshakeTimeoutMillis;
	}

	/**
	 * Return false when the peer certificate is not verified.
	 *
	 * @return false when the peer certificate is not verified
	 */
	public boolean isRejectUnauthorized() {
		return material.rejectUnauthorized;
	}

	/**
	 * Create a new {@link SslHandler} for the given peer.
	 *
	 * @param allocator the buffer allocator
	 * @param peerHost the peer host, used for SNI and hostname verification
	 * @param peerPort the peer port
	 * @return a new {@link SslHandler}
	 */
	public SslHandler newHandler(ByteBufAllocator allocator, String peerHost, int peerPort) {
		SslHandler sslHandler = sslContext.newHandler(allocator, peerHost, peerPort);
		sslHandler.setHandshakeTimeoutMillis(material.handshakeTimeoutMillis);
		if (material.rejectUnauthorized) {
			SSLEngine engine = sslHandler.engine();
			SSLParameters sslParameters = engine.getSSLParameters();
			sslParameters.setEndpointIdentificationAlgorithm("HTTPS");
			engine.setSSLParameters(sslParameters);
		}
		return sslHandler;
	}

	/**
	 * Add an {@link SslHandler} for the given peer after the eventual proxy handler.
	 *
	 * @param channel the channel
	 * @param peerHost the peer host
	 * @param peerPort the peer port
	 */
	public void addSslHandler(Channel channel, String peerHost, int peerPort) {
		Objects.requireNonNull(channel, "channel");
		SslHandler sslHandler = newHandler(channel.alloc(), peerHost, peerPort);
		if (log.isDebugEnabled()) {
			log.debug(format(channel, "SSL enabled using engine {} and SNI {}:{}"),
					sslHandler.engine().getClass().getSimpleName(), peerHost, peerPort);
		}
		ChannelPipeline pipeline = channel.pipeline();
		if (pipeline.get(UrlFetchPipeline.SslHandler) != null) {
			pipeline.remove(UrlFetchPipeline.SslHandler);
		}
		if (pipeline.get(UrlFetchPipeline.ProxyHandler) != null) {
			pipeline.addAfter(UrlFetchPipeline.ProxyHandler, UrlFetchPipeline.SslHandler, sslHandler);
		}
		else {
			pipeline.addFirst(UrlFetchPipeline.SslHandler, sslHandler);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		SslProvider that = (SslProvider) o;
		return material.equals(that.material);
	}

	@Override
	public int hashCode() {
		return material.hashCode();
	}

	@Override
	public String toString() {
		return "SslProvider{" +
				"rejectUnauthorized=" + material.rejectUnauthorized +
				", secureProtocol=" + material.secureProtocol +
				", ciphers=" + material.ciphers +
				", handshakeTimeoutMillis=" + material.handshakeTimeoutMillis +
				'}';
	}

	/**
	 * Map a TLS method name as used by OpenSSL ({@code TLSv1_2_method}) to the JDK protocol
	 * name ({@code TLSv1.2}). JDK names are returned unchanged, generic methods
	 * ({@code TLS_method}, {@code SSLv23_method}) map to {@code null} meaning "negotiate".
	 *
	 * @param secureProtocol the method name
	 * @return the JDK protocol name or null
	 */
	@Nullable
	public static String toJdkProtocol(@Nullable String secureProtocol) {
		if (secureProtocol == null || secureProtocol.isEmpty()) {
			return null;
		}
		if (GENERIC_METHODS.contains(secureProtocol)) {
			return null;
		}
		Matcher matcher = TLS_METHOD.matcher(secureProtocol);
		if (matcher.matches()) {
			String minor = matcher.group(1);
			return minor == null ? "TLSv1" : "TLSv1." + minor;
		}
		return secureProtocol;
	}

	static final Pattern TLS_METHOD = Pattern.compile("TLSv1(?:_(\\d))?_(?:client_)?method");

	static final List<String> GENERIC_METHODS =
			Arrays.asList("TLS_method", "TLS_client_method", "SSLv23_method", "SSLv23_client_method");

	static final Logger log = Loggers.getLogger(SslProvider.class);

	static final SslProvider DEFAULT_CLIENT_PROVIDER;

	static {
		try {
			DEFAULT_CLIENT_PROVIDER = new SslProvider(new Builder());
		}
		catch (SSLException e) {
			throw new ExceptionInInitializerError(e);
		}
	}

	/**
	 * Collects the TLS material. Certificates and keys are PEM encoded, {@code pfx} is a
	 * PKCS#12 archive.
	 */
	public static final class Builder {

		List<byte[]> ca = Collections.emptyList();
		byte[]       pfx;
		byte[]       key;
		byte[]       cert;
		String       passphrase;
		List<String> ciphers = Collections.emptyList();
		String       secureProtocol;
		boolean      rejectUnauthorized = true;
		long         handshakeTimeoutMillis = DEFAULT_SSL_HANDSHAKE_TIMEOUT;

		Builder() {
		}

		/**
		 * Trusted certificates replacing the JDK trust store.
		 *
		 * @param ca PEM encoded certificates, one or more per entry
		 * @return {@literal this}
		 */
		public Builder ca(List<byte[]> ca) {
			Objects.requireNonNull(ca, "ca");
			List<byte[]> copy = new ArrayList<>(ca.size());
			for (byte[] pem : ca) {
				copy.add(Objects.requireNonNull(pem, "ca entry").clone());
			}
			this.ca = Collections.unmodifiableList(copy);
			return this;
		}

		/**
		 * Trusted certificates replacing the JDK trust store.
		 *
		 * @param pem PEM encoded certificates
		 * @return {@literal this}
		 */
		public Builder ca(String pem) {
			Objects.requireNonNull(pem, "pem");
			return ca(Collections.singletonList(pem.getBytes(StandardCharsets.US_ASCII)));
		}

		/**
		 * Client private key, certificate chain and CA certificates in PKCS#12 format.
		 *
		 * @param pfx the archive
		 * @return {@literal this}
		 */
		public Builder pfx(@Nullable byte[] pfx) {
			this.pfx = pfx == null ? null : pfx.clone();
			return this;
		}

		/**
		 * Client private key in PEM format (PKCS#8).
		 *
		 * @param key the key
		 * @return {@literal this}
		 */
		public Builder key(@Nullable byte[] key) {
			this.key = key == null ? null : key.clone();
			return this;
		}

		/**
		 * Client certificate chain in PEM format.
		 *
		 * @param cert the certificate chain
		 * @return {@literal this}
		 */
		public Builder cert(@Nullable byte[] cert) {
			this.cert = cert == null ? null : cert.clone();
			return this;
		}

		/**
		 * Passphrase of the private key or of the PKCS#12 archive.
		 *
		 * @param passphrase the passphrase
		 * @return {@literal this}
		 */
		public Builder passphrase(@Nullable String passphrase) {
			this.passphrase = passphrase;
			return this;
		}

		/**
		 * Cipher suites to enable, separated by {@code :} or {@code ,}. Suites the engine
		 * does not support are ignored.
		 *
		 * @param ciphers the cipher suites
		 * @return {@literal this}
		 */
		public Builder ciphers(@Nullable String ciphers) {
			if (ciphers == null || ciphers.trim().isEmpty()) {
				this.ciphers = Collections.emptyList();
				return this;
			}
			List<String> list = new ArrayList<>();
			for (String cipher : ciphers.split("[:,]")) {
				String trimmed = cipher.trim();
				if (!trimmed.isEmpty()) {
					list.add(trimmed);
				}
			}
			this.ciphers = Collections.unmodifiableList(list);
			return this;
		}

		/**
		 * The TLS protocol to use, either a JDK name ({@code TLSv1.2}) or an OpenSSL method
		 * name ({@code TLSv1_2_method}).
		 *
		 * @param secureProtocol the protocol
		 * @return {@literal this}
		 */
		public Builder secureProtocol(@Nullable String secureProtocol) {
			this.secureProtocol = secureProtocol;
			return this;
		}

		/**
		 * If true (the default) the server certificate is verified against the trusted
		 * certificates and the host name.
		 *
		 * @param rejectUnauthorized false to accept any server certificate
		 * @return {@literal this}
		 */
		public Builder rejectUnauthorized(boolean rejectUnauthorized) {
			this.rejectUnauthorized = rejectUnauthorized;
			return this;
		}

		/**
		 * Set the SSL handshake timeout. Default to {@link #DEFAULT_SSL_HANDSHAKE_TIMEOUT}.
		 *
		 * @param handshakeTimeout the timeout
		 * @return {@literal this}
		 */
		public Builder handshakeTimeout(Duration handshakeTimeout) {
			Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
			if (handshakeTimeout.isNegative()) {
				throw new IllegalArgumentException("handshakeTimeout must be positive");
			}
			this.handshakeTimeoutMillis = handshakeTimeout.toMillis();
			return this;
		}

		/**
		 * Builds a new {@link SslProvider}.
		 *
		 * @return a new {@link SslProvider}
		 * @throws SSLException when the TLS material cannot be loaded
		 */
		public SslProvider build() throws SSLException {
			return new SslProvider(this);
		}

		SslContext createContext() throws SSLException {
			SslContextBuilder builder = SslContextBuilder.forClient();
			if (!rejectUnauthorized) {
				builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
			}
			else if (!ca.isEmpty()) {
				try {
					builder.trustManager(new ByteArrayInputStream(concat(ca)));
				}
				catch (IllegalArgumentException e) {
					throw new SSLException("Cannot load the trusted certificates", e);
				}
			}
			if (pfx != null) {
				builder.keyManager(pkcs12KeyManager());
			}
			else if (key != null && cert != null) {
				try {
					builder.keyManager(new ByteArrayInputStream(cert), new ByteArrayInputStream(key), passphrase);
				}
				catch (IllegalArgumentException e) {
					throw new SSLException("Cannot load the client key/certificate", e);
				}
			}
			else if (key != null || cert != null) {
				throw new SSLException("Both key and cert must be provided for client authentication");
			}
			if (!ciphers.isEmpty()) {
				builder.ciphers(ciphers, SupportedCipherSuiteFilter.INSTANCE);
			}
			String protocol = toJdkProtocol(secureProtocol);
			if (protocol != null) {
				builder.protocols(protocol);
			}
			return builder.build();
		}

		KeyManagerFactory pkcs12KeyManager() throws SSLException {
			char[] password = passphrase == null ? new char[0] : passphrase.toCharArray();
			try {
				KeyStore keyStore = KeyStore.getInstance("PKCS12");
				keyStore.load(new ByteArrayInputStream(pfx), password);
				KeyManagerFactory factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
				factory.init(keyStore, password);
				return factory;
			}
			catch (GeneralSecurityException | IOException e) {
				throw new SSLException("Cannot load the PKCS#12 archive", e);
			}
		}

		Builder copy() {
			Builder copy = new Builder();
			copy.ca = ca;
			copy.pfx = pfx;
			copy.key = key;
			copy.cert = cert;
			copy.passphrase = passphrase;
			copy.ciphers = ciphers;
			copy.secureProtocol = secureProtocol;
			copy.rejectUnauthorized = rejectUnauthorized;
			copy.handshakeTimeoutMillis = handshakeTimeoutMillis;
			return copy;
		}

		static byte[] concat(List<byte[]> pems) {
			int length = 0;
			for (byte[] pem : pems) {
				length += pem.length + 1;
			}
			byte[] result = new byte[length];
			int offset = 0;
			for (byte[] pem : pems) {
				System.arraycopy(pem, 0, result, offset, pem.length);
				offset += pem.length;
				result[offset++] = '\n';
			}
			return result;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (o == null || getClass() != o.getClass()) {
				return false;
			}
			Builder that = (Builder) o;
			if (ca.size() != that.ca.size()) {
				return false;
			}
			for (int i = 0; i < ca.size(); i++) {
				if (!Arrays.equals(ca.get(i), that.ca.get(i))) {
					return false;
				}
			}
			return rejectUnauthorized == that.rejectUnauthorized &&
					handshakeTimeoutMillis == that.handshakeTimeoutMillis &&
					Arrays.equals(pfx, that.pfx) &&
					Arrays.equals(key, that.key) &&
					Arrays.equals(cert, that.cert) &&
					Objects.equals(passphrase, that.passphrase) &&
					ciphers.equals(that.ciphers) &&
					Objects.equals(secureProtocol, that.secureProtocol);
		}

		@Override
		public int hashCode() {
			int result = 1;
			for (byte[] pem : ca) {
				result = 31 * result + Arrays.hashCode(pem);
			}
			result = 31 * result + Arrays.hashCode(pfx);
			result = 31 * result + Arrays.hashCode(key);
			result = 31 * result + Arrays.hashCode(cert);
			result = 31 * result + Objects.hashCode(passphrase);
			result = 31 * result + ciphers.hashCode();
			result = 31 * result + Objects.hashCode(secureProtocol);
			result = 31 * result + Boolean.hashCode(rejectUnauthorized);
			result = 31 * result + Long.hashCode(handshakeTimeoutMillis);
			return result;
		}
	}
}

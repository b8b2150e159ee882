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
package urlfetch.http.client;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.netty.buffer.ByteBufUtil;
import reactor.util.annotation.Nullable;

/**
 * A Digest challenge received in a {@code WWW-Authenticate} header, and the computation of
 * the matching {@code Authorization} header (RFC 7616). Supports MD5, MD5-sess, SHA-256 and
 * SHA-256-sess with {@code qop=auth} or without qop. Each authorization increments the
 * nonce count, starting at {@code 00000001}.
 */
final class DigestChallenge {

	static final Pattern PARAMETER = Pattern.compile("([\\w-]+)\\s*=\\s*(?:\"((?:[^\"\\\\]|\\\\.)*)\"|([^,\\s]*))");

	static final SecureRandom RANDOM = new SecureRandom();

	/**
	 * Parse the first Digest challenge of the given header values.
	 *
	 * @param wwwAuthenticate the {@code WWW-Authenticate} header values
	 * @return the challenge
	 * @throws HttpClientAuthenticationException if there is no Digest challenge, it lacks
	 * realm or nonce, or it asks for an unsupported algorithm or qop
	 */
	static DigestChallenge parse(Iterable<String> wwwAuthenticate) throws HttpClientAuthenticationException {
		for (String value : wwwAuthenticate) {
			String trimmed = value.trim();
			if (trimmed.regionMatches(true, 0, AuthHeaders.DIGEST, 0, AuthHeaders.DIGEST.length())) {
				return parse(trimmed.substring(AuthHeaders.DIGEST.length()));
			}
		}
		throw new HttpClientAuthenticationException("No Digest challenge in WWW-Authenticate");
	}

	static DigestChallenge parse(String parameters) throws HttpClientAuthenticationException {
		Map<String, String> values = new HashMap<>();
		Matcher matcher = PARAMETER.matcher(parameters);
		while (matcher.find()) {
			String quoted = matcher.group(2);
			values.put(matcher.group(1).toLowerCase(Locale.ROOT),
					quoted != null ? quoted.replaceAll("\\\\(.)", "$1") : matcher.group(3));
		}
		String realm = values.get("realm");
		String nonce = values.get("nonce");
		if (realm == null || nonce == null) {
			throw new HttpClientAuthenticationException("Digest challenge without realm or nonce: " + parameters);
		}
		String algorithm = values.getOrDefault("algorithm", "MD5");
		String normalized = algorithm.toUpperCase(Locale.ROOT);
		if (!"MD5".equals(normalized) && !"MD5-SESS".equals(normalized) &&
				!"SHA-256".equals(normalized) && !"SHA-256-SESS".equals(normalized)) {
			throw new HttpClientAuthenticationException("Unsupported Digest algorithm: " + algorithm);
		}
		String qop = null;
		String offered = values.get("qop");
		if (offered != null) {
			for (String option : offered.split(",")) {
				if ("auth".equalsIgnoreCase(option.trim())) {
					qop = "auth";
				}
			}
			if (qop == null) {
				throw new HttpClientAuthenticationException("Unsupported Digest qop: " + offered);
			}
		}
		return new DigestChallenge(realm, nonce, qop, values.get("opaque"), algorithm);
	}

	final String realm;
	final String nonce;
	final String qop;
	final String opaque;
	final String algorithm;
	final AtomicInteger nonceCount = new AtomicInteger();

	DigestChallenge(String realm, String nonce, @Nullable String qop, @Nullable String opaque, String algorithm) {
		this.realm = realm;
		this.nonce = nonce;
		this.qop = qop;
		this.opaque = opaque;
		this.algorithm = algorithm;
	}

	/**
	 * Compute the {@code Authorization} header value for one request.
	 *
	 * @param method the request method
	 * @param uri the request target, as written in the request line
	 * @param username the user
	 * @param password the password
	 * @return the header value
	 */
	String authorize(String method, String uri, String username, String password) {
		return authorize(method, uri, username, password, newCnonce());
	}

	String authorize(String method, String uri, String username, String password, String cnonce) {
		String upper = algorithm.toUpperCase(Locale.ROOT);
		String digestName = upper.startsWith("SHA-256") ? "SHA-256" : "MD5";
		String nc = String.format("%08x", nonceCount.incrementAndGet());

		String ha1 = hash(digestName, username + ':' + realm + ':' + password);
		if (upper.endsWith("-SESS")) {
			ha1 = hash(digestName, ha1 + ':' + nonce + ':' + cnonce);
		}
		String ha2 = hash(digestName, method + ':' + uri);
		String response = qop != null ?
				hash(digestName, ha1 + ':' + nonce + ':' + nc + ':' + cnonce + ':' + qop + ':' + ha2) :
				hash(digestName, ha1 + ':' + nonce + ':' + ha2);

		StringBuilder header = new StringBuilder("Digest ")
				.append("username=\"").append(username).append("\", ")
				.append("realm=\"").append(realm).append("\", ")
				.append("nonce=\"").append(nonce).append("\", ")
				.append("uri=\"").append(uri).append("\", ")
				.append("algorithm=").append(algorithm).append(", ")
				.append("response=\"").append(response).append('"');
		if (opaque != null) {
			header.append(", opaque=\"").append(opaque).append('"');
		}
		if (qop != null) {
			header.append(", qop=").append(qop)
			      .append(", nc=").append(nc)
			      .append(", cnonce=\"").append(cnonce).append('"');
		}
		return header.toString();
	}

	static String newCnonce() {
		byte[] bytes = new byte[8];
		RANDOM.nextBytes(bytes);
		return ByteBufUtil.hexDump(bytes);
	}

	static String hash(String algorithm, String value) {
		try {
			MessageDigest digest = MessageDigest.getInstance(algorithm);
			return ByteBufUtil.hexDump(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("Missing " + algorithm + " support", e);
		}
	}

	@Override
	public String toString() {
		return "DigestChallenge{realm=" + realm + ", qop=" + qop + ", algorithm=" + algorithm + '}';
	}
}

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

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class DigestChallengeTest {

	@Test
	void md5WithQopAuth() throws HttpClientAuthenticationException {
		DigestChallenge challenge = DigestChallenge.parse(Collections.singletonList(
				"Digest realm=\"testrealm@host.com\", qop=\"auth,auth-int\", " +
				"nonce=\"dcd98b7102dd2f0e8b11d0f600bfb0c093\", opaque=\"5ccc069c403ebaf9f0171e9517f40e41\""));

		assertThat(challenge.realm).isEqualTo("testrealm@host.com");
		assertThat(challenge.qop).isEqualTo("auth");
		assertThat(challenge.algorithm).isEqualTo("MD5");

		String authorization = challenge.authorize("GET", "/dir/index.html", "Mufasa", "Circle Of Life", "0a4f113b");
		assertThat(authorization)
				.startsWith("Digest username=\"Mufasa\", realm=\"testrealm@host.com\"")
				.contains("response=\"6629fae49393a05397450978507c4ef1\"")
				.contains("opaque=\"5ccc069c403ebaf9f0171e9517f40e41\"")
				.contains("qop=auth, nc=00000001, cnonce=\"0a4f113b\"");
	}

	@Test
	void sha256WithQopAuth() throws HttpClientAuthenticationException {
		DigestChallenge challenge = DigestChallenge.parse(
				" realm=\"http-auth@example.org\", qop=\"auth, auth-int\", algorithm=SHA-256, " +
				"nonce=\"7ypf/xlj9XXwfDPEoM4URrv/xwf94BcCAzFZH4GiTo0v\", " +
				"opaque=\"FQhe/qaU925kfnzjCev0ciny7QMkPqMAFRtzCUYo5tdS\"");

		String authorization = challenge.authorize("GET", "/dir/index.html", "Mufasa", "Circle of Life",
				"f2/wE4q74E6zIJEtWaHKaf5wv/H5QzzpXusqGemxURZJ");
		assertThat(authorization)
				.contains("algorithm=SHA-256")
				.contains("response=\"753927fa0e85d155564e2e272a28d1802ca10daf4496794697cf8db5856cb6c1\"");
	}

	@Test
	void nonceCountIncrements() throws HttpClientAuthenticationException {
		DigestChallenge challenge = DigestChallenge.parse("realm=\"r\", nonce=\"n\", qop=auth");
		assertThat(challenge.authorize("GET", "/", "u", "p")).contains("nc=00000001");
		assertThat(challenge.authorize("GET", "/", "u", "p")).contains("nc=00000002");
	}

	@Test
	void withoutQop() throws HttpClientAuthenticationException {
		DigestChallenge challenge = DigestChallenge.parse("realm=\"r\", nonce=\"n\"");
		assertThat(challenge.authorize("GET", "/", "u", "p"))
				.doesNotContain("qop=")
				.doesNotContain("nc=");
	}

	@Test
	void picksTheDigestChallenge() throws HttpClientAuthenticationException {
		DigestChallenge challenge = DigestChallenge.parse(Arrays.asList("Basic realm=\"basic\"",
				"Digest realm=\"digest\", nonce=\"n\""));
		assertThat(challenge.realm).isEqualTo("digest");
	}

	@Test
	void missingNonce() {
		assertThatExceptionOfType(HttpClientAuthenticationException.class)
				.isThrownBy(() -> DigestChallenge.parse("realm=\"r\""));
	}

	@Test
	void unsupportedAlgorithm() {
		assertThatExceptionOfType(HttpClientAuthenticationException.class)
				.isThrownBy(() -> DigestChallenge.parse("realm=\"r\", nonce=\"n\", algorithm=SHA-512-256"))
				.withMessageContaining("SHA-512-256");
	}

	@Test
	void unsupportedQop() {
		assertThatExceptionOfType(HttpClientAuthenticationException.class)
				.isThrownBy(() -> DigestChallenge.parse("realm=\"r\", nonce=\"n\", qop=\"auth-int\""));
	}

	@Test
	void noDigestChallenge() {
		assertThatExceptionOfType(HttpClientAuthenticationException.class)
				.isThrownBy(() -> DigestChallenge.parse(Collections.singletonList("Basic realm=\"r\"")));
	}

	@Test
	void cacheIsKeyedByHost() throws HttpClientAuthenticationException {
		DigestAuthCache cache = new DigestAuthCache();
		assertThat(cache.authorize("example.com", "GET", "/", "u", "p")).isNull();

		cache.put("Example.COM", DigestChallenge.parse("realm=\"r\", nonce=\"n\", qop=auth"));
		assertThat(cache.authorize("example.com", "GET", "/", "u", "p")).contains("nc=00000001");
		assertThat(cache.authorize("example.com", "GET", "/", "u", "p")).contains("nc=00000002");
		assertThat(cache.authorize("other.com", "GET", "/", "u", "p")).isNull();

	}

	@Test
	void cacheKeepsOneNonceCountPerRealm() throws HttpClientAuthenticationException {
		DigestAuthCache cache = new DigestAuthCache();
		cache.put("example.com", DigestChallenge.parse("realm=\"a\", nonce=\"n1\", qop=auth"));
		assertThat(cache.authorize("example.com", "GET", "/", "u", "p"))
				.contains("realm=\"a\"")
				.contains("nc=00000001");
		assertThat(cache.authorize("example.com", "GET", "/", "u", "p")).contains("nc=00000002");

		cache.put("example.com", DigestChallenge.parse("realm=\"b\", nonce=\"n2\", qop=auth"));
		assertThat(cache.authorize("example.com", "GET", "/", "u", "p"))
				.contains("realm=\"b\"")
				.contains("nc=00000001");
		assertThat(cache.challenges).hasSize(2);

		cache.put("example.com", cache.challenges.get(DigestAuthCache.key("example.com", "a")));
		assertThat(cache.authorize("example.com", "GET", "/", "u", "p"))
				.contains("realm=\"a\"")
				.contains("nc=00000003");
	}

	@Test
	void basicAndDigestCredentials() throws HttpClientAuthenticationException {
		assertThat(AuthHeaders.basic("user:pass")).isEqualTo("Basic dXNlcjpwYXNz");

		AuthMode.Digest digest = AuthHeaders.digest("user:pa:ss");
		assertThat(digest.username).isEqualTo("user");
		assertThat(digest.password).isEqualTo("pa:ss");

		assertThatExceptionOfType(HttpClientAuthenticationException.class)
				.isThrownBy(() -> AuthHeaders.digest("nocolon"));
	}
}

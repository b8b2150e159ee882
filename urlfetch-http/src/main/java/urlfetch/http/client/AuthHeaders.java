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
import java.util.Base64;
import java.util.Locale;

import reactor.util.annotation.Nullable;

/**
 * Authorization header values.
 */
final class AuthHeaders {

	static final String BASIC  = "Basic ";
	static final String DIGEST = "Digest";

	/**
	 * Return the Basic authorization of the given credentials, sent as they are.
	 *
	 * @param credentials {@code user:password}
	 * @return the header value
	 */
	static String basic(String credentials) {
		return BASIC + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Split Digest credentials.
	 *
	 * @param credentials {@code user:password}
	 * @return the Digest authentication mode
	 * @throws HttpClientAuthenticationException if the credentials have no {@code :} or no user
	 */
	static AuthMode.Digest digest(String credentials) throws HttpClientAuthenticationException {
		int colon = credentials.indexOf(':');
		if (colon <= 0) {
			throw new HttpClientAuthenticationException("digestAuth must be formatted as user:password");
		}
		return new AuthMode.Digest(credentials.substring(0, colon), credentials.substring(colon + 1));
	}

	/**
	 * Return true if one of the given {@code WWW-Authenticate} values is a Digest challenge.
	 *
	 * @param wwwAuthenticate the header values
	 * @return true if a Digest challenge is present
	 */
	static boolean hasDigestChallenge(@Nullable Iterable<String> wwwAuthenticate) {
		if (wwwAuthenticate == null) {
			return false;
		}
		for (String value : wwwAuthenticate) {
			if (value.toLowerCase(Locale.ROOT).trim().startsWith("digest")) {
				return true;
			}
		}
		return false;
	}

	private AuthHeaders() {
	}
}

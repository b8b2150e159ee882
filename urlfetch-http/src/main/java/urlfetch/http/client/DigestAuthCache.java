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

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import reactor.util.annotation.Nullable;

/**
 * Digest challenges received by the requests of a client, keyed by host and realm, so
 * that later requests authenticate preemptively. The nonce count of a challenge is
 * advanced under the lock of its entry. Preemptive requests use the realm a host
 * challenged with last.
 */
final class DigestAuthCache {

	final ConcurrentMap<String, DigestChallenge> challenges = new ConcurrentHashMap<>();
	final ConcurrentMap<String, String>          realms = new ConcurrentHashMap<>();

	void put(String host, DigestChallenge challenge) {
		String hostKey = host.toLowerCase(Locale.ROOT);
		challenges.put(key(hostKey, challenge.realm), challenge);
		realms.put(hostKey, challenge.realm);
	}

	/**
	 * Compute the authorization for the challenge of the realm a host challenged with last.
	 *
	 * @return the header value, or null when no challenge is cached for the host
	 */
	@Nullable
	String authorize(String host, String method, String uri, String username, String password) {
		String hostKey = host.toLowerCase(Locale.ROOT);
		String realm = realms.get(hostKey);
		if (realm == null) {
			return null;
		}
		String[] authorization = new String[1];
		challenges.computeIfPresent(key(hostKey, realm), (k, challenge) -> {
			authorization[0] = challenge.authorize(method, uri, username, password);
			return challenge;
		});
		return authorization[0];
	}

	static String key(String hostKey, String realm) {
		return hostKey + ' ' + realm;
	}
}

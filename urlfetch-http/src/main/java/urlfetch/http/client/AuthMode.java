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

/**
 * Authentication of a request: none, Basic or Digest.
 */
abstract class AuthMode {

	static final AuthMode NONE = new None();

	static final class None extends AuthMode {
	}

	static final class Basic extends AuthMode {

		final String authorization;

		Basic(String authorization) {
			this.authorization = authorization;
		}
	}

	static final class Digest extends AuthMode {

		final String username;
		final String password;

		Digest(String username, String password) {
			this.username = username;
			this.password = password;
		}
	}
}

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
 * The connection could not be established: name resolution, TCP connect, proxy or TLS
 * handshake failure. Nothing has been sent when this error is raised.
 */
public final class ConnectFailedException extends RequestException {

	ConnectFailedException(String message, Throwable cause) {
		super(message, cause);
	}

	private static final long serialVersionUID = 7812340912734091623L;
}

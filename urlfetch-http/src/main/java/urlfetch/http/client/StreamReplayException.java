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
 * A redirect or a Digest challenge asked to send again a request body that came from an
 * already consumed {@link java.io.InputStream}.
 */
public final class StreamReplayException extends RequestException {

	StreamReplayException(HttpClientResponse response) {
		super("Cannot replay the stream request body after " + response.status() + " from " + response.url(),
				null, response);
	}

	private static final long serialVersionUID = -4498102374012746123L;
}

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

import java.io.IOException;

import reactor.util.annotation.Nullable;

/**
 * Base class of every failure delivered by the client. Carries the response when one was
 * received before the failure.
 */
public class RequestException extends IOException {

	volatile HttpClientResponse response;

	public RequestException(String message) {
		super(message);
	}

	public RequestException(String message, @Nullable Throwable cause) {
		super(message, cause);
	}

	RequestException(String message, @Nullable Throwable cause, @Nullable HttpClientResponse response) {
		super(message, cause);
		this.response = response;
	}

	/**
	 * Return the response received before the failure, if any.
	 *
	 * @return the response received before the failure or null
	 */
	@Nullable
	public HttpClientResponse response() {
		return response;
	}

	RequestException response(@Nullable HttpClientResponse response) {
		if (this.response == null) {
			this.response = response;
		}
		return this;
	}

	private static final long serialVersionUID = 4235127812478136592L;
}

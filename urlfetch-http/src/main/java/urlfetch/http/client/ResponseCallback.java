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

import reactor.util.annotation.Nullable;

/**
 * Callback receiving the outcome of a request, invoked exactly once.
 */
@FunctionalInterface
public interface ResponseCallback {

	/**
	 * Receive the outcome of a request.
	 *
	 * @param error the failure, null on success
	 * @param data the decoded body, null on failure or when the body was piped or streamed
	 * @param response the response, null when none was received
	 */
	void onComplete(@Nullable Throwable error, @Nullable Object data, @Nullable HttpClientResponse response);
}

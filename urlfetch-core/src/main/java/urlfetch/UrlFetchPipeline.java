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
package urlfetch;

/**
 * Names of the handlers installed in a client channel pipeline.
 * <p>
 * Order: {@code [ProxyLoggingHandler] -> [ProxyHandler] -> [SslHandler] -> [LoggingHandler]
 * -> HttpCodec -> ChunkedWriter -> ResponseHandler}.
 */
public interface UrlFetchPipeline {

	String LEFT = "urlfetch.left.";

	String RIGHT = "urlfetch.right.";

	String ConnectMetricsHandler = LEFT + "connectMetricsHandler";
	String ProxyHandler          = LEFT + "proxyHandler";
	String ProxyLoggingHandler   = LEFT + "proxyLoggingHandler";
	String SslHandler            = LEFT + "sslHandler";
	String LoggingHandler        = LEFT + "loggingHandler";
	String HttpCodec             = LEFT + "httpCodec";
	String ChunkedWriter         = LEFT + "chunkedWriter";

	String ResponseHandler       = RIGHT + "responseHandler";
}

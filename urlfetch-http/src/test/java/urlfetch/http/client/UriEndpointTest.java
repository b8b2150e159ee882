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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class UriEndpointTest {

	@Test
	void defaultPorts() {
		UriEndpoint http = UriEndpoint.create("http://example.com");
		UriEndpoint https = UriEndpoint.create("HTTPS://example.com/a?b=c");

		assertThat(http.port()).isEqualTo(80);
		assertThat(http.getRawUri()).isEqualTo("/");
		assertThat(http.getHostHeader()).isEqualTo("example.com");
		assertThat(https.isSecure()).isTrue();
		assertThat(https.port()).isEqualTo(443);
		assertThat(https.getRawUri()).isEqualTo("/a?b=c");
		assertThat(https.toExternalForm()).isEqualTo("https://example.com/a?b=c");
	}

	@Test
	void explicitDefaultPortIsNotInTheHostHeader() {
		assertThat(UriEndpoint.create("http://example.com:80/").getHostHeader()).isEqualTo("example.com");
		assertThat(UriEndpoint.create("https://example.com:8443/").getHostHeader()).isEqualTo("example.com:8443");
	}

	@Test
	void ipv6Literal() {
		UriEndpoint endpoint = UriEndpoint.create("http://[::1]:8080/x");

		assertThat(endpoint.host()).isEqualTo("::1");
		assertThat(endpoint.port()).isEqualTo(8080);
		assertThat(endpoint.getHostHeader()).isEqualTo("[::1]:8080");
	}

	@Test
	void encodedPathIsKept() {
		assertThat(UriEndpoint.create("http://example.com/a%20b?q=%26").getRawUri()).isEqualTo("/a%20b?q=%26");
	}

	@Test
	void redirectResolution() {
		UriEndpoint endpoint = UriEndpoint.create("http://example.com/a/b");

		assertThat(endpoint.redirect("c").toExternalForm()).isEqualTo("http://example.com/a/c");
		assertThat(endpoint.redirect("/c").toExternalForm()).isEqualTo("http://example.com/c");
		assertThat(endpoint.redirect("//other.com/c").toExternalForm()).isEqualTo("http://other.com/c");
		assertThat(endpoint.redirect("https://other.com/").isSecure()).isTrue();
	}

	@Test
	void sameHost() {
		UriEndpoint endpoint = UriEndpoint.create("http://Example.com/a");

		assertThat(endpoint.isSameHost(UriEndpoint.create("https://example.COM:8443/b"))).isTrue();
		assertThat(endpoint.isSameHost(UriEndpoint.create("http://other.com/a"))).isFalse();
	}

	@Test
	void invalidUrls() {
		assertThatExceptionOfType(IllegalArgumentException.class)
				.isThrownBy(() -> UriEndpoint.create("http://exa mple.com"));
		assertThatExceptionOfType(IllegalArgumentException.class)
				.isThrownBy(() -> UriEndpoint.create("http:///path"));
		assertThatExceptionOfType(IllegalArgumentException.class)
				.isThrownBy(() -> UriEndpoint.create("file:///tmp/x"));
	}
}

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

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An absolute {@code http} or {@code https} URL split into what the connection and the
 * request line need.
 */
final class UriEndpoint {

	static final int DEFAULT_PORT        = 80;
	static final int DEFAULT_SECURE_PORT = 443;

	private static final Pattern SCHEME_PATTERN = Pattern.compile("^\\w+://.*$");
	private static final String ROOT_PATH = "/";
	private static final String COLON_DOUBLE_SLASH = "://";

	private final URI uri;
	private final String scheme;
	private final boolean secure;
	private final String host;
	private final int port;
	private final String authority;
	private final String rawUri;

	private UriEndpoint(URI uri) {
		this.uri = Objects.requireNonNull(uri, "uri");
		if (uri.isOpaque()) {
			throw new IllegalArgumentException("URI is opaque: " + uri);
		}
		if (!uri.isAbsolute()) {
			throw new IllegalArgumentException("URI is not absolute: " + uri);
		}
		this.scheme = uri.getScheme().toLowerCase(Locale.ROOT);
		if (!"http".equals(scheme) && !"https".equals(scheme)) {
			throw new IllegalArgumentException("Unsupported scheme " + scheme + ": " + uri);
		}
		if (uri.getHost() == null) {
			throw new IllegalArgumentException("URI has no host: " + uri);
		}
		this.secure = "https".equals(scheme);
		this.host = uri.getHost();
		this.port = uri.getPort() != -1 ? uri.getPort() : (secure ? DEFAULT_SECURE_PORT : DEFAULT_PORT);
		this.authority = authority(uri, secure);
		this.rawUri = rawUri(uri);
	}

	/**
	 * Parse a URL, {@code http://} being assumed when the scheme is missing.
	 *
	 * @param url the URL
	 * @return a new {@link UriEndpoint}
	 * @throws IllegalArgumentException if the URL is not a valid http or https URL
	 */
	static UriEndpoint create(String url) {
		Objects.requireNonNull(url, "url");
		String uriStr = url.trim();
		if (!SCHEME_PATTERN.matcher(uriStr).matches()) {
			// support "example.com/path" case by prepending scheme
			uriStr = "http" + COLON_DOUBLE_SLASH + uriStr;
		}
		try {
			return new UriEndpoint(new URI(uriStr));
		}
		catch (URISyntaxException e) {
			throw new IllegalArgumentException("Invalid URL " + url + ": " + e.getMessage(), e);
		}
	}

	private static String rawUri(URI uri) {
		String rawPath = uri.getRawPath();
		if (rawPath == null || rawPath.isEmpty()) {
			rawPath = ROOT_PATH;
		}
		String rawQuery = uri.getRawQuery();
		if (rawQuery == null) {
			return rawPath;
		}
		return rawPath + '?' + rawQuery;
	}

	private static String authority(URI uri, boolean secure) {
		String host = uri.getHost();
		int port = uri.getPort();
		if (port == -1 || (!secure && port == DEFAULT_PORT) || (secure && port == DEFAULT_SECURE_PORT)) {
			return host;
		}
		return host + ':' + port;
	}

	/**
	 * Resolve a {@code Location} header against this URL.
	 *
	 * @param to the location
	 * @return the redirect target
	 * @throws IllegalArgumentException if the location cannot be resolved
	 */
	UriEndpoint redirect(String to) {
		try {
			URI redirectUri = new URI(to);
			if (redirectUri.isAbsolute()) {
				// absolute path: treat as a brand new uri
				return new UriEndpoint(redirectUri);
			}
			return new UriEndpoint(uri.resolve(redirectUri));
		}
		catch (URISyntaxException e) {
			throw new IllegalArgumentException("Cannot resolve location header", e);
		}
	}

	boolean isSecure() {
		return secure;
	}

	/**
	 * Return the host, without the brackets of IPv6 literals.
	 *
	 * @return the host
	 */
	String host() {
		if (host.startsWith("[") && host.endsWith("]")) {
			return host.substring(1, host.length() - 1);
		}
		return host;
	}

	int port() {
		return port;
	}

	String getRawUri() {
		return rawUri;
	}

	String getHostHeader() {
		return authority;
	}

	/**
	 * Return true if both URLs target the same host, whatever the scheme and port.
	 *
	 * @param other the other URL
	 * @return true if both URLs target the same host
	 */
	boolean isSameHost(UriEndpoint other) {
		return host.equalsIgnoreCase(other.host);
	}

	String toExternalForm() {
		return scheme + COLON_DOUBLE_SLASH + authority + rawUri;
	}

	@Override
	public String toString() {
		return toExternalForm();
	}
}

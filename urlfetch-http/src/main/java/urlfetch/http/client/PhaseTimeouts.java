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

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import reactor.util.annotation.Nullable;

/**
 * The two deadlines of an attempt. The connect phase runs from acquisition until the
 * request is fully sent, the response phase from there until the response is fully
 * received. Timers run on a Netty event loop, independently of the I/O; a zero duration
 * disables the phase deadline.
 * <p>
 * The expiry callback is invoked at most once and never after {@link #cancel()}. The
 * attempt still arbitrates between expiry and normal completion.
 */
final class PhaseTimeouts {

	final EventExecutor                               executor;
	final Duration                                    connectTimeout;
	final Duration                                    responseTimeout;
	final Consumer<? super RequestTimeoutException.Phase> onExpiry;

	ScheduledFuture<?> connectTimer;
	ScheduledFuture<?> responseTimer;
	boolean            responsePhase;
	boolean            done;

	PhaseTimeouts(EventExecutor executor, Duration connectTimeout, Duration responseTimeout,
			Consumer<? super RequestTimeoutException.Phase> onExpiry) {
		this.executor = executor;
		this.connectTimeout = connectTimeout;
		this.responseTimeout = responseTimeout;
		this.onExpiry = onExpiry;
	}

	synchronized void startConnectPhase() {
		if (done || connectTimer != null) {
			return;
		}
		connectTimer = schedule(connectTimeout, RequestTimeoutException.Phase.CONNECT);
	}

	/**
	 * Stop the connect deadline and start the response one. Subsequent calls are no-op.
	 */
	synchronized void startResponsePhase() {
		if (done || responsePhase) {
			return;
		}
		responsePhase = true;
		cancelTimer(connectTimer);
		responseTimer = schedule(responseTimeout, RequestTimeoutException.Phase.RESPONSE);
	}

	synchronized void cancel() {
		done = true;
		cancelTimer(connectTimer);
		cancelTimer(responseTimer);
	}

	Duration timeout(RequestTimeoutException.Phase phase) {
		return phase == RequestTimeoutException.Phase.CONNECT ? connectTimeout : responseTimeout;
	}

	@Nullable
	ScheduledFuture<?> schedule(Duration timeout, RequestTimeoutException.Phase phase) {
		if (timeout.isZero()) {
			return null;
		}
		return executor.schedule(() -> expire(phase), timeout.toNanos(), TimeUnit.NANOSECONDS);
	}

	void expire(RequestTimeoutException.Phase phase) {
		synchronized (this) {
			if (done) {
				return;
			}
			done = true;
			cancelTimer(connectTimer);
			cancelTimer(responseTimer);
		}
		onExpiry.accept(phase);
	}

	static void cancelTimer(@Nullable ScheduledFuture<?> timer) {
		if (timer != null) {
			timer.cancel(false);
		}
	}
}

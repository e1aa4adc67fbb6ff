/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.resultant;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link FetchLogger} which logs via <a href="https://docs.oracle.com/en/java/javase/17/docs/api/java.logging/java/util/logging/package-summary.html">java.util.logging</a>.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultFetchLogger implements FetchLogger {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "com.resultant.FETCH";
	@NonNull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	@NonNull
	private final Logger logger;
	@NonNull
	private final Level loggerLevel;

	/**
	 * Creates a new fetch logger with the default logger name <code>{@value #DEFAULT_LOGGER_NAME}</code> and level.
	 */
	public DefaultFetchLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	/**
	 * Creates a new fetch logger with the given logger name and level.
	 *
	 * @param loggerName  the logger name to use
	 * @param loggerLevel the logger level to use
	 */
	public DefaultFetchLogger(@NonNull String loggerName,
														@NonNull Level loggerLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
	}

	@Override
	public void log(@NonNull FetchLog fetchLog) {
		requireNonNull(fetchLog);

		if (getLogger().isLoggable(getLoggerLevel()))
			getLogger().log(getLoggerLevel(), formatFetchLog(fetchLog));
	}

	@NonNull
	protected String formatFetchLog(@NonNull FetchLog fetchLog) {
		requireNonNull(fetchLog);

		StringBuilder line = new StringBuilder(fetchLog.getOperation().name());

		if (fetchLog.getArguments().isPresent())
			line.append(format(" (%s)", fetchLog.getArguments().get()));

		line.append(format(": %d row%s in %s", fetchLog.getRowsFetched(), fetchLog.getRowsFetched() == 1 ? "" : "s", fetchLog.getDuration()));

		Throwable exception = fetchLog.getException().orElse(null);

		if (exception != null) {
			if (exception instanceof RowSourceException && exception.getCause() != null)
				exception = exception.getCause();

			line.append(format("\nFailed due to %s", exception));
		}

		return line.toString();
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}
}

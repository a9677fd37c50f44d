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

package com.dbjob;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * A {@link JobLogger} which writes to {@code java.util.logging}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultJobLogger implements JobLogger {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "com.dbjob.SQL";
	@NonNull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	/**
	 * The point at which we ellipsize output for parameters.
	 */
	private static final int MAXIMUM_PARAMETER_LOGGING_LENGTH = 100;

	@NonNull
	private final Logger logger;
	@NonNull
	private final Level loggerLevel;

	/**
	 * Creates a new job logger with the default logger name <code>{@value #DEFAULT_LOGGER_NAME}</code> and level.
	 */
	public DefaultJobLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	/**
	 * Creates a new job logger with the given logger name and level.
	 *
	 * @param loggerName  the logger name to use
	 * @param loggerLevel the logger level to use
	 */
	public DefaultJobLogger(@NonNull String loggerName,
													@NonNull Level loggerLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
	}

	@Override
	public void log(@NonNull JobLog jobLog) {
		requireNonNull(jobLog);

		if (getLogger().isLoggable(getLoggerLevel()))
			getLogger().log(getLoggerLevel(), formatJobLog(jobLog));
	}

	@NonNull
	protected String formatJobLog(@NonNull JobLog jobLog) {
		requireNonNull(jobLog);

		List<String> timingEntries = new ArrayList<>(4);

		jobLog.getConnectionAcquisitionDuration().ifPresent(duration -> timingEntries.add(format("%s acquiring connection", duration)));
		jobLog.getPreparationDuration().ifPresent(duration -> timingEntries.add(format("%s preparing command", duration)));
		jobLog.getExecutionDuration().ifPresent(duration -> timingEntries.add(format("%s executing command", duration)));
		jobLog.getMaterializationDuration().ifPresent(duration -> timingEntries.add(format("%s materializing results", duration)));

		List<String> lines = new ArrayList<>(5);

		lines.add(format("Job %d attempt %d %s", jobLog.getJobId(), jobLog.getAttempt(), jobLog.getJobState().name().toLowerCase(Locale.ROOT)));

		JobContext jobContext = jobLog.getJobContext().orElse(null);

		if (jobContext != null) {
			lines.add(jobContext.getSql());

			if (jobContext.getParameters().size() > 0)
				lines.add(format("Parameters: %s", jobContext.getParameters().stream().map(this::formatParameter).collect(joining(", "))));
		}

		if (timingEntries.size() > 0)
			lines.add(String.join(", ", timingEntries));

		Throwable exception = jobLog.getException().orElse(null);

		if (exception != null) {
			if (exception.getCause() != null)
				exception = exception.getCause();

			lines.add(format("Failed at %s due to %s", jobLog.getRunStage(), exception));
		}

		return String.join("\n", lines);
	}

	@NonNull
	protected String formatParameter(Object parameter) {
		if (parameter == null)
			return "null";

		if (parameter instanceof Number)
			return format("%s", parameter);

		if (parameter instanceof byte[] bytes)
			return format("[byte array of length %d]", bytes.length);

		return format("'%s'", ellipsize(parameter.toString(), MAXIMUM_PARAMETER_LOGGING_LENGTH));
	}

	/**
	 * Ellipsizes the given {@code string}, capping at {@code maximumLength}.
	 *
	 * @param string        the string to ellipsize
	 * @param maximumLength the maximum length of the ellipsized string, not including ellipsis
	 * @return an ellipsized version of {@code string}
	 */
	@NonNull
	protected String ellipsize(@NonNull String string,
														 int maximumLength) {
		requireNonNull(string);

		string = string.trim();

		if (string.length() <= maximumLength)
			return string;

		return format("%s...", string.substring(0, maximumLength));
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

package org.oncolens.engine.util;

/*
 * This file is part of OncoLens.
 *
 * Copyright (C) 2026 OncoLens contributors
 *
 * OncoLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * OncoLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with OncoLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/**
 * Small static logger used across the engine.
 *
 * <p>Each line carries a timestamp, the calling thread and the level. Gate and
 * scorer code logs through here so batch runs show which worker produced a
 * score.</p>
 *
 * <p>System properties, read once:</p>
 * <ul>
 *   <li><b>oncolens.log.level</b>: minimum level printed (default INFO)</li>
 *   <li><b>oncolens.log.datetime</b>: timestamp pattern (default yyyy-MM-dd HH:mm:ss)</li>
 * </ul>
 */
public final class Logger {

	/** Severity, lowest first. */
	public enum Level {
		TRACE, DEBUG, INFO, WARN, ERROR;

		static Level parse(String s, Level fallback) {
			if (StringUtils.isBlank(s))
				return fallback;
			try {
				return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
			} catch (IllegalArgumentException ex) {
				return fallback;
			}
		}
	}

	public static final String SYS_PROP_LEVEL = "oncolens.log.level";
	public static final String SYS_PROP_DATETIME = "oncolens.log.datetime";

	private static final Level MIN_LEVEL = Level.parse(System.getProperty(SYS_PROP_LEVEL), Level.INFO);

	private static final DateTimeFormatter TS = DateTimeFormatter
			.ofPattern(System.getProperty(SYS_PROP_DATETIME, "yyyy-MM-dd HH:mm:ss"));

	private Logger() {
	}

	public static boolean isEnabled(Level level) {
		return level.ordinal() >= MIN_LEVEL.ordinal();
	}

	public static void trace(String msg, Object... args) { write(Level.TRACE, null, msg, args); }
	public static void debug(String msg, Object... args) { write(Level.DEBUG, null, msg, args); }
	public static void info (String msg, Object... args) { write(Level.INFO , null, msg, args); }
	public static void warn (String msg, Object... args) { write(Level.WARN , null, msg, args); }
	public static void error(String msg, Object... args) { write(Level.ERROR, null, msg, args); }

	public static void warn (String msg, Throwable t, Object... args) { write(Level.WARN , t, msg, args); }
	public static void error(String msg, Throwable t, Object... args) { write(Level.ERROR, t, msg, args); }

	private static void write(Level level, Throwable t, String msg, Object... args) {
		if (!isEnabled(level))
			return;

		final String line = "[" + LocalDateTime.now().format(TS) + "] [" + Thread.currentThread().getName() + "] "
				+ level + " " + format(msg, args);

		// WARN and ERROR go to stderr
		final PrintStream out = level.ordinal() >= Level.WARN.ordinal() ? System.err : System.out;

		synchronized (Logger.class) {
			out.println(line);
			if (t != null) {
				t.printStackTrace(out);
			}
		}
	}

	/**
	 * Replaces each "{}" with the next argument. Leftover arguments are appended
	 * separated by spaces.
	 */
	static String format(String template, Object... args) {
		if (template == null)
			return "null";
		if (args == null || args.length == 0)
			return template;

		StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
		int next = 0;
		int i = 0;
		while (i < template.length()) {
			int open = template.indexOf("{}", i);
			if (open < 0 || next >= args.length) {
				sb.append(template, i, template.length());
				break;
			}
			sb.append(template, i, open).append(args[next++]);
			i = open + 2;
		}
		while (next < args.length) {
			sb.append(' ').append(args[next++]);
		}
		return sb.toString();
	}
}

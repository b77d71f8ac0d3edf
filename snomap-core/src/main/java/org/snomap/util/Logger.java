package org.snomap.util;

/*
 * This file is part of SnoMap.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * SnoMap is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SnoMap is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SnoMap.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Static, dependency-free logger used across SnoMap.
 *
 * <p>Each line reads {@code [timestamp] [thread] LEVEL message}. Messages use
 * {@code {}} placeholders; a {@link Throwable} passed as the last argument is
 * not substituted but printed with its stack trace after the line.</p>
 *
 * <ul>
 *   <li><b>snomap.log.level</b> minimum level to print (default: INFO)</li>
 *   <li><b>snomap.log.datetime</b> timestamp pattern (default: yyyy-MM-dd HH:mm:ss)</li>
 * </ul>
 *
 * INFO and below go to the standard stream, WARN and ERROR to the error
 * stream. Both can be redirected with {@link #redirect(PrintStream, PrintStream)}.
 */
public final class Logger {

	public enum Level {
		TRACE, DEBUG, INFO, WARN, ERROR;

		static Level parse(String s, Level fallback) {
			if (s == null || s.isBlank())
				return fallback;
			try {
				return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
			} catch (IllegalArgumentException ex) {
				return fallback;
			}
		}
	}

	private static final DateTimeFormatter TS = DateTimeFormatter
			.ofPattern(System.getProperty("snomap.log.datetime", "yyyy-MM-dd HH:mm:ss"));

	private static volatile Level minLevel = Level.parse(System.getProperty("snomap.log.level"), Level.INFO);
	private static volatile PrintStream out = System.out;
	private static volatile PrintStream err = System.err;

	private Logger() {
	}

	public static void trace(String msg, Object... args) {
		log(Level.TRACE, msg, args);
	}

	public static void debug(String msg, Object... args) {
		log(Level.DEBUG, msg, args);
	}

	public static void info(String msg, Object... args) {
		log(Level.INFO, msg, args);
	}

	public static void warn(String msg, Object... args) {
		log(Level.WARN, msg, args);
	}

	public static void error(String msg, Object... args) {
		log(Level.ERROR, msg, args);
	}

	public static boolean isEnabled(Level level) {
		return level.ordinal() >= minLevel.ordinal();
	}

	public static void setLevel(Level level) {
		minLevel = (level == null) ? Level.INFO : level;
	}

	public static Level getLevel() {
		return minLevel;
	}

	/** Swap the output streams; {@code null} restores the console stream. */
	public static synchronized void redirect(PrintStream stdout, PrintStream stderr) {
		out = (stdout == null) ? System.out : stdout;
		err = (stderr == null) ? System.err : stderr;
	}

	// ---- Internals ----------------------------------------------------------

	private static void log(Level level, String msg, Object... args) {
		if (!isEnabled(level))
			return;

		Throwable t = null;
		Object[] fmtArgs = args;
		if (args != null && args.length > 0 && args[args.length - 1] instanceof Throwable) {
			t = (Throwable) args[args.length - 1];
			fmtArgs = new Object[args.length - 1];
			System.arraycopy(args, 0, fmtArgs, 0, fmtArgs.length);
		}

		final String line = "[" + LocalDateTime.now().format(TS) + "] [" + Thread.currentThread().getName() + "] "
				+ level + " " + format(msg, fmtArgs);

		synchronized (Logger.class) {
			PrintStream target = (level.ordinal() >= Level.WARN.ordinal()) ? err : out;
			target.println(line);
			if (t != null) {
				t.printStackTrace(target);
			}
		}
	}

	/**
	 * Replaces each {@code {}} with the next argument. Surplus arguments are
	 * appended, surplus placeholders are left as they are.
	 */
	static String format(String template, Object... args) {
		if (template == null)
			return "null";
		if (args == null || args.length == 0)
			return template;

		StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
		int argIdx = 0;
		int from = 0;
		int at;
		while (argIdx < args.length && (at = template.indexOf("{}", from)) >= 0) {
			sb.append(template, from, at).append(args[argIdx++]);
			from = at + 2;
		}
		sb.append(template.substring(from));
		while (argIdx < args.length) {
			sb.append(' ').append(args[argIdx++]);
		}
		return sb.toString();
	}
}

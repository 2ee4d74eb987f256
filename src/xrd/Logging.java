/**
 * MIT License
 * <p>
 * Copyright (c) 2022 Justin Kunimune
 * <p>
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 * <p>
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 * <p>
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package xrd;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class Logging {

	/**
	 * give the logger a compact console format and make it also log to a file in the given directory.
	 * @param logger the logger to set up
	 * @param name the name of this run, which goes in the log filename
	 * @param directory the directory where the log file goes; it's created if it doesn't exist
	 * @throws IOException if the log file can't be opened
	 */
	public static void configureLogger(Logger logger, String name, File directory) throws IOException {
		System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));

		for (Handler handler: logger.getParent().getHandlers()) {
			handler.setFormatter(newFormatter("%1$ta %1$tH:%1$tM:%1$tS | %2$s | %3$s%4$s%n"));
			handler.setEncoding("UTF-8");
		}
		if (!directory.isDirectory() && !directory.mkdirs())
			throw new IOException("could not create the log directory "+directory);
		File file = new File(directory, String.format("log-%s.log", name));
		FileHandler handler = new FileHandler(file.getPath(), true);
		handler.setFormatter(newFormatter("%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS | %2$s | %3$s%4$s%n"));
		logger.addHandler(handler);
		System.out.println("logging in　to `"+file+"`");
	}

	static Formatter newFormatter(String format) {
		return new SimpleFormatter() {
			public String format(LogRecord record) {
				return String.format(format,
				                     record.getMillis(),
				                     record.getLevel(),
				                     record.getMessage(),
				                     (record.getThrown() != null) ? record.getThrown() : "");
			}
		};
	}
}

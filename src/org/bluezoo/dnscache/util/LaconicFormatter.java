/*
 * LaconicFormatter.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of dnscache, a caching DNS lookup library.
 *
 * dnscache is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * dnscache is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with dnscache.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.dnscache.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * A one-line logging formatter: level, short logger name, message.
 * Stack traces of thrown exceptions follow on subsequent lines.
 *
 * <p>To use it for the whole process:
 * <pre>
 * handlers = java.util.logging.ConsoleHandler
 * java.util.logging.ConsoleHandler.formatter = org.bluezoo.dnscache.util.LaconicFormatter
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LaconicFormatter extends Formatter {

    @Override
    public String format(LogRecord record) {
        StringBuilder buf = new StringBuilder();
        buf.append(record.getLevel().getLocalizedName());
        String loggerName = record.getLoggerName();
        if (loggerName != null) {
            buf.append(" [");
            buf.append(loggerName.substring(loggerName.lastIndexOf('.') + 1));
            buf.append(']');
        }
        buf.append(": ");
        String message = formatMessage(record);
        if (message != null) {
            buf.append(message);
        }
        buf.append(System.lineSeparator());
        Throwable t = record.getThrown();
        if (t != null) {
            StringWriter sink = new StringWriter();
            PrintWriter filter = new PrintWriter(sink);
            t.printStackTrace(filter);
            filter.flush();
            buf.append(sink.toString());
        }
        return buf.toString();
    }

}

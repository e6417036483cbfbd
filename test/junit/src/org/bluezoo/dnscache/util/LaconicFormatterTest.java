/*
 * LaconicFormatterTest.java
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

import org.junit.Test;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link LaconicFormatter}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LaconicFormatterTest {

    private final LaconicFormatter formatter = new LaconicFormatter();

    @Test
    public void testOneLine() {
        LogRecord record = new LogRecord(Level.WARNING, "example.com MX lookup timed out.");
        record.setLoggerName("org.bluezoo.dnscache.DNSCache");

        String text = formatter.format(record);

        assertEquals(Level.WARNING.getLocalizedName() + " [DNSCache]: example.com MX lookup timed out."
                + System.lineSeparator(), text);
    }

    @Test
    public void testParameters() {
        LogRecord record = new LogRecord(Level.INFO, "Local IP addresses: {0}");
        record.setParameters(new Object[] { "[192.0.2.1]" });

        String text = formatter.format(record);

        assertEquals(Level.INFO.getLocalizedName() + ": Local IP addresses: [192.0.2.1]"
                + System.lineSeparator(), text);
    }

    @Test
    public void testThrown() {
        LogRecord record = new LogRecord(Level.SEVERE, "failed");
        record.setLoggerName("Root");
        record.setThrown(new IOException("disk on fire"));

        String text = formatter.format(record);

        assertTrue(text.startsWith(Level.SEVERE.getLocalizedName() + " [Root]: failed"));
        assertTrue(text.contains("java.io.IOException: disk on fire"));
        assertTrue(text.contains("testThrown"));
    }

}

/*
 * CombinedListConfigTest.java
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

package org.bluezoo.dnscache;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link CombinedListConfig}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CombinedListConfigTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @After
    public void tearDown() {
        System.clearProperty(CombinedListConfig.PATH_PROPERTY);
    }

    private Path write(String json) throws IOException {
        File file = folder.newFile("combined_lists.json");
        Files.write(file.toPath(), json.getBytes(StandardCharsets.UTF_8));
        return file.toPath();
    }

    @Test
    public void testLoad() throws IOException {
        Path path = write("{\n" +
                "  \"COMBINED\": \"combined.dnsbl.example.net\",\n" +
                "  \"COMBINED_URL\": \"combined.urlbl.example.net\",\n" +
                "  \"COMBINED_DNSBL\": {\"list1.dnsbl.example.com\": \"127.0.1.2\"},\n" +
                "  \"COMBINED_DNSBL_REVERSE\": {\"127.0.1.2\": \"list1.dnsbl.example.com\"},\n" +
                "  \"COMBINED_URLBL\": {\"list1.urlbl.example.com\": \"127.0.2.2\"},\n" +
                "  \"COMBINED_URLBL_REVERSE\": {\"127.0.2.2\": \"list1.urlbl.example.com\"}\n" +
                "}\n");

        CombinedListConfig config = CombinedListConfig.load(path);

        assertEquals("combined.dnsbl.example.net", config.getCombined());
        assertEquals("combined.urlbl.example.net", config.getCombinedURL());
        assertEquals("127.0.1.2", config.getDNSBL().get("list1.dnsbl.example.com"));
        assertEquals("list1.dnsbl.example.com", config.getDNSBLReverse().get("127.0.1.2"));
        assertEquals("127.0.2.2", config.getURLBL().get("list1.urlbl.example.com"));
        assertEquals("list1.urlbl.example.com", config.getURLBLReverse().get("127.0.2.2"));
        assertTrue(config.isCombinedDNSBL("list1.dnsbl.example.com"));
        assertFalse(config.isCombinedDNSBL("list1.urlbl.example.com"));
        assertTrue(config.isCombinedURLBL("list1.urlbl.example.com"));
        assertFalse(config.isCombinedURLBL("list2.urlbl.example.com"));
    }

    @Test
    public void testMissingFile() {
        CombinedListConfig config = CombinedListConfig.load(folder.getRoot().toPath().resolve("absent.json"));

        assertSame(CombinedListConfig.empty(), config);
        assertEquals("", config.getCombined());
        assertTrue(config.getDNSBLReverse().isEmpty());
    }

    @Test
    public void testMalformedFile() throws IOException {
        Path path = write("{ \"COMBINED\": ");

        assertSame(CombinedListConfig.empty(), CombinedListConfig.load(path));
    }

    @Test
    public void testAbsentKeysAreEmpty() throws IOException {
        Path path = write("{\"COMBINED_DNSBL_REVERSE\": {\"127.0.1.2\": \"list1.dnsbl.example.com\"}}");

        CombinedListConfig config = CombinedListConfig.load(path);

        assertEquals("", config.getCombined());
        assertEquals("", config.getCombinedURL());
        assertTrue(config.getURLBLReverse().isEmpty());
        // No combined zone, so nothing is combined
        assertFalse(config.isCombinedDNSBL("list1.dnsbl.example.com"));
    }

    @Test
    public void testUnknownKeysIgnored() throws IOException {
        Path path = write("{\"COMBINED\": \"combined.dnsbl.example.net\", \"VERSION\": 3}");

        assertEquals("combined.dnsbl.example.net", CombinedListConfig.load(path).getCombined());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testMapsAreReadOnly() throws IOException {
        Path path = write("{\"COMBINED_DNSBL\": {\"list1.dnsbl.example.com\": \"127.0.1.2\"}}");

        CombinedListConfig.load(path).getDNSBL().put("list2.dnsbl.example.com", "127.0.1.3");
    }

    @Test
    public void testLoadFromSystemProperty() throws IOException {
        Path path = write("{\"COMBINED\": \"combined.dnsbl.example.net\"}");
        System.setProperty(CombinedListConfig.PATH_PROPERTY, path.toString());

        assertEquals("combined.dnsbl.example.net", CombinedListConfig.load().getCombined());
    }

}

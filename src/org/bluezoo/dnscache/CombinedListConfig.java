/*
 * CombinedListConfig.java
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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Combined block list configuration.
 *
 * <p>A combined list is a single DNSBL (or URLBL) zone whose answers
 * encode membership of many underlying lists. The reverse mappings map
 * each answer value of the combined zone to the four-label domain of the
 * list it stands for.
 *
 * <p>The configuration is read from a JSON object:
 * <pre>
 * {
 *   "COMBINED": "combined.dnsbl.example.com",
 *   "COMBINED_URL": "combined.urlbl.example.com",
 *   "COMBINED_DNSBL": { "list1.dnsbl.example.com": "127.0.1.2" },
 *   "COMBINED_DNSBL_REVERSE": { "127.0.1.2": "list1.dnsbl.example.com" },
 *   "COMBINED_URLBL": { },
 *   "COMBINED_URLBL_REVERSE": { }
 * }
 * </pre>
 * Absent keys are empty. Instances are immutable.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CombinedListConfig {

    private static final Logger LOGGER = Logger.getLogger(CombinedListConfig.class.getName());

    /** Default location of the configuration file. */
    public static final String DEFAULT_PATH = "/etc/combined_lists.json";

    /** System property overriding the configuration file location. */
    public static final String PATH_PROPERTY = "dnscache.combinedLists";

    private static final CombinedListConfig EMPTY = new CombinedListConfig(null, null, null, null, null, null);

    private final String combined;
    private final String combinedURL;
    private final Map<String, String> dnsbl;
    private final Map<String, String> dnsblReverse;
    private final Map<String, String> urlbl;
    private final Map<String, String> urlblReverse;

    /**
     * Creates a configuration. Null arguments are treated as empty.
     *
     * @param combined the combined DNSBL zone
     * @param combinedURL the combined URLBL zone
     * @param dnsbl list domain to combined answer value, for DNSBLs
     * @param dnsblReverse combined answer value to list domain, for DNSBLs
     * @param urlbl list domain to combined answer value, for URLBLs
     * @param urlblReverse combined answer value to list domain, for URLBLs
     */
    @JsonCreator
    public CombinedListConfig(@JsonProperty("COMBINED") String combined,
                              @JsonProperty("COMBINED_URL") String combinedURL,
                              @JsonProperty("COMBINED_DNSBL") Map<String, String> dnsbl,
                              @JsonProperty("COMBINED_DNSBL_REVERSE") Map<String, String> dnsblReverse,
                              @JsonProperty("COMBINED_URLBL") Map<String, String> urlbl,
                              @JsonProperty("COMBINED_URLBL_REVERSE") Map<String, String> urlblReverse) {
        this.combined = combined == null ? "" : combined;
        this.combinedURL = combinedURL == null ? "" : combinedURL;
        this.dnsbl = copy(dnsbl);
        this.dnsblReverse = copy(dnsblReverse);
        this.urlbl = copy(urlbl);
        this.urlblReverse = copy(urlblReverse);
    }

    private static Map<String, String> copy(Map<String, String> map) {
        if (map == null || map.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    /**
     * Returns a configuration with no combined lists.
     *
     * @return the empty configuration
     */
    public static CombinedListConfig empty() {
        return EMPTY;
    }

    /**
     * Loads the configuration from the location named by the
     * {@value #PATH_PROPERTY} system property, or {@value #DEFAULT_PATH}.
     *
     * @return the configuration
     */
    public static CombinedListConfig load() {
        return load(Paths.get(System.getProperty(PATH_PROPERTY, DEFAULT_PATH)));
    }

    /**
     * Loads the configuration from a file.
     * A missing file yields the empty configuration. A file that cannot
     * be read or parsed is logged and also yields the empty configuration.
     *
     * @param path the JSON file
     * @return the configuration
     */
    public static CombinedListConfig load(Path path) {
        if (!Files.exists(path)) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(DNSCache.L10N.getString("debug.no_config"), path));
            }
            return EMPTY;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            CombinedListConfig config = new ObjectMapper().readValue(reader, CombinedListConfig.class);
            return config == null ? EMPTY : config;
        } catch (IOException e) {
            String msg = MessageFormat.format(DNSCache.L10N.getString("warn.bad_config"), path);
            LOGGER.log(Level.WARNING, msg, e);
            return EMPTY;
        }
    }

    @JsonProperty("COMBINED")
    public String getCombined() {
        return combined;
    }

    @JsonProperty("COMBINED_URL")
    public String getCombinedURL() {
        return combinedURL;
    }

    @JsonProperty("COMBINED_DNSBL")
    public Map<String, String> getDNSBL() {
        return dnsbl;
    }

    @JsonProperty("COMBINED_DNSBL_REVERSE")
    public Map<String, String> getDNSBLReverse() {
        return dnsblReverse;
    }

    @JsonProperty("COMBINED_URLBL")
    public Map<String, String> getURLBL() {
        return urlbl;
    }

    @JsonProperty("COMBINED_URLBL_REVERSE")
    public Map<String, String> getURLBLReverse() {
        return urlblReverse;
    }

    /**
     * Returns true if DNSBL queries for the given list domain can be
     * answered from the combined DNSBL zone.
     *
     * @param listDomain a four-label list domain
     * @return true if the list is combined and a combined zone is set
     */
    public boolean isCombinedDNSBL(String listDomain) {
        return !combined.isEmpty() && dnsblReverse.containsValue(listDomain);
    }

    /**
     * Returns true if URLBL queries for the given list domain can be
     * answered from the combined URLBL zone.
     *
     * @param listDomain a four-label list domain
     * @return true if the list is combined and a combined zone is set
     */
    public boolean isCombinedURLBL(String listDomain) {
        return !combinedURL.isEmpty() && urlblReverse.containsValue(listDomain);
    }

    @Override
    public String toString() {
        return "CombinedListConfig{combined=" + combined +
               ", combinedURL=" + combinedURL +
               ", dnsbl=" + dnsblReverse.size() +
               ", urlbl=" + urlblReverse.size() + "}";
    }

}

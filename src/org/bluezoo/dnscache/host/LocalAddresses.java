/*
 * LocalAddresses.java
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

package org.bluezoo.dnscache.host;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.GroupPrincipal;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.text.MessageFormat;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import org.bluezoo.dnscache.util.IPAddresses;

/**
 * Enumerates the IP addresses this machine is using.
 *
 * <p>The addresses are those of the local network interfaces: IPv4
 * addresses other than {@code 127.0.0.1}, and IPv6 addresses of global
 * scope. Optionally the address under which this machine is seen from
 * outside is fetched from an HTTP endpoint that returns it as text.
 *
 * <p>The result is kept in a cache file shared by the processes (and
 * system users) of the installation. A cache younger than 24 hours is
 * used as is. When the cache file is first created it is made group
 * writable and given to a shared group.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LocalAddresses {

    private static final Logger LOGGER = Logger.getLogger(LocalAddresses.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.dnscache.host.L10N");

    /** Maximum age of a usable cache file, in milliseconds. */
    public static final long CACHE_MAX_AGE_MS = 24L * 60L * 60L * 1000L;

    /** Group given to newly created cache files by default. */
    public static final String DEFAULT_CACHE_GROUP = "Debian-exim";

    static final String USER_AGENT = "dnscache/1.0";
    private static final Duration EXTERNAL_TIMEOUT = Duration.ofSeconds(5);
    private static final String MAPPED_PREFIX = "::ffff:";

    private final OkHttpClient client;
    private final String cacheGroup;

    /**
     * Creates an enumerator with the default HTTP client and cache group.
     */
    public LocalAddresses() {
        this(new OkHttpClient.Builder()
                .connectTimeout(EXTERNAL_TIMEOUT)
                .readTimeout(EXTERNAL_TIMEOUT)
                .callTimeout(EXTERNAL_TIMEOUT)
                .build(), DEFAULT_CACHE_GROUP);
    }

    /**
     * Creates an enumerator.
     *
     * @param client the HTTP client used to fetch the external address
     * @param cacheGroup the group given to newly created cache files, or
     *        null to leave the group unchanged
     */
    public LocalAddresses(OkHttpClient client, String cacheGroup) {
        this.client = client;
        this.cacheGroup = cacheGroup;
    }

    /**
     * Returns the addresses of this machine.
     *
     * @param cacheFile the cache file
     * @param externalLink URL of an endpoint returning this machine's
     *        external address, or null
     * @param useCached whether a fresh cache file may be used
     * @return the distinct addresses, in text form
     */
    public List<String> getAddresses(Path cacheFile, String externalLink, boolean useCached) {
        if (useCached) {
            List<String> cached = readCache(cacheFile);
            if (cached != null) {
                return cached;
            }
        }
        Set<String> addresses = new LinkedHashSet<>();
        try {
            addresses.addAll(interfaceAddresses());
        } catch (SocketException e) {
            LOGGER.log(Level.WARNING, L10N.getString("warn.interfaces"), e);
        }
        if (externalLink != null) {
            String external = fetchExternalAddress(externalLink);
            if (external != null) {
                addresses.add(external);
            }
        }
        List<String> result = new ArrayList<>(addresses);
        if (LOGGER.isLoggable(Level.INFO)) {
            LOGGER.info(MessageFormat.format(L10N.getString("info.local_addresses"), String.join(", ", result)));
        }
        writeCache(cacheFile, result);
        return result;
    }

    /**
     * Returns the addresses of the local network interfaces.
     *
     * @return IPv4 addresses except 127.0.0.1 and global IPv6 addresses
     * @throws SocketException if the interfaces cannot be enumerated
     */
    protected Collection<String> interfaceAddresses() throws SocketException {
        List<String> addresses = new ArrayList<>();
        Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
        if (interfaces == null) {
            return addresses;
        }
        for (NetworkInterface ni : Collections.list(interfaces)) {
            for (InetAddress address : Collections.list(ni.getInetAddresses())) {
                if (address instanceof Inet4Address) {
                    String text = IPAddresses.toText(address);
                    if (!"127.0.0.1".equals(text)) {
                        addresses.add(text);
                    }
                } else if (address instanceof Inet6Address && isGlobal(address)) {
                    addresses.add(IPAddresses.toText(address));
                }
            }
        }
        return addresses;
    }

    private static boolean isGlobal(InetAddress address) {
        return !address.isLoopbackAddress() &&
               !address.isLinkLocalAddress() &&
               !address.isSiteLocalAddress() &&
               !address.isAnyLocalAddress() &&
               !address.isMulticastAddress();
    }

    /**
     * Fetches this machine's external address.
     *
     * @param externalLink the endpoint URL
     * @return the address text, or null if it could not be retrieved
     */
    String fetchExternalAddress(String externalLink) {
        Request request;
        try {
            request = new Request.Builder()
                    .url(externalLink)
                    .header("User-Agent", USER_AGENT)
                    .get()
                    .build();
        } catch (IllegalArgumentException e) {
            String msg = MessageFormat.format(L10N.getString("warn.external_address"), externalLink, e.getMessage());
            LOGGER.warning(msg);
            return null;
        }
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                String msg = MessageFormat.format(L10N.getString("warn.external_address"), externalLink,
                        response.code() + " " + response.message());
                LOGGER.warning(msg);
                return null;
            }
            String address = body.string().trim();
            if (address.startsWith(MAPPED_PREFIX)) {
                address = address.substring(address.lastIndexOf(':') + 1);
            }
            return address;
        } catch (IOException e) {
            String msg = MessageFormat.format(L10N.getString("warn.external_address"), externalLink, e.getMessage());
            LOGGER.log(Level.WARNING, msg, e);
            return null;
        }
    }

    // -- Cache file --

    @SuppressWarnings("unchecked")
    private List<String> readCache(Path cacheFile) {
        long age;
        try {
            age = System.currentTimeMillis() - Files.getLastModifiedTime(cacheFile).toMillis();
        } catch (IOException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("debug.cache_unavailable"), e));
            }
            return null;
        }
        if (age >= CACHE_MAX_AGE_MS) {
            LOGGER.fine(L10N.getString("debug.cache_stale"));
            return null;
        }
        try (InputStream in = Files.newInputStream(cacheFile);
             ObjectInputStream ois = new ObjectInputStream(in)) {
            Object value = ois.readObject();
            if (!(value instanceof List)) {
                throw new IOException("Unexpected cache content: " + (value == null ? null : value.getClass()));
            }
            List<String> addresses = new ArrayList<>();
            for (Object address : (List<Object>) value) {
                addresses.add(String.valueOf(address));
            }
            LOGGER.fine(L10N.getString("debug.cache_used"));
            return addresses;
        } catch (IOException | ClassNotFoundException e) {
            LOGGER.log(Level.WARNING, L10N.getString("warn.bad_cache"), e);
            return null;
        }
    }

    private void writeCache(Path cacheFile, List<String> addresses) {
        boolean created = !Files.exists(cacheFile);
        try (OutputStream out = Files.newOutputStream(cacheFile);
             ObjectOutputStream oos = new ObjectOutputStream(out)) {
            oos.writeObject(new ArrayList<>(addresses));
        } catch (IOException e) {
            String msg = MessageFormat.format(L10N.getString("warn.write_cache"), cacheFile, e.getMessage());
            LOGGER.log(Level.WARNING, msg, e);
            return;
        }
        if (created) {
            shareCacheFile(cacheFile);
        }
    }

    /**
     * Makes a newly created cache file usable by the other system users
     * of the installation.
     */
    private void shareCacheFile(Path cacheFile) {
        try {
            Files.setPosixFilePermissions(cacheFile, PosixFilePermissions.fromString("rw-rw----"));
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            LOGGER.info(MessageFormat.format(L10N.getString("info.cache_permissions"), cacheFile, e));
        }
        if (cacheGroup == null) {
            return;
        }
        try {
            PosixFileAttributeView view = Files.getFileAttributeView(cacheFile, PosixFileAttributeView.class);
            if (view == null) {
                throw new UnsupportedOperationException("POSIX attributes not supported");
            }
            GroupPrincipal group = cacheFile.getFileSystem().getUserPrincipalLookupService()
                    .lookupPrincipalByGroupName(cacheGroup);
            view.setGroup(group);
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            LOGGER.info(MessageFormat.format(L10N.getString("info.cache_group"), cacheFile, cacheGroup, e));
        }
    }

}

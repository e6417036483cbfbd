/*
 * UDPNameResolver.java
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

package org.bluezoo.dnscache.dns.client;

import java.io.BufferedReader;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.SecureRandom;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.dnscache.dns.DNSFormatException;
import org.bluezoo.dnscache.dns.DNSMessage;
import org.bluezoo.dnscache.dns.DNSQuestion;
import org.bluezoo.dnscache.dns.DNSRecordSet;
import org.bluezoo.dnscache.dns.client.QueryResult.Status;

/**
 * Blocking DNS resolver that sends recursive queries over UDP.
 *
 * <p>Each query is sent to the configured nameservers in turn. Servers
 * that time out are tried again in later rounds while the query lifetime
 * allows; servers that fail (refusal, server failure, network errors) are
 * dropped for the rest of the query. Truncated UDP responses are retried
 * over TCP against the same server.
 *
 * <p>Example usage:
 * <pre><code>
 * UDPNameResolver resolver = new UDPNameResolver();
 * resolver.useSystemResolvers();
 * QueryResult result = resolver.query(
 *         new DNSQuestion("example.com", DNSType.MX), 10000L);
 * if (result.isSuccess()) {
 *     for (DNSResourceRecord rr : result.getResponse().getAnswers()) {
 *         // ...
 *     }
 * }
 * </code></pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class UDPNameResolver implements NameResolver {

    private static final Logger LOGGER = Logger.getLogger(UDPNameResolver.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.dnscache.dns.client.L10N");

    /** System property overriding the upstream nameservers. */
    public static final String NAMESERVER_PROPERTY = "dnscache.nameserver";

    private static final int DEFAULT_PORT = 53;
    private static final long ATTEMPT_TIMEOUT_MS = 2000L;
    private static final int MAX_UDP_SIZE = 65535;

    private final List<InetSocketAddress> servers;
    private final Random random;

    /**
     * Creates a new resolver with no servers configured.
     * Call {@link #addServer(String)} or {@link #useSystemResolvers()}
     * before querying.
     */
    public UDPNameResolver() {
        this.servers = new ArrayList<>();
        this.random = new SecureRandom();
    }

    // -- Configuration --

    /**
     * Adds a nameserver by IP address or hostname, on the default port.
     *
     * @param server the server address
     * @throws UnknownHostException if the hostname cannot be resolved
     */
    public void addServer(String server) throws UnknownHostException {
        addServer(InetAddress.getByName(server), DEFAULT_PORT);
    }

    /**
     * Adds a nameserver.
     *
     * @param address the server address
     * @param port the port number
     */
    public void addServer(InetAddress address, int port) {
        servers.add(new InetSocketAddress(address, port));
    }

    /**
     * Returns the configured nameservers.
     *
     * @return unmodifiable list of servers
     */
    public List<InetSocketAddress> getServers() {
        return Collections.unmodifiableList(servers);
    }

    /**
     * Adds the system's default nameservers.
     * If the system property {@value #NAMESERVER_PROPERTY} is set, the
     * servers it lists (separated by spaces or commas) are used. Otherwise
     * this reads from /etc/resolv.conf on Unix-like systems, falling back
     * to well-known public resolvers if none are found.
     */
    public void useSystemResolvers() {
        String override = System.getProperty(NAMESERVER_PROPERTY);
        if (override != null && !override.trim().isEmpty()) {
            for (String addr : override.trim().split("[\\s,]+")) {
                try {
                    addServer(addr);
                } catch (UnknownHostException e) {
                    String msg = MessageFormat.format(L10N.getString("err.invalid_nameserver_property"), addr);
                    LOGGER.log(Level.WARNING, msg, e);
                }
            }
            if (!servers.isEmpty()) {
                return;
            }
        }
        Path resolvConf = Paths.get("/etc/resolv.conf");
        if (Files.exists(resolvConf)) {
            try (BufferedReader reader = Files.newBufferedReader(resolvConf)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    line = line.trim();
                    if (line.startsWith("nameserver ")) {
                        String addr = line.substring(11).trim();
                        int scope = addr.indexOf('%');
                        if (scope >= 0) {
                            addr = addr.substring(0, scope);
                        }
                        try {
                            addServer(addr);
                        } catch (UnknownHostException e) {
                            String msg = MessageFormat.format(L10N.getString("err.invalid_nameserver"), addr);
                            LOGGER.log(Level.FINE, msg, e);
                        }
                    }
                }
            } catch (IOException e) {
                LOGGER.log(Level.FINE, L10N.getString("err.read_resolv_conf"), e);
            }
        }
        if (servers.isEmpty()) {
            try {
                addServer("8.8.8.8");      // Google
                addServer("1.1.1.1");      // Cloudflare
            } catch (UnknownHostException e) {
                // Not possible for IP address literals
                throw new IllegalStateException(e);
            }
        }
    }

    @Override
    public NameResolver forServers(List<InetAddress> nameservers) {
        UDPNameResolver resolver = new UDPNameResolver();
        for (InetAddress address : nameservers) {
            resolver.addServer(address, DEFAULT_PORT);
        }
        return resolver;
    }

    // -- Query --

    @Override
    public QueryResult query(DNSQuestion question, long lifetimeMs) {
        if (lifetimeMs <= 0) {
            throw new IllegalArgumentException("lifetime must be positive: " + lifetimeMs);
        }
        if (servers.isEmpty()) {
            return QueryResult.failure(question, Status.NO_NAMESERVERS, L10N.getString("err.no_dns_servers"));
        }
        int queryId = random.nextInt(0x10000);
        ByteBuffer serialized;
        try {
            serialized = DNSMessage.createQuery(queryId, question).serialize();
        } catch (IllegalArgumentException e) {
            return QueryResult.failure(question, Status.MALFORMED, e.getMessage());
        }
        byte[] queryData = new byte[serialized.remaining()];
        serialized.get(queryData);

        long deadline = System.currentTimeMillis() + lifetimeMs;
        List<InetSocketAddress> live = new ArrayList<>(servers);
        List<String> errors = new ArrayList<>();
        while (!live.isEmpty()) {
            for (int i = 0; i < live.size(); ) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    String msg = MessageFormat.format(L10N.getString("err.query_timeout"), question, lifetimeMs);
                    return QueryResult.failure(question, Status.TIMEOUT, msg);
                }
                InetSocketAddress server = live.get(i);
                DNSMessage response;
                try {
                    response = exchange(server, queryData, queryId, question,
                            Math.min(ATTEMPT_TIMEOUT_MS, remaining));
                } catch (SocketTimeoutException e) {
                    i++;
                    continue;
                } catch (IOException e) {
                    errors.add(server + ": " + e.getMessage());
                    live.remove(i);
                    continue;
                } catch (DNSFormatException e) {
                    return QueryResult.failure(question, Status.MALFORMED, e.getMessage());
                }
                int rcode = response.getRcode();
                if (rcode == DNSMessage.RCODE_NXDOMAIN) {
                    return QueryResult.failure(question, Status.NXDOMAIN,
                            MessageFormat.format(L10N.getString("err.nxdomain"), question.getName()));
                }
                if (rcode == DNSMessage.RCODE_NOERROR) {
                    DNSRecordSet answer = response.findAnswer(question);
                    if (answer == null) {
                        return QueryResult.noAnswer(question, response);
                    }
                    return QueryResult.success(question, response);
                }
                errors.add(server + ": rcode " + rcode);
                live.remove(i);
            }
        }
        String msg = MessageFormat.format(L10N.getString("err.no_nameservers"), question, errors);
        return QueryResult.failure(question, Status.NO_NAMESERVERS, msg);
    }

    /**
     * Sends the query to one server and waits for the matching response.
     * Datagrams with the wrong ID or question are ignored.
     */
    private DNSMessage exchange(InetSocketAddress server, byte[] queryData, int queryId,
                                DNSQuestion question, long timeoutMs)
            throws IOException, DNSFormatException {
        long attemptDeadline = System.currentTimeMillis() + timeoutMs;
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.connect(server);
            socket.send(new DatagramPacket(queryData, queryData.length));
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(L10N.getString("debug.sent_query"), question, server, queryId);
                LOGGER.fine(msg);
            }
            byte[] buf = new byte[MAX_UDP_SIZE];
            while (true) {
                long remaining = attemptDeadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    throw new SocketTimeoutException();
                }
                socket.setSoTimeout((int) Math.max(1L, remaining));
                DatagramPacket packet = new DatagramPacket(buf, buf.length);
                socket.receive(packet);
                DNSMessage response = DNSMessage.parse(ByteBuffer.wrap(buf, 0, packet.getLength()));
                if (!isReplyTo(response, queryId, question)) {
                    if (LOGGER.isLoggable(Level.FINE)) {
                        String msg = MessageFormat.format(L10N.getString("debug.received_response_unknown"),
                                response.getId());
                        LOGGER.fine(msg);
                    }
                    continue;
                }
                if (response.isTruncated()) {
                    return exchangeTCP(server, queryData, queryId, question, remaining);
                }
                if (LOGGER.isLoggable(Level.FINE)) {
                    String msg = MessageFormat.format(L10N.getString("debug.received_response"),
                            question, response.getAnswers().size());
                    LOGGER.fine(msg);
                }
                return response;
            }
        }
    }

    private DNSMessage exchangeTCP(InetSocketAddress server, byte[] queryData, int queryId,
                                   DNSQuestion question, long timeoutMs)
            throws IOException, DNSFormatException {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("debug.tcp_retry"), question, server));
        }
        try (Socket socket = new Socket()) {
            socket.connect(server, (int) Math.max(1L, timeoutMs));
            socket.setSoTimeout((int) Math.max(1L, timeoutMs));
            DataOutputStream out = new DataOutputStream(socket.getOutputStream());
            out.writeShort(queryData.length);
            out.write(queryData);
            out.flush();
            DataInputStream in = new DataInputStream(socket.getInputStream());
            int length = in.readUnsignedShort();
            byte[] buf = new byte[length];
            in.readFully(buf);
            DNSMessage response = DNSMessage.parse(ByteBuffer.wrap(buf));
            if (!isReplyTo(response, queryId, question)) {
                throw new DNSFormatException(MessageFormat.format(
                        L10N.getString("err.mismatched_response"), question, response.getId()));
            }
            return response;
        }
    }

    private static boolean isReplyTo(DNSMessage response, int queryId, DNSQuestion question) {
        if (!response.isResponse() || response.getId() != queryId) {
            return false;
        }
        List<DNSQuestion> questions = response.getQuestions();
        return questions.isEmpty() || questions.get(0).equals(question);
    }

}

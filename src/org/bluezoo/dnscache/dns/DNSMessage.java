/*
 * DNSMessage.java
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

package org.bluezoo.dnscache.dns;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A DNS protocol message.
 *
 * <p>DNS messages are used for both queries and responses. The message
 * consists of a header followed by question, answer, authority, and
 * additional sections.
 *
 * <p>See RFC 1035 for the DNS protocol specification.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DNSMessage {

    // -- Header flags --

    /** Query/Response flag: 0 = query, 1 = response */
    public static final int FLAG_QR = 0x8000;

    /** Truncation flag */
    public static final int FLAG_TC = 0x0200;

    /** Recursion Desired flag */
    public static final int FLAG_RD = 0x0100;

    /** Recursion Available flag */
    public static final int FLAG_RA = 0x0080;

    // -- RCODE values (bits 0-3 of flags) --

    /** No error */
    public static final int RCODE_NOERROR = 0;

    /** Server failure */
    public static final int RCODE_SERVFAIL = 2;

    /** Non-existent domain */
    public static final int RCODE_NXDOMAIN = 3;

    /** Query refused */
    public static final int RCODE_REFUSED = 5;

    private static final int HEADER_SIZE = 12;
    private static final int COMPRESSION_MASK = 0xC0;
    private static final int COMPRESSION_POINTER = 0xC0;
    private static final int MAX_JUMPS = 10;

    private final int id;
    private final int flags;
    private final List<DNSQuestion> questions;
    private final List<DNSResourceRecord> answers;
    private final List<DNSResourceRecord> authorities;
    private final List<DNSResourceRecord> additionals;

    /**
     * Creates a new DNS message.
     *
     * @param id the message ID
     * @param flags the header flags
     * @param questions the question section
     * @param answers the answer section
     * @param authorities the authority section
     * @param additionals the additional section
     */
    public DNSMessage(int id, int flags,
                      List<DNSQuestion> questions,
                      List<DNSResourceRecord> answers,
                      List<DNSResourceRecord> authorities,
                      List<DNSResourceRecord> additionals) {
        this.id = id & 0xFFFF;
        this.flags = flags & 0xFFFF;
        this.questions = Collections.unmodifiableList(new ArrayList<>(questions));
        this.answers = Collections.unmodifiableList(new ArrayList<>(answers));
        this.authorities = Collections.unmodifiableList(new ArrayList<>(authorities));
        this.additionals = Collections.unmodifiableList(new ArrayList<>(additionals));
    }

    /**
     * Returns the message ID.
     *
     * @return the message ID (0-65535)
     */
    public int getId() {
        return id;
    }

    /**
     * Returns the header flags.
     *
     * @return the flags
     */
    public int getFlags() {
        return flags;
    }

    /**
     * Returns true if this is a response message.
     *
     * @return true if response, false if query
     */
    public boolean isResponse() {
        return (flags & FLAG_QR) != 0;
    }

    /**
     * Returns true if the message was truncated.
     *
     * @return true if truncated
     */
    public boolean isTruncated() {
        return (flags & FLAG_TC) != 0;
    }

    /**
     * Returns true if Recursion Desired is set.
     *
     * @return true if recursion is desired
     */
    public boolean isRecursionDesired() {
        return (flags & FLAG_RD) != 0;
    }

    /**
     * Returns the RCODE (response code).
     *
     * @return the response code (0-15)
     */
    public int getRcode() {
        return flags & 0x0F;
    }

    /**
     * Returns the question section.
     *
     * @return unmodifiable list of questions
     */
    public List<DNSQuestion> getQuestions() {
        return questions;
    }

    /**
     * Returns the answer section.
     *
     * @return unmodifiable list of answers
     */
    public List<DNSResourceRecord> getAnswers() {
        return answers;
    }

    /**
     * Returns the authority section.
     *
     * @return unmodifiable list of authority records
     */
    public List<DNSResourceRecord> getAuthorities() {
        return authorities;
    }

    /**
     * Returns the additional section.
     *
     * @return unmodifiable list of additional records
     */
    public List<DNSResourceRecord> getAdditionals() {
        return additionals;
    }

    /**
     * Returns the answer section grouped into record sets.
     *
     * @return the answer record sets, in order of first appearance
     */
    public List<DNSRecordSet> getAnswerSets() {
        return DNSRecordSet.group(answers);
    }

    /**
     * Returns the additional section grouped into record sets.
     *
     * @return the additional record sets, in order of first appearance
     */
    public List<DNSRecordSet> getAdditionalSets() {
        return DNSRecordSet.group(additionals);
    }

    /**
     * Returns the answer record set that answers the given question,
     * following any CNAME chain contained in the answer section.
     *
     * @param question the question asked
     * @return the matching record set, or null if the answer section
     *         holds no data of the requested type for the name
     */
    public DNSRecordSet findAnswer(DNSQuestion question) {
        List<DNSRecordSet> sets = getAnswerSets();
        String owner = question.getName();
        for (int depth = 0; depth <= sets.size(); depth++) {
            DNSRecordSet alias = null;
            for (DNSRecordSet set : sets) {
                if (!DNSQuestion.sameName(set.getName(), owner)
                        || set.getDNSClass() != question.getDNSClass()) {
                    continue;
                }
                if (set.getType() == question.getType()) {
                    return set;
                }
                if (set.getType() == DNSType.CNAME) {
                    alias = set;
                }
            }
            if (alias == null) {
                return null;
            }
            owner = alias.getRecords().get(0).getTargetName();
        }
        return null;
    }

    // -- Parsing --

    /**
     * Parses a DNS message from a byte buffer.
     *
     * <p>Records of types this library does not model are skipped.
     *
     * @param data the buffer containing the DNS message
     * @return the parsed message
     * @throws DNSFormatException if the message is malformed
     */
    public static DNSMessage parse(ByteBuffer data) throws DNSFormatException {
        if (data.remaining() < HEADER_SIZE) {
            throw new DNSFormatException("Message too short for header");
        }
        ByteBuffer original = data.duplicate();
        try {
            int id = data.getShort() & 0xFFFF;
            int flags = data.getShort() & 0xFFFF;
            int qdCount = data.getShort() & 0xFFFF;
            int anCount = data.getShort() & 0xFFFF;
            int nsCount = data.getShort() & 0xFFFF;
            int arCount = data.getShort() & 0xFFFF;

            List<DNSQuestion> questions = new ArrayList<>(qdCount);
            for (int i = 0; i < qdCount; i++) {
                questions.add(parseQuestion(data, original));
            }
            List<DNSResourceRecord> answers = parseSection(data, original, anCount);
            List<DNSResourceRecord> authorities = parseSection(data, original, nsCount);
            List<DNSResourceRecord> additionals = parseSection(data, original, arCount);
            return new DNSMessage(id, flags, questions, answers, authorities, additionals);
        } catch (BufferUnderflowException | IllegalArgumentException | IllegalStateException e) {
            throw new DNSFormatException("Malformed message: " + e.getMessage(), e);
        }
    }

    private static List<DNSResourceRecord> parseSection(ByteBuffer data, ByteBuffer original, int count)
            throws DNSFormatException {
        List<DNSResourceRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            DNSResourceRecord record = parseResourceRecord(data, original);
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }

    private static DNSQuestion parseQuestion(ByteBuffer data, ByteBuffer original) throws DNSFormatException {
        String name = decodeName(data, original);
        if (data.remaining() < 4) {
            throw new DNSFormatException("Truncated question");
        }
        int typeValue = data.getShort() & 0xFFFF;
        int classValue = data.getShort() & 0xFFFF;

        DNSType type = DNSType.fromValue(typeValue);
        if (type == null) {
            throw new DNSFormatException("Unknown type: " + typeValue);
        }
        DNSClass dnsClass = DNSClass.fromValue(classValue);
        if (dnsClass == null) {
            throw new DNSFormatException("Unknown class: " + classValue);
        }
        return new DNSQuestion(name, type, dnsClass);
    }

    private static DNSResourceRecord parseResourceRecord(ByteBuffer data, ByteBuffer original)
            throws DNSFormatException {
        String name = decodeName(data, original);
        if (data.remaining() < 10) {
            throw new DNSFormatException("Truncated resource record");
        }
        int typeValue = data.getShort() & 0xFFFF;
        int classValue = data.getShort() & 0xFFFF;
        int ttl = data.getInt();
        int rdLength = data.getShort() & 0xFFFF;
        if (data.remaining() < rdLength) {
            throw new DNSFormatException("Truncated RDATA");
        }

        // Name-bearing RDATA may use compression pointers into the
        // message, so expand those names before storing the record.
        int rdStart = data.position();
        DNSType type = DNSType.fromValue(typeValue);
        DNSClass dnsClass = DNSClass.fromValue(classValue);
        byte[] rdata;
        if (type == DNSType.NS || type == DNSType.CNAME || type == DNSType.PTR) {
            rdata = encodeName(decodeName(data, original));
        } else if (type == DNSType.MX) {
            int preference = data.getShort() & 0xFFFF;
            byte[] exchange = encodeName(decodeName(data, original));
            rdata = ByteBuffer.allocate(2 + exchange.length)
                    .putShort((short) preference).put(exchange).array();
        } else if (type == DNSType.SOA) {
            byte[] mname = encodeName(decodeName(data, original));
            byte[] rname = encodeName(decodeName(data, original));
            byte[] counters = new byte[20];
            data.get(counters);
            rdata = ByteBuffer.allocate(mname.length + rname.length + 20)
                    .put(mname).put(rname).put(counters).array();
        } else {
            rdata = new byte[rdLength];
            data.get(rdata);
        }
        data.position(rdStart + rdLength);

        if (type == null || dnsClass == null) {
            return null;
        }
        return new DNSResourceRecord(name, type, dnsClass, ttl, rdata);
    }

    /**
     * Decodes a DNS name from the buffer.
     * Handles compression pointers.
     *
     * @param data the current read position
     * @param original the original message for pointer resolution
     * @return the decoded domain name, without trailing dot
     * @throws IllegalStateException if the compression pointers loop
     */
    static String decodeName(ByteBuffer data, ByteBuffer original) {
        return decodeName(data, original, 0);
    }

    private static String decodeName(ByteBuffer data, ByteBuffer original, int jumps) {
        StringBuilder name = new StringBuilder();
        while (data.hasRemaining()) {
            int len = data.get() & 0xFF;
            if (len == 0) {
                break;
            }
            if ((len & COMPRESSION_MASK) == COMPRESSION_POINTER) {
                if (!data.hasRemaining()) {
                    break;
                }
                int offset = ((len & 0x3F) << 8) | (data.get() & 0xFF);
                if (jumps + 1 > MAX_JUMPS) {
                    throw new IllegalStateException("Too many compression pointers");
                }
                ByteBuffer pointer = original.duplicate();
                pointer.position(offset);
                String rest = decodeName(pointer, original, jumps + 1);
                if (name.length() > 0 && !rest.isEmpty()) {
                    name.append('.');
                }
                name.append(rest);
                break;
            }
            if (data.remaining() < len) {
                throw new IllegalStateException("Truncated label");
            }
            byte[] label = new byte[len];
            data.get(label);
            if (name.length() > 0) {
                name.append('.');
            }
            name.append(new String(label, StandardCharsets.US_ASCII));
        }
        return name.toString();
    }

    /**
     * Encodes a domain name to DNS wire format.
     *
     * @param name the domain name
     * @return the encoded bytes
     * @throws IllegalArgumentException if a label is empty or too long
     */
    static byte[] encodeName(String name) {
        if (name == null || name.isEmpty() || name.equals(".")) {
            return new byte[] { 0 };
        }
        if (name.endsWith(".")) {
            name = name.substring(0, name.length() - 1);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int start = 0;
        int len = name.length();
        while (start < len) {
            int dotIndex = name.indexOf('.', start);
            String label;
            if (dotIndex < 0) {
                label = name.substring(start);
                start = len;
            } else {
                label = name.substring(start, dotIndex);
                start = dotIndex + 1;
            }
            byte[] bytes = label.getBytes(StandardCharsets.US_ASCII);
            if (bytes.length == 0) {
                throw new IllegalArgumentException("Empty label in: " + name);
            }
            if (bytes.length > 63) {
                throw new IllegalArgumentException("Label too long: " + label);
            }
            out.write(bytes.length);
            out.write(bytes, 0, bytes.length);
        }
        out.write(0);
        return out.toByteArray();
    }

    // -- Serialization --

    /**
     * Serializes this message to a byte buffer.
     *
     * @return the serialized message
     * @throws IllegalArgumentException if a name cannot be encoded
     */
    public ByteBuffer serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        writeShort(out, id);
        writeShort(out, flags);
        writeShort(out, questions.size());
        writeShort(out, answers.size());
        writeShort(out, authorities.size());
        writeShort(out, additionals.size());

        for (DNSQuestion q : questions) {
            byte[] name = encodeName(q.getName());
            out.write(name, 0, name.length);
            writeShort(out, q.getType().getValue());
            writeShort(out, q.getDNSClass().getValue());
        }
        for (DNSResourceRecord rr : answers) {
            writeResourceRecord(out, rr);
        }
        for (DNSResourceRecord rr : authorities) {
            writeResourceRecord(out, rr);
        }
        for (DNSResourceRecord rr : additionals) {
            writeResourceRecord(out, rr);
        }
        return ByteBuffer.wrap(out.toByteArray());
    }

    private static void writeShort(ByteArrayOutputStream out, int value) {
        out.write((value >> 8) & 0xFF);
        out.write(value & 0xFF);
    }

    private static void writeInt(ByteArrayOutputStream out, int value) {
        out.write((value >> 24) & 0xFF);
        out.write((value >> 16) & 0xFF);
        out.write((value >> 8) & 0xFF);
        out.write(value & 0xFF);
    }

    private static void writeResourceRecord(ByteArrayOutputStream out, DNSResourceRecord rr) {
        byte[] name = encodeName(rr.getName());
        out.write(name, 0, name.length);
        writeShort(out, rr.getType().getValue());
        writeShort(out, rr.getDNSClass().getValue());
        writeInt(out, rr.getTTL());
        byte[] rdata = rr.getRData();
        writeShort(out, rdata.length);
        out.write(rdata, 0, rdata.length);
    }

    // -- Factory methods --

    /**
     * Creates a new recursive query message.
     *
     * @param id the message ID
     * @param question the question to ask
     * @return the query message
     */
    public static DNSMessage createQuery(int id, DNSQuestion question) {
        List<DNSResourceRecord> emptyList = Collections.emptyList();
        return new DNSMessage(id, FLAG_RD, Collections.singletonList(question),
                emptyList, emptyList, emptyList);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("DNSMessage{id=");
        sb.append(id);
        sb.append(", ");
        sb.append(isResponse() ? "RESPONSE" : "QUERY");
        if (isResponse()) {
            sb.append(", rcode=");
            sb.append(getRcode());
        }
        if (isTruncated()) {
            sb.append(", TC");
        }
        sb.append(", questions=");
        sb.append(questions.size());
        sb.append(", answers=");
        sb.append(answers.size());
        sb.append(", authorities=");
        sb.append(authorities.size());
        sb.append(", additionals=");
        sb.append(additionals.size());
        sb.append("}");
        return sb.toString();
    }

}

/*
 * QueryResult.java
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

import org.bluezoo.dnscache.dns.DNSMessage;
import org.bluezoo.dnscache.dns.DNSQuestion;

/**
 * The outcome of a single upstream query.
 *
 * <p>Negative outcomes are values, not exceptions: every expected failure
 * of DNS resolution is reported through {@link Status}. A
 * {@link Status#NO_ANSWER} result still carries the response, so that
 * callers interested in other record types in the answer section (for
 * example a CNAME where NS data was asked for) can inspect it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see NameResolver
 */
public final class QueryResult {

    /**
     * Classification of a query outcome.
     */
    public enum Status {

        /** The response contains data for the question. */
        SUCCESS,

        /** The name does not exist. */
        NXDOMAIN,

        /** No response arrived within the query lifetime. */
        TIMEOUT,

        /** The name exists but has no data of the requested type. */
        NO_ANSWER,

        /** No configured nameserver could answer the query. */
        NO_NAMESERVERS,

        /** A response arrived but could not be parsed. */
        MALFORMED;

    }

    private final DNSQuestion question;
    private final Status status;
    private final DNSMessage response;
    private final String detail;

    private QueryResult(DNSQuestion question, Status status, DNSMessage response, String detail) {
        this.question = question;
        this.status = status;
        this.response = response;
        this.detail = detail;
    }

    /**
     * Creates a successful result.
     *
     * @param question the question asked
     * @param response the response received
     * @return the result
     */
    public static QueryResult success(DNSQuestion question, DNSMessage response) {
        return new QueryResult(question, Status.SUCCESS, response, null);
    }

    /**
     * Creates a no-answer result, keeping the response that had no data.
     *
     * @param question the question asked
     * @param response the response received
     * @return the result
     */
    public static QueryResult noAnswer(DNSQuestion question, DNSMessage response) {
        return new QueryResult(question, Status.NO_ANSWER, response,
                "The DNS response does not contain an answer to the question: " + question);
    }

    /**
     * Creates a negative result without a usable response.
     *
     * @param question the question asked
     * @param status the failure classification
     * @param detail a human readable description of the failure
     * @return the result
     */
    public static QueryResult failure(DNSQuestion question, Status status, String detail) {
        if (status == Status.SUCCESS) {
            throw new IllegalArgumentException(String.valueOf(status));
        }
        return new QueryResult(question, status, null, detail);
    }

    /**
     * Returns the question this result answers.
     *
     * @return the question
     */
    public DNSQuestion getQuestion() {
        return question;
    }

    /**
     * Returns the classification of this result.
     *
     * @return the status
     */
    public Status getStatus() {
        return status;
    }

    /**
     * Returns true if the query produced an answer.
     *
     * @return true for {@link Status#SUCCESS}
     */
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * Returns the response message, if one was received and parsed.
     *
     * @return the response, or null
     */
    public DNSMessage getResponse() {
        return response;
    }

    /**
     * Returns a description of a negative outcome.
     *
     * @return the detail text, or null for successful results
     */
    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return question + ": " + status + (detail != null ? " (" + detail + ")" : "");
    }

}

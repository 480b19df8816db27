//
// ========================================================================
// Copyright (c) 1995 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//


package io.shrink.compression.server;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.QuotedQualityCSV;
import org.eclipse.jetty.util.StringUtil;

/**
 * <p>The content codings listed by the {@code Accept-Encoding} request headers,
 * with their quality values.</p>
 * <p>Values are parsed by {@link QuotedQualityCSV}: a missing quality is {@code 1.0}
 * and an unparseable quality is {@code 0}.
 * On top of that, tokens are lower-cased, the aliases {@code x-gzip} and {@code brotli}
 * are mapped to {@code gzip} and {@code br}, a quality out of range is clamped to
 * {@code [0, 1]}, and an entry with an empty token is dropped.</p>
 *
 * @see <a href="https://www.rfc-editor.org/rfc/rfc9110.html#section-12.5.3">RFC 9110, Accept-Encoding</a>
 */
public class AcceptEncoding
{
    private static final Map<String, String> ALIASES = Map.of(
        "x-gzip", "gzip",
        "brotli", "br"
    );

    private final List<Coding> codings;

    private AcceptEncoding(List<Coding> codings)
    {
        this.codings = Collections.unmodifiableList(codings);
    }

    /**
     * @param headers the request headers
     * @return the codings of all the {@code Accept-Encoding} fields
     */
    public static AcceptEncoding from(HttpFields headers)
    {
        QuotedQualityCSV qualityCSV = new QuotedQualityCSV();
        for (HttpField field : headers)
        {
            // Collect all Accept-Encoding headers.
            if (field.getHeader() == HttpHeader.ACCEPT_ENCODING)
                qualityCSV.addValue(field.getValue());
        }
        return from(qualityCSV);
    }

    /**
     * @param values the {@code Accept-Encoding} field values
     * @return the codings of the given values
     */
    public static AcceptEncoding parse(String... values)
    {
        QuotedQualityCSV qualityCSV = new QuotedQualityCSV();
        for (String value : values)
        {
            qualityCSV.addValue(value);
        }
        return from(qualityCSV);
    }

    private static AcceptEncoding from(QuotedQualityCSV qualityCSV)
    {
        List<Coding> codings = new ArrayList<>();
        for (QuotedQualityCSV.QualityValue qualityValue : qualityCSV.getQualityValues())
        {
            Coding coding = toCoding(qualityValue);
            if (coding != null)
                codings.add(coding);
        }
        return new AcceptEncoding(codings);
    }

    private static Coding toCoding(QuotedQualityCSV.QualityValue qualityValue)
    {
        // Other parameters stay attached to the value.
        String value = qualityValue.getValue();
        int semicolon = value.indexOf(';');
        String token = StringUtil.asciiToLowerCase((semicolon < 0 ? value : value.substring(0, semicolon)).trim());
        if (token.isEmpty())
            return null;
        token = ALIASES.getOrDefault(token, token);

        double quality = qualityValue.getWeight();
        if (Double.isNaN(quality))
            quality = 0.0D;
        return new Coding(token, Math.max(0.0D, Math.min(1.0D, quality)));
    }

    public boolean isEmpty()
    {
        return codings.isEmpty();
    }

    /**
     * @return the codings, in the order of {@link QuotedQualityCSV#getQualityValues()}
     */
    public List<Coding> getCodings()
    {
        return codings;
    }

    /**
     * @param token a content coding token
     * @return the quality of the first coding with that token, or {@code -1} if not listed
     */
    public double getQuality(String token)
    {
        for (Coding coding : codings)
        {
            if (coding.getToken().equals(token))
                return coding.getQuality();
        }
        return -1.0D;
    }

    /**
     * @param token a content coding token
     * @return whether the token is listed with a quality greater than zero
     */
    public boolean isAcceptable(String token)
    {
        return getQuality(token) > 0.0D;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x%s", getClass().getSimpleName(), hashCode(), codings);
    }

    /**
     * A content coding token with its quality value.
     */
    public static class Coding
    {
        private final String token;
        private final double quality;

        private Coding(String token, double quality)
        {
            this.token = token;
            this.quality = quality;
        }

        public String getToken()
        {
            return token;
        }

        public double getQuality()
        {
            return quality;
        }

        @Override
        public String toString()
        {
            return String.format("%s;q=%.3f", token, quality);
        }
    }
}

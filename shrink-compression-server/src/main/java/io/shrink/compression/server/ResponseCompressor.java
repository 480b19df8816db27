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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.shrink.compression.Compression;
import io.shrink.compression.Compressions;
import io.shrink.compression.server.internal.CompressionContentSource;
import io.shrink.compression.server.internal.CompressionState;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.io.Content;
import org.eclipse.jetty.util.StringUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Compresses response bodies according to a {@link CompressionConfig} and a set of
 * {@link Compression}s.</p>
 * <p>{@link #compress(String, HttpFields, int, HttpFields.Mutable, Content.Source)} wraps a
 * response body {@link Content.Source} that is pulled by the transport; the response headers
 * are rewritten before the returned source produces its first byte, so they must not be
 * sent before then.</p>
 * <pre>{@code
 * ResponseCompressor compressor = new ResponseCompressor(CompressionConfig.builder().defaults().build(), Compressions.getKnown());
 * Content.Source body = compressor.compress("GET", requestHeaders, 200, responseHeaders, originalBody);
 * }</pre>
 */
public class ResponseCompressor
{
    private static final Logger LOG = LoggerFactory.getLogger(ResponseCompressor.class);

    private final CompressionConfig config;
    private final Map<String, Compression> compressions;
    private final EncodingNegotiator negotiator;

    /**
     * @param config the compression configuration
     * @param compressions the compressions that may be negotiated
     * @throws IllegalArgumentException if a compression has an unsupported encoding token
     */
    public ResponseCompressor(CompressionConfig config, Collection<Compression> compressions)
    {
        this.config = Objects.requireNonNull(config);
        Map<String, Compression> map = new LinkedHashMap<>();
        for (Compression compression : compressions)
        {
            String encoding = StringUtil.asciiToLowerCase(compression.getEncodingName());
            if (!Compressions.isSupported(encoding))
                throw new IllegalArgumentException("Unsupported encoding " + encoding + " for " + compression);
            map.put(encoding, compression);
        }
        this.compressions = Collections.unmodifiableMap(map);
        this.negotiator = new EncodingNegotiator(config, this.compressions);
    }

    public CompressionConfig getConfig()
    {
        return config;
    }

    /**
     * @return the compressions that may be negotiated, keyed by lower-case encoding token
     */
    public Map<String, Compression> getCompressions()
    {
        return compressions;
    }

    /**
     * @param method the request method, or null if unknown
     * @param requestHeaders the request headers
     * @param status the response status, or {@code 0} if not yet set
     * @param responseHeaders the response headers
     * @return the decision for the response
     * @see EncodingNegotiator#negotiate(String, HttpFields, int, HttpFields)
     */
    public Decision negotiate(String method, HttpFields requestHeaders, int status, HttpFields responseHeaders)
    {
        return negotiator.negotiate(method, requestHeaders, status, responseHeaders);
    }

    /**
     * <p>Negotiates the decision for a response and wraps its body.</p>
     *
     * @param method the request method, or null if unknown
     * @param requestHeaders the request headers
     * @param status the response status, or {@code 0} if not yet set
     * @param responseHeaders the response headers, rewritten when the returned source commits its decision
     * @param body the original response body
     * @return the transformed response body
     */
    public Content.Source compress(String method, HttpFields requestHeaders, int status, HttpFields.Mutable responseHeaders, Content.Source body)
    {
        Decision decision = negotiate(method, requestHeaders, status, responseHeaders);
        long contentLength = getContentLength(responseHeaders);
        if (contentLength < 0)
            contentLength = body.getLength();
        CompressionState state = newCompressionState(decision, contentLength, responseHeaders);
        return new CompressionContentSource(body, state);
    }

    /**
     * @param decision the negotiated decision
     * @param contentLength the length of the original body, or {@code -1} if unknown
     * @param responseHeaders the response headers to rewrite at the commit point
     * @return a new state for the body of the response
     */
    public CompressionState newCompressionState(Decision decision, long contentLength, HttpFields.Mutable responseHeaders)
    {
        CompressionState state = new CompressionState(decision, contentLength, config.getMinCompressSize(),
            committed -> HeaderRewriter.apply(committed, responseHeaders));
        if (LOG.isDebugEnabled())
            LOG.debug("new {} for length {}", state, contentLength);
        return state;
    }

    /**
     * @param headers the response headers
     * @return the numeric {@code Content-Length}, or {@code -1} if absent or invalid
     */
    public static long getContentLength(HttpFields headers)
    {
        try
        {
            return headers.getLongField(HttpHeader.CONTENT_LENGTH);
        }
        catch (NumberFormatException x)
        {
            LOG.trace("IGNORED", x);
            return -1;
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,%s}", getClass().getSimpleName(), hashCode(), compressions.keySet(), config);
    }
}

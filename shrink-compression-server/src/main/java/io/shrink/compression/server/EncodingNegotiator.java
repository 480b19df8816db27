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

import java.util.Map;

import io.shrink.compression.Compression;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Computes the {@link Decision} for a response from the request and response headers.</p>
 * <p>Negotiation never fails: malformed header values are ignored and, in the worst
 * case, the response is not compressed.</p>
 */
public class EncodingNegotiator
{
    private static final Logger LOG = LoggerFactory.getLogger(EncodingNegotiator.class);

    private final CompressionConfig config;
    private final Map<String, Compression> compressions;

    /**
     * @param config the compression configuration
     * @param compressions the available compressions, keyed by lower-case encoding token
     */
    public EncodingNegotiator(CompressionConfig config, Map<String, Compression> compressions)
    {
        this.config = config;
        this.compressions = compressions;
    }

    /**
     * @param method the request method, or null if unknown
     * @param requestHeaders the request headers
     * @param status the response status, or {@code 0} if not yet set
     * @param responseHeaders the response headers, final for the purpose of negotiation
     * @return the decision for the response
     */
    public Decision negotiate(String method, HttpFields requestHeaders, int status, HttpFields responseHeaders)
    {
        String contentType = responseHeaders.get(HttpHeader.CONTENT_TYPE);
        boolean forceFlush = config.hasFlushHeader(requestHeaders) ||
            config.hasFlushHeader(responseHeaders) ||
            config.getContentTypeClassifier().isFlushType(contentType);

        if (method != null && (HttpMethod.HEAD.is(method) || !config.isCompressMethodSupported(method)))
            return skip("method " + method, forceFlush, false);

        if (status > 0 && (HttpStatus.isInformational(status) ||
            status == HttpStatus.NO_CONTENT_204 ||
            status == HttpStatus.RESET_CONTENT_205 ||
            status == HttpStatus.NOT_MODIFIED_304))
            return skip("status " + status, forceFlush, false);

        // Never encode twice.
        if (responseHeaders.contains(HttpHeader.CONTENT_ENCODING))
            return skip("explicit content encoding", forceFlush, false);

        // Range responses must stay byte-exact.
        if (responseHeaders.contains(HttpHeader.CONTENT_RANGE))
            return skip("content range", forceFlush, false);

        if (config.getContentTypeClassifier().isExcluded(contentType))
            return skip("excluded content type " + contentType, forceFlush, false);

        Compression compression = select(AcceptEncoding.from(requestHeaders));
        if (compression == null)
            return skip("no acceptable encoding", forceFlush, false);

        long contentLength = ResponseCompressor.getContentLength(responseHeaders);
        if (contentLength >= 0 && contentLength < config.getMinCompressSize())
            return skip("content length " + contentLength, forceFlush, true);

        Decision decision = Decision.compress(compression, forceFlush);
        if (LOG.isDebugEnabled())
            LOG.debug("negotiated {}", decision);
        return decision;
    }

    /**
     * <p>Selects the enabled compression with the highest quality, ties broken by the preferred order.</p>
     * <p>Only explicitly listed encodings are candidates: neither {@code identity} nor {@code *}
     * selects a compression, and a quality of zero disables a compression.</p>
     *
     * @param acceptEncoding the request codings
     * @return the selected compression, or null if none is acceptable
     */
    Compression select(AcceptEncoding acceptEncoding)
    {
        if (acceptEncoding.isEmpty())
            return null;

        Compression selected = null;
        double selectedQuality = 0.0D;
        for (String encoding : config.getCompressPreferredEncodings())
        {
            Compression compression = compressions.get(encoding);
            if (compression == null || !config.isCompressEncodingSupported(encoding))
                continue;
            double quality = acceptEncoding.getQuality(encoding);
            if (quality > selectedQuality)
            {
                selected = compression;
                selectedQuality = quality;
            }
        }
        return selected;
    }

    private Decision skip(String reason, boolean forceFlush, boolean vary)
    {
        Decision decision = Decision.skip(forceFlush, vary);
        if (LOG.isDebugEnabled())
            LOG.debug("skipping compression: {} {}", reason, decision);
        return decision;
    }
}

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


package io.shrink.compression.server.internal;

import java.nio.ByteBuffer;

import io.shrink.compression.server.Decision;
import io.shrink.compression.server.ResponseCompressor;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.BufferUtil;
import org.eclipse.jetty.util.Callback;
import org.eclipse.jetty.util.thread.Invocable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A response wrapper that transforms each written buffer through a {@link CompressionState}.</p>
 * <p>The decision is negotiated at the first write, when the response headers are final.
 * Nothing is written to the wrapped response, which commits its headers on the first write,
 * until the {@link CompressionState} has committed its decision.</p>
 * <p>This response is also the callback of the handling: when it succeeds without
 * the last write, the body is ended with an empty last write.</p>
 */
public class CompressionResponse extends Response.Wrapper implements Callback, Invocable
{
    private static final Logger LOG = LoggerFactory.getLogger(CompressionResponse.class);

    private final Callback callback;
    private final ResponseCompressor compressor;
    private CompressionState state;
    private boolean last;

    public CompressionResponse(Request request, Response wrapped, Callback callback, ResponseCompressor compressor)
    {
        super(request, wrapped);
        this.callback = callback;
        this.compressor = compressor;
    }

    @Override
    public void succeeded()
    {
        if (last)
        {
            release();
            callback.succeeded();
            return;
        }

        // End the body to flush the buffered or compressed bytes.
        write(true, null, new Callback()
        {
            @Override
            public void succeeded()
            {
                release();
                callback.succeeded();
            }

            @Override
            public void failed(Throwable x)
            {
                release();
                callback.failed(x);
            }

            @Override
            public InvocationType getInvocationType()
            {
                return callback.getInvocationType();
            }
        });
    }

    @Override
    public void failed(Throwable x)
    {
        release();
        callback.failed(x);
    }

    @Override
    public InvocationType getInvocationType()
    {
        return callback.getInvocationType();
    }

    @Override
    public void write(boolean last, ByteBuffer content, Callback callback)
    {
        CompressionState state = this.state;
        if (state == null)
        {
            Request request = getRequest();
            Decision decision = compressor.negotiate(request.getMethod(), request.getHeaders(), getStatus(), getHeaders());
            state = compressor.newCompressionState(decision, ResponseCompressor.getContentLength(getHeaders()), getHeaders());
            this.state = state;
        }

        if (last)
            this.last = true;

        boolean passthrough = state.isPassthrough();
        ByteBuffer output;
        try
        {
            output = state.process(content == null ? BufferUtil.EMPTY_BUFFER : content, last);
        }
        catch (Throwable x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("failed write {}", this, x);
            callback.failed(x);
            return;
        }

        if (passthrough)
            super.write(last, content, callback);
        else if (last || output.hasRemaining())
            super.write(last, output, callback);
        else
            callback.succeeded();
    }

    /**
     * Releases the encoder and buffer held for this response.
     */
    public void release()
    {
        CompressionState state = this.state;
        if (state != null)
            state.release();
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s]", getClass().getSimpleName(), hashCode(), state);
    }
}

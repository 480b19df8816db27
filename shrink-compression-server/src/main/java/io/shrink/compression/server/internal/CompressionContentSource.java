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

import org.eclipse.jetty.http.Trailers;
import org.eclipse.jetty.io.Content;
import org.eclipse.jetty.io.content.ContentSourceTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A {@link Content.Source} that transforms the chunks read from the original body
 * source through a {@link CompressionState}.</p>
 * <p>A {@link Trailers} chunk ending a compressed body is returned unmodified by the
 * {@code read()} that follows the one returning the last compressed bytes.</p>
 */
public class CompressionContentSource extends ContentSourceTransformer
{
    private static final Logger LOG = LoggerFactory.getLogger(CompressionContentSource.class);

    private final CompressionState state;
    private final boolean passthrough;
    private Content.Chunk trailers;
    private boolean finished;
    private volatile Content.Chunk failure;

    public CompressionContentSource(Content.Source source, CompressionState state)
    {
        super(source);
        this.state = state;
        this.passthrough = state.isPassthrough();
    }

    public CompressionState getCompressionState()
    {
        return state;
    }

    /**
     * @return the length of the original body if the response was not to be compressed
     * from the start, {@code -1} otherwise
     */
    @Override
    public long getLength()
    {
        return passthrough ? getContentSource().getLength() : -1;
    }

    @Override
    public Content.Chunk read()
    {
        Content.Chunk chunk = super.read();
        if (Content.Chunk.isFailure(chunk) && chunk.isLast())
            release();
        return chunk;
    }

    @Override
    protected Content.Chunk transform(Content.Chunk input)
    {
        Content.Chunk failure = this.failure;
        if (failure != null)
        {
            trailers = null;
            return failure;
        }

        if (trailers != null)
        {
            Content.Chunk result = trailers;
            trailers = null;
            return result;
        }

        if (finished)
            return Content.Chunk.EOF;

        if (!input.isLast() && !input.getByteBuffer().hasRemaining())
            return null;

        boolean last = input.isLast();
        if (state.isPassthrough())
        {
            finished = last;
            return input;
        }

        ByteBuffer output;
        try
        {
            output = state.process(input.getByteBuffer(), last);
        }
        catch (Throwable x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("failed to process {} {}", input, this, x);
            fail(x);
            return this.failure;
        }

        if (input instanceof Trailers)
        {
            finished = true;
            if (!output.hasRemaining())
                return input;
            trailers = input;
            return Content.Chunk.from(output, false);
        }

        if (last)
        {
            finished = true;
            return Content.Chunk.from(output, true);
        }
        return output.hasRemaining() ? Content.Chunk.from(output, false) : null;
    }

    @Override
    public void fail(Throwable failure)
    {
        if (LOG.isDebugEnabled())
            LOG.debug("failing {}", this, failure);
        if (this.failure == null)
            this.failure = Content.Chunk.from(failure);
        release();
        super.fail(failure);
    }

    /**
     * Releases the encoder and buffer of the compression state.
     */
    public void release()
    {
        state.release();
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s]", getClass().getSimpleName(), hashCode(), state);
    }
}

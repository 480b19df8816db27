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

package io.shrink.compression;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

import org.eclipse.jetty.util.BufferUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>An {@link Encoder} that adapts a library compressor exposed as a
 * {@link java.io.FilterOutputStream}-like encoder stream.</p>
 * <p>The encoder stream writes into an in-memory sink that is drained after every
 * operation, so the bytes returned by {@link #encode(ByteBuffer)}, {@link #flush()}
 * and {@link #finish()} are exactly those produced by that operation.
 * Draining hands the sink array over to the returned buffer without copying it.
 * The encoder stream is created lazily on first use, so initialization failures
 * are reported by the first operation.</p>
 */
public abstract class OutputStreamEncoder implements Encoder
{
    private static final Logger LOG = LoggerFactory.getLogger(OutputStreamEncoder.class);

    private final Sink sink;
    private OutputStream stream;
    private boolean released;

    protected OutputStreamEncoder(int bufferSize)
    {
        this.sink = new Sink(Math.max(64, bufferSize));
    }

    /**
     * @param sink the stream that receives the compressed bytes
     * @return a new encoder stream that compresses into the given sink
     * @throws IOException if the library compressor cannot be created
     */
    protected abstract OutputStream newEncoderStream(OutputStream sink) throws IOException;

    /**
     * <p>Discards the given encoder stream without finishing it.</p>
     * <p>The default implementation closes the stream, which releases any native resource.</p>
     *
     * @param stream the encoder stream to discard
     * @throws IOException if the stream cannot be discarded
     */
    protected void abort(OutputStream stream) throws IOException
    {
        stream.close();
    }

    @Override
    public ByteBuffer encode(ByteBuffer input) throws IOException
    {
        OutputStream out = ensureStream();
        if (input.hasArray())
        {
            out.write(input.array(), input.arrayOffset() + input.position(), input.remaining());
            input.position(input.limit());
        }
        else
        {
            byte[] bytes = new byte[input.remaining()];
            input.get(bytes);
            out.write(bytes);
        }
        return drain();
    }

    @Override
    public ByteBuffer flush() throws IOException
    {
        ensureStream().flush();
        return drain();
    }

    @Override
    public ByteBuffer finish() throws IOException
    {
        OutputStream out = ensureStream();
        released = true;
        stream = null;
        try
        {
            out.close();
        }
        catch (Throwable x)
        {
            discard(out);
            throw x;
        }
        return drain();
    }

    @Override
    public boolean isReleased()
    {
        return released;
    }

    @Override
    public void release()
    {
        if (released)
            return;
        released = true;
        OutputStream out = stream;
        stream = null;
        if (out != null)
            discard(out);
        sink.reset();
    }

    private void discard(OutputStream out)
    {
        try
        {
            abort(out);
        }
        catch (Throwable x)
        {
            LOG.trace("IGNORED", x);
        }
    }

    private OutputStream ensureStream() throws IOException
    {
        if (released)
            throw new IllegalStateException("Encoder released " + this);
        if (stream == null)
            stream = newEncoderStream(sink);
        return stream;
    }

    private ByteBuffer drain()
    {
        return sink.take();
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[released=%b]", getClass().getSimpleName(), hashCode(), released);
    }

    private static class Sink extends ByteArrayOutputStream
    {
        private final int capacity;

        private Sink(int capacity)
        {
            super(capacity);
            this.capacity = capacity;
        }

        /**
         * @return the bytes written since the last call, in a buffer that owns the array
         */
        private ByteBuffer take()
        {
            if (count == 0)
                return BufferUtil.EMPTY_BUFFER;
            ByteBuffer output = ByteBuffer.wrap(buf, 0, count);
            buf = new byte[capacity];
            count = 0;
            return output;
        }
    }
}

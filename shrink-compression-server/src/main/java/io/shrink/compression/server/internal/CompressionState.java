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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.function.Consumer;

import io.shrink.compression.Encoder;
import io.shrink.compression.server.Decision;
import org.eclipse.jetty.util.BufferUtil;
import org.eclipse.jetty.util.thread.AutoLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>The body transformation state of one response.</p>
 * <p>Each call to {@link #process(ByteBuffer, boolean)} consumes a chunk of the original
 * body and returns the bytes to deliver, an empty buffer meaning that more input is needed.</p>
 * <p>When the length of a body to compress is unknown, the first {@code minSize} bytes
 * are buffered: if the body ends before the buffer is full the response is committed
 * uncompressed, otherwise it is committed compressed.
 * A known length below {@code minSize} is committed uncompressed immediately.
 * The {@code commitListener} receives the final {@link Decision} before any byte is
 * returned, so that the response headers can be rewritten.</p>
 */
public class CompressionState
{
    private static final Logger LOG = LoggerFactory.getLogger(CompressionState.class);

    public enum Mode
    {
        BUFFERING,
        COMPRESSING,
        PASSTHROUGH,
        FINISHED,
        FAILED
    }

    private final AutoLock lock = new AutoLock();
    private final Decision decision;
    private final Consumer<Decision> commitListener;
    private Mode mode;
    private Decision committed;
    private ByteBuffer buffer;
    private Encoder encoder;

    /**
     * @param decision the negotiated decision
     * @param contentLength the length of the original body, or {@code -1} if unknown
     * @param minSize the minimum number of body bytes to compress
     * @param commitListener the listener of the final decision
     */
    public CompressionState(Decision decision, long contentLength, int minSize, Consumer<Decision> commitListener)
    {
        this.decision = decision;
        this.commitListener = commitListener;
        if (!decision.isCompress())
        {
            commit(Mode.PASSTHROUGH, decision);
        }
        else if (contentLength >= minSize)
        {
            commit(Mode.COMPRESSING, decision);
        }
        else if (contentLength >= 0)
        {
            commit(Mode.PASSTHROUGH, decision.asSkip());
        }
        else
        {
            mode = Mode.BUFFERING;
            buffer = ByteBuffer.allocate(minSize);
        }
    }

    /**
     * @param input the next chunk of the original body, fully consumed by this method
     * @param last whether the chunk is the last of the original body
     * @return the bytes to deliver, possibly empty; in {@link Mode#PASSTHROUGH} mode the input itself
     * @throws IOException if the encoder fails
     * @throws IllegalStateException if the body has already finished or failed
     */
    public ByteBuffer process(ByteBuffer input, boolean last) throws IOException
    {
        try (AutoLock ignored = lock.lock())
        {
            try
            {
                return switch (mode)
                {
                    case PASSTHROUGH ->
                    {
                        if (last)
                            mode = Mode.FINISHED;
                        yield input;
                    }
                    case BUFFERING -> buffer(input, last);
                    case COMPRESSING -> compress(null, input, last);
                    case FINISHED, FAILED -> throw new IllegalStateException("Body " + mode + " " + this);
                };
            }
            catch (Throwable x)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("failed {}", this, x);
                doRelease();
                throw x;
            }
        }
    }

    private ByteBuffer buffer(ByteBuffer input, boolean last) throws IOException
    {
        int length = Math.min(buffer.remaining(), input.remaining());
        ByteBuffer slice = input.slice();
        slice.limit(length);
        buffer.put(slice);
        input.position(input.position() + length);

        if (!buffer.hasRemaining())
        {
            if (LOG.isDebugEnabled())
                LOG.debug("buffered {} bytes, compressing {}", buffer.position(), this);
            commit(Mode.COMPRESSING, decision);
            ByteBuffer buffered = buffer.flip();
            buffer = null;
            return compress(buffered, input, last);
        }

        if (last)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("body ended after {} bytes, not compressing {}", buffer.position(), this);
            commit(Mode.PASSTHROUGH, decision.asSkip());
            ByteBuffer buffered = buffer.flip();
            buffer = null;
            mode = Mode.FINISHED;
            return buffered;
        }

        return BufferUtil.EMPTY_BUFFER;
    }

    private ByteBuffer compress(ByteBuffer buffered, ByteBuffer input, boolean last) throws IOException
    {
        if (encoder == null)
            encoder = decision.getCompression().newEncoder();

        ByteBuffer head = buffered == null ? BufferUtil.EMPTY_BUFFER : encoder.encode(buffered);
        ByteBuffer body = input.hasRemaining() ? encoder.encode(input) : BufferUtil.EMPTY_BUFFER;
        ByteBuffer tail;
        if (last)
        {
            tail = encoder.finish();
            encoder = null;
            mode = Mode.FINISHED;
        }
        else if (decision.isForceFlush())
        {
            tail = encoder.flush();
        }
        else
        {
            tail = BufferUtil.EMPTY_BUFFER;
        }
        return join(head, body, tail);
    }

    private static ByteBuffer join(ByteBuffer... buffers)
    {
        ByteBuffer single = null;
        int size = 0;
        for (ByteBuffer buffer : buffers)
        {
            if (buffer.hasRemaining())
            {
                single = single == null ? buffer : null;
                size += buffer.remaining();
            }
        }
        if (size == 0)
            return BufferUtil.EMPTY_BUFFER;
        if (single != null && single.remaining() == size)
            return single;
        ByteBuffer joined = ByteBuffer.allocate(size);
        for (ByteBuffer buffer : buffers)
        {
            joined.put(buffer);
        }
        return joined.flip();
    }

    private void commit(Mode mode, Decision decision)
    {
        this.mode = mode;
        this.committed = decision;
        if (LOG.isDebugEnabled())
            LOG.debug("committed {} {}", decision, this);
        commitListener.accept(decision);
    }

    /**
     * <p>Releases the encoder and the buffer.</p>
     * <p>If the body has not finished, it is failed and cannot be processed anymore.
     * This method is idempotent.</p>
     */
    public void release()
    {
        try (AutoLock ignored = lock.lock())
        {
            doRelease();
        }
    }

    private void doRelease()
    {
        if (mode != Mode.FINISHED)
            mode = Mode.FAILED;
        buffer = null;
        Encoder encoder = this.encoder;
        this.encoder = null;
        if (encoder != null)
            encoder.release();
    }

    public Mode getMode()
    {
        try (AutoLock ignored = lock.lock())
        {
            return mode;
        }
    }

    public boolean isPassthrough()
    {
        return getMode() == Mode.PASSTHROUGH;
    }

    /**
     * @return the final decision, or null if the body is still buffering
     */
    public Decision getCommittedDecision()
    {
        try (AutoLock ignored = lock.lock())
        {
            return committed;
        }
    }

    /**
     * @return the number of bytes currently buffered
     */
    public int getBufferedBytes()
    {
        try (AutoLock ignored = lock.lock())
        {
            return buffer == null ? 0 : buffer.position();
        }
    }

    /**
     * @return whether an encoder is currently held
     */
    public boolean hasEncoder()
    {
        try (AutoLock ignored = lock.lock())
        {
            return encoder != null;
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s,%s]", getClass().getSimpleName(), hashCode(), mode, decision);
    }
}

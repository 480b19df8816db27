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

import java.util.Objects;

import io.shrink.compression.Compression;

/**
 * <p>The negotiated outcome for one response: either skip compression, or compress
 * with a chosen {@link Compression}, plus the flush policy of the body.</p>
 * <p>Instances are immutable.</p>
 */
public final class Decision
{
    public enum Action
    {
        SKIP,
        COMPRESS
    }

    private final Action action;
    private final Compression compression;
    private final boolean forceFlush;
    private final boolean vary;

    private Decision(Action action, Compression compression, boolean forceFlush, boolean vary)
    {
        this.action = action;
        this.compression = compression;
        this.forceFlush = forceFlush;
        this.vary = vary;
    }

    /**
     * @param forceFlush whether each body chunk must be delivered as soon as it is available
     * @param vary whether the response must vary on {@code Accept-Encoding}
     * @return a decision not to compress the response body
     */
    public static Decision skip(boolean forceFlush, boolean vary)
    {
        return new Decision(Action.SKIP, null, forceFlush, vary);
    }

    /**
     * @param compression the compression to apply to the response body
     * @param forceFlush whether the encoder must be flushed after each body chunk
     * @return a decision to compress the response body
     */
    public static Decision compress(Compression compression, boolean forceFlush)
    {
        return new Decision(Action.COMPRESS, Objects.requireNonNull(compression), forceFlush, true);
    }

    public Action getAction()
    {
        return action;
    }

    public boolean isCompress()
    {
        return action == Action.COMPRESS;
    }

    /**
     * @return the compression to apply, or null if the action is {@link Action#SKIP}
     */
    public Compression getCompression()
    {
        return compression;
    }

    public boolean isForceFlush()
    {
        return forceFlush;
    }

    /**
     * @return whether {@code Accept-Encoding} must be listed in the {@code Vary} response header
     */
    public boolean isVary()
    {
        return vary;
    }

    /**
     * @return a decision not to compress, retaining the flush and vary policies of this decision
     */
    public Decision asSkip()
    {
        if (action == Action.SKIP)
            return this;
        return skip(forceFlush, vary);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s,%s,flush=%b,vary=%b]", getClass().getSimpleName(), hashCode(),
            action, compression == null ? null : compression.getEncodingName(), forceFlush, vary);
    }
}

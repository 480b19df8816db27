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

package io.shrink.compression.brotli;

import java.util.Objects;

import com.aayushatharva.brotli4j.encoder.Encoder;
import io.shrink.compression.EncoderConfig;

public class BrotliEncoderConfig implements EncoderConfig
{
    /**
     * Default quality for dynamically generated content.
     */
    public static final int DEFAULT_QUALITY = 5;
    public static final int DEFAULT_WINDOW = 22;
    private static final int DEFAULT_BUFFER_SIZE = 16384;
    private static final int MIN_BUFFER_SIZE = 1024;

    private int bufferSize = DEFAULT_BUFFER_SIZE;
    private int quality = DEFAULT_QUALITY;
    private int window = DEFAULT_WINDOW;
    private Encoder.Mode mode = Encoder.Mode.GENERIC;

    @Override
    public int getBufferSize()
    {
        return bufferSize;
    }

    @Override
    public void setBufferSize(int size)
    {
        this.bufferSize = Math.max(MIN_BUFFER_SIZE, size);
    }

    /**
     * @return the brotli quality, between 0 and 11
     */
    @Override
    public int getCompressionLevel()
    {
        return quality;
    }

    @Override
    public void setCompressionLevel(int level)
    {
        if (level < 0 || level > 11)
            throw new IllegalArgumentException("Invalid brotli quality: " + level);
        this.quality = level;
    }

    /**
     * @return the base 2 logarithm of the sliding window size, between 10 and 24
     */
    public int getWindow()
    {
        return window;
    }

    public void setWindow(int window)
    {
        if (window < 10 || window > 24)
            throw new IllegalArgumentException("Invalid brotli window: " + window);
        this.window = window;
    }

    public Encoder.Mode getMode()
    {
        return mode;
    }

    public void setMode(Encoder.Mode mode)
    {
        this.mode = Objects.requireNonNull(mode);
    }

    public Encoder.Parameters asEncoderParams()
    {
        return new Encoder.Parameters()
            .setQuality(quality)
            .setWindow(window)
            .setMode(mode);
    }
}

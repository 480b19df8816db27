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

package io.shrink.compression.gzip;

import java.util.zip.Deflater;

import io.shrink.compression.EncoderConfig;

public class GzipEncoderConfig implements EncoderConfig
{
    private static final int DEFAULT_BUFFER_SIZE = 8192;
    // Minimum buffer size to avoid issues with JDK-8133170.
    private static final int MIN_BUFFER_SIZE = 32;

    private int bufferSize = DEFAULT_BUFFER_SIZE;
    private int compressionLevel = Deflater.DEFAULT_COMPRESSION;
    private int strategy = Deflater.DEFAULT_STRATEGY;

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

    @Override
    public int getCompressionLevel()
    {
        return compressionLevel;
    }

    /**
     * @param level the deflater level, from {@link Deflater#NO_COMPRESSION} to {@link Deflater#BEST_COMPRESSION},
     * or {@link Deflater#DEFAULT_COMPRESSION}
     */
    @Override
    public void setCompressionLevel(int level)
    {
        if (level != Deflater.DEFAULT_COMPRESSION && (level < Deflater.NO_COMPRESSION || level > Deflater.BEST_COMPRESSION))
            throw new IllegalArgumentException("Invalid gzip level: " + level);
        this.compressionLevel = level;
    }

    public int getStrategy()
    {
        return strategy;
    }

    /**
     * @param strategy one of {@link Deflater#DEFAULT_STRATEGY}, {@link Deflater#FILTERED} or {@link Deflater#HUFFMAN_ONLY}
     */
    public void setStrategy(int strategy)
    {
        switch (strategy)
        {
            case Deflater.DEFAULT_STRATEGY, Deflater.FILTERED, Deflater.HUFFMAN_ONLY -> this.strategy = strategy;
            default -> throw new IllegalArgumentException("Invalid gzip strategy: " + strategy);
        }
    }
}

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

package io.shrink.compression.zstandard;

import com.github.luben.zstd.Zstd;
import io.shrink.compression.EncoderConfig;

public class ZstandardEncoderConfig implements EncoderConfig
{
    public static final int DEFAULT_LEVEL = 3;
    private static final int DEFAULT_BUFFER_SIZE = 16384;
    private static final int MIN_BUFFER_SIZE = 1024;

    private int bufferSize = DEFAULT_BUFFER_SIZE;
    private int level = DEFAULT_LEVEL;
    private boolean checksum;
    private int workers;

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
        return level;
    }

    @Override
    public void setCompressionLevel(int level)
    {
        if (level < Zstd.minCompressionLevel() || level > Zstd.maxCompressionLevel())
            throw new IllegalArgumentException("Invalid zstd level: " + level);
        this.level = level;
    }

    /**
     * @return whether a content checksum is appended at the end of the frame
     */
    public boolean isChecksum()
    {
        return checksum;
    }

    public void setChecksum(boolean checksum)
    {
        this.checksum = checksum;
    }

    /**
     * @return the number of zstd worker threads, {@code 0} to compress in the calling thread
     */
    public int getWorkers()
    {
        return workers;
    }

    public void setWorkers(int workers)
    {
        this.workers = Math.max(0, workers);
    }
}

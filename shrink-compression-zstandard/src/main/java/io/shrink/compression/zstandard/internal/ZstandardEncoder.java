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

package io.shrink.compression.zstandard.internal;

import java.io.IOException;
import java.io.OutputStream;

import com.github.luben.zstd.ZstdOutputStream;
import io.shrink.compression.OutputStreamEncoder;
import io.shrink.compression.zstandard.ZstandardEncoderConfig;

/**
 * <p>Zstandard encoder backed by the zstd-jni streaming compressor.</p>
 * <p>{@link #flush()} maps to {@code ZSTD_e_flush}: the current block is closed
 * and emitted without ending the frame.</p>
 */
public class ZstandardEncoder extends OutputStreamEncoder
{
    private final ZstandardEncoderConfig config;

    public ZstandardEncoder(ZstandardEncoderConfig config)
    {
        super(config.getBufferSize());
        this.config = config;
    }

    @Override
    protected OutputStream newEncoderStream(OutputStream sink) throws IOException
    {
        ZstdOutputStream zstd = new ZstdOutputStream(sink, config.getCompressionLevel());
        zstd.setChecksum(config.isChecksum());
        if (config.getWorkers() > 0)
            zstd.setWorkers(config.getWorkers());
        return zstd;
    }
}

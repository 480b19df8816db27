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

package io.shrink.compression.brotli.internal;

import java.io.IOException;
import java.io.OutputStream;

import com.aayushatharva.brotli4j.encoder.BrotliOutputStream;
import io.shrink.compression.OutputStreamEncoder;
import io.shrink.compression.brotli.BrotliEncoderConfig;

/**
 * <p>Brotli encoder backed by the brotli4j native streaming encoder.</p>
 * <p>{@link #flush()} issues a brotli {@code FLUSH} operation, so the output
 * produced so far can be decoded before the stream ends.</p>
 */
public class BrotliEncoder extends OutputStreamEncoder
{
    private final BrotliEncoderConfig config;

    public BrotliEncoder(BrotliEncoderConfig config)
    {
        super(config.getBufferSize());
        this.config = config;
    }

    @Override
    protected OutputStream newEncoderStream(OutputStream sink) throws IOException
    {
        return new BrotliOutputStream(sink, config.asEncoderParams(), config.getBufferSize());
    }
}

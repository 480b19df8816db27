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

package io.shrink.compression.gzip.internal;

import java.io.IOException;
import java.io.OutputStream;

import io.shrink.compression.OutputStreamEncoder;
import io.shrink.compression.gzip.GzipEncoderConfig;

public class GzipEncoder extends OutputStreamEncoder
{
    private final GzipEncoderConfig config;

    public GzipEncoder(GzipEncoderConfig config)
    {
        super(config.getBufferSize());
        this.config = config;
    }

    @Override
    protected OutputStream newEncoderStream(OutputStream sink) throws IOException
    {
        return new ConfigurableGzipOutputStream(sink, config);
    }

    @Override
    protected void abort(OutputStream stream)
    {
        ((ConfigurableGzipOutputStream)stream).abort();
    }
}

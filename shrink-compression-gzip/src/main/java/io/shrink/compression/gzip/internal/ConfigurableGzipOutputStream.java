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
import java.util.zip.GZIPOutputStream;

import io.shrink.compression.gzip.GzipEncoderConfig;

/**
 * A {@link GZIPOutputStream} with sync flush enabled and the level and strategy
 * taken from a {@link GzipEncoderConfig}.
 */
public class ConfigurableGzipOutputStream extends GZIPOutputStream
{
    public ConfigurableGzipOutputStream(OutputStream out, GzipEncoderConfig config) throws IOException
    {
        super(out, config.getBufferSize(), true);
        def.setLevel(config.getCompressionLevel());
        def.setStrategy(config.getStrategy());
    }

    /**
     * Releases the deflater without writing the gzip trailer.
     */
    public void abort()
    {
        def.end();
    }
}

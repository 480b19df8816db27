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

import com.aayushatharva.brotli4j.Brotli4jLoader;
import io.shrink.compression.Compression;
import io.shrink.compression.Encoder;
import io.shrink.compression.EncoderConfig;
import io.shrink.compression.brotli.internal.BrotliEncoder;
import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.PreEncodedHttpField;

/**
 * Brotli Compression.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7932">RFC7932: Brotli Compressed Data Format</a>
 */
public class BrotliCompression extends Compression
{
    private static final String ENCODING_NAME = "br";
    private static final HttpField CONTENT_ENCODING = new PreEncodedHttpField(HttpHeader.CONTENT_ENCODING, ENCODING_NAME);

    static
    {
        Brotli4jLoader.ensureAvailability();
    }

    private BrotliEncoderConfig defaultEncoderConfig = new BrotliEncoderConfig();

    public BrotliCompression()
    {
        super(ENCODING_NAME);
    }

    @Override
    public String getName()
    {
        return "brotli";
    }

    @Override
    public HttpField getContentEncodingField()
    {
        return CONTENT_ENCODING;
    }

    @Override
    public BrotliEncoderConfig getDefaultEncoderConfig()
    {
        return this.defaultEncoderConfig;
    }

    @Override
    public void setDefaultEncoderConfig(EncoderConfig config)
    {
        BrotliEncoderConfig brotliEncoderConfig = (BrotliEncoderConfig)config;
        this.defaultEncoderConfig = Objects.requireNonNull(brotliEncoderConfig);
    }

    @Override
    public Encoder newEncoder(EncoderConfig config)
    {
        BrotliEncoderConfig brotliEncoderConfig = (BrotliEncoderConfig)config;
        return new BrotliEncoder(brotliEncoderConfig);
    }
}

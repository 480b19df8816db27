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

import java.util.Objects;

import io.shrink.compression.Compression;
import io.shrink.compression.Encoder;
import io.shrink.compression.EncoderConfig;
import io.shrink.compression.gzip.internal.GzipEncoder;
import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.PreEncodedHttpField;

/**
 * Gzip Compression.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc1952">RFC1952: GZIP file format specification</a>
 */
public class GzipCompression extends Compression
{
    private static final String ENCODING_NAME = "gzip";
    private static final HttpField CONTENT_ENCODING = new PreEncodedHttpField(HttpHeader.CONTENT_ENCODING, ENCODING_NAME);

    private GzipEncoderConfig defaultEncoderConfig = new GzipEncoderConfig();

    public GzipCompression()
    {
        super(ENCODING_NAME);
    }

    @Override
    public String getName()
    {
        return "gzip";
    }

    @Override
    public HttpField getContentEncodingField()
    {
        return CONTENT_ENCODING;
    }

    @Override
    public GzipEncoderConfig getDefaultEncoderConfig()
    {
        return this.defaultEncoderConfig;
    }

    @Override
    public void setDefaultEncoderConfig(EncoderConfig config)
    {
        this.defaultEncoderConfig = Objects.requireNonNull((GzipEncoderConfig)config);
    }

    @Override
    public Encoder newEncoder(EncoderConfig config)
    {
        return new GzipEncoder((GzipEncoderConfig)config);
    }
}

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

package io.shrink.compression;

import java.io.IOException;
import java.util.Objects;

import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.util.annotation.ManagedAttribute;
import org.eclipse.jetty.util.annotation.ManagedObject;
import org.eclipse.jetty.util.component.ContainerLifeCycle;

/**
 * <p>A compression algorithm that can be negotiated as an HTTP {@code Content-Encoding}.</p>
 * <p>A {@code Compression} is a stateless factory shared by all responses:
 * each response obtains its own {@link Encoder} via {@link #newEncoder()}.</p>
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}, see {@link Compressions}.</p>
 */
@ManagedObject("Compression")
public abstract class Compression extends ContainerLifeCycle
{
    private final String encodingName;

    protected Compression(String encodingName)
    {
        this.encodingName = Objects.requireNonNull(encodingName);
    }

    /**
     * @return the {@code Content-Encoding} token of this compression, such as {@code gzip} or {@code br}
     */
    @ManagedAttribute("The Content-Encoding token")
    public String getEncodingName()
    {
        return encodingName;
    }

    /**
     * @return the human readable name of this compression
     */
    @ManagedAttribute("The compression name")
    public abstract String getName();

    /**
     * @return the pre-encoded {@code Content-Encoding} response field for this compression
     */
    public abstract HttpField getContentEncodingField();

    /**
     * @return the encoder configuration used by {@link #newEncoder()}
     */
    public abstract EncoderConfig getDefaultEncoderConfig();

    /**
     * @param config the encoder configuration to be used by {@link #newEncoder()}
     */
    public abstract void setDefaultEncoderConfig(EncoderConfig config);

    /**
     * @return a new encoder configured with the {@link #getDefaultEncoderConfig() default configuration}
     * @throws IOException if the encoder cannot be created
     */
    public Encoder newEncoder() throws IOException
    {
        return newEncoder(getDefaultEncoderConfig());
    }

    /**
     * @param config the encoder configuration, specific to this compression
     * @return a new encoder, exclusively owned by the caller
     * @throws IOException if the encoder cannot be created
     */
    public abstract Encoder newEncoder(EncoderConfig config) throws IOException;

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s]", getClass().getSimpleName(), hashCode(), getEncodingName());
    }
}

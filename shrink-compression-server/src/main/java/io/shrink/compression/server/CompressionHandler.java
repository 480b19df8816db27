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


package io.shrink.compression.server;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.shrink.compression.Compression;
import io.shrink.compression.Compressions;
import io.shrink.compression.server.internal.CompressionResponse;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.eclipse.jetty.util.StringUtil;
import org.eclipse.jetty.util.annotation.ManagedAttribute;
import org.eclipse.jetty.util.annotation.ManagedObject;
import org.eclipse.jetty.util.thread.AutoLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>CompressionHandler to provide compression of response bodies.</p>
 * <p>Supports the {@code gzip}, {@code br} and {@code zstd} content encodings via
 * {@link Compression} implementations, discovered via {@link java.util.ServiceLoader}
 * if none is explicitly registered.</p>
 * <p>If no {@link CompressionConfig} is set, the {@link CompressionConfig.Builder#defaults() default}
 * configuration is used.</p>
 */
@ManagedObject("Compression Handler")
public class CompressionHandler extends Handler.Wrapper
{
    private static final Logger LOG = LoggerFactory.getLogger(CompressionHandler.class);

    private final AutoLock lock = new AutoLock();
    private final Map<String, Compression> supportedEncodings = new LinkedHashMap<>();
    private CompressionConfig config;
    private volatile ResponseCompressor compressor;

    public CompressionHandler()
    {
    }

    public CompressionHandler(Handler handler)
    {
        super(handler);
    }

    /**
     * Registers support for a Compression implementation to this Handler.
     *
     * @param compression the compression implementation.
     * @return the previously registered compression with the same encoding name, can be null.
     * @throws IllegalArgumentException if the encoding of the compression is not supported
     */
    public Compression putCompression(Compression compression)
    {
        String encoding = StringUtil.asciiToLowerCase(compression.getEncodingName());
        if (!Compressions.isSupported(encoding))
            throw new IllegalArgumentException("Unsupported encoding " + encoding + " for " + compression);
        Compression previous;
        try (AutoLock ignored = lock.lock())
        {
            previous = supportedEncodings.put(encoding, compression);
            updateCompressor();
        }
        updateBean(previous, compression, true);
        return previous;
    }

    /**
     * Unregisters a specific Compression implementation.
     *
     * @param encodingName the encoding name of the compression to remove.
     * @return the Compression that was removed, can be null if no Compression exists on that encoding name.
     */
    public Compression removeCompression(String encodingName)
    {
        Compression compression;
        try (AutoLock ignored = lock.lock())
        {
            compression = supportedEncodings.remove(StringUtil.asciiToLowerCase(encodingName));
            updateCompressor();
        }
        if (compression != null)
            removeBean(compression);
        return compression;
    }

    /**
     * @return the registered compressions
     */
    public List<Compression> getCompressions()
    {
        try (AutoLock ignored = lock.lock())
        {
            return List.copyOf(supportedEncodings.values());
        }
    }

    @ManagedAttribute("The supported encodings")
    public List<String> getSupportedEncodings()
    {
        try (AutoLock ignored = lock.lock())
        {
            return List.copyOf(supportedEncodings.keySet());
        }
    }

    public CompressionConfig getConfiguration()
    {
        try (AutoLock ignored = lock.lock())
        {
            return config;
        }
    }

    /**
     * @param config the configuration of response compression
     */
    public void setConfiguration(CompressionConfig config)
    {
        CompressionConfig previous;
        try (AutoLock ignored = lock.lock())
        {
            previous = this.config;
            this.config = config;
            updateCompressor();
        }
        updateBean(previous, config);
    }

    private void updateCompressor()
    {
        if (config != null && (isStarted() || isStarting()))
            compressor = new ResponseCompressor(config, supportedEncodings.values());
    }

    @Override
    protected void doStart() throws Exception
    {
        boolean discover;
        try (AutoLock ignored = lock.lock())
        {
            discover = supportedEncodings.isEmpty();
        }
        // No explicit compression configured, discover them via ServiceLoader.
        if (discover)
            Compressions.getKnown().forEach(this::putCompression);

        if (getConfiguration() == null)
            setConfiguration(CompressionConfig.builder().defaults().build());

        try (AutoLock ignored = lock.lock())
        {
            compressor = new ResponseCompressor(config, supportedEncodings.values());
        }

        super.doStart();
    }

    @Override
    protected void doStop() throws Exception
    {
        super.doStop();
        compressor = null;
    }

    /**
     * @return the compressor used by this handler, or null if the handler is not started
     */
    public ResponseCompressor getResponseCompressor()
    {
        return compressor;
    }

    @Override
    public boolean handle(Request request, Response response, Callback callback) throws Exception
    {
        if (LOG.isDebugEnabled())
            LOG.debug("handling {} {} {}", request, response, this);

        Handler next = getHandler();
        if (next == null)
            return false;

        ResponseCompressor compressor = this.compressor;
        if (compressor == null || !request.getHeaders().contains(HttpHeader.ACCEPT_ENCODING))
        {
            if (LOG.isDebugEnabled())
                LOG.debug("skipping compression: no Accept-Encoding {}", request);
            return next.handle(request, response, callback);
        }

        CompressionResponse compressionResponse = new CompressionResponse(request, response, callback, compressor);
        if (next.handle(request, compressionResponse, compressionResponse))
            return true;

        compressionResponse.release();
        return false;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,supported=%s}", getClass().getSimpleName(), hashCode(), getState(), String.join(",", getSupportedEncodings()));
    }
}

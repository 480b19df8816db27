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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;

import org.eclipse.jetty.util.TypeUtil;
import org.eclipse.jetty.util.thread.AutoLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@link Compression} implementations available via {@link java.util.ServiceLoader}.
 */
public class Compressions
{
    /**
     * The {@code Content-Encoding} tokens that can be negotiated, in server preference order.
     */
    public static final List<String> SUPPORTED_ENCODINGS = List.of("zstd", "br", "gzip");

    private static final Logger LOG = LoggerFactory.getLogger(Compressions.class);
    private static final AutoLock LOCK = new AutoLock();
    private static final Map<String, Compression> COMPRESSION_MAP = new LinkedHashMap<>();

    private Compressions()
    {
    }

    /**
     * @param encodingName a {@code Content-Encoding} token
     * @return whether the token is one of {@link #SUPPORTED_ENCODINGS}
     */
    public static boolean isSupported(String encodingName)
    {
        return encodingName != null && SUPPORTED_ENCODINGS.contains(encodingName.toLowerCase(Locale.ENGLISH));
    }

    /**
     * @return the compressions found on the class-path, discovered once
     */
    public static Collection<Compression> getKnown()
    {
        try (AutoLock ignored = LOCK.lock())
        {
            if (COMPRESSION_MAP.isEmpty())
            {
                TypeUtil.serviceProviderStream(ServiceLoader.load(Compression.class)).forEach(
                    compressionProvider ->
                    {
                        try
                        {
                            Compression compression = compressionProvider.get();
                            if (isSupported(compression.getEncodingName()))
                                COMPRESSION_MAP.put(compression.getEncodingName(), compression);
                            else
                                LOG.warn("Ignoring unsupported Compression {}", compression);
                        }
                        catch (Throwable e)
                        {
                            LOG.warn("Unable to get Compression", e);
                        }
                    }
                );
                if (LOG.isDebugEnabled())
                    LOG.debug("discovered compressions {}", COMPRESSION_MAP.keySet());
            }
            return new ArrayList<>(COMPRESSION_MAP.values());
        }
    }

    /**
     * @param encodingName a {@code Content-Encoding} token
     * @return the known compression for the token, or null if none was discovered
     */
    public static Compression get(String encodingName)
    {
        for (Compression compression : getKnown())
        {
            if (compression.getEncodingName().equalsIgnoreCase(encodingName))
                return compression;
        }
        return null;
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

import io.shrink.compression.Compressions;
import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.util.IncludeExclude;
import org.eclipse.jetty.util.StringUtil;
import org.eclipse.jetty.util.annotation.ManagedAttribute;
import org.eclipse.jetty.util.annotation.ManagedObject;

/**
 * <p>Immutable configuration of response compression.</p>
 * <p>Instances are created with a {@link Builder}, obtained from {@link #builder()}.</p>
 */
@ManagedObject("Compression Configuration")
public class CompressionConfig
{
    /**
     * The default minimum number of body bytes for a response to be compressed.
     */
    public static final int DEFAULT_MIN_COMPRESS_SIZE = 860;

    private final int minCompressSize;
    /**
     * Set of {@code Accept-Encoding} encodings that are supported for compressing Response content.
     */
    private final IncludeExclude<String> compressEncodings;
    /**
     * Set of HTTP Methods that are supported for compressing Response content.
     */
    private final IncludeExclude<String> compressMethods;
    /**
     * Preferred order of encodings when the client accepts more than one with the same quality.
     */
    private final List<String> preferredCompressEncodings;
    private final ContentTypeClassifier contentTypeClassifier;
    private final List<HttpField> flushHeaders;

    private CompressionConfig(Builder builder)
    {
        this.minCompressSize = builder.minCompressSize;
        this.compressEncodings = copyOf(builder.compressEncodings);
        this.compressMethods = copyOf(builder.compressMethods);
        List<String> preferred = new ArrayList<>(builder.compressPreferredEncodings);
        for (String encoding : Compressions.SUPPORTED_ENCODINGS)
        {
            if (!preferred.contains(encoding))
                preferred.add(encoding);
        }
        this.preferredCompressEncodings = Collections.unmodifiableList(preferred);
        this.contentTypeClassifier = new ContentTypeClassifier(builder.compressExcludeMimeTypes, builder.compressIncludeMimeTypes, builder.flushMimeTypes);
        this.flushHeaders = List.copyOf(builder.flushHeaders);
    }

    private static IncludeExclude<String> copyOf(IncludeExclude<String> source)
    {
        IncludeExclude<String> copy = new IncludeExclude<>();
        source.getIncluded().forEach(copy::include);
        source.getExcluded().forEach(copy::exclude);
        return copy;
    }

    /**
     * @return a new {@link Builder} to configure a {@code CompressionConfig} instance
     */
    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * @return the minimum number of body bytes for a response to be compressed
     */
    @ManagedAttribute("Minimum body size in bytes for response compression")
    public int getMinCompressSize()
    {
        return minCompressSize;
    }

    /**
     * @return the encodings that disable response compression
     * @see #getCompressIncludeEncodings()
     */
    @ManagedAttribute("Encodings that disable response compression")
    public Set<String> getCompressExcludeEncodings()
    {
        return Set.copyOf(compressEncodings.getExcluded());
    }

    /**
     * @return the encodings that enable response compression, all supported encodings if empty
     * @see #getCompressExcludeEncodings()
     */
    @ManagedAttribute("Encodings that enable response compression")
    public Set<String> getCompressIncludeEncodings()
    {
        return Set.copyOf(compressEncodings.getIncluded());
    }

    /**
     * @return the HTTP methods that disable response compression
     * @see #getCompressIncludeMethods()
     */
    @ManagedAttribute("HTTP methods that disable response compression")
    public Set<String> getCompressExcludeMethods()
    {
        return Set.copyOf(compressMethods.getExcluded());
    }

    /**
     * @return HTTP methods that enable response compression, all methods if empty
     * @see #getCompressExcludeMethods()
     */
    @ManagedAttribute("HTTP methods that enable response compression")
    public Set<String> getCompressIncludeMethods()
    {
        return Set.copyOf(compressMethods.getIncluded());
    }

    /**
     * @return the MIME type patterns that disable response compression
     * @see #getCompressIncludeMimeTypes()
     */
    @ManagedAttribute("MIME types that disable response compression")
    public List<String> getCompressExcludeMimeTypes()
    {
        return contentTypeClassifier.getExcluded();
    }

    /**
     * @return the MIME type patterns that are compressed despite matching an excluded pattern
     * @see #getCompressExcludeMimeTypes()
     */
    @ManagedAttribute("MIME types excepted from the excluded MIME types")
    public List<String> getCompressIncludeMimeTypes()
    {
        return contentTypeClassifier.getExceptions();
    }

    /**
     * @return the encodings for response compression in preferred order
     */
    @ManagedAttribute("Encodings for response compression in preferred order")
    public List<String> getCompressPreferredEncodings()
    {
        return preferredCompressEncodings;
    }

    /**
     * @return the MIME type patterns of responses that are flushed after each chunk
     */
    @ManagedAttribute("MIME types of responses flushed after each chunk")
    public List<String> getFlushMimeTypes()
    {
        return contentTypeClassifier.getFlushTypes();
    }

    /**
     * @return the request or response header fields that cause a response to be flushed after each chunk
     */
    @ManagedAttribute("Header fields that cause a response to be flushed after each chunk")
    public List<String> getFlushHeaders()
    {
        return flushHeaders.stream().map(HttpField::toString).toList();
    }

    public ContentTypeClassifier getContentTypeClassifier()
    {
        return contentTypeClassifier;
    }

    public boolean isCompressEncodingSupported(String encoding)
    {
        return compressEncodings.test(StringUtil.asciiToLowerCase(encoding));
    }

    public boolean isCompressMethodSupported(String method)
    {
        return compressMethods.test(method.toUpperCase(Locale.ENGLISH));
    }

    /**
     * @param fields request or response header fields
     * @return whether the fields contain one of the {@link #getFlushHeaders() flush headers}
     */
    public boolean hasFlushHeader(HttpFields fields)
    {
        if (flushHeaders.isEmpty())
            return false;
        for (HttpField field : fields)
        {
            for (HttpField flushHeader : flushHeaders)
            {
                if (flushHeader.getName().equalsIgnoreCase(field.getName()) &&
                    field.getValue() != null &&
                    flushHeader.getValue().equalsIgnoreCase(field.getValue().trim()))
                    return true;
            }
        }
        return false;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{minSize=%d,encodings=%s,preferred=%s,%s}",
            getClass().getSimpleName(), hashCode(), minCompressSize, compressEncodings, preferredCompressEncodings, contentTypeClassifier);
    }

    /**
     * <p>The builder of {@link CompressionConfig} immutable instances.</p>
     * <p>MIME type patterns are matched without parameters and case-insensitively;
     * a pattern ending with {@code *} matches by prefix.
     * For encodings and methods, exclusion takes precedence over inclusion,
     * as defined by {@link IncludeExclude}.</p>
     */
    public static class Builder
    {
        private final IncludeExclude<String> compressEncodings = new IncludeExclude<>();
        private final IncludeExclude<String> compressMethods = new IncludeExclude<>();
        private final Set<String> compressExcludeMimeTypes = new LinkedHashSet<>();
        private final Set<String> compressIncludeMimeTypes = new LinkedHashSet<>();
        private final Set<String> flushMimeTypes = new LinkedHashSet<>();
        private final List<HttpField> flushHeaders = new ArrayList<>();
        private final List<String> compressPreferredEncodings = new ArrayList<>();
        private int minCompressSize = DEFAULT_MIN_COMPRESS_SIZE;

        private Builder()
        {
            // Use the static builder() method instead.
        }

        /**
         * @param size the minimum number of body bytes for a response to be compressed
         * @return this builder
         */
        public Builder minCompressSize(int size)
        {
            if (size < 0)
                throw new IllegalArgumentException("Invalid min compress size: " + size);
            this.minCompressSize = size;
            return this;
        }

        /**
         * @param encoding the encoding to exclude for response compression.
         * @return this builder
         */
        public Builder compressExcludeEncoding(String encoding)
        {
            this.compressEncodings.exclude(StringUtil.asciiToLowerCase(encoding));
            return this;
        }

        /**
         * @param encoding the encoding to include for response compression.
         * @return this builder
         */
        public Builder compressIncludeEncoding(String encoding)
        {
            this.compressEncodings.include(StringUtil.asciiToLowerCase(encoding));
            return this;
        }

        /**
         * @param method the HTTP method to exclude for response compression
         * @return this builder
         */
        public Builder compressExcludeMethod(String method)
        {
            this.compressMethods.exclude(method.toUpperCase(Locale.ENGLISH));
            return this;
        }

        /**
         * @param method the HTTP method to include for response compression
         * @return this builder
         */
        public Builder compressIncludeMethod(String method)
        {
            this.compressMethods.include(method.toUpperCase(Locale.ENGLISH));
            return this;
        }

        /**
         * @param mimetype the MIME type pattern to exclude for response compression
         * @return this builder
         */
        public Builder compressExcludeMimeType(String mimetype)
        {
            this.compressExcludeMimeTypes.add(mimetype);
            return this;
        }

        /**
         * <p>A MIME type pattern that is compressed even if it matches an
         * {@link #compressExcludeMimeType(String) excluded} pattern.</p>
         *
         * @param mimetype the MIME type pattern to except from the exclusions
         * @return this builder
         */
        public Builder compressIncludeMimeType(String mimetype)
        {
            this.compressIncludeMimeTypes.add(mimetype);
            return this;
        }

        /**
         * <p>Specifies a list of encodings for response compression in preferred order.</p>
         * <p>This list is only used to break ties, when {@code Accept-Encoding} specifies
         * the same quality for more than one supported encoding.
         * Supported encodings missing from the list follow in their default order.</p>
         *
         * @param encodings a list of encodings for response compression in preferred order
         * @return this builder
         */
        public Builder compressPreferredEncodings(List<String> encodings)
        {
            this.compressPreferredEncodings.clear();
            if (encodings != null)
                encodings.stream().map(StringUtil::asciiToLowerCase).forEach(compressPreferredEncodings::add);
            return this;
        }

        /**
         * @param mimetype the MIME type pattern of responses whose chunks are flushed as soon as available
         * @return this builder
         */
        public Builder flushMimeType(String mimetype)
        {
            this.flushMimeTypes.add(mimetype);
            return this;
        }

        /**
         * @param name the name of a request or response header
         * @param value the value, compared case-insensitively, that causes each chunk to be flushed
         * @return this builder
         */
        public Builder flushHeader(String name, String value)
        {
            this.flushHeaders.add(new HttpField(name, value));
            return this;
        }

        /**
         * <p>Configures this {@code Builder} with the default configuration.</p>
         * <p>Additional configuration may be specified using the {@code Builder}
         * methods, possibly overriding the defaults.</p>
         *
         * @return this builder
         */
        public Builder defaults()
        {
            compressExcludeMimeType("image/*");
            compressIncludeMimeType("image/svg+xml");
            compressExcludeMimeType("audio/*");
            compressExcludeMimeType("video/*");
            compressExcludeMimeType("application/grpc*");
            compressIncludeMimeType("application/grpc-web*");

            Stream.of("application/compress",
                "application/zip",
                "application/gzip",
                "application/x-bzip2",
                "application/brotli",
                "application/x-br",
                "application/x-xz",
                "application/x-rar-compressed",
                "application/vnd.bzip3",
                "application/zstd"
            ).forEach(this::compressExcludeMimeType);

            flushMimeType("text/event-stream");
            flushMimeType("application/grpc-web*");
            flushHeader("X-Accel-Buffering", "no");

            return this;
        }

        /**
         * @return a new {@link CompressionConfig} instance configured with this {@code Builder}.
         */
        public CompressionConfig build()
        {
            return new CompressionConfig(this);
        }
    }
}

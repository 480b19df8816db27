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

import java.util.Collection;
import java.util.List;

import org.eclipse.jetty.http.MimeTypes;
import org.eclipse.jetty.util.StringUtil;

/**
 * <p>Stateless predicates over a response {@code Content-Type}.</p>
 * <p>The MIME type is compared without its parameters and case-insensitively against
 * patterns that match either exactly, or by prefix when they end with {@code *}:
 * {@code image/*} matches every image type and {@code application/grpc*} matches both
 * {@code application/grpc} and {@code application/grpc+proto}.</p>
 * <p>A MIME type is excluded from compression if it matches an exclusion pattern and
 * no exception pattern; an exception never widens compression beyond the exclusions.</p>
 */
public class ContentTypeClassifier
{
    private final List<String> excluded;
    private final List<String> exceptions;
    private final List<String> flushTypes;

    public ContentTypeClassifier(Collection<String> excluded, Collection<String> exceptions, Collection<String> flushTypes)
    {
        this.excluded = normalize(excluded);
        this.exceptions = normalize(exceptions);
        this.flushTypes = normalize(flushTypes);
    }

    private static List<String> normalize(Collection<String> patterns)
    {
        return patterns.stream().map(StringUtil::asciiToLowerCase).toList();
    }

    /**
     * @param contentType a {@code Content-Type} value, possibly with parameters
     * @return the lower-cased MIME type without parameters, or null if there is none
     */
    public static String getMimeType(String contentType)
    {
        if (StringUtil.isBlank(contentType))
            return null;
        String mimeType = MimeTypes.getContentTypeWithoutCharset(contentType.trim());
        // MimeTypes keeps parameters other than the charset.
        int semicolon = mimeType.indexOf(';');
        if (semicolon >= 0)
            mimeType = mimeType.substring(0, semicolon);
        if (StringUtil.isBlank(mimeType))
            return null;
        return StringUtil.asciiToLowerCase(mimeType.trim());
    }

    /**
     * @param contentType a {@code Content-Type} value, possibly null
     * @return whether a response with this content type must not be compressed
     */
    public boolean isExcluded(String contentType)
    {
        String mimeType = getMimeType(contentType);
        if (mimeType == null)
            return false;
        return matches(excluded, mimeType) && !matches(exceptions, mimeType);
    }

    /**
     * @param contentType a {@code Content-Type} value, possibly null
     * @return whether a response with this content type is a stream whose chunks must be flushed
     */
    public boolean isFlushType(String contentType)
    {
        String mimeType = getMimeType(contentType);
        return mimeType != null && matches(flushTypes, mimeType);
    }

    public List<String> getExcluded()
    {
        return excluded;
    }

    public List<String> getExceptions()
    {
        return exceptions;
    }

    public List<String> getFlushTypes()
    {
        return flushTypes;
    }

    private static boolean matches(List<String> patterns, String mimeType)
    {
        for (String pattern : patterns)
        {
            if (pattern.endsWith("*"))
            {
                if (mimeType.startsWith(pattern.substring(0, pattern.length() - 1)))
                    return true;
            }
            else if (pattern.equals(mimeType))
            {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{excluded=%s,exceptions=%s,flush=%s}", getClass().getSimpleName(), hashCode(), excluded, exceptions, flushTypes);
    }
}

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
import java.util.List;

import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.PreEncodedHttpField;

/**
 * Applies to the response headers the mutations implied by a {@link Decision}.
 */
public class HeaderRewriter
{
    private static final HttpField VARY_ACCEPT_ENCODING = new PreEncodedHttpField(HttpHeader.VARY, HttpHeader.ACCEPT_ENCODING.asString());

    private HeaderRewriter()
    {
    }

    /**
     * <p>For a compressed response, sets {@code Content-Encoding}, removes {@code Content-Length}
     * and {@code Accept-Ranges}, and adds {@code Accept-Encoding} to {@code Vary}.</p>
     * <p>For a response that is not compressed, only adds {@code Accept-Encoding} to {@code Vary}
     * if the decision {@link Decision#isVary() requires it}.</p>
     *
     * @param decision the final decision for the response
     * @param headers the mutable response headers
     */
    public static void apply(Decision decision, HttpFields.Mutable headers)
    {
        if (decision.isCompress())
        {
            headers.put(decision.getCompression().getContentEncodingField());
            headers.remove(HttpHeader.CONTENT_LENGTH);
            headers.remove(HttpHeader.ACCEPT_RANGES);
        }
        if (decision.isVary())
            varyAcceptEncoding(headers);
    }

    /**
     * <p>Merges {@code Accept-Encoding} into the {@code Vary} header.</p>
     * <p>Headers are unchanged if a {@code Vary} field already lists {@code Accept-Encoding} or {@code *}.</p>
     *
     * @param headers the mutable response headers
     */
    public static void varyAcceptEncoding(HttpFields.Mutable headers)
    {
        List<String> values = new ArrayList<>();
        for (HttpField field : headers)
        {
            if (field.getHeader() != HttpHeader.VARY)
                continue;
            String value = field.getValue();
            if (value == null || value.isBlank())
                continue;
            for (String token : value.split(","))
            {
                token = token.trim();
                if ("*".equals(token) || HttpHeader.ACCEPT_ENCODING.is(token))
                    return;
            }
            values.add(value.trim());
        }

        if (values.isEmpty())
        {
            headers.put(VARY_ACCEPT_ENCODING);
        }
        else
        {
            values.add(HttpHeader.ACCEPT_ENCODING.asString());
            headers.put(HttpHeader.VARY, String.join(", ", values));
        }
    }
}

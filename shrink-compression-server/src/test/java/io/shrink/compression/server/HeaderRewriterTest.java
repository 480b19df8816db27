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

import java.util.List;

import io.shrink.compression.zstandard.ZstandardCompression;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

public class HeaderRewriterTest
{
    @Test
    public void testCompress()
    {
        HttpFields.Mutable headers = HttpFields.build()
            .add(HttpHeader.CONTENT_TYPE, "text/html")
            .add(HttpHeader.CONTENT_LENGTH, "4096")
            .add(HttpHeader.ACCEPT_RANGES, "bytes")
            .add(HttpHeader.ETAG, "\"abc\"");

        HeaderRewriter.apply(Decision.compress(new ZstandardCompression(), false), headers);

        assertEquals("zstd", headers.get(HttpHeader.CONTENT_ENCODING));
        assertFalse(headers.contains(HttpHeader.CONTENT_LENGTH));
        assertFalse(headers.contains(HttpHeader.ACCEPT_RANGES));
        assertEquals("Accept-Encoding", headers.get(HttpHeader.VARY));
        assertEquals("text/html", headers.get(HttpHeader.CONTENT_TYPE));
        assertEquals("\"abc\"", headers.get(HttpHeader.ETAG));
    }

    @Test
    public void testSkipWithoutVaryLeavesHeadersUnchanged()
    {
        HttpFields.Mutable headers = HttpFields.build()
            .add(HttpHeader.CONTENT_LENGTH, "12")
            .add(HttpHeader.ACCEPT_RANGES, "bytes");

        HeaderRewriter.apply(Decision.skip(true, false), headers);

        assertEquals(2, headers.size());
        assertNull(headers.get(HttpHeader.VARY));
    }

    @Test
    public void testSkipWithVary()
    {
        HttpFields.Mutable headers = HttpFields.build().add(HttpHeader.CONTENT_LENGTH, "12");

        HeaderRewriter.apply(Decision.skip(false, true), headers);

        assertEquals("12", headers.get(HttpHeader.CONTENT_LENGTH));
        assertEquals("Accept-Encoding", headers.get(HttpHeader.VARY));
        assertNull(headers.get(HttpHeader.CONTENT_ENCODING));
    }

    @Test
    public void testVaryMergedWithExistingValues()
    {
        HttpFields.Mutable headers = HttpFields.build()
            .add(HttpHeader.VARY, "Origin")
            .add(HttpHeader.VARY, "Cookie, User-Agent");

        HeaderRewriter.varyAcceptEncoding(headers);

        List<String> values = headers.getValuesList(HttpHeader.VARY);
        assertThat(values, contains("Origin, Cookie, User-Agent, Accept-Encoding"));
    }

    @Test
    public void testVaryAlreadyListsAcceptEncoding()
    {
        HttpFields.Mutable headers = HttpFields.build()
            .add(HttpHeader.VARY, "Origin")
            .add(HttpHeader.VARY, "origin, accept-encoding");

        HeaderRewriter.varyAcceptEncoding(headers);

        assertThat(headers.getValuesList(HttpHeader.VARY), contains("Origin", "origin, accept-encoding"));
    }

    @Test
    public void testVaryStar()
    {
        HttpFields.Mutable headers = HttpFields.build().add(HttpHeader.VARY, "*");

        HeaderRewriter.varyAcceptEncoding(headers);

        assertThat(headers.getValuesList(HttpHeader.VARY), contains("*"));
    }
}

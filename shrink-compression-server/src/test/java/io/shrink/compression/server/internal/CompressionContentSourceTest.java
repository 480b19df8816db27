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


package io.shrink.compression.server.internal;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.CancellationException;

import io.shrink.compression.Compression;
import io.shrink.compression.brotli.BrotliCompression;
import io.shrink.compression.gzip.GzipCompression;
import io.shrink.compression.server.CompressionConfig;
import io.shrink.compression.server.Decoders;
import io.shrink.compression.server.FailingCompression;
import io.shrink.compression.server.ResponseCompressor;
import io.shrink.compression.zstandard.ZstandardCompression;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.Trailers;
import org.eclipse.jetty.io.Content;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CompressionContentSourceTest
{
    private HttpFields.Mutable requestHeaders;
    private HttpFields.Mutable responseHeaders;
    private ResponseCompressor compressor;

    @BeforeEach
    public void prepare()
    {
        requestHeaders = HttpFields.build().put(HttpHeader.ACCEPT_ENCODING, "gzip");
        responseHeaders = HttpFields.build().put(HttpHeader.CONTENT_TYPE, "text/plain;charset=utf-8");
        compressor = newCompressor(new GzipCompression(), new BrotliCompression(), new ZstandardCompression());
    }

    private static ResponseCompressor newCompressor(Compression... compressions)
    {
        return new ResponseCompressor(CompressionConfig.builder().defaults().build(), List.of(compressions));
    }

    private CompressionContentSource compress(TestSource body)
    {
        return (CompressionContentSource)compressor.compress("GET", requestHeaders, 200, responseHeaders, body);
    }

    private static byte[] text(int length)
    {
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; ++i)
        {
            bytes[i] = (byte)('a' + i % 26);
        }
        return bytes;
    }

    private static Content.Chunk chunk(byte[] bytes, int offset, int length, boolean last)
    {
        return Content.Chunk.from(ByteBuffer.wrap(bytes, offset, length), last);
    }

    private static void append(ByteArrayOutputStream out, Content.Chunk chunk)
    {
        ByteBuffer buffer = chunk.getByteBuffer();
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        out.write(bytes, 0, bytes.length);
    }

    /**
     * Reads until the last chunk, returning all the chunks read except {@code null}s.
     */
    private static List<Content.Chunk> readAll(Content.Source source)
    {
        List<Content.Chunk> chunks = new ArrayList<>();
        int nulls = 0;
        while (true)
        {
            Content.Chunk chunk = source.read();
            if (chunk == null)
            {
                assertThat("no progress", ++nulls, lessThanOrEqualTo(1000));
                continue;
            }
            chunks.add(chunk);
            if (chunk.isLast())
                return chunks;
        }
    }

    private static byte[] bytesOf(List<Content.Chunk> chunks)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        chunks.forEach(chunk -> append(out, chunk));
        return out.toByteArray();
    }

    @Test
    public void testSmallBodyIsNotCompressed()
    {
        byte[] body = text(300);
        TestSource source = new TestSource()
            .add(chunk(body, 0, 100, false))
            .add(chunk(body, 100, 100, false))
            .add(chunk(body, 200, 100, false))
            .add(Content.Chunk.EOF);
        CompressionContentSource compressed = compress(source);

        List<Content.Chunk> chunks = readAll(compressed);

        assertThat(bytesOf(chunks), is(body));
        assertNull(responseHeaders.get(HttpHeader.CONTENT_ENCODING));
        assertEquals("Accept-Encoding", responseHeaders.get(HttpHeader.VARY));
        assertTrue(compressed.read().isLast());
    }

    @Test
    public void testLargeBodyIsCompressed() throws Exception
    {
        byte[] body = text(2000);
        TestSource source = new TestSource();
        for (int offset = 0; offset < body.length; offset += 100)
        {
            source.add(chunk(body, offset, 100, offset + 100 == body.length));
        }
        CompressionContentSource compressed = compress(source);

        byte[] bytes = bytesOf(readAll(compressed));

        assertThat(Decoders.decode("gzip", bytes), is(body));
        assertEquals("gzip", responseHeaders.get(HttpHeader.CONTENT_ENCODING));
        assertEquals("Accept-Encoding", responseHeaders.get(HttpHeader.VARY));
        assertEquals(CompressionState.Mode.FINISHED, compressed.getCompressionState().getMode());
    }

    @Test
    public void testKnownLengthHeadersAreRewritten() throws Exception
    {
        requestHeaders.put(HttpHeader.ACCEPT_ENCODING, "br");
        responseHeaders.put(HttpHeader.CONTENT_LENGTH, 4000L);
        responseHeaders.put(HttpHeader.ACCEPT_RANGES, "bytes");
        byte[] body = text(4000);
        TestSource source = new TestSource().add(chunk(body, 0, 4000, true));
        CompressionContentSource compressed = compress(source);

        // The decision is committed before the first read.
        assertEquals("br", responseHeaders.get(HttpHeader.CONTENT_ENCODING));
        assertFalse(responseHeaders.contains(HttpHeader.CONTENT_LENGTH));
        assertFalse(responseHeaders.contains(HttpHeader.ACCEPT_RANGES));
        assertEquals(-1, compressed.getLength());

        assertThat(Decoders.decode("br", bytesOf(readAll(compressed))), is(body));
    }

    @Test
    public void testBufferIsBounded() throws Exception
    {
        byte[] body = text(3000);
        TestSource source = new TestSource();
        for (int offset = 0; offset < body.length; offset += 70)
        {
            int length = Math.min(70, body.length - offset);
            source.add(chunk(body, offset, length, offset + length == body.length)).add(null);
        }
        CompressionContentSource compressed = compress(source);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        while (true)
        {
            Content.Chunk chunk = compressed.read();
            assertThat(compressed.getCompressionState().getBufferedBytes(), lessThanOrEqualTo(860));
            if (chunk == null)
                continue;
            append(out, chunk);
            if (chunk.isLast())
                break;
        }

        assertThat(Decoders.decode("gzip", out.toByteArray()), is(body));
    }

    @Test
    public void testEventStreamIsFlushedAfterCommit() throws Exception
    {
        responseHeaders.put(HttpHeader.CONTENT_TYPE, "text/event-stream");
        TestSource source = new TestSource();
        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        for (int i = 0; i < 30; ++i)
        {
            byte[] event = String.format("data: event %05d padding padding padding.......\n\n", i).getBytes(StandardCharsets.UTF_8);
            expected.write(event, 0, event.length);
            source.add(chunk(event, 0, event.length, false)).add(null);
        }
        source.add(Content.Chunk.EOF);
        CompressionContentSource compressed = compress(source);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < 30; ++i)
        {
            Content.Chunk chunk = compressed.read();
            if (i < 17)
            {
                assertNull(chunk);
                assertNull(compressed.getCompressionState().getCommittedDecision());
                assertNull(responseHeaders.get(HttpHeader.CONTENT_ENCODING));
            }
            else
            {
                assertNotNull(chunk);
                assertThat(chunk.remaining(), greaterThan(0));
                assertEquals("gzip", responseHeaders.get(HttpHeader.CONTENT_ENCODING));
                append(out, chunk);
                // Consume the null that follows the chunk.
                assertNull(compressed.read());
            }
        }
        readAll(compressed).forEach(chunk -> append(out, chunk));

        assertThat(Decoders.decode("gzip", out.toByteArray()), is(expected.toByteArray()));
    }

    @Test
    public void testTrailersFollowCompressedBody() throws Exception
    {
        byte[] body = text(2000);
        Trailers trailers = new Trailers(HttpFields.build().put("X-Checksum", "abc"));
        TestSource source = new TestSource()
            .add(chunk(body, 0, 2000, false))
            .add(trailers);
        CompressionContentSource compressed = compress(source);

        List<Content.Chunk> chunks = readAll(compressed);

        assertThat(chunks.get(chunks.size() - 1), sameInstance(trailers));
        assertEquals(1, chunks.stream().filter(Trailers.class::isInstance).count());
        for (Content.Chunk chunk : chunks.subList(0, chunks.size() - 1))
        {
            assertFalse(chunk.isLast());
        }
        assertThat(Decoders.decode("gzip", bytesOf(chunks.subList(0, chunks.size() - 1))), is(body));

        Content.Chunk after = compressed.read();
        assertTrue(after.isLast());
        assertThat(after, is(Content.Chunk.EOF));
    }

    @Test
    public void testPendingTrailersDoNotDemandUpstream()
    {
        byte[] body = text(100);
        Trailers trailers = new Trailers(HttpFields.build().put("X-Checksum", "abc"));
        TestSource source = new TestSource()
            .add(chunk(body, 0, 100, false))
            .add(trailers);
        CompressionContentSource compressed = compress(source);

        Content.Chunk data = compressed.read();
        assertFalse(data.isLast());
        assertThat(bytesOf(List.of(data)), is(body));

        boolean[] demanded = new boolean[1];
        compressed.demand(() -> demanded[0] = true);
        assertTrue(demanded[0]);
        assertEquals(0, source.getDemands());

        assertThat(compressed.read(), sameInstance(trailers));
        assertThat(compressed.read(), is(Content.Chunk.EOF));
    }

    @Test
    public void testUpstreamFailureReleasesState()
    {
        IOException failure = new IOException("upstream");
        byte[] body = text(3000);
        TestSource source = new TestSource()
            .add(chunk(body, 0, 3000, false))
            .add(Content.Chunk.from(failure));
        CompressionContentSource compressed = compress(source);

        List<Content.Chunk> chunks = readAll(compressed);

        Content.Chunk last = chunks.get(chunks.size() - 1);
        assertTrue(Content.Chunk.isFailure(last));
        assertThat(last.getFailure(), sameInstance(failure));
        CompressionState state = compressed.getCompressionState();
        assertEquals(CompressionState.Mode.FAILED, state.getMode());
        assertFalse(state.hasEncoder());
        assertThat(compressed.read().getFailure(), sameInstance(failure));
    }

    @Test
    public void testEncoderFailureFailsSource()
    {
        FailingCompression failing = new FailingCompression();
        compressor = newCompressor(failing);
        responseHeaders.put(HttpHeader.CONTENT_LENGTH, 5000L);
        TestSource source = new TestSource().add(chunk(text(5000), 0, 5000, true));
        CompressionContentSource compressed = compress(source);

        Content.Chunk chunk = compressed.read();

        assertTrue(Content.Chunk.isFailure(chunk));
        assertTrue(chunk.isLast());
        assertEquals("encoder failure", chunk.getFailure().getMessage());
        assertThat(source.getFailure(), sameInstance(chunk.getFailure()));
        assertEquals(1, failing.getAborted());
        assertEquals(CompressionState.Mode.FAILED, compressed.getCompressionState().getMode());
        assertThat(compressed.read(), sameInstance(chunk));
    }

    @Test
    public void testFailReleasesState()
    {
        byte[] body = text(4000);
        TestSource source = new TestSource()
            .add(chunk(body, 0, 2000, false))
            .add(null)
            .add(chunk(body, 2000, 2000, true));
        CompressionContentSource compressed = compress(source);

        Content.Chunk first = compressed.read();
        assertNotNull(first);
        assertTrue(compressed.getCompressionState().hasEncoder());

        CancellationException cancel = new CancellationException();
        compressed.fail(cancel);

        CompressionState state = compressed.getCompressionState();
        assertFalse(state.hasEncoder());
        assertEquals(CompressionState.Mode.FAILED, state.getMode());
        assertThat(source.getFailure(), sameInstance(cancel));
        Content.Chunk after = compressed.read();
        assertTrue(Content.Chunk.isFailure(after));
        assertThat(after.getFailure(), sameInstance(cancel));
    }

    @Test
    public void testExistingContentEncodingIsPassedThrough()
    {
        responseHeaders.put(HttpHeader.CONTENT_ENCODING, "br");
        responseHeaders.put(HttpHeader.CONTENT_LENGTH, 3000L);
        byte[] body = text(3000);
        Content.Chunk first = chunk(body, 0, 1500, false);
        Content.Chunk second = chunk(body, 1500, 1500, true);
        TestSource source = new TestSource().add(first).add(second).length(3000);
        CompressionContentSource compressed = compress(source);

        assertEquals(3000, compressed.getLength());
        assertThat(compressed.read(), sameInstance(first));
        assertThat(compressed.read(), sameInstance(second));
        // The length is unchanged once the body has finished.
        assertEquals(3000, compressed.getLength());
        assertEquals("br", responseHeaders.get(HttpHeader.CONTENT_ENCODING));
        assertEquals("3000", responseHeaders.get(HttpHeader.CONTENT_LENGTH));
        assertFalse(responseHeaders.contains(HttpHeader.VARY));
    }

    @Test
    public void testContentRangeIsPassedThrough()
    {
        responseHeaders.put(HttpHeader.CONTENT_RANGE, "bytes 0-1999/8000");
        byte[] body = text(2000);
        Content.Chunk only = chunk(body, 0, 2000, true);
        TestSource source = new TestSource().add(only);
        CompressionContentSource compressed = compress(source);

        assertThat(compressed.read(), sameInstance(only));
        assertTrue(compressed.read().isLast());
        assertNull(responseHeaders.get(HttpHeader.CONTENT_ENCODING));
    }

    @Test
    public void testEmptyPassthroughChunksAreSkipped()
    {
        responseHeaders.put(HttpHeader.CONTENT_TYPE, "image/png");
        byte[] body = text(10);
        Content.Chunk data = chunk(body, 0, 10, false);
        TestSource source = new TestSource()
            .add(Content.Chunk.from(ByteBuffer.allocate(0), false))
            .add(data)
            .add(Content.Chunk.EOF);
        CompressionContentSource compressed = compress(source);

        assertThat(compressed.read(), sameInstance(data));
        assertThat(compressed.read(), is(Content.Chunk.EOF));
    }

    @Test
    public void testShortSourceLengthIsPassedThrough()
    {
        TestSource source = new TestSource().add(null).length(500);
        CompressionContentSource compressed = compress(source);

        assertThat(compressed.read(), nullValue());
        assertEquals(CompressionState.Mode.PASSTHROUGH, compressed.getCompressionState().getMode());
        assertEquals(500, compressed.getLength());
        assertEquals("Accept-Encoding", responseHeaders.get(HttpHeader.VARY));
    }

    @Test
    public void testLengthWhileBufferingIsUnknown()
    {
        TestSource source = new TestSource().add(chunk(text(100), 0, 100, false)).add(null);
        CompressionContentSource compressed = compress(source);

        assertThat(compressed.read(), nullValue());
        assertEquals(CompressionState.Mode.BUFFERING, compressed.getCompressionState().getMode());
        assertEquals(-1, compressed.getLength());
    }

    @Test
    public void testLengthWhileCompressingIsUnknown()
    {
        TestSource source = new TestSource().add(null).length(5000);
        CompressionContentSource compressed = compress(source);

        assertThat(compressed.read(), nullValue());
        assertEquals(CompressionState.Mode.COMPRESSING, compressed.getCompressionState().getMode());
        assertEquals(-1, compressed.getLength());
    }

    @Test
    public void testNullChunkIsPropagated()
    {
        TestSource source = new TestSource().add(null).add(Content.Chunk.EOF);
        CompressionContentSource compressed = compress(source);

        assertNull(compressed.read());
        compressed.demand(() -> {});
        assertEquals(1, source.getDemands());
        assertThat(compressed.read(), instanceOf(Content.Chunk.class));
    }

    private static class TestSource implements Content.Source
    {
        private final LinkedList<Content.Chunk> chunks = new LinkedList<>();
        private long length = -1;
        private int demands;
        private Throwable failure;

        /**
         * @param chunk the next chunk, or {@code null} to make one read return {@code null}
         */
        TestSource add(Content.Chunk chunk)
        {
            chunks.add(chunk);
            return this;
        }

        TestSource length(long length)
        {
            this.length = length;
            return this;
        }

        int getDemands()
        {
            return demands;
        }

        Throwable getFailure()
        {
            return failure;
        }

        @Override
        public long getLength()
        {
            return length;
        }

        @Override
        public Content.Chunk read()
        {
            if (failure != null)
                return Content.Chunk.from(failure);
            return chunks.isEmpty() ? null : chunks.poll();
        }

        @Override
        public void demand(Runnable demandCallback)
        {
            ++demands;
            demandCallback.run();
        }

        @Override
        public void fail(Throwable failure)
        {
            this.failure = failure;
        }
    }
}

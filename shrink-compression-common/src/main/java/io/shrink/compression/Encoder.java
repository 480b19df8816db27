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
import java.nio.ByteBuffer;

/**
 * <p>A streaming compressor for a single response body.</p>
 * <p>The contract is push/flush/finish: bytes are pushed with {@link #encode(ByteBuffer)},
 * {@link #flush()} forces out everything that the algorithm can emit without ending the stream,
 * and {@link #finish()} ends the stream, emitting any footer or checksum.
 * Each method returns the bytes produced by that call, which may be an empty buffer
 * because the algorithm is free to retain input in its internal window.</p>
 * <p>Instances are not thread-safe and are owned by exactly one response.
 * {@link #release()} must be called on every exit path; it is idempotent.</p>
 */
public interface Encoder
{
    /**
     * <p>Pushes the remaining bytes of the given buffer into the compressor.</p>
     * <p>The input buffer is fully consumed when this method returns.</p>
     *
     * @param input the bytes to compress
     * @return the compressed bytes produced so far, possibly empty
     * @throws IOException if the compressor fails
     */
    ByteBuffer encode(ByteBuffer input) throws IOException;

    /**
     * @return all the output currently available, possibly empty
     * @throws IOException if the compressor fails
     */
    ByteBuffer flush() throws IOException;

    /**
     * <p>Ends the compressed stream.</p>
     * <p>After this method returns the encoder is released and cannot be used anymore.</p>
     *
     * @return the final bytes of the compressed stream
     * @throws IOException if the compressor fails
     */
    ByteBuffer finish() throws IOException;

    /**
     * @return whether {@link #finish()} or {@link #release()} has been called
     */
    boolean isReleased();

    /**
     * <p>Releases the resources held by this encoder, discarding any pending output.</p>
     */
    void release();
}

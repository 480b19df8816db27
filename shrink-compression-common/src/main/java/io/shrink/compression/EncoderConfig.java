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

/**
 * Tuning parameters common to all {@link Encoder} implementations.
 */
public interface EncoderConfig
{
    /**
     * @return the size of the buffers used by the encoder
     */
    int getBufferSize();

    void setBufferSize(int size);

    /**
     * @return the algorithm specific compression level
     */
    int getCompressionLevel();

    void setCompressionLevel(int level);
}

/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * In-memory images with lazy, cache backed file access.
 * <p>
 * {@link io.tileverse.imagebuf.ImageBuf} is the entry point. A buffer either owns its pixels, addresses memory
 * handed to it by the caller, or reads a file on demand through an {@link io.tileverse.imagebuf.cache.ImageCache}.
 * {@link io.tileverse.imagebuf.ImageBufContext} holds the state buffers share: the default cache and the
 * accounting of locally allocated memory.
 *
 * <h2>Key Classes</h2>
 * <ul>
 * <li>{@link io.tileverse.imagebuf.ImageBuf} - the image buffer</li>
 * <li>{@link io.tileverse.imagebuf.ImageBufContext} - shared cache, memory accounting and factories</li>
 * <li>{@link io.tileverse.imagebuf.TileCursor} - pixel lookups holding at most one cache tile</li>
 * <li>{@link io.tileverse.imagebuf.WrapMode} - how lookups outside the data window resolve</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 *
 * <h3>Reading pixels of a file</h3>
 * <pre>{@code
 * ImageBuf buf = ImageBuf.open("input.ibuf");
 * float[] pixel = new float[buf.nchannels()];
 * buf.getPixel(10, 20, pixel);
 * if (buf.hasError()) {
 *     System.err.println(buf.getError());
 * }
 * }</pre>
 *
 * <h3>Converting and writing</h3>
 * <pre>{@code
 * ImageBuf src = ImageBuf.open("input.ibuf");
 * ImageBuf half = src.copy(PixelType.HALF);
 * half.setWriteTiles(64, 64, 1);
 * half.write("output.ibuf");
 * }</pre>
 */
package io.tileverse.imagebuf;

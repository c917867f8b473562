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
package io.tileverse.imagebuf.raw;

import io.tileverse.imagebuf.spec.ImageSpec;
import io.tileverse.imagebuf.spi.AbstractImageFormatProvider;
import io.tileverse.imagebuf.spi.ImageInput;
import io.tileverse.imagebuf.spi.ImageOutput;
import java.io.IOException;
import java.nio.file.Path;

/**
 * {@link io.tileverse.imagebuf.spi.ImageFormatProvider} for the lossless {@code ibuf} container, files ending in
 * {@code .ibuf}.
 * <p>
 * The format has no options, a config spec passed to {@link #openInput(Path, ImageSpec)} is accepted and ignored.
 */
public class RawImageFormatProvider extends AbstractImageFormatProvider {

    public static final String ID = "ibuf";

    public RawImageFormatProvider() {
        super(ID, "Lossless raw container for any pixel type, subimages, miplevels and deep data", "ibuf");
    }

    @Override
    public ImageInput openInput(Path path, ImageSpec config) throws IOException {
        return new RawImageInput(path);
    }

    @Override
    public ImageOutput createOutput() {
        return new RawImageOutput();
    }
}

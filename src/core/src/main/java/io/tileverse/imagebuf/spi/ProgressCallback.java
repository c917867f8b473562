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
package io.tileverse.imagebuf.spi;

/**
 * Receives progress notifications from long running reads and writes.
 */
@FunctionalInterface
public interface ProgressCallback {

    /** A callback that ignores notifications and never aborts. */
    ProgressCallback NONE = portion -> false;

    /**
     * @param portionDone fraction of the work completed, from {@code 0} to {@code 1}
     * @return {@code true} to abort the operation
     */
    boolean progress(float portionDone);

    /** Null-safe invocation. */
    static boolean report(ProgressCallback callback, float portionDone) {
        return callback != null && callback.progress(portionDone);
    }
}

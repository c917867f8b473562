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
package io.tileverse.imagebuf;

import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Accumulated error messages of one buffer. Messages are separated by newlines; beyond {@link #MAX_CHARS} the
 * oldest text is dropped.
 */
@Slf4j
final class ErrorLog {

    static final int MAX_CHARS = 1 << 20;

    private final ReentrantLock lock = new ReentrantLock();
    private final StringBuilder text = new StringBuilder();

    void append(String message) {
        if (message == null || message.isEmpty()) {
            return;
        }
        log.debug("ImageBuf error: {}", message);
        lock.lock();
        try {
            if (text.length() > 0 && text.charAt(text.length() - 1) != '\n') {
                text.append('\n');
            }
            text.append(message);
            if (text.length() > MAX_CHARS) {
                text.delete(0, text.length() - MAX_CHARS);
            }
        } finally {
            lock.unlock();
        }
    }

    boolean hasError() {
        lock.lock();
        try {
            return text.length() > 0;
        } finally {
            lock.unlock();
        }
    }

    String get(boolean clear) {
        lock.lock();
        try {
            String message = text.toString();
            if (clear) {
                text.setLength(0);
            }
            return message;
        } finally {
            lock.unlock();
        }
    }
}

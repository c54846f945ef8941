/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.catalog.util;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/** Holds a lock for the extent of a try-with-resources block. */
public final class LockScope implements AutoCloseable {

    private final Lock lock;

    private LockScope(Lock lock) {
        this.lock = lock;
        lock.lock();
    }

    public static LockScope shared(ReadWriteLock rw) {
        return new LockScope(rw.readLock());
    }

    public static LockScope exclusive(ReadWriteLock rw) {
        return new LockScope(rw.writeLock());
    }

    @Override
    public void close() {
        lock.unlock();
    }
}

/*
 * Copyright 2024 TsvStore.
 *
 * This file is part of TsvStore.
 *
 * TsvStore is free software: you can redistribute it and/or modify
 * it under the terms of the Affero GNU General Public License as
 * published by the Free Software Foundation, either version 3 of
 * the License, or (at your option) any later version.
 *
 * TsvStore is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Affero GNU General Public License for more details.
 *
 * You should have received a copy of the Affero GNU General Public
 * License along with TsvStore.  If not, see
 * <https://www.gnu.org/licenses/>.
 */
package io.tsvstore.core.utils;

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * A fixed number of single-use slots, filled by producers in any order and
 * drained by one consumer in index order.
 * <p>
 * All the slots are guarded by one lock and one condition. A producer fills
 * slot i exactly once by {@link #put(int, Object)}; the consumer calls
 * {@link #take(int)} for i = 0, 1, ..., which blocks until slot i is filled,
 * then empties the slot and hands the value over. A producer that can not
 * produce its value calls {@link #fail(Throwable)}, which wakes up the
 * consumer so that it does not wait for a value that never comes.
 * </p>
 *
 * @param <V> the type of the values handed over
 */
@ThreadSafe
public class BlockingSlots<V>
{
    private final Object[] slots;
    private final boolean[] filled;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFilled = lock.newCondition();
    private Throwable failure = null;

    public BlockingSlots(int numSlots)
    {
        checkArgument(numSlots >= 0, "numSlots is negative");
        this.slots = new Object[numSlots];
        this.filled = new boolean[numSlots];
    }

    public int size()
    {
        return slots.length;
    }

    /**
     * Fill the slot and signal the consumer.
     * @param index the index of the slot
     * @param value the value, must not be null
     */
    public void put(int index, V value)
    {
        checkElementIndex(index, slots.length);
        requireNonNull(value, "value is null");
        lock.lock();
        try
        {
            checkState(!filled[index], "slot %s is filled more than once", index);
            slots[index] = value;
            filled[index] = true;
            slotFilled.signalAll();
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Record the failure of a producer. Only the first failure is kept, the
     * later ones are added to it as suppressed exceptions.
     * @param cause the failure of the producer
     */
    public void fail(Throwable cause)
    {
        requireNonNull(cause, "cause is null");
        lock.lock();
        try
        {
            if (failure == null)
            {
                failure = cause;
            }
            else if (failure != cause)
            {
                failure.addSuppressed(cause);
            }
            slotFilled.signalAll();
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Wait until the slot is filled, then take the value out of it.
     * @param index the index of the slot
     * @return the value put into the slot
     * @throws SlotFailedException if a producer failed before the slot is taken
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    @SuppressWarnings("unchecked")
    public V take(int index) throws SlotFailedException, InterruptedException
    {
        checkElementIndex(index, slots.length);
        lock.lock();
        try
        {
            while (failure == null && !filled[index])
            {
                slotFilled.await();
            }
            if (failure != null)
            {
                throw new SlotFailedException(failure);
            }
            V value = (V) slots[index];
            checkState(value != null, "slot %s is taken more than once", index);
            // the slot is not reused, filled[index] stays true
            slots[index] = null;
            return value;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * @return true if a producer has failed
     */
    public boolean isFailed()
    {
        lock.lock();
        try
        {
            return failure != null;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Thrown from {@link #take(int)} when a producer has failed,
     * the cause is the failure of the producer.
     */
    public static class SlotFailedException extends Exception
    {
        private static final long serialVersionUID = 3519860412785604631L;

        public SlotFailedException(Throwable cause)
        {
            super("a producer of the slots failed", cause);
        }
    }
}

package com.github.ylgrgyq.phsp;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A base class that simplifies implementing an iterator. Subclasses only implement {@link #makeNext()}
 * and call {@link #allDone()} when there are no more elements.
 *
 * @param <T> the type of element returned by this iterator
 */
abstract class AbstractIterator<T> implements Iterator<T> {
    private enum State {
        READY, NOT_READY, DONE, FAILED
    }

    private State state = State.NOT_READY;
    private T next;

    @Override
    public boolean hasNext() {
        switch (state) {
            case FAILED:
                throw new IllegalStateException("Iterator is in failed state");
            case DONE:
                return false;
            case READY:
                return true;
            default:
                return maybeComputeNext();
        }
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        state = State.NOT_READY;
        if (next == null) {
            throw new IllegalStateException("Expected item but none found.");
        }
        return next;
    }

    @Override
    public void remove() {
        throw new UnsupportedOperationException("Removal not supported");
    }

    protected abstract T makeNext();

    protected T allDone() {
        state = State.DONE;
        return null;
    }

    private boolean maybeComputeNext() {
        state = State.FAILED;
        next = makeNext();
        if (state == State.DONE) {
            return false;
        } else {
            state = State.READY;
            return true;
        }
    }
}

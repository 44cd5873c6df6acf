package com.hellblazer.arscene.scene;

import com.hellblazer.arscene.tracking.AnchorFuture;

/**
 * Anchor task the test completes by hand
 *
 * @author hal.hildebrand
 */
public class FakeFuture<R> implements AnchorFuture<R> {
    private int   cancelCount;
    private R     result;
    private State state = State.PENDING;

    @Override
    public boolean cancel() {
        cancelCount++;
        if (state != State.PENDING) {
            return false;
        }
        state = State.CANCELLED;
        return true;
    }

    public void complete(R result) {
        this.result = result;
        state = State.DONE;
    }

    public int getCancelCount() {
        return cancelCount;
    }

    @Override
    public R getResult() {
        return state == State.DONE ? result : null;
    }

    @Override
    public State getState() {
        return state;
    }
}
